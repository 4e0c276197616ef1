package com.ecoimpact.indicators.boot;

import com.ecoimpact.indicators.config.IndicatorProps;
import com.ecoimpact.indicators.exception.StoreUnavailableException;
import com.ecoimpact.indicators.pipeline.IndicatorPipeline;
import com.ecoimpact.indicators.pipeline.RunMode;
import com.ecoimpact.indicators.pipeline.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 기동 시 ecoservices.run.mode 에 지정된 모드를 한 번 실행한다.
 * 실패하면 원인을 로그로 남기고 그대로 던져서 프로세스가 0 이 아닌 코드로 끝나게 한다.
 */
@Component
@Order(100)
public class IndicatorRunRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRunRunner.class);

    private final IndicatorProps props;
    private final IndicatorPipeline pipeline;
    private final ApplicationContext context;

    public IndicatorRunRunner(IndicatorProps props, IndicatorPipeline pipeline, ApplicationContext context) {
        this.props = props;
        this.pipeline = pipeline;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunMode mode = RunMode.fromKey(props.getRun().getMode());
        if (mode == RunMode.NONE) {
            log.info("[run] 앱 기동 - 실행 모드 없음(mode=none). 스킵합니다.");
            return;
        }

        log.info("[run] 앱 기동 - {} 실행 시작 (studyArea={})", mode.getKey(), props.getStudyArea());
        try {
            RunSummary summary = pipeline.run(mode);
            log.info("[run] 앱 기동 - {} 실행 완료 (calculated={}, persisted={}, csv={})",
                    mode.getKey(), summary.rowsCalculated(), summary.rowsPersisted(), summary.resultsCsv());
        } catch (StoreUnavailableException e) {
            log.error("[run] 저장소 연결 실패 ({}): {}", e.getClassification(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[run] {} 실행 실패: {}", mode.getKey(), e.getMessage(), e);
            throw e;
        }

        if (props.getRun().isExitOnCompletion()) {
            log.info("[run] exit-on-completion=true, 종료합니다.");
            System.exit(SpringApplication.exit(context, () -> 0));
        }
    }
}
