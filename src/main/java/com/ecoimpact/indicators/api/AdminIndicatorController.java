package com.ecoimpact.indicators.api;

import com.ecoimpact.indicators.config.IndicatorProps;
import com.ecoimpact.indicators.domain.Indicator;
import com.ecoimpact.indicators.pipeline.IndicatorPipeline;
import com.ecoimpact.indicators.pipeline.RunMode;
import com.ecoimpact.indicators.pipeline.RunSummary;
import com.ecoimpact.indicators.repo.LandCoverClassRepository;
import com.ecoimpact.indicators.store.ResultStore;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/indicators")
public class AdminIndicatorController {

    private final IndicatorPipeline pipeline;
    private final ResultStore resultStore;
    private final LandCoverClassRepository landCoverRepo;
    private final IndicatorProps props;

    public AdminIndicatorController(IndicatorPipeline pipeline,
                                    ResultStore resultStore,
                                    LandCoverClassRepository landCoverRepo,
                                    IndicatorProps props) {
        this.pipeline = pipeline;
        this.resultStore = resultStore;
        this.landCoverRepo = landCoverRepo;
        this.props = props;
    }

    /** 간단 헬스체크 */
    @GetMapping("/ping")
    public Map<String, Object> ping() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("running", pipeline.isRunning());
        body.put("lastJob", pipeline.getLastJob());
        body.put("lastStartedAt", pipeline.getLastStartedAt());
        body.put("lastFinishedAt", pipeline.getLastFinishedAt());
        body.put("lastOutcome", pipeline.getLastOutcome());
        body.put("studyArea", props.getStudyArea());
        body.put("modeOnStartup", props.getRun().getMode());
        return body;
    }

    /** 현재 DB 대략 통계 */
    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("landCoverClasses", landCoverRepo.count());
        resultStore.countAll().forEach((indicator, count) -> body.put(indicator.getKey(), count));
        return body;
    }

    /** 기준표만 다시 적재 (동기) */
    @PostMapping("/reload-reference")
    public Map<String, Object> reloadReference() {
        return summaryBody(pipeline.run(RunMode.REINDEX));
    }

    /** 지표 하나 즉시 실행 (동기) */
    @PostMapping("/{indicator}/run")
    public Map<String, Object> run(@PathVariable String indicator) {
        return summaryBody(pipeline.run(RunMode.of(Indicator.fromKey(indicator))));
    }

    private static Map<String, Object> summaryBody(RunSummary summary) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("mode", summary.mode().getKey());
        body.put("referenceRowsLoaded", summary.reference().rowsLoaded());
        body.put("referenceRowsDropped", summary.reference().rowsDropped());
        body.put("cascaded", summary.reference().cascaded());
        body.put("rowsCalculated", summary.rowsCalculated());
        body.put("rowsPersisted", summary.rowsPersisted());
        if (summary.resultsCsv() != null) body.put("resultsCsv", summary.resultsCsv().toString());
        if (summary.reportFile() != null) body.put("reportFile", summary.reportFile().toString());
        if (summary.seriesCsv() != null) body.put("seriesCsv", summary.seriesCsv().toString());
        return body;
    }
}
