package com.ecoimpact.indicators.pipeline;

import com.ecoimpact.indicators.calc.*;
import com.ecoimpact.indicators.config.IndicatorProps;
import com.ecoimpact.indicators.domain.Indicator;
import com.ecoimpact.indicators.exception.RunInProgressException;
import com.ecoimpact.indicators.exception.StoreUnavailableException;
import com.ecoimpact.indicators.export.ResultCsvExporter;
import com.ecoimpact.indicators.ingest.AreaSummaryReader;
import com.ecoimpact.indicators.ingest.CarbonPriceScheduleReader;
import com.ecoimpact.indicators.ingest.WetlandValueReader;
import com.ecoimpact.indicators.projection.CostProjector;
import com.ecoimpact.indicators.projection.DiscountedCost;
import com.ecoimpact.indicators.reference.ReferenceLoadResult;
import com.ecoimpact.indicators.reference.ReferenceTable;
import com.ecoimpact.indicators.reference.ReferenceTableLoader;
import com.ecoimpact.indicators.report.ReportAggregator;
import com.ecoimpact.indicators.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 모드 하나를 처음부터 끝까지 수행한다.
 *
 * 입력 검증 → 기준표 재적재 → 결과 테이블 clear → 계산 → 저장 → CSV/리포트 (탄소는 할인 시계열까지).
 * 같은 저장소에 두 실행이 겹치면 안 되므로 동시에 하나만 허용한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndicatorPipeline {

    private final IndicatorProps props;
    private final ReferenceTableLoader referenceLoader;
    private final AreaSummaryReader areaReader;
    private final WetlandValueReader wetlandReader;
    private final CarbonPriceScheduleReader priceReader;
    private final BiocapacityCalculator biocapacityCalculator;
    private final CarbonSequestrationCalculator carbonCalculator;
    private final WaterFiltrationCalculator waterCalculator;
    private final AestheticQualityCalculator aestheticCalculator;
    private final ResultStore resultStore;
    private final ReportAggregator reportAggregator;
    private final ResultCsvExporter exporter;
    private final CostProjector costProjector;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<String> lastJob = new AtomicReference<>("-");
    private final AtomicReference<Instant> lastStartedAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastFinishedAt = new AtomicReference<>();
    private final AtomicReference<String> lastOutcome = new AtomicReference<>("-");

    /**
     * @throws RunInProgressException 다른 실행이 진행 중일 때
     */
    public RunSummary run(RunMode mode) {
        if (mode == RunMode.NONE) {
            throw new IllegalArgumentException("mode 'none' has nothing to run");
        }
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException(lastJob.get());
        }
        lastJob.set(mode.getKey());
        lastStartedAt.set(Instant.now(clock));
        try {
            RunSummary summary = execute(mode);
            lastOutcome.set("ok");
            return summary;
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            StoreUnavailableException unavailable = StoreUnavailableException.from(e);
            lastOutcome.set("failed: " + unavailable.getClassification());
            throw unavailable;
        } catch (RuntimeException e) {
            lastOutcome.set("failed: " + e.getClass().getSimpleName());
            throw e;
        } finally {
            lastFinishedAt.set(Instant.now(clock));
            running.set(false);
        }
    }

    private RunSummary execute(RunMode mode) {
        log.info("[pipeline] start mode={} studyArea={}", mode.getKey(), props.getStudyArea());
        RunSummary summary = mode.indicator()
                .map(this::runIndicator)
                .orElseGet(() -> RunSummary.referenceOnly(reloadReference()));
        log.info("[pipeline] done mode={} persisted={}", mode.getKey(), summary.rowsPersisted());
        return summary;
    }

    private ReferenceLoadResult reloadReference() {
        return referenceLoader.load(Path.of(props.getInput().getReferenceCsv()), props.getOverrides());
    }

    private RunSummary runIndicator(Indicator indicator) {
        // 입력은 모두 먼저 읽는다: 컬럼이 빠졌으면 아무것도 바꾸기 전에 실패
        List<AreaRow> areas = areaReader.read(Path.of(props.getInput().getAreaWorkbook()));
        Map<String, Double> wetlandValues = indicator == Indicator.WATER_FILTRATION
                ? wetlandReader.read(Path.of(props.getInput().getWetlandValuesCsv()))
                : Map.of();
        NavigableMap<Integer, Double> schedule = indicator == Indicator.CARBON_SEQUESTRATION
                ? priceReader.read(Path.of(props.getInput().getSccScheduleCsv()))
                : null;

        ReferenceLoadResult referenceLoad = reloadReference();
        ReferenceTable reference = referenceLoader.current();

        resultStore.clear(indicator);
        List<? extends IndicatorRow> rows = switch (indicator) {
            case BIOCAPACITY -> biocapacityCalculator.calculate(areas, reference);
            case CARBON_SEQUESTRATION -> carbonCalculator.calculate(areas, reference);
            case WATER_FILTRATION -> waterCalculator.calculate(areas, reference, wetlandValues);
            case AESTHETIC_QUALITY -> aestheticCalculator.calculate(areas, reference);
        };
        int persisted = resultStore.persist(indicator, rows);

        Path dir = Path.of(props.getOutputDir(), indicator.getKey());
        Path csv = dir.resolve(indicator.getKey() + "_results_" + props.getStudyArea() + ".csv");
        exporter.export(indicator, csv);

        String report = reportAggregator.render(indicator, props.getStudyArea());
        Path reportFile = dir.resolve(indicator.getKey() + "_report_" + fileSafe(props.getStudyArea()) + ".txt");
        writeText(reportFile, report);
        log.info("[pipeline] {} report\n{}", indicator.getKey(), report);

        Path seriesCsv = null;
        if (schedule != null) {
            IndicatorProps.Projection p = props.getProjection();
            List<DiscountedCost> series = costProjector.project(resultStore.totalSscMillions(), schedule,
                    p.getStartYear(), p.getEndYear(), p.getDiscountRate(), p.getReferencePrice());
            seriesCsv = dir.resolve("discounted_ssc_" + fileSafe(props.getStudyArea()) + ".csv");
            exporter.exportSeries(series, seriesCsv);
        }
        return new RunSummary(RunMode.of(indicator), referenceLoad, rows.size(), persisted, csv, reportFile, seriesCsv);
    }

    private static String fileSafe(String studyArea) {
        return studyArea.replace(' ', '_');
    }

    private static void writeText(Path file, String text) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report: " + file, e);
        }
    }

    // ===== 상태 조회 (admin ping) =====

    public boolean isRunning() { return running.get(); }

    public String getLastJob() { return lastJob.get(); }

    public Instant getLastStartedAt() { return lastStartedAt.get(); }

    public Instant getLastFinishedAt() { return lastFinishedAt.get(); }

    public String getLastOutcome() { return lastOutcome.get(); }
}
