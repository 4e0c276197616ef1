package com.ecoimpact.indicators.pipeline;

import com.ecoimpact.indicators.reference.ReferenceLoadResult;

import java.nio.file.Path;

/**
 * 한 번 실행의 결과 요약. 기준표만 다시 적재한 경우 지표 관련 필드는 0/null.
 */
public record RunSummary(
        RunMode mode,
        ReferenceLoadResult reference,
        int rowsCalculated,
        int rowsPersisted,
        Path resultsCsv,
        Path reportFile,
        Path seriesCsv
) {

    static RunSummary referenceOnly(ReferenceLoadResult reference) {
        return new RunSummary(RunMode.REINDEX, reference, 0, 0, null, null, null);
    }
}
