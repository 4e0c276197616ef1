package com.ecoimpact.indicators.reference;

/**
 * 기준표 한 행 (코드 → 계수)
 */
public record ReferenceEntry(
        int code,
        String className,
        String biocapacityCategory,
        double biocapacityFactor,
        String landUseCategory,
        double agc,
        double bgc,
        double soc,
        double deoc,
        double naturalness,
        String description
) {
}
