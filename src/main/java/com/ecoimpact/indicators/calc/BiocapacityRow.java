package com.ecoimpact.indicators.calc;

/**
 * 기준표에 없는 코드는 계수/생물생산능력/비율이 모두 null (정의되지 않음)
 */
public record BiocapacityRow(
        int code,
        String className,
        String biocapacityCategory,
        double areaHectares,
        Double conversionFactor,
        Double biocapacityGha,
        Double percentageOfTotal
) implements IndicatorRow {
}
