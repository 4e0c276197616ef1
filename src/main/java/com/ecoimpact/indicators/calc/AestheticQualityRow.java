package com.ecoimpact.indicators.calc;

/**
 * @param percentageOfArea 전체 면적 대비 비율 (희귀도 산정용, 저장하지 않음)
 */
public record AestheticQualityRow(
        int code,
        String className,
        double areaHectares,
        double naturalness,
        double percentageOfArea,
        int rarityScore,
        double aestheticScore
) implements IndicatorRow {
}
