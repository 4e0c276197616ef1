package com.ecoimpact.indicators.calc;

/**
 * @param ssc 사회적 탄소비용 (통화 단위, 백만 환산 전)
 */
public record CarbonSequestrationRow(
        int code,
        String className,
        double areaHectares,
        Double agc,
        Double bgc,
        Double soc,
        Double deoc,
        double totalCarbonTc,
        double ssc,
        double percentageOfTotal
) implements IndicatorRow {

    /** 저장 단위: 백만, 소수 4자리 */
    public double sscMillions() {
        return Rounding.round(ssc / 1_000_000d, 4);
    }

    /**
     * 백만/ha, 소수 6자리. 면적이 0 이라 무한대/NaN 이 되면 0
     */
    public double sscDensity() {
        double density = sscMillions() / Rounding.round(areaHectares, 4);
        if (Double.isNaN(density) || Double.isInfinite(density)) {
            return 0.0;
        }
        return Rounding.round(density, 6);
    }
}
