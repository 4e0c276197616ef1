package com.ecoimpact.indicators.calc;

public record WaterFiltrationRow(
        int code,
        String className,
        double areaHectares,
        double valuePerHa,
        double totalValue,
        double percentageOfTotal
) implements IndicatorRow {
}
