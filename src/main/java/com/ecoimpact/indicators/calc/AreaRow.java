package com.ecoimpact.indicators.calc;

/**
 * 토지피복 코드별 면적 (ha)
 */
public record AreaRow(int code, double areaHectares) {
}
