package com.ecoimpact.indicators.projection;

/**
 * @param value 할인된 사회적 탄소비용 (백만 단위)
 */
public record DiscountedCost(int year, double value) {
}
