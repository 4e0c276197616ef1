package com.ecoimpact.indicators.projection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * 사회적 탄소비용 연도별 할인 시계열.
 *
 * scaling = 합계(백만) / 기준연도 가격, value(year) = scaling × price(year) / (1 + rate)^(year - start).
 * 일정표에 없는 연도는 그 이전 가장 가까운 연도의 가격을 쓴다 (보간/앞쪽 외삽 없음).
 */
@Component
@Slf4j
public class CostProjector {

    public List<DiscountedCost> project(double aggregateMillions,
                                        NavigableMap<Integer, Double> schedule,
                                        int startYear,
                                        int endYear,
                                        double discountRate,
                                        double referencePrice) {
        if (endYear < startYear) {
            throw new IllegalArgumentException("endYear " + endYear + " is before startYear " + startYear);
        }
        if (referencePrice == 0.0) {
            throw new IllegalArgumentException("reference price must not be zero");
        }
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalArgumentException("price schedule is empty");
        }

        double scaling = aggregateMillions / referencePrice;
        List<DiscountedCost> series = new ArrayList<>(endYear - startYear + 1);
        for (int year = startYear; year <= endYear; year++) {
            double price = priceFor(schedule, year);
            double discount = Math.pow(1.0 + discountRate, year - startYear);
            series.add(new DiscountedCost(year, scaling * price / discount));
        }
        log.info("[projection] projected {} years ({}-{}) at {}% from aggregate {} million",
                series.size(), startYear, endYear, discountRate * 100, aggregateMillions);
        return series;
    }

    static double priceFor(NavigableMap<Integer, Double> schedule, int year) {
        Map.Entry<Integer, Double> entry = schedule.floorEntry(year);
        if (entry == null) {
            throw new IllegalArgumentException("No price at or before year " + year
                    + " (schedule starts at " + schedule.firstKey() + ")");
        }
        return entry.getValue();
    }
}
