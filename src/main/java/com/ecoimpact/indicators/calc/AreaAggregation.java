package com.ecoimpact.indicators.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 같은 코드의 면적은 거부하지 않고 합산한다. 결과는 코드 오름차순.
 */
public final class AreaAggregation {

    private AreaAggregation() {
    }

    public static List<AreaRow> sumByCode(List<AreaRow> rows) {
        Map<Integer, Double> byCode = new TreeMap<>();
        for (AreaRow row : rows) {
            byCode.merge(row.code(), row.areaHectares(), Double::sum);
        }
        List<AreaRow> aggregated = new ArrayList<>(byCode.size());
        byCode.forEach((code, area) -> aggregated.add(new AreaRow(code, area)));
        return aggregated;
    }

    public static double totalArea(List<AreaRow> rows) {
        return rows.stream().mapToDouble(AreaRow::areaHectares).sum();
    }
}
