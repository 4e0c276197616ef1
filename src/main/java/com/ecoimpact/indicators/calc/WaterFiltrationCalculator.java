package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceEntry;
import com.ecoimpact.indicators.reference.ReferenceTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 코드 → 클래스명 (기준표) → ha 당 정화 가치 (습지 가치표) 두 단계 조인.
 * 가치표에 없는 클래스명은 조용히 0 으로 처리한다.
 */
@Component
@Slf4j
public class WaterFiltrationCalculator {

    public List<WaterFiltrationRow> calculate(List<AreaRow> areas,
                                              ReferenceTable reference,
                                              Map<String, Double> valuePerHaByClass) {
        List<AreaRow> aggregated = AreaAggregation.sumByCode(areas);

        List<WaterFiltrationRow> partial = new ArrayList<>(aggregated.size());
        double total = 0.0;

        for (AreaRow area : aggregated) {
            String className = reference.find(area.code()).map(ReferenceEntry::className).orElse(null);
            Double perHa = className == null ? null : valuePerHaByClass.get(className);
            if (perHa == null) {
                log.debug("[water] no filtration value for class '{}' (code {}), using 0", className, area.code());
                perHa = 0.0;
            }
            double totalValue = Rounding.round(area.areaHectares() * perHa, 4);
            total += totalValue;
            partial.add(new WaterFiltrationRow(area.code(), className, area.areaHectares(), perHa, totalValue, 0.0));
        }

        List<WaterFiltrationRow> rows = new ArrayList<>(partial.size());
        for (WaterFiltrationRow r : partial) {
            double percentage = total != 0.0 ? r.totalValue() / total * 100.0 : 0.0;
            rows.add(new WaterFiltrationRow(r.code(), r.className(), r.areaHectares(),
                    r.valuePerHa(), r.totalValue(), percentage));
        }
        log.info("[water] calculated rows={} totalValue={}", rows.size(), total);
        return rows;
    }
}
