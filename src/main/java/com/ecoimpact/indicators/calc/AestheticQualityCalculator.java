package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceEntry;
import com.ecoimpact.indicators.reference.ReferenceTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 경관 점수 = 자연성 × 0.67 + 희귀도 × 0.33
 *
 * 다른 계산기와 달리 기준표에 없는 코드는 결과에서 제외한다 (희귀도 분모에도 안 들어감).
 */
@Component
@Slf4j
public class AestheticQualityCalculator {

    public static final double NATURALNESS_WEIGHT = 0.67;
    public static final double RARITY_WEIGHT = 0.33;

    public List<AestheticQualityRow> calculate(List<AreaRow> areas, ReferenceTable reference) {
        List<AreaRow> matched = new ArrayList<>();
        List<Integer> dropped = new ArrayList<>();
        for (AreaRow area : AreaAggregation.sumByCode(areas)) {
            if (reference.contains(area.code())) {
                matched.add(area);
            } else {
                dropped.add(area.code());
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("[aesthetic] land-cover codes not in lookup, excluded: {}", dropped);
        }

        double totalArea = AreaAggregation.totalArea(matched);
        List<AestheticQualityRow> rows = new ArrayList<>(matched.size());
        for (AreaRow area : matched) {
            ReferenceEntry e = reference.find(area.code()).orElseThrow();
            double percentage = totalArea > 0 ? area.areaHectares() / totalArea * 100.0 : 0.0;
            int rarity = RarityScale.classify(percentage);
            rows.add(new AestheticQualityRow(area.code(), e.className(), area.areaHectares(),
                    e.naturalness(), percentage, rarity, score(e.naturalness(), rarity)));
        }
        log.info("[aesthetic] calculated rows={} totalArea={}", rows.size(), totalArea);
        return rows;
    }

    public static double score(double naturalness, int rarity) {
        return naturalness * NATURALNESS_WEIGHT + rarity * RARITY_WEIGHT;
    }
}
