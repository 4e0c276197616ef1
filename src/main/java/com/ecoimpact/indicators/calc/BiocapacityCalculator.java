package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceEntry;
import com.ecoimpact.indicators.reference.ReferenceTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 생물생산능력 (gha) = 면적 (ha) × 환산계수 (gha/ha)
 *
 * 기준표에 없는 코드도 결과에 남기되 수치는 null 로 둔다 (경고 로그).
 * 비율은 정의된 값들의 합계 기준이며, 합계가 0 이면 모든 비율이 null.
 */
@Component
@Slf4j
public class BiocapacityCalculator {

    public List<BiocapacityRow> calculate(List<AreaRow> areas, ReferenceTable reference) {
        List<AreaRow> aggregated = AreaAggregation.sumByCode(areas);

        List<Integer> missingCodes = new ArrayList<>();
        List<BiocapacityRow> partial = new ArrayList<>(aggregated.size());
        double total = 0.0;

        for (AreaRow area : aggregated) {
            Optional<ReferenceEntry> entry = reference.find(area.code());
            if (entry.isEmpty()) {
                missingCodes.add(area.code());
                partial.add(new BiocapacityRow(area.code(), null, null, area.areaHectares(), null, null, null));
                continue;
            }
            ReferenceEntry e = entry.get();
            double biocapacity = area.areaHectares() * e.biocapacityFactor();
            total += biocapacity;
            partial.add(new BiocapacityRow(area.code(), e.className(), e.biocapacityCategory(),
                    area.areaHectares(), e.biocapacityFactor(), biocapacity, null));
        }

        if (!missingCodes.isEmpty()) {
            log.warn("[biocapacity] Missing lookup entries for land-cover codes: {}", missingCodes);
        }

        List<BiocapacityRow> rows = new ArrayList<>(partial.size());
        for (BiocapacityRow r : partial) {
            Double percentage = (r.biocapacityGha() == null || total == 0.0)
                    ? null
                    : r.biocapacityGha() / total * 100.0;
            rows.add(new BiocapacityRow(r.code(), r.className(), r.biocapacityCategory(), r.areaHectares(),
                    r.conversionFactor(), r.biocapacityGha(), percentage));
        }
        log.info("[biocapacity] calculated rows={} totalGha={}", rows.size(), total);
        return rows;
    }
}
