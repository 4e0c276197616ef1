package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceEntry;
import com.ecoimpact.indicators.reference.ReferenceTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 총 탄소 (tC) = (AGC + BGC + SOC + DeOC) × 면적, 없는 성분은 0 으로 본다.
 * SSC = 총 탄소 × 기준연도 단가 (252).
 *
 * 생물생산능력과 달리 전체 합계가 0 이면 비율은 0 (null 아님).
 */
@Component
@Slf4j
public class CarbonSequestrationCalculator {

    /** 2021 기준 탄소 1톤당 사회적 비용 */
    public static final double REFERENCE_YEAR_PRICE = 252.0;

    public List<CarbonSequestrationRow> calculate(List<AreaRow> areas, ReferenceTable reference) {
        List<AreaRow> aggregated = AreaAggregation.sumByCode(areas);

        List<Integer> missingCodes = new ArrayList<>();
        List<CarbonSequestrationRow> partial = new ArrayList<>(aggregated.size());
        double total = 0.0;

        for (AreaRow area : aggregated) {
            Optional<ReferenceEntry> entry = reference.find(area.code());
            if (entry.isEmpty()) {
                missingCodes.add(area.code());
            }
            Double agc = entry.map(ReferenceEntry::agc).orElse(null);
            Double bgc = entry.map(ReferenceEntry::bgc).orElse(null);
            Double soc = entry.map(ReferenceEntry::soc).orElse(null);
            Double deoc = entry.map(ReferenceEntry::deoc).orElse(null);

            double density = zeroIfNull(agc) + zeroIfNull(bgc) + zeroIfNull(soc) + zeroIfNull(deoc);
            double totalCarbon = density * area.areaHectares();
            total += totalCarbon;

            partial.add(new CarbonSequestrationRow(area.code(), entry.map(ReferenceEntry::className).orElse(null),
                    area.areaHectares(), agc, bgc, soc, deoc,
                    totalCarbon, totalCarbon * REFERENCE_YEAR_PRICE, 0.0));
        }

        if (!missingCodes.isEmpty()) {
            log.warn("[carbon] Missing lookup entries for land-cover codes: {}", missingCodes);
        }

        List<CarbonSequestrationRow> rows = new ArrayList<>(partial.size());
        for (CarbonSequestrationRow r : partial) {
            double percentage = total != 0.0 ? r.totalCarbonTc() / total * 100.0 : 0.0;
            rows.add(new CarbonSequestrationRow(r.code(), r.className(), r.areaHectares(),
                    r.agc(), r.bgc(), r.soc(), r.deoc(), r.totalCarbonTc(), r.ssc(), percentage));
        }
        log.info("[carbon] calculated rows={} totalCarbonTc={}", rows.size(), total);
        return rows;
    }

    private static double zeroIfNull(Double value) {
        return value == null ? 0.0 : value;
    }
}
