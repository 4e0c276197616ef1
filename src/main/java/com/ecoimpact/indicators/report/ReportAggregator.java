package com.ecoimpact.indicators.report;

import com.ecoimpact.indicators.domain.*;
import com.ecoimpact.indicators.repo.AestheticQualityResultRepository;
import com.ecoimpact.indicators.repo.BiocapacityResultRepository;
import com.ecoimpact.indicators.repo.CarbonSequestrationResultRepository;
import com.ecoimpact.indicators.repo.WaterFiltrationResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * 저장된 결과를 다시 읽어 클래스별로 묶고 텍스트 리포트를 만든다.
 * 클래스 단위 비율은 여기서 다시 계산한다 (행 단위 비율과 다름). 결과가 비어 있으면 비율은 0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportAggregator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(60);

    private final BiocapacityResultRepository biocapacityRepo;
    private final CarbonSequestrationResultRepository carbonRepo;
    private final WaterFiltrationResultRepository waterRepo;
    private final AestheticQualityResultRepository aestheticRepo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public String render(Indicator indicator, String studyArea) {
        String report = switch (indicator) {
            case BIOCAPACITY -> biocapacity(studyArea);
            case CARBON_SEQUESTRATION -> carbon(studyArea);
            case WATER_FILTRATION -> water(studyArea);
            case AESTHETIC_QUALITY -> aesthetic(studyArea);
        };
        log.debug("[report] rendered {} report for {}", indicator.getKey(), studyArea);
        return report;
    }

    /** 클래스별 집계만 필요할 때 (API 응답용) */
    @Transactional(readOnly = true)
    public List<ClassSummary> summarize(Indicator indicator) {
        return switch (indicator) {
            case BIOCAPACITY -> summarize(biocapacityRepo.findAll(),
                    BiocapacityResult::getClassName, BiocapacityResult::getAreaHectares, decimal(BiocapacityResult::getBiocapacityGha), true);
            case CARBON_SEQUESTRATION -> summarize(carbonRepo.findAll(),
                    CarbonSequestrationResult::getClassName, CarbonSequestrationResult::getAreaHectares,
                    decimal(CarbonSequestrationResult::getTotalCarbonTc), true);
            case WATER_FILTRATION -> summarize(waterRepo.findAll(),
                    WaterFiltrationResult::getClassName, WaterFiltrationResult::getAreaHectares,
                    decimal(WaterFiltrationResult::getTotalValue), true);
            case AESTHETIC_QUALITY -> summarize(aestheticRepo.findAll(),
                    AestheticQualityResult::getClassName, AestheticQualityResult::getAreaHectares,
                    (AestheticQualityResult r) -> num(r.getAestheticQualityScore()) * num(r.getAreaHectares()), false).stream()
                    .map(s -> new ClassSummary(s.className(), s.areaHectares(),
                            divide(s.metric(), s.areaHectares()), s.percentageOfArea(), 0.0))
                    .sorted(Comparator.comparingDouble(ClassSummary::metric).reversed()
                            .thenComparing(ClassSummary::className))
                    .toList();
        };
    }

    // ===== 지표별 리포트 =====

    private String biocapacity(String studyArea) {
        List<ClassSummary> classes = summarize(Indicator.BIOCAPACITY);
        double totalArea = sum(classes, ClassSummary::areaHectares);
        double totalGha = sum(classes, ClassSummary::metric);

        StringBuilder sb = header("BIOCAPACITY ANALYSIS REPORT", studyArea);
        for (ClassSummary c : classes) {
            sb.append(c.className()).append(":\n");
            line(sb, "  Area: %,.2f hectares (%.1f%% of total)", c.areaHectares(), c.percentageOfArea());
            line(sb, "  Biocapacity: %,.2f global hectares (%.1f%% of total)", c.metric(), c.percentageOfTotal());
            sb.append('\n');
        }
        totals(sb);
        line(sb, "Total Area: %,.2f hectares", totalArea);
        line(sb, "Total Biocapacity: %,.2f global hectares", totalGha);
        line(sb, "Biocapacity per Hectare: %.3f gha/ha", divide(totalGha, totalArea));
        return sb.toString();
    }

    private String carbon(String studyArea) {
        List<CarbonSequestrationResult> rows = carbonRepo.findAll();
        Map<String, List<CarbonSequestrationResult>> byClass = group(rows, CarbonSequestrationResult::getClassName);
        List<ClassSummary> classes = summarize(Indicator.CARBON_SEQUESTRATION);
        double totalArea = sum(classes, ClassSummary::areaHectares);
        double totalCarbon = sum(classes, ClassSummary::metric);
        double totalSsc = sumOf(rows, CarbonSequestrationResult::getSsc);

        StringBuilder sb = header("CARBON SEQUESTRATION ANALYSIS REPORT", studyArea);
        for (ClassSummary c : classes) {
            List<CarbonSequestrationResult> members = byClass.get(c.className());
            sb.append(c.className()).append(":\n");
            line(sb, "  Area: %,.2f hectares (%.1f%% of total)", c.areaHectares(), c.percentageOfArea());
            line(sb, "  Total Carbon: %,.2f tonnes C (%.1f%% of total)", c.metric(), c.percentageOfTotal());
            line(sb, "  Carbon Density: %.2f tC/ha", divide(c.metric(), c.areaHectares()));
            sb.append("  Breakdown per hectare:\n");
            line(sb, "    - AGC: %.2f tC/ha", average(members, CarbonSequestrationResult::getAgc));
            line(sb, "    - BGC: %.2f tC/ha", average(members, CarbonSequestrationResult::getBgc));
            line(sb, "    - SOC: %.2f tC/ha", average(members, CarbonSequestrationResult::getSoc));
            line(sb, "    - DeOC: %.2f tC/ha", average(members, CarbonSequestrationResult::getDeoc));
            // 밀도는 백만 단위로 저장되어 있으므로 통화 단위로 환산
            line(sb, "    - SSC: $%.2f per ha", 1_000_000d * sumOf(members, CarbonSequestrationResult::getSscDensity));
            line(sb, "  Total SSC: $%,.6f million", sumOf(members, CarbonSequestrationResult::getSsc));
            sb.append('\n');
        }
        totals(sb);
        line(sb, "Total Area: %,.2f hectares", totalArea);
        line(sb, "Total Carbon Sequestration: %,.2f tonnes C", totalCarbon);
        line(sb, "Average Carbon Density: %.2f tC/ha", divide(totalCarbon, totalArea));
        line(sb, "Total SSC: $%,.2f million", totalSsc);
        return sb.toString();
    }

    private String water(String studyArea) {
        List<WaterFiltrationResult> rows = waterRepo.findAll();
        Map<String, List<WaterFiltrationResult>> byClass = group(rows, WaterFiltrationResult::getClassName);
        List<ClassSummary> classes = summarize(Indicator.WATER_FILTRATION);
        double totalArea = sum(classes, ClassSummary::areaHectares);
        double totalValue = sum(classes, ClassSummary::metric);

        StringBuilder sb = header("WATER FILTRATION ANALYSIS REPORT", studyArea);
        for (ClassSummary c : classes) {
            sb.append(c.className()).append(":\n");
            line(sb, "  Area: %,.2f hectares (%.1f%% of total)", c.areaHectares(), c.percentageOfArea());
            line(sb, "  WF Value($)/ha: %,.2f", average(byClass.get(c.className()), WaterFiltrationResult::getValuePerHa));
            line(sb, "  Total WF Value($): %,.2f (%.1f%% of total)", c.metric(), c.percentageOfTotal());
            sb.append('\n');
        }
        totals(sb);
        line(sb, "Total Area: %,.2f hectares", totalArea);
        line(sb, "Total Water Filtration Value ($ millions): %,.6f", totalValue / 1_000_000d);
        return sb.toString();
    }

    private String aesthetic(String studyArea) {
        List<AestheticQualityResult> rows = aestheticRepo.findAll();
        Map<String, List<AestheticQualityResult>> byClass = group(rows, AestheticQualityResult::getClassName);
        List<ClassSummary> classes = summarize(Indicator.AESTHETIC_QUALITY);
        double totalArea = sum(classes, ClassSummary::areaHectares);
        double weightedScore = 0.0;
        for (ClassSummary c : classes) {
            weightedScore += c.metric() * c.areaHectares();
        }

        StringBuilder sb = header("AESTHETIC QUALITY ANALYSIS REPORT", studyArea);
        for (ClassSummary c : classes) {
            List<AestheticQualityResult> members = byClass.get(c.className());
            sb.append(c.className()).append(":\n");
            line(sb, "  Aesthetic Score: %.2f", c.metric());
            line(sb, "    - Area: %,.2f hectares (%.1f%% of total)", c.areaHectares(), c.percentageOfArea());
            line(sb, "    - Naturalness Score: %.2f", weightedAverage(members,
                    AestheticQualityResult::getNaturalnessScore, AestheticQualityResult::getAreaHectares));
            line(sb, "    - Rarity Score: %d (5=rarest, 1=most common)", members.stream()
                    .mapToInt(AestheticQualityResult::getRarityScore).max().orElse(0));
            sb.append('\n');
        }
        totals(sb);
        line(sb, "Total Area: %,.2f hectares", totalArea);
        line(sb, "Area-Weighted Average Aesthetic Score: %.2f", divide(weightedScore, totalArea));
        return sb.toString();
    }

    // ===== 집계 유틸 =====

    private static <T> ToDoubleFunction<T> decimal(Function<T, BigDecimal> field) {
        return r -> num(field.apply(r));
    }

    private static <T> List<ClassSummary> summarize(List<T> rows,
                                                    Function<T, String> className,
                                                    Function<T, BigDecimal> area,
                                                    ToDoubleFunction<T> metric,
                                                    boolean withShare) {
        Map<String, double[]> sums = new TreeMap<>();
        for (T row : rows) {
            double[] acc = sums.computeIfAbsent(className.apply(row), k -> new double[2]);
            acc[0] += num(area.apply(row));
            acc[1] += metric.applyAsDouble(row);
        }
        double totalArea = 0.0;
        double totalMetric = 0.0;
        for (double[] acc : sums.values()) {
            totalArea += acc[0];
            totalMetric += acc[1];
        }

        List<ClassSummary> result = new ArrayList<>(sums.size());
        for (Map.Entry<String, double[]> e : sums.entrySet()) {
            double a = e.getValue()[0];
            double m = e.getValue()[1];
            result.add(new ClassSummary(e.getKey(), a, m,
                    percentage(a, totalArea),
                    withShare ? percentage(m, totalMetric) : 0.0));
        }
        result.sort(Comparator.comparingDouble(ClassSummary::metric).reversed()
                .thenComparing(ClassSummary::className));
        return result;
    }

    private static <T> Map<String, List<T>> group(List<T> rows, Function<T, String> className) {
        Map<String, List<T>> groups = new HashMap<>();
        for (T row : rows) {
            groups.computeIfAbsent(className.apply(row), k -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    private static <T> double average(List<T> rows, Function<T, BigDecimal> field) {
        return rows.stream().mapToDouble(r -> num(field.apply(r))).average().orElse(0.0);
    }

    private static <T> double weightedAverage(List<T> rows, Function<T, BigDecimal> field, Function<T, BigDecimal> weight) {
        double weighted = 0.0;
        double weights = 0.0;
        for (T row : rows) {
            double w = num(weight.apply(row));
            weighted += num(field.apply(row)) * w;
            weights += w;
        }
        return weights > 0 ? weighted / weights : average(rows, field);
    }

    private static <T> double sumOf(List<T> rows, Function<T, BigDecimal> field) {
        return rows.stream().mapToDouble(r -> num(field.apply(r))).sum();
    }

    private static double sum(List<ClassSummary> classes, ToDoubleFunction<ClassSummary> field) {
        return classes.stream().mapToDouble(field).sum();
    }

    static double percentage(double part, double total) {
        return total != 0.0 ? part / total * 100.0 : 0.0;
    }

    private static double divide(double a, double b) {
        return b != 0.0 ? a / b : 0.0;
    }

    private static double num(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    // ===== 렌더링 =====

    private StringBuilder header(String title, String studyArea) {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        sb.append("Study Area: ").append(studyArea).append('\n');
        sb.append("Generated: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append('\n');
        sb.append('\n').append(RULE).append('\n');
        sb.append("SUMMARY BY LAND-COVER CLASS\n");
        sb.append(RULE).append("\n\n");
        return sb;
    }

    private static void totals(StringBuilder sb) {
        sb.append(RULE).append('\n').append("TOTALS\n").append(RULE).append('\n');
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.US, format, args)).append('\n');
    }
}
