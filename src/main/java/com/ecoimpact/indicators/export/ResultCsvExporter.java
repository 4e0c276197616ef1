package com.ecoimpact.indicators.export;

import com.ecoimpact.indicators.domain.*;
import com.ecoimpact.indicators.projection.DiscountedCost;
import com.ecoimpact.indicators.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 결과 테이블 → CSV. 컬럼은 클래스명, 코드, 지표 컬럼 순. 대표 지표 내림차순.
 * 숫자는 저장된 scale 그대로 (toPlainString) 써서 다시 읽어도 같은 값이 나온다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResultCsvExporter {

    private final ResultStore resultStore;

    public static List<String> columns(Indicator indicator) {
        return switch (indicator) {
            case BIOCAPACITY -> List.of("class_name", "land_cover_code", "biocapacity_category", "area_hectares",
                    "biocapacity_conversion_factor", "biocapacity_gha", "percentage_of_total");
            case CARBON_SEQUESTRATION -> List.of("class_name", "land_cover_code", "area_hectares",
                    "agc_tc_ha", "bgc_tc_ha", "soc_tc_ha", "deoc_tc_ha", "total_carbon_tc", "ssc", "ssc_density",
                    "percentage_of_total");
            case WATER_FILTRATION -> List.of("class_name", "land_cover_code", "area_hectares",
                    "wf_value_per_ha", "total_wf_value", "percentage_of_total");
            case AESTHETIC_QUALITY -> List.of("class_name", "land_cover_code", "area_hectares",
                    "naturalness_score", "rarity_score", "aesthetic_quality_score");
        };
    }

    /**
     * @return 기록한 행 수
     */
    public int export(Indicator indicator, Path output) {
        List<?> results = resultStore.findAll(indicator);
        List<List<Object>> records = new ArrayList<>(results.size());
        for (Object result : results) {
            records.add(toRecord(indicator, result));
        }
        write(output, columns(indicator), records);
        log.info("[export] results ({}) exported to CSV: {} ({} rows)", indicator.getKey(), output, records.size());
        return records.size();
    }

    public void exportSeries(List<DiscountedCost> series, Path output) {
        List<List<Object>> records = new ArrayList<>(series.size());
        for (DiscountedCost point : series) {
            records.add(List.of(point.year(), BigDecimal.valueOf(point.value()).toPlainString()));
        }
        write(output, List.of("year", "discounted_ssc_millions"), records);
        log.info("[export] discounted cost series exported to CSV: {} ({} years)", output, records.size());
    }

    private static List<Object> toRecord(Indicator indicator, Object result) {
        return switch (indicator) {
            case BIOCAPACITY -> {
                BiocapacityResult r = (BiocapacityResult) result;
                yield values(r.getClassName(), r.getLandCoverCode(), r.getBiocapacityCategory(), r.getAreaHectares(),
                        r.getConversionFactor(), r.getBiocapacityGha(), r.getPercentageOfTotal());
            }
            case CARBON_SEQUESTRATION -> {
                CarbonSequestrationResult r = (CarbonSequestrationResult) result;
                yield values(r.getClassName(), r.getLandCoverCode(), r.getAreaHectares(),
                        r.getAgc(), r.getBgc(), r.getSoc(), r.getDeoc(), r.getTotalCarbonTc(), r.getSsc(),
                        r.getSscDensity(), r.getPercentageOfTotal());
            }
            case WATER_FILTRATION -> {
                WaterFiltrationResult r = (WaterFiltrationResult) result;
                yield values(r.getClassName(), r.getLandCoverCode(), r.getAreaHectares(),
                        r.getValuePerHa(), r.getTotalValue(), r.getPercentageOfTotal());
            }
            case AESTHETIC_QUALITY -> {
                AestheticQualityResult r = (AestheticQualityResult) result;
                yield values(r.getClassName(), r.getLandCoverCode(), r.getAreaHectares(),
                        r.getNaturalnessScore(), r.getRarityScore(), r.getAestheticQualityScore());
            }
        };
    }

    private static List<Object> values(Object... values) {
        List<Object> out = new ArrayList<>(values.length);
        for (Object v : values) {
            if (v instanceof BigDecimal d) {
                out.add(d.toPlainString());
            } else {
                out.add(v == null ? "" : v);
            }
        }
        return out;
    }

    private static void write(Path output, List<String> header, List<List<Object>> records) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                         .setHeader(header.toArray(String[]::new))
                         .build())) {
                for (List<Object> record : records) {
                    printer.printRecord(record);
                }
            }
        } catch (IOException e) {
            log.error("[export] cannot write CSV file {}", output, e);
            throw new UncheckedIOException("Failed to write CSV file: " + output, e);
        }
    }
}
