package com.ecoimpact.indicators.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 습지 유형별 수질정화 가치 (wetland_type, value) → 클래스명 → ha 당 가치.
 * 클래스명으로 조인되므로 이름이 중복되면 첫 값만 쓴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WetlandValueReader {

    public static final String TYPE_COLUMN = "wetland_type";
    public static final String VALUE_COLUMN = "value";

    private final TabularFileReader fileReader;

    public Map<String, Double> read(Path path) {
        return read(fileReader.read(path));
    }

    public Map<String, Double> read(TabularData data) {
        data.requireColumns(List.of(TYPE_COLUMN, VALUE_COLUMN));

        Map<String, Double> valuePerHaByClass = new LinkedHashMap<>();
        for (var row : data.rows()) {
            String type = row.get(TYPE_COLUMN);
            String value = row.get(VALUE_COLUMN);
            if (type == null || value == null) continue;

            double perHa = CellValues.parseCurrency(data.source(), VALUE_COLUMN, value);
            Double previous = valuePerHaByClass.putIfAbsent(type, perHa);
            if (previous != null) {
                log.warn("[ingest] duplicate wetland type '{}' in {}, keeping {}", type, data.source(), previous);
            }
        }
        log.info("[ingest] wetland values loaded={}", valuePerHaByClass.size());
        return valuePerHaByClass;
    }
}
