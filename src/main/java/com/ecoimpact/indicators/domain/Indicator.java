package com.ecoimpact.indicators.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * 생태계 서비스 지표. 지표마다 결과 테이블을 하나씩 가진다.
 */
public enum Indicator {

    BIOCAPACITY("biocapacity", "biocapacity_results"),
    CARBON_SEQUESTRATION("carbon_sequestration", "carbon_sequestration_results"),
    WATER_FILTRATION("water_filtration", "water_filtration_results"),
    AESTHETIC_QUALITY("aesthetic_quality", "aesthetic_quality_results");

    private final String key;
    private final String tableName;

    Indicator(String key, String tableName) {
        this.key = key;
        this.tableName = tableName;
    }

    public String getKey() { return key; }

    public String getTableName() { return tableName; }

    /** "carbon", "water", "aesthetic" 같은 축약형도 허용 */
    public static Indicator fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("indicator is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(i -> i.key.equals(v) || i.key.startsWith(v + "_") || i.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown indicator: " + value));
    }
}
