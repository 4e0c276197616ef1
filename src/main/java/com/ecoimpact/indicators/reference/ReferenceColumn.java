package com.ecoimpact.indicators.reference;

import com.ecoimpact.indicators.exception.SchemaException;
import com.ecoimpact.indicators.ingest.TabularData;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 기준표 입력 컬럼. 예전 SOLRIS 헤더명(solris_code, lulc_category ...)도 별칭으로 받는다.
 */
public enum ReferenceColumn {

    CODE("code", "solris_code"),
    CLASS("class", "solris_class"),
    BIOCAPACITY_CATEGORY("biocapacity_category"),
    BIOCAPACITY_FACTOR("biocapacity_factor", "biocapacity_conversion_factor"),
    LAND_USE_CATEGORY("land_use_category", "lulc_category"),
    AGC("agc", "agc_tc_ha"),
    BGC("bgc", "bgc_tc_ha"),
    SOC("soc", "soc_tc_ha"),
    DEOC("deoc", "deoc_tc_ha"),
    NATURALNESS("naturalness"),
    DESCRIPTION("description");

    private final String header;
    private final String alias;

    ReferenceColumn(String header) {
        this(header, null);
    }

    ReferenceColumn(String header, String alias) {
        this.header = header;
        this.alias = alias;
    }

    public String getHeader() {
        return header;
    }

    public boolean matches(String name) {
        return header.equals(name) || (alias != null && alias.equals(name));
    }

    public static Optional<ReferenceColumn> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.matches(name)).findFirst();
    }

    /**
     * 원본 헤더 → 컬럼 매핑. 하나라도 없으면 SchemaException (변경 전에 실패)
     */
    public static Map<ReferenceColumn, String> resolve(TabularData data) {
        Map<ReferenceColumn, String> resolved = new EnumMap<>(ReferenceColumn.class);
        List<String> missing = new ArrayList<>();
        for (ReferenceColumn column : values()) {
            Optional<String> header = data.headers().stream().filter(column::matches).findFirst();
            if (header.isPresent()) {
                resolved.put(column, header.get());
            } else {
                missing.add(column.header);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(data.source(), missing);
        }
        return resolved;
    }
}
