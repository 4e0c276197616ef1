package com.ecoimpact.indicators.pipeline;

import com.ecoimpact.indicators.domain.Indicator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 실행 모드. 한 번 실행에 하나만 선택된다.
 * 지표 모드는 항상 기준표를 먼저 다시 적재한다.
 */
public enum RunMode {

    NONE("none", null),
    REINDEX("reindex", null),
    BIOCAPACITY("biocapacity", Indicator.BIOCAPACITY),
    CARBON_SEQUESTRATION("carbon_sequestration", Indicator.CARBON_SEQUESTRATION),
    WATER_FILTRATION("water_filtration", Indicator.WATER_FILTRATION),
    AESTHETIC_QUALITY("aesthetic_quality", Indicator.AESTHETIC_QUALITY);

    private final String key;
    private final Indicator indicator;

    RunMode(String key, Indicator indicator) {
        this.key = key;
        this.indicator = indicator;
    }

    public String getKey() { return key; }

    /** 지표 계산 모드가 아니면 empty */
    public Optional<Indicator> indicator() {
        return Optional.ofNullable(indicator);
    }

    public static RunMode of(Indicator indicator) {
        return switch (indicator) {
            case BIOCAPACITY -> BIOCAPACITY;
            case CARBON_SEQUESTRATION -> CARBON_SEQUESTRATION;
            case WATER_FILTRATION -> WATER_FILTRATION;
            case AESTHETIC_QUALITY -> AESTHETIC_QUALITY;
        };
    }

    /** "reindex", "none" 또는 지표 키/축약형 ("carbon", "water" ...) */
    public static RunMode fromKey(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(m -> m.key.equals(v))
                .findFirst()
                .orElseGet(() -> of(Indicator.fromKey(v)));
    }
}
