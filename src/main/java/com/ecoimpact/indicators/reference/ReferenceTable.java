package com.ecoimpact.indicators.reference;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 메모리상의 기준표 스냅샷. 계산기는 이것만 보고 DB 는 보지 않는다.
 */
public final class ReferenceTable {

    private final Map<Integer, ReferenceEntry> byCode;

    private ReferenceTable(Map<Integer, ReferenceEntry> byCode) {
        this.byCode = Collections.unmodifiableMap(byCode);
    }

    public static ReferenceTable of(Collection<ReferenceEntry> entries) {
        Map<Integer, ReferenceEntry> map = new LinkedHashMap<>();
        for (ReferenceEntry e : entries) {
            if (map.putIfAbsent(e.code(), e) != null) {
                throw new IllegalArgumentException("duplicate land-cover code " + e.code());
            }
        }
        return new ReferenceTable(map);
    }

    public Optional<ReferenceEntry> find(int code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public boolean contains(int code) {
        return byCode.containsKey(code);
    }
}
