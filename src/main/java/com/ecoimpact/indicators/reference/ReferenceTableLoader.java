package com.ecoimpact.indicators.reference;

import com.ecoimpact.indicators.domain.LandCoverClass;
import com.ecoimpact.indicators.exception.ReferentialIntegrityException;
import com.ecoimpact.indicators.exception.SchemaException;
import com.ecoimpact.indicators.ingest.CellValues;
import com.ecoimpact.indicators.ingest.TabularData;
import com.ecoimpact.indicators.ingest.TabularFileReader;
import com.ecoimpact.indicators.repo.LandCoverClassRepository;
import com.ecoimpact.indicators.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.*;

/**
 * 토지피복 기준표 적재.
 *
 * 1) 필수 컬럼 검증 → 2) 코드별 덮어쓰기 → 3) null 이 있는 행 제거 → 4) 기준표 통째로 교체.
 * 교체 시 결과 테이블이 기준표를 참조하고 있어 삭제가 막히면, 결과 테이블을 모두 비우고 딱 한 번 재시도한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceTableLoader {

    private static final String LOOKUP_TABLE = "land_cover_lookup";

    private final TabularFileReader fileReader;
    private final LandCoverClassRepository repository;
    private final ResultStore resultStore;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public ReferenceLoadResult load(Path csvPath, Map<Integer, Map<String, String>> overrides) {
        return load(fileReader.read(csvPath), overrides);
    }

    public ReferenceLoadResult load(TabularData source, Map<Integer, Map<String, String>> overrides) {
        log.info("[reference] loaded source with {} records: {}", source.size(), source.source());
        Prepared prepared = prepare(source, overrides);
        boolean cascaded = replace(prepared.entries());

        ReferenceLoadResult result = new ReferenceLoadResult(
                source.size(), prepared.entries().size(), prepared.dropped(), prepared.overridesApplied(), cascaded);
        log.info("[reference] loaded {} land-cover classes into lookup table (dropped={}, overrides={}, cascaded={})",
                result.rowsLoaded(), result.rowsDropped(), result.overridesApplied(), result.cascaded());
        return result;
    }

    /** 현재 DB 기준표 스냅샷 */
    @Transactional(readOnly = true)
    public ReferenceTable current() {
        return ReferenceTable.of(repository.findAllByOrderByCodeAsc().stream()
                .map(ReferenceTableLoader::toEntry)
                .toList());
    }

    // ===== 검증 / 덮어쓰기 / null 필터 (DB 접근 없음) =====

    record Prepared(List<ReferenceEntry> entries, int dropped, int overridesApplied) {
    }

    Prepared prepare(TabularData source, Map<Integer, Map<String, String>> overrides) {
        Map<ReferenceColumn, String> headers = ReferenceColumn.resolve(source);
        Map<Integer, Map<ReferenceColumn, String>> patches = resolveOverrides(overrides);

        List<Map<ReferenceColumn, String>> rows = new ArrayList<>(source.size());
        int overridesApplied = 0;
        for (Map<String, String> raw : source.rows()) {
            Map<ReferenceColumn, String> row = new EnumMap<>(ReferenceColumn.class);
            headers.forEach((column, header) -> row.put(column, raw.get(header)));

            String code = row.get(ReferenceColumn.CODE);
            if (code != null) {
                Map<ReferenceColumn, String> patch = patches.get(CellValues.parseCode(source.source(), "code", code));
                if (patch != null) {
                    row.putAll(patch);
                    overridesApplied += patch.size();
                    log.info("[reference] applied custom values {} for land-cover code {}", patch.keySet(), code);
                }
            }
            rows.add(row);
        }

        // null 이 하나라도 있는 행은 통째로 버린다 (건수만 보고)
        List<ReferenceEntry> entries = new ArrayList<>(rows.size());
        Set<Integer> seen = new HashSet<>();
        int dropped = 0;
        for (Map<ReferenceColumn, String> row : rows) {
            if (row.values().stream().anyMatch(Objects::isNull) || row.size() < ReferenceColumn.values().length) {
                dropped++;
                continue;
            }
            ReferenceEntry entry = toEntry(source.source(), row);
            if (!seen.add(entry.code())) {
                throw new SchemaException(source.source() + ": duplicate land-cover code " + entry.code());
            }
            entries.add(entry);
        }
        if (dropped > 0) {
            log.info("[reference] dropped {} rows with missing values", dropped);
        }
        return new Prepared(entries, dropped, overridesApplied);
    }

    private Map<Integer, Map<ReferenceColumn, String>> resolveOverrides(Map<Integer, Map<String, String>> overrides) {
        Map<Integer, Map<ReferenceColumn, String>> patches = new HashMap<>();
        if (overrides == null) return patches;

        overrides.forEach((code, fields) -> {
            Map<ReferenceColumn, String> patch = new EnumMap<>(ReferenceColumn.class);
            fields.forEach((field, value) -> {
                ReferenceColumn column = ReferenceColumn.fromName(field)
                        .orElseThrow(() -> new SchemaException("Unknown override field '" + field + "' for code " + code));
                if (column == ReferenceColumn.CODE) {
                    throw new SchemaException("The land-cover code itself cannot be overridden (code " + code + ")");
                }
                patch.put(column, value);
            });
            patches.put(code, patch);
        });
        return patches;
    }

    private static ReferenceEntry toEntry(String source, Map<ReferenceColumn, String> row) {
        return new ReferenceEntry(
                CellValues.parseCode(source, "code", row.get(ReferenceColumn.CODE)),
                row.get(ReferenceColumn.CLASS),
                row.get(ReferenceColumn.BIOCAPACITY_CATEGORY),
                number(source, row, ReferenceColumn.BIOCAPACITY_FACTOR),
                row.get(ReferenceColumn.LAND_USE_CATEGORY),
                number(source, row, ReferenceColumn.AGC),
                number(source, row, ReferenceColumn.BGC),
                number(source, row, ReferenceColumn.SOC),
                number(source, row, ReferenceColumn.DEOC),
                number(source, row, ReferenceColumn.NATURALNESS),
                row.get(ReferenceColumn.DESCRIPTION));
    }

    private static double number(String source, Map<ReferenceColumn, String> row, ReferenceColumn column) {
        return CellValues.parseDouble(source, column.getHeader(), row.get(column));
    }

    // ===== 교체 =====

    /**
     * 기준표 교체. (삭제 + 삽입) 을 한 트랜잭션으로 시도하고, FK 때문에 삭제가 막히면
     * 그 트랜잭션은 롤백된다. 그 다음 (결과 테이블 전부 삭제 + 삭제 + 삽입) 을 한 트랜잭션으로 한 번만 재시도.
     *
     * @return 결과 테이블을 먼저 비웠으면 true
     */
    boolean replace(List<ReferenceEntry> entries) {
        try {
            tx.executeWithoutResult(status -> {
                clearLookup();
                insert(entries);
            });
            return false;
        } catch (ReferentialIntegrityException e) {
            log.info("[reference] clearing dependent tables first due to foreign key constraints...");
        }

        tx.executeWithoutResult(status -> {
            resultStore.clearAllDependents();
            clearLookup();
            insert(entries);
        });
        return true;
    }

    private void clearLookup() {
        try {
            int deleted = jdbc.update("DELETE FROM " + LOOKUP_TABLE);
            log.info("[reference] cleared existing data from {} ({} rows)", LOOKUP_TABLE, deleted);
        } catch (DataIntegrityViolationException e) {
            throw new ReferentialIntegrityException("lookup table is still referenced by result rows", e);
        }
    }

    private void insert(List<ReferenceEntry> entries) {
        List<LandCoverClass> entities = entries.stream().map(ReferenceTableLoader::toEntity).toList();
        repository.saveAll(entities);
        repository.flush();
    }

    private static LandCoverClass toEntity(ReferenceEntry e) {
        LandCoverClass c = new LandCoverClass();
        c.setCode(e.code());
        c.setClassName(e.className());
        c.setBiocapacityCategory(e.biocapacityCategory());
        c.setBiocapacityConversionFactor(BigDecimal.valueOf(e.biocapacityFactor()));
        c.setLandUseCategory(e.landUseCategory());
        c.setAgc(BigDecimal.valueOf(e.agc()));
        c.setBgc(BigDecimal.valueOf(e.bgc()));
        c.setSoc(BigDecimal.valueOf(e.soc()));
        c.setDeoc(BigDecimal.valueOf(e.deoc()));
        c.setNaturalness(BigDecimal.valueOf(e.naturalness()));
        c.setDescription(e.description());
        return c;
    }

    private static ReferenceEntry toEntry(LandCoverClass c) {
        return new ReferenceEntry(
                c.getCode(),
                c.getClassName(),
                c.getBiocapacityCategory(),
                c.getBiocapacityConversionFactor().doubleValue(),
                c.getLandUseCategory(),
                c.getAgc().doubleValue(),
                c.getBgc().doubleValue(),
                c.getSoc().doubleValue(),
                c.getDeoc().doubleValue(),
                c.getNaturalness().doubleValue(),
                c.getDescription());
    }
}
