package com.ecoimpact.indicators.store;

import com.ecoimpact.indicators.calc.AestheticQualityRow;
import com.ecoimpact.indicators.calc.BiocapacityRow;
import com.ecoimpact.indicators.calc.CarbonSequestrationRow;
import com.ecoimpact.indicators.calc.IndicatorRow;
import com.ecoimpact.indicators.calc.WaterFiltrationRow;
import com.ecoimpact.indicators.domain.*;
import com.ecoimpact.indicators.repo.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.util.*;
import java.util.function.Function;

import static com.ecoimpact.indicators.calc.Rounding.toScale;

/**
 * 지표별 결과 테이블 저장소.
 *
 * persist 는 append 만 한다. 교체 의미가 필요하면 호출하는 쪽이 먼저 clear 해야 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResultStore {

    private final JdbcTemplate jdbc;
    private final LandCoverClassRepository landCoverRepo;
    private final BiocapacityResultRepository biocapacityRepo;
    private final CarbonSequestrationResultRepository carbonRepo;
    private final WaterFiltrationResultRepository waterRepo;
    private final AestheticQualityResultRepository aestheticRepo;

    /**
     * 해당 지표의 결과를 전부 지운다. 테이블이 없으면 그대로 실패
     */
    @Transactional
    public int clear(Indicator indicator) {
        int deleted = jdbc.update("DELETE FROM " + indicator.getTableName());
        log.info("[store] cleared results table {} ({} rows)", indicator.getTableName(), deleted);
        return deleted;
    }

    /**
     * 기준표 교체를 위해 모든 결과 테이블을 비운다. 아직 없는 테이블은 건너뛴다.
     * 호출하는 쪽 트랜잭션에 참여한다. PostgreSQL 은 실패한 문장 하나로 트랜잭션 전체가
     * abort 되므로, 없는 테이블에는 DELETE 를 보내지 않고 메타데이터로 먼저 확인한다.
     */
    public void clearAllDependents() {
        Set<String> existing = existingTables();
        for (Indicator indicator : Indicator.values()) {
            String table = indicator.getTableName();
            if (!existing.contains(table.toLowerCase(Locale.ROOT))) {
                log.debug("[store] table {} does not exist yet, skipped", table);
                continue;
            }
            int deleted = jdbc.update("DELETE FROM " + table);
            log.debug("[store] cleared {} ({} rows)", table, deleted);
        }
        log.info("[store] cleared all results tables");
    }

    private Set<String> existingTables() {
        Set<String> tables = jdbc.execute((ConnectionCallback<Set<String>>) con -> {
            Set<String> names = new HashSet<>();
            try (ResultSet rs = con.getMetaData().getTables(null, null, "%", null)) {
                while (rs.next()) {
                    names.add(rs.getString("TABLE_NAME"));
                }
            }
            return names;
        });
        if (tables == null) {
            return Set.of();
        }
        Set<String> lower = new HashSet<>();
        for (String name : tables) {
            lower.add(name.toLowerCase(Locale.ROOT));
        }
        return lower;
    }

    /**
     * 결과 행 저장 (컬럼 선택 + 반올림 정책 적용).
     * FK 때문에 기준표에 없는 코드의 행은 저장하지 않고 경고만 남긴다.
     *
     * @return 저장된 행 수
     */
    @Transactional
    public int persist(Indicator indicator, List<? extends IndicatorRow> rows) {
        Set<Integer> knownCodes = new HashSet<>(landCoverRepo.findAllCodes());

        List<IndicatorRow> storable = new ArrayList<>(rows.size());
        List<Integer> skipped = new ArrayList<>();
        for (IndicatorRow row : rows) {
            if (row.matched() && knownCodes.contains(row.code())) {
                storable.add(row);
            } else {
                skipped.add(row.code());
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("[store] {} rows not persisted, no lookup entry for codes: {}", indicator.getKey(), skipped);
        }

        int saved = switch (indicator) {
            case BIOCAPACITY -> biocapacityRepo.saveAll(
                    project(storable, BiocapacityRow.class, this::toBiocapacity)).size();
            case CARBON_SEQUESTRATION -> carbonRepo.saveAll(
                    project(storable, CarbonSequestrationRow.class, this::toCarbon)).size();
            case WATER_FILTRATION -> waterRepo.saveAll(
                    project(storable, WaterFiltrationRow.class, this::toWater)).size();
            case AESTHETIC_QUALITY -> aestheticRepo.saveAll(
                    project(storable, AestheticQualityRow.class, this::toAesthetic)).size();
        };
        log.info("[store] {} results saved to database: {} rows", indicator.getKey(), saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public Map<Indicator, Long> countAll() {
        Map<Indicator, Long> counts = new EnumMap<>(Indicator.class);
        for (Indicator indicator : Indicator.values()) {
            long count = switch (indicator) {
                case BIOCAPACITY -> biocapacityRepo.count();
                case CARBON_SEQUESTRATION -> carbonRepo.count();
                case WATER_FILTRATION -> waterRepo.count();
                case AESTHETIC_QUALITY -> aestheticRepo.count();
            };
            counts.put(indicator, count);
        }
        return counts;
    }

    /**
     * 저장된 결과 행을 대표 지표 내림차순으로 읽는다
     */
    @Transactional(readOnly = true)
    public List<?> findAll(Indicator indicator) {
        return switch (indicator) {
            case BIOCAPACITY -> biocapacityRepo.findAllByOrderByBiocapacityGhaDesc();
            case CARBON_SEQUESTRATION -> carbonRepo.findAllByOrderByTotalCarbonTcDesc();
            case WATER_FILTRATION -> waterRepo.findAllByOrderByTotalValueDesc();
            case AESTHETIC_QUALITY -> aestheticRepo.findAllByOrderByAestheticQualityScoreDesc();
        };
    }

    /** 전체 SSC 합계 (백만 단위), 결과가 없으면 0 */
    @Transactional(readOnly = true)
    public double totalSscMillions() {
        BigDecimal sum = carbonRepo.sumSscMillions();
        return sum == null ? 0.0 : sum.doubleValue();
    }

    // ===== 행 → 엔티티 =====

    private <R extends IndicatorRow, E> List<E> project(List<IndicatorRow> rows, Class<R> type, Function<R, E> mapper) {
        List<E> entities = new ArrayList<>(rows.size());
        for (IndicatorRow row : rows) {
            if (!type.isInstance(row)) {
                throw new IllegalArgumentException("expected " + type.getSimpleName() + " but got " + row.getClass().getSimpleName());
            }
            entities.add(mapper.apply(type.cast(row)));
        }
        return entities;
    }

    private BiocapacityResult toBiocapacity(BiocapacityRow row) {
        BiocapacityResult r = new BiocapacityResult();
        r.setLandCoverClass(landCoverRepo.getReferenceById(row.code()));
        r.setClassName(row.className());
        r.setBiocapacityCategory(row.biocapacityCategory());
        r.setAreaHectares(toScale(row.areaHectares(), 4));
        r.setConversionFactor(toScale(row.conversionFactor(), 2));
        r.setBiocapacityGha(toScale(row.biocapacityGha(), 4));
        r.setPercentageOfTotal(toScale(row.percentageOfTotal(), 2));
        return r;
    }

    private CarbonSequestrationResult toCarbon(CarbonSequestrationRow row) {
        CarbonSequestrationResult r = new CarbonSequestrationResult();
        r.setLandCoverClass(landCoverRepo.getReferenceById(row.code()));
        r.setClassName(row.className());
        r.setAreaHectares(toScale(row.areaHectares(), 4));
        r.setAgc(toScale(row.agc(), 4));
        r.setBgc(toScale(row.bgc(), 4));
        r.setSoc(toScale(row.soc(), 4));
        r.setDeoc(toScale(row.deoc(), 4));
        r.setTotalCarbonTc(toScale(row.totalCarbonTc(), 4));
        r.setSsc(toScale(row.sscMillions(), 4));
        r.setSscDensity(toScale(row.sscDensity(), 6));
        r.setPercentageOfTotal(toScale(row.percentageOfTotal(), 2));
        return r;
    }

    private WaterFiltrationResult toWater(WaterFiltrationRow row) {
        WaterFiltrationResult r = new WaterFiltrationResult();
        r.setLandCoverClass(landCoverRepo.getReferenceById(row.code()));
        r.setClassName(row.className());
        r.setAreaHectares(toScale(row.areaHectares(), 4));
        r.setValuePerHa(toScale(row.valuePerHa(), 4));
        r.setTotalValue(toScale(row.totalValue(), 4));
        r.setPercentageOfTotal(toScale(row.percentageOfTotal(), 2));
        return r;
    }

    private AestheticQualityResult toAesthetic(AestheticQualityRow row) {
        AestheticQualityResult r = new AestheticQualityResult();
        r.setLandCoverClass(landCoverRepo.getReferenceById(row.code()));
        r.setClassName(row.className());
        r.setAreaHectares(toScale(row.areaHectares(), 4));
        r.setNaturalnessScore(toScale(row.naturalness(), 2));
        r.setRarityScore(row.rarityScore());
        r.setAestheticQualityScore(toScale(row.aestheticScore(), 2));
        return r;
    }
}
