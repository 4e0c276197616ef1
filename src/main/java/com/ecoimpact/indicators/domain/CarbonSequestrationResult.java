package com.ecoimpact.indicators.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "carbon_sequestration_results")
@Getter
@Setter
@NoArgsConstructor
public class CarbonSequestrationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "land_cover_code", nullable = false)
    private LandCoverClass landCoverClass;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "land_cover_code", insertable = false, updatable = false)
    private Integer landCoverCode;

    @Column(name = "class_name", nullable = false)
    private String className;

    @Column(name = "area_hectares", nullable = false, precision = 12, scale = 4)
    private BigDecimal areaHectares;

    @Column(name = "agc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal agc;

    @Column(name = "bgc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal bgc;

    @Column(name = "soc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal soc;

    @Column(name = "deoc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal deoc;

    @Column(name = "total_carbon_tc", nullable = false, precision = 12, scale = 4)
    private BigDecimal totalCarbonTc;

    /** 사회적 탄소비용 (백만 단위) */
    @Column(nullable = false, precision = 12, scale = 4)
    private BigDecimal ssc;

    /** 백만 단위 / ha */
    @Column(name = "ssc_density", nullable = false, precision = 12, scale = 6)
    private BigDecimal sscDensity;

    @Column(name = "percentage_of_total", nullable = false, precision = 5, scale = 2)
    private BigDecimal percentageOfTotal;

    public Integer getLandCoverCode() {
        if (landCoverCode != null) {
            return landCoverCode;
        }
        return landCoverClass != null ? landCoverClass.getCode() : null;
    }
}
