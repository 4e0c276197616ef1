package com.ecoimpact.indicators.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "water_filtration_results")
@Getter
@Setter
@NoArgsConstructor
public class WaterFiltrationResult {

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

    @Column(name = "wf_value_per_ha", nullable = false, precision = 12, scale = 4)
    private BigDecimal valuePerHa;

    @Column(name = "total_wf_value", nullable = false, precision = 14, scale = 4)
    private BigDecimal totalValue;

    @Column(name = "percentage_of_total", nullable = false, precision = 5, scale = 2)
    private BigDecimal percentageOfTotal;

    public Integer getLandCoverCode() {
        if (landCoverCode != null) {
            return landCoverCode;
        }
        return landCoverClass != null ? landCoverClass.getCode() : null;
    }
}
