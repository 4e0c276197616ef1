package com.ecoimpact.indicators.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "aesthetic_quality_results")
@Getter
@Setter
@NoArgsConstructor
public class AestheticQualityResult {

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

    @Column(name = "naturalness_score", nullable = false, precision = 4, scale = 2)
    private BigDecimal naturalnessScore;

    /** 5=가장 희귀, 1=가장 흔함 */
    @Column(name = "rarity_score", nullable = false)
    private Integer rarityScore;

    @Column(name = "aesthetic_quality_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal aestheticQualityScore;

    public Integer getLandCoverCode() {
        if (landCoverCode != null) {
            return landCoverCode;
        }
        return landCoverClass != null ? landCoverClass.getCode() : null;
    }
}
