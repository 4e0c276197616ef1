package com.ecoimpact.indicators.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "biocapacity_results")
@Getter
@Setter
@NoArgsConstructor
public class BiocapacityResult {

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

    @Column(name = "biocapacity_category", nullable = false)
    private String biocapacityCategory;

    @Column(name = "area_hectares", nullable = false, precision = 12, scale = 4)
    private BigDecimal areaHectares;

    @Column(name = "biocapacity_conversion_factor", nullable = false, precision = 4, scale = 2)
    private BigDecimal conversionFactor;

    @Column(name = "biocapacity_gha", nullable = false, precision = 12, scale = 4)
    private BigDecimal biocapacityGha;

    /** 전체 합계가 0 이면 정의되지 않으므로 null */
    @Column(name = "percentage_of_total", precision = 5, scale = 2)
    private BigDecimal percentageOfTotal;

    // JSON 직렬화용
    public Integer getLandCoverCode() {
        if (landCoverCode != null) {
            return landCoverCode;
        }
        return landCoverClass != null ? landCoverClass.getCode() : null;
    }
}
