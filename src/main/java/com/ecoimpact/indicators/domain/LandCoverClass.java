package com.ecoimpact.indicators.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * 토지피복 코드 기준표. 코드가 유일 키이며 네 결과 테이블이 모두 이 코드를 FK 로 참조한다.
 */
@Entity
@Table(name = "land_cover_lookup")
@Getter
@Setter
@NoArgsConstructor
public class LandCoverClass {

    @Id
    @Column(name = "land_cover_code")
    private Integer code;

    @Column(name = "class_name", nullable = false)
    private String className;

    @Column(name = "biocapacity_category", nullable = false)
    private String biocapacityCategory;

    @Column(name = "biocapacity_conversion_factor", nullable = false, precision = 4, scale = 2)
    private BigDecimal biocapacityConversionFactor;

    @Column(name = "lulc_category", nullable = false)
    private String landUseCategory;

    @Column(name = "agc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal agc;

    @Column(name = "bgc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal bgc;

    @Column(name = "soc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal soc;

    @Column(name = "deoc_tc_ha", nullable = false, precision = 8, scale = 4)
    private BigDecimal deoc;

    @Column(nullable = false, precision = 4, scale = 2)
    private BigDecimal naturalness;

    @Column(length = 2000)
    private String description;
}
