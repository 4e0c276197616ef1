package com.ecoimpact.indicators.repo;

import com.ecoimpact.indicators.domain.CarbonSequestrationResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.util.List;

public interface CarbonSequestrationResultRepository extends JpaRepository<CarbonSequestrationResult, Long> {

    List<CarbonSequestrationResult> findAllByOrderByTotalCarbonTcDesc();

    /**
     * 전체 SSC 합계 (백만 단위). 결과가 없으면 null
     */
    @Query("select sum(c.ssc) from CarbonSequestrationResult c")
    BigDecimal sumSscMillions();
}
