package com.ecoimpact.indicators.repo;

import com.ecoimpact.indicators.domain.AestheticQualityResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AestheticQualityResultRepository extends JpaRepository<AestheticQualityResult, Long> {

    List<AestheticQualityResult> findAllByOrderByAestheticQualityScoreDesc();
}
