package com.ecoimpact.indicators.repo;

import com.ecoimpact.indicators.domain.WaterFiltrationResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WaterFiltrationResultRepository extends JpaRepository<WaterFiltrationResult, Long> {

    List<WaterFiltrationResult> findAllByOrderByTotalValueDesc();
}
