package com.ecoimpact.indicators.repo;

import com.ecoimpact.indicators.domain.BiocapacityResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BiocapacityResultRepository extends JpaRepository<BiocapacityResult, Long> {

    /** CSV 내보내기 순서 */
    List<BiocapacityResult> findAllByOrderByBiocapacityGhaDesc();
}
