package com.ecoimpact.indicators.repo;

import com.ecoimpact.indicators.domain.LandCoverClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface LandCoverClassRepository extends JpaRepository<LandCoverClass, Integer> {

    List<LandCoverClass> findAllByOrderByCodeAsc();

    @Query("select l.code from LandCoverClass l")
    List<Integer> findAllCodes();
}
