package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.AircraftClassification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface AircraftClassificationRepository extends JpaRepository<AircraftClassification, Long>, JpaSpecificationExecutor<AircraftClassification> {

    boolean existsByNameIgnoreCase(String name);
}
