package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface AircraftTypeRepository extends JpaRepository<AircraftType, Long>, JpaSpecificationExecutor<AircraftType> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByClassificationId(Long classificationId);

    List<AircraftType> findAllByClassificationId(Long classificationId, Sort sort);
}
