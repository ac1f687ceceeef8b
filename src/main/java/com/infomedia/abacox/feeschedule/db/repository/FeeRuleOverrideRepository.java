package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.FeeRuleOverride;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;

public interface FeeRuleOverrideRepository extends JpaRepository<FeeRuleOverride, Long>, JpaSpecificationExecutor<FeeRuleOverride> {

    Optional<FeeRuleOverride> findByClassificationIdAndFeeRuleId(Long classificationId, Long feeRuleId);

    Optional<FeeRuleOverride> findByAircraftTypeIdAndFeeRuleId(Long aircraftTypeId, Long feeRuleId);

    List<FeeRuleOverride> findAllByFeeRuleId(Long feeRuleId);

    boolean existsByFeeRuleId(Long feeRuleId);

    boolean existsByClassificationId(Long classificationId);

    void deleteAllByAircraftTypeId(Long aircraftTypeId);
}
