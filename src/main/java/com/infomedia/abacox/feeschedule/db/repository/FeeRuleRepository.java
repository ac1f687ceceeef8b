package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.FeeRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FeeRuleRepository extends JpaRepository<FeeRule, Long>, JpaSpecificationExecutor<FeeRule> {

    Optional<FeeRule> findByFeeCode(String feeCode);

    List<FeeRule> findAllByFeeCodeIn(Collection<String> feeCodes);

    boolean existsByFeeCode(String feeCode);

    boolean existsByAppliesToClassificationId(Long classificationId);
}
