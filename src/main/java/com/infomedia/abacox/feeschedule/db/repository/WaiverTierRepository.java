package com.infomedia.abacox.feeschedule.db.repository;

import com.infomedia.abacox.feeschedule.db.entity.WaiverTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface WaiverTierRepository extends JpaRepository<WaiverTier, Long>, JpaSpecificationExecutor<WaiverTier> {

    List<WaiverTier> findAllByOrderByTierPriorityDescIdAsc();

    boolean existsByTierPriority(Integer tierPriority);

    @Query("SELECT COALESCE(MAX(t.tierPriority), 0) FROM WaiverTier t")
    int findMaxTierPriority();
}
