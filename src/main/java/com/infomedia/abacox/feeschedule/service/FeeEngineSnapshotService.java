package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.AircraftContext;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleOverrideInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.OverrideAmount;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverTierInfo;
import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import com.infomedia.abacox.feeschedule.db.entity.FeeRule;
import com.infomedia.abacox.feeschedule.db.entity.FeeRuleOverride;
import com.infomedia.abacox.feeschedule.db.entity.WaiverTier;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleOverrideRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.db.repository.WaiverTierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Maps persisted fee configuration into the immutable values the fee engine works on.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class FeeEngineSnapshotService {

    private final AircraftTypeRepository aircraftTypeRepository;
    private final FeeRuleRepository feeRuleRepository;
    private final FeeRuleOverrideRepository feeRuleOverrideRepository;
    private final WaiverTierRepository waiverTierRepository;

    @Transactional(readOnly = true)
    public FeeEngineSnapshot load() {
        List<AircraftContext> aircraft = aircraftTypeRepository.findAll(Sort.by("name", "id")).stream()
                .map(FeeEngineSnapshotService::toAircraftContext)
                .toList();
        List<FeeRuleInfo> rules = feeRuleRepository.findAll(Sort.by("feeCode")).stream()
                .map(FeeEngineSnapshotService::toFeeRuleInfo)
                .toList();
        List<FeeRuleOverrideInfo> overrides = feeRuleOverrideRepository.findAll().stream()
                .map(FeeEngineSnapshotService::toOverrideInfo)
                .toList();
        List<WaiverTierInfo> tiers = loadWaiverTiers();
        log.debug("Loaded fee engine snapshot: {} aircraft, {} rules, {} overrides, {} tiers",
                aircraft.size(), rules.size(), overrides.size(), tiers.size());
        return new FeeEngineSnapshot(aircraft, rules, overrides, tiers);
    }

    @Transactional(readOnly = true)
    public List<WaiverTierInfo> loadWaiverTiers() {
        return waiverTierRepository.findAllByOrderByTierPriorityDescIdAsc().stream()
                .map(FeeEngineSnapshotService::toWaiverTierInfo)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FeeRuleOverrideInfo> loadOverrides() {
        return feeRuleOverrideRepository.findAll().stream()
                .map(FeeEngineSnapshotService::toOverrideInfo)
                .toList();
    }

    public static AircraftContext toAircraftContext(AircraftType aircraftType) {
        return new AircraftContext(aircraftType.getId(), aircraftType.getClassificationId(),
                aircraftType.getBaseMinFuelGallonsForWaiver());
    }

    public static FeeRuleInfo toFeeRuleInfo(FeeRule feeRule) {
        return FeeRuleInfo.builder()
                .id(feeRule.getId())
                .feeCode(feeRule.getFeeCode())
                .feeName(feeRule.getFeeName())
                .appliesToClassificationId(feeRule.getAppliesToClassificationId())
                .amount(feeRule.getAmount())
                .currency(feeRule.getCurrency())
                .hasCaaOverride(Boolean.TRUE.equals(feeRule.getHasCaaOverride()))
                .caaOverrideAmount(feeRule.getCaaOverrideAmount())
                .taxable(Boolean.TRUE.equals(feeRule.getTaxable()))
                .potentiallyWaivableByFuelUplift(Boolean.TRUE.equals(feeRule.getPotentiallyWaivableByFuelUplift()))
                .manuallyWaivable(Boolean.TRUE.equals(feeRule.getManuallyWaivable()))
                .primaryFee(Boolean.TRUE.equals(feeRule.getPrimaryFee()))
                .calculationBasis(feeRule.getCalculationBasis())
                .build();
    }

    public static FeeRuleOverrideInfo toOverrideInfo(FeeRuleOverride override) {
        return new FeeRuleOverrideInfo(override.getFeeRuleId(), override.getClassificationId(),
                override.getAircraftTypeId(), OverrideAmount.ofNullable(override.getOverrideAmount()),
                OverrideAmount.ofNullable(override.getOverrideCaaAmount()));
    }

    public static WaiverTierInfo toWaiverTierInfo(WaiverTier tier) {
        return WaiverTierInfo.builder()
                .id(tier.getId())
                .name(tier.getName())
                .fuelUpliftMultiplier(tier.getFuelUpliftMultiplier())
                .feesWaivedCodes(tier.getFeesWaivedCodes() == null ? null : new LinkedHashSet<>(tier.getFeesWaivedCodes()))
                .tierPriority(tier.getTierPriority())
                .caaSpecificTier(Boolean.TRUE.equals(tier.getCaaSpecificTier()))
                .build();
    }
}
