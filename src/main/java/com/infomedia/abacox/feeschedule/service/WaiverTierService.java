package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.component.feeengine.PriorityAssignment;
import com.infomedia.abacox.feeschedule.component.feeengine.PriorityReorderer;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverTierInfo;
import com.infomedia.abacox.feeschedule.db.entity.FeeRule;
import com.infomedia.abacox.feeschedule.db.entity.WaiverTier;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.db.repository.WaiverTierRepository;
import com.infomedia.abacox.feeschedule.dto.waivertier.CreateWaiverTier;
import com.infomedia.abacox.feeschedule.dto.waivertier.UpdateWaiverTier;
import com.infomedia.abacox.feeschedule.service.common.CrudService;
import com.infomedia.abacox.feeschedule.service.common.ReferenceConflictException;
import com.infomedia.abacox.feeschedule.service.common.StaleWriteException;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Log4j2
public class WaiverTierService extends CrudService<WaiverTier, Long, WaiverTierRepository> {

    private static final int MULTIPLIER_SCALE = 2;
    private static final BigDecimal MIN_MULTIPLIER = new BigDecimal("0.01");
    private static final BigDecimal MAX_MULTIPLIER = new BigDecimal("999.99");

    private final FeeRuleRepository feeRuleRepository;
    private final PriorityReorderer priorityReorderer;

    public WaiverTierService(WaiverTierRepository repository,
                             FeeRuleRepository feeRuleRepository,
                             PriorityReorderer priorityReorderer) {
        super(repository);
        this.feeRuleRepository = feeRuleRepository;
        this.priorityReorderer = priorityReorderer;
    }

    /**
     * Highest priority first, which is the order the evaluator walks them in.
     */
    @Transactional(readOnly = true)
    public List<WaiverTier> findAllOrdered() {
        return getRepository().findAllByOrderByTierPriorityDescIdAsc();
    }

    @Transactional
    public WaiverTier create(CreateWaiverTier cDto) {
        int priority = cDto.getTierPriority() != null
                ? cDto.getTierPriority()
                : getRepository().findMaxTierPriority() + 1;
        requireFreePriority(priority);
        WaiverTier tier = WaiverTier.builder()
                .name(cDto.getName())
                .fuelUpliftMultiplier(storableMultiplier(cDto.getFuelUpliftMultiplier()))
                .feesWaivedCodes(knownFeeCodes(cDto.getFeesWaivedCodes()))
                .tierPriority(priority)
                .caaSpecificTier(cDto.getCaaSpecificTier())
                .build();
        WaiverTier saved;
        try {
            saved = getRepository().saveAndFlush(tier);
        } catch (DataIntegrityViolationException e) {
            throw new StaleWriteException("Priority " + priority + " was taken by another request", e);
        }
        log.info("Created waiver tier {} '{}' at priority {} ({}x, waives {})",
                saved.getId(), saved.getName(), saved.getTierPriority(), saved.getFuelUpliftMultiplier(), saved.getFeesWaivedCodes());
        return saved;
    }

    @Transactional
    public WaiverTier update(Long id, UpdateWaiverTier uDto) {
        WaiverTier tier = get(id);
        if (uDto.getExpectedVersion() != null && !Objects.equals(uDto.getExpectedVersion(), tier.getVersion())) {
            throw new StaleWriteException("Waiver tier " + id + " is at version " + tier.getVersion()
                    + ", expected " + uDto.getExpectedVersion());
        }
        uDto.getName().ifPresent(tier::setName);
        uDto.getFuelUpliftMultiplier().ifPresent(multiplier -> tier.setFuelUpliftMultiplier(storableMultiplier(multiplier)));
        uDto.getFeesWaivedCodes().ifPresent(codes -> tier.setFeesWaivedCodes(knownFeeCodes(codes)));
        uDto.getCaaSpecificTier().ifPresent(tier::setCaaSpecificTier);
        uDto.getTierPriority().ifPresent(priority -> {
            if (!Objects.equals(priority, tier.getTierPriority())) {
                requireFreePriority(priority);
                tier.setTierPriority(priority);
            }
        });
        try {
            return getRepository().saveAndFlush(tier);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StaleWriteException("Waiver tier " + id + " was changed by another request", e);
        } catch (DataIntegrityViolationException e) {
            throw new StaleWriteException("Priority " + tier.getTierPriority() + " was taken by another request", e);
        }
    }

    @Transactional
    public void delete(Long id) {
        WaiverTier tier = get(id);
        getRepository().delete(tier);
        log.info("Deleted waiver tier {} '{}' (priority {})", id, tier.getName(), tier.getTierPriority());
    }

    /**
     * Renumbers the tiers so that {@code tierIds} reads from highest to lowest priority. The whole
     * batch is written in this transaction or not at all.
     * <p>
     * Priorities are unique in the database, so changed rows are first parked on their negated new
     * priority and then moved to the final value.
     */
    @Transactional
    public List<PriorityAssignment> reorder(List<Long> tierIds) {
        List<WaiverTier> tiers = getRepository().findAll();
        List<WaiverTierInfo> infos = tiers.stream().map(FeeEngineSnapshotService::toWaiverTierInfo).toList();
        List<PriorityAssignment> assignments = priorityReorderer.reorder(infos, tierIds);

        Map<Long, WaiverTier> byId = tiers.stream().collect(Collectors.toMap(WaiverTier::getId, Function.identity()));
        Map<WaiverTier, Integer> changed = new LinkedHashMap<>();
        for (PriorityAssignment assignment : assignments) {
            if (assignment.isChange()) {
                changed.put(byId.get(assignment.tierId()), assignment.newPriority());
            }
        }
        List<WaiverTier> changedTiers = new ArrayList<>(changed.keySet());
        try {
            changed.forEach((tier, priority) -> tier.setTierPriority(-priority));
            getRepository().saveAllAndFlush(changedTiers);
            changed.forEach(WaiverTier::setTierPriority);
            getRepository().saveAllAndFlush(changedTiers);
        } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new StaleWriteException("Waiver tiers were changed by another request while reordering", e);
        }
        log.info("Reordered waiver tiers {}: {} of {} priorities changed", tierIds, changed.size(), assignments.size());
        return assignments;
    }

    private void requireFreePriority(int priority) {
        if (getRepository().existsByTierPriority(priority)) {
            throw new ReferenceConflictException("Another waiver tier already has priority " + priority);
        }
    }

    /**
     * The multiplier column holds 3 integer and 2 fraction digits; anything else would be rounded
     * or overflow on write.
     */
    private static BigDecimal storableMultiplier(BigDecimal multiplier) {
        if (multiplier == null || multiplier.compareTo(MIN_MULTIPLIER) < 0 || multiplier.compareTo(MAX_MULTIPLIER) > 0
                || multiplier.stripTrailingZeros().scale() > MULTIPLIER_SCALE) {
            throw new InvalidFeeConfigurationException("Fuel uplift multiplier must be between " + MIN_MULTIPLIER
                    + " and " + MAX_MULTIPLIER + " with at most " + MULTIPLIER_SCALE + " decimals, got " + multiplier);
        }
        return multiplier.setScale(MULTIPLIER_SCALE);
    }

    private List<String> knownFeeCodes(Collection<String> feeCodes) {
        Set<String> requested = new LinkedHashSet<>(feeCodes);
        Set<String> known = feeRuleRepository.findAllByFeeCodeIn(requested).stream()
                .map(FeeRule::getFeeCode)
                .collect(Collectors.toSet());
        List<String> unknown = requested.stream().filter(code -> !known.contains(code)).toList();
        if (!unknown.isEmpty()) {
            throw new InvalidFeeConfigurationException("Unknown fee codes in waiver tier: " + unknown);
        }
        return new ArrayList<>(requested);
    }

    @Override
    protected String entityName() {
        return "Waiver tier";
    }
}
