package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Selects the single waiver tier that applies to a fuel uplift.
 * <p>
 * Tiers are walked from highest to lowest priority and the first qualifying tier wins; lower tiers
 * are never merged in. CAA-specific tiers are only considered for CAA customers, general tiers for
 * everyone. An aircraft without a minimum fuel baseline never qualifies.
 */
@Component
@Log4j2
public class WaiverEvaluator {

    private static final Comparator<WaiverTierInfo> BY_PRIORITY_DESC =
            Comparator.comparingInt(WaiverTierInfo::tierPriority).reversed();

    public WaivedFeeSet evaluate(Collection<WaiverTierInfo> tiers, AircraftContext aircraft,
                                 BigDecimal fuelUplift, boolean caaCustomer) {
        Objects.requireNonNull(tiers, "tiers");
        Objects.requireNonNull(aircraft, "aircraft");
        Objects.requireNonNull(fuelUplift, "fuelUplift");
        if (fuelUplift.signum() < 0) {
            throw new InvalidFeeConfigurationException("Fuel uplift must not be negative, got " + fuelUplift);
        }

        if (!aircraft.hasWaiverBaseline()) {
            log.debug("Aircraft type {} has no minimum fuel for waiver, no tier can apply", aircraft.aircraftTypeId());
            return WaivedFeeSet.none(null);
        }

        BigDecimal baseMin = aircraft.baseMinFuelGallonsForWaiver();
        BigDecimal ratio = fuelUplift.divide(baseMin, MathContext.DECIMAL64);

        for (WaiverTierInfo tier : orderByPriority(tiers)) {
            if (tier.caaSpecificTier() && !caaCustomer) {
                continue;
            }
            // uplift >= baseMin * multiplier is ratio >= multiplier without rounding the ratio
            if (fuelUplift.compareTo(baseMin.multiply(tier.fuelUpliftMultiplier())) >= 0) {
                log.debug("Waiver tier '{}' (priority {}) wins for aircraft type {} at ratio {}",
                        tier.name(), tier.tierPriority(), aircraft.aircraftTypeId(), ratio);
                return WaivedFeeSet.of(tier, ratio);
            }
        }
        log.debug("No waiver tier qualifies for aircraft type {} at ratio {}", aircraft.aircraftTypeId(), ratio);
        return WaivedFeeSet.none(ratio);
    }

    /**
     * Highest priority first. Equal priorities keep their input order.
     */
    public static List<WaiverTierInfo> orderByPriority(Collection<WaiverTierInfo> tiers) {
        List<WaiverTierInfo> ordered = new ArrayList<>(tiers);
        ordered.sort(BY_PRIORITY_DESC);
        return ordered;
    }
}
