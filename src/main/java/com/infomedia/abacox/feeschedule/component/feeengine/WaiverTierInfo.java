package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

@Builder(toBuilder = true)
public record WaiverTierInfo(Long id,
                             String name,
                             BigDecimal fuelUpliftMultiplier,
                             Set<String> feesWaivedCodes,
                             int tierPriority,
                             boolean caaSpecificTier) {

    public WaiverTierInfo {
        Objects.requireNonNull(id, "id");
        if (fuelUpliftMultiplier == null || fuelUpliftMultiplier.signum() <= 0) {
            throw new InvalidFeeConfigurationException("Waiver tier " + id + " multiplier must be > 0, got " + fuelUpliftMultiplier);
        }
        if (feesWaivedCodes == null || feesWaivedCodes.isEmpty()) {
            throw new InvalidFeeConfigurationException("Waiver tier " + id + " must waive at least one fee code");
        }
        feesWaivedCodes = Collections.unmodifiableSet(new LinkedHashSet<>(feesWaivedCodes));
    }
}
