package com.infomedia.abacox.feeschedule.component.feeengine;

import java.util.Objects;

/**
 * Override of one fee rule for exactly one scope: an aircraft classification or an aircraft type.
 */
public record FeeRuleOverrideInfo(Long feeRuleId,
                                  Long classificationId,
                                  Long aircraftTypeId,
                                  OverrideAmount overrideAmount,
                                  OverrideAmount overrideCaaAmount) {

    public FeeRuleOverrideInfo {
        Objects.requireNonNull(feeRuleId, "feeRuleId");
        if ((classificationId == null) == (aircraftTypeId == null)) {
            throw new AmbiguousOverrideException("Override for fee rule " + feeRuleId
                    + " must reference exactly one of classification or aircraft type (classification="
                    + classificationId + ", aircraftType=" + aircraftTypeId + ")");
        }
        if (overrideAmount == null) {
            overrideAmount = OverrideAmount.inherit();
        }
        if (overrideCaaAmount == null) {
            overrideCaaAmount = OverrideAmount.inherit();
        }
    }

    public static FeeRuleOverrideInfo forClassification(Long feeRuleId, Long classificationId,
                                                        OverrideAmount amount, OverrideAmount caaAmount) {
        return new FeeRuleOverrideInfo(feeRuleId, classificationId, null, amount, caaAmount);
    }

    public static FeeRuleOverrideInfo forAircraftType(Long feeRuleId, Long aircraftTypeId,
                                                      OverrideAmount amount, OverrideAmount caaAmount) {
        return new FeeRuleOverrideInfo(feeRuleId, null, aircraftTypeId, amount, caaAmount);
    }

    public boolean isAircraftScoped() {
        return aircraftTypeId != null;
    }

    public Long scopeId() {
        return isAircraftScoped() ? aircraftTypeId : classificationId;
    }

    OverrideAmount amountFor(PricingMode pricing) {
        return pricing == PricingMode.CAA ? overrideCaaAmount : overrideAmount;
    }
}
