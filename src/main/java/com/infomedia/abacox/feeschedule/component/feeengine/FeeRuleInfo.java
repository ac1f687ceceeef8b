package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable snapshot of a fee rule as seen by the engine.
 *
 * @param appliesToClassificationId {@code null} when the rule applies to every classification
 */
@Builder(toBuilder = true)
public record FeeRuleInfo(Long id,
                          String feeCode,
                          String feeName,
                          Long appliesToClassificationId,
                          BigDecimal amount,
                          String currency,
                          boolean hasCaaOverride,
                          BigDecimal caaOverrideAmount,
                          boolean taxable,
                          boolean potentiallyWaivableByFuelUplift,
                          boolean manuallyWaivable,
                          boolean primaryFee,
                          CalculationBasis calculationBasis) {

    public FeeRuleInfo {
        Objects.requireNonNull(id, "id");
        if (feeCode == null || feeCode.isBlank()) {
            throw new InvalidFeeConfigurationException("Fee rule " + id + " has no fee code");
        }
        if (amount == null || amount.signum() < 0) {
            throw new InvalidFeeConfigurationException("Fee rule " + feeCode + " amount must be >= 0, got " + amount);
        }
        if (caaOverrideAmount != null && caaOverrideAmount.signum() < 0) {
            throw new InvalidFeeConfigurationException("Fee rule " + feeCode + " CAA amount must be >= 0, got " + caaOverrideAmount);
        }
        if (hasCaaOverride && caaOverrideAmount == null) {
            throw new InvalidFeeConfigurationException("Fee rule " + feeCode + " is flagged with a CAA override but has no CAA amount");
        }
        if (calculationBasis == null) {
            calculationBasis = CalculationBasis.NOT_APPLICABLE;
        }
    }

    public boolean appliesTo(AircraftContext aircraft) {
        return appliesToClassificationId == null || appliesToClassificationId.equals(aircraft.classificationId());
    }
}
