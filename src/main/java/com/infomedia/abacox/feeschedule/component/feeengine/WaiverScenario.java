package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Hypothetical fuel uplift used to flag waived cells in a compiled schedule, expressed as a multiple
 * of each aircraft's own minimum fuel for waiver.
 */
public record WaiverScenario(BigDecimal upliftMultiple) {

    public static final WaiverScenario AT_MINIMUM_FUEL = new WaiverScenario(BigDecimal.ONE);

    public WaiverScenario {
        Objects.requireNonNull(upliftMultiple, "upliftMultiple");
        if (upliftMultiple.signum() < 0) {
            throw new InvalidFeeConfigurationException("Uplift multiple must not be negative, got " + upliftMultiple);
        }
    }

    public BigDecimal fuelUpliftFor(AircraftContext aircraft) {
        if (!aircraft.hasWaiverBaseline()) {
            return BigDecimal.ZERO;
        }
        return aircraft.baseMinFuelGallonsForWaiver().multiply(upliftMultiple);
    }
}
