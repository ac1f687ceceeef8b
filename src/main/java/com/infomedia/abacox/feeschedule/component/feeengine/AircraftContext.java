package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * @param baseMinFuelGallonsForWaiver fuel quantity equivalent to a 1.0x uplift, {@code null} or zero disables waivers
 */
public record AircraftContext(Long aircraftTypeId,
                              Long classificationId,
                              BigDecimal baseMinFuelGallonsForWaiver) {

    public AircraftContext {
        Objects.requireNonNull(aircraftTypeId, "aircraftTypeId");
        Objects.requireNonNull(classificationId, "classificationId");
        if (baseMinFuelGallonsForWaiver != null && baseMinFuelGallonsForWaiver.signum() < 0) {
            throw new InvalidFeeConfigurationException("Aircraft type " + aircraftTypeId
                    + " minimum fuel for waiver must be >= 0, got " + baseMinFuelGallonsForWaiver);
        }
    }

    public boolean hasWaiverBaseline() {
        return baseMinFuelGallonsForWaiver != null && baseMinFuelGallonsForWaiver.signum() > 0;
    }
}
