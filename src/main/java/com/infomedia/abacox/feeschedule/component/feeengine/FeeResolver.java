package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Walks the override inheritance chain aircraft type -> classification -> global for a single fee rule.
 * <p>
 * Standard and CAA amounts are resolved independently. When CAA pricing is requested for a rule
 * without a CAA override, the standard chain is used end to end and CAA override fields are ignored.
 * <p>
 * The caller is responsible for only passing rules that apply to the aircraft's classification.
 */
@Component
@Log4j2
public class FeeResolver {

    public ResolvedFee resolve(FeeRuleInfo rule, AircraftContext aircraft, OverrideIndex overrides, PricingMode pricing) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(aircraft, "aircraft");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(pricing, "pricing");

        boolean caaFallback = pricing == PricingMode.CAA && !rule.hasCaaOverride();
        PricingMode effective = caaFallback ? PricingMode.STANDARD : pricing;

        BigDecimal globalDefault = effective == PricingMode.CAA ? rule.caaOverrideAmount() : rule.amount();

        OverrideAmount classificationAmount = overrides.findClassificationOverride(aircraft.classificationId(), rule.id())
                .map(o -> o.amountFor(effective))
                .orElse(OverrideAmount.inherit());
        BigDecimal classificationDefault = classificationAmount.orElse(globalDefault);

        OverrideAmount aircraftAmount = overrides.findAircraftOverride(aircraft.aircraftTypeId(), rule.id())
                .map(o -> o.amountFor(effective))
                .orElse(OverrideAmount.inherit());

        SourceScope scope;
        BigDecimal finalAmount;
        BigDecimal revertTo;
        if (aircraftAmount.isOverride()) {
            scope = SourceScope.AIRCRAFT;
            finalAmount = aircraftAmount.get();
            revertTo = classificationDefault;
        } else if (classificationAmount.isOverride()) {
            scope = SourceScope.CLASSIFICATION;
            finalAmount = classificationAmount.get();
            revertTo = globalDefault;
        } else {
            scope = SourceScope.GLOBAL;
            finalAmount = globalDefault;
            revertTo = globalDefault;
        }

        log.trace("Resolved fee {} for aircraft type {} ({}): {} from {}{}", rule.feeCode(), aircraft.aircraftTypeId(),
                pricing, finalAmount, scope, caaFallback ? " (standard fallback)" : "");

        return new ResolvedFee(rule.id(), pricing, finalAmount, scope != SourceScope.GLOBAL, scope, revertTo,
                classificationDefault, globalDefault, caaFallback);
    }
}
