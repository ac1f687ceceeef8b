package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;

/**
 * Result of resolving one fee rule for one aircraft and pricing mode.
 *
 * @param finalAmount           amount to charge
 * @param override              true when an aircraft or classification override supplied {@code finalAmount}
 * @param sourceScope           scope that supplied {@code finalAmount}
 * @param revertToAmount        amount that applies once the override supplying {@code finalAmount} is removed;
 *                              equals {@code finalAmount} when the global default is in effect
 * @param classificationDefault classification override if set, otherwise the global default
 * @param globalDefault         the rule's own default for the effective pricing mode
 * @param caaFallback           CAA pricing was requested but the rule has no CAA override, so standard fields were used
 */
public record ResolvedFee(Long feeRuleId,
                          PricingMode pricing,
                          BigDecimal finalAmount,
                          boolean override,
                          SourceScope sourceScope,
                          BigDecimal revertToAmount,
                          BigDecimal classificationDefault,
                          BigDecimal globalDefault,
                          boolean caaFallback) {

    public boolean isAircraftOverride() {
        return sourceScope == SourceScope.AIRCRAFT;
    }
}
