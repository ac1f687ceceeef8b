package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;

/**
 * One (aircraft type, fee rule) entry of a compiled fee schedule, carrying the full inheritance
 * chain for both standard and CAA pricing.
 */
public record FeeCell(Long feeRuleId,
                      String feeCode,
                      BigDecimal finalDisplayValue,
                      boolean aircraftOverride,
                      SourceScope sourceScope,
                      BigDecimal revertToValue,
                      BigDecimal classificationDefault,
                      BigDecimal globalDefault,
                      BigDecimal finalCaaDisplayValue,
                      boolean caaAircraftOverride,
                      SourceScope caaSourceScope,
                      BigDecimal revertToCaaValue,
                      BigDecimal classificationCaaDefault,
                      BigDecimal globalCaaDefault,
                      boolean waived,
                      boolean caaWaived) {

    static FeeCell of(FeeRuleInfo rule, ResolvedFee standard, ResolvedFee caa, boolean waived, boolean caaWaived) {
        return new FeeCell(rule.id(), rule.feeCode(),
                standard.finalAmount(), standard.isAircraftOverride(), standard.sourceScope(), standard.revertToAmount(),
                standard.classificationDefault(), standard.globalDefault(),
                caa.finalAmount(), caa.isAircraftOverride(), caa.sourceScope(), caa.revertToAmount(),
                caa.classificationDefault(), caa.globalDefault(),
                waived, caaWaived);
    }
}
