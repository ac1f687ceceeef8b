package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Set;

/**
 * Fee codes waived by the winning waiver tier for one aircraft and fuel uplift.
 *
 * @param winningTierId {@code null} when no tier qualified
 * @param upliftRatio   fuel uplift divided by the aircraft's minimum fuel, {@code null} when the aircraft has no minimum
 */
public record WaivedFeeSet(Long winningTierId,
                           String winningTierName,
                           Set<String> waivedFeeCodes,
                           BigDecimal upliftRatio) {

    public WaivedFeeSet {
        waivedFeeCodes = waivedFeeCodes == null ? Collections.emptySet() : Collections.unmodifiableSet(waivedFeeCodes);
    }

    public static WaivedFeeSet none(BigDecimal upliftRatio) {
        return new WaivedFeeSet(null, null, Collections.emptySet(), upliftRatio);
    }

    public static WaivedFeeSet of(WaiverTierInfo tier, BigDecimal upliftRatio) {
        return new WaivedFeeSet(tier.id(), tier.name(), tier.feesWaivedCodes(), upliftRatio);
    }

    public boolean hasWinningTier() {
        return winningTierId != null;
    }

    public boolean contains(String feeCode) {
        return waivedFeeCodes.contains(feeCode);
    }

    /**
     * Billing rule: the fee must be flagged as waivable by fuel uplift and listed by the winning tier.
     */
    public boolean isWaived(FeeRuleInfo rule) {
        return rule.potentiallyWaivableByFuelUplift() && contains(rule.feeCode());
    }
}
