package com.infomedia.abacox.feeschedule.component.feeengine;

import java.util.List;

/**
 * Chooses the primary columns of the fee schedule. Rules flagged as primary are used as is.
 * When none is flagged and the fallback is enabled, every rule is shown as a primary column,
 * which keeps a freshly configured schedule usable before anyone has picked primary fees.
 */
public final class NoPrimaryFeesFallback {

    private static final NoPrimaryFeesFallback ENABLED = new NoPrimaryFeesFallback(true);
    private static final NoPrimaryFeesFallback DISABLED = new NoPrimaryFeesFallback(false);

    private final boolean enabled;

    private NoPrimaryFeesFallback(boolean enabled) {
        this.enabled = enabled;
    }

    public static NoPrimaryFeesFallback of(boolean enabled) {
        return enabled ? ENABLED : DISABLED;
    }

    public PrimaryFeeColumns selectPrimaryColumns(List<FeeRuleInfo> rules) {
        List<FeeRuleInfo> flagged = rules.stream().filter(FeeRuleInfo::primaryFee).toList();
        if (flagged.isEmpty() && enabled && !rules.isEmpty()) {
            return new PrimaryFeeColumns(rules, true);
        }
        return new PrimaryFeeColumns(flagged, false);
    }
}
