package com.infomedia.abacox.feeschedule.component.feeengine;

import java.util.List;

/**
 * @param fallbackApplied true when no rule was flagged primary and every rule was promoted instead
 */
public record PrimaryFeeColumns(List<FeeRuleInfo> rules, boolean fallbackApplied) {

    public PrimaryFeeColumns {
        rules = List.copyOf(rules);
    }
}
