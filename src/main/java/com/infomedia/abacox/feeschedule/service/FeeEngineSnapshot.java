package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.AircraftContext;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleOverrideInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverTierInfo;

import java.util.List;

/**
 * Everything the fee engine reads, taken from the database in one read-only transaction.
 */
public record FeeEngineSnapshot(List<AircraftContext> aircraft,
                                List<FeeRuleInfo> feeRules,
                                List<FeeRuleOverrideInfo> overrides,
                                List<WaiverTierInfo> waiverTiers) {

    public FeeEngineSnapshot {
        aircraft = List.copyOf(aircraft);
        feeRules = List.copyOf(feeRules);
        overrides = List.copyOf(overrides);
        waiverTiers = List.copyOf(waiverTiers);
    }
}
