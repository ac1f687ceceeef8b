package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Builds the aircraft x fee rule matrix shown by the fee schedule screen.
 * <p>
 * The result depends only on the arguments. Nothing is cached between calls, so a changed override
 * set is only reflected by compiling again.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class ScheduleCompiler {

    private final FeeResolver feeResolver;
    private final WaiverEvaluator waiverEvaluator;

    public ScheduleMatrix compile(List<AircraftContext> aircraftList, List<FeeRuleInfo> feeRules,
                                  Collection<FeeRuleOverrideInfo> overrides, Collection<WaiverTierInfo> tiers) {
        return compile(aircraftList, feeRules, overrides, tiers, WaiverScenario.AT_MINIMUM_FUEL);
    }

    public ScheduleMatrix compile(List<AircraftContext> aircraftList, List<FeeRuleInfo> feeRules,
                                  Collection<FeeRuleOverrideInfo> overrides, Collection<WaiverTierInfo> tiers,
                                  WaiverScenario scenario) {
        Objects.requireNonNull(aircraftList, "aircraftList");
        Objects.requireNonNull(feeRules, "feeRules");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(tiers, "tiers");
        Objects.requireNonNull(scenario, "scenario");

        OverrideIndex index = OverrideIndex.of(overrides);
        List<WaiverTierInfo> orderedTiers = WaiverEvaluator.orderByPriority(tiers);

        List<AircraftScheduleRow> rows = new ArrayList<>(aircraftList.size());
        for (AircraftContext aircraft : aircraftList) {
            rows.add(compileRow(aircraft, feeRules, index, orderedTiers, scenario));
        }
        log.debug("Compiled fee schedule: {} aircraft, {} rules, {} overrides, {} tiers",
                aircraftList.size(), feeRules.size(), index.size(), orderedTiers.size());
        return new ScheduleMatrix(rows, scenario);
    }

    private AircraftScheduleRow compileRow(AircraftContext aircraft, List<FeeRuleInfo> feeRules, OverrideIndex index,
                                           List<WaiverTierInfo> tiers, WaiverScenario scenario) {
        BigDecimal fuelUplift = scenario.fuelUpliftFor(aircraft);
        WaivedFeeSet standardWaivers = waiverEvaluator.evaluate(tiers, aircraft, fuelUplift, false);
        WaivedFeeSet caaWaivers = waiverEvaluator.evaluate(tiers, aircraft, fuelUplift, true);

        List<FeeCell> cells = new ArrayList<>();
        for (FeeRuleInfo rule : feeRules) {
            if (!rule.appliesTo(aircraft)) {
                continue;
            }
            ResolvedFee standard = feeResolver.resolve(rule, aircraft, index, PricingMode.STANDARD);
            ResolvedFee caa = feeResolver.resolve(rule, aircraft, index, PricingMode.CAA);
            cells.add(FeeCell.of(rule, standard, caa, standardWaivers.isWaived(rule), caaWaivers.isWaived(rule)));
        }
        return new AircraftScheduleRow(aircraft.aircraftTypeId(), aircraft.classificationId(),
                aircraft.baseMinFuelGallonsForWaiver(), cells);
    }
}
