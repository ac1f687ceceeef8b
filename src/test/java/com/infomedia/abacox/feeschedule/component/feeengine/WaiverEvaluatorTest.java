package com.infomedia.abacox.feeschedule.component.feeengine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaiverEvaluatorTest {

    private WaiverEvaluator waiverEvaluator;
    private AircraftContext aircraft;

    private final WaiverTierInfo tierA = tier(1L, "1.0", 10, false, "RAMP");
    private final WaiverTierInfo tierB = tier(2L, "2.0", 20, false, "RAMP", "GPU");

    @BeforeEach
    void setUp() {
        waiverEvaluator = new WaiverEvaluator();
        aircraft = new AircraftContext(10L, 100L, new BigDecimal("200"));
    }

    @Test
    @DisplayName("Should pick the lower tier when the higher priority multiplier is not reached")
    void shouldPickQualifyingLowerTier() {
        // When
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA, tierB), aircraft, new BigDecimal("300"), false);

        // Then
        assertThat(result.upliftRatio()).isEqualByComparingTo("1.5");
        assertThat(result.winningTierId()).isEqualTo(1L);
        assertThat(result.waivedFeeCodes()).containsExactly("RAMP");
    }

    @Test
    @DisplayName("Should stop at the first qualifying tier without merging lower ones")
    void shouldNotMergeLowerTiers() {
        // Given
        WaiverTierInfo fuelOnly = tier(3L, "3.0", 30, false, "OVERNIGHT");

        // When
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA, tierB, fuelOnly), aircraft, new BigDecimal("600"), false);

        // Then
        assertThat(result.winningTierId()).isEqualTo(3L);
        assertThat(result.waivedFeeCodes()).containsExactly("OVERNIGHT");
        assertThat(result.contains("RAMP")).isFalse();
    }

    @Test
    @DisplayName("Should qualify when the uplift equals the threshold exactly")
    void shouldQualifyAtExactThreshold() {
        // When
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA, tierB), aircraft, new BigDecimal("400"), false);

        // Then
        assertThat(result.winningTierId()).isEqualTo(2L);
        assertThat(result.waivedFeeCodes()).containsExactlyInAnyOrder("RAMP", "GPU");
    }

    @Test
    @DisplayName("Should return an empty set when no tier qualifies")
    void shouldReturnEmptyWhenNothingQualifies() {
        // When
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA, tierB), aircraft, new BigDecimal("150"), false);

        // Then
        assertThat(result.hasWinningTier()).isFalse();
        assertThat(result.waivedFeeCodes()).isEmpty();
        assertThat(result.upliftRatio()).isEqualByComparingTo("0.75");
    }

    @Test
    @DisplayName("Should never waive for an aircraft without minimum fuel")
    void shouldGuardZeroBaseline() {
        // Given
        AircraftContext noBaseline = new AircraftContext(11L, 100L, BigDecimal.ZERO);

        // When
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA, tierB), noBaseline, new BigDecimal("5000"), true);

        // Then
        assertThat(result.hasWinningTier()).isFalse();
        assertThat(result.upliftRatio()).isNull();
    }

    @Test
    @DisplayName("CAA-specific tiers should only apply to CAA customers")
    void shouldFilterCaaTiers() {
        // Given
        WaiverTierInfo caaTier = tier(4L, "0.5", 50, true, "RAMP", "GPU", "LAV");

        // When
        WaivedFeeSet standard = waiverEvaluator.evaluate(List.of(tierA, caaTier), aircraft, new BigDecimal("200"), false);
        WaivedFeeSet caa = waiverEvaluator.evaluate(List.of(tierA, caaTier), aircraft, new BigDecimal("200"), true);

        // Then
        assertThat(standard.winningTierId()).isEqualTo(1L);
        assertThat(caa.winningTierId()).isEqualTo(4L);
        assertThat(caa.waivedFeeCodes()).contains("LAV");
    }

    @Test
    @DisplayName("Should give the same result regardless of tier input order")
    void shouldBeDeterministic() {
        // Given
        List<WaiverTierInfo> tiers = new ArrayList<>(List.of(tierA, tierB, tier(5L, "1.2", 15, false, "GPU")));
        WaivedFeeSet first = waiverEvaluator.evaluate(tiers, aircraft, new BigDecimal("250"), false);

        // When
        Collections.reverse(tiers);
        WaivedFeeSet second = waiverEvaluator.evaluate(tiers, aircraft, new BigDecimal("250"), false);

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(first.winningTierId()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should reject a negative fuel uplift")
    void shouldRejectNegativeUplift() {
        assertThatThrownBy(() -> waiverEvaluator.evaluate(List.of(tierA), aircraft, new BigDecimal("-1"), false))
                .isInstanceOf(InvalidFeeConfigurationException.class);
    }

    @Test
    @DisplayName("Waived set should only waive fees flagged as waivable by fuel uplift")
    void shouldRespectWaivableFlag() {
        // Given
        WaivedFeeSet result = waiverEvaluator.evaluate(List.of(tierA), aircraft, new BigDecimal("200"), false);
        FeeRuleInfo waivable = FeeRuleInfo.builder().id(1L).feeCode("RAMP").amount(BigDecimal.TEN)
                .potentiallyWaivableByFuelUplift(true).build();
        FeeRuleInfo notWaivable = waivable.toBuilder().potentiallyWaivableByFuelUplift(false).build();

        // Then
        assertThat(result.isWaived(waivable)).isTrue();
        assertThat(result.isWaived(notWaivable)).isFalse();
    }

    static WaiverTierInfo tier(Long id, String multiplier, int priority, boolean caaSpecific, String... codes) {
        return WaiverTierInfo.builder()
                .id(id)
                .name("Tier " + id)
                .fuelUpliftMultiplier(new BigDecimal(multiplier))
                .feesWaivedCodes(Set.of(codes))
                .tierPriority(priority)
                .caaSpecificTier(caaSpecific)
                .build();
    }
}
