package com.infomedia.abacox.feeschedule.component.feeengine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeeResolverTest {

    private static final Long RULE_ID = 1L;
    private static final Long AIRCRAFT_ID = 10L;
    private static final Long CLASSIFICATION_ID = 100L;

    private FeeResolver feeResolver;
    private AircraftContext aircraft;

    @BeforeEach
    void setUp() {
        feeResolver = new FeeResolver();
        aircraft = new AircraftContext(AIRCRAFT_ID, CLASSIFICATION_ID, new BigDecimal("200"));
    }

    @Test
    @DisplayName("Should fall back to the rule amount when no override exists")
    void shouldUseGlobalAmountWithoutOverrides() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, OverrideIndex.empty(), PricingMode.STANDARD);

        // Then
        assertThat(resolved.finalAmount()).isEqualByComparingTo("100");
        assertThat(resolved.sourceScope()).isEqualTo(SourceScope.GLOBAL);
        assertThat(resolved.override()).isFalse();
        assertThat(resolved.isAircraftOverride()).isFalse();
        assertThat(resolved.revertToAmount()).isEqualByComparingTo("100");
        assertThat(resolved.classificationDefault()).isEqualByComparingTo("100");
        assertThat(resolved.globalDefault()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Should apply a classification override and revert to the rule amount")
    void shouldApplyClassificationOverride() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forClassification(RULE_ID, CLASSIFICATION_ID, OverrideAmount.of(new BigDecimal("80")), null)));

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);

        // Then
        assertThat(resolved.finalAmount()).isEqualByComparingTo("80");
        assertThat(resolved.isAircraftOverride()).isFalse();
        assertThat(resolved.sourceScope()).isEqualTo(SourceScope.CLASSIFICATION);
        assertThat(resolved.revertToAmount()).isEqualByComparingTo("100");
        assertThat(resolved.classificationDefault()).isEqualByComparingTo("80");
    }

    @Test
    @DisplayName("Should prefer the aircraft override and revert to the classification value")
    void shouldPreferAircraftOverride() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forClassification(RULE_ID, CLASSIFICATION_ID, OverrideAmount.of(new BigDecimal("80")), null),
                FeeRuleOverrideInfo.forAircraftType(RULE_ID, AIRCRAFT_ID, OverrideAmount.of(new BigDecimal("65")), null)));

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);

        // Then
        assertThat(resolved.finalAmount()).isEqualByComparingTo("65");
        assertThat(resolved.isAircraftOverride()).isTrue();
        assertThat(resolved.sourceScope()).isEqualTo(SourceScope.AIRCRAFT);
        assertThat(resolved.revertToAmount()).isEqualByComparingTo("80");
    }

    @Test
    @DisplayName("Deleting the aircraft override should yield the previous revert value")
    void shouldMatchRevertValueAfterDeletingAircraftOverride() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forClassification(RULE_ID, CLASSIFICATION_ID, OverrideAmount.of(new BigDecimal("80")), null),
                FeeRuleOverrideInfo.forAircraftType(RULE_ID, AIRCRAFT_ID, OverrideAmount.of(new BigDecimal("65")), null)));
        ResolvedFee before = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);

        // When
        ResolvedFee after = feeResolver.resolve(rule, aircraft,
                overrides.withoutAircraftOverride(AIRCRAFT_ID, RULE_ID), PricingMode.STANDARD);

        // Then
        assertThat(after.finalAmount()).isEqualByComparingTo(before.revertToAmount());
        assertThat(after.isAircraftOverride()).isFalse();
    }

    @Test
    @DisplayName("Should treat a zero override as an explicit amount")
    void shouldKeepZeroOverride() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forAircraftType(RULE_ID, AIRCRAFT_ID, OverrideAmount.of(BigDecimal.ZERO), null)));

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);

        // Then
        assertThat(resolved.finalAmount()).isEqualByComparingTo("0");
        assertThat(resolved.isAircraftOverride()).isTrue();
        assertThat(resolved.revertToAmount()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Should skip an aircraft override whose amount inherits")
    void shouldSkipInheritingAircraftOverride() {
        // Given
        FeeRuleInfo rule = rule("100", true, "90");
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forAircraftType(RULE_ID, AIRCRAFT_ID, OverrideAmount.inherit(),
                        OverrideAmount.of(new BigDecimal("70")))));

        // When
        ResolvedFee standard = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);
        ResolvedFee caa = feeResolver.resolve(rule, aircraft, overrides, PricingMode.CAA);

        // Then
        assertThat(standard.finalAmount()).isEqualByComparingTo("100");
        assertThat(standard.sourceScope()).isEqualTo(SourceScope.GLOBAL);
        assertThat(caa.finalAmount()).isEqualByComparingTo("70");
        assertThat(caa.sourceScope()).isEqualTo(SourceScope.AIRCRAFT);
        assertThat(caa.revertToAmount()).isEqualByComparingTo("90");
        assertThat(caa.caaFallback()).isFalse();
    }

    @Test
    @DisplayName("CAA pricing without a CAA override should use the standard chain")
    void shouldFallBackToStandardChainForCaa() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forClassification(RULE_ID, CLASSIFICATION_ID, OverrideAmount.of(new BigDecimal("80")),
                        OverrideAmount.of(new BigDecimal("5")))));

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, PricingMode.CAA);

        // Then
        assertThat(resolved.caaFallback()).isTrue();
        assertThat(resolved.pricing()).isEqualTo(PricingMode.CAA);
        assertThat(resolved.finalAmount()).isEqualByComparingTo("80");
        assertThat(resolved.globalDefault()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Overrides of other aircraft or rules should not leak into the result")
    void shouldIgnoreOverridesForOtherKeys() {
        // Given
        FeeRuleInfo rule = rule("100", false, null);
        OverrideIndex overrides = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forAircraftType(RULE_ID, 99L, OverrideAmount.of(new BigDecimal("1")), null),
                FeeRuleOverrideInfo.forClassification(2L, CLASSIFICATION_ID, OverrideAmount.of(new BigDecimal("2")), null)));

        // When
        ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, PricingMode.STANDARD);

        // Then
        assertThat(resolved.finalAmount()).isEqualByComparingTo("100");
        assertThat(resolved.sourceScope()).isEqualTo(SourceScope.GLOBAL);
    }

    private static FeeRuleInfo rule(String amount, boolean hasCaa, String caaAmount) {
        return FeeRuleInfo.builder()
                .id(RULE_ID)
                .feeCode("RAMP")
                .feeName("Ramp Fee")
                .amount(new BigDecimal(amount))
                .hasCaaOverride(hasCaa)
                .caaOverrideAmount(caaAmount == null ? null : new BigDecimal(caaAmount))
                .taxable(true)
                .build();
    }
}
