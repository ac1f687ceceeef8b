package com.infomedia.abacox.feeschedule.component.feeengine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverrideIndexTest {

    @Test
    @DisplayName("Should keep aircraft and classification overrides with equal ids apart")
    void shouldSeparateScopes() {
        // Given
        FeeRuleOverrideInfo byClassification = FeeRuleOverrideInfo.forClassification(1L, 5L, OverrideAmount.of(BigDecimal.ONE), null);
        FeeRuleOverrideInfo byAircraft = FeeRuleOverrideInfo.forAircraftType(1L, 5L, OverrideAmount.of(BigDecimal.TEN), null);

        // When
        OverrideIndex index = OverrideIndex.of(List.of(byClassification, byAircraft));

        // Then
        assertThat(index.size()).isEqualTo(2);
        assertThat(index.findClassificationOverride(5L, 1L)).contains(byClassification);
        assertThat(index.findAircraftOverride(5L, 1L)).contains(byAircraft);
        assertThat(index.findAircraftOverride(5L, 2L)).isEmpty();
    }

    @Test
    @DisplayName("Replacing an override should keep a single entry per key")
    void shouldReplaceOnSameKey() {
        // Given
        OverrideIndex index = OverrideIndex.of(List.of(
                FeeRuleOverrideInfo.forAircraftType(1L, 5L, OverrideAmount.of(BigDecimal.ONE), null)));

        // When
        OverrideIndex updated = index.with(FeeRuleOverrideInfo.forAircraftType(1L, 5L, OverrideAmount.of(BigDecimal.TEN), null));

        // Then
        assertThat(updated.size()).isEqualTo(1);
        assertThat(updated.findAircraftOverride(5L, 1L).orElseThrow().overrideAmount()).isEqualTo(OverrideAmount.of(BigDecimal.TEN));
        assertThat(index.findAircraftOverride(5L, 1L).orElseThrow().overrideAmount()).isEqualTo(OverrideAmount.of(BigDecimal.ONE));
    }

    @Test
    @DisplayName("An override must reference exactly one scope")
    void shouldRejectAmbiguousScope() {
        assertThatThrownBy(() -> new FeeRuleOverrideInfo(1L, 5L, 6L, null, null))
                .isInstanceOf(AmbiguousOverrideException.class);
        assertThatThrownBy(() -> new FeeRuleOverrideInfo(1L, null, null, null, null))
                .isInstanceOf(AmbiguousOverrideException.class);
    }

    @Test
    @DisplayName("Override amounts should distinguish zero from inherit")
    void shouldDistinguishZeroFromInherit() {
        // Given
        OverrideAmount zero = OverrideAmount.of(new BigDecimal("0.00"));
        OverrideAmount inherit = OverrideAmount.ofNullable(null);

        // Then
        assertThat(zero.isOverride()).isTrue();
        assertThat(zero).isEqualTo(OverrideAmount.of(BigDecimal.ZERO));
        assertThat(inherit.isOverride()).isFalse();
        assertThat(inherit.orElse(BigDecimal.TEN)).isEqualByComparingTo("10");
        assertThat(inherit.toNullable()).isNull();
        assertThatThrownBy(inherit::get).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> OverrideAmount.of(new BigDecimal("-0.01")))
                .isInstanceOf(InvalidFeeConfigurationException.class);
    }
}
