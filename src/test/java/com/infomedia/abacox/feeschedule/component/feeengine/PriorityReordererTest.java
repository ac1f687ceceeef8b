package com.infomedia.abacox.feeschedule.component.feeengine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static com.infomedia.abacox.feeschedule.component.feeengine.WaiverEvaluatorTest.tier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriorityReordererTest {

    private PriorityReorderer priorityReorderer;
    private List<WaiverTierInfo> tiers;

    @BeforeEach
    void setUp() {
        priorityReorderer = new PriorityReorderer();
        tiers = List.of(
                tier(1L, "1.0", 10, false, "RAMP"),
                tier(2L, "2.0", 20, false, "GPU"),
                tier(3L, "3.0", 30, false, "LAV"));
    }

    @Test
    @DisplayName("Should assign dense descending priorities in the requested order")
    void shouldAssignDensePriorities() {
        // When
        List<PriorityAssignment> assignments = priorityReorderer.reorder(tiers, List.of(1L, 3L, 2L));

        // Then
        assertThat(assignments).containsExactly(
                new PriorityAssignment(1L, 10, 3),
                new PriorityAssignment(3L, 30, 2),
                new PriorityAssignment(2L, 20, 1));
    }

    @Test
    @DisplayName("Sorting by the new priorities should reproduce the requested order")
    void shouldReproduceRequestedOrder() {
        // Given
        List<Long> newOrder = List.of(2L, 1L, 3L);

        // When
        List<PriorityAssignment> assignments = priorityReorderer.reorder(tiers, newOrder);
        List<WaiverTierInfo> reordered = priorityReorderer.apply(tiers, assignments);

        // Then
        assertThat(reordered).extracting(WaiverTierInfo::id).containsExactlyElementsOf(newOrder);
        assertThat(reordered).extracting(WaiverTierInfo::tierPriority).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Reordering should change which tier wins the evaluation")
    void shouldChangeWinningTier() {
        // Given
        AircraftContext aircraft = new AircraftContext(1L, 1L, new BigDecimal("100"));
        WaiverEvaluator evaluator = new WaiverEvaluator();
        BigDecimal uplift = new BigDecimal("300");

        // When
        WaivedFeeSet before = evaluator.evaluate(tiers, aircraft, uplift, false);
        List<WaiverTierInfo> reordered = priorityReorderer.apply(tiers, priorityReorderer.reorder(tiers, List.of(1L, 2L, 3L)));
        WaivedFeeSet after = evaluator.evaluate(reordered, aircraft, uplift, false);

        // Then
        assertThat(before.winningTierId()).isEqualTo(3L);
        assertThat(after.winningTierId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should reject unknown, duplicate and null tier ids")
    void shouldRejectInvalidIds() {
        assertThatThrownBy(() -> priorityReorderer.reorder(tiers, List.of(1L, 2L, 99L)))
                .isInstanceOf(InvalidReorderException.class)
                .hasMessageContaining("99");
        assertThatThrownBy(() -> priorityReorderer.reorder(tiers, List.of(1L, 1L, 2L)))
                .isInstanceOf(InvalidReorderException.class);
        assertThatThrownBy(() -> priorityReorderer.reorder(tiers, Arrays.asList(1L, null, 2L)))
                .isInstanceOf(InvalidReorderException.class);
    }

    @Test
    @DisplayName("Should reject a partial order that would collide with an unlisted tier")
    void shouldRejectCollidingPartialOrder() {
        // Given
        List<WaiverTierInfo> lowTiers = List.of(
                tier(1L, "1.0", 1, false, "RAMP"),
                tier(2L, "2.0", 2, false, "GPU"),
                tier(3L, "3.0", 3, false, "LAV"));

        // Then
        assertThatThrownBy(() -> priorityReorderer.reorder(lowTiers, List.of(3L, 2L)))
                .isInstanceOf(InvalidReorderException.class);
    }

    @Test
    @DisplayName("Should accept a partial order when unlisted tiers keep distinct priorities")
    void shouldAcceptNonCollidingPartialOrder() {
        // When
        List<PriorityAssignment> assignments = priorityReorderer.reorder(tiers, List.of(1L, 2L));

        // Then
        assertThat(assignments).extracting(PriorityAssignment::newPriority).containsExactly(2, 1);
        assertThat(assignments).allMatch(PriorityAssignment::isChange);
    }
}
