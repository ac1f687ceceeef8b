package com.infomedia.abacox.feeschedule.component.feeengine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.infomedia.abacox.feeschedule.component.feeengine.WaiverEvaluatorTest.tier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleCompilerTest {

    private static final Long PISTON = 100L;
    private static final Long JET = 200L;

    private ScheduleCompiler scheduleCompiler;

    private final AircraftContext cessna = new AircraftContext(1L, PISTON, new BigDecimal("50"));
    private final AircraftContext citation = new AircraftContext(2L, JET, new BigDecimal("200"));
    private final AircraftContext glider = new AircraftContext(3L, PISTON, null);

    private final FeeRuleInfo ramp = FeeRuleInfo.builder().id(10L).feeCode("RAMP").feeName("Ramp")
            .amount(new BigDecimal("100")).hasCaaOverride(true).caaOverrideAmount(new BigDecimal("75"))
            .potentiallyWaivableByFuelUplift(true).primaryFee(true).build();
    private final FeeRuleInfo gpu = FeeRuleInfo.builder().id(20L).feeCode("GPU").feeName("Ground Power")
            .amount(new BigDecimal("40")).potentiallyWaivableByFuelUplift(false).build();
    private final FeeRuleInfo hangar = FeeRuleInfo.builder().id(30L).feeCode("HANGAR").feeName("Jet Hangar")
            .appliesToClassificationId(JET).amount(new BigDecimal("500")).build();

    @BeforeEach
    void setUp() {
        scheduleCompiler = new ScheduleCompiler(new FeeResolver(), new WaiverEvaluator());
    }

    @Test
    @DisplayName("Should build one row per aircraft with cells only for applicable rules")
    void shouldBuildMatrix() {
        // When
        ScheduleMatrix matrix = scheduleCompiler.compile(List.of(cessna, citation, glider), List.of(ramp, gpu, hangar),
                List.of(), List.of());

        // Then
        assertThat(matrix.rows()).hasSize(3);
        assertThat(matrix.row(1L).orElseThrow().cells()).extracting(FeeCell::feeCode).containsExactly("RAMP", "GPU");
        assertThat(matrix.row(2L).orElseThrow().cells()).extracting(FeeCell::feeCode).containsExactly("RAMP", "GPU", "HANGAR");
        assertThat(matrix.cell(1L, 30L)).isEmpty();
        assertThat(matrix.waiverScenario()).isEqualTo(WaiverScenario.AT_MINIMUM_FUEL);
    }

    @Test
    @DisplayName("Cells should carry the standard and CAA inheritance chains")
    void shouldCarryBothChains() {
        // Given
        List<FeeRuleOverrideInfo> overrides = List.of(
                FeeRuleOverrideInfo.forClassification(10L, JET, OverrideAmount.of(new BigDecimal("150")), OverrideAmount.of(new BigDecimal("120"))),
                FeeRuleOverrideInfo.forAircraftType(10L, 2L, OverrideAmount.of(new BigDecimal("175")), null));

        // When
        ScheduleMatrix matrix = scheduleCompiler.compile(List.of(cessna, citation), List.of(ramp), overrides, List.of());
        FeeCell jetCell = matrix.cell(2L, 10L).orElseThrow();
        FeeCell pistonCell = matrix.cell(1L, 10L).orElseThrow();

        // Then
        assertThat(jetCell.finalDisplayValue()).isEqualByComparingTo("175");
        assertThat(jetCell.aircraftOverride()).isTrue();
        assertThat(jetCell.revertToValue()).isEqualByComparingTo("150");
        assertThat(jetCell.classificationDefault()).isEqualByComparingTo("150");
        assertThat(jetCell.globalDefault()).isEqualByComparingTo("100");
        assertThat(jetCell.finalCaaDisplayValue()).isEqualByComparingTo("120");
        assertThat(jetCell.caaAircraftOverride()).isFalse();
        assertThat(jetCell.caaSourceScope()).isEqualTo(SourceScope.CLASSIFICATION);
        assertThat(jetCell.revertToCaaValue()).isEqualByComparingTo("75");

        assertThat(pistonCell.finalDisplayValue()).isEqualByComparingTo("100");
        assertThat(pistonCell.sourceScope()).isEqualTo(SourceScope.GLOBAL);
        assertThat(pistonCell.finalCaaDisplayValue()).isEqualByComparingTo("75");
    }

    @Test
    @DisplayName("Waived flags should follow the scenario uplift and the waivable flag")
    void shouldFlagWaivedCells() {
        // Given
        List<WaiverTierInfo> tiers = List.of(
                tier(1L, "1.0", 10, false, "RAMP", "GPU"),
                tier(2L, "0.5", 20, true, "RAMP"));

        // When
        ScheduleMatrix atMinimum = scheduleCompiler.compile(List.of(cessna, glider), List.of(ramp, gpu), List.of(), tiers);
        ScheduleMatrix halfMinimum = scheduleCompiler.compile(List.of(cessna), List.of(ramp, gpu), List.of(), tiers,
                new WaiverScenario(new BigDecimal("0.5")));

        // Then
        assertThat(atMinimum.cell(1L, 10L).orElseThrow().waived()).isTrue();
        assertThat(atMinimum.cell(1L, 20L).orElseThrow().waived()).isFalse();
        assertThat(atMinimum.cell(3L, 10L).orElseThrow().waived()).isFalse();
        assertThat(halfMinimum.cell(1L, 10L).orElseThrow().waived()).isFalse();
        assertThat(halfMinimum.cell(1L, 10L).orElseThrow().caaWaived()).isTrue();
    }

    @Test
    @DisplayName("Should fail loudly on duplicate overrides for the same scope and rule")
    void shouldRejectDuplicateOverrides() {
        // Given
        List<FeeRuleOverrideInfo> overrides = List.of(
                FeeRuleOverrideInfo.forAircraftType(10L, 1L, OverrideAmount.of(BigDecimal.ONE), null),
                FeeRuleOverrideInfo.forAircraftType(10L, 1L, OverrideAmount.of(BigDecimal.TEN), null));

        // Then
        assertThatThrownBy(() -> scheduleCompiler.compile(List.of(cessna), List.of(ramp), overrides, List.of()))
                .isInstanceOf(AmbiguousOverrideException.class);
    }

    @Test
    @DisplayName("Compiling the same inputs twice should give equal matrices")
    void shouldBePure() {
        // Given
        List<FeeRuleOverrideInfo> overrides = List.of(
                FeeRuleOverrideInfo.forClassification(20L, PISTON, OverrideAmount.of(new BigDecimal("35")), null));
        List<WaiverTierInfo> tiers = List.of(tier(1L, "1.0", 10, false, "RAMP"));

        // When
        ScheduleMatrix first = scheduleCompiler.compile(List.of(cessna, citation), List.of(ramp, gpu, hangar), overrides, tiers);
        ScheduleMatrix second = scheduleCompiler.compile(List.of(cessna, citation), List.of(ramp, gpu, hangar), overrides, tiers);

        // Then
        assertThat(second).isEqualTo(first);
    }
}
