package com.infomedia.abacox.feeschedule.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.feeschedule.component.feeengine.AircraftContext;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeResolver;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.ScheduleCompiler;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverEvaluator;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverTierInfo;
import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.config.ConfigKey;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeCellDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeRuleColumnDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeScheduleDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeeScheduleServiceTest {

    @Mock
    private FeeEngineSnapshotService snapshotService;

    @Mock
    private ConfigService configService;

    @Mock
    private NameLookupService nameLookupService;

    private FeeScheduleService feeScheduleService;

    private final FeeRuleInfo ramp = FeeRuleInfo.builder()
            .id(1L).feeCode("RAMP").feeName("Ramp Fee").amount(new BigDecimal("200.00")).currency("USD")
            .potentiallyWaivableByFuelUplift(true).build();
    private final FeeRuleInfo gpu = FeeRuleInfo.builder()
            .id(2L).feeCode("GPU").feeName("Ground Power").amount(new BigDecimal("50.00")).currency("USD")
            .build();
    private final WaiverTierInfo gold = WaiverTierInfo.builder()
            .id(1L).name("Gold").fuelUpliftMultiplier(new BigDecimal("2.00")).feesWaivedCodes(Set.of("RAMP"))
            .tierPriority(1).build();

    @BeforeEach
    void setUp() {
        ScheduleCompiler compiler = new ScheduleCompiler(new FeeResolver(), new WaiverEvaluator());
        feeScheduleService = new FeeScheduleService(snapshotService, compiler, configService, nameLookupService,
                new ModelConverter(new ObjectMapper()));
    }

    @Test
    @DisplayName("Should promote every rule to a primary column when none is flagged")
    void shouldApplyPrimaryFallback() {
        // Given
        givenSnapshot(List.of(ramp, gpu));
        when(configService.getDecimal(ConfigKey.SCHEDULE_UPLIFT_MULTIPLE)).thenReturn(BigDecimal.ONE);
        when(configService.getBoolean(ConfigKey.NO_PRIMARY_FEES_FALLBACK)).thenReturn(true);

        // When
        FeeScheduleDto schedule = feeScheduleService.getFeeSchedule(null);

        // Then
        assertThat(schedule.getPrimaryFallbackApplied()).isTrue();
        assertThat(schedule.getPrimaryColumns()).extracting(FeeRuleColumnDto::getFeeCode).containsExactly("RAMP", "GPU");
        assertThat(schedule.getOtherColumns()).isEmpty();
        assertThat(schedule.getRows()).hasSize(1);
        assertThat(schedule.getRows().get(0).getAircraftTypeName()).isEqualTo("B737");
        assertThat(schedule.getRows().get(0).getClassificationName()).isEqualTo("Narrow Body");
        assertThat(schedule.getRows().get(0).getCells()).extracting(FeeCellDto::getWaived).containsExactly(false, false);
    }

    @Test
    @DisplayName("Flagged rules should be primary and the rest listed as other columns")
    void shouldSplitColumns() {
        // Given
        FeeRuleInfo primaryRamp = ramp.toBuilder().primaryFee(true).build();
        givenSnapshot(List.of(primaryRamp, gpu));
        when(configService.getDecimal(ConfigKey.SCHEDULE_UPLIFT_MULTIPLE)).thenReturn(BigDecimal.ONE);
        when(configService.getBoolean(ConfigKey.NO_PRIMARY_FEES_FALLBACK)).thenReturn(true);

        // When
        FeeScheduleDto schedule = feeScheduleService.getFeeSchedule(null);

        // Then
        assertThat(schedule.getPrimaryFallbackApplied()).isFalse();
        assertThat(schedule.getPrimaryColumns()).extracting(FeeRuleColumnDto::getFeeCode).containsExactly("RAMP");
        assertThat(schedule.getOtherColumns()).extracting(FeeRuleColumnDto::getFeeCode).containsExactly("GPU");
    }

    @Test
    @DisplayName("A requested uplift multiple should flag the cells its winning tier waives")
    void shouldFlagWaivedCellsForRequestedMultiple() {
        // Given
        givenSnapshot(List.of(ramp, gpu));
        when(configService.getBoolean(ConfigKey.NO_PRIMARY_FEES_FALLBACK)).thenReturn(false);

        // When
        FeeScheduleDto schedule = feeScheduleService.getFeeSchedule(new BigDecimal("2"));

        // Then
        assertThat(schedule.getUpliftMultiple()).isEqualByComparingTo("2");
        assertThat(schedule.getPrimaryColumns()).isEmpty();
        assertThat(schedule.getOtherColumns()).hasSize(2);
        assertThat(schedule.getRows().get(0).getCells()).extracting(FeeCellDto::getWaived).containsExactly(true, false);
        verify(configService, never()).getDecimal(ConfigKey.SCHEDULE_UPLIFT_MULTIPLE);
    }

    private void givenSnapshot(List<FeeRuleInfo> rules) {
        AircraftContext b737 = new AircraftContext(1L, 1L, new BigDecimal("100"));
        when(snapshotService.load()).thenReturn(new FeeEngineSnapshot(List.of(b737), rules, List.of(), List.of(gold)));
        when(nameLookupService.aircraftTypeName(1L)).thenReturn("B737");
        when(nameLookupService.classificationName(1L)).thenReturn("Narrow Body");
    }
}
