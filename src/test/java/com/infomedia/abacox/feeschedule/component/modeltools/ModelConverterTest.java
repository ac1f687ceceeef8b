package com.infomedia.abacox.feeschedule.component.modeltools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeCell;
import com.infomedia.abacox.feeschedule.component.feeengine.PriorityAssignment;
import com.infomedia.abacox.feeschedule.component.feeengine.SourceScope;
import com.infomedia.abacox.feeschedule.db.entity.WaiverTier;
import com.infomedia.abacox.feeschedule.dto.configuration.ConfigurationDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeCellDto;
import com.infomedia.abacox.feeschedule.dto.waivertier.PriorityAssignmentDto;
import com.infomedia.abacox.feeschedule.dto.waivertier.WaiverTierDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModelConverterTest {

    private final ModelConverter modelConverter = new ModelConverter(new ObjectMapper());

    @Test
    @DisplayName("Should map a schedule cell with both pricing chains")
    void shouldMapFeeCell() {
        // Given
        FeeCell cell = new FeeCell(7L, "RAMP",
                new BigDecimal("90.00"), true, SourceScope.AIRCRAFT, new BigDecimal("80.00"),
                new BigDecimal("80.00"), new BigDecimal("100.00"),
                new BigDecimal("60.00"), false, SourceScope.GLOBAL, new BigDecimal("60.00"),
                new BigDecimal("60.00"), new BigDecimal("60.00"),
                true, false);

        // When
        FeeCellDto dto = modelConverter.map(cell, FeeCellDto.class);

        // Then
        assertThat(dto.getFeeRuleId()).isEqualTo(7L);
        assertThat(dto.getFeeCode()).isEqualTo("RAMP");
        assertThat(dto.getFinalDisplayValue()).isEqualByComparingTo("90.00");
        assertThat(dto.getAircraftOverride()).isTrue();
        assertThat(dto.getSourceScope()).isEqualTo(SourceScope.AIRCRAFT);
        assertThat(dto.getRevertToValue()).isEqualByComparingTo("80.00");
        assertThat(dto.getGlobalDefault()).isEqualByComparingTo("100.00");
        assertThat(dto.getFinalCaaDisplayValue()).isEqualByComparingTo("60.00");
        assertThat(dto.getCaaSourceScope()).isEqualTo(SourceScope.GLOBAL);
        assertThat(dto.getWaived()).isTrue();
        assertThat(dto.getCaaWaived()).isFalse();
    }

    @Test
    @DisplayName("Should map reorder results in order")
    void shouldMapPriorityAssignments() {
        // When
        List<PriorityAssignmentDto> dtos = modelConverter.mapList(
                List.of(new PriorityAssignment(3L, 1, 2), new PriorityAssignment(1L, 2, 1)),
                PriorityAssignmentDto.class);

        // Then
        assertThat(dtos).containsExactly(new PriorityAssignmentDto(3L, 1, 2), new PriorityAssignmentDto(1L, 2, 1));
    }

    @Test
    @DisplayName("Should map entities by matching field names")
    void shouldMapEntity() {
        // Given
        WaiverTier tier = WaiverTier.builder()
                .id(4L)
                .name("Gold")
                .fuelUpliftMultiplier(new BigDecimal("2.50"))
                .feesWaivedCodes(List.of("RAMP", "GPU"))
                .tierPriority(3)
                .caaSpecificTier(true)
                .version(2L)
                .build();

        // When
        WaiverTierDto dto = modelConverter.map(tier, WaiverTierDto.class);

        // Then
        assertThat(dto.getId()).isEqualTo(4L);
        assertThat(dto.getName()).isEqualTo("Gold");
        assertThat(dto.getTierPriority()).isEqualTo(3);
        assertThat(dto.getFeesWaivedCodes()).containsExactly("RAMP", "GPU");
    }

    @Test
    @DisplayName("Stored configuration strings should be read into typed values")
    void shouldReadConfigurationFromMap() {
        // When
        ConfigurationDto dto = modelConverter.fromMap(
                Map.of("taxRate", "0.08", "noPrimaryFeesFallback", "true", "scheduleUpliftMultiple", "1.0"),
                ConfigurationDto.class);

        // Then
        assertThat(dto.getTaxRate()).isEqualByComparingTo("0.08");
        assertThat(dto.getNoPrimaryFeesFallback()).isTrue();
        assertThat(dto.getScheduleUpliftMultiple()).isEqualByComparingTo("1.0");
    }
}
