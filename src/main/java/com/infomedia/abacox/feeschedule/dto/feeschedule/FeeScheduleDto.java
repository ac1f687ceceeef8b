package com.infomedia.abacox.feeschedule.dto.feeschedule;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FeeScheduleDto {
    @Schema(description = "fuel uplift used to flag waived cells, as a multiple of each aircraft's minimum fuel", example = "1.0")
    private BigDecimal upliftMultiple;
    @Schema(description = "true when no rule is flagged primary and every rule is shown as a primary column")
    private Boolean primaryFallbackApplied;
    private List<FeeRuleColumnDto> primaryColumns;
    private List<FeeRuleColumnDto> otherColumns;
    private List<AircraftFeeRowDto> rows;
}
