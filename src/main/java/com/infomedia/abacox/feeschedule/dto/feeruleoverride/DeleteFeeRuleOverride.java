package com.infomedia.abacox.feeschedule.dto.feeruleoverride;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DeleteFeeRuleOverride {
    @NotNull
    private Long feeRuleId;

    private Long classificationId;

    private Long aircraftTypeId;

    private Long expectedVersion;
}
