package com.infomedia.abacox.feeschedule.dto.waivertier;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ReorderWaiverTiers {
    @NotEmpty
    @Schema(description = "tier ids from highest to lowest priority", example = "[3, 1, 2]")
    private List<Long> tierIds;
}
