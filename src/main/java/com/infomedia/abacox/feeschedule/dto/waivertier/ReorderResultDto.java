package com.infomedia.abacox.feeschedule.dto.waivertier;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ReorderResultDto {
    private List<PriorityAssignmentDto> assignments;
    private List<WaiverTierDto> tiers;
}
