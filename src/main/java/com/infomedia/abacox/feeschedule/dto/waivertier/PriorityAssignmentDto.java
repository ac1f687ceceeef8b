package com.infomedia.abacox.feeschedule.dto.waivertier;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PriorityAssignmentDto {
    private Long tierId;
    private Integer previousPriority;
    private Integer newPriority;
}
