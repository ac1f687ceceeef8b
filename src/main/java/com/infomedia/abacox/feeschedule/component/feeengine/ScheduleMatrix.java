package com.infomedia.abacox.feeschedule.component.feeengine;

import java.util.List;
import java.util.Optional;

public record ScheduleMatrix(List<AircraftScheduleRow> rows, WaiverScenario waiverScenario) {

    public ScheduleMatrix {
        rows = List.copyOf(rows);
    }

    public Optional<AircraftScheduleRow> row(Long aircraftTypeId) {
        return rows.stream().filter(r -> r.aircraftTypeId().equals(aircraftTypeId)).findFirst();
    }

    public Optional<FeeCell> cell(Long aircraftTypeId, Long feeRuleId) {
        return row(aircraftTypeId).flatMap(r -> r.cell(feeRuleId));
    }
}
