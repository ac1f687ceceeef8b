package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record AircraftScheduleRow(Long aircraftTypeId,
                                  Long classificationId,
                                  BigDecimal baseMinFuelGallonsForWaiver,
                                  List<FeeCell> cells) {

    public AircraftScheduleRow {
        cells = List.copyOf(cells);
    }

    public Optional<FeeCell> cell(Long feeRuleId) {
        return cells.stream().filter(c -> c.feeRuleId().equals(feeRuleId)).findFirst();
    }
}
