package com.infomedia.abacox.feeschedule.component.feeengine;

public enum CalculationBasis {
    FIXED_PRICE,
    PER_UNIT_SERVICE,
    NOT_APPLICABLE
}
