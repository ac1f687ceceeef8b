package com.infomedia.abacox.feeschedule.component.feeengine;

public enum PricingMode {
    STANDARD,
    CAA
}
