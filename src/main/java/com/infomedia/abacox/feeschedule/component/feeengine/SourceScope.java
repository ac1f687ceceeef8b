package com.infomedia.abacox.feeschedule.component.feeengine;

/**
 * Scope that supplied a resolved fee amount, from most to least specific.
 */
public enum SourceScope {
    AIRCRAFT,
    CLASSIFICATION,
    GLOBAL
}
