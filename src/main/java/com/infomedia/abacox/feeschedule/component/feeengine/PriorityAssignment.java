package com.infomedia.abacox.feeschedule.component.feeengine;

public record PriorityAssignment(Long tierId, int previousPriority, int newPriority) {

    public boolean isChange() {
        return previousPriority != newPriority;
    }
}
