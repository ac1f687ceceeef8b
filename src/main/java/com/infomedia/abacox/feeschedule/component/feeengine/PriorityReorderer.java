package com.infomedia.abacox.feeschedule.component.feeengine;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a drag-and-drop ordering of waiver tiers into a batch of dense priority values.
 * <p>
 * The first id of {@code newOrder} receives {@code newOrder.size()}, the last receives 1. The batch is
 * computed as a whole and rejected as a whole: it is returned only when every tier of the resulting
 * set, listed or not, ends up with a distinct priority.
 */
@Component
@Log4j2
public class PriorityReorderer {

    public List<PriorityAssignment> reorder(Collection<WaiverTierInfo> tiers, List<Long> newOrder) {
        Objects.requireNonNull(tiers, "tiers");
        Objects.requireNonNull(newOrder, "newOrder");

        Map<Long, WaiverTierInfo> byId = new LinkedHashMap<>();
        for (WaiverTierInfo tier : tiers) {
            byId.put(tier.id(), tier);
        }

        Set<Long> seen = new HashSet<>();
        for (Long tierId : newOrder) {
            if (tierId == null) {
                throw new InvalidReorderException("Tier order contains a null id");
            }
            if (!byId.containsKey(tierId)) {
                throw new InvalidReorderException("Unknown waiver tier " + tierId);
            }
            if (!seen.add(tierId)) {
                throw new InvalidReorderException("Waiver tier " + tierId + " appears more than once");
            }
        }

        int size = newOrder.size();
        List<PriorityAssignment> assignments = new ArrayList<>(size);
        Map<Long, Integer> resulting = new HashMap<>();
        byId.values().forEach(t -> resulting.put(t.id(), t.tierPriority()));
        for (int index = 0; index < size; index++) {
            Long tierId = newOrder.get(index);
            int newPriority = size - index;
            assignments.add(new PriorityAssignment(tierId, byId.get(tierId).tierPriority(), newPriority));
            resulting.put(tierId, newPriority);
        }

        Set<Integer> distinct = new HashSet<>(resulting.values());
        if (distinct.size() != resulting.size()) {
            throw new InvalidReorderException("Reordering " + size + " of " + byId.size()
                    + " tiers would leave duplicate priorities; send the complete tier order");
        }

        log.debug("Computed {} priority assignments for {} tiers", assignments.size(), byId.size());
        return assignments;
    }

    /**
     * Tiers with the batch applied, highest priority first.
     */
    public List<WaiverTierInfo> apply(Collection<WaiverTierInfo> tiers, List<PriorityAssignment> assignments) {
        Map<Long, Integer> newPriorities = new HashMap<>();
        assignments.forEach(a -> newPriorities.put(a.tierId(), a.newPriority()));
        List<WaiverTierInfo> updated = new ArrayList<>(tiers.size());
        for (WaiverTierInfo tier : tiers) {
            Integer priority = newPriorities.get(tier.id());
            updated.add(priority == null ? tier : tier.toBuilder().tierPriority(priority).build());
        }
        return WaiverEvaluator.orderByPriority(updated);
    }
}
