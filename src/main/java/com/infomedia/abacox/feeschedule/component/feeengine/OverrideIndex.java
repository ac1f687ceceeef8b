package com.infomedia.abacox.feeschedule.component.feeengine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of overrides by (scope, fee rule). Each key holds at most one override;
 * duplicates are rejected when the index is built.
 */
public final class OverrideIndex {

    private static final OverrideIndex EMPTY = new OverrideIndex(Collections.emptyMap(), Collections.emptyMap());

    private record ScopeKey(Long scopeId, Long feeRuleId) {
    }

    private final Map<ScopeKey, FeeRuleOverrideInfo> aircraftOverrides;
    private final Map<ScopeKey, FeeRuleOverrideInfo> classificationOverrides;

    private OverrideIndex(Map<ScopeKey, FeeRuleOverrideInfo> aircraftOverrides,
                          Map<ScopeKey, FeeRuleOverrideInfo> classificationOverrides) {
        this.aircraftOverrides = aircraftOverrides;
        this.classificationOverrides = classificationOverrides;
    }

    public static OverrideIndex empty() {
        return EMPTY;
    }

    public static OverrideIndex of(Collection<FeeRuleOverrideInfo> overrides) {
        Map<ScopeKey, FeeRuleOverrideInfo> byAircraft = new LinkedHashMap<>();
        Map<ScopeKey, FeeRuleOverrideInfo> byClassification = new LinkedHashMap<>();
        for (FeeRuleOverrideInfo override : overrides) {
            Map<ScopeKey, FeeRuleOverrideInfo> target = override.isAircraftScoped() ? byAircraft : byClassification;
            ScopeKey key = new ScopeKey(override.scopeId(), override.feeRuleId());
            if (target.putIfAbsent(key, override) != null) {
                throw new AmbiguousOverrideException("Duplicate " + (override.isAircraftScoped() ? "aircraft" : "classification")
                        + " override for scope " + key.scopeId() + " and fee rule " + key.feeRuleId());
            }
        }
        return new OverrideIndex(Collections.unmodifiableMap(byAircraft), Collections.unmodifiableMap(byClassification));
    }

    public Optional<FeeRuleOverrideInfo> findAircraftOverride(Long aircraftTypeId, Long feeRuleId) {
        return Optional.ofNullable(aircraftOverrides.get(new ScopeKey(aircraftTypeId, feeRuleId)));
    }

    public Optional<FeeRuleOverrideInfo> findClassificationOverride(Long classificationId, Long feeRuleId) {
        return Optional.ofNullable(classificationOverrides.get(new ScopeKey(classificationId, feeRuleId)));
    }

    /**
     * Copy of this index with the given override inserted, replacing the one on the same key.
     */
    public OverrideIndex with(FeeRuleOverrideInfo override) {
        List<FeeRuleOverrideInfo> all = new ArrayList<>(all());
        all.removeIf(existing -> existing.isAircraftScoped() == override.isAircraftScoped()
                && existing.scopeId().equals(override.scopeId())
                && existing.feeRuleId().equals(override.feeRuleId()));
        all.add(override);
        return of(all);
    }

    public OverrideIndex withoutAircraftOverride(Long aircraftTypeId, Long feeRuleId) {
        List<FeeRuleOverrideInfo> all = new ArrayList<>(all());
        all.removeIf(existing -> existing.isAircraftScoped()
                && existing.aircraftTypeId().equals(aircraftTypeId)
                && existing.feeRuleId().equals(feeRuleId));
        return of(all);
    }

    public List<FeeRuleOverrideInfo> all() {
        List<FeeRuleOverrideInfo> all = new ArrayList<>(aircraftOverrides.size() + classificationOverrides.size());
        all.addAll(classificationOverrides.values());
        all.addAll(aircraftOverrides.values());
        return all;
    }

    public int size() {
        return aircraftOverrides.size() + classificationOverrides.size();
    }
}
