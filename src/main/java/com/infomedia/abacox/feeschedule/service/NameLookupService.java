package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.lookupcache.ReadThroughCache;
import com.infomedia.abacox.feeschedule.db.entity.AircraftClassification;
import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import com.infomedia.abacox.feeschedule.db.repository.AircraftClassificationRepository;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Display names of aircraft types and classifications for the fee schedule. Services that rename
 * or delete these entities evict the affected key.
 */
@Service
public class NameLookupService {

    private final ReadThroughCache<Long, String> aircraftTypeNames;
    private final ReadThroughCache<Long, String> classificationNames;

    public NameLookupService(AircraftTypeRepository aircraftTypeRepository,
                             AircraftClassificationRepository classificationRepository,
                             Clock clock,
                             @Value("${feeschedule.lookup-cache.ttl-seconds:300}") long ttlSeconds,
                             @Value("${feeschedule.lookup-cache.max-size:5000}") long maxSize) {
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        this.aircraftTypeNames = new ReadThroughCache<>("aircraftTypeNames",
                id -> aircraftTypeRepository.findById(id).map(AircraftType::getName).orElse(null),
                ttl, maxSize, clock);
        this.classificationNames = new ReadThroughCache<>("classificationNames",
                id -> classificationRepository.findById(id).map(AircraftClassification::getName).orElse(null),
                ttl, maxSize, clock);
    }

    public String aircraftTypeName(Long aircraftTypeId) {
        return aircraftTypeNames.get(aircraftTypeId).orElse(null);
    }

    public String classificationName(Long classificationId) {
        return classificationNames.get(classificationId).orElse(null);
    }

    public void evictAircraftType(Long aircraftTypeId) {
        aircraftTypeNames.invalidate(aircraftTypeId);
    }

    public void evictClassification(Long classificationId) {
        classificationNames.invalidate(classificationId);
    }
}
