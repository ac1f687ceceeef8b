package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.db.entity.ConfigValue;
import com.infomedia.abacox.feeschedule.db.repository.ConfigValueRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Configuration values stored in the database, served from an in-memory cache.
 * <p>
 * All values are loaded on startup. Reads never touch the database; writes go to the database
 * and the cache in the same call.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class ConfigManagerService {

    private final ConfigValueRepository repository;

    private final Map<String, String> configCache = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeCache() {
        log.info("Initializing configuration cache...");
        repository.findAll().forEach(configValue -> configCache.put(configValue.getKey(), configValue.getValue()));
        log.info("Configuration cache initialized with {} entries.", configCache.size());
    }

    public String getValue(String configKey, String defaultValue) {
        return configCache.getOrDefault(configKey, defaultValue);
    }

    @Transactional
    public void setValue(String configKey, String value) {
        setByKey(configKey, value);
    }

    protected void setByKey(String configKey, String newValue) {
        String oldValue = configCache.get(configKey);
        if (Objects.equals(oldValue, newValue)) {
            return;
        }

        ConfigValue configValue = repository.findByKey(configKey)
                .orElseGet(() -> ConfigValue.builder().key(configKey).build());
        configValue.setValue(newValue);
        repository.save(configValue);

        configCache.put(configKey, newValue);
        log.info("Updated config key '{}' to '{}'.", configKey, newValue);
    }

    public Map<String, Object> getConfigurationByKeys(Map<String, String> keysAndDefaults) {
        return keysAndDefaults.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        entry -> configCache.getOrDefault(entry.getKey(), entry.getValue())
                ));
    }

    @Transactional
    public void updateConfiguration(Map<String, String> configMap) {
        configMap.forEach(this::setByKey);
    }
}
