package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.config.ConfigKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ConfigService {

    private final ConfigManagerService configManagerService;

    public Map<String, Object> getPublicConfiguration() {
        Map<String, String> publicKeysAndDefaults = ConfigKey.getPublicKeys().stream()
                .collect(Collectors.toMap(ConfigKey::getKey, ConfigKey::getDefaultValue));
        return configManagerService.getConfigurationByKeys(publicKeysAndDefaults);
    }

    /**
     * Writes the public keys present in {@code newConfig}. Unknown keys and null values are ignored.
     */
    public void updatePublicConfiguration(Map<String, Object> newConfig) {
        List<String> publicKeys = ConfigKey.getPublicKeys().stream().map(ConfigKey::getKey).toList();

        Map<String, String> filteredConfig = new HashMap<>();
        newConfig.forEach((key, value) -> {
            if (publicKeys.contains(key) && value != null) {
                filteredConfig.put(key, value.toString());
            }
        });

        configManagerService.updateConfiguration(filteredConfig);
    }

    public String getValue(ConfigKey configKey) {
        return configManagerService.getValue(configKey.getKey(), configKey.getDefaultValue());
    }

    public BigDecimal getDecimal(ConfigKey configKey) {
        String value = getValue(configKey);
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFeeConfigurationException("Configuration '" + configKey.getKey()
                    + "' is not a decimal number: " + value, e);
        }
    }

    public boolean getBoolean(ConfigKey configKey) {
        return Boolean.parseBoolean(getValue(configKey).trim());
    }
}
