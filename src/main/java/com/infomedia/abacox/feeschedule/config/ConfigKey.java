package com.infomedia.abacox.feeschedule.config;

import lombok.Getter;

import java.util.List;
import java.util.stream.Stream;

/**
 * Runtime business settings stored in the database. Each key holds its default value so the
 * application can always run against an empty config table.
 */
@Getter
public enum ConfigKey {

    // --- Fee calculation ---
    TAX_RATE("0.08", true),

    // --- Fee schedule ---
    NO_PRIMARY_FEES_FALLBACK("true", true),
    SCHEDULE_UPLIFT_MULTIPLE("1.0", true);

    private final String defaultValue;
    private final boolean isPublic;

    ConfigKey(String defaultValue, boolean isPublic) {
        this.defaultValue = defaultValue;
        this.isPublic = isPublic;
    }

    public static List<ConfigKey> getPublicKeys() {
        return Stream.of(values())
                .filter(ConfigKey::isPublic)
                .toList();
    }

    /**
     * UPPER_SNAKE_CASE name as lowerCamelCase, e.g. TAX_RATE becomes taxRate.
     */
    public String getKey() {
        String[] parts = this.name().toLowerCase().split("_");
        StringBuilder camelCase = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            camelCase.append(Character.toUpperCase(part.charAt(0)))
                    .append(part.substring(1));
        }
        return camelCase.toString();
    }
}
