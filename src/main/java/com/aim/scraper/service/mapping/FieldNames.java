package com.aim.scraper.service.mapping;

import org.apache.commons.lang3.StringUtils;

/**
 * Name predicates shared by the mapping rules. All matching is
 * case-insensitive.
 */
public final class FieldNames {

    private static final String[] TEMPERATURE_FRAGMENTS = {"temp", "temperature", "t_"};

    private static final String[] HUMIDITY_FRAGMENTS = {"rh", "humid", "relative"};

    private FieldNames() {
    }

    public static boolean isTemperature(final String name) {
        return StringUtils.containsAnyIgnoreCase(name, TEMPERATURE_FRAGMENTS)
                || "t".equalsIgnoreCase(name);
    }

    public static boolean isHumidity(final String name) {
        return StringUtils.containsAnyIgnoreCase(name, HUMIDITY_FRAGMENTS);
    }

    public static boolean containsAny(final String name, final String... fragments) {
        return StringUtils.containsAnyIgnoreCase(name, fragments);
    }
}
