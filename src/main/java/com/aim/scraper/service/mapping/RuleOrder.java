package com.aim.scraper.service.mapping;

/**
 * Slots of the built-in rules. Gaps leave room for page-specific rules.
 */
public final class RuleOrder {

    public static final int TEMPERATURE = 100;
    public static final int HUMIDITY = 200;
    public static final int WATER_MODE = 250;
    public static final int EXACT_SPECIES = 300;
    public static final int TEXTAREA_SPECIES = 400;
    public static final int GENERIC_SPECIES = 500;
    public static final int SOLIDS = 600;
    public static final int SUBMIT = 700;

    private RuleOrder() {
    }
}
