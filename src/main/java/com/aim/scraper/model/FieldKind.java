package com.aim.scraper.model;

import java.util.Locale;

/**
 * Kind of an addressable form control.
 */
public enum FieldKind {
    TEXT,
    TEXTAREA,
    SELECT,
    CHECKBOX,
    RADIO;

    /**
     * @return {@code true} for controls that only submit a value when checked
     */
    public boolean isCheckable() {
        return this == CHECKBOX || this == RADIO;
    }

    /**
     * Maps an {@code <input type=...>} attribute to a kind. Anything that is
     * not a checkbox or radio button (hidden, number, email, ...) is text-like.
     *
     * @param inputType raw type attribute, may be blank
     * @return matching kind, never {@code null}
     */
    public static FieldKind fromInputType(final String inputType) {
        String type = inputType == null ? "" : inputType.trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "checkbox" -> CHECKBOX;
            case "radio" -> RADIO;
            default -> TEXT;
        };
    }
}
