package com.aim.scraper.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An addressable control of a discovered form.
 *
 * @param name         submission name, unique within a {@link FormSkeleton}
 * @param kind         control kind
 * @param defaultValue value the page pre-fills; for checkbox/radio fields the
 *                     declared value submitted when checked ({@code "on"} if
 *                     the page declares none)
 * @param options      select options in document order; for checkbox/radio
 *                     fields the inputs sharing this name, one per input
 * @param checked      checked state for checkbox/radio fields
 * @param labelText    text of the associated {@code <label>}, empty if none
 */
public record FormField(
        String name,
        FieldKind kind,
        String defaultValue,
        List<FieldOption> options,
        boolean checked,
        String labelText
) {

    public FormField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        defaultValue = defaultValue == null ? "" : defaultValue;
        options = options == null ? List.of() : List.copyOf(options);
        labelText = labelText == null ? "" : labelText;
    }

    public static FormField text(final String name, final String value) {
        return new FormField(name, FieldKind.TEXT, value, List.of(), false, "");
    }

    public static FormField textarea(final String name, final String value) {
        return new FormField(name, FieldKind.TEXTAREA, value, List.of(), false, "");
    }

    public static FormField checkbox(final String name, final String value,
                                     final boolean checked, final String labelText) {
        return new FormField(name, FieldKind.CHECKBOX, value, List.of(), checked, labelText);
    }

    /**
     * Value this field contributes to a freshly seeded payload. Unchecked
     * checkbox/radio fields contribute nothing.
     */
    public Optional<String> seedValue() {
        if (kind.isCheckable() && !checked) {
            return Optional.empty();
        }
        return Optional.of(defaultValue);
    }

    /** Value submitted when a checkbox/radio field is ticked. */
    public String checkedValue() {
        return defaultValue.isEmpty() ? "on" : defaultValue;
    }

    /**
     * Inputs of a checkbox/radio group in document order. A field built
     * without group members stands for its single input.
     *
     * @return the members, empty for non-checkable kinds
     */
    public List<FieldOption> members() {
        if (!kind.isCheckable()) {
            return List.of();
        }
        return options.isEmpty() ? List.of(new FieldOption(defaultValue, checked, labelText)) : options;
    }
}
