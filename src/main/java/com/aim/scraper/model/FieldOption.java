package com.aim.scraper.model;

/**
 * One {@code <option>} of a select field, or one input of a checkbox/radio
 * group sharing a name.
 *
 * @param value    submitted value
 * @param selected whether the option is {@code selected} (or the input {@code checked})
 * @param label    label text of a checkbox/radio input, empty for select options
 */
public record FieldOption(String value, boolean selected, String label) {

    public FieldOption {
        value = value == null ? "" : value;
        label = label == null ? "" : label;
    }

    public FieldOption(final String value, final boolean selected) {
        this(value, selected, "");
    }

    /** Value a checkbox/radio input submits when ticked. */
    public String checkedValue() {
        return value.isEmpty() ? "on" : value;
    }
}
