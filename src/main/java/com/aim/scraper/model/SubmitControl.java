package com.aim.scraper.model;

/**
 * A submit-typed {@code <input>} or a {@code <button>} found inside a form.
 *
 * @param name  submission name, may be empty
 * @param value value attribute, may be empty
 * @param text  visible text of the element, may be empty
 */
public record SubmitControl(String name, String value, String text) {

    public SubmitControl {
        name = name == null ? "" : name;
        value = value == null ? "" : value;
        text = text == null ? "" : text;
    }
}
