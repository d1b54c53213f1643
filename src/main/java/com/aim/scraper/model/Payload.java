package com.aim.scraper.model;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered name/value set posted to the remote form.
 * <p>
 * Insertion order is kept so the request body lists fields the way the page
 * declared them, followed by anything the mapping rules appended.
 * </p>
 */
public final class Payload {

    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * Sets or overwrites a field value.
     */
    public Payload put(final String name, final String value) {
        values.put(Objects.requireNonNull(name, "name"), value == null ? "" : value);
        return this;
    }

    public Optional<String> get(final String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    /** Snapshot of the current names, safe to iterate while the payload is modified. */
    public List<String> names() {
        return new ArrayList<>(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Form representation for {@code application/x-www-form-urlencoded} bodies. */
    public MultiValueMap<String, String> toFormData() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        values.forEach(form::add);
        return form;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload" + values;
    }
}
