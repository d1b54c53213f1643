package com.aim.scraper.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structure of a discovered HTML form: where to post and which fields exist.
 *
 * @param actionUrl      absolute URL the payload is posted to
 * @param fields         addressable fields in document order, names unique
 * @param submitControls submit inputs and buttons in document order
 */
public record FormSkeleton(URI actionUrl, List<FormField> fields, List<SubmitControl> submitControls) {

    public FormSkeleton {
        Objects.requireNonNull(actionUrl, "actionUrl");
        fields = fields == null ? List.of() : List.copyOf(fields);
        submitControls = submitControls == null ? List.of() : List.copyOf(submitControls);
        long distinct = fields.stream().map(FormField::name).distinct().count();
        if (distinct != fields.size()) {
            throw new IllegalArgumentException("Form field names must be unique");
        }
    }

    /**
     * @param name exact field name
     * @return the field with that name, if any
     */
    public Optional<FormField> field(final String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * @param kind wanted kind
     * @return fields of that kind in document order
     */
    public List<FormField> fieldsOfKind(final FieldKind kind) {
        return fields.stream().filter(f -> f.kind() == kind).toList();
    }
}
