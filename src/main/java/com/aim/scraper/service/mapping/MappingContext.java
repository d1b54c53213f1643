package com.aim.scraper.service.mapping;

import com.aim.scraper.model.FormField;
import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.Payload;
import com.aim.scraper.model.SubmissionParameters;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable state threaded through one pass of the rule chain.
 */
@Getter
public class MappingContext {

    private final FormSkeleton skeleton;

    private final SubmissionParameters params;

    private final Payload payload;

    private final Set<String> placedSpecies = new LinkedHashSet<>();

    /**
     * Seeds the payload with every field's current default. Unchecked
     * checkbox/radio fields are left out.
     */
    public MappingContext(final FormSkeleton skeleton, final SubmissionParameters params) {
        this.skeleton = skeleton;
        this.params = params;
        this.payload = new Payload();
        for (FormField field : skeleton.fields()) {
            field.seedValue().ifPresent(v -> payload.put(field.name(), v));
        }
    }

    public Set<String> getPlacedSpecies() {
        return Collections.unmodifiableSet(placedSpecies);
    }

    public void markPlaced(final String speciesLabel) {
        placedSpecies.add(speciesLabel);
    }

    public void markAllPlaced() {
        placedSpecies.addAll(params.species().keySet());
    }

    public boolean nothingPlaced() {
        return placedSpecies.isEmpty();
    }

    /**
     * @return {@code "<label> <value>"} lines for all species, newline-joined,
     * in the caller's order
     */
    public String speciesBlock() {
        return params.species().entrySet().stream()
                .map(e -> e.getKey() + " " + DecimalText.of(e.getValue()))
                .collect(Collectors.joining("\n"));
    }

    public Map<String, Double> species() {
        return params.species();
    }
}
