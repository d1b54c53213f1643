package com.aim.scraper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Semantic inputs of one model run.
 * <p>
 * The relative humidity is a fraction; its admissible range is checked by the
 * caller, not here. Species keep the caller's iteration order, which is the
 * order species lines are written when they end up in a single block field.
 * A {@code null} solids set means "no solids requested".
 * </p>
 *
 * @param temperatureK     temperature in Kelvin, strictly positive
 * @param relativeHumidity relative humidity as a fraction
 * @param species          species label to concentration, labels case-sensitive
 * @param solids           solid-phase labels to include, never {@code null} after construction
 */
public record SubmissionParameters(
        double temperatureK,
        double relativeHumidity,
        Map<String, Double> species,
        Set<String> solids
) {

    public SubmissionParameters {
        if (!(temperatureK > 0) || Double.isInfinite(temperatureK)) {
            throw new IllegalArgumentException("temperatureK must be a positive finite number: " + temperatureK);
        }
        if (!Double.isFinite(relativeHumidity)) {
            throw new IllegalArgumentException("relativeHumidity must be finite: " + relativeHumidity);
        }
        Map<String, Double> speciesCopy = new LinkedHashMap<>();
        if (species != null) {
            species.forEach((label, value) -> {
                if (label == null || value == null || !Double.isFinite(value)) {
                    throw new IllegalArgumentException("Invalid species entry " + label + "=" + value);
                }
                speciesCopy.put(label, value);
            });
        }
        species = Collections.unmodifiableMap(speciesCopy);
        solids = solids == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(solids));
    }

    public SubmissionParameters(final double temperatureK,
                                final double relativeHumidity,
                                final Map<String, Double> species) {
        this(temperatureK, relativeHumidity, species, Set.of());
    }
}
