package com.aim.scraper.dto;

import com.aim.scraper.model.SubmissionParameters;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Request payload for one model run.
 * <p>
 * Relative humidity is a fraction; the range mirrors what the model page
 * accepts for RH-driven runs.
 * </p>
 *
 * @param temperatureK     temperature in Kelvin
 * @param relativeHumidity relative humidity, 0.1 to 1.0
 * @param species          species label to amount, e.g. {@code {"H+": 0.2, "SO42-": 0.1}}
 * @param solids           solid phases to include; may be omitted
 * @param timeoutSeconds   per-call timeout; the configured default when omitted
 */
public record ModelRunRequest(
        @NotNull @Positive Double temperatureK,
        @NotNull @DecimalMin("0.1") @DecimalMax("1.0") Double relativeHumidity,
        Map<String, Double> species,
        Set<String> solids,
        @Positive Integer timeoutSeconds
) {

    public SubmissionParameters toParameters() {
        return new SubmissionParameters(temperatureK, relativeHumidity, species, solids);
    }

    /**
     * @return the requested timeout, or {@code null} to use the default
     */
    public Duration timeout() {
        return timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
    }
}
