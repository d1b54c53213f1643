package com.aim.scraper.service.core;

import com.aim.scraper.model.ParsedResult;
import com.aim.scraper.model.SubmissionParameters;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Defines the single operation a presentation layer needs: run the remote
 * model with the given inputs and get a structured result back.
 * <p>
 * Implementations are synchronous and keep no state between calls, so the
 * caller decides on threading. Each call performs at most two blocking
 * network requests.
 * </p>
 */
public interface ModelRunService {

    /**
     * Runs the model.
     *
     * @param params  run inputs
     * @param timeout timeout of each network call
     * @return the parsed result, never {@code null}; a result without
     *     recognisable structure carries a raw excerpt
     * @throws com.aim.scraper.service.http.NetworkException
     *     if the page cannot be fetched or the submission fails
     */
    ParsedResult run(SubmissionParameters params, Duration timeout);

    /**
     * Runs the model with the configured default timeout.
     */
    ParsedResult run(SubmissionParameters params);

    /**
     * Convenience overload taking the inputs one by one.
     */
    default ParsedResult run(final double temperatureK,
                             final double relativeHumidity,
                             final Map<String, Double> species,
                             final Set<String> solids,
                             final Duration timeout) {
        return run(new SubmissionParameters(temperatureK, relativeHumidity, species, solids), timeout);
    }
}
