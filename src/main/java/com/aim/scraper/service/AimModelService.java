package com.aim.scraper.service;

import com.aim.scraper.config.AimProperties;
import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.ParsedResult;
import com.aim.scraper.model.Payload;
import com.aim.scraper.model.SubmissionParameters;
import com.aim.scraper.parser.ResponseParser;
import com.aim.scraper.service.core.ModelRunService;
import com.aim.scraper.service.discovery.FormDiscovery;
import com.aim.scraper.service.http.AimSession;
import com.aim.scraper.service.http.SubmissionClient;
import com.aim.scraper.service.mapping.FieldMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * <h2>AimModelService</h2>
 *
 * <p>Runs the AIM model through its web form:</p>
 * <ol>
 *   <li>open a fresh session and GET the model page,</li>
 *   <li>map the inputs onto the discovered form (or build the generic
 *       payload when the page has no form),</li>
 *   <li>POST the payload to the form action (or back to the page),</li>
 *   <li>parse the text output.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AimModelService implements ModelRunService {

    private final AimProperties props;

    private final SubmissionClient submissionClient;

    private final FormDiscovery formDiscovery;

    private final FieldMapper fieldMapper;

    private final ResponseParser responseParser;

    @Override
    public ParsedResult run(final SubmissionParameters params) {
        return run(params, props.getTimeout());
    }

    @Override
    public ParsedResult run(final SubmissionParameters params, final Duration timeout) {
        Objects.requireNonNull(params, "params");
        Duration effective = timeout != null ? timeout : props.getTimeout();
        URI pageUrl = props.pageUri();

        AimSession session = submissionClient.openSession(pageUrl);
        Optional<FormSkeleton> skeleton = formDiscovery.discover(session, effective);

        Payload payload = skeleton
                .map(s -> fieldMapper.map(s, params))
                .orElseGet(() -> fieldMapper.fallbackPayload(params));
        URI target = skeleton.map(FormSkeleton::actionUrl).orElse(pageUrl);

        String body = submissionClient.submit(session, target, payload, effective);
        ParsedResult result = responseParser.parse(body);
        log.info("Model run at T={} K, RH={} finished: {}",
                params.temperatureK(), params.relativeHumidity(), result);
        return result;
    }
}
