package com.aim.scraper.service.http;

import com.aim.scraper.config.AimProperties;
import com.aim.scraper.model.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Opens HTTP sessions against the model page and submits payloads.
 * <p>
 * Stateless: every run gets its own {@link AimSession}, which is what keeps
 * cookies of concurrent runs apart.
 * </p>
 */
@Slf4j
@Service
public class SubmissionClient {

    private final WebClient.Builder builder;

    private final AimProperties props;

    public SubmissionClient(final WebClient.Builder builder, final AimProperties props) {
        this.builder = builder;
        this.props = props;
    }

    /**
     * @param pageUrl page hosting the form; GET target and submission {@code Referer}
     * @return a fresh session with an empty cookie jar
     */
    public AimSession openSession(final URI pageUrl) {
        return new AimSession(pageUrl, builder, props.getUserAgent());
    }

    /**
     * Posts the payload and returns the raw response body.
     *
     * @throws NetworkException on timeout, connection failure or non-2xx status
     */
    public String submit(final AimSession session, final URI actionUrl,
                         final Payload payload, final Duration timeout) {
        log.debug("Submitting {} fields to {}", payload.size(), actionUrl);
        String body = session.postForm(actionUrl, payload, timeout);
        log.debug("Received {} chars from {}", body.length(), actionUrl);
        return body;
    }
}
