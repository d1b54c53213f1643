package com.aim.scraper.service.discovery;

import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.service.http.AimSession;
import com.aim.scraper.service.http.NetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Downloads the model page and describes the form it currently serves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormDiscovery {

    private final FormSkeletonExtractor extractor;

    /**
     * GETs the session's page and extracts its first form.
     *
     * @param session session opened for the model page
     * @param timeout timeout of the GET
     * @return the form skeleton, or empty when the page contains no form
     * @throws NetworkException on timeout, connection failure or non-2xx status
     */
    public Optional<FormSkeleton> discover(final AimSession session, final Duration timeout) {
        String html = session.fetchPage(timeout);
        Document doc = Jsoup.parse(html, session.getPageUrl().toString());

        Optional<FormSkeleton> skeleton = extractor.extract(doc, session.getPageUrl());
        if (skeleton.isEmpty()) {
            log.warn("No <form> on {}; falling back to a generic submission", session.getPageUrl());
        } else {
            log.info("Discovered form with {} fields at {}",
                    skeleton.get().fields().size(), session.getPageUrl());
        }
        return skeleton;
    }
}
