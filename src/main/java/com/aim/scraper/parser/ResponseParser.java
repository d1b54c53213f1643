package com.aim.scraper.parser;

import com.aim.scraper.config.AimProperties;
import com.aim.scraper.model.ParsedResult;
import com.aim.scraper.pattern.NumberPattern;
import com.aim.scraper.pattern.OutputPatterns;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the AIM model's text output out of a result page.
 * <p>
 * The model prints its results as plain text, normally inside a
 * {@code <pre>} block: a few {@code label = value} summary lines followed by
 * one {@code <species> <molality>} line per species. Parsing never fails; when
 * nothing is recognised the result carries a {@code raw} excerpt instead.
 * </p>
 */
@Slf4j
@Component
public class ResponseParser {

    public static final int DEFAULT_RAW_EXCERPT_LIMIT = 2000;

    private final int rawExcerptLimit;

    public ResponseParser() {
        this(DEFAULT_RAW_EXCERPT_LIMIT);
    }

    @Autowired
    public ResponseParser(final AimProperties props) {
        this(props.getRawExcerptLimit());
    }

    ResponseParser(final int rawExcerptLimit) {
        this.rawExcerptLimit = rawExcerptLimit;
    }

    /**
     * @param html response body, may be {@code null} or empty
     * @return the parsed result, never {@code null}
     */
    public ParsedResult parse(final String html) {
        return parseText(extractText(html));
    }

    /**
     * Text of the first {@code <pre>} block, or the visible page text (one
     * text node per line) when there is none.
     */
    public String extractText(final String html) {
        if (StringUtils.isEmpty(html)) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        Element pre = doc.selectFirst("pre");
        if (pre != null) {
            return pre.wholeText();
        }
        StringJoiner text = new StringJoiner("\n");
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                text.add(((TextNode) node).getWholeText());
            }
        }, doc.body());
        return text.toString();
    }

    /**
     * Extracts scalars and the molarity table from already extracted text.
     */
    public ParsedResult parseText(final String text) {
        String txt = text == null ? "" : text;

        Map<String, Object> scalars = new LinkedHashMap<>();
        findScalar(OutputPatterns.TOTAL_GIBBS, txt)
                .ifPresent(v -> scalars.put(ParsedResult.TOTAL_GIBBS_FREE_ENERGY, v));
        findScalar(OutputPatterns.PH, txt)
                .ifPresent(v -> scalars.put(ParsedResult.PH, v));

        Map<String, Double> molarities = new LinkedHashMap<>();
        for (String line : txt.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher m = OutputPatterns.TABULAR_LINE.matcher(trimmed);
            if (m.matches()) {
                NumberPattern.parse(m.group(2)).ifPresent(v -> molarities.put(m.group(1), v));
            }
        }

        if (scalars.isEmpty() && molarities.isEmpty()) {
            log.info("No structured values in {} chars of output, keeping raw excerpt", txt.length());
            return ParsedResult.raw(excerpt(txt));
        }
        log.debug("Parsed {} scalars and {} molarities", scalars.size(), molarities.size());
        return ParsedResult.structured(scalars, molarities);
    }

    /** Leading part of the text, never ending in half a surrogate pair. */
    private String excerpt(final String txt) {
        if (txt.length() <= rawExcerptLimit) {
            return txt;
        }
        int end = rawExcerptLimit;
        if (Character.isHighSurrogate(txt.charAt(end - 1))) {
            end--;
        }
        return txt.substring(0, end);
    }

    /** Numeric capture as {@link Double}, or verbatim when it does not parse. */
    private static Optional<Object> findScalar(final Pattern pattern, final String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        String captured = m.group(1);
        return Optional.of(NumberPattern.parse(captured).<Object>map(d -> d).orElse(captured));
    }
}
