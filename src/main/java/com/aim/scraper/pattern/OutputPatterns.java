package com.aim.scraper.pattern;

import java.util.regex.Pattern;

/**
 * Named patterns applied to the plain-text output of the AIM model.
 * <p>
 * The output mixes summary lines ({@code Total Gibbs Free Energy = -123.456},
 * {@code pH = 4.56}) with a table of {@code <name> <number>} rows. Scalar
 * patterns are multi-line and case-insensitive and capture the numeric part in
 * group 1; the tabular pattern is meant for {@link java.util.regex.Matcher#matches()}
 * on a single trimmed line and captures the name in group 1 and the number in
 * group 2.
 * </p>
 */
public final class OutputPatterns {

    /** {@code total gibbs <anything but ':' or '='> [:=] <number>}. */
    public static final Pattern TOTAL_GIBBS = Pattern.compile(
            "(?im)total\\s+gibbs[^:=\\n]*[:=]\\s*(" + NumberPattern.REGEX + ")");

    /** A standalone {@code ph} token followed by {@code [:=] <number>}. */
    public static final Pattern PH = Pattern.compile(
            "(?im)\\bph\\b[^:=\\n]*[:=]\\s*(" + NumberPattern.REGEX + ")");

    /** Strict full-line {@code <name><whitespace><number>}; trailing tokens do not match. */
    public static final Pattern TABULAR_LINE = Pattern.compile(
            "([A-Za-z0-9_+\\-()\\[\\]/]+)\\s+(" + NumberPattern.REGEX + ")");

    private OutputPatterns() {
    }
}
