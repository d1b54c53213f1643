package com.aim.scraper.pattern;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lexical pattern for numeric literals embedded in free text.
 * <p>
 * Accepts an optional sign, digits with an optional fractional part (or a
 * leading-dot decimal such as {@code .5}) and an optional {@code e}/{@code E}
 * exponent with its own optional sign: {@code -123.456}, {@code 1.23E-07},
 * {@code +.5e3}.
 * </p>
 */
public final class NumberPattern {

    /**
     * Raw expression, without anchors or capture groups, so that it can be
     * embedded into larger line patterns.
     */
    public static final String REGEX = "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?";

    /** Compiled form of {@link #REGEX}. */
    public static final Pattern NUMBER = Pattern.compile(REGEX);

    private NumberPattern() {
    }

    /**
     * @param text candidate literal, may be {@code null}
     * @return {@code true} when the whole (trimmed) text is a numeric literal
     */
    public static boolean isNumber(final String text) {
        return text != null && NUMBER.matcher(text.trim()).matches();
    }

    /**
     * Parses a literal recognised by {@link #NUMBER}.
     *
     * @param text candidate literal, may be {@code null}
     * @return the parsed value, or empty when the text is not a numeric literal
     */
    public static Optional<Double> parse(final String text) {
        if (!isNumber(text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
