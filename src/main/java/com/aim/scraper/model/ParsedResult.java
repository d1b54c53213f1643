package com.aim.scraper.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured outcome of one model run.
 * <p>
 * Either structured data was recognised (scalars and/or a molarity table), or
 * a {@code raw} excerpt of the response text is kept instead; never both.
 * Serialised to JSON with the scalars at top level:
 * </p>
 * <pre>{@code
 * {
 *   "Total Gibbs Free Energy": -123.456,
 *   "pH": 4.56,
 *   "molarities": { "H+": 1.23E-7, "Na+": 0.1 }
 * }
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParsedResult {

    public static final String TOTAL_GIBBS_FREE_ENERGY = "Total Gibbs Free Energy";

    public static final String PH = "pH";

    public static final String MOLARITIES = "molarities";

    public static final String RAW = "raw";

    /** Values are {@link Double}, or {@link String} when the captured text was not numeric. */
    private final Map<String, Object> scalars;

    private final Map<String, Double> molarities;

    private final String raw;

    private ParsedResult(final Map<String, Object> scalars,
                         final Map<String, Double> molarities,
                         final String raw) {
        this.scalars = scalars;
        this.molarities = molarities;
        this.raw = raw;
    }

    /**
     * @param scalars    recognised scalar values, may be empty
     * @param molarities recognised table, may be empty
     * @throws IllegalArgumentException when both are empty
     */
    public static ParsedResult structured(final Map<String, Object> scalars,
                                          final Map<String, Double> molarities) {
        Map<String, Object> s = scalars == null ? Map.of() : scalars;
        Map<String, Double> m = molarities == null ? Map.of() : molarities;
        if (s.isEmpty() && m.isEmpty()) {
            throw new IllegalArgumentException("A structured result needs scalars or molarities");
        }
        return new ParsedResult(
                Collections.unmodifiableMap(new LinkedHashMap<>(s)),
                m.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(m)),
                null);
    }

    public static ParsedResult raw(final String excerpt) {
        return new ParsedResult(Map.of(), null, Objects.requireNonNullElse(excerpt, ""));
    }

    @JsonAnyGetter
    public Map<String, Object> getScalars() {
        return scalars;
    }

    public Optional<Object> scalar(final String label) {
        return Optional.ofNullable(scalars.get(label));
    }

    @JsonProperty(MOLARITIES)
    public Map<String, Double> getMolarities() {
        return molarities;
    }

    @JsonProperty(RAW)
    public String getRaw() {
        return raw;
    }

    @JsonIgnore
    public boolean isRaw() {
        return raw != null;
    }

    /**
     * Flattens the result into a two-column table: scalars first, then the
     * molarity entries, or the single raw row.
     */
    public List<ResultRow> toRows() {
        List<ResultRow> rows = new ArrayList<>();
        scalars.forEach((k, v) -> rows.add(new ResultRow(k, String.valueOf(v))));
        if (molarities != null) {
            molarities.forEach((k, v) -> rows.add(new ResultRow(k, String.valueOf(v))));
        }
        if (raw != null) {
            rows.add(new ResultRow(RAW, raw));
        }
        return rows;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedResult other)) {
            return false;
        }
        return scalars.equals(other.scalars)
                && Objects.equals(molarities, other.molarities)
                && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalars, molarities, raw);
    }

    @Override
    public String toString() {
        return "ParsedResult{scalars=" + scalars + ", molarities=" + molarities
                + ", raw=" + (raw == null ? null : raw.length() + " chars") + '}';
    }
}
