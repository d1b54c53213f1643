package com.aim.scraper.model;

/**
 * One row of the flattened two-column result table.
 *
 * @param parameter scalar label, species label or {@code "raw"}
 * @param value     textual value
 */
public record ResultRow(String parameter, String value) {
}
