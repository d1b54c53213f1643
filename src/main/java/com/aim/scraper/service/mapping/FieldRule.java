package com.aim.scraper.service.mapping;

/**
 * One step of the heuristic chain that fills a payload.
 * <p>
 * Rules run in {@link org.springframework.core.annotation.Order} order and may
 * add or overwrite payload entries, but never remove one. A rule only touches
 * the fields it targets.
 * </p>
 */
@FunctionalInterface
public interface FieldRule {

    void apply(MappingContext ctx);
}
