package com.aim.scraper.service.mapping;

import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.Payload;
import com.aim.scraper.model.SubmissionParameters;
import com.aim.scraper.service.mapping.rules.ExactSpeciesRule;
import com.aim.scraper.service.mapping.rules.GenericSpeciesFieldRule;
import com.aim.scraper.service.mapping.rules.HumidityRule;
import com.aim.scraper.service.mapping.rules.SolidsRule;
import com.aim.scraper.service.mapping.rules.SubmitControlRule;
import com.aim.scraper.service.mapping.rules.TemperatureRule;
import com.aim.scraper.service.mapping.rules.TextareaSpeciesRule;
import com.aim.scraper.service.mapping.rules.WaterModeRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * <h2>FieldMapper</h2>
 *
 * <p>Builds the payload for a discovered form by seeding it with the form's
 * own defaults (hidden tokens, pre-selected options, checked boxes) and then
 * running the rule chain:</p>
 *
 * <ol>
 *   <li>temperature,</li>
 *   <li>relative humidity and water/RH mode,</li>
 *   <li>species by exact field name,</li>
 *   <li>species block into a textarea,</li>
 *   <li>species block into any species-like field,</li>
 *   <li>solid-phase checkboxes,</li>
 *   <li>submit control.</li>
 * </ol>
 *
 * <p>The chain is every {@link FieldRule} bean sorted by
 * {@link org.springframework.core.annotation.Order @Order}; a page variant that
 * needs another heuristic gets a new rule bean in a free slot of
 * {@link RuleOrder}.</p>
 */
@Slf4j
@Component
public class FieldMapper {

    private final List<FieldRule> rules;

    public FieldMapper(final List<FieldRule> rules) {
        List<FieldRule> sorted = new ArrayList<>(rules);
        AnnotationAwareOrderComparator.sort(sorted);
        this.rules = List.copyOf(sorted);
        log.debug("Field rule chain: {}", this.rules.stream().map(r -> r.getClass().getSimpleName()).toList());
    }

    /**
     * @return a mapper running the built-in rules only
     */
    public static FieldMapper withDefaultRules() {
        return new FieldMapper(List.of(
                new TemperatureRule(),
                new HumidityRule(),
                new WaterModeRule(),
                new ExactSpeciesRule(),
                new TextareaSpeciesRule(),
                new GenericSpeciesFieldRule(),
                new SolidsRule(),
                new SubmitControlRule()));
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * Maps semantic parameters onto the discovered form.
     *
     * @param skeleton discovered form
     * @param params   run parameters
     * @return the payload to post to {@link FormSkeleton#actionUrl()}
     */
    public Payload map(final FormSkeleton skeleton, final SubmissionParameters params) {
        MappingContext ctx = new MappingContext(skeleton, params);
        for (FieldRule rule : rules) {
            rule.apply(ctx);
        }
        log.debug("Mapped payload: {}", ctx.getPayload());
        return ctx.getPayload();
    }

    /**
     * Generic payload for a page that has no form at all: the common names for
     * temperature and humidity, one entry per species, and a submit value.
     */
    public Payload fallbackPayload(final SubmissionParameters params) {
        String temperature = DecimalText.of(params.temperatureK());
        Payload payload = new Payload()
                .put(TemperatureRule.FALLBACK_LONG, temperature)
                .put(TemperatureRule.FALLBACK_SHORT, temperature)
                .put(HumidityRule.FALLBACK, DecimalText.of(params.relativeHumidity()));
        params.species().forEach((label, value) -> payload.put(label.trim(), DecimalText.of(value)));
        if (!payload.contains(SubmitControlRule.FALLBACK_NAME)) {
            payload.put(SubmitControlRule.FALLBACK_NAME, SubmitControlRule.FALLBACK_VALUE);
        }
        return payload;
    }
}
