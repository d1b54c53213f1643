package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.FieldKind;
import com.aim.scraper.model.FormField;
import com.aim.scraper.service.mapping.FieldNames;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Last species fallback: the first non-textarea field named like a species or
 * concentration input receives the whole species block. Species left unplaced
 * after this rule are reported and dropped.
 */
@Slf4j
@Component
@Order(RuleOrder.GENERIC_SPECIES)
public class GenericSpeciesFieldRule implements FieldRule {

    private static final String[] FRAGMENTS = {"species", "conc", "concentration", "mole"};

    @Override
    public void apply(final MappingContext ctx) {
        if (!ctx.nothingPlaced() || ctx.species().isEmpty()) {
            return;
        }
        ctx.getPayload().names().stream()
                .filter(name -> !isTextarea(ctx, name))
                .filter(name -> FieldNames.containsAny(name, FRAGMENTS))
                .findFirst()
                .ifPresentOrElse(name -> {
                    ctx.getPayload().put(name, ctx.speciesBlock());
                    ctx.markAllPlaced();
                    log.debug("Species block -> field {}", name);
                }, () -> log.warn("No form field found for species {}", ctx.species().keySet()));
    }

    private boolean isTextarea(final MappingContext ctx, final String name) {
        return ctx.getSkeleton().field(name)
                .map(FormField::kind)
                .filter(k -> k == FieldKind.TEXTAREA)
                .isPresent();
    }
}
