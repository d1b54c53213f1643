package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.FieldKind;
import com.aim.scraper.service.mapping.FieldNames;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * When no species matched a field by name, writes all of them as
 * {@code "<label> <value>"} lines into the first species-like textarea.
 */
@Slf4j
@Component
@Order(RuleOrder.TEXTAREA_SPECIES)
public class TextareaSpeciesRule implements FieldRule {

    private static final String[] FRAGMENTS = {"species", "conc", "concentration", "input"};

    @Override
    public void apply(final MappingContext ctx) {
        if (!ctx.nothingPlaced() || ctx.species().isEmpty()) {
            return;
        }
        ctx.getSkeleton().fieldsOfKind(FieldKind.TEXTAREA).stream()
                .filter(f -> FieldNames.containsAny(f.name(), FRAGMENTS))
                .findFirst()
                .ifPresent(f -> {
                    ctx.getPayload().put(f.name(), ctx.speciesBlock());
                    ctx.markAllPlaced();
                    log.debug("Species block -> textarea {}", f.name());
                });
    }
}
