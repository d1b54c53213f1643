package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.Payload;
import com.aim.scraper.service.mapping.DecimalText;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * A field whose name equals a species label (ignoring case) receives that
 * species' concentration.
 */
@Component
@Order(RuleOrder.EXACT_SPECIES)
public class ExactSpeciesRule implements FieldRule {

    @Override
    public void apply(final MappingContext ctx) {
        Payload payload = ctx.getPayload();
        for (Map.Entry<String, Double> species : ctx.species().entrySet()) {
            String label = species.getKey().trim();
            payload.names().stream()
                    .filter(label::equalsIgnoreCase)
                    .findFirst()
                    .ifPresent(name -> {
                        payload.put(name, DecimalText.of(species.getValue()));
                        ctx.markPlaced(species.getKey());
                    });
        }
    }
}
