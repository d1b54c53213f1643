package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.Payload;
import com.aim.scraper.service.mapping.DecimalText;
import com.aim.scraper.service.mapping.FieldNames;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Writes the temperature into every temperature-like field
 * ({@code temp}, {@code temperature}, {@code t_}, or exactly {@code t}).
 * Pages without one get the generic {@code Temperature} and {@code T} keys.
 */
@Slf4j
@Component
@Order(RuleOrder.TEMPERATURE)
public class TemperatureRule implements FieldRule {

    public static final String FALLBACK_LONG = "Temperature";
    public static final String FALLBACK_SHORT = "T";

    @Override
    public void apply(final MappingContext ctx) {
        Payload payload = ctx.getPayload();
        String value = DecimalText.of(ctx.getParams().temperatureK());

        boolean matched = false;
        for (String name : payload.names()) {
            if (FieldNames.isTemperature(name)) {
                payload.put(name, value);
                matched = true;
                log.debug("Temperature -> {}", name);
            }
        }
        if (!matched) {
            payload.put(FALLBACK_LONG, value);
            payload.put(FALLBACK_SHORT, value);
        }
    }
}
