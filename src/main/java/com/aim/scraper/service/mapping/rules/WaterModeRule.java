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

import java.util.Optional;

/**
 * The AIM form carries relative humidity in {@code water_var}, which only
 * takes effect when {@code interactive_type} is {@code 2} (RH-driven mode
 * instead of fixed composition). When a water-like field exists it receives
 * the humidity and the mode switch is forced.
 */
@Slf4j
@Component
@Order(RuleOrder.WATER_MODE)
public class WaterModeRule implements FieldRule {

    static final String WATER_FIELD = "water_var";
    static final String MODE_FIELD = "interactive_type";
    static final String RH_MODE = "2";

    @Override
    public void apply(final MappingContext ctx) {
        Payload payload = ctx.getPayload();
        Optional<String> target = payload.contains(WATER_FIELD)
                ? Optional.of(WATER_FIELD)
                : payload.names().stream().filter(n -> FieldNames.containsAny(n, "water")).findFirst();

        target.ifPresent(name -> {
            payload.put(name, DecimalText.of(ctx.getParams().relativeHumidity()));
            payload.put(MODE_FIELD, RH_MODE);
            log.debug("Water content -> {}, {}={}", name, MODE_FIELD, RH_MODE);
        });
    }
}
