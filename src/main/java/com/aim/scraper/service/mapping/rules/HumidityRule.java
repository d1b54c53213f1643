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
 * Writes the relative humidity into humidity-like fields ({@code rh},
 * {@code humid}, {@code relative}). A field already claimed by the
 * temperature rule keeps the temperature. Pages without any humidity-like
 * field get the generic {@code RH} key.
 */
@Slf4j
@Component
@Order(RuleOrder.HUMIDITY)
public class HumidityRule implements FieldRule {

    public static final String FALLBACK = "RH";

    @Override
    public void apply(final MappingContext ctx) {
        Payload payload = ctx.getPayload();
        String value = DecimalText.of(ctx.getParams().relativeHumidity());

        boolean anyHumidityName = false;
        for (String name : payload.names()) {
            if (!FieldNames.isHumidity(name)) {
                continue;
            }
            anyHumidityName = true;
            if (!FieldNames.isTemperature(name)) {
                payload.put(name, value);
                log.debug("Relative humidity -> {}", name);
            }
        }
        if (!anyHumidityName) {
            payload.put(FALLBACK, value);
        }
    }
}
