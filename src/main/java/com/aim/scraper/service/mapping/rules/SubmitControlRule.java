package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.SubmitControl;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Adds the name/value of the first named submit control, as a browser does for
 * the clicked button. Falls back to {@code submit=Run model}.
 */
@Component
@Order(RuleOrder.SUBMIT)
public class SubmitControlRule implements FieldRule {

    public static final String FALLBACK_NAME = "submit";
    public static final String FALLBACK_VALUE = "Run model";

    @Override
    public void apply(final MappingContext ctx) {
        ctx.getSkeleton().submitControls().stream()
                .filter(c -> StringUtils.isNotEmpty(c.name()))
                .findFirst()
                .ifPresentOrElse(
                        c -> ctx.getPayload().put(c.name(), valueOf(c)),
                        () -> ctx.getPayload().put(FALLBACK_NAME, FALLBACK_VALUE));
    }

    private static String valueOf(final SubmitControl control) {
        return StringUtils.firstNonBlank(control.value(), control.text(), "Run");
    }
}
