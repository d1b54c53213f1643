package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.FieldOption;
import com.aim.scraper.model.FormField;
import com.aim.scraper.service.mapping.FieldRule;
import com.aim.scraper.service.mapping.MappingContext;
import com.aim.scraper.service.mapping.RuleOrder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ticks the checkbox/radio input of each requested solid. A solid matches an
 * input when its label occurs (ignoring case) in the input's name, declared
 * value or label text. Every member of a group sharing a name is tested; only
 * the first matching input is ticked.
 */
@Slf4j
@Component
@Order(RuleOrder.SOLIDS)
public class SolidsRule implements FieldRule {

    @Override
    public void apply(final MappingContext ctx) {
        if (ctx.getParams().solids().isEmpty()) {
            return;
        }
        List<FormField> checkables = ctx.getSkeleton().fields().stream()
                .filter(f -> f.kind().isCheckable())
                .toList();

        for (String solid : ctx.getParams().solids()) {
            if (!tick(ctx, checkables, solid)) {
                log.debug("No control found for solid {}", solid);
            }
        }
    }

    private static boolean tick(final MappingContext ctx, final List<FormField> checkables, final String solid) {
        for (FormField field : checkables) {
            for (FieldOption member : field.members()) {
                if (matches(field.name(), member, solid)) {
                    ctx.getPayload().put(field.name(), member.checkedValue());
                    log.debug("Solid {} -> {}={}", solid, field.name(), member.checkedValue());
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean matches(final String name, final FieldOption member, final String solid) {
        return StringUtils.containsIgnoreCase(name, solid)
                || StringUtils.containsIgnoreCase(member.value(), solid)
                || StringUtils.containsIgnoreCase(member.label(), solid);
    }
}
