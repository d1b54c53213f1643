package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.FormField;
import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.SubmissionParameters;
import com.aim.scraper.model.SubmitControl;
import com.aim.scraper.service.mapping.MappingContext;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SubmitControlRuleTest {

    private final SubmitControlRule rule = new SubmitControlRule();

    private static MappingContext context(final SubmitControl... controls) {
        FormSkeleton skeleton = new FormSkeleton(URI.create("http://localhost/form"),
                List.of(FormField.text("x", "1")), List.of(controls));
        return new MappingContext(skeleton, new SubmissionParameters(298.15, 0.5, Map.of()));
    }

    @Test
    void unnamedControlsAreSkipped() {
        MappingContext ctx = context(
                new SubmitControl("", "Help", "Help"),
                new SubmitControl("go", "Calculate", ""));

        rule.apply(ctx);

        assertEquals("Calculate", ctx.getPayload().get("go").orElseThrow());
        assertFalse(ctx.getPayload().contains(SubmitControlRule.FALLBACK_NAME));
    }

    @Test
    void buttonTextUsedWhenValueIsBlank() {
        MappingContext ctx = context(new SubmitControl("action", " ", "Run the model"));

        rule.apply(ctx);

        assertEquals("Run the model", ctx.getPayload().get("action").orElseThrow());
    }

    @Test
    void defaultValueWhenControlHasNoValueOrText() {
        MappingContext ctx = context(new SubmitControl("action", "", ""));

        rule.apply(ctx);

        assertEquals("Run", ctx.getPayload().get("action").orElseThrow());
    }

    @Test
    void fallbackWithoutNamedControl() {
        MappingContext ctx = context();

        rule.apply(ctx);

        assertEquals(SubmitControlRule.FALLBACK_VALUE, ctx.getPayload().get(SubmitControlRule.FALLBACK_NAME).orElseThrow());
    }
}
