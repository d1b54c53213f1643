package com.aim.scraper.service.mapping.rules;

import com.aim.scraper.model.FieldKind;
import com.aim.scraper.model.FieldOption;
import com.aim.scraper.model.FormField;
import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.SubmissionParameters;
import com.aim.scraper.service.mapping.MappingContext;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SolidsRuleTest {

    private final SolidsRule rule = new SolidsRule();

    private static MappingContext context(final Set<String> solids, final FormField... fields) {
        FormSkeleton skeleton = new FormSkeleton(URI.create("http://localhost/form"), List.of(fields), List.of());
        return new MappingContext(skeleton, new SubmissionParameters(298.15, 0.5, Map.of(), solids));
    }

    @Test
    void matchesOnLabelText() {
        MappingContext ctx = context(Set.of("(NH4)2SO4"),
                FormField.checkbox("s1", "", false, "Ice"),
                FormField.checkbox("s2", "", false, "(NH4)2SO4 (s)"));

        rule.apply(ctx);

        assertEquals("on", ctx.getPayload().get("s2").orElseThrow());
        assertFalse(ctx.getPayload().contains("s1"));
    }

    @Test
    void onlyFirstMatchingFieldIsTicked() {
        MappingContext ctx = context(Set.of("ice"),
                FormField.checkbox("ice_a", "Ice", false, ""),
                FormField.checkbox("ice_b", "Ice", false, ""));

        rule.apply(ctx);

        assertEquals("Ice", ctx.getPayload().get("ice_a").orElseThrow());
        assertFalse(ctx.getPayload().contains("ice_b"));
    }

    @Test
    void everyGroupMemberIsTested() {
        FormField group = new FormField("solids", FieldKind.CHECKBOX, "Ice",
                List.of(new FieldOption("Ice", false, ""), new FieldOption("", false, "Sodium nitrate")),
                false, "");
        MappingContext ctx = context(Set.of("nitrate"), group);

        rule.apply(ctx);

        assertEquals("on", ctx.getPayload().get("solids").orElseThrow());
    }

    @Test
    void textFieldsAreNeverTicked() {
        MappingContext ctx = context(Set.of("Ice"), FormField.text("ice_note", "x"));

        rule.apply(ctx);

        assertEquals("x", ctx.getPayload().get("ice_note").orElseThrow());
    }

    @Test
    void checkedDefaultsStayWhenNotRequested() {
        MappingContext ctx = context(Set.of(), FormField.checkbox("solid3", "NaCl", true, ""));

        rule.apply(ctx);

        assertEquals("NaCl", ctx.getPayload().get("solid3").orElseThrow());
    }
}
