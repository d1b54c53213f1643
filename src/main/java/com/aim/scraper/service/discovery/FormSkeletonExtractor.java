package com.aim.scraper.service.discovery;

import com.aim.scraper.model.FieldKind;
import com.aim.scraper.model.FieldOption;
import com.aim.scraper.model.FormField;
import com.aim.scraper.model.FormSkeleton;
import com.aim.scraper.model.SubmitControl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the first {@code <form>} of a parsed page into a {@link FormSkeleton}.
 * <p>
 * Pure transformation of an already downloaded document; see
 * {@link FormDiscovery} for the network part.
 * </p>
 */
@Slf4j
@Component
public class FormSkeletonExtractor {

    private static final Set<String> SUBMIT_INPUT_TYPES = Set.of("submit", "image");

    /**
     * @param doc     page parsed with its own URL as base URI
     * @param pageUrl URL the page was fetched from
     * @return the skeleton of the first form, empty when the page has none
     */
    public Optional<FormSkeleton> extract(final Document doc, final URI pageUrl) {
        Element form = doc.selectFirst("form");
        if (form == null) {
            return Optional.empty();
        }

        Map<String, String> labelsById = labelsById(doc);
        Map<String, FormField> fields = new LinkedHashMap<>();
        List<SubmitControl> submits = new ArrayList<>();

        for (Element el : form.select("input, select, textarea, button")) {
            String tag = el.normalName();
            String type = el.attr("type").trim().toLowerCase(Locale.ROOT);

            if ("button".equals(tag) || ("input".equals(tag) && SUBMIT_INPUT_TYPES.contains(type))) {
                submits.add(new SubmitControl(el.attr("name"), el.attr("value"), el.text().trim()));
                continue;
            }

            String name = el.attr("name");
            if (StringUtils.isEmpty(name)) {
                continue;                           // cannot be addressed in a submission
            }
            FormField field = toField(el, tag, type, name, labelFor(el, labelsById));
            merge(fields, field);
        }

        URI actionUrl = resolveAction(form, pageUrl);
        log.debug("Form at {} posts to {} with {} fields, {} submit controls",
                pageUrl, actionUrl, fields.size(), submits.size());
        return Optional.of(new FormSkeleton(actionUrl, new ArrayList<>(fields.values()), submits));
    }

    private FormField toField(final Element el, final String tag, final String type,
                              final String name, final String label) {
        return switch (tag) {
            case "textarea" -> new FormField(name, FieldKind.TEXTAREA, el.wholeText(), List.of(), false, label);
            case "select" -> selectField(el, name, label);
            default -> {
                FieldKind kind = FieldKind.fromInputType(type);
                if (kind.isCheckable()) {
                    String value = el.hasAttr("value") ? el.attr("value") : "on";
                    boolean checked = el.hasAttr("checked");
                    yield new FormField(name, kind, value,
                            List.of(new FieldOption(value, checked, label)), checked, label);
                }
                yield new FormField(name, kind, el.attr("value"), List.of(), false, label);
            }
        };
    }

    private FormField selectField(final Element select, final String name, final String label) {
        List<FieldOption> options = new ArrayList<>();
        String selectedValue = null;
        for (Element opt : select.select("option")) {
            String value = opt.hasAttr("value") ? opt.attr("value") : opt.text().trim();
            boolean selected = opt.hasAttr("selected");
            options.add(new FieldOption(value, selected));
            if (selected && selectedValue == null) {
                selectedValue = value;
            }
        }
        if (selectedValue == null) {
            selectedValue = options.isEmpty() ? "" : options.get(0).value();
        }
        return new FormField(name, FieldKind.SELECT, selectedValue, options, false, label);
    }

    /**
     * Keeps one field per name. Checkbox/radio inputs sharing a name are
     * collected as members of one group field, whose default is the first
     * checked member (or the first member). Other duplicates are skipped.
     */
    private void merge(final Map<String, FormField> fields, final FormField field) {
        FormField existing = fields.get(field.name());
        if (existing == null) {
            fields.put(field.name(), field);
        } else if (existing.kind().isCheckable() && existing.kind() == field.kind()) {
            fields.put(field.name(), joinGroup(existing, field));
        } else {
            log.trace("Duplicate form field name {} skipped", field.name());
        }
    }

    private FormField joinGroup(final FormField group, final FormField member) {
        List<FieldOption> members = new ArrayList<>(group.members());
        members.addAll(member.members());
        FormField primary = !group.checked() && member.checked() ? member : group;
        return new FormField(group.name(), group.kind(), primary.defaultValue(), members,
                group.checked() || member.checked(), primary.labelText());
    }

    private URI resolveAction(final Element form, final URI pageUrl) {
        if (StringUtils.isBlank(form.attr("action"))) {
            return pageUrl;
        }
        String abs = form.absUrl("action");
        if (StringUtils.isBlank(abs)) {
            return pageUrl;
        }
        try {
            return URI.create(abs);
        } catch (IllegalArgumentException ex) {
            log.warn("Unusable form action '{}', posting to {}", abs, pageUrl);
            return pageUrl;
        }
    }

    private Map<String, String> labelsById(final Document doc) {
        Map<String, String> labels = new HashMap<>();
        for (Element label : doc.select("label[for]")) {
            labels.putIfAbsent(label.attr("for"), label.text().trim());
        }
        return labels;
    }

    private String labelFor(final Element el, final Map<String, String> labelsById) {
        String id = el.id();
        if (!id.isEmpty() && labelsById.containsKey(id)) {
            return labelsById.get(id);
        }
        Element wrapping = el.closest("label");
        return wrapping == null ? "" : wrapping.text().trim();
    }
}
