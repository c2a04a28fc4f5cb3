package com.tracking.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders record templates at read time.
 *
 * Tags look like {@code <%= latitude %>} and resolve against the stored record
 * body; nested fields use dots ({@code <%= geofence.identifier %>}). Strings are
 * inserted raw, so the template quotes them itself. Unknown fields render as
 * {@code null}. The rendered text is parsed as JSON; if it is not JSON the
 * text itself is returned as a JSON string.
 *
 * Example: {@code {"lat":<%= latitude %>,"lng":<%= longitude %>,"t":"<%= timestamp %>"}}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordTemplateRenderer {

    private static final Pattern TAG = Pattern.compile("<%=\\s*([\\w.]+)\\s*%>");

    private final ObjectMapper objectMapper;

    public JsonNode render(String template, JsonNode body) {
        Matcher matcher = TAG.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(valueOf(body, matcher.group(1))));
        }
        matcher.appendTail(rendered);

        String text = rendered.toString();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Rendered template is not valid JSON, sending it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(text);
        }
    }

    private String valueOf(JsonNode body, String path) {
        JsonNode node = body;
        for (String segment : path.split("\\.")) {
            node = node == null ? null : node.get(segment);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }
}
