package com.example.alpenglow.theoremmap.util;

import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{name}}} placeholders. Plain values pass through the escaper; keys starting with
 * {@code raw:} are inserted as they are, for fragments that were rendered and escaped already.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}");
    private static final String RAW_PREFIX = "raw:";

    private TemplateRenderer() {}

    public static String render(String template, Map<String, Object> variables) {
        return render(template, variables, UnaryOperator.identity());
    }

    public static String render(String template, Map<String, Object> variables, UnaryOperator<String> escaper) {
        if (template == null) {
            return "";
        }
        if (variables == null || variables.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1).trim();
            String value;
            if (key.startsWith(RAW_PREFIX)) {
                value = String.valueOf(variables.getOrDefault(key.substring(RAW_PREFIX.length()), ""));
            } else {
                value = escaper.apply(String.valueOf(variables.getOrDefault(key, "")));
            }
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }
}
