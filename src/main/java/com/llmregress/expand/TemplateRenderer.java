package com.llmregress.expand;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import com.llmregress.suite.Placeholders;

public final class TemplateRenderer {
    private TemplateRenderer() {
    }

    public static String render(String template, Map<String, String> bindings) {
        if (template == null) {
            return null;
        }
        Set<String> missing = Placeholders.missing(template, bindings);
        if (!missing.isEmpty()) {
            throw new TemplateException("unresolved template variables " + missing + " in '" + template + "'", missing);
        }
        Matcher matcher = Placeholders.PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(bindings.get(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
