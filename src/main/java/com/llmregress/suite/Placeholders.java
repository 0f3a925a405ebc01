package com.llmregress.suite;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Placeholders {
    public static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    private Placeholders() {
    }

    public static Set<String> names(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    // a key bound to null (YAML ~) counts as missing
    public static Set<String> missing(String template, Map<String, String> bindings) {
        Set<String> missing = names(template);
        missing.removeIf(name -> bindings.get(name) != null);
        return missing;
    }
}
