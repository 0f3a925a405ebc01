package com.llmregress.expand;

import java.util.Set;

public class TemplateException extends IllegalArgumentException {
    private final Set<String> missingVariables;

    public TemplateException(String message, Set<String> missingVariables) {
        super(message);
        this.missingVariables = Set.copyOf(missingVariables);
    }

    public Set<String> missingVariables() {
        return missingVariables;
    }
}
