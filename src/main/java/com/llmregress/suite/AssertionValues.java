package com.llmregress.suite;

import java.math.BigDecimal;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class AssertionValues {
    private AssertionValues() {
    }

    public static long requireNumber(AssertionSpec spec) {
        String raw = spec.value();
        if (raw == null || raw.isBlank()) {
            throw new ConfigException(spec.kind().wireName() + " value must be a number");
        }
        BigDecimal number;
        try {
            number = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(spec.kind().wireName() + " value must be a number, got '" + raw + "'", e);
        }
        if (number.signum() < 0) {
            throw new ConfigException(spec.kind().wireName() + " value must be >= 0, got " + raw);
        }
        try {
            return number.longValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigException(spec.kind().wireName() + " value must be a whole number within range, got '" + raw + "'", e);
        }
    }

    public static String requireText(AssertionSpec spec) {
        if (spec.value() == null) {
            throw new ConfigException(spec.kind().wireName() + " value must be a string");
        }
        return spec.value();
    }

    public static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigException("invalid regex '" + pattern + "': " + e.getDescription(), e);
        }
    }

    public static void check(AssertionSpec spec) {
        switch (spec.kind().valueType()) {
            case NUMBER -> requireNumber(spec);
            case TEXT -> {
                String text = requireText(spec);
                if (spec.kind() == AssertionKind.REGEX) {
                    compile(text);
                }
            }
            case NONE -> {
            }
        }
    }
}
