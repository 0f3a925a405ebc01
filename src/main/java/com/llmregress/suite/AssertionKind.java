package com.llmregress.suite;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

public enum AssertionKind {
    CONTAINS("contains", ValueType.TEXT, true),
    NOT_CONTAINS("not-contains", ValueType.TEXT, true),
    LATENCY_MAX("latency-max", ValueType.NUMBER, false, "latency_max"),
    MIN_LENGTH("min-length", ValueType.NUMBER, false, "min_length"),
    MAX_LENGTH("max-length", ValueType.NUMBER, false, "max_length"),
    REGEX("regex", ValueType.TEXT, true),
    JSON_VALID("json-valid", ValueType.NONE, false, "json_valid"),
    SNAPSHOT("snapshot", ValueType.NONE, false);

    public enum ValueType {
        TEXT,
        NUMBER,
        NONE
    }

    private final String wireName;
    private final ValueType valueType;
    private final boolean keyedByValue;
    private final List<String> aliases;

    AssertionKind(String wireName, ValueType valueType, boolean keyedByValue, String... aliases) {
        this.wireName = wireName;
        this.valueType = valueType;
        this.keyedByValue = keyedByValue;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public ValueType valueType() {
        return valueType;
    }

    public boolean requiresValue() {
        return valueType != ValueType.NONE;
    }

    public boolean keyedByValue() {
        return keyedByValue;
    }

    public static Optional<AssertionKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(normalized) || kind.aliases.contains(normalized))
                .findFirst();
    }

    public static List<String> knownNames() {
        return Arrays.stream(values())
                .flatMap(kind -> Stream.concat(Stream.of(kind.wireName), kind.aliases.stream()))
                .toList();
    }
}
