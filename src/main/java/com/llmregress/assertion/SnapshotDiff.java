package com.llmregress.assertion;

final class SnapshotDiff {
    private static final int LINE_PREVIEW = 40;
    private static final int VALUE_PREVIEW = 200;

    private SnapshotDiff() {
    }

    static String describe(String expected, String actual) {
        return summary(expected, actual)
                + ". expected=\"" + truncate(expected, VALUE_PREVIEW) + "\""
                + " actual=\"" + truncate(actual, VALUE_PREVIEW) + "\"";
    }

    static String summary(String expected, String actual) {
        String[] expectedLines = expected.split("\n", -1);
        String[] actualLines = actual.split("\n", -1);
        int shared = Math.min(expectedLines.length, actualLines.length);
        for (int i = 0; i < shared; i++) {
            if (!expectedLines[i].equals(actualLines[i])) {
                return String.format("First diff at line %d: expected '%s', got '%s'",
                        i + 1,
                        truncate(expectedLines[i], LINE_PREVIEW),
                        truncate(actualLines[i], LINE_PREVIEW));
            }
        }
        if (expectedLines.length != actualLines.length) {
            return String.format("Line count differs: snapshot has %d, output has %d",
                    expectedLines.length, actualLines.length);
        }
        return "Content differs";
    }

    static String truncate(String value, int max) {
        if (value.codePointCount(0, value.length()) <= max) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, max)) + "...";
    }
}
