package com.llmregress.snapshot;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

public record SnapshotKey(String testId, int caseOrdinal) {

    public SnapshotKey {
        Objects.requireNonNull(testId, "testId");
        if (caseOrdinal < 0) {
            throw new IllegalArgumentException("caseOrdinal must be >= 0");
        }
    }

    /**
     * Distinct keys always map to distinct names: characters outside {@code [A-Za-z0-9._-]}
     * are percent-encoded as UTF-8 bytes, {@code %} included.
     */
    public String fileName() {
        return encode(testId) + "_case" + caseOrdinal + ".snap";
    }

    private static String encode(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-') {
                out.append((char) c);
            } else {
                out.append('%').append(String.format(Locale.ROOT, "%02X", c));
            }
        }
        return out.toString();
    }
}
