package com.llmregress.assertion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotDiffTest {

    @Test
    void shouldReportFirstDifferingLine() {
        assertEquals("First diff at line 2: expected 'b', got 'x'", SnapshotDiff.summary("a\nb\nc", "a\nx\nc"));
    }

    @Test
    void shouldReportLineCountWhenPrefixMatches() {
        assertEquals("Line count differs: snapshot has 2, output has 3", SnapshotDiff.summary("a\nb", "a\nb\nc"));
    }

    @Test
    void shouldTruncateLongValuesWithoutSplittingSurrogates() {
        String smiles = "😀".repeat(5);

        String truncated = SnapshotDiff.truncate(smiles, 3);

        assertEquals("😀".repeat(3) + "...", truncated);
        assertTrue(SnapshotDiff.describe("x".repeat(500), "y").contains("..."));
    }
}
