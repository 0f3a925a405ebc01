package com.llmregress.assertion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.llmregress.expand.EvalCase;
import com.llmregress.provider.ProviderResponse;
import com.llmregress.snapshot.SnapshotKey;
import com.llmregress.snapshot.SnapshotStore;
import com.llmregress.suite.AssertionSpec;
import com.llmregress.suite.AssertionValues;
import com.llmregress.suite.ConfigException;

public class AssertionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(AssertionEvaluator.class);

    private final SnapshotStore snapshots;
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    public AssertionEvaluator(SnapshotStore snapshots) {
        this.snapshots = snapshots;
    }

    public List<AssertionResult> evaluateAll(EvalCase testCase, ProviderResponse response) {
        List<AssertionResult> results = new ArrayList<>();
        for (AssertionSpec spec : testCase.assertions()) {
            try {
                results.add(evaluate(spec, response, testCase.snapshotKey()));
            } catch (ConfigException e) {
                results.add(AssertionResult.fail(spec, "config error: " + e.getMessage()));
            }
        }
        return results;
    }

    public AssertionResult evaluate(AssertionSpec spec, ProviderResponse response, SnapshotKey key) {
        String text = response.text();
        return switch (spec.kind()) {
            case CONTAINS -> {
                boolean found = text.contains(AssertionValues.requireText(spec));
                yield AssertionResult.of(spec, found, found ? "found in output" : "NOT found in output");
            }
            case NOT_CONTAINS -> {
                boolean found = text.contains(AssertionValues.requireText(spec));
                yield AssertionResult.of(spec, !found, found ? "unexpectedly found in output" : "correctly absent from output");
            }
            case LATENCY_MAX -> {
                long max = AssertionValues.requireNumber(spec);
                long actual = response.latencyMs();
                yield AssertionResult.of(spec, actual <= max, "actual: " + actual + "ms");
            }
            case MIN_LENGTH -> {
                long min = AssertionValues.requireNumber(spec);
                int length = text.codePointCount(0, text.length());
                yield AssertionResult.of(spec, length >= min, "actual: " + length + " chars");
            }
            case MAX_LENGTH -> {
                long max = AssertionValues.requireNumber(spec);
                int length = text.codePointCount(0, text.length());
                yield AssertionResult.of(spec, length <= max, "actual: " + length + " chars");
            }
            case REGEX -> {
                boolean matched = AssertionValues.compile(AssertionValues.requireText(spec)).matcher(text).find();
                yield AssertionResult.of(spec, matched, matched ? "pattern matched" : "pattern NOT matched");
            }
            case JSON_VALID -> {
                boolean valid = isJson(text);
                yield AssertionResult.of(spec, valid, valid ? "output is valid JSON" : "output is NOT valid JSON");
            }
            case SNAPSHOT -> snapshot(spec, text, key);
        };
    }

    private boolean isJson(String text) {
        if (text.isBlank()) {
            return false;
        }
        try {
            JsonNode node = jsonMapper.readTree(text);
            return node != null && !node.isMissingNode();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private AssertionResult snapshot(AssertionSpec spec, String text, SnapshotKey key) {
        try {
            if (snapshots.updateMode()) {
                snapshots.put(key, text);
                return AssertionResult.pass(spec, "updated");
            }
            Optional<String> golden = snapshots.get(key);
            if (golden.isEmpty()) {
                Optional<String> raced = snapshots.putIfAbsent(key, text);
                if (raced.isEmpty()) {
                    return AssertionResult.pass(spec, "created (first run)");
                }
                if (!raced.get().equals(text)) {
                    log.warn("snapshot.nondeterministic key={} reason=concurrent first writes differ", key.fileName());
                }
                return AssertionResult.pass(spec, "created (first run, concurrent write kept)");
            }
            if (golden.get().equals(text)) {
                return AssertionResult.pass(spec, "matches saved snapshot");
            }
            return AssertionResult.fail(spec, "differs from snapshot. " + SnapshotDiff.describe(golden.get(), text)
                    + ". Run with --update-snapshots to accept.");
        } catch (IOException e) {
            log.warn("snapshot.io.failed key={} reason={}", key.fileName(), e.getMessage());
            return AssertionResult.fail(spec, "failed to access snapshot: " + e.getMessage());
        }
    }
}
