package com.llmregress.suite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class SuiteValidator {
    public static final List<String> KNOWN_PROVIDERS = List.of("openai", "anthropic", "webhook");
    private static final int MAX_SUGGESTION_DISTANCE = 3;

    public List<String> validate(TestSuiteFile file) {
        List<String> issues = new ArrayList<>();
        TestSuiteFile.Defaults defaults = file.defaultsOrEmpty();

        if (!KNOWN_PROVIDERS.contains(defaults.providerOrDefault())) {
            issues.add("Unknown default provider '" + defaults.providerOrDefault() + "'. Known: "
                    + String.join(", ", KNOWN_PROVIDERS));
        }
        double temperature = defaults.temperatureOrDefault();
        if (temperature < 0.0 || temperature > 2.0) {
            issues.add("Temperature " + temperature + " is out of range [0.0, 2.0]");
        }
        if (file.testsOrEmpty().isEmpty()) {
            issues.add("No tests defined");
        }

        Set<String> seenIds = new HashSet<>();
        for (TestSuiteFile.TestEntry test : file.testsOrEmpty()) {
            String id = test.id() == null ? "" : test.id();
            if (id.isBlank()) {
                issues.add("Test with prompt '" + abbreviate(test.prompt()) + "' has no id");
            } else if (!seenIds.add(id)) {
                issues.add("Duplicate test ID '" + id + "'");
            }
            if (test.provider() != null && !KNOWN_PROVIDERS.contains(test.provider())) {
                issues.add("Test '" + id + "': unknown provider '" + test.provider() + "'");
            }
            if (test.prompt() == null || test.prompt().isEmpty()) {
                issues.add("Test '" + id + "': prompt is empty");
            }
            if (test.casesOrEmpty().isEmpty() && !test.hasCasesFile()) {
                issues.add("Test '" + id + "': no test cases defined (inline or CSV)");
            }
            if (!test.casesOrEmpty().isEmpty() && test.hasCasesFile()) {
                issues.add("Test '" + id + "': declares both inline cases and casesFile '" + test.casesFile()
                        + "'; use one source per test");
            }

            List<TestSuiteFile.AssertionEntry> defaultAssertions = test.assertionsOrEmpty();
            for (int i = 0; i < defaultAssertions.size(); i++) {
                checkAssertion(defaultAssertions.get(i), "Test '" + id + "', default assertion " + (i + 1))
                        .ifPresent(issues::add);
            }

            List<TestSuiteFile.CaseEntry> cases = test.casesOrEmpty();
            for (int ci = 0; ci < cases.size(); ci++) {
                TestSuiteFile.CaseEntry testCase = cases.get(ci);
                String where = "Test '" + id + "', case " + (ci + 1);
                if (testCase.assertionsOrEmpty().isEmpty() && defaultAssertions.isEmpty()) {
                    issues.add(where + ": no assertions defined");
                }
                for (TestSuiteFile.AssertionEntry assertion : testCase.assertionsOrEmpty()) {
                    checkAssertion(assertion, where).ifPresent(issues::add);
                }
                testCase.inputOrEmpty().forEach((name, value) -> {
                    if (value == null) {
                        issues.add(where + ": input '" + name + "' has no value");
                    }
                });
                Set<String> missing = Placeholders.missing(test.prompt(), testCase.inputOrEmpty());
                if (!missing.isEmpty()) {
                    issues.add(where + ": unresolved template variables in prompt " + missing);
                }
            }
        }
        return issues;
    }

    private Optional<String> checkAssertion(TestSuiteFile.AssertionEntry entry, String where) {
        Optional<AssertionKind> kind = AssertionKind.fromName(entry.type());
        if (kind.isEmpty()) {
            String hint = closest(entry.type() == null ? "" : entry.type(), AssertionKind.knownNames())
                    .map(suggestion -> ". Did you mean '" + suggestion + "'?")
                    .orElse("");
            return Optional.of(where + ": unknown assertion type '" + entry.type() + "'" + hint);
        }
        try {
            AssertionSpec spec = new AssertionSpec(kind.get(), entry.valueText());
            if (spec.isTemplated()) {
                return Optional.empty();
            }
            AssertionValues.check(spec);
            return Optional.empty();
        } catch (ConfigException e) {
            return Optional.of(where + ": " + e.getMessage());
        }
    }

    static Optional<String> closest(String input, List<String> candidates) {
        return candidates.stream()
                .filter(candidate -> levenshtein(input, candidate) <= MAX_SUGGESTION_DISTANCE)
                .min(Comparator.comparingInt(candidate -> levenshtein(input, candidate)));
    }

    static int levenshtein(String a, String b) {
        int[][] matrix = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            matrix[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            matrix[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                matrix[i][j] = Math.min(
                        Math.min(matrix[i - 1][j] + 1, matrix[i][j - 1] + 1),
                        matrix[i - 1][j - 1] + cost);
            }
        }
        return matrix[a.length()][b.length()];
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > 40 ? value.substring(0, 40) + "..." : value;
    }
}
