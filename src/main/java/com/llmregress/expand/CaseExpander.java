package com.llmregress.expand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmregress.suite.AssertionSpec;
import com.llmregress.suite.ConfigException;
import com.llmregress.suite.TestDefinition;

public class CaseExpander {
    private static final Logger log = LoggerFactory.getLogger(CaseExpander.class);

    private final CsvCaseSource csvSource;

    public CaseExpander() {
        this(new CsvCaseSource());
    }

    public CaseExpander(CsvCaseSource csvSource) {
        this.csvSource = csvSource;
    }

    public List<EvalCase> expand(TestDefinition test) throws DataSourceException {
        if (test.hasCasesFile() && !test.inlineCases().isEmpty()) {
            throw new ConfigException("Test '" + test.id() + "' declares both inline cases and casesFile "
                    + test.casesFile() + "; use one source per test");
        }

        List<EvalCase> cases = new ArrayList<>();
        if (test.hasCasesFile()) {
            List<Map<String, String>> rows = csvSource.readRows(test.casesFile());
            for (int ordinal = 0; ordinal < rows.size(); ordinal++) {
                cases.add(resolve(test, ordinal, rows.get(ordinal), List.of()));
            }
        } else {
            List<TestDefinition.InlineCase> inlineCases = test.inlineCases();
            for (int ordinal = 0; ordinal < inlineCases.size(); ordinal++) {
                TestDefinition.InlineCase inline = inlineCases.get(ordinal);
                cases.add(resolve(test, ordinal, inline.bindings(), inline.assertions()));
            }
        }

        long unresolved = cases.stream().filter(testCase -> !testCase.isResolved()).count();
        if (unresolved > 0) {
            log.warn("expand.unresolved test={} unresolvedCases={} totalCases={}", test.id(), unresolved, cases.size());
        }
        log.debug("expand.done test={} cases={} source={}", test.id(), cases.size(),
                test.hasCasesFile() ? test.casesFile() : "inline");
        return cases;
    }

    EvalCase resolve(TestDefinition test, int ordinal, Map<String, String> bindings, List<AssertionSpec> overrides) {
        try {
            String prompt = TemplateRenderer.render(test.promptTemplate(), bindings);
            List<AssertionSpec> effective = new ArrayList<>();
            for (AssertionSpec spec : mergeAssertions(test.defaultAssertions(), overrides)) {
                effective.add(spec.withValue(TemplateRenderer.render(spec.value(), bindings)));
            }
            return EvalCase.resolved(test.id(), ordinal, bindings, prompt, effective, test.model());
        } catch (TemplateException e) {
            return EvalCase.unresolved(test.id(), ordinal, bindings, test.model(), e.getMessage());
        }
    }

    /**
     * Defaults keep their position; an override with the same merge key replaces the default in
     * place and the remaining overrides follow in declaration order.
     */
    static List<AssertionSpec> mergeAssertions(List<AssertionSpec> defaults, List<AssertionSpec> overrides) {
        Map<String, AssertionSpec> merged = new LinkedHashMap<>();
        for (AssertionSpec spec : defaults) {
            merged.put(spec.mergeKey(), spec);
        }
        for (AssertionSpec spec : overrides) {
            merged.put(spec.mergeKey(), spec);
        }
        return List.copyOf(merged.values());
    }
}
