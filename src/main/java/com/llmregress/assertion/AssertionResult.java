package com.llmregress.assertion;

import com.llmregress.suite.AssertionSpec;

public record AssertionResult(AssertionSpec spec, String label, boolean passed, String detail) {

    public static AssertionResult pass(AssertionSpec spec, String detail) {
        return new AssertionResult(spec, spec.label(), true, detail);
    }

    public static AssertionResult fail(AssertionSpec spec, String detail) {
        return new AssertionResult(spec, spec.label(), false, detail);
    }

    public static AssertionResult of(AssertionSpec spec, boolean passed, String detail) {
        return new AssertionResult(spec, spec.label(), passed, detail);
    }

    public static AssertionResult synthetic(String label, String detail) {
        return new AssertionResult(null, label, false, detail);
    }
}
