package com.llmregress.suite;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestSuiteFile(
        String version,
        Defaults defaults,
        List<TestEntry> tests) {

    public Defaults defaultsOrEmpty() {
        return defaults == null ? Defaults.empty() : defaults;
    }

    public List<TestEntry> testsOrEmpty() {
        return tests == null ? List.of() : tests;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Defaults(
            String provider,
            String model,
            Double temperature,
            @JsonAlias("provider_url") String providerUrl) {

        public static final String DEFAULT_PROVIDER = "openai";
        public static final String DEFAULT_MODEL = "gpt-4o-mini";
        public static final double DEFAULT_TEMPERATURE = 0.7;

        static Defaults empty() {
            return new Defaults(null, null, null, null);
        }

        public String providerOrDefault() {
            return provider == null || provider.isBlank() ? DEFAULT_PROVIDER : provider;
        }

        public String modelOrDefault() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model;
        }

        public double temperatureOrDefault() {
            return temperature == null ? DEFAULT_TEMPERATURE : temperature;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestEntry(
            String id,
            String prompt,
            String provider,
            String model,
            List<CaseEntry> cases,
            @JsonAlias("cases_file") String casesFile,
            List<AssertionEntry> assertions) {

        public List<CaseEntry> casesOrEmpty() {
            return cases == null ? List.of() : cases;
        }

        public List<AssertionEntry> assertionsOrEmpty() {
            return assertions == null ? List.of() : assertions;
        }

        public boolean hasCasesFile() {
            return casesFile != null && !casesFile.isBlank();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CaseEntry(
            Map<String, String> input,
            @JsonProperty("assert") @JsonAlias("assertions") List<AssertionEntry> assertions) {

        public Map<String, String> inputOrEmpty() {
            return input == null ? Map.of() : input;
        }

        public List<AssertionEntry> assertionsOrEmpty() {
            return assertions == null ? List.of() : assertions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssertionEntry(
            String type,
            JsonNode value) {

        public boolean hasValue() {
            return value != null && !value.isNull() && !value.isMissingNode();
        }

        public String valueText() {
            if (!hasValue()) {
                return null;
            }
            if (!value.isValueNode()) {
                throw new ConfigException("assertion '" + type + "' value must be a scalar, got " + value.getNodeType());
            }
            return value.asText();
        }
    }
}
