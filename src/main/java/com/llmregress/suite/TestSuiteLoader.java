package com.llmregress.suite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.llmregress.provider.ModelConfig;

public class TestSuiteLoader {
    private final ObjectMapper mapper;

    public TestSuiteLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    TestSuiteLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TestSuiteFile read(Path testFile) throws IOException {
        if (!Files.isRegularFile(testFile)) {
            throw new IOException("Test file not found: " + testFile.toAbsolutePath().normalize());
        }
        TestSuiteFile file = mapper.readValue(testFile.toFile(), TestSuiteFile.class);
        if (file == null) {
            throw new IOException("Test file is empty: " + testFile);
        }
        return file;
    }

    public TestSuite load(Path testFile) throws IOException {
        return toSuite(testFile, read(testFile));
    }

    public TestSuite toSuite(Path testFile, TestSuiteFile file) {
        TestSuiteFile.Defaults defaults = file.defaultsOrEmpty();
        ModelConfig baseModel = new ModelConfig(
                defaults.providerOrDefault(),
                defaults.modelOrDefault(),
                defaults.temperatureOrDefault(),
                defaults.providerUrl());
        Path baseDir = testFile.toAbsolutePath().getParent();

        List<TestDefinition> tests = new ArrayList<>();
        for (TestSuiteFile.TestEntry entry : file.testsOrEmpty()) {
            List<TestDefinition.InlineCase> inlineCases = new ArrayList<>();
            for (TestSuiteFile.CaseEntry caseEntry : entry.casesOrEmpty()) {
                inlineCases.add(new TestDefinition.InlineCase(
                        new LinkedHashMap<>(caseEntry.inputOrEmpty()),
                        toSpecs(entry.id(), caseEntry.assertionsOrEmpty())));
            }
            Path casesFile = entry.hasCasesFile() ? resolve(baseDir, entry.casesFile()) : null;
            tests.add(new TestDefinition(
                    entry.id() == null ? "" : entry.id(),
                    entry.prompt() == null ? "" : entry.prompt(),
                    toSpecs(entry.id(), entry.assertionsOrEmpty()),
                    inlineCases,
                    casesFile,
                    baseModel.withProvider(entry.provider()).withModel(entry.model())));
        }
        return new TestSuite(testFile, tests);
    }

    static List<AssertionSpec> toSpecs(String testId, List<TestSuiteFile.AssertionEntry> entries) {
        List<AssertionSpec> specs = new ArrayList<>();
        for (TestSuiteFile.AssertionEntry entry : entries) {
            AssertionKind kind = AssertionKind.fromName(entry.type())
                    .orElseThrow(() -> new ConfigException(
                            "Test '" + testId + "': unknown assertion type '" + entry.type() + "'"));
            specs.add(new AssertionSpec(kind, entry.valueText()));
        }
        return specs;
    }

    private static Path resolve(Path baseDir, String casesFile) {
        Path path = Path.of(casesFile);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }
}
