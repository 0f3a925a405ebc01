package com.llmregress;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.llmregress.assertion.AssertionEvaluator;
import com.llmregress.engine.ProjectInitializer;
import com.llmregress.engine.RegressionRunner;
import com.llmregress.expand.CaseExpander;
import com.llmregress.provider.ProviderClients;
import com.llmregress.provider.ProviderRouter;
import com.llmregress.report.ConsoleReport;
import com.llmregress.report.JsonReportWriter;
import com.llmregress.report.ResultAggregator;
import com.llmregress.report.RunSummary;
import com.llmregress.retry.CancellationToken;
import com.llmregress.runtime.AppConfig;
import com.llmregress.scheduler.CaseExecutor;
import com.llmregress.scheduler.CaseScheduler;
import com.llmregress.snapshot.FileSnapshotStore;
import com.llmregress.suite.ConfigException;
import com.llmregress.suite.SuiteValidator;
import com.llmregress.suite.TestDefinition;
import com.llmregress.suite.TestSuite;
import com.llmregress.suite.TestSuiteFile;
import com.llmregress.suite.TestSuiteLoader;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "llm-regress",
        mixinStandardHelpOptions = true,
        version = "llm-regress 0.1.0",
        description = "Runs prompt regression tests against LLM providers.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "run")
    Mode mode;

    @Option(names = { "-f", "--file" }, description = "Path to the YAML test file", defaultValue = "tests.yaml")
    Path testFile;

    @Option(names = { "-c", "--config" }, description = "Path to YAML engine config file", defaultValue = "llm-regress.yml")
    Path configPath;

    @Option(names = "--concurrency", description = "Maximum number of in-flight provider calls")
    Integer concurrency;

    @Option(names = "--timeout-ms", description = "Per-request timeout in milliseconds")
    Integer timeoutMs;

    @Option(names = "--max-attempts", description = "Attempts per case including the first call")
    Integer maxAttempts;

    @Option(names = "--update-snapshots", description = "Overwrite stored snapshots with current output", defaultValue = "false")
    boolean updateSnapshots;

    @Option(names = "--no-validate", description = "Skip test file validation before running", defaultValue = "false")
    boolean noValidate;

    @Option(names = "--filter", description = "Only run tests whose id contains this text")
    String filter;

    @Option(names = "--json-report", description = "Write a JSON report to this path")
    Path jsonReport;

    @Option(names = "--dir", description = "Target directory for init mode", defaultValue = ".")
    Path initDirectory;

    @Option(names = { "-v", "--verbose" }, description = "Show passing assertions and full model output", defaultValue = "false")
    boolean verbose;

    Map<String, String> environment = System.getenv();
    PrintStream out = System.out;
    PrintStream err = System.err;

    enum Mode {
        run,
        validate,
        init
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        log.info("Starting llm-regress in {} mode", mode);
        try {
            return switch (mode) {
                case init -> runInit();
                case validate -> runValidate();
                case run -> runTests();
            };
        } catch (IllegalArgumentException | IllegalStateException | IOException ex) {
            log.error("run.aborted mode={} error={}", mode, ex.getMessage());
            err.println("error: " + ex.getMessage());
            return RunSummary.EXIT_USAGE;
        }
    }

    private int runInit() throws IOException {
        ProjectInitializer.InitResult result = new ProjectInitializer().initialize(initDirectory);
        for (Path created : result.created()) {
            out.println("created " + created);
        }
        for (Path skipped : result.skipped()) {
            out.println("skipped " + skipped + " (already exists)");
        }
        return RunSummary.EXIT_OK;
    }

    private int runValidate() throws IOException {
        TestSuiteLoader loader = new TestSuiteLoader();
        TestSuiteFile file = loader.read(testFile);
        List<String> issues = new SuiteValidator().validate(file);
        if (!issues.isEmpty()) {
            printIssues(issues);
            return RunSummary.EXIT_USAGE;
        }

        TestSuite suite = loader.toSuite(testFile, file);
        int inlineCases = 0;
        int assertions = 0;
        for (TestDefinition test : suite.tests()) {
            inlineCases += test.inlineCases().size();
            assertions += test.defaultAssertions().size() * test.inlineCases().size();
            for (TestDefinition.InlineCase inlineCase : test.inlineCases()) {
                assertions += inlineCase.assertions().size();
            }
        }
        TestSuiteFile.Defaults defaults = file.defaultsOrEmpty();
        out.printf("%s is valid: %d test(s), %d inline case(s), %d assertion(s)%n",
                testFile, suite.tests().size(), inlineCases, assertions);
        out.printf("provider %s, model %s%n", defaults.providerOrDefault(), defaults.modelOrDefault());
        return RunSummary.EXIT_OK;
    }

    private int runTests() throws IOException {
        AppConfig config = loadConfig(configPath);
        applyOverrides(config);
        AppConfig.RunnerConfig runner = config.getRunner();
        log.info("Using config file: {} concurrency={} timeoutMs={} maxAttempts={}",
                configPath, runner.getConcurrency(), runner.getTimeoutMs(), config.getRetry().getMaxAttempts());

        TestSuiteLoader loader = new TestSuiteLoader();
        TestSuiteFile file = loader.read(testFile);
        if (!noValidate) {
            List<String> issues = new SuiteValidator().validate(file);
            if (!issues.isEmpty()) {
                printIssues(issues);
                err.println("Fix these issues or use --no-validate to skip.");
                return RunSummary.EXIT_USAGE;
            }
        }

        TestSuite suite = loader.toSuite(testFile, file);
        TestSuite selected = suite.filter(filter);
        if (filter != null) {
            out.printf("filter '%s' matched %d of %d test(s)%n", filter, selected.tests().size(), suite.tests().size());
        }
        if (selected.tests().isEmpty()) {
            out.println("no tests to run");
            return RunSummary.EXIT_OK;
        }

        OkHttpClient httpClient = ProviderClients.httpClient(Duration.ofMillis(runner.getTimeoutMs()));
        ProviderRouter router = ProviderClients.router(
                selected.tests().stream().map(TestDefinition::model).toList(), httpClient, environment);

        CancellationToken cancellation = new CancellationToken();
        Thread cancelOnShutdown = new Thread(cancellation::cancel, "llm-regress-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        RunSummary summary;
        boolean snapshotsSaved;
        FileSnapshotStore snapshots = FileSnapshotStore.open(Path.of(runner.getSnapshotDir()), updateSnapshots);
        try {
            CaseExecutor executor = new CaseExecutor(
                    router,
                    config.getRetry().toPolicy(),
                    new AssertionEvaluator(snapshots),
                    config.priceTable());
            RegressionRunner regressionRunner = new RegressionRunner(
                    new CaseExpander(), new CaseScheduler(executor), new ResultAggregator());
            summary = regressionRunner.run(selected, runner.getConcurrency(), cancellation);
        } finally {
            removeShutdownHook(cancelOnShutdown);
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
            snapshotsSaved = closeSnapshots(snapshots);
        }

        new ConsoleReport(out, verbose).print(summary);
        if (jsonReport != null) {
            new JsonReportWriter().write(summary, jsonReport);
            out.println("JSON report saved to " + jsonReport);
        }
        if (!snapshotsSaved) {
            err.println("error: snapshots could not be saved to " + snapshots.directory());
            return RunSummary.EXIT_FAILURES;
        }
        return summary.exitCode();
    }

    private static boolean closeSnapshots(FileSnapshotStore snapshots) {
        try {
            snapshots.close();
            return true;
        } catch (IOException ex) {
            log.error("snapshot.flush.failed dir={} error={}", snapshots.directory(), ex.toString());
            return false;
        }
    }

    private void applyOverrides(AppConfig config) {
        if (concurrency != null) {
            config.getRunner().setConcurrency(concurrency);
        }
        if (timeoutMs != null) {
            config.getRunner().setTimeoutMs(timeoutMs);
        }
        if (maxAttempts != null) {
            config.getRetry().setMaxAttempts(maxAttempts);
        }
        if (config.getRunner().getConcurrency() < 1) {
            throw new ConfigException("concurrency must be >= 1");
        }
        if (config.getRunner().getTimeoutMs() < 1) {
            throw new ConfigException("timeoutMs must be >= 1");
        }
        if (config.getRetry().getMaxAttempts() < 1) {
            throw new ConfigException("maxAttempts must be >= 1");
        }
    }

    private void printIssues(List<String> issues) {
        err.printf("%s has %d issue(s):%n", testFile, issues.size());
        for (String issue : issues) {
            err.println("  - " + issue);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            log.debug("JVM already shutting down, cancel hook stays registered");
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        String content = Files.readString(config);
        if (content.isBlank()) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(content, AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
