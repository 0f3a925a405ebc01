package com.llmregress.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmregress.expand.CaseExpander;
import com.llmregress.expand.DataSourceException;
import com.llmregress.expand.EvalCase;
import com.llmregress.report.ResultAggregator;
import com.llmregress.report.RunSummary;
import com.llmregress.report.TestOutcome;
import com.llmregress.retry.CancellationToken;
import com.llmregress.scheduler.CaseOutcome;
import com.llmregress.scheduler.CaseScheduler;
import com.llmregress.suite.ConfigException;
import com.llmregress.suite.TestDefinition;
import com.llmregress.suite.TestSuite;

public class RegressionRunner {
    private static final Logger log = LoggerFactory.getLogger(RegressionRunner.class);

    private final CaseExpander expander;
    private final CaseScheduler scheduler;
    private final ResultAggregator aggregator;

    public RegressionRunner(CaseExpander expander, CaseScheduler scheduler, ResultAggregator aggregator) {
        this.expander = expander;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
    }

    public RunSummary run(TestSuite suite, int concurrency, CancellationToken cancellation) {
        long started = System.nanoTime();
        List<TestDefinition> tests = suite.tests();
        List<List<EvalCase>> expanded = new ArrayList<>(tests.size());
        List<String> loadErrors = new ArrayList<>(tests.size());
        List<EvalCase> allCases = new ArrayList<>();

        for (TestDefinition test : tests) {
            List<EvalCase> cases = List.of();
            String loadError = null;
            try {
                cases = expander.expand(test);
            } catch (DataSourceException | ConfigException ex) {
                loadError = ex.getMessage();
                log.error("test.load.failed test={} error={}", test.id(), ex.getMessage());
            }
            expanded.add(cases);
            loadErrors.add(loadError);
            allCases.addAll(cases);
        }

        log.info("run.start tests={} cases={} concurrency={}", tests.size(), allCases.size(), concurrency);
        List<CaseOutcome> outcomes = scheduler.run(allCases, concurrency, cancellation);

        // outcomes come back in input order, so each test owns a contiguous slice
        List<TestOutcome> testOutcomes = new ArrayList<>(tests.size());
        int offset = 0;
        for (int i = 0; i < tests.size(); i++) {
            String testId = tests.get(i).id();
            if (loadErrors.get(i) != null) {
                testOutcomes.add(aggregator.loadFailed(testId, loadErrors.get(i)));
                continue;
            }
            int size = expanded.get(i).size();
            testOutcomes.add(aggregator.aggregate(testId, outcomes.subList(offset, offset + size)));
            offset += size;
        }

        RunSummary summary = aggregator.summarize(testOutcomes)
                .withWallTime(Duration.ofNanos(System.nanoTime() - started));
        log.info("run.done passed={} failed={} errored={} skipped={} costUsd={}",
                summary.passed(), summary.failed(), summary.errored(), summary.skipped(),
                String.format(Locale.ROOT, "%.6f", summary.costUsd()));
        return summary;
    }
}
