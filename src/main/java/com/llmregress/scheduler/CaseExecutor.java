package com.llmregress.scheduler;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmregress.assertion.AssertionEvaluator;
import com.llmregress.assertion.AssertionResult;
import com.llmregress.expand.EvalCase;
import com.llmregress.provider.Completion;
import com.llmregress.provider.PriceTable;
import com.llmregress.provider.ProviderClient;
import com.llmregress.provider.ProviderResponse;
import com.llmregress.provider.TokenUsage;
import com.llmregress.retry.CancellationToken;
import com.llmregress.retry.RetryOutcome;
import com.llmregress.retry.RetryPolicy;

public class CaseExecutor {
    private static final Logger log = LoggerFactory.getLogger(CaseExecutor.class);

    private final ProviderClient provider;
    private final RetryPolicy retryPolicy;
    private final AssertionEvaluator evaluator;
    private final PriceTable prices;

    public CaseExecutor(ProviderClient provider, RetryPolicy retryPolicy, AssertionEvaluator evaluator, PriceTable prices) {
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.evaluator = evaluator;
        this.prices = prices;
    }

    public CaseOutcome execute(EvalCase testCase, CancellationToken cancellation) {
        if (!testCase.isResolved()) {
            log.warn("case.errored test={} ordinal={} reason={}", testCase.testId(), testCase.ordinal(), testCase.resolutionError());
            return CaseOutcome.errored(testCase, testCase.resolutionError());
        }

        RetryOutcome call = retryPolicy.call(provider, testCase.prompt(), testCase.model(), cancellation);
        TokenUsage totalUsage = call.totalUsage();
        double totalCost = prices.estimate(testCase.model().model(), totalUsage);

        if (!call.succeeded()) {
            String reason = call.cancelled()
                    ? "run cancelled after " + call.attemptCount() + " attempt(s): " + call.lastError()
                    : "provider call failed after " + call.attemptCount() + " attempt(s): " + call.lastError();
            return CaseOutcome.providerFailed(testCase, reason, call.attemptCount(), totalUsage, totalCost);
        }

        Completion completion = call.completion();
        ProviderResponse response = new ProviderResponse(
                completion.text(),
                completion.usage(),
                call.latency(),
                prices.estimate(testCase.model().model(), completion.usage()));
        List<AssertionResult> results = evaluator.evaluateAll(testCase, response);
        CaseOutcome outcome = CaseOutcome.evaluated(testCase, response, results, call.attemptCount(), totalUsage, totalCost);
        log.debug("case.done test={} ordinal={} status={} attempts={} latencyMs={}",
                testCase.testId(), testCase.ordinal(), outcome.status(), call.attemptCount(), response.latencyMs());
        return outcome;
    }
}
