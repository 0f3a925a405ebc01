package com.llmregress.scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmregress.expand.EvalCase;
import com.llmregress.retry.CancellationToken;

/**
 * Dispatches cases to a fixed pool of workers. Each worker claims the next unstarted index and
 * writes its outcome into the slot for that index, so the returned list is always in input
 * order regardless of completion order or pool size.
 */
public class CaseScheduler {
    private static final Logger log = LoggerFactory.getLogger(CaseScheduler.class);

    static final String SKIPPED_REASON = "run cancelled before dispatch";

    private final CaseExecutor executor;

    public CaseScheduler(CaseExecutor executor) {
        this.executor = executor;
    }

    public List<CaseOutcome> run(List<EvalCase> cases, int concurrencyLimit, CancellationToken cancellation) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        }
        if (cases.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(concurrencyLimit, cases.size());
        AtomicReferenceArray<CaseOutcome> slots = new AtomicReferenceArray<>(cases.size());
        AtomicInteger nextIndex = new AtomicInteger();
        log.info("scheduler.start cases={} workers={}", cases.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            List<Future<?>> running = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                running.add(pool.submit(() -> drain(cases, slots, nextIndex, cancellation)));
            }
            for (Future<?> worker : running) {
                awaitWorker(worker, cancellation);
            }
        } finally {
            pool.shutdownNow();
        }

        List<CaseOutcome> outcomes = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            CaseOutcome outcome = slots.get(i);
            outcomes.add(outcome != null ? outcome : CaseOutcome.skipped(cases.get(i), SKIPPED_REASON));
        }
        log.info("scheduler.done cases={} cancelled={}", cases.size(), cancellation.isCancelled());
        return outcomes;
    }

    private void drain(
            List<EvalCase> cases,
            AtomicReferenceArray<CaseOutcome> slots,
            AtomicInteger nextIndex,
            CancellationToken cancellation) {
        int index;
        while ((index = nextIndex.getAndIncrement()) < cases.size()) {
            EvalCase testCase = cases.get(index);
            CaseOutcome outcome;
            if (cancellation.isCancelled()) {
                outcome = CaseOutcome.skipped(testCase, SKIPPED_REASON);
            } else {
                try {
                    outcome = executor.execute(testCase, cancellation);
                } catch (RuntimeException ex) {
                    log.error("case.crashed test={} ordinal={}", testCase.testId(), testCase.ordinal(), ex);
                    outcome = CaseOutcome.errored(testCase, "unexpected error: " + ex.getMessage());
                }
            }
            if (!slots.compareAndSet(index, null, outcome)) {
                throw new IllegalStateException("slot " + index + " written twice");
            }
        }
    }

    private static void awaitWorker(Future<?> worker, CancellationToken cancellation) {
        try {
            worker.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            log.warn("scheduler.interrupted, cancelling remaining cases");
        } catch (ExecutionException ex) {
            throw new IllegalStateException("scheduler worker failed", ex.getCause());
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "case-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
