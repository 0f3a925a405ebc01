package com.llmregress.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.llmregress.provider.PriceTable;
import com.llmregress.provider.PriceTable.ModelPrice;
import com.llmregress.retry.RetryPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private RunnerConfig runner = new RunnerConfig();
    private RetryConfig retry = new RetryConfig();
    private Map<String, PriceConfig> pricing = new LinkedHashMap<>();

    public RunnerConfig getRunner() {
        return runner;
    }

    public void setRunner(RunnerConfig runner) {
        this.runner = runner == null ? new RunnerConfig() : runner;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    public Map<String, PriceConfig> getPricing() {
        return pricing;
    }

    public void setPricing(Map<String, PriceConfig> pricing) {
        this.pricing = pricing == null ? new LinkedHashMap<>() : pricing;
    }

    public PriceTable priceTable() {
        Map<String, ModelPrice> overrides = new LinkedHashMap<>();
        pricing.forEach((model, price) -> overrides.put(model, new ModelPrice(price.getInputPerMillion(), price.getOutputPerMillion())));
        return PriceTable.withOverrides(overrides);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RunnerConfig {
        private int concurrency = 5;
        private int timeoutMs = 30000;
        private String snapshotDir = ".snapshots";

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getSnapshotDir() {
            return snapshotDir;
        }

        public void setSnapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 4;
        private long baseDelayMs = 500;
        private double jitterRatio = 0.2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = jitterRatio;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), jitterRatio);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PriceConfig {
        private double inputPerMillion;
        private double outputPerMillion;

        public double getInputPerMillion() {
            return inputPerMillion;
        }

        public void setInputPerMillion(double inputPerMillion) {
            this.inputPerMillion = inputPerMillion;
        }

        public double getOutputPerMillion() {
            return outputPerMillion;
        }

        public void setOutputPerMillion(double outputPerMillion) {
            this.outputPerMillion = outputPerMillion;
        }
    }
}
