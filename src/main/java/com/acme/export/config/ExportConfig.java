package com.acme.export.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Export pipeline settings: concurrency, request budget, retry and file locations.
 */
@ConfigurationProperties("export")
public class ExportConfig {

    private int concurrency = 5;
    private int maxConcurrency = 32;
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private Duration runTimeout;
    private Duration syncWait = Duration.ofSeconds(1);
    private Duration runRetention = Duration.ofHours(1);
    private String stateDir = "state";
    private String outputDir = "output";
    private Rate rate = new Rate();
    private Retry retry = new Retry();
    private Discovery discovery = new Discovery();

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Whole-run timeout after which the run is cancelled. Null means no limit.
     */
    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    public Duration getSyncWait() {
        return syncWait;
    }

    public void setSyncWait(Duration syncWait) {
        this.syncWait = syncWait;
    }

    public long getSyncWaitMillis() {
        return syncWait.toMillis();
    }

    /**
     * How long a finished run stays queryable through the status endpoint.
     */
    public Duration getRunRetention() {
        return runRetention;
    }

    public void setRunRetention(Duration runRetention) {
        this.runRetention = runRetention;
    }

    public String getStateDir() {
        return stateDir;
    }

    public void setStateDir(String stateDir) {
        this.stateDir = stateDir;
    }

    public Path getStateDirPath() {
        return Path.of(stateDir);
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public Path getOutputDirPath() {
        return Path.of(outputDir);
    }

    public Rate getRate() {
        return rate;
    }

    public void setRate(Rate rate) {
        this.rate = rate;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public static class Rate {
        private int capacity = 3;
        private double refillPerSecond = 3.0;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    /**
     * Listing pages are cheaper for the source than record pages, so they get their own budget.
     */
    public static class Discovery {
        private int rateCapacity = 10;
        private double rateRefillPerSecond = 10.0;
        private int maxPages = 1000;

        public int getRateCapacity() {
            return rateCapacity;
        }

        public void setRateCapacity(int rateCapacity) {
            this.rateCapacity = rateCapacity;
        }

        public double getRateRefillPerSecond() {
            return rateRefillPerSecond;
        }

        public void setRateRefillPerSecond(double rateRefillPerSecond) {
            this.rateRefillPerSecond = rateRefillPerSecond;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }
}
