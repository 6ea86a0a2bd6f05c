package com.architecture.memory.riskscope.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the risk pipeline, bound from the {@code riskscope.*} tree in application.yml.
 * Defaults here are the production values; tests construct this class directly.
 */
@Data
@ConfigurationProperties(prefix = "riskscope")
public class RiskScopeProperties {

    private Cache cache = new Cache();
    private Tier1 tier1 = new Tier1();
    private Profiles profiles = new Profiles();
    private Tier2 tier2 = new Tier2();
    private Investigation investigation = new Investigation();
    private Temporal temporal = new Temporal();
    private Validation validation = new Validation();
    private Reasoning reasoning = new Reasoning();
    private Api api = new Api();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration signalTtl = Duration.ofMinutes(15);
        private Duration traceTtl = Duration.ofMinutes(60);
        private long maximumSize = 10_000;
    }

    @Data
    public static class Tier1 {
        /** Join timeout for each of the three concurrent baseline signals. */
        private Duration signalTimeout = Duration.ofMillis(80);
        private int poolSize = 12;
        private int couplingThreshold = 10;
        private double coChangeThreshold = 0.7;
        private double testRatioThreshold = 0.3;
    }

    /**
     * Threshold profile selection. With {@code adaptive} off every file uses the {@code default}
     * profile, whose thresholds are the {@code tier1.*} values.
     */
    @Data
    public static class Profiles {
        private boolean adaptive = false;
        /** Profile key used for every file, overriding selection. */
        private String fixed;
        /** Primary language of the repository; empty means per-file from the extension. */
        private String language;
        /** web, backend, frontend, ml or cli; empty means inferred from the path. */
        private String domain;
    }

    @Data
    public static class Tier2 {
        private int windowDays = 90;
        private int recentCommitLimit = 20;
    }

    @Data
    public static class Investigation {
        private int maxHops = 3;
        private int maxContextDepth = 2;
        private Duration callTimeout = Duration.ofSeconds(4);
        private Duration budget = Duration.ofSeconds(8);
        /** Tail of {@code budget} that DECIDE iterations may not use. */
        private Duration synthesisReserve = Duration.ofSeconds(3);
        private double timeoutConfidenceCap = 0.3;
    }

    @Data
    public static class Temporal {
        private int windowDays = 90;
        private double minFrequency = 0.3;
        private int maxFilesPerCommit = 100;
        private Duration refreshInterval = Duration.ofMinutes(15);
    }

    @Data
    public static class Validation {
        private long minUses = 20;
        private double maxFpRate = 0.03;
    }

    @Data
    public static class Reasoning {
        private boolean enabled = true;
    }

    @Data
    public static class Api {
        /** A risk check still running after this is cancelled and answered with 503. */
        private Duration checkTimeout = Duration.ofSeconds(60);
    }
}
