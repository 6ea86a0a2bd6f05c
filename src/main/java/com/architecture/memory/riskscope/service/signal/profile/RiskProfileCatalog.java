package com.architecture.memory.riskscope.service.signal.profile;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in threshold profiles keyed by {@code language_domain}. The {@code default} profile is
 * built from {@code riskscope.tier1.*} so the plain escalation rule stays configurable.
 */
@Slf4j
@Component
public class RiskProfileCatalog {

    public static final String DEFAULT = "default";
    public static final String PYTHON_WEB = "python_web";
    public static final String PYTHON_BACKEND = "python_backend";
    public static final String GO_BACKEND = "go_backend";
    public static final String GO_WEB = "go_web";
    public static final String TYPESCRIPT_WEB = "typescript_web";
    public static final String TYPESCRIPT_FRONTEND = "typescript_frontend";
    public static final String JAVA_BACKEND = "java_backend";
    public static final String RUST_BACKEND = "rust_backend";
    public static final String ML_PROJECT = "ml_project";
    public static final String CLI_TOOL = "cli_tool";

    static final int DEFAULT_COUPLING_MEDIUM_DIVISOR = 2;
    static final double DEFAULT_CO_CHANGE_MEDIUM_ABOVE = 0.3;
    static final double DEFAULT_TEST_RATIO_LOW_FROM = 0.8;

    private final Map<String, RiskProfile> profiles = new LinkedHashMap<>();

    public RiskProfileCatalog(RiskScopeProperties properties) {
        RiskScopeProperties.Tier1 tier1 = properties.getTier1();
        register(RiskProfile.builder()
                .key(DEFAULT)
                .description("Conservative thresholds used when nothing more specific applies")
                .couplingThreshold(tier1.getCouplingThreshold())
                .couplingMediumAbove(tier1.getCouplingThreshold() / DEFAULT_COUPLING_MEDIUM_DIVISOR)
                .coChangeThreshold(tier1.getCoChangeThreshold())
                .coChangeMediumAbove(DEFAULT_CO_CHANGE_MEDIUM_ABOVE)
                .testRatioThreshold(tier1.getTestRatioThreshold())
                .testRatioLowFrom(DEFAULT_TEST_RATIO_LOW_FROM)
                .build());

        register(profile(PYTHON_WEB, "Python web applications (Flask, Django, FastAPI)", 15, 7, 0.75, 0.375, 0.4, 0.7));
        register(profile(PYTHON_BACKEND, "Python backend services, workers and processors", 12, 6, 0.7, 0.35, 0.5, 0.8));
        register(profile(GO_BACKEND, "Go backend services and microservices", 8, 4, 0.6, 0.3, 0.5, 0.8));
        register(profile(GO_WEB, "Go web applications (Gin, Echo, Fiber)", 10, 5, 0.65, 0.325, 0.45, 0.75));
        register(profile(TYPESCRIPT_WEB, "TypeScript/JavaScript full-stack web apps", 18, 9, 0.8, 0.4, 0.35, 0.65));
        register(profile(TYPESCRIPT_FRONTEND, "TypeScript/JavaScript frontend apps (React, Vue, Angular)", 20, 10, 0.8, 0.4, 0.3, 0.6));
        register(profile(JAVA_BACKEND, "Java backend services (Spring Boot, Jakarta EE)", 12, 6, 0.65, 0.325, 0.6, 0.9));
        register(profile(RUST_BACKEND, "Rust backend services and systems", 7, 3, 0.55, 0.275, 0.55, 0.85));
        register(profile(ML_PROJECT, "Machine learning and data science projects", 10, 5, 0.7, 0.35, 0.25, 0.55));
        register(profile(CLI_TOOL, "Command-line tools and utilities", 10, 5, 0.6, 0.3, 0.4, 0.7));

        log.info("[Profiles] {} risk profiles registered, default coupling>{} co_change>{} test_ratio<{}",
                profiles.size(), tier1.getCouplingThreshold(), tier1.getCoChangeThreshold(), tier1.getTestRatioThreshold());
    }

    public Optional<RiskProfile> find(String key) {
        return Optional.ofNullable(key).map(profiles::get);
    }

    public RiskProfile defaultProfile() {
        return profiles.get(DEFAULT);
    }

    public Collection<RiskProfile> all() {
        return Collections.unmodifiableCollection(profiles.values());
    }

    private void register(RiskProfile profile) {
        profiles.put(profile.getKey(), profile);
    }

    private static RiskProfile profile(String key, String description,
                                       int coupling, int couplingMedium,
                                       double coChange, double coChangeMedium,
                                       double testRatio, double testRatioLow) {
        return RiskProfile.builder()
                .key(key)
                .description(description)
                .couplingThreshold(coupling)
                .couplingMediumAbove(couplingMedium)
                .coChangeThreshold(coChange)
                .coChangeMediumAbove(coChangeMedium)
                .testRatioThreshold(testRatio)
                .testRatioLowFrom(testRatioLow)
                .build();
    }
}
