package com.architecture.memory.riskscope.dto.risk;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every signal the pipeline knows how to compute. The wire name is what feedback,
 * validation statistics, cache keys and the reasoning service use.
 */
public enum SignalName {
    COUPLING("coupling", Tier.BASELINE),
    CO_CHANGE("co_change", Tier.BASELINE),
    TEST_RATIO("test_ratio", Tier.BASELINE),
    OWNERSHIP_CHURN("ownership_churn", Tier.ON_DEMAND),
    INCIDENT_SIMILARITY("incident_similarity", Tier.ON_DEMAND);

    public enum Tier {
        BASELINE,
        ON_DEMAND
    }

    private final String wireName;
    private final Tier tier;

    SignalName(String wireName, Tier tier) {
        this.wireName = wireName;
        this.tier = tier;
    }

    public String getWireName() {
        return wireName;
    }

    public Tier getTier() {
        return tier;
    }

    public boolean isOnDemand() {
        return tier == Tier.ON_DEMAND;
    }

    public static Optional<SignalName> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim();
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(normalized))
                .findFirst();
    }
}
