package com.architecture.memory.riskscope.dto.risk;

/**
 * Risk classification shared by individual signals and final assessments.
 * Tier-1 only ever produces LOW or HIGH for a file; MEDIUM comes out of investigation synthesis
 * or the degraded heuristic.
 */
public enum RiskLevel {
    LOW("🟢", "LOW"),
    MEDIUM("🟡", "MEDIUM"),
    HIGH("🟠", "HIGH");

    private final String emoji;
    private final String label;

    RiskLevel(String emoji, String label) {
        this.emoji = emoji;
        this.label = label;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getLabel() {
        return label;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * Strict parse used at the reasoning-service boundary; returns null for anything
     * that isn't exactly one of the three levels (case-insensitive).
     */
    public static RiskLevel parseStrict(String value) {
        if (value == null) return null;
        for (RiskLevel level : values()) {
            if (level.label.equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return null;
    }
}
