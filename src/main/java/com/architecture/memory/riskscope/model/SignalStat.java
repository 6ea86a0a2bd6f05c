package com.architecture.memory.riskscope.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Validation record for one signal. Counters are only ever changed with atomic $inc.
 */
@Document(collection = "signal_stats")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SignalStat {

    @Id
    private String name; // signal wire name, e.g. "coupling"

    private long totalUses;

    private long falsePositives;

    private long truePositives;

    private double fpRate;

    @Builder.Default
    private boolean enabled = true;

    private String disabledReason;

    private Instant disabledAt;

    private Instant updatedAt;

    public static SignalStat empty(String name) {
        return SignalStat.builder().name(name).build();
    }
}
