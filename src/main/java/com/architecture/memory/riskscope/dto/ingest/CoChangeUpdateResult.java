package com.architecture.memory.riskscope.dto.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of a CO_CHANGED rebuild or incremental update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoChangeUpdateResult {

    public enum Mode {
        FULL,
        INCREMENTAL,
        SKIPPED
    }

    private Mode mode;

    private int commitsScanned;

    private int bulkCommitsIgnored;

    private int edgesWritten;

    /**
     * Files whose CO_CHANGED edges were rewritten or removed.
     */
    @Builder.Default
    private Set<String> affectedFiles = new LinkedHashSet<>();

    private long durationMs;

    public static CoChangeUpdateResult skipped() {
        return CoChangeUpdateResult.builder().mode(Mode.SKIPPED).build();
    }
}
