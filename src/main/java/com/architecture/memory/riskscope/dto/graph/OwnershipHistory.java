package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Who owns a file now, who owned it before, and how long ago it changed hands.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnershipHistory {

    private String currentOwner;

    private String previousOwner;

    /**
     * -1 when there was no transition inside the window.
     */
    private int daysSinceTransition;

    private int commitCount;

    private int windowDays;

    @Builder.Default
    private List<String> developers = new ArrayList<>();

    public boolean hasTransition() {
        return previousOwner != null && daysSinceTransition >= 0;
    }
}
