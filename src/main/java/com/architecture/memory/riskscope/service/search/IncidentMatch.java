package com.architecture.memory.riskscope.service.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentMatch {

    private String incidentId;

    private String title;

    private double score;

    /**
     * The incident already has an AFFECTS edge to the file being assessed.
     */
    private boolean affectsFile;
}
