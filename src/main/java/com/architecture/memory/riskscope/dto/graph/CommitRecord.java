package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A commit and the files it touched, as read from the temporal layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitRecord {

    private String sha;

    private Instant authoredAt;

    @Builder.Default
    private Set<String> files = new LinkedHashSet<>();
}
