package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitAuthorship {

    private String sha;

    private String authorEmail;

    private Instant authoredAt;
}
