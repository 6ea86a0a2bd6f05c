package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A file that historically changes together with the queried file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoChangePartner {

    private String filePath;

    private double frequency;   // 0.0 - 1.0

    private int coChangeCount;
}
