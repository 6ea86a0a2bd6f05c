package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A derived CO_CHANGED edge. {@code fileA} sorts before {@code fileB}, so each pair has
 * exactly one edge and one frequency regardless of direction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoChangeEdge {

    private String fileA;

    private String fileB;

    private double frequency;

    private int coChangeCount;

    private int windowDays;

    public boolean touches(String path) {
        return fileA.equals(path) || fileB.equals(path);
    }

    public String partnerOf(String path) {
        return fileA.equals(path) ? fileB : fileA;
    }
}
