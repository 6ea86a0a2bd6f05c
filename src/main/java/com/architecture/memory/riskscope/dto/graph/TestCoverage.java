package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCoverage {

    private int sourceLoc;

    private int testLoc;

    /**
     * Smoothed ratio: (testLoc + 1) / (sourceLoc + 1).
     */
    private double ratio;

    @Builder.Default
    private List<String> testFiles = new ArrayList<>();

    public static double smoothedRatio(int testLoc, int sourceLoc) {
        return (testLoc + 1.0) / (sourceLoc + 1.0);
    }
}
