package com.architecture.memory.riskscope.service.graph;

import com.architecture.memory.riskscope.dto.graph.CoChangePartner;
import com.architecture.memory.riskscope.dto.graph.GraphNodeRef;
import com.architecture.memory.riskscope.dto.graph.OwnershipHistory;
import com.architecture.memory.riskscope.dto.graph.TestCoverage;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the knowledge graph (structural, temporal and incident layers).
 *
 * <p>Latency contract: 1-hop queries under 50ms, edge-weight lookups under 20ms.
 * Every method may throw {@link GraphUnavailableException}; callers retry at most once
 * (see {@link GraphRetry}) and then degrade.</p>
 */
public interface GraphStoreAdapter {

    /**
     * Blast radius: number of distinct files structurally linked to any of the paths, which are
     * the current and earlier paths of one file. The paths themselves are not counted.
     */
    int coupling(List<String> filePaths);

    default int coupling(String filePath) {
        return coupling(List.of(filePath));
    }

    /**
     * Earlier paths of the file, following RENAMED_FROM edges, most recent first.
     * Empty when the file was never renamed or is not in the graph.
     */
    List<String> priorPaths(String filePath);

    /**
     * CO_CHANGED partners ordered by frequency, highest first.
     */
    List<CoChangePartner> coChanged(String filePath);

    /**
     * Test-to-source line ratio; empty when the file is not in the graph.
     */
    Optional<TestCoverage> testCoverage(String filePath);

    OwnershipHistory ownershipHistory(String filePath, int windowDays);

    /**
     * Nodes reachable within {@code hops} (1 or 2) from the given node. The node's label selects
     * the indexed key it is looked up by.
     */
    Set<GraphNodeRef> neighbors(GraphNodeRef node, int hops);

    /**
     * Messages of the most recent commits that modified the file inside the window, newest first.
     */
    List<String> recentCommitMessages(String filePath, int windowDays, int limit);
}
