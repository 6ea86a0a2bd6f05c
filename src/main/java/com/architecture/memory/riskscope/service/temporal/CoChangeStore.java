package com.architecture.memory.riskscope.service.temporal;

import com.architecture.memory.riskscope.dto.graph.CoChangeEdge;
import com.architecture.memory.riskscope.dto.graph.CommitRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Commit history reads and CO_CHANGED writes for the temporal layer.
 */
public interface CoChangeStore {

    List<CommitRecord> commitsInWindow(int windowDays);

    /**
     * Commits in the window that modified any of the files, each with its full file set.
     */
    List<CommitRecord> commitsTouching(Collection<String> filePaths, int windowDays);

    Set<String> filesChangedSince(Instant since);

    /**
     * Current CO_CHANGED partners of the files.
     */
    Set<String> partnersOf(Collection<String> filePaths);

    /**
     * Drops every CO_CHANGED edge and writes the given ones.
     */
    void replaceAll(List<CoChangeEdge> edges);

    /**
     * Drops the CO_CHANGED edges incident to the files and writes the given ones.
     */
    void replaceIncident(Collection<String> filePaths, List<CoChangeEdge> edges);
}
