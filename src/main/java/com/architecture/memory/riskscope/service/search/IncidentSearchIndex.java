package com.architecture.memory.riskscope.service.search;

import java.util.List;

/**
 * Lexical ranking of incident text against a free-text query.
 */
public interface IncidentSearchIndex {

    /**
     * @param filePath file under assessment, used only to flag incidents already linked to it
     * @return matches ordered by score, highest first
     */
    List<IncidentMatch> search(String query, int topK, String filePath);

    /**
     * Reloads every incident from the graph.
     */
    void rebuild();

    int size();
}
