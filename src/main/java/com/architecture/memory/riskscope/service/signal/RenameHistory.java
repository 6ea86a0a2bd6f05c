package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Current path followed by the paths the file was renamed from, most recent first.
 */
final class RenameHistory {

    private RenameHistory() {
    }

    static List<String> pathsOf(GraphStoreAdapter graph, String filePath) {
        List<String> paths = new ArrayList<>();
        paths.add(filePath);
        for (String prior : graph.priorPaths(filePath)) {
            if (!paths.contains(prior)) {
                paths.add(prior);
            }
        }
        return paths;
    }
}
