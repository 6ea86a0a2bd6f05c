package com.architecture.memory.riskscope.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lightweight handle on a graph node returned by neighborhood queries.
 * {@code id} is the path for files and the stable key for every other label.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNodeRef {

    private String id;

    private String label;       // File, Function, Class, Commit, Developer, Incident

    private String name;

    public static GraphNodeRef file(String path) {
        return GraphNodeRef.builder().id(path).label("File").name(path).build();
    }

    public boolean isFile() {
        return "File".equals(label);
    }
}
