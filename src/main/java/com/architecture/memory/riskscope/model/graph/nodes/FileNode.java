package com.architecture.memory.riskscope.model.graph.nodes;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Property;

/**
 * Structural file node. Written by the parser during ingestion, replaced wholesale when
 * the file is reparsed; read-only here.
 */
@Node("File")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileNode {

    @Id
    @Property("path")
    private String path;

    @Property("language")
    private String language;

    @Property("loc")
    private Integer loc;
}
