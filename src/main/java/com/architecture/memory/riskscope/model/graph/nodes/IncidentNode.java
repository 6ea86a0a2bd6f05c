package com.architecture.memory.riskscope.model.graph.nodes;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Property;
import org.springframework.data.neo4j.core.schema.Relationship;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Production incident linked out-of-band to the files (AFFECTS) and commits (CAUSED_BY)
 * it is blamed on.
 */
@Node("Incident")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentNode {

    @Id
    @Property("id")
    private String id;

    @Property("title")
    private String title;

    @Property("description")
    private String description;

    @Property("rootCause")
    private String rootCause;

    @Property("severity")
    private String severity;    // critical, high, medium, low

    @Property("occurredAt")
    private Instant occurredAt;

    @Relationship(type = "AFFECTS", direction = Relationship.Direction.OUTGOING)
    @Builder.Default
    private Set<FileNode> affectedFiles = new HashSet<>();
}
