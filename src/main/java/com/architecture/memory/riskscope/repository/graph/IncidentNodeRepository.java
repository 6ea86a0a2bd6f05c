package com.architecture.memory.riskscope.repository.graph;

import com.architecture.memory.riskscope.model.graph.nodes.IncidentNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IncidentNodeRepository extends Neo4jRepository<IncidentNode, String> {
}
