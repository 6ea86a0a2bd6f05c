package com.architecture.memory.riskscope.repository.graph;

import com.architecture.memory.riskscope.model.graph.nodes.FileNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FileNodeRepository extends Neo4jRepository<FileNode, String> {

    Optional<FileNode> findByPath(String path);

    @Query("MATCH (t:File)-[:TESTS]->(f:File {path: $path}) RETURN t")
    List<FileNode> findTestsOf(String path);
}
