package com.architecture.memory.riskscope.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.repository.config.EnableNeo4jRepositories;

/**
 * The knowledge graph (structural, temporal and incident layers) lives in Neo4j.
 * Connection settings come from {@code spring.neo4j.*}.
 */
@Configuration
@EnableNeo4jRepositories(basePackages = "com.architecture.memory.riskscope.repository.graph")
public class Neo4jConfig {
}
