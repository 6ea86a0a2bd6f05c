package com.architecture.memory.riskscope.service.graph;

import com.architecture.memory.riskscope.dto.graph.CoChangePartner;
import com.architecture.memory.riskscope.dto.graph.CommitAuthorship;
import com.architecture.memory.riskscope.dto.graph.GraphNodeRef;
import com.architecture.memory.riskscope.dto.graph.OwnershipHistory;
import com.architecture.memory.riskscope.dto.graph.TestCoverage;
import com.architecture.memory.riskscope.model.graph.nodes.FileNode;
import com.architecture.memory.riskscope.repository.graph.FileNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.exceptions.value.Uncoercible;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cypher-backed {@link GraphStoreAdapter}. All reads; the temporal layer writes through
 * {@link com.architecture.memory.riskscope.service.temporal.CoChangeStore}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphStoreAdapter implements GraphStoreAdapter {

    static final long ONE_HOP_BUDGET_MS = 50;
    static final long EDGE_WEIGHT_BUDGET_MS = 20;
    static final int NEIGHBOR_LIMIT = 200;

    static final int MAX_RENAME_DEPTH = 5;

    private static final String COUPLING_QUERY = """
            MATCH (f:File) WHERE f.path IN $paths
            CALL {
                WITH f
                MATCH (f)-[:IMPORTS]-(other:File)
                RETURN other
                UNION
                WITH f
                MATCH (f)-[:CONTAINS]->(:Function)-[:CALLS]-(:Function)<-[:CONTAINS]-(other:File)
                RETURN other
            }
            WITH other WHERE NOT other.path IN $paths
            RETURN count(DISTINCT other) AS coupling
            """;

    private static final String PRIOR_PATHS_QUERY = """
            MATCH p = (:File {path: $path})-[:RENAMED_FROM*1..%d]->(old:File)
            RETURN old.path AS path, min(length(p)) AS distance
            ORDER BY distance ASC, path ASC
            """.formatted(MAX_RENAME_DEPTH);

    private static final String CO_CHANGED_QUERY = """
            MATCH (f:File {path: $path})-[r:CO_CHANGED]-(other:File)
            RETURN other.path AS path, r.frequency AS frequency, r.coChangeCount AS coChangeCount
            ORDER BY r.frequency DESC, other.path ASC
            """;

    private static final String AUTHORSHIP_QUERY = """
            MATCH (d:Developer)-[:AUTHORED]->(c:Commit)-[:MODIFIES]->(:File {path: $path})
            WHERE c.authoredAt >= $since
            RETURN c.sha AS sha, d.email AS email, c.authoredAt AS authoredAt
            """;

    private static final String RECENT_MESSAGES_QUERY = """
            MATCH (c:Commit)-[:MODIFIES]->(:File {path: $path})
            WHERE c.authoredAt >= $since AND c.message IS NOT NULL
            RETURN c.message AS message
            ORDER BY c.authoredAt DESC
            LIMIT $limit
            """;

    /**
     * Start-node lookups per label, each on the property that label is indexed by.
     */
    static final Map<String, String> NEIGHBOR_ANCHORS = Map.of(
            "File", "MATCH (n:File {path: $id})",
            "Commit", "MATCH (n:Commit {sha: $id})",
            "Developer", "MATCH (n:Developer {email: $id})",
            "Function", "MATCH (n:Function {id: $id})",
            "Class", "MATCH (n:Class {id: $id})",
            "Incident", "MATCH (n:Incident {id: $id})");

    private static final String ANY_LABEL_ANCHOR = """
            CALL {
                MATCH (n:File {path: $id}) RETURN n
                UNION
                MATCH (n:Commit {sha: $id}) RETURN n
                UNION
                MATCH (n:Developer {email: $id}) RETURN n
                UNION
                MATCH (n:Function {id: $id}) RETURN n
                UNION
                MATCH (n:Class {id: $id}) RETURN n
                UNION
                MATCH (n:Incident {id: $id}) RETURN n
            }""";

    private static final String NEIGHBORS_TAIL = """
            WITH n LIMIT 1
            MATCH (n)-[*1..%d]-(m)
            WHERE m <> n
            WITH DISTINCT m
            RETURN labels(m)[0] AS label,
                   coalesce(m.path, m.sha, m.email, m.id, elementId(m)) AS id,
                   coalesce(m.name, m.title, m.path, m.email, m.sha) AS name
            LIMIT $limit
            """;

    private final Neo4jClient neo4jClient;
    private final FileNodeRepository fileNodeRepository;
    private final Clock clock;

    @Override
    public int coupling(List<String> filePaths) {
        if (filePaths.isEmpty()) {
            return 0;
        }
        return timed("coupling", filePaths.get(0), ONE_HOP_BUDGET_MS, () ->
                neo4jClient.query(COUPLING_QUERY)
                        .bind(filePaths).to("paths")
                        .fetchAs(Long.class)
                        .one()
                        .orElse(0L)
                        .intValue());
    }

    @Override
    public List<String> priorPaths(String filePath) {
        return timed("priorPaths", filePath, ONE_HOP_BUDGET_MS, () ->
                neo4jClient.query(PRIOR_PATHS_QUERY)
                        .bind(filePath).to("path")
                        .fetchAs(String.class)
                        .mappedBy((typeSystem, record) -> record.get("path").asString())
                        .all()
                        .stream()
                        .filter(path -> !path.equals(filePath))
                        .distinct()
                        .toList());
    }

    @Override
    public List<CoChangePartner> coChanged(String filePath) {
        return timed("coChanged", filePath, EDGE_WEIGHT_BUDGET_MS, () ->
                new ArrayList<>(neo4jClient.query(CO_CHANGED_QUERY)
                        .bind(filePath).to("path")
                        .fetchAs(CoChangePartner.class)
                        .mappedBy((typeSystem, record) -> CoChangePartner.builder()
                                .filePath(record.get("path").asString())
                                .frequency(record.get("frequency").asDouble(0.0))
                                .coChangeCount(record.get("coChangeCount").asInt(0))
                                .build())
                        .all()));
    }

    @Override
    public Optional<TestCoverage> testCoverage(String filePath) {
        return timed("testCoverage", filePath, ONE_HOP_BUDGET_MS, () -> {
            Optional<FileNode> source = fileNodeRepository.findByPath(filePath);
            if (source.isEmpty()) {
                return Optional.empty();
            }
            List<FileNode> tests = fileNodeRepository.findTestsOf(filePath);
            int sourceLoc = locOf(source.get());
            int testLoc = tests.stream().mapToInt(this::locOf).sum();
            List<String> testPaths = tests.stream().map(FileNode::getPath).toList();
            return Optional.of(TestCoverage.builder()
                    .sourceLoc(sourceLoc)
                    .testLoc(testLoc)
                    .ratio(TestCoverage.smoothedRatio(testLoc, sourceLoc))
                    .testFiles(new ArrayList<>(testPaths))
                    .build());
        });
    }

    @Override
    public OwnershipHistory ownershipHistory(String filePath, int windowDays) {
        Instant now = clock.instant();
        ZonedDateTime since = ZonedDateTime.ofInstant(now.minus(Duration.ofDays(windowDays)), ZoneOffset.UTC);
        List<CommitAuthorship> commits = timed("ownershipHistory", filePath, ONE_HOP_BUDGET_MS, () ->
                new ArrayList<>(neo4jClient.query(AUTHORSHIP_QUERY)
                        .bindAll(Map.of("path", filePath, "since", since))
                        .fetchAs(CommitAuthorship.class)
                        .mappedBy((typeSystem, record) -> CommitAuthorship.builder()
                                .sha(record.get("sha").asString(null))
                                .authorEmail(record.get("email").asString(null))
                                .authoredAt(toInstant(record.get("authoredAt")))
                                .build())
                        .all()));
        return OwnershipAnalyzer.analyze(commits, now, windowDays);
    }

    @Override
    public Set<GraphNodeRef> neighbors(GraphNodeRef node, int hops) {
        if (hops < 1 || hops > 2) {
            throw new IllegalArgumentException("hops must be 1 or 2, got " + hops);
        }
        String cypher = neighborsQuery(node.getLabel(), hops);
        return timed("neighbors", node.getId(), ONE_HOP_BUDGET_MS * hops, () ->
                new LinkedHashSet<>(neo4jClient.query(cypher)
                        .bindAll(Map.of("id", node.getId(), "limit", NEIGHBOR_LIMIT))
                        .fetchAs(GraphNodeRef.class)
                        .mappedBy((typeSystem, record) -> GraphNodeRef.builder()
                                .id(record.get("id").asString())
                                .label(record.get("label").asString(null))
                                .name(record.get("name").asString(null))
                                .build())
                        .all()));
    }

    @Override
    public List<String> recentCommitMessages(String filePath, int windowDays, int limit) {
        ZonedDateTime since = ZonedDateTime.ofInstant(clock.instant().minus(Duration.ofDays(windowDays)), ZoneOffset.UTC);
        return timed("recentCommitMessages", filePath, ONE_HOP_BUDGET_MS, () ->
                new ArrayList<>(neo4jClient.query(RECENT_MESSAGES_QUERY)
                        .bindAll(Map.of("path", filePath, "since", since, "limit", limit))
                        .fetchAs(String.class)
                        .mappedBy((typeSystem, record) -> record.get("message").asString())
                        .all()));
    }

    /**
     * Labels outside {@link #NEIGHBOR_ANCHORS} fall back to a union of the indexed lookups.
     */
    static String neighborsQuery(String label, int hops) {
        String anchor = label != null ? NEIGHBOR_ANCHORS.getOrDefault(label, ANY_LABEL_ANCHOR) : ANY_LABEL_ANCHOR;
        return anchor + "\n" + NEIGHBORS_TAIL.formatted(hops);
    }

    private int locOf(FileNode file) {
        return file.getLoc() == null ? 0 : file.getLoc();
    }

    /**
     * Runs a read, maps connectivity failures to {@link GraphUnavailableException}
     * and warns when the call overshoots its latency budget.
     */
    private <T> T timed(String operation, String key, long budgetMs, Supplier<T> query) {
        long start = System.nanoTime();
        try {
            return query.get();
        } catch (ServiceUnavailableException | SessionExpiredException | TransientException e) {
            throw new GraphUnavailableException("Graph store unavailable during " + operation, e);
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new GraphUnavailableException("Graph store unavailable during " + operation, e);
        } finally {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (elapsedMs > budgetMs) {
                log.warn("[GraphStore] {} for {} took {}ms (budget {}ms)", operation, key, elapsedMs, budgetMs);
            } else {
                log.trace("[GraphStore] {} for {} took {}ms", operation, key, elapsedMs);
            }
        }
    }

    public static Instant toInstant(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return value.asZonedDateTime().toInstant();
        } catch (Uncoercible notZoned) {
            try {
                return value.asLocalDateTime().toInstant(ZoneOffset.UTC);
            } catch (Uncoercible notLocal) {
                return Instant.ofEpochMilli(value.asLong());
            }
        }
    }
}
