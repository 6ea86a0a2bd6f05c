package com.architecture.memory.riskscope.service.temporal;

import com.architecture.memory.riskscope.dto.graph.CoChangeEdge;
import com.architecture.memory.riskscope.dto.graph.CommitRecord;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import com.architecture.memory.riskscope.service.graph.Neo4jGraphStoreAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
@Component
@RequiredArgsConstructor
public class Neo4jCoChangeStore implements CoChangeStore {

    static final int WRITE_BATCH = 1000;

    private static final String COMMITS_IN_WINDOW = """
            MATCH (c:Commit)-[:MODIFIES]->(f:File)
            WHERE c.authoredAt >= $since
            RETURN c.sha AS sha, c.authoredAt AS authoredAt, collect(DISTINCT f.path) AS files
            """;

    private static final String COMMITS_TOUCHING = """
            MATCH (c:Commit)-[:MODIFIES]->(f:File)
            WHERE f.path IN $paths AND c.authoredAt >= $since
            WITH DISTINCT c
            MATCH (c)-[:MODIFIES]->(g:File)
            RETURN c.sha AS sha, c.authoredAt AS authoredAt, collect(DISTINCT g.path) AS files
            """;

    private static final String FILES_CHANGED_SINCE = """
            MATCH (c:Commit)-[:MODIFIES]->(f:File)
            WHERE coalesce(c.ingestedAt, c.authoredAt) > $since
            RETURN DISTINCT f.path AS path
            """;

    private static final String PARTNERS_OF = """
            MATCH (f:File)-[:CO_CHANGED]-(p:File)
            WHERE f.path IN $paths
            RETURN DISTINCT p.path AS path
            """;

    private static final String DELETE_ALL = "MATCH (:File)-[r:CO_CHANGED]->(:File) DELETE r";

    private static final String DELETE_INCIDENT = """
            MATCH (f:File)-[r:CO_CHANGED]-(:File)
            WHERE f.path IN $paths
            DELETE r
            """;

    private static final String WRITE_EDGES = """
            UNWIND $edges AS e
            MATCH (a:File {path: e.fileA}), (b:File {path: e.fileB})
            MERGE (a)-[r:CO_CHANGED]->(b)
            SET r.frequency = e.frequency,
                r.coChangeCount = e.coChangeCount,
                r.windowDays = e.windowDays,
                r.computedAt = $computedAt
            """;

    private final Neo4jClient neo4jClient;
    private final Clock clock;

    @Override
    public List<CommitRecord> commitsInWindow(int windowDays) {
        return guarded("commitsInWindow", () -> new ArrayList<>(neo4jClient.query(COMMITS_IN_WINDOW)
                .bind(since(windowDays)).to("since")
                .fetchAs(CommitRecord.class)
                .mappedBy((typeSystem, record) -> toCommit(record.get("sha"), record.get("authoredAt"), record.get("files")))
                .all()));
    }

    @Override
    public List<CommitRecord> commitsTouching(Collection<String> filePaths, int windowDays) {
        if (filePaths.isEmpty()) {
            return List.of();
        }
        return guarded("commitsTouching", () -> new ArrayList<>(neo4jClient.query(COMMITS_TOUCHING)
                .bindAll(Map.of("paths", List.copyOf(filePaths), "since", since(windowDays)))
                .fetchAs(CommitRecord.class)
                .mappedBy((typeSystem, record) -> toCommit(record.get("sha"), record.get("authoredAt"), record.get("files")))
                .all()));
    }

    @Override
    public Set<String> filesChangedSince(Instant since) {
        return guarded("filesChangedSince", () -> new LinkedHashSet<>(neo4jClient.query(FILES_CHANGED_SINCE)
                .bind(ZonedDateTime.ofInstant(since, ZoneOffset.UTC)).to("since")
                .fetchAs(String.class)
                .mappedBy((typeSystem, record) -> record.get("path").asString())
                .all()));
    }

    @Override
    public Set<String> partnersOf(Collection<String> filePaths) {
        if (filePaths.isEmpty()) {
            return Set.of();
        }
        return guarded("partnersOf", () -> new LinkedHashSet<>(neo4jClient.query(PARTNERS_OF)
                .bind(List.copyOf(filePaths)).to("paths")
                .fetchAs(String.class)
                .mappedBy((typeSystem, record) -> record.get("path").asString())
                .all()));
    }

    @Override
    @Transactional
    public void replaceAll(List<CoChangeEdge> edges) {
        guarded("replaceAll", () -> {
            neo4jClient.query(DELETE_ALL).run();
            write(edges);
            return null;
        });
    }

    @Override
    @Transactional
    public void replaceIncident(Collection<String> filePaths, List<CoChangeEdge> edges) {
        guarded("replaceIncident", () -> {
            neo4jClient.query(DELETE_INCIDENT).bind(List.copyOf(filePaths)).to("paths").run();
            write(edges);
            return null;
        });
    }

    private void write(List<CoChangeEdge> edges) {
        ZonedDateTime computedAt = ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        for (int from = 0; from < edges.size(); from += WRITE_BATCH) {
            List<Map<String, Object>> rows = edges.subList(from, Math.min(edges.size(), from + WRITE_BATCH))
                    .stream()
                    .map(e -> Map.<String, Object>of(
                            "fileA", e.getFileA(),
                            "fileB", e.getFileB(),
                            "frequency", e.getFrequency(),
                            "coChangeCount", e.getCoChangeCount(),
                            "windowDays", e.getWindowDays()))
                    .toList();
            neo4jClient.query(WRITE_EDGES)
                    .bindAll(Map.of("edges", rows, "computedAt", computedAt))
                    .run();
        }
        log.debug("[Temporal] Wrote {} CO_CHANGED edges", edges.size());
    }

    private ZonedDateTime since(int windowDays) {
        return ZonedDateTime.ofInstant(clock.instant().minus(Duration.ofDays(windowDays)), ZoneOffset.UTC);
    }

    private static CommitRecord toCommit(Value sha, Value authoredAt, Value files) {
        return CommitRecord.builder()
                .sha(sha.asString())
                .authoredAt(Neo4jGraphStoreAdapter.toInstant(authoredAt))
                .files(new LinkedHashSet<>(files.asList(Value::asString)))
                .build();
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new GraphUnavailableException("Graph store unavailable during " + operation, e);
        }
    }
}
