package com.architecture.memory.riskscope.service.temporal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.CoChangeEdge;
import com.architecture.memory.riskscope.dto.graph.CommitRecord;
import com.architecture.memory.riskscope.dto.ingest.CoChangeUpdateResult;
import com.architecture.memory.riskscope.service.cache.CacheInvalidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps CO_CHANGED edges in step with commit history. Off the request path.
 *
 * <p>Full rebuild recomputes the whole rolling window. Incremental update recomputes only the
 * edges incident to the given files; commits outside the window age out on the next full rebuild.</p>
 */
@Slf4j
@Service
public class TemporalCouplingBuilder {

    private final CoChangeStore store;
    private final CacheInvalidationService cacheInvalidation;
    private final RiskScopeProperties.Temporal settings;
    private final Clock clock;

    private Instant lastRun;

    public TemporalCouplingBuilder(CoChangeStore store, CacheInvalidationService cacheInvalidation,
                                   RiskScopeProperties properties, Clock clock) {
        this.store = store;
        this.cacheInvalidation = cacheInvalidation;
        this.settings = properties.getTemporal();
        this.clock = clock;
    }

    public synchronized CoChangeUpdateResult rebuildWindow() {
        long start = System.currentTimeMillis();
        Instant runStartedAt = clock.instant();

        List<CommitRecord> commits = store.commitsInWindow(settings.getWindowDays());
        CoChangeCalculator.Computation computation = compute(commits, null);
        store.replaceAll(computation.edges());
        lastRun = runStartedAt;

        Set<String> affected = endpoints(computation.edges());
        cacheInvalidation.onCoChangeUpdated(affected);

        CoChangeUpdateResult result = result(CoChangeUpdateResult.Mode.FULL, computation, affected, start);
        log.info("[Temporal] Full rebuild over {} days: {} commits ({} bulk ignored), {} edges in {}ms",
                settings.getWindowDays(), result.getCommitsScanned(), result.getBulkCommitsIgnored(),
                result.getEdgesWritten(), result.getDurationMs());
        return result;
    }

    /**
     * Recomputes every edge with at least one endpoint in {@code changedFiles}.
     */
    public synchronized CoChangeUpdateResult updateForFiles(Collection<String> changedFiles) {
        if (changedFiles.isEmpty()) {
            return CoChangeUpdateResult.skipped();
        }
        long start = System.currentTimeMillis();
        Set<String> focus = new LinkedHashSet<>(changedFiles);

        // partner counts need every commit of every co-changed file, not just the shared ones
        List<CommitRecord> direct = store.commitsTouching(focus, settings.getWindowDays());
        Set<String> coChanged = new LinkedHashSet<>();
        direct.stream()
                .filter(c -> c.getFiles().size() <= settings.getMaxFilesPerCommit())
                .forEach(c -> coChanged.addAll(c.getFiles()));
        coChanged.removeAll(focus);

        Map<String, CommitRecord> commits = new LinkedHashMap<>();
        direct.forEach(c -> commits.putIfAbsent(c.getSha(), c));
        store.commitsTouching(coChanged, settings.getWindowDays())
                .forEach(c -> commits.putIfAbsent(c.getSha(), c));

        Set<String> previousPartners = store.partnersOf(focus);
        CoChangeCalculator.Computation computation = compute(commits.values(), focus);
        store.replaceIncident(focus, computation.edges());

        Set<String> affected = new LinkedHashSet<>(focus);
        affected.addAll(previousPartners);
        affected.addAll(endpoints(computation.edges()));
        cacheInvalidation.onCoChangeUpdated(affected);

        CoChangeUpdateResult result = result(CoChangeUpdateResult.Mode.INCREMENTAL, computation, affected, start);
        log.info("[Temporal] Incremental update for {} files: {} commits, {} edges in {}ms",
                focus.size(), result.getCommitsScanned(), result.getEdgesWritten(), result.getDurationMs());
        return result;
    }

    /**
     * Updates edges for files changed since the previous run.
     */
    public synchronized CoChangeUpdateResult runIncremental() {
        Instant now = clock.instant();
        Instant since = lastRun != null ? lastRun : now.minus(settings.getRefreshInterval());
        Set<String> changed = store.filesChangedSince(since);
        if (changed.isEmpty()) {
            log.debug("[Temporal] No files changed since {}", since);
            lastRun = now;
            return CoChangeUpdateResult.skipped();
        }
        CoChangeUpdateResult result = updateForFiles(changed);
        lastRun = now;
        return result;
    }

    public synchronized Instant getLastRun() {
        return lastRun;
    }

    private CoChangeCalculator.Computation compute(Collection<CommitRecord> commits, Set<String> focus) {
        return CoChangeCalculator.compute(commits, focus,
                settings.getWindowDays(), settings.getMinFrequency(), settings.getMaxFilesPerCommit());
    }

    private static Set<String> endpoints(List<CoChangeEdge> edges) {
        Set<String> files = new LinkedHashSet<>();
        edges.forEach(e -> {
            files.add(e.getFileA());
            files.add(e.getFileB());
        });
        return files;
    }

    private static CoChangeUpdateResult result(CoChangeUpdateResult.Mode mode, CoChangeCalculator.Computation computation,
                                               Set<String> affected, long start) {
        return CoChangeUpdateResult.builder()
                .mode(mode)
                .commitsScanned(computation.commitsScanned())
                .bulkCommitsIgnored(computation.bulkCommitsIgnored())
                .edgesWritten(computation.edges().size())
                .affectedFiles(new LinkedHashSet<>(affected))
                .durationMs(System.currentTimeMillis() - start)
                .build();
    }
}
