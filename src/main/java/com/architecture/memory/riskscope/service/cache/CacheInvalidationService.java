package com.architecture.memory.riskscope.service.cache;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Drops cached signals whose inputs changed in the graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheInvalidationService {

    static final Set<SignalName> COMMIT_SENSITIVE = EnumSet.of(
            SignalName.COUPLING,
            SignalName.CO_CHANGE,
            SignalName.TEST_RATIO,
            SignalName.OWNERSHIP_CHURN);

    private final SignalCache signalCache;

    /**
     * A new commit touched these files.
     */
    public void onCommit(Collection<String> filePaths) {
        for (String path : filePaths) {
            for (SignalName name : COMMIT_SENSITIVE) {
                signalCache.invalidate(CacheKeys.signal(name, path));
            }
        }
        log.debug("[Cache] Invalidated commit-sensitive signals for {} files", filePaths.size());
    }

    /**
     * CO_CHANGED edges touching these files were rewritten.
     */
    public void onCoChangeUpdated(Collection<String> filePaths) {
        filePaths.forEach(path -> signalCache.invalidate(CacheKeys.signal(SignalName.CO_CHANGE, path)));
    }

    /**
     * An incident was linked to the file.
     */
    public void onIncidentLinked(Collection<String> filePaths) {
        filePaths.forEach(path -> signalCache.invalidate(CacheKeys.signal(SignalName.INCIDENT_SIMILARITY, path)));
        log.debug("[Cache] Invalidated incident similarity for {} files", filePaths.size());
    }
}
