package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfile;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfileSelector;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blast radius: how many files are structurally tied to the changed file, counted across
 * the paths it was renamed from.
 */
@Component
public class CouplingSignalCalculator extends AbstractCachedSignalCalculator {

    private final GraphStoreAdapter graph;
    private final RiskProfileSelector profiles;

    public CouplingSignalCalculator(GraphStoreAdapter graph, RiskProfileSelector profiles,
                                    SignalCache cache, RiskScopeProperties properties) {
        super(cache, properties.getCache().getSignalTtl());
        this.graph = graph;
        this.profiles = profiles;
    }

    @Override
    public SignalName name() {
        return SignalName.COUPLING;
    }

    @Override
    protected SignalResult compute(String filePath) {
        List<String> paths = RenameHistory.pathsOf(graph, filePath);
        int coupling = graph.coupling(paths);
        RiskProfile profile = profiles.select(filePath).getProfile();
        RiskLevel level = profile.couplingLevel(coupling);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("profile", profile.getKey());
        if (paths.size() > 1) {
            details.put("priorPaths", paths.subList(1, paths.size()));
        }
        return computed(filePath, coupling, level)
                .evidenceText(String.format("%d files structurally depend on or are used by %s (%s)",
                        coupling, filePath, level.getLabel()))
                .details(details)
                .build();
    }
}
