package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.CoChangePartner;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfile;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfileSelector;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Highest CO_CHANGED frequency among the file's partners. No partners means 0.0.
 *
 * <p>Partners found under earlier names of the file are merged in; a partner seen under
 * several names keeps its highest frequency.</p>
 */
@Component
public class CoChangeSignalCalculator extends AbstractCachedSignalCalculator {

    static final int PARTNERS_IN_EVIDENCE = 5;

    private final GraphStoreAdapter graph;
    private final RiskProfileSelector profiles;

    public CoChangeSignalCalculator(GraphStoreAdapter graph, RiskProfileSelector profiles,
                                    SignalCache cache, RiskScopeProperties properties) {
        super(cache, properties.getCache().getSignalTtl());
        this.graph = graph;
        this.profiles = profiles;
    }

    @Override
    public SignalName name() {
        return SignalName.CO_CHANGE;
    }

    @Override
    protected SignalResult compute(String filePath) {
        List<String> paths = RenameHistory.pathsOf(graph, filePath);
        List<CoChangePartner> partners = partnersAcross(paths);
        double max = partners.stream().mapToDouble(CoChangePartner::getFrequency).max().orElse(0.0);
        RiskProfile profile = profiles.select(filePath).getProfile();
        RiskLevel level = profile.coChangeLevel(max);

        Map<String, Object> top = new LinkedHashMap<>();
        partners.stream()
                .limit(PARTNERS_IN_EVIDENCE)
                .forEach(p -> top.put(p.getFilePath(), p.getFrequency()));

        String evidence = partners.isEmpty()
                ? "no files historically change together with " + filePath
                : String.format("%s changes together with %s in %.0f%% of commits (%d partners, %s)",
                        filePath, partners.get(0).getFilePath(), max * 100, partners.size(), level.getLabel());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("partners", top);
        details.put("profile", profile.getKey());
        return computed(filePath, max, level)
                .evidenceText(evidence)
                .details(details)
                .build();
    }

    private List<CoChangePartner> partnersAcross(List<String> paths) {
        if (paths.size() == 1) {
            return graph.coChanged(paths.get(0));
        }
        Map<String, CoChangePartner> merged = new LinkedHashMap<>();
        for (String path : paths) {
            for (CoChangePartner partner : graph.coChanged(path)) {
                if (paths.contains(partner.getFilePath())) {
                    continue;
                }
                merged.merge(partner.getFilePath(), partner,
                        (a, b) -> a.getFrequency() >= b.getFrequency() ? a : b);
            }
        }
        return merged.values().stream()
                .sorted(Comparator.comparingDouble(CoChangePartner::getFrequency).reversed())
                .toList();
    }
}
