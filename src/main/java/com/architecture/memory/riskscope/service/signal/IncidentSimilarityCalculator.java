package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.search.IncidentMatch;
import com.architecture.memory.riskscope.service.search.IncidentSearchIndex;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BM25 score of the file's recent commit messages against past incidents.
 * Top score &lt;5 LOW, 5-10 MEDIUM, &ge;10 HIGH.
 */
@Component
public class IncidentSimilarityCalculator extends AbstractCachedSignalCalculator {

    static final double MEDIUM_FROM = 5.0;
    static final double HIGH_FROM = 10.0;
    static final int TOP_MATCHES = 3;

    private final GraphStoreAdapter graph;
    private final IncidentSearchIndex searchIndex;
    private final RiskScopeProperties.Tier2 tier2;

    public IncidentSimilarityCalculator(GraphStoreAdapter graph, IncidentSearchIndex searchIndex,
                                        SignalCache cache, RiskScopeProperties properties) {
        super(cache, properties.getCache().getSignalTtl());
        this.graph = graph;
        this.searchIndex = searchIndex;
        this.tier2 = properties.getTier2();
    }

    @Override
    public SignalName name() {
        return SignalName.INCIDENT_SIMILARITY;
    }

    @Override
    protected SignalResult compute(String filePath) {
        List<String> messages = graph.recentCommitMessages(filePath, tier2.getWindowDays(), tier2.getRecentCommitLimit());
        if (messages.isEmpty()) {
            return computed(filePath, 0.0, RiskLevel.LOW)
                    .evidenceText(String.format("no commits to %s in the last %d days to compare with incidents",
                            filePath, tier2.getWindowDays()))
                    .build();
        }

        List<IncidentMatch> matches = searchIndex.search(String.join("\n", messages), TOP_MATCHES, filePath);
        if (matches.isEmpty()) {
            return computed(filePath, 0.0, RiskLevel.LOW)
                    .evidenceText("recent commits to " + filePath + " resemble no recorded incident")
                    .build();
        }

        IncidentMatch top = matches.get(0);
        RiskLevel level = levelFor(top.getScore());

        Map<String, Object> incidents = new LinkedHashMap<>();
        matches.forEach(m -> incidents.put(m.getIncidentId(), m.getScore()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("incidents", incidents);
        details.put("topIncidentTitle", top.getTitle());
        details.put("topIncidentAffectsFile", top.isAffectsFile());

        return computed(filePath, top.getScore(), level)
                .evidenceText(String.format("recent commits resemble incident %s \"%s\" (score %.1f%s, %s)",
                        top.getIncidentId(), top.getTitle(), top.getScore(),
                        top.isAffectsFile() ? ", already linked to this file" : "", level.getLabel()))
                .details(details)
                .build();
    }

    static RiskLevel levelFor(double score) {
        if (score >= HIGH_FROM) {
            return RiskLevel.HIGH;
        }
        return score >= MEDIUM_FROM ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }
}
