package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.OwnershipHistory;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Days since the file changed hands. Recent hand-overs are risky: >90 LOW, 30-90 MEDIUM, <30 HIGH.
 * No hand-over inside the window is LOW with value -1.
 */
@Component
public class OwnershipChurnCalculator extends AbstractCachedSignalCalculator {

    static final int HIGH_BELOW_DAYS = 30;
    static final int LOW_ABOVE_DAYS = 90;

    private final GraphStoreAdapter graph;
    private final int windowDays;

    public OwnershipChurnCalculator(GraphStoreAdapter graph, SignalCache cache, RiskScopeProperties properties) {
        super(cache, properties.getCache().getSignalTtl());
        this.graph = graph;
        this.windowDays = properties.getTier2().getWindowDays();
    }

    @Override
    public SignalName name() {
        return SignalName.OWNERSHIP_CHURN;
    }

    @Override
    protected SignalResult compute(String filePath) {
        OwnershipHistory history = graph.ownershipHistory(filePath, windowDays);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentOwner", history.getCurrentOwner());
        details.put("previousOwner", history.getPreviousOwner());
        details.put("commitCount", history.getCommitCount());
        details.put("developers", history.getDevelopers());

        if (!history.hasTransition()) {
            String evidence = history.getCommitCount() == 0
                    ? String.format("no commits to %s in the last %d days", filePath, windowDays)
                    : String.format("%s owned by %s with no hand-over in the last %d days",
                            filePath, history.getCurrentOwner(), windowDays);
            return computed(filePath, -1, RiskLevel.LOW)
                    .evidenceText(evidence)
                    .details(details)
                    .build();
        }

        int days = history.getDaysSinceTransition();
        RiskLevel level = levelFor(days);
        return computed(filePath, days, level)
                .evidenceText(String.format("ownership moved from %s to %s %d days ago (%s)",
                        history.getPreviousOwner(), history.getCurrentOwner(), days, level.getLabel()))
                .details(details)
                .build();
    }

    static RiskLevel levelFor(int daysSinceTransition) {
        if (daysSinceTransition < HIGH_BELOW_DAYS) {
            return RiskLevel.HIGH;
        }
        return daysSinceTransition > LOW_ABOVE_DAYS ? RiskLevel.LOW : RiskLevel.MEDIUM;
    }
}
