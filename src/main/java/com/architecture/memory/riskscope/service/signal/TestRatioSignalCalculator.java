package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.TestCoverage;
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
import java.util.Optional;

/**
 * Test lines per source line. A file the graph has never seen is UNKNOWN, not HIGH.
 * A renamed file without coverage of its own falls back to its most recent earlier name.
 */
@Component
public class TestRatioSignalCalculator extends AbstractCachedSignalCalculator {

    private final GraphStoreAdapter graph;
    private final RiskProfileSelector profiles;

    public TestRatioSignalCalculator(GraphStoreAdapter graph, RiskProfileSelector profiles,
                                     SignalCache cache, RiskScopeProperties properties) {
        super(cache, properties.getCache().getSignalTtl());
        this.graph = graph;
        this.profiles = profiles;
    }

    @Override
    public SignalName name() {
        return SignalName.TEST_RATIO;
    }

    @Override
    protected SignalResult compute(String filePath) {
        Optional<TestCoverage> coverage = graph.testCoverage(filePath);
        String coveredPath = filePath;
        if (coverage.isEmpty()) {
            List<String> paths = RenameHistory.pathsOf(graph, filePath);
            for (String prior : paths.subList(1, paths.size())) {
                coverage = graph.testCoverage(prior);
                if (coverage.isPresent()) {
                    coveredPath = prior;
                    break;
                }
            }
        }
        if (coverage.isEmpty()) {
            return SignalResult.unknown(name(), filePath, "file not present in the graph");
        }
        TestCoverage c = coverage.get();
        RiskProfile profile = profiles.select(filePath).getProfile();
        RiskLevel level = profile.testRatioLevel(c.getRatio());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sourceLoc", c.getSourceLoc());
        details.put("testLoc", c.getTestLoc());
        details.put("testFiles", c.getTestFiles());
        details.put("profile", profile.getKey());
        if (!coveredPath.equals(filePath)) {
            details.put("coveredPath", coveredPath);
        }
        return computed(filePath, c.getRatio(), level)
                .evidenceText(String.format("test ratio %.2f (%d test lines for %d source lines, %d test files, %s)",
                        c.getRatio(), c.getTestLoc(), c.getSourceLoc(), c.getTestFiles().size(), level.getLabel()))
                .details(details)
                .build();
    }
}
