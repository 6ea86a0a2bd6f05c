package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.CoChangePartner;
import com.architecture.memory.riskscope.dto.graph.OwnershipHistory;
import com.architecture.memory.riskscope.dto.graph.TestCoverage;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.dto.risk.SignalStatus;
import com.architecture.memory.riskscope.service.cache.CacheKeys;
import com.architecture.memory.riskscope.service.cache.CaffeineSignalCache;
import com.architecture.memory.riskscope.service.cache.NoOpSignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import com.architecture.memory.riskscope.service.search.IncidentMatch;
import com.architecture.memory.riskscope.service.search.IncidentSearchIndex;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfileCatalog;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfileSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignalCalculatorsTest {

    private static final String FILE = "internal/auth/session.go";

    @Mock
    private GraphStoreAdapter graph;

    @Mock
    private IncidentSearchIndex searchIndex;

    private RiskScopeProperties properties;
    private CaffeineSignalCache cache;
    private RiskProfileSelector selector;

    @BeforeEach
    void setUp() {
        properties = new RiskScopeProperties();
        cache = new CaffeineSignalCache(100);
        selector = new RiskProfileSelector(new RiskProfileCatalog(properties), properties);
    }

    @Test
    void coupling_classifiesAgainstDefaultProfile() {
        when(graph.coupling(List.of(FILE))).thenReturn(11, 10, 5);

        assertThat(new CouplingSignalCalculator(graph, selector, new NoOpSignalCache(), properties)
                .calculate(FILE).getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(new CouplingSignalCalculator(graph, selector, new NoOpSignalCache(), properties)
                .calculate(FILE).getSignalLevel()).isEqualTo(RiskLevel.MEDIUM);
        SignalResult low = new CouplingSignalCalculator(graph, selector, new NoOpSignalCache(), properties)
                .calculate(FILE);
        assertThat(low.getSignalLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(low.getDetails()).containsEntry("profile", RiskProfileCatalog.DEFAULT);
    }

    @Test
    void coupling_usesAdaptiveProfileBands() {
        properties.getProfiles().setAdaptive(true);
        when(graph.coupling(List.of(FILE))).thenReturn(9);
        CouplingSignalCalculator calculator = new CouplingSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getDetails()).containsEntry("profile", RiskProfileCatalog.GO_BACKEND);
    }

    @Test
    void coupling_countsAcrossRenamedPaths() {
        when(graph.priorPaths(FILE)).thenReturn(List.of("internal/auth/sess.go", "auth/sess.go"));
        when(graph.coupling(List.of(FILE, "internal/auth/sess.go", "auth/sess.go"))).thenReturn(13);
        CouplingSignalCalculator calculator = new CouplingSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(13.0);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getDetails()).containsEntry("priorPaths", List.of("internal/auth/sess.go", "auth/sess.go"));
    }

    @Test
    void coChange_mergesPartnersOfRenamedPaths_keepingHighestFrequency() {
        String old = "internal/auth/sess.go";
        when(graph.priorPaths(FILE)).thenReturn(List.of(old));
        when(graph.coChanged(FILE)).thenReturn(List.of(partner("internal/auth/cookie.go", 0.2)));
        when(graph.coChanged(old)).thenReturn(List.of(
                partner("internal/auth/cookie.go", 0.75),
                partner("internal/auth/token.go", 0.5),
                partner(FILE, 0.9)));
        CoChangeSignalCalculator calculator = new CoChangeSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(0.75);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        @SuppressWarnings("unchecked")
        Map<String, Object> partners = (Map<String, Object>) result.getDetails().get("partners");
        assertThat(partners).containsOnlyKeys("internal/auth/cookie.go", "internal/auth/token.go");
        assertThat(partners.keySet()).first().isEqualTo("internal/auth/cookie.go");
    }

    @Test
    void testRatio_fallsBackToCoverageOfEarlierName() {
        String old = "internal/auth/sess.go";
        when(graph.testCoverage(FILE)).thenReturn(Optional.empty());
        when(graph.priorPaths(FILE)).thenReturn(List.of(old));
        when(graph.testCoverage(old)).thenReturn(Optional.of(TestCoverage.builder()
                .sourceLoc(100).testLoc(90).ratio(TestCoverage.smoothedRatio(90, 100)).build()));
        TestRatioSignalCalculator calculator = new TestRatioSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.isComputed()).isTrue();
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.getDetails()).containsEntry("coveredPath", old);
    }

    @Test
    void coupling_isServedFromCache_onSecondCall() {
        when(graph.coupling(List.of(FILE))).thenReturn(14);
        CouplingSignalCalculator calculator = new CouplingSignalCalculator(graph, selector, cache, properties);

        SignalResult first = calculator.calculate(FILE);
        SignalResult second = calculator.calculate(FILE);

        assertThat(first.getValue()).isEqualTo(14.0);
        assertThat(first.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(second).isEqualTo(first);
        verify(graph, times(1)).coupling(List.of(FILE));
    }

    @Test
    void graphFailure_isRetriedOnceThenUnknown_andNotCached() {
        when(graph.coupling(List.of(FILE))).thenThrow(new GraphUnavailableException("connection refused"));
        CouplingSignalCalculator calculator = new CouplingSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getStatus()).isEqualTo(SignalStatus.UNKNOWN);
        assertThat(result.getValue()).isNull();
        verify(graph, times(2)).coupling(List.of(FILE));
        assertThat(cache.get(CacheKeys.signal(SignalName.COUPLING, FILE), SignalResult.class)).isEmpty();
    }

    @Test
    void graphFailure_recoversOnRetry() {
        when(graph.coupling(List.of(FILE)))
                .thenThrow(new GraphUnavailableException("timeout"))
                .thenReturn(3);
        CouplingSignalCalculator calculator = new CouplingSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.isComputed()).isTrue();
        assertThat(result.getValue()).isEqualTo(3.0);
    }

    @Test
    void coChange_usesHighestPartnerFrequency() {
        when(graph.coChanged(FILE)).thenReturn(List.of(
                partner("internal/auth/token.go", 0.85),
                partner("internal/auth/cookie.go", 0.4)));
        CoChangeSignalCalculator calculator = new CoChangeSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(0.85);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getEvidenceText()).contains("internal/auth/token.go");
        @SuppressWarnings("unchecked")
        Map<String, Object> partners = (Map<String, Object>) result.getDetails().get("partners");
        assertThat(partners).containsKeys("internal/auth/token.go", "internal/auth/cookie.go");
    }

    @Test
    void coChange_withoutPartners_isZero() {
        when(graph.coChanged(FILE)).thenReturn(List.of());
        CoChangeSignalCalculator calculator = new CoChangeSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isZero();
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void testRatio_isUnknown_forFileMissingFromGraph() {
        when(graph.testCoverage(FILE)).thenReturn(Optional.empty());
        TestRatioSignalCalculator calculator = new TestRatioSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getStatus()).isEqualTo(SignalStatus.UNKNOWN);
        assertThat(cache.size()).isZero();
    }

    @Test
    void testRatio_isHigh_forUntestedFile() {
        when(graph.testCoverage(FILE)).thenReturn(Optional.of(TestCoverage.builder()
                .sourceLoc(200).testLoc(0).ratio(TestCoverage.smoothedRatio(0, 200)).build()));
        TestRatioSignalCalculator calculator = new TestRatioSignalCalculator(graph, selector, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getDetails()).containsEntry("sourceLoc", 200).containsEntry("testLoc", 0);
    }

    @Test
    void ownershipChurn_recentHandoverIsHigh() {
        when(graph.ownershipHistory(FILE, 90)).thenReturn(OwnershipHistory.builder()
                .currentOwner("bob@corp.io").previousOwner("alice@corp.io")
                .daysSinceTransition(12).commitCount(9).windowDays(90)
                .developers(List.of("alice@corp.io", "bob@corp.io"))
                .build());
        OwnershipChurnCalculator calculator = new OwnershipChurnCalculator(graph, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(12.0);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getDetails()).containsEntry("previousOwner", "alice@corp.io");
    }

    @Test
    void ownershipChurn_withoutHandoverIsLow() {
        when(graph.ownershipHistory(FILE, 90)).thenReturn(OwnershipHistory.builder()
                .currentOwner("alice@corp.io").daysSinceTransition(-1).commitCount(4).windowDays(90).build());
        OwnershipChurnCalculator calculator = new OwnershipChurnCalculator(graph, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(-1.0);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void ownershipChurn_levels() {
        assertThat(OwnershipChurnCalculator.levelFor(29)).isEqualTo(RiskLevel.HIGH);
        assertThat(OwnershipChurnCalculator.levelFor(30)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(OwnershipChurnCalculator.levelFor(90)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(OwnershipChurnCalculator.levelFor(91)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void incidentSimilarity_reportsTopMatch() {
        when(graph.recentCommitMessages(FILE, 90, 20)).thenReturn(List.of("fix session expiry race", "refresh token"));
        when(searchIndex.search(anyString(), eq(3), eq(FILE))).thenReturn(List.of(
                IncidentMatch.builder().incidentId("INC-7").title("Sessions dropped").score(12.5).affectsFile(true).build(),
                IncidentMatch.builder().incidentId("INC-2").title("Login outage").score(4.0).build()));
        IncidentSimilarityCalculator calculator = new IncidentSimilarityCalculator(graph, searchIndex, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isEqualTo(12.5);
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getDetails()).containsEntry("topIncidentTitle", "Sessions dropped")
                .containsEntry("topIncidentAffectsFile", true);
        assertThat(result.getEvidenceText()).contains("INC-7");
    }

    @Test
    void incidentSimilarity_withoutRecentCommits_skipsSearch() {
        when(graph.recentCommitMessages(eq(FILE), anyInt(), anyInt())).thenReturn(List.of());
        IncidentSimilarityCalculator calculator = new IncidentSimilarityCalculator(graph, searchIndex, cache, properties);

        SignalResult result = calculator.calculate(FILE);

        assertThat(result.getValue()).isZero();
        assertThat(result.getSignalLevel()).isEqualTo(RiskLevel.LOW);
        verifyNoInteractions(searchIndex);
    }

    @Test
    void incidentSimilarity_levels() {
        assertThat(IncidentSimilarityCalculator.levelFor(10.0)).isEqualTo(RiskLevel.HIGH);
        assertThat(IncidentSimilarityCalculator.levelFor(5.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(IncidentSimilarityCalculator.levelFor(4.99)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void cachedEntries_areSeparatedPerSignal() {
        when(graph.coupling(List.of(FILE))).thenReturn(2);
        when(graph.coChanged(FILE)).thenReturn(List.of(partner("a.go", 0.5)));

        new CouplingSignalCalculator(graph, selector, cache, properties).calculate(FILE);
        new CoChangeSignalCalculator(graph, selector, cache, properties).calculate(FILE);

        assertThat(cache.get(CacheKeys.signal(SignalName.COUPLING, FILE), SignalResult.class))
                .map(SignalResult::getValue).contains(2.0);
        assertThat(cache.get(CacheKeys.signal(SignalName.CO_CHANGE, FILE), SignalResult.class))
                .map(SignalResult::getValue).contains(0.5);
        verify(graph, never()).testCoverage(anyString());
    }

    private static CoChangePartner partner(String path, double frequency) {
        return CoChangePartner.builder().filePath(path).frequency(frequency).coChangeCount(5).build();
    }
}
