package com.architecture.memory.riskscope.service.temporal;

import com.architecture.memory.riskscope.dto.graph.CoChangeEdge;
import com.architecture.memory.riskscope.dto.graph.CommitRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CoChangeCalculatorTest {

    @Test
    void frequencyIsSharedCommitsOverCommitsTouchingEither() {
        // a+b together 3 times, a alone once, b alone once -> 3 / 5
        List<CommitRecord> commits = List.of(
                commit("1", "a.go", "b.go"),
                commit("2", "a.go", "b.go"),
                commit("3", "a.go", "b.go"),
                commit("4", "a.go"),
                commit("5", "b.go"));

        CoChangeCalculator.Computation result = CoChangeCalculator.compute(commits, null, 90, 0.3, 100);

        assertThat(result.edges()).singleElement().satisfies(edge -> {
            assertThat(edge.getFileA()).isEqualTo("a.go");
            assertThat(edge.getFileB()).isEqualTo("b.go");
            assertThat(edge.getFrequency()).isCloseTo(0.6, within(1e-9));
            assertThat(edge.getCoChangeCount()).isEqualTo(3);
            assertThat(edge.getWindowDays()).isEqualTo(90);
        });
        assertThat(result.commitsScanned()).isEqualTo(5);
    }

    @Test
    void pairOrderDoesNotMatter() {
        List<CommitRecord> forward = List.of(commit("1", "a.go", "z.go"), commit("2", "a.go", "z.go"));
        List<CommitRecord> backward = List.of(commit("1", "z.go", "a.go"), commit("2", "z.go", "a.go"));

        CoChangeEdge one = CoChangeCalculator.compute(forward, null, 90, 0.3, 100).edges().get(0);
        CoChangeEdge two = CoChangeCalculator.compute(backward, null, 90, 0.3, 100).edges().get(0);

        assertThat(one).isEqualTo(two);
        assertThat(one.getFileA()).isEqualTo("a.go");
        assertThat(one.partnerOf("z.go")).isEqualTo("a.go");
    }

    @Test
    void dropsPairsBelowMinimumFrequency() {
        List<CommitRecord> commits = new ArrayList<>();
        commits.add(commit("1", "a.go", "b.go"));
        for (int i = 0; i < 4; i++) {
            commits.add(commit("a" + i, "a.go"));
        }

        assertThat(CoChangeCalculator.compute(commits, null, 90, 0.3, 100).edges()).isEmpty();
        assertThat(CoChangeCalculator.compute(commits, null, 90, 0.2, 100).edges()).hasSize(1);
    }

    @Test
    void ignoresBulkCommitsEntirely() {
        Set<String> many = new LinkedHashSet<>();
        for (int i = 0; i < 101; i++) {
            many.add("gen/file" + i + ".go");
        }
        many.add("a.go");
        List<CommitRecord> commits = List.of(
                CommitRecord.builder().sha("bulk").authoredAt(Instant.EPOCH).files(many).build(),
                commit("1", "a.go", "b.go"));

        CoChangeCalculator.Computation result = CoChangeCalculator.compute(commits, null, 90, 0.3, 100);

        assertThat(result.bulkCommitsIgnored()).isEqualTo(1);
        assertThat(result.commitsScanned()).isEqualTo(1);
        assertThat(result.edges()).singleElement()
                .satisfies(edge -> assertThat(edge.getFrequency()).isEqualTo(1.0));
    }

    @Test
    void countsDuplicateShaOnce() {
        List<CommitRecord> commits = List.of(
                commit("1", "a.go", "b.go"),
                commit("1", "a.go", "b.go"),
                commit("2", "a.go"));

        CoChangeCalculator.Computation result = CoChangeCalculator.compute(commits, null, 90, 0.3, 100);

        assertThat(result.edges().get(0).getFrequency()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void focusRestrictsToIncidentPairs_withSameFrequencies() {
        List<CommitRecord> commits = List.of(
                commit("1", "a.go", "b.go", "c.go"),
                commit("2", "b.go", "c.go"),
                commit("3", "a.go", "b.go"));

        List<CoChangeEdge> all = CoChangeCalculator.compute(commits, null, 90, 0.3, 100).edges();
        List<CoChangeEdge> focused = CoChangeCalculator.compute(commits, Set.of("a.go"), 90, 0.3, 100).edges();

        assertThat(focused).allMatch(e -> e.touches("a.go"));
        assertThat(focused).containsExactlyElementsOf(all.stream().filter(e -> e.touches("a.go")).toList());
        assertThat(all).anyMatch(e -> e.getFileA().equals("b.go") && e.getFileB().equals("c.go"));
    }

    private static CommitRecord commit(String sha, String... files) {
        return CommitRecord.builder()
                .sha(sha)
                .authoredAt(Instant.parse("2026-01-01T00:00:00Z"))
                .files(new LinkedHashSet<>(List.of(files)))
                .build();
    }
}
