package com.architecture.memory.riskscope.service.temporal;

import com.architecture.memory.riskscope.dto.graph.CoChangeEdge;
import com.architecture.memory.riskscope.dto.graph.CommitRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives CO_CHANGED weights from commits:
 * {@code frequency = coChangeCount / commits touching either file}.
 *
 * <p>Pairs are keyed with the smaller path first, so A-B and B-A are the same edge.
 * Commits touching more than {@code maxFilesPerCommit} files are ignored entirely.</p>
 */
public final class CoChangeCalculator {

    private CoChangeCalculator() {
    }

    public record Computation(List<CoChangeEdge> edges, int commitsScanned, int bulkCommitsIgnored) {
    }

    private record FilePair(String a, String b) {

        static FilePair of(String x, String y) {
            return x.compareTo(y) < 0 ? new FilePair(x, y) : new FilePair(y, x);
        }
    }

    /**
     * @param focus when not null, only pairs with at least one endpoint in this set are produced
     */
    public static Computation compute(Collection<CommitRecord> commits, Set<String> focus,
                                      int windowDays, double minFrequency, int maxFilesPerCommit) {
        Map<String, CommitRecord> bySha = new LinkedHashMap<>();
        commits.forEach(c -> bySha.putIfAbsent(c.getSha(), c));

        Map<String, Integer> fileCounts = new HashMap<>();
        Map<FilePair, Integer> pairCounts = new HashMap<>();
        int bulk = 0;

        for (CommitRecord commit : bySha.values()) {
            Set<String> files = new TreeSet<>(commit.getFiles());
            if (files.size() > maxFilesPerCommit) {
                bulk++;
                continue;
            }
            files.forEach(f -> fileCounts.merge(f, 1, Integer::sum));

            List<String> ordered = new ArrayList<>(files);
            for (int i = 0; i < ordered.size(); i++) {
                for (int j = i + 1; j < ordered.size(); j++) {
                    String a = ordered.get(i);
                    String b = ordered.get(j);
                    if (focus != null && !focus.contains(a) && !focus.contains(b)) {
                        continue;
                    }
                    pairCounts.merge(FilePair.of(a, b), 1, Integer::sum);
                }
            }
        }

        List<CoChangeEdge> edges = new ArrayList<>();
        pairCounts.forEach((pair, together) -> {
            int either = fileCounts.get(pair.a()) + fileCounts.get(pair.b()) - together;
            double frequency = (double) together / either;
            if (frequency >= minFrequency) {
                edges.add(CoChangeEdge.builder()
                        .fileA(pair.a())
                        .fileB(pair.b())
                        .frequency(frequency)
                        .coChangeCount(together)
                        .windowDays(windowDays)
                        .build());
            }
        });
        edges.sort(Comparator.comparing(CoChangeEdge::getFileA).thenComparing(CoChangeEdge::getFileB));
        return new Computation(edges, bySha.size() - bulk, bulk);
    }
}
