package com.architecture.memory.riskscope.service.graph;

import com.architecture.memory.riskscope.dto.graph.CommitAuthorship;
import com.architecture.memory.riskscope.dto.graph.OwnershipHistory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Derives current/previous dominant authors from a file's commit authorship inside a window.
 *
 * <ul>
 *   <li>current owner: top author of the last 30 days, falling back to the top author of the window</li>
 *   <li>previous owner: top other author before the last 30 days, falling back to the second author of the window</li>
 *   <li>transition: the current owner's first commit after the previous owner's last one</li>
 * </ul>
 * Ties go to the author with the more recent commit, then to the lexicographically smaller email.
 */
public final class OwnershipAnalyzer {

    static final int RECENT_DAYS = 30;

    private OwnershipAnalyzer() {
    }

    public static OwnershipHistory analyze(List<CommitAuthorship> commits, Instant now, int windowDays) {
        Instant windowStart = now.minus(Duration.ofDays(windowDays));
        List<CommitAuthorship> inWindow = commits.stream()
                .filter(c -> c.getAuthorEmail() != null && c.getAuthoredAt() != null)
                .filter(c -> !c.getAuthoredAt().isBefore(windowStart) && !c.getAuthoredAt().isAfter(now))
                .sorted(Comparator.comparing(CommitAuthorship::getAuthoredAt))
                .collect(Collectors.toList());

        if (inWindow.isEmpty()) {
            return OwnershipHistory.builder()
                    .daysSinceTransition(-1)
                    .commitCount(0)
                    .windowDays(windowDays)
                    .build();
        }

        Instant recentCutoff = now.minus(Duration.ofDays(RECENT_DAYS));
        List<CommitAuthorship> recent = inWindow.stream()
                .filter(c -> !c.getAuthoredAt().isBefore(recentCutoff))
                .collect(Collectors.toList());
        List<CommitAuthorship> older = inWindow.stream()
                .filter(c -> c.getAuthoredAt().isBefore(recentCutoff))
                .collect(Collectors.toList());

        List<String> rankedAll = rankAuthors(inWindow);
        String current = rankAuthors(recent).stream().findFirst().orElse(rankedAll.get(0));

        String previous = rankAuthors(older).stream()
                .filter(a -> !a.equals(current))
                .findFirst()
                .orElseGet(() -> rankedAll.stream()
                        .filter(a -> !a.equals(current))
                        .findFirst()
                        .orElse(null));

        int days = -1;
        if (previous != null) {
            days = daysSinceTransition(inWindow, current, previous, now);
        }

        List<String> developers = new ArrayList<>(new LinkedHashSet<>(rankedAll));
        return OwnershipHistory.builder()
                .currentOwner(current)
                .previousOwner(previous)
                .daysSinceTransition(days)
                .commitCount(inWindow.size())
                .windowDays(windowDays)
                .developers(developers)
                .build();
    }

    private static int daysSinceTransition(List<CommitAuthorship> ordered, String current, String previous, Instant now) {
        Instant previousLast = ordered.stream()
                .filter(c -> c.getAuthorEmail().equals(previous))
                .map(CommitAuthorship::getAuthoredAt)
                .max(Comparator.naturalOrder())
                .orElseThrow();

        Optional<Instant> handOver = ordered.stream()
                .filter(c -> c.getAuthorEmail().equals(current))
                .map(CommitAuthorship::getAuthoredAt)
                .filter(t -> t.isAfter(previousLast))
                .findFirst();

        Instant transition = handOver.orElse(previousLast);
        return (int) Duration.between(transition, now).toDays();
    }

    /**
     * Authors by commit count, descending.
     */
    private static List<String> rankAuthors(List<CommitAuthorship> commits) {
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Instant> latest = new HashMap<>();
        for (CommitAuthorship c : commits) {
            counts.merge(c.getAuthorEmail(), 1, Integer::sum);
            latest.merge(c.getAuthorEmail(), c.getAuthoredAt(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return counts.keySet().stream()
                .sorted(Comparator.<String>comparingInt(counts::get).reversed()
                        .thenComparing(latest::get, Comparator.reverseOrder())
                        .thenComparing(Comparator.naturalOrder()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }
}
