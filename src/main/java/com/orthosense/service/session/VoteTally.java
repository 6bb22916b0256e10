package com.orthosense.service.session;

import com.orthosense.domain.ExerciseLabel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Majority vote over per-window labels.
 *
 * <p>The label with most votes wins; on an equal count the label that received its first vote
 * earliest wins. Not thread-safe.
 */
public final class VoteTally {

    private final Map<ExerciseLabel, Integer> votes = new LinkedHashMap<>();
    private int total;

    public void add(ExerciseLabel label) {
        Objects.requireNonNull(label, "label");
        votes.merge(label, 1, Integer::sum);
        total++;
    }

    public int totalVotes() {
        return total;
    }

    public boolean isEmpty() {
        return total == 0;
    }

    public int votesFor(ExerciseLabel label) {
        return votes.getOrDefault(label, 0);
    }

    public Optional<ExerciseLabel> winner() {
        ExerciseLabel best = null;
        int bestCount = 0;
        for (Map.Entry<ExerciseLabel, Integer> e : votes.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /** Winner votes divided by all votes, or 0 when nothing was tallied. */
    public double confidence() {
        return winner().map(w -> (double) votesFor(w) / total).orElse(0.0);
    }

    public Map<ExerciseLabel, Integer> asMap() {
        return Collections.unmodifiableMap(votes);
    }
}
