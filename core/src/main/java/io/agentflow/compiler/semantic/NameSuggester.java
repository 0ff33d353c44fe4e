package io.agentflow.compiler.semantic;

import java.util.Collection;
import java.util.Optional;

/**
 * Picks the closest known name for a misspelled reference. A candidate qualifies when its
 * Levenshtein distance to the written name is at most 2, or at most a third of the name's
 * length for longer names. Ties go to the earliest candidate.
 */
public final class NameSuggester {

    private NameSuggester() {}

    public static Optional<String> suggest(String name, Collection<String> candidates) {
        int limit = Math.max(2, name.length() / 3);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            if (candidate.equals(name)) {
                continue;
            }
            int distance = distance(name, candidate);
            if (distance <= limit && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Help text for a diagnostic, or {@code null} when nothing is close enough. */
    public static String help(String name, Collection<String> candidates) {
        return suggest(name, candidates).map(s -> "did you mean '" + s + "'?").orElse(null);
    }

    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
