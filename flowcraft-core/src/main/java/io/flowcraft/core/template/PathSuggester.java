package io.flowcraft.core.template;

import java.util.Collection;
import java.util.Optional;

/// Finds the closest known path to a mistyped one.
///
/// Uses case-insensitive Levenshtein distance; candidates further than
/// {@link #MAX_DISTANCE} edits away are never suggested.
public final class PathSuggester {

    public static final int MAX_DISTANCE = 2;

    private PathSuggester() {}

    /// Returns the nearest candidate within {@link #MAX_DISTANCE}, ties going to
    /// the earliest candidate.
    public static Optional<String> suggest(String path, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = distance(path.toLowerCase(), candidate.toLowerCase());
            if (distance <= MAX_DISTANCE && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
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
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] =
                        Math.min(
                                Math.min(current[j - 1] + 1, previous[j] + 1),
                                previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
