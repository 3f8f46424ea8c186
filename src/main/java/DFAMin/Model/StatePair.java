package DFAMin.Model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Unordered pair of distinct states in canonical form: {@code first < second} under {@link StateId}'s order.
 */
public record StatePair(StateId first, StateId second) implements Comparable<StatePair> {
    private static final Comparator<StatePair> ORDER =
        Comparator.comparing(StatePair::first).thenComparing(StatePair::second);

    public StatePair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException("Pair is not canonical: " + first + ", " + second);
        }
    }

    /**
     * Canonicalize {p, q}.
     */
    public static StatePair of(StateId p, StateId q) {
        int cmp = p.compareTo(q);
        if (cmp == 0) {
            throw new IllegalArgumentException("A pair needs two distinct states: " + p);
        }
        return cmp < 0 ? new StatePair(p, q) : new StatePair(q, p);
    }

    public boolean contains(StateId state) {
        return first.equals(state) || second.equals(state);
    }

    @Override
    public int compareTo(StatePair other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "{" + first.format() + "," + second.format() + "}";
    }
}
