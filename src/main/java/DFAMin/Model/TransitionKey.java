package DFAMin.Model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Key of the transition function: (source state, input symbol).
 */
public record TransitionKey(StateId source, String symbol) implements Comparable<TransitionKey> {
    private static final Comparator<TransitionKey> ORDER =
        Comparator.comparing(TransitionKey::source).thenComparing(TransitionKey::symbol);

    public TransitionKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public int compareTo(TransitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + source.format() + ", " + symbol + ")";
    }
}
