package DFAMin.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable DFA description: alphabet, states, initial state, accepting states and a (possibly partial)
 * transition function keyed by (state, symbol).
 * <p>
 * Nothing here checks that the parts agree with each other: an initial state outside the state set,
 * transitions over undeclared states or symbols and missing transitions are all representable, and are
 * what {@link DFAMin.Validation.DFAValidator} reports.
 */
public final class DFAModel {
    private final SortedSet<String> alphabet;
    private final SortedSet<StateId> states;
    private final StateId initial;
    private final SortedSet<StateId> accepting;
    private final SortedMap<TransitionKey, StateId> transitions;

    public DFAModel(Collection<String> alphabet,
                    Collection<? extends StateId> states,
                    StateId initial,
                    Collection<? extends StateId> accepting,
                    Map<TransitionKey, ? extends StateId> transitions) {
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.initial = initial;
        this.accepting = Collections.unmodifiableSortedSet(new TreeSet<>(accepting));
        this.transitions = Collections.unmodifiableSortedMap(new TreeMap<>(transitions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> getAlphabet() {
        return alphabet;
    }

    public SortedSet<StateId> getStates() {
        return states;
    }

    /**
     * @return initial state, or null if none was declared
     */
    public StateId getInitialState() {
        return initial;
    }

    public boolean hasInitialState() {
        return initial != null;
    }

    public SortedSet<StateId> getAcceptingStates() {
        return accepting;
    }

    public boolean isAccepting(StateId state) {
        return accepting.contains(state);
    }

    public SortedMap<TransitionKey, StateId> getTransitions() {
        return transitions;
    }

    /**
     * @return destination of the transition, or null if the transition is absent
     */
    public StateId getSuccessor(StateId state, String symbol) {
        return transitions.get(new TransitionKey(state, symbol));
    }

    /**
     * Outgoing transitions of one state, by symbol.
     */
    public SortedMap<String, StateId> getTransitions(StateId state) {
        SortedMap<String, StateId> out = new TreeMap<>();
        for (Map.Entry<TransitionKey, StateId> e : transitions.entrySet()) {
            if (e.getKey().source().equals(state)) {
                out.put(e.getKey().symbol(), e.getValue());
            }
        }
        return out;
    }

    public int size() {
        return states.size();
    }

    /**
     * Run a word from the initial state. A missing transition rejects.
     */
    public boolean accepts(List<String> word) {
        StateId current = initial;
        for (String symbol : word) {
            if (current == null) {
                return false;
            }
            current = getSuccessor(current, symbol);
        }
        return current != null && isAccepting(current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DFAModel)) {
            return false;
        }
        DFAModel other = (DFAModel) o;
        return alphabet.equals(other.alphabet)
            && states.equals(other.states)
            && Objects.equals(initial, other.initial)
            && accepting.equals(other.accepting)
            && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, states, initial, accepting, transitions);
    }

    @Override
    public String toString() {
        String transitionStr = transitions.entrySet().stream()
            .map(e -> "  " + e.getKey().source().format() + " --" + e.getKey().symbol() + "--> " + e.getValue().format())
            .collect(Collectors.joining("\n"));
        return "DFA(alphabet=" + alphabet
            + ", states=" + formatAll(states)
            + ", initial=" + (initial == null ? "-" : initial.format())
            + ", accepting=" + formatAll(accepting)
            + ", transitions=\n" + transitionStr + ")";
    }

    private static String formatAll(Collection<StateId> ids) {
        return ids.stream().map(StateId::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Mutable staging area for a {@link DFAModel}. String overloads create {@link StateId.Label}s.
     */
    public static final class Builder {
        private final SortedSet<String> alphabet = new TreeSet<>();
        private final SortedSet<StateId> states = new TreeSet<>();
        private final SortedSet<StateId> accepting = new TreeSet<>();
        private final SortedMap<TransitionKey, StateId> transitions = new TreeMap<>();
        private StateId initial;

        private Builder() {
        }

        public Builder alphabet(String... symbols) {
            Collections.addAll(alphabet, symbols);
            return this;
        }

        public Builder alphabet(Collection<String> symbols) {
            alphabet.addAll(symbols);
            return this;
        }

        public Builder states(String... names) {
            for (String name : names) {
                states.add(StateId.of(name));
            }
            return this;
        }

        public Builder state(StateId state) {
            states.add(state);
            return this;
        }

        public Builder initial(String name) {
            return initial(StateId.of(name));
        }

        public Builder initial(StateId state) {
            this.initial = state;
            return this;
        }

        public Builder accepting(String... names) {
            for (String name : names) {
                accepting.add(StateId.of(name));
            }
            return this;
        }

        public Builder accepting(StateId state) {
            accepting.add(state);
            return this;
        }

        /**
         * Redefining a (source, symbol) pair replaces the earlier destination.
         */
        public Builder transition(String source, String symbol, String destination) {
            return transition(StateId.of(source), symbol, StateId.of(destination));
        }

        public Builder transition(StateId source, String symbol, StateId destination) {
            transitions.put(new TransitionKey(source, symbol), Objects.requireNonNull(destination, "destination"));
            return this;
        }

        public boolean hasTransition(StateId source, String symbol) {
            return transitions.containsKey(new TransitionKey(source, symbol));
        }

        public StateId getTransition(StateId source, String symbol) {
            return transitions.get(new TransitionKey(source, symbol));
        }

        public DFAModel build() {
            return new DFAModel(alphabet, states, initial, accepting, transitions);
        }
    }
}
