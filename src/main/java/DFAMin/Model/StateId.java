package DFAMin.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Identifier of a DFA state.
 * Either an atomic {@link Label} (states of a parsed automaton) or a {@link Composite} holding the
 * identifiers of an equivalence class (states of a minimized automaton).
 * A label never equals a composite, not even a singleton composite over the same label.
 */
public interface StateId extends Comparable<StateId> {

    /**
     * Canonical text: a label's name, or the sorted, comma-joined canonical text of a composite's members.
     */
    String format();

    static Label of(String name) {
        return new Label(name);
    }

    static Composite classOf(Collection<? extends StateId> members) {
        return new Composite(new TreeSet<>(members));
    }

    /**
     * Labels order before composites; labels by name, composites element-wise over their sorted members.
     */
    @Override
    default int compareTo(StateId other) {
        final boolean thisLabel = this instanceof Label;
        if (thisLabel != other instanceof Label) {
            return thisLabel ? -1 : 1;
        }
        if (thisLabel) {
            return ((Label) this).name().compareTo(((Label) other).name());
        }
        final Set<StateId> mine = ((Composite) this).members();
        final Set<StateId> theirs = ((Composite) other).members();
        Iterator<StateId> left = mine.iterator();
        Iterator<StateId> right = theirs.iterator();
        while (left.hasNext() && right.hasNext()) {
            int cmp = left.next().compareTo(right.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(mine.size(), theirs.size());
    }

    record Label(String name) implements StateId {
        public Label {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("State label must be non-empty");
            }
        }

        @Override
        public String format() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Equivalence class of states. Members are kept sorted, so equality and hashing do not depend on
     * the order they were supplied in.
     */
    record Composite(Set<StateId> members) implements StateId {
        public Composite {
            if (members.isEmpty()) {
                throw new IllegalArgumentException("Equivalence class must have at least one member");
            }
            members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        }

        public boolean contains(StateId member) {
            return members.contains(member);
        }

        /**
         * Smallest member, used as the class representative.
         */
        public StateId representative() {
            return members.iterator().next();
        }

        @Override
        public String format() {
            return members.stream()
                .map(StateId::format)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.joining(","));
        }

        @Override
        public String toString() {
            return "{" + format() + "}";
        }
    }
}
