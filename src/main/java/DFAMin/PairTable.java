package DFAMin;

import DFAMin.Model.StateId;
import DFAMin.Model.StatePair;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lower-triangular marking table over a fixed, sorted set of states.
 * Pair {i, j} with i &lt; j occupies bit j*(j-1)/2 + i.
 */
public class PairTable {
    public static final int MISSING_ELEMENT = -1;

    private final List<StateId> states;
    private final Object2IntMap<StateId> state2Index;
    private final BitSet marked;

    public PairTable(Collection<? extends StateId> states) {
        final SortedSet<StateId> sorted = new TreeSet<>(states);
        this.states = Collections.unmodifiableList(new ArrayList<>(sorted));
        this.state2Index = new Object2IntOpenHashMap<>(sorted.size());
        this.state2Index.defaultReturnValue(MISSING_ELEMENT);
        for (int i = 0; i < this.states.size(); i++) {
            state2Index.put(this.states.get(i), i);
        }
        this.marked = new BitSet(pairCount());
    }

    public List<StateId> getStates() {
        return states;
    }

    public int indexOf(StateId state) {
        return state2Index.getInt(state);
    }

    /**
     * Number of unordered pairs of distinct states, C(n, 2).
     */
    public int pairCount() {
        final int n = states.size();
        return n * (n - 1) / 2;
    }

    static int position(int i, int j) {
        if (i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }
        return j * (j - 1) / 2 + i;
    }

    public boolean isMarked(int i, int j) {
        return i != j && marked.get(position(i, j));
    }

    public boolean isMarked(StateId p, StateId q) {
        final int i = indexOf(p);
        final int j = indexOf(q);
        if (i == MISSING_ELEMENT || j == MISSING_ELEMENT) {
            throw new IllegalArgumentException("Pair outside the table: " + p + ", " + q);
        }
        return isMarked(i, j);
    }

    /**
     * @return true if the pair was not marked before
     */
    public boolean mark(int i, int j) {
        if (i == j) {
            throw new IllegalArgumentException("A state is never distinguishable from itself: " + states.get(i));
        }
        final int pos = position(i, j);
        final boolean fresh = !marked.get(pos);
        marked.set(pos);
        return fresh;
    }

    public int markedCount() {
        return marked.cardinality();
    }

    public StatePair pairAt(int i, int j) {
        return StatePair.of(states.get(i), states.get(j));
    }

    public SortedSet<StatePair> markedPairs() {
        final SortedSet<StatePair> result = new TreeSet<>();
        for (int j = 1; j < states.size(); j++) {
            for (int i = 0; i < j; i++) {
                if (marked.get(position(i, j))) {
                    result.add(pairAt(i, j));
                }
            }
        }
        return result;
    }

    public SortedSet<StatePair> unmarkedPairs() {
        final SortedSet<StatePair> result = new TreeSet<>();
        for (int j = 1; j < states.size(); j++) {
            for (int i = 0; i < j; i++) {
                if (!marked.get(position(i, j))) {
                    result.add(pairAt(i, j));
                }
            }
        }
        return result;
    }
}
