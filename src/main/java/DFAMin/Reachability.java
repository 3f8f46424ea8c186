package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

public class Reachability {
    /**
     * Breadth-first search from the initial state over the declared transitions.
     * Absent transitions and destinations outside the state set do not extend the frontier.
     * @param dfa - automaton to explore
     * @return reachable states; empty if the initial state is missing or undeclared
     */
    public static SortedSet<StateId> reachableStates(DFAModel dfa) {
        final StateId init = dfa.getInitialState();
        if (init == null || !dfa.getStates().contains(init)) {
            return Collections.emptySortedSet();
        }

        final SortedSet<StateId> reachable = new TreeSet<>();
        final Deque<StateId> queue = new ArrayDeque<>();
        reachable.add(init);
        queue.add(init);

        while (!queue.isEmpty()) {
            StateId curr = queue.poll();
            for (String symbol : dfa.getAlphabet()) {
                StateId succ = dfa.getSuccessor(curr, symbol);
                if (succ != null && dfa.getStates().contains(succ) && reachable.add(succ)) {
                    queue.add(succ);
                }
            }
        }
        return reachable;
    }

    /**
     * Declared states that {@link #reachableStates(DFAModel)} does not visit.
     */
    public static SortedSet<StateId> unreachableStates(DFAModel dfa) {
        final SortedSet<StateId> unreachable = new TreeSet<>(dfa.getStates());
        unreachable.removeAll(reachableStates(dfa));
        return unreachable;
    }
}
