package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import DFAMin.Model.StatePair;
import DFAMin.Model.TransitionKey;
import DFAMin.Registry.DisjointSetRegistry;
import DFAMin.Trace.MinimizationEvent;
import DFAMin.Trace.MinimizationListener;
import DFAMin.Trace.MinimizationTrace;
import DFAMin.Validation.DiagnosticKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Table-filling (Moore-style pair marking) DFA minimization.
 * <p>
 * The input is assumed valid (see {@link DFAMin.Validation.DFAValidator}), but only two conditions are
 * re-checked: something must be reachable, and the initial state must be among it. On an incomplete
 * automaton a symbol on which either state of a pair has no transition is skipped for that pair, so
 * missing transitions never distinguish states by themselves.
 */
public class TableFillingMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(TableFillingMinimizer.class);

    /**
     * Minimize and collect every event.
     * @param dfa - automaton to minimize; not modified
     * @return completed trace, ending with a result or an error event
     */
    public static MinimizationTrace minimize(DFAModel dfa) {
        final MinimizationTrace trace = new MinimizationTrace();
        minimize(dfa, trace);
        return trace;
    }

    /**
     * Minimize, delivering events to the listener as they are produced.
     * The last event delivered is either {@link MinimizationEvent.Result} or {@link MinimizationEvent.Error}.
     * @param dfa - automaton to minimize; not modified
     * @param listener - event consumer
     */
    public static void minimize(DFAModel dfa, MinimizationListener listener) {
        info(listener, "Finding reachable states...");
        final SortedSet<StateId> reachable = Reachability.reachableStates(dfa);

        if (reachable.isEmpty()) {
            fail(listener, DiagnosticKind.EMPTY_AUTOMATON, "No reachable states found. Cannot minimize.");
            return;
        }
        final StateId init = dfa.getInitialState();
        if (!reachable.contains(init)) {
            fail(listener, DiagnosticKind.EMPTY_AUTOMATON, "Initial state '" + init.format() + "' is not reachable.");
            return;
        }

        info(listener, "Working with " + reachable.size() + " reachable states: " + formatStates(reachable));
        if (reachable.size() < dfa.size()) {
            final SortedSet<StateId> ignored = new TreeSet<>(dfa.getStates());
            ignored.removeAll(reachable);
            info(listener, "Ignoring unreachable states: " + formatStates(ignored));
        }

        final PairTable table = new PairTable(reachable);
        final int[][] successors = successorTable(dfa, table);

        info(listener, "--- Step-by-step minimization ---");
        markAcceptance(dfa, table);
        listener.onEvent(new MinimizationEvent.StepTable(0, table.markedPairs()));
        final int passes = markToFixedPoint(table, successors, listener);
        LOG.debug("Marking reached a fixed point after {} passes: {} of {} pairs distinguishable",
            passes, table.markedCount(), table.pairCount());

        info(listener, "Building minimized DFA...");
        final List<SortedSet<StateId>> classes = partition(table);
        if (classes.isEmpty()) {
            fail(listener, DiagnosticKind.CONSTRUCTION, "No equivalence classes found.");
            return;
        }

        final DFAModel minimized = buildQuotient(dfa, reachable, classes);
        info(listener, "Minimized DFA construction complete: " + reachable.size() + " -> "
            + minimized.size() + " states.");
        listener.onEvent(new MinimizationEvent.Result(minimized));
    }

    /**
     * successors[i][a] is the table index of the a-th symbol's successor of state i,
     * or MISSING_ELEMENT if the transition is absent or leaves the reachable set.
     */
    static int[][] successorTable(DFAModel dfa, PairTable table) {
        final List<StateId> states = table.getStates();
        final List<String> symbols = new ArrayList<>(dfa.getAlphabet());
        final int[][] successors = new int[states.size()][symbols.size()];
        for (int i = 0; i < states.size(); i++) {
            for (int a = 0; a < symbols.size(); a++) {
                final StateId succ = dfa.getSuccessor(states.get(i), symbols.get(a));
                successors[i][a] = succ == null ? PairTable.MISSING_ELEMENT : table.indexOf(succ);
            }
        }
        return successors;
    }

    /**
     * Pass 0: mark every pair with exactly one accepting member.
     */
    static void markAcceptance(DFAModel dfa, PairTable table) {
        final List<StateId> states = table.getStates();
        for (int j = 1; j < states.size(); j++) {
            final boolean jAcc = dfa.isAccepting(states.get(j));
            for (int i = 0; i < j; i++) {
                if (dfa.isAccepting(states.get(i)) != jAcc) {
                    table.mark(i, j);
                }
            }
        }
    }

    /**
     * Repeat passes until one marks nothing. Each pass only consults marks from earlier passes,
     * so pass k marks exactly the pairs first separated by a word of length k.
     * @return number of passes that marked at least one pair
     */
    static int markToFixedPoint(PairTable table, int[][] successors, MinimizationListener listener) {
        final int n = table.getStates().size();
        int pass = 1;
        while (true) {
            final IntArrayList newLow = new IntArrayList();
            final IntArrayList newHigh = new IntArrayList();
            for (int j = 1; j < n; j++) {
                for (int i = 0; i < j; i++) {
                    if (!table.isMarked(i, j) && separatedBySuccessors(table, successors[i], successors[j])) {
                        newLow.add(i);
                        newHigh.add(j);
                    }
                }
            }

            if (newLow.isEmpty()) {
                info(listener, "Pass " + pass + ": no new pairs marked. Marking complete.");
                return pass - 1;
            }

            final SortedSet<StatePair> newlyMarked = new TreeSet<>();
            for (int k = 0; k < newLow.size(); k++) {
                table.mark(newLow.getInt(k), newHigh.getInt(k));
                newlyMarked.add(table.pairAt(newLow.getInt(k), newHigh.getInt(k)));
            }
            listener.onEvent(new MinimizationEvent.StepUpdate(pass, newlyMarked));
            listener.onEvent(new MinimizationEvent.StepTable(pass, table.markedPairs()));
            pass++;
        }
    }

    private static boolean separatedBySuccessors(PairTable table, int[] pSucc, int[] qSucc) {
        for (int a = 0; a < pSucc.length; a++) {
            final int p = pSucc[a];
            final int q = qSucc[a];
            if (p == PairTable.MISSING_ELEMENT || q == PairTable.MISSING_ELEMENT) {
                continue; // not comparable on this symbol
            }
            if (p != q && table.isMarked(p, q)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Union every pair left unmarked; the resulting classes are the new states.
     */
    static List<SortedSet<StateId>> partition(PairTable table) {
        final DisjointSetRegistry registry = new DisjointSetRegistry(table.getStates());
        for (StatePair pair : table.unmarkedPairs()) {
            registry.unify(pair.first(), pair.second());
        }
        return registry.classes();
    }

    static DFAModel buildQuotient(DFAModel dfa, SortedSet<StateId> reachable, List<SortedSet<StateId>> classes) {
        final Map<StateId, StateId.Composite> classOf = new HashMap<>();
        final List<StateId.Composite> composites = new ArrayList<>(classes.size());
        for (SortedSet<StateId> members : classes) {
            final StateId.Composite cls = StateId.classOf(members);
            composites.add(cls);
            for (StateId member : members) {
                classOf.put(member, cls);
            }
        }

        final DFAModel.Builder builder = DFAModel.builder()
            .alphabet(dfa.getAlphabet())
            .initial(classOf.get(dfa.getInitialState()));

        for (StateId.Composite cls : composites) {
            builder.state(cls);
            if (cls.members().stream().anyMatch(dfa::isAccepting)) {
                builder.accepting(cls);
            }
            final StateId rep = cls.representative();
            for (String symbol : dfa.getAlphabet()) {
                final StateId dest = dfa.getSuccessor(rep, symbol);
                if (dest != null && reachable.contains(dest)) {
                    builder.transition(cls, symbol, classOf.get(dest));
                }
            }
        }
        return pruneUnreachable(builder.build());
    }

    /**
     * On a partial automaton unmarked pairs need not be transitive, so a merged class may lose the
     * transitions of its non-representative members and leave other classes unreachable. Drop them.
     */
    static DFAModel pruneUnreachable(DFAModel quotient) {
        final SortedSet<StateId> live = Reachability.reachableStates(quotient);
        if (live.size() == quotient.size()) {
            return quotient;
        }
        LOG.debug("Dropping {} unreachable classes from the quotient", quotient.size() - live.size());
        final DFAModel.Builder builder = DFAModel.builder()
            .alphabet(quotient.getAlphabet())
            .initial(quotient.getInitialState());
        for (StateId cls : live) {
            builder.state(cls);
            if (quotient.isAccepting(cls)) {
                builder.accepting(cls);
            }
        }
        for (Map.Entry<TransitionKey, StateId> e : quotient.getTransitions().entrySet()) {
            if (live.contains(e.getKey().source())) {
                builder.transition(e.getKey().source(), e.getKey().symbol(), e.getValue());
            }
        }
        return builder.build();
    }

    private static void info(MinimizationListener listener, String message) {
        listener.onEvent(new MinimizationEvent.Info(message));
    }

    private static void fail(MinimizationListener listener, DiagnosticKind kind, String message) {
        LOG.debug("Minimization failed: {}", message);
        listener.onEvent(new MinimizationEvent.Error(kind, message));
    }

    private static String formatStates(SortedSet<StateId> states) {
        return states.stream().map(StateId::format).collect(Collectors.joining(", ", "[", "]"));
    }
}
