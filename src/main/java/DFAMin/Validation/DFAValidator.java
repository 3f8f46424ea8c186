package DFAMin.Validation;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import DFAMin.Model.TransitionKey;
import DFAMin.Reachability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Structural checks of a {@link DFAModel}: consistency, completeness and reachability.
 * All checks run and append to one diagnostic list; the automaton is never modified.
 */
public class DFAValidator {
    private static final Logger LOG = LoggerFactory.getLogger(DFAValidator.class);

    public static ValidationResult validate(DFAModel dfa) {
        final List<Diagnostic> diagnostics = new ArrayList<>();

        if (dfa.getStates().isEmpty() || dfa.getAlphabet().isEmpty() || !dfa.hasInitialState()) {
            diagnostics.add(new Diagnostic(DiagnosticKind.EMPTY_AUTOMATON,
                "DFA is empty or incomplete (no states, alphabet or initial state)."));
            LOG.debug("Rejected empty DFA");
            return new ValidationResult(false, diagnostics, null);
        }

        checkConsistency(dfa, diagnostics);
        checkCompleteness(dfa, diagnostics);

        SortedSet<StateId> reachable = null;
        if (dfa.getStates().contains(dfa.getInitialState())) {
            reachable = checkReachability(dfa, diagnostics);
        }

        final boolean valid = diagnostics.stream().noneMatch(Diagnostic::isError);
        LOG.debug("Validated DFA with {} states: valid={}, {} diagnostics", dfa.size(), valid, diagnostics.size());
        return new ValidationResult(valid, diagnostics, reachable);
    }

    /**
     * Initial and accepting states are declared; every transition uses declared states and symbols.
     * @return true if no inconsistency was found
     */
    static boolean checkConsistency(DFAModel dfa, List<Diagnostic> diagnostics) {
        final int before = diagnostics.size();
        final SortedSet<StateId> states = dfa.getStates();

        if (!states.contains(dfa.getInitialState())) {
            structural(diagnostics, "Initial state '" + dfa.getInitialState().format()
                + "' is not in the state set " + formatStates(states) + ".");
        }

        final SortedSet<StateId> undeclaredAccepting = new TreeSet<>(dfa.getAcceptingStates());
        undeclaredAccepting.removeAll(states);
        if (!undeclaredAccepting.isEmpty()) {
            structural(diagnostics, "Accepting states " + formatStates(undeclaredAccepting)
                + " are not in the state set " + formatStates(states) + ".");
        }

        // one report per undeclared source, however many transitions leave it
        final SortedSet<StateId> reportedSources = new TreeSet<>();
        for (Map.Entry<TransitionKey, StateId> e : dfa.getTransitions().entrySet()) {
            final StateId source = e.getKey().source();
            final String symbol = e.getKey().symbol();
            final StateId destination = e.getValue();

            if (!states.contains(source) && reportedSources.add(source)) {
                structural(diagnostics, "Transition source '" + source.format() + "' is not in the state set.");
            }
            if (!dfa.getAlphabet().contains(symbol)) {
                structural(diagnostics, "Symbol '" + symbol + "' on transition '" + source.format() + "' -> '"
                    + destination.format() + "' is not in the alphabet " + dfa.getAlphabet() + ".");
            }
            if (!states.contains(destination)) {
                structural(diagnostics, "Transition destination '" + destination.format() + "' from '"
                    + source.format() + "' on '" + symbol + "' is not in the state set.");
            }
        }
        return diagnostics.size() == before;
    }

    /**
     * Every (state, symbol) pair has a transition.
     * @return true if the automaton is complete
     */
    static boolean checkCompleteness(DFAModel dfa, List<Diagnostic> diagnostics) {
        boolean complete = true;
        for (StateId state : dfa.getStates()) {
            for (String symbol : dfa.getAlphabet()) {
                if (dfa.getSuccessor(state, symbol) == null) {
                    diagnostics.add(new Diagnostic(DiagnosticKind.INCOMPLETE, "Missing transition for state '"
                        + state.format() + "' on symbol '" + symbol + "'. DFA not complete/deterministic."));
                    complete = false;
                }
            }
        }
        return complete;
    }

    /**
     * Warn about each declared state the initial state cannot reach.
     * @return the reachable states
     */
    static SortedSet<StateId> checkReachability(DFAModel dfa, List<Diagnostic> diagnostics) {
        final SortedSet<StateId> reachable = Reachability.reachableStates(dfa);
        for (StateId state : dfa.getStates()) {
            if (!reachable.contains(state)) {
                diagnostics.add(new Diagnostic(DiagnosticKind.UNREACHABLE_STATE, "State '" + state.format()
                    + "' is unreachable from '" + dfa.getInitialState().format() + "'."));
            }
        }
        return reachable;
    }

    private static void structural(List<Diagnostic> diagnostics, String message) {
        diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL, message));
    }

    static String formatStates(SortedSet<StateId> states) {
        return states.stream().map(StateId::format).collect(Collectors.joining(", ", "{", "}"));
    }
}
