package DFAMin.Validation;

/**
 * Defects found in an automaton, each with the severity it is reported at.
 */
public enum DiagnosticKind {
    /** Initial, accepting or transition references a state or symbol outside the declared sets. */
    STRUCTURAL(Severity.ERROR),
    /** Some (state, symbol) pair has no transition. */
    INCOMPLETE(Severity.ERROR),
    /** A declared state cannot be reached from the initial state. */
    UNREACHABLE_STATE(Severity.WARNING),
    /** No states, no alphabet or no initial state; or nothing (initial included) is reachable. */
    EMPTY_AUTOMATON(Severity.ERROR),
    /** Minimization produced no equivalence classes. */
    CONSTRUCTION(Severity.ERROR);

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
