package DFAMin.Trace;

import DFAMin.Validation.DiagnosticKind;

/**
 * A minimization run ended with an error event.
 */
public class MinimizationException extends RuntimeException {
    private final DiagnosticKind kind;

    public MinimizationException(DiagnosticKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DiagnosticKind getKind() {
        return kind;
    }
}
