package DFAMin.Validation;

import java.util.Objects;

public record Diagnostic(DiagnosticKind kind, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public Severity severity() {
        return kind.getSeverity();
    }

    public boolean isError() {
        return severity() == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity() + ": " + message;
    }
}
