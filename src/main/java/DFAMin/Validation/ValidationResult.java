package DFAMin.Validation;

import DFAMin.Model.StateId;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of {@link DFAValidator#validate}.
 * @param valid - true iff no diagnostic has severity ERROR
 * @param diagnostics - every finding, in the order the checks produced them
 * @param reachable - reachable states, or null if the initial state is missing or undeclared
 */
public record ValidationResult(boolean valid, List<Diagnostic> diagnostics, SortedSet<StateId> reachable) {

    public ValidationResult {
        diagnostics = List.copyOf(diagnostics);
        if (reachable != null) {
            reachable = Collections.unmodifiableSortedSet(new TreeSet<>(reachable));
        }
    }

    public Optional<SortedSet<StateId>> reachableStates() {
        return Optional.ofNullable(reachable);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
    }

    public boolean has(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }
}
