package DFAMin.Trace;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StatePair;
import DFAMin.Validation.DiagnosticKind;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One step of a minimization run, in the order it was produced.
 * {@link Result} and {@link Error} are terminal: exactly one of them ends every run.
 */
public interface MinimizationEvent {

    enum Kind {
        INFO,
        STEP_TABLE,
        STEP_UPDATE,
        RESULT,
        ERROR
    }

    Kind kind();

    default boolean isTerminal() {
        return false;
    }

    record Info(String message) implements MinimizationEvent {
        @Override
        public Kind kind() {
            return Kind.INFO;
        }

        @Override
        public String toString() {
            return message;
        }
    }

    /**
     * Snapshot of every pair marked after a pass; pass 0 is the initial final/non-final marking.
     */
    record StepTable(int pass, SortedSet<StatePair> marked) implements MinimizationEvent {
        public StepTable {
            marked = Collections.unmodifiableSortedSet(new TreeSet<>(marked));
        }

        @Override
        public Kind kind() {
            return Kind.STEP_TABLE;
        }

        @Override
        public String toString() {
            return TraceFormatter.formatTable(pass, marked);
        }
    }

    /**
     * Pairs newly marked during one pass.
     */
    record StepUpdate(int pass, SortedSet<StatePair> newlyMarked) implements MinimizationEvent {
        public StepUpdate {
            newlyMarked = Collections.unmodifiableSortedSet(new TreeSet<>(newlyMarked));
        }

        @Override
        public Kind kind() {
            return Kind.STEP_UPDATE;
        }

        @Override
        public String toString() {
            return TraceFormatter.formatNewlyMarked(pass, newlyMarked);
        }
    }

    record Result(DFAModel minimized) implements MinimizationEvent {
        public Result {
            Objects.requireNonNull(minimized, "minimized");
        }

        @Override
        public Kind kind() {
            return Kind.RESULT;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Minimized " + minimized;
        }
    }

    record Error(DiagnosticKind cause, String message) implements MinimizationEvent {
        public Error {
            Objects.requireNonNull(cause, "cause");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Kind kind() {
            return Kind.ERROR;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "ERROR: " + message;
        }
    }
}
