package DFAMin.Trace;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StatePair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Ordered record of one minimization run. Accepts no events after a terminal one.
 */
public class MinimizationTrace implements MinimizationListener {
    private final List<MinimizationEvent> events = new ArrayList<>();
    private MinimizationEvent terminal;

    @Override
    public void onEvent(MinimizationEvent event) {
        if (terminal != null) {
            throw new IllegalStateException("Event after terminal event " + terminal.kind() + ": " + event);
        }
        events.add(event);
        if (event.isTerminal()) {
            terminal = event;
        }
    }

    public List<MinimizationEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<MinimizationEvent> getEvents(MinimizationEvent.Kind kind) {
        return events.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }

    public boolean isComplete() {
        return terminal != null;
    }

    public boolean isSuccessful() {
        return terminal instanceof MinimizationEvent.Result;
    }

    public Optional<DFAModel> getResult() {
        return isSuccessful() ? Optional.of(((MinimizationEvent.Result) terminal).minimized()) : Optional.empty();
    }

    public Optional<MinimizationEvent.Error> getError() {
        return terminal instanceof MinimizationEvent.Error ? Optional.of((MinimizationEvent.Error) terminal) : Optional.empty();
    }

    /**
     * @return the minimized DFA
     * @throws MinimizationException if the run ended with an error
     * @throws IllegalStateException if the run has not ended
     */
    public DFAModel requireResult() {
        if (terminal == null) {
            throw new IllegalStateException("Minimization has not finished");
        }
        if (terminal instanceof MinimizationEvent.Error) {
            MinimizationEvent.Error error = (MinimizationEvent.Error) terminal;
            throw new MinimizationException(error.cause(), error.message());
        }
        return ((MinimizationEvent.Result) terminal).minimized();
    }

    /**
     * Number of passes that marked at least one new pair.
     */
    public int getMarkingPasses() {
        return getEvents(MinimizationEvent.Kind.STEP_UPDATE).size();
    }

    /**
     * Pairs marked at the fixed point, i.e. in the last table snapshot; empty if no snapshot was produced.
     */
    public SortedSet<StatePair> getMarkedPairs() {
        List<MinimizationEvent> tables = getEvents(MinimizationEvent.Kind.STEP_TABLE);
        if (tables.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return ((MinimizationEvent.StepTable) tables.get(tables.size() - 1)).marked();
    }

    @Override
    public String toString() {
        return events.stream().map(MinimizationEvent::toString).collect(Collectors.joining("\n"));
    }
}
