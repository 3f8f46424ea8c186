package DFAMin.Trace;

import org.slf4j.Logger;

/**
 * Receives minimization events synchronously, in production order.
 */
@FunctionalInterface
public interface MinimizationListener {

    void onEvent(MinimizationEvent event);

    default MinimizationListener andThen(MinimizationListener next) {
        return event -> {
            onEvent(event);
            next.onEvent(event);
        };
    }

    /**
     * Writes every event to the given logger: errors at ERROR, results at INFO, the rest at DEBUG.
     */
    static MinimizationListener logging(Logger log) {
        return event -> {
            switch (event.kind()) {
                case ERROR -> log.error("{}", event);
                case RESULT -> log.info("{}", event);
                default -> log.debug("{}", event);
            }
        };
    }
}
