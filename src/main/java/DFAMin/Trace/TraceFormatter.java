package DFAMin.Trace;

import DFAMin.Model.StatePair;

import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Human-readable rendering of the marking table.
 */
public class TraceFormatter {
    static final String NONE = "  None";

    public static String formatTable(int pass, SortedSet<StatePair> marked) {
        StringBuilder sb = new StringBuilder();
        if (pass == 0) {
            sb.append("Pass 0: initial marking (final vs non-final)");
        } else {
            sb.append("Table after pass ").append(pass).append(':');
        }
        sb.append('\n').append(" Marked pairs (distinguishable):").append('\n');
        if (marked.isEmpty()) {
            sb.append(NONE);
        } else {
            sb.append("  ").append(marked.stream().map(StatePair::toString).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    public static String formatNewlyMarked(int pass, SortedSet<StatePair> newlyMarked) {
        StringBuilder sb = new StringBuilder();
        sb.append("Pass ").append(pass).append(": new pairs marked as distinguishable");
        if (newlyMarked.isEmpty()) {
            sb.append('\n').append(NONE);
        }
        for (StatePair pair : newlyMarked) {
            sb.append('\n').append("  - ").append(pair);
        }
        return sb.toString();
    }
}
