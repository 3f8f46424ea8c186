package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import DFAMin.Model.TransitionKey;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Graphviz DOT source for a {@link DFAModel}. Node ids are the canonical state text, so a minimized
 * automaton's classes show up as sorted, comma-joined member lists.
 */
public class DOTFormat {
    static final String START_NODE = "__start__";

    public static void write(DFAModel dfa, Appendable out) throws IOException {
        out.append("digraph DFA {\n");
        out.append("  rankdir=LR;\n");
        out.append("  ").append(START_NODE).append(" [shape=point, style=invis];\n");

        for (StateId state : dfa.getStates()) {
            out.append("  ").append(quote(state.format()))
                .append(dfa.isAccepting(state) ? " [shape=doublecircle];\n" : " [shape=circle];\n");
        }

        if (dfa.hasInitialState()) {
            out.append("  ").append(START_NODE).append(" -> ").append(quote(dfa.getInitialState().format())).append(";\n");
        }

        for (Map.Entry<TransitionKey, StateId> e : dfa.getTransitions().entrySet()) {
            out.append("  ").append(quote(e.getKey().source().format()))
                .append(" -> ").append(quote(e.getValue().format()))
                .append(" [label=").append(quote(e.getKey().symbol())).append("];\n");
        }
        out.append("}\n");
    }

    public static String toDOT(DFAModel dfa) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(dfa, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringBuilder does not throw
        }
        return sb.toString();
    }

    static void writeDOTFile(String filename, DFAModel dfa) {
        try (Writer writer = Files.newBufferedWriter(Path.of(filename), StandardCharsets.UTF_8)) {
            write(dfa, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
