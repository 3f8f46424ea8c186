package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import net.automatalib.exception.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reader for the line-oriented DFA description format:
 * <pre>
 * alphabet: a, b        # comments start with '#'
 * states: q0, q1
 * initial: q0
 * final: q1
 * transitions
 * q0, q1, a             # origin, destination, symbol
 * </pre>
 * Keywords are case-insensitive; {@code alfabeto:}, {@code estados:}, {@code inicial:}, {@code finais:} and
 * {@code transicoes} are accepted as well. States used by transitions join the state set.
 */
public class DFATextFormat {
    private static final Logger LOG = LoggerFactory.getLogger(DFATextFormat.class);

    private static final List<String> ALPHABET_KEYS = List.of("alphabet:", "alfabeto:");
    private static final List<String> STATES_KEYS = List.of("states:", "estados:");
    private static final List<String> INITIAL_KEYS = List.of("initial:", "inicial:");
    private static final List<String> FINAL_KEYS = List.of("final:", "finals:", "accepting:", "finais:");
    private static final Set<String> TRANSITIONS_KEYS = Set.of("transitions", "transitions:", "transicoes", "transicoes:");

    /**
     * Parsed automaton plus the recoverable problems met on the way.
     */
    public record ParseResult(DFAModel dfa, List<String> warnings) {
        public ParseResult {
            warnings = List.copyOf(warnings);
        }
    }

    public static ParseResult read(InputStream is) throws IOException, FormatException {
        return read(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public static ParseResult parse(String text) throws FormatException {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException("StringReader failed", e);
        }
    }

    public static ParseResult read(Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    static ParseResult getDFAFile(String filePath) {
        try {
            return read(Paths.get(filePath));
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    public static ParseResult read(Reader in) throws IOException, FormatException {
        final BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        final List<String> warnings = new ArrayList<>();

        SortedSet<String> alphabet = null;
        final SortedSet<String> states = new TreeSet<>();
        String initial = null;
        SortedSet<String> finals = null;
        final List<String[]> rawTransitions = new ArrayList<>();
        boolean inTransitions = false;
        boolean sawTransitionsHeader = false;

        String rawLine;
        int lineNum = 0;
        while ((rawLine = reader.readLine()) != null) {
            lineNum++;
            final int hash = rawLine.indexOf('#');
            final String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            if (line.isEmpty()) {
                continue;
            }
            final String lower = line.toLowerCase(Locale.ROOT);

            if (startsWithAny(lower, ALPHABET_KEYS)) {
                if (alphabet != null) {
                    warn(warnings, "Line " + lineNum + ": section 'alphabet' redefined.");
                }
                alphabet = splitValues(line);
                inTransitions = false;
            } else if (startsWithAny(lower, STATES_KEYS)) {
                states.addAll(splitValues(line));
                inTransitions = false;
            } else if (startsWithAny(lower, INITIAL_KEYS)) {
                if (initial != null) {
                    warn(warnings, "Line " + lineNum + ": initial state redefined.");
                }
                initial = valueOf(line);
                inTransitions = false;
            } else if (startsWithAny(lower, FINAL_KEYS)) {
                if (finals != null) {
                    warn(warnings, "Line " + lineNum + ": section 'final' redefined.");
                }
                finals = splitValues(line);
                inTransitions = false;
            } else if (TRANSITIONS_KEYS.contains(lower)) {
                inTransitions = true;
                sawTransitionsHeader = true;
            } else if (inTransitions) {
                final String[] parts = Arrays.stream(line.split(",", -1)).map(String::trim).toArray(String[]::new);
                if (parts.length != 3) {
                    warn(warnings, "Line " + lineNum + ": malformed transition (expected 'origin, destination, symbol') ignored: '" + line + "'");
                } else if (parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
                    warn(warnings, "Line " + lineNum + ": transition with empty parts ignored: '" + line + "'");
                } else {
                    rawTransitions.add(parts);
                    states.add(parts[0]);
                    states.add(parts[1]);
                }
            } else {
                warn(warnings, "Line " + lineNum + ": line outside any known section ignored: '" + line + "'");
            }
        }

        if (alphabet == null) {
            throw new FormatException("Section 'alphabet:' missing.");
        }
        if (initial == null || initial.isEmpty()) {
            throw new FormatException("Section 'initial:' missing or empty.");
        }
        if (finals == null) {
            warn(warnings, "Section 'final:' missing. Assuming no accepting states.");
            finals = new TreeSet<>();
        }
        if (rawTransitions.isEmpty() && !sawTransitionsHeader) {
            warn(warnings, "Section 'transitions' missing or empty.");
        }

        final DFAModel.Builder builder = DFAModel.builder().alphabet(alphabet);
        for (String[] t : rawTransitions) {
            final String origin = t[0];
            final String destination = t[1];
            final String symbol = t[2];
            if (!alphabet.contains(symbol)) {
                warn(warnings, "Symbol '" + symbol + "' on transition '" + origin + "' -> '" + destination
                    + "' is not in the declared alphabet " + alphabet + ".");
            }
            final StateId previous = builder.getTransition(StateId.of(origin), symbol);
            if (previous != null && !previous.equals(StateId.of(destination))) {
                warn(warnings, "Transition (" + origin + ", " + symbol + ") redefined: using -> " + destination
                    + " (was -> " + previous.format() + ").");
            }
            builder.transition(origin, symbol, destination);
        }

        if (states.isEmpty()) {
            throw new FormatException("No states defined (neither declared nor used by transitions).");
        }
        if (!states.contains(initial)) {
            throw new FormatException("Initial state '" + initial + "' is not among the states " + states + ".");
        }
        final SortedSet<String> undeclaredFinals = new TreeSet<>(finals);
        undeclaredFinals.removeAll(states);
        if (!undeclaredFinals.isEmpty()) {
            throw new FormatException("Final states " + undeclaredFinals + " are not among the states " + states + ".");
        }

        builder.states(states.toArray(new String[0]))
            .initial(initial)
            .accepting(finals.toArray(new String[0]));
        final DFAModel dfa = builder.build();
        LOG.debug("Parsed DFA: {} states, {} symbols, {} transitions", dfa.size(), dfa.getAlphabet().size(),
            dfa.getTransitions().size());
        return new ParseResult(dfa, warnings);
    }

    private static boolean startsWithAny(String lower, List<String> keys) {
        for (String key : keys) {
            if (lower.startsWith(key)) {
                return true;
            }
        }
        return false;
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }

    private static SortedSet<String> splitValues(String line) {
        return Arrays.stream(valueOf(line).split(","))
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .collect(Collectors.toCollection(TreeSet::new));
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }
}
