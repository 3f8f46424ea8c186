package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import DFAMin.Model.TransitionKey;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.serialization.ba.BAWriter;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Bridge from {@link DFAModel} to AutomataLib's {@link CompactDFA}.
 */
public class CompactConversion {

    public static CompactDFA<String> toCompactDFA(DFAModel dfa) {
        return toCompactDFA(dfa, new HashMap<>());
    }

    /**
     * Copy declared states (in sorted order), the initial state if declared, and every transition whose
     * source, symbol and destination are declared. Anything else is dropped.
     * @param dfa - automaton to copy
     * @param mapping - filled with the compact id of each declared state
     * @return new compact automaton over the same alphabet
     */
    public static CompactDFA<String> toCompactDFA(DFAModel dfa, Map<StateId, Integer> mapping) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());

        for (StateId state : dfa.getStates()) {
            final int id = out.addState(dfa.isAccepting(state));
            mapping.put(state, id);
        }
        if (dfa.hasInitialState() && mapping.containsKey(dfa.getInitialState())) {
            out.setInitialState(mapping.get(dfa.getInitialState()));
        }
        for (Map.Entry<TransitionKey, StateId> e : dfa.getTransitions().entrySet()) {
            final Integer source = mapping.get(e.getKey().source());
            final Integer destination = mapping.get(e.getValue());
            if (source != null && destination != null && alphabet.containsSymbol(e.getKey().symbol())) {
                out.setTransition(source, e.getKey().symbol(), destination);
            }
        }
        return out;
    }

    static void writeBAFile(String filename, DFAModel dfa) {
        final CompactDFA<String> compact = toCompactDFA(dfa);
        final BAWriter<String> baWriter = new BAWriter<>();
        try (OutputStream os = new FileOutputStream(filename)) {
            baWriter.writeModel(os, compact, compact.getInputAlphabet());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
