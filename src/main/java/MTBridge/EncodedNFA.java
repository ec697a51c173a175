package MTBridge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import MTBridge.Codec.AlphabetCodec;
import MTBridge.Diagram.BitVector;
import MTBridge.Diagram.MtRobdd;
import MTBridge.Symbolic.SymbolicDFA;
import net.automatalib.alphabet.Alphabet;

/**
 * An explicit NFA encoded as a {@link SymbolicDFA}. Every letter of the symbolic automaton is
 * [symbol bits][nondeterminism bits]; the nondeterminism bits select one of the targets of
 * a nondeterministic transition.
 * @param <I> - Input symbol type, e.g., Integer
 */
public class EncodedNFA<I> {
    private final SymbolicDFA dfa;
    private final AlphabetCodec<I> codec;
    private final Alphabet<I> inputAlphabet;
    private final int numOfNondetVars;
    private final int nondeterminismLevel;
    private final int originalStates;

    EncodedNFA(SymbolicDFA dfa, AlphabetCodec<I> codec, Alphabet<I> inputAlphabet,
               int numOfNondetVars, int nondeterminismLevel, int originalStates) {
        this.dfa = dfa;
        this.codec = codec;
        this.inputAlphabet = inputAlphabet;
        this.numOfNondetVars = numOfNondetVars;
        this.nondeterminismLevel = nondeterminismLevel;
        this.originalStates = originalStates;
    }

    public SymbolicDFA getDFA() {
        return dfa;
    }

    public AlphabetCodec<I> getCodec() {
        return codec;
    }

    public Alphabet<I> getInputAlphabet() {
        return inputAlphabet;
    }

    public int numOfVars() {
        return codec.width() + numOfNondetVars;
    }

    public int numOfAlphabetVars() {
        return codec.width();
    }

    public int numOfNondetVars() {
        return numOfNondetVars;
    }

    public int nondeterminismLevel() {
        return nondeterminismLevel;
    }

    /**
     * @return number of states of the explicit automaton that was encoded (after initial-state unification)
     */
    public int originalStates() {
        return originalStates;
    }

    /**
     * The symbolic automaton is a faithful DFA only if no nondeterminism bits select between targets.
     */
    public boolean isDeterministic() {
        return nondeterminismLevel <= 1;
    }

    /**
     * Letters of the symbolic automaton for a word, nondeterminism bits set to 0.
     * @throws IllegalStateException if the encoding is nondeterministic
     */
    public List<BitVector> encodeWord(List<I> word) {
        if (!isDeterministic()) {
            throw new IllegalStateException("Words are ambiguous in a nondeterministic encoding");
        }
        final BitVector nondetBits = BitVector.fromLong(0, numOfNondetVars);
        final List<BitVector> letters = new ArrayList<>(word.size());
        for (I symbol : word) {
            letters.add(codec.encode(symbol).concat(nondetBits));
        }
        return letters;
    }

    /**
     * Run a word on the symbolic automaton. Symbols without a code label no transition.
     */
    public boolean accepts(List<I> word) {
        for (I symbol : word) {
            if (!codec.contains(symbol)) {
                return false;
            }
        }
        return dfa.accepts(encodeWord(word));
    }

    public MtRobdd toMtRobdd() {
        return MtRobdd.fromSymbolic(numOfVars(), dfa.getNodeTable(), dfa.getBehaviours());
    }

    public String toDot() {
        return toMtRobdd().toDot();
    }

    public void saveAsDot(Path file) throws IOException {
        toMtRobdd().saveAsDot(file);
    }

    @Override
    public String toString() {
        return "EncodedNFA[states=" + dfa.size() + ", alphabetVars=" + codec.width()
            + ", nondetVars=" + numOfNondetVars + "]";
    }
}
