package MTBridge.Codec;

import java.util.NoSuchElementException;

/**
 * Thrown when a symbol or a bit vector has no entry in an {@link AlphabetCodec}.
 * Expected while decoding sink and unused codes; callers usually skip such codes.
 */
public class UnknownCodeException extends NoSuchElementException {
    private static final long serialVersionUID = 4182593207645218806L;

    public UnknownCodeException(String msg) {
        super(msg);
    }
}
