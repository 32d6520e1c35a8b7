package hlsyde.core;

/**
 * Root of every error raised by the synthesis pipeline. All of them are
 * unchecked: configuration and constraint errors are meant to be fixed by the
 * caller and retried, the rest signal a problem that cannot be solved as posed.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
