package hlsyde.core;

/**
 * The problem as posed has no solution under the given bounds. Nothing is
 * relaxed or retried automatically.
 */
public class InfeasibilityException extends SynthesisException {

    public InfeasibilityException(String message) {
        super(message);
    }
}
