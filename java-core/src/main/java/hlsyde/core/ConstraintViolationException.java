package hlsyde.core;

/**
 * A requested mutation would break an invariant of a schedule or an
 * architecture.
 */
public class ConstraintViolationException extends SynthesisException {

    public ConstraintViolationException(String message) {
        super(message);
    }
}
