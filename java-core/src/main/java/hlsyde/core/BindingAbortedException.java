package hlsyde.core;

public class BindingAbortedException extends SynthesisException {

    public BindingAbortedException(String message) {
        super(message);
    }

    public BindingAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
