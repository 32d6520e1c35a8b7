package hlsyde.core;

/**
 * Caller-supplied data is structurally invalid, e.g. an empty collection where
 * a non-empty one is required or missing port counts.
 */
public class ConfigurationException extends SynthesisException {

    public ConfigurationException(String message) {
        super(message);
    }
}
