package hlsyde.core;

/**
 * Two live values ended up in one register in the same cycle. This only
 * happens when the binding and the allocation disagree.
 */
public class AllocationInvariantException extends SynthesisException {

    public AllocationInvariantException(String message) {
        super(message);
    }
}
