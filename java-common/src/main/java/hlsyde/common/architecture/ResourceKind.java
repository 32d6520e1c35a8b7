package hlsyde.common.architecture;

public enum ResourceKind {
    PROCESSING_ELEMENT,
    MEMORY
}
