package hlsyde.common;

public enum ProcessKind {
    OPERATOR,
    MEMORY_VARIABLE,
    PLAIN_MEMORY_VARIABLE
}
