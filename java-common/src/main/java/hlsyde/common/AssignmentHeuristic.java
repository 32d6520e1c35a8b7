package hlsyde.common;

/**
 * How processes are packed into cells that never overlap in time.
 */
public enum AssignmentHeuristic {
    /**
     * Sort on start time and put each process in the first cell it fits in.
     */
    LEFT_EDGE,
    /**
     * Color the execution time exclusion graph, one cell per color.
     */
    GRAPH_COLOR
}
