package hlsyde.common.binding;

public enum MilpStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    /**
     * Stopped by a time limit or an interruption before proving optimality.
     */
    ABORTED
}
