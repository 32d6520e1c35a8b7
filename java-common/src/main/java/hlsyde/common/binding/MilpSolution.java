package hlsyde.common.binding;

/**
 * Values of the program variables, by index, together with the status the
 * solver ended in. The values are meaningless when the status is
 * {@link MilpStatus#INFEASIBLE}.
 */
public record MilpSolution(MilpStatus status, int[] values) {

    public static MilpSolution withoutValues(MilpStatus status) {
        return new MilpSolution(status, new int[0]);
    }

    public int value(int variable) {
        return values[variable];
    }
}
