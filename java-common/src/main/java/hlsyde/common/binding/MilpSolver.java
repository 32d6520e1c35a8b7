package hlsyde.common.binding;

import java.time.Duration;
import java.util.Optional;

/**
 * A backend able to minimize a {@link LinearProgram} over binary variables.
 */
public interface MilpSolver {

    /**
     * @param timeLimit when present, the solver stops after this long and
     *                  reports {@link MilpStatus#ABORTED} unless optimality was
     *                  proven.
     */
    MilpSolution solve(LinearProgram program, Optional<Duration> timeLimit);

    default String uniqueIdentifier() {
        return getClass().getSimpleName();
    }
}
