package hlsyde.choco;

import hlsyde.common.binding.LinearProgram;
import hlsyde.common.binding.MilpSolution;
import hlsyde.common.binding.MilpSolver;
import hlsyde.common.binding.MilpStatus;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves binary linear programs with the Choco constraint solver. Every
 * constraint becomes a scalar constraint and the objective an integer variable
 * that is minimized. Each improving solution is recorded, the last one is
 * optimal when the search completes.
 */
public class ChocoMilpSolver implements MilpSolver {

    private static final Logger logger = LoggerFactory.getLogger(ChocoMilpSolver.class);

    @Override
    public MilpSolution solve(LinearProgram program, Optional<Duration> timeLimit) {
        var model = new Model("binding");
        BoolVar[] vars = new BoolVar[program.variableCount()];
        for (int i = 0; i < vars.length; i++) {
            vars[i] = model.boolVar(program.variables().get(i));
        }
        for (var constraint : program.constraints()) {
            if (constraint.indices().length == 0) {
                if (!holdsOnEmpty(constraint)) {
                    model.falseConstraint().post();
                }
                continue;
            }
            var scope = Arrays.stream(constraint.indices()).mapToObj(i -> vars[i]).toArray(IntVar[]::new);
            model.scalar(scope, constraint.coefficients(), operator(constraint.relation()), constraint.rhs()).post();
        }
        if (!program.objective().isEmpty()) {
            var terms = program.objective().keySet().stream().mapToInt(Integer::intValue).toArray();
            var coefficients = Arrays.stream(terms).map(i -> program.objective().get(i)).toArray();
            int lower = Arrays.stream(coefficients).filter(c -> c < 0).sum();
            int upper = Arrays.stream(coefficients).filter(c -> c > 0).sum();
            var objective = model.intVar("objective", lower, upper);
            var scope = Arrays.stream(terms).mapToObj(i -> vars[i]).toArray(IntVar[]::new);
            model.scalar(scope, coefficients, "=", objective).post();
            model.setObjective(Model.MINIMIZE, objective);
        }
        var solver = model.getSolver();
        timeLimit.ifPresent(limit -> solver.limitTime(limit.toMillis()));
        solver.addStopCriterion(() -> Thread.currentThread().isInterrupted());
        int[] best = null;
        while (solver.solve()) {
            best = Arrays.stream(vars).mapToInt(IntVar::getValue).toArray();
            logger.debug("%s found a solution after %.2f s".formatted(uniqueIdentifier(), solver.getTimeCount()));
            if (program.objective().isEmpty()) {
                break;
            }
        }
        if (solver.isStopCriterionMet()) {
            logger.info("%s stopped before proving optimality".formatted(uniqueIdentifier()));
            return best == null ? MilpSolution.withoutValues(MilpStatus.ABORTED) : new MilpSolution(MilpStatus.ABORTED, best);
        }
        if (best == null) {
            return MilpSolution.withoutValues(MilpStatus.INFEASIBLE);
        }
        return new MilpSolution(MilpStatus.OPTIMAL, best);
    }

    private static boolean holdsOnEmpty(LinearProgram.Constraint constraint) {
        switch (constraint.relation()) {
            case LESS_EQUAL:
                return 0 <= constraint.rhs();
            case EQUAL:
                return 0 == constraint.rhs();
            default:
                return 0 >= constraint.rhs();
        }
    }

    private static String operator(LinearProgram.Relation relation) {
        switch (relation) {
            case LESS_EQUAL:
                return "<=";
            case EQUAL:
                return "=";
            default:
                return ">=";
        }
    }
}
