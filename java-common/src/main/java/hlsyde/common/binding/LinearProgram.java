package hlsyde.common.binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A minimization program over binary variables with integer coefficients.
 */
public record LinearProgram(List<String> variables, List<Constraint> constraints, Map<Integer, Integer> objective) {

    public enum Relation {
        LESS_EQUAL,
        EQUAL,
        GREATER_EQUAL
    }

    /**
     * {@code sum(coefficients[i] * variables[indices[i]]) relation rhs}.
     */
    public record Constraint(int[] indices, int[] coefficients, Relation relation, int rhs) {
    }

    public int variableCount() {
        return variables.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<String> variables = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private final Map<Integer, Integer> objective = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @return the index of the new variable.
         */
        public int binaryVariable(String name) {
            variables.add(name);
            return variables.size() - 1;
        }

        public Builder constraint(int[] indices, int[] coefficients, Relation relation, int rhs) {
            constraints.add(new Constraint(indices, coefficients, relation, rhs));
            return this;
        }

        /**
         * Adds {@code sum(variables) relation rhs}.
         */
        public Builder sum(List<Integer> indices, Relation relation, int rhs) {
            var coefficients = new int[indices.size()];
            Arrays.fill(coefficients, 1);
            return constraint(indices.stream().mapToInt(Integer::intValue).toArray(), coefficients, relation, rhs);
        }

        public Builder minimize(int variable, int coefficient) {
            objective.merge(variable, coefficient, Integer::sum);
            return this;
        }

        public LinearProgram build() {
            return new LinearProgram(List.copyOf(variables), List.copyOf(constraints), Map.copyOf(objective));
        }
    }
}
