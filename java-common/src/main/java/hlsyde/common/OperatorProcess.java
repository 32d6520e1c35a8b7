package hlsyde.common;

import hlsyde.core.ConfigurationException;
import hlsyde.core.Operation;

/**
 * An operation placed at a start time.
 */
public record OperatorProcess(
        String name,
        int startTime,
        int executionTime,
        String typeName,
        Operation operation) implements Process {

    public OperatorProcess {
        if (startTime < 0 || executionTime < 0) {
            throw new ConfigurationException("Process %s has negative timing".formatted(name));
        }
    }

    public static OperatorProcess of(Operation operation, int startTime) {
        int executionTime = operation.executionTime()
                .orElseThrow(() -> new ConfigurationException(
                        "Operation %s has no execution time".formatted(operation.graphId())));
        return new OperatorProcess(operation.graphId(), startTime, executionTime, operation.typeName(), operation);
    }

    @Override
    public ProcessKind kind() {
        return ProcessKind.OPERATOR;
    }

    @Override
    public OperatorProcess withStartTime(int startTime) {
        return new OperatorProcess(name, startTime, executionTime, typeName, operation);
    }
}
