package hlsyde.common.architecture;

import hlsyde.common.AssignmentHeuristic;
import hlsyde.common.OperatorProcess;
import hlsyde.common.Process;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;
import hlsyde.core.InfeasibilityException;

import java.util.List;

/**
 * A functional unit executing operations of a single type, one at a time.
 */
public class ProcessingElement extends Resource {

    private final String typeName;
    private final int inputCount;
    private final int outputCount;

    public ProcessingElement(ProcessCollection collection, String entityName) {
        super(collection, entityName);
        if (collection.stream().anyMatch(p -> !(p instanceof OperatorProcess))) {
            throw new ConfigurationException(
                    "Can only have OperatorProcesses in ProcessCollection when creating ProcessingElement");
        }
        var operators = collection.operatorProcesses();
        var first = operators.get(0);
        if (operators.stream().anyMatch(p -> !p.typeName().equals(first.typeName()))) {
            throw new ConfigurationException("Different Operation types in ProcessCollection");
        }
        this.typeName = first.typeName();
        this.inputCount = first.operation().inputCount();
        this.outputCount = first.operation().outputCount();
    }

    public String typeName() {
        return typeName;
    }

    public List<OperatorProcess> processes() {
        return collection.operatorProcesses();
    }

    @Override
    public ResourceKind resourceKind() {
        return ResourceKind.PROCESSING_ELEMENT;
    }

    @Override
    public int inputCount() {
        return inputCount;
    }

    @Override
    public int outputCount() {
        return outputCount;
    }

    @Override
    protected void checkProcess(Process process) {
        if (!(process instanceof OperatorProcess operator) || !operator.typeName().equals(typeName)) {
            throw new ConfigurationException("%s not of type %s".formatted(process.name(), typeName));
        }
    }

    /**
     * @throws InfeasibilityException when two of the operations overlap in time.
     */
    @Override
    public void assign(AssignmentHeuristic heuristic) {
        var cells = collection.splitOnExecutionTime(heuristic);
        if (cells.size() > 1) {
            assignment = null;
            throw new InfeasibilityException(
                    "Cannot map ProcessCollection to single ProcessingElement %s".formatted(entityName()));
        }
        assignment = cells;
    }
}
