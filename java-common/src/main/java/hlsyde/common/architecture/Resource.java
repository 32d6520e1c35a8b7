package hlsyde.common.architecture;

import hlsyde.common.AssignmentHeuristic;
import hlsyde.common.Process;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;

import java.util.List;
import java.util.Optional;

/**
 * A hardware block executing a collection of processes over the schedule.
 *
 * Adding or removing a process drops the current assignment.
 */
public abstract class Resource {

    protected final ProcessCollection collection;
    private String entityName;
    protected List<ProcessCollection> assignment;

    protected Resource(ProcessCollection collection, String entityName) {
        if (collection.isEmpty()) {
            throw new ConfigurationException("Do not create Resource with empty ProcessCollection");
        }
        this.collection = collection;
        setEntityName(entityName);
    }

    public abstract ResourceKind resourceKind();

    public abstract int inputCount();

    public abstract int outputCount();

    /**
     * Packs the processes into non-overlapping cells.
     */
    public abstract void assign(AssignmentHeuristic heuristic);

    /**
     * Throws when the process cannot live on this resource.
     */
    protected abstract void checkProcess(Process process);

    public void assign() {
        assign(AssignmentHeuristic.LEFT_EDGE);
    }

    public String entityName() {
        return entityName;
    }

    public void setEntityName(String entityName) {
        if (!VhdlIdentifiers.isValid(entityName)) {
            throw new ConfigurationException("%s is not a valid VHDL identifier".formatted(entityName));
        }
        this.entityName = entityName;
    }

    public ProcessCollection collection() {
        return collection;
    }

    public int scheduleTime() {
        return collection.scheduleTime();
    }

    public boolean isAssigned() {
        return assignment != null;
    }

    public Optional<List<ProcessCollection>> assignment() {
        return Optional.ofNullable(assignment);
    }

    public void addProcess(Process process) {
        checkProcess(process);
        collection.addProcess(process);
        assignment = null;
    }

    public Process removeProcess(String name) {
        var removed = collection.removeProcess(name);
        assignment = null;
        return removed;
    }

    @Override
    public String toString() {
        return entityName;
    }
}
