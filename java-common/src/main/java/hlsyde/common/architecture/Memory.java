package hlsyde.common.architecture;

import hlsyde.common.AssignmentHeuristic;
import hlsyde.common.MemoryProcess;
import hlsyde.common.PortBudget;
import hlsyde.common.Process;
import hlsyde.common.ProcessCollection;
import hlsyde.common.storage.ForwardBackwardTable;
import hlsyde.common.storage.MemoryAddressTable;
import hlsyde.core.ConfigurationException;

import java.util.List;
import java.util.Optional;

/**
 * Storage for memory variables, either a RAM with addressed cells or a chain
 * of registers.
 *
 * Port counts are optional. When none is given the memory gets as many ports
 * as its variables need in the busiest cycle.
 */
public class Memory extends Resource {

    private final MemoryType memoryType;
    private final int readPorts;
    private final int writePorts;
    private final int totalPorts;
    private ForwardBackwardTable registerTable;

    public Memory(ProcessCollection collection, MemoryType memoryType, String entityName) {
        this(collection, memoryType, entityName, -1, -1, -1);
    }

    /**
     * Negative port counts are treated as not given.
     */
    public Memory(ProcessCollection collection, MemoryType memoryType, String entityName, int readPorts,
            int writePorts, int totalPorts) {
        super(collection, entityName);
        if (collection.stream().anyMatch(p -> !(p instanceof MemoryProcess))) {
            throw new ConfigurationException("Can only have MemoryProcess in ProcessCollection when creating Memory");
        }
        this.memoryType = memoryType;
        if (readPorts >= 0 || writePorts >= 0 || totalPorts >= 0) {
            var budget = PortBudget.sanitize(readPorts, writePorts, totalPorts);
            readPorts = budget.read();
            writePorts = budget.write();
            totalPorts = budget.total();
        }
        int readBound = collection.readPortsBound();
        if (readPorts >= 0 && readPorts < readBound) {
            throw new ConfigurationException("At least %d read ports required".formatted(readBound));
        }
        int writeBound = collection.writePortsBound();
        if (writePorts >= 0 && writePorts < writeBound) {
            throw new ConfigurationException("At least %d write ports required".formatted(writeBound));
        }
        int totalBound = collection.totalPortsBound();
        if (totalPorts >= 0 && totalPorts < totalBound) {
            throw new ConfigurationException("At least %d total ports required".formatted(totalBound));
        }
        this.readPorts = readPorts >= 0 ? readPorts : readBound;
        this.writePorts = writePorts >= 0 ? writePorts : writeBound;
        this.totalPorts = totalPorts >= 0 ? totalPorts : this.readPorts + this.writePorts;
    }

    public MemoryType memoryType() {
        return memoryType;
    }

    public int readPorts() {
        return readPorts;
    }

    public int writePorts() {
        return writePorts;
    }

    public int totalPorts() {
        return totalPorts;
    }

    public List<MemoryProcess> variables() {
        return collection.memoryProcesses();
    }

    @Override
    public ResourceKind resourceKind() {
        return ResourceKind.MEMORY;
    }

    @Override
    public int inputCount() {
        return writePorts;
    }

    @Override
    public int outputCount() {
        return readPorts;
    }

    @Override
    protected void checkProcess(Process process) {
        var kind = collection.kind();
        if (!(process instanceof MemoryProcess) || (kind.isPresent() && kind.get() != process.kind())) {
            throw new ConfigurationException(
                    "%s not of type %s".formatted(process.name(), kind.map(Enum::name).orElse("MemoryProcess")));
        }
    }

    @Override
    public void addProcess(Process process) {
        super.addProcess(process);
        registerTable = null;
    }

    @Override
    public Process removeProcess(String name) {
        var removed = super.removeProcess(name);
        registerTable = null;
        return removed;
    }

    /**
     * A RAM gets its variables packed into cells. A register memory gets its
     * forward-backward table, the heuristic does not apply there.
     */
    @Override
    public void assign(AssignmentHeuristic heuristic) {
        if (memoryType == MemoryType.RAM) {
            assignment = collection.splitOnExecutionTime(heuristic);
        } else {
            registerTable = new ForwardBackwardTable(collection);
        }
    }

    @Override
    public boolean isAssigned() {
        return memoryType == MemoryType.RAM ? super.isAssigned() : registerTable != null;
    }

    public ForwardBackwardTable forwardBackwardTable() {
        if (registerTable == null) {
            registerTable = new ForwardBackwardTable(collection);
        }
        return registerTable;
    }

    /**
     * Address generation for the RAM cells. Assigns the memory with the
     * left-edge heuristic first when needed.
     */
    public MemoryAddressTable addressTable(int muxSize, int pipelineDepth, boolean inputSync) {
        if (memoryType != MemoryType.RAM) {
            throw new ConfigurationException("Address tables only exist for RAM, %s is a %s memory"
                    .formatted(entityName(), memoryType.label()));
        }
        if (!isAssigned()) {
            assign();
        }
        return new MemoryAddressTable(assignment, collection, muxSize, pipelineDepth, inputSync);
    }

    public Optional<ForwardBackwardTable> registerTable() {
        return Optional.ofNullable(registerTable);
    }
}
