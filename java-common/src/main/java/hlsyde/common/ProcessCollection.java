package hlsyde.common;

import hlsyde.core.ConfigurationException;
import hlsyde.core.NotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A set of processes sharing one schedule time. All processes are of the same
 * {@link ProcessKind}, fixed by the first one added, and are looked up by name.
 *
 * Start times are taken modulo the schedule time on insertion. The splitting
 * operations return new collections and leave this one untouched.
 */
public class ProcessCollection implements Iterable<Process> {

    private final Map<String, Process> processes = new LinkedHashMap<>();
    private final int scheduleTime;
    private final boolean cyclic;
    private ProcessKind kind;

    public ProcessCollection(int scheduleTime, boolean cyclic) {
        if (scheduleTime <= 0) {
            throw new ConfigurationException("Schedule time must be positive, got %d".formatted(scheduleTime));
        }
        this.scheduleTime = scheduleTime;
        this.cyclic = cyclic;
    }

    public ProcessCollection(Collection<? extends Process> processes, int scheduleTime, boolean cyclic) {
        this(scheduleTime, cyclic);
        processes.forEach(this::addProcess);
    }

    public int scheduleTime() {
        return scheduleTime;
    }

    public boolean isCyclic() {
        return cyclic;
    }

    /**
     * @return the kind of the processes, empty until the first insertion.
     */
    public Optional<ProcessKind> kind() {
        return Optional.ofNullable(kind);
    }

    public int size() {
        return processes.size();
    }

    public boolean isEmpty() {
        return processes.isEmpty();
    }

    public boolean contains(String name) {
        return processes.containsKey(name);
    }

    public List<Process> processes() {
        return List.copyOf(processes.values());
    }

    public List<String> names() {
        return List.copyOf(processes.keySet());
    }

    public Stream<Process> stream() {
        return processes.values().stream();
    }

    @Override
    public Iterator<Process> iterator() {
        return processes().iterator();
    }

    public List<MemoryProcess> memoryProcesses() {
        return stream().map(p -> {
            if (p instanceof MemoryProcess memoryProcess) {
                return memoryProcess;
            }
            throw new ConfigurationException(
                    "Process %s not of expected type %s".formatted(p.name(), ProcessKind.MEMORY_VARIABLE));
        }).collect(Collectors.toList());
    }

    public List<OperatorProcess> operatorProcesses() {
        return stream().map(p -> {
            if (p instanceof OperatorProcess operatorProcess) {
                return operatorProcess;
            }
            throw new ConfigurationException(
                    "Process %s not of expected type %s".formatted(p.name(), ProcessKind.OPERATOR));
        }).collect(Collectors.toList());
    }

    /**
     * @return an empty collection with the same schedule time and cyclicity.
     */
    public ProcessCollection emptyCopy() {
        return new ProcessCollection(scheduleTime, cyclic);
    }

    public ProcessCollection copy() {
        return new ProcessCollection(processes.values(), scheduleTime, cyclic);
    }

    public void addProcess(Process process) {
        if (kind != null && process.kind() != kind) {
            throw new ConfigurationException("Process %s not of expected type %s".formatted(process.name(), kind));
        }
        if (processes.containsKey(process.name())) {
            throw new ConfigurationException("Process %s already in ProcessCollection".formatted(process.name()));
        }
        var normalized = process.startTime() >= scheduleTime
                ? process.withStartTime(process.startTime() % scheduleTime)
                : process;
        processes.put(process.name(), normalized);
        kind = process.kind();
    }

    public Process removeProcess(String name) {
        var removed = processes.remove(name);
        if (removed == null) {
            throw new NotFoundException("%s not in ProcessCollection".formatted(name));
        }
        return removed;
    }

    public Process fromName(String name) {
        var process = processes.get(name);
        if (process == null) {
            throw new NotFoundException("%s not in ProcessCollection".formatted(name));
        }
        return process;
    }

    /**
     * Groups operator processes by the type name of their operation, in order of
     * first appearance.
     */
    public Map<String, ProcessCollection> splitOnTypeName() {
        var split = new LinkedHashMap<String, ProcessCollection>();
        for (var process : operatorProcesses()) {
            split.computeIfAbsent(process.typeName(), t -> emptyCopy()).addProcess(process);
        }
        return split;
    }

    /**
     * Packs the processes into cells whose processes never overlap in time.
     */
    public List<ProcessCollection> splitOnExecutionTime(AssignmentHeuristic heuristic) {
        switch (heuristic) {
            case LEFT_EDGE:
                return leftEdgeCells();
            case GRAPH_COLOR:
                return ExclusionGraphs.fromExecutionTime(this).colorClasses();
            default:
                throw new ConfigurationException("Unknown heuristic %s".formatted(heuristic));
        }
    }

    private List<ProcessCollection> leftEdgeCells() {
        var cells = new ArrayList<ProcessCollection>();
        var sorted = stream().sorted(Process.LEFT_EDGE_ORDER).toList();
        for (var process : sorted) {
            var cell = cells.stream()
                    .filter(c -> c.stream().noneMatch(other -> other.overlaps(process, scheduleTime)))
                    .findFirst();
            if (cell.isPresent()) {
                cell.get().addProcess(process);
            } else {
                var created = emptyCopy();
                created.addProcess(process);
                cells.add(created);
            }
        }
        return cells;
    }

    /**
     * Splits memory processes on the life time of their reads. Reads not longer
     * than the threshold land in the short collection. A process read on both
     * sides appears in both, under the same name.
     */
    public LengthPartition splitOnLength(int threshold) {
        var shortProcesses = emptyCopy();
        var longProcesses = emptyCopy();
        for (var process : memoryProcesses()) {
            var split = process.splitOnLength(threshold);
            split.shortPart().ifPresent(shortProcesses::addProcess);
            split.longPart().ifPresent(longProcesses::addProcess);
        }
        return new LengthPartition(shortProcesses, longProcesses);
    }

    public LengthPartition splitOnLength() {
        return splitOnLength(0);
    }

    /**
     * Splits memory processes into collections that each fit one memory with
     * the given ports.
     */
    public List<ProcessCollection> splitOnPorts(int readPorts, int writePorts, int totalPorts) {
        return ExclusionGraphs.fromPorts(this, readPorts, writePorts, totalPorts).colorClasses();
    }

    /**
     * @return a new collection with the processes of both. Memory processes
     *         present in both under the same name get their reads merged.
     */
    public ProcessCollection union(ProcessCollection other) {
        if (other.scheduleTime != scheduleTime || other.cyclic != cyclic) {
            throw new ConfigurationException("Cannot unite ProcessCollections with different schedules");
        }
        var merged = new LinkedHashMap<>(processes);
        for (var process : other.processes.values()) {
            var present = merged.get(process.name());
            if (present == null) {
                merged.put(process.name(), process);
            } else if (present instanceof MemoryProcess a && process instanceof MemoryProcess b) {
                merged.put(process.name(), a.mergedWith(b));
            } else {
                throw new ConfigurationException(
                        "Process %s already in ProcessCollection".formatted(process.name()));
            }
        }
        return new ProcessCollection(merged.values(), scheduleTime, cyclic);
    }

    /**
     * @return the largest number of processes alive in a single cycle.
     */
    public int processingElementBound() {
        var alive = new int[scheduleTime];
        for (var process : this) {
            process.occupiedCycles(scheduleTime).stream().forEach(t -> alive[t]++);
        }
        return max(alive);
    }

    public int readPortsBound() {
        var reads = new int[scheduleTime];
        for (var process : memoryProcesses()) {
            PortAccess.of(process, scheduleTime).readCycles().forEach(t -> reads[t]++);
        }
        return max(reads);
    }

    public int writePortsBound() {
        var writes = new int[scheduleTime];
        for (var process : memoryProcesses()) {
            writes[PortAccess.of(process, scheduleTime).writeCycle()]++;
        }
        return max(writes);
    }

    public int totalPortsBound() {
        var accesses = new int[scheduleTime];
        for (var process : memoryProcesses()) {
            var access = PortAccess.of(process, scheduleTime);
            accesses[access.writeCycle()]++;
            access.readCycles().forEach(t -> accesses[t]++);
        }
        return max(accesses);
    }

    private static int max(int[] values) {
        int max = 0;
        for (int v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    @Override
    public String toString() {
        return "ProcessCollection(" + String.join(", ", processes.keySet()) + "; schedule_time=" + scheduleTime
                + ", cyclic=" + cyclic + ")";
    }

    public record LengthPartition(ProcessCollection shortProcesses, ProcessCollection longProcesses) {
    }
}
