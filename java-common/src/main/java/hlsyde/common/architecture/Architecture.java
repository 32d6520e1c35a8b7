package hlsyde.common.architecture;

import hlsyde.common.AssignmentHeuristic;
import hlsyde.common.MemoryProcess;
import hlsyde.common.OperatorProcess;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;
import hlsyde.core.ConstraintViolationException;
import hlsyde.core.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Processing elements and memories sharing one schedule, plus the values
 * passed directly between processing elements without being stored.
 *
 * Ports are identified by their names, {@code operation.index}.
 */
public class Architecture {

    private static final Logger logger = LoggerFactory.getLogger(Architecture.class);

    /**
     * Number of accesses per processing element, for the write side and the
     * read side of a memory.
     */
    public record MemoryInterconnects(Map<String, Integer> writers, Map<String, Integer> readers) {
    }

    private final List<ProcessingElement> processingElements;
    private final List<Memory> memories;
    private final String entityName;
    private final ProcessCollection directInterconnects;
    private final int scheduleTime;

    public Architecture(List<ProcessingElement> processingElements, List<Memory> memories) {
        this(processingElements, memories, "arch", null);
    }

    /**
     * @param directInterconnects zero-length memory variables, may be null.
     */
    public Architecture(List<ProcessingElement> processingElements, List<Memory> memories, String entityName,
            ProcessCollection directInterconnects) {
        if (!VhdlIdentifiers.isValid(entityName)) {
            throw new ConfigurationException("%s is not a valid VHDL identifier".formatted(entityName));
        }
        this.processingElements = new ArrayList<>(processingElements);
        this.memories = new ArrayList<>(memories);
        this.entityName = entityName;
        this.directInterconnects = directInterconnects;
        this.scheduleTime = checkScheduleTimes();
        checkBindings(this.processingElements);
        checkBindings(this.memories);
        logger.debug("Architecture %s with %d processing elements and %d memories".formatted(entityName,
                this.processingElements.size(), this.memories.size()));
    }

    private int checkScheduleTimes() {
        var scheduleTimes = new TreeSet<Integer>();
        resources().forEach(r -> scheduleTimes.add(r.scheduleTime()));
        if (directInterconnects != null) {
            scheduleTimes.add(directInterconnects.scheduleTime());
        }
        if (scheduleTimes.size() != 1) {
            throw new ConfigurationException("Different schedule times: %s".formatted(scheduleTimes));
        }
        return scheduleTimes.first();
    }

    private static void checkBindings(List<? extends Resource> resources) {
        var boundTo = new HashMap<String, String>();
        var names = new HashSet<String>();
        for (var resource : resources) {
            if (!names.add(resource.entityName())) {
                throw new ConfigurationException("Duplicate resource name %s".formatted(resource.entityName()));
            }
            for (var name : resource.collection().names()) {
                var previous = boundTo.put(name, resource.entityName());
                if (previous != null) {
                    throw new ConfigurationException(
                            "Process %s bound to both %s and %s".formatted(name, previous, resource.entityName()));
                }
            }
        }
    }

    public String entityName() {
        return entityName;
    }

    public int scheduleTime() {
        return scheduleTime;
    }

    public List<ProcessingElement> processingElements() {
        return List.copyOf(processingElements);
    }

    public List<Memory> memories() {
        return List.copyOf(memories);
    }

    public Optional<ProcessCollection> directInterconnects() {
        return Optional.ofNullable(directInterconnects);
    }

    private Stream<Resource> resources() {
        return Stream.concat(memories.stream(), processingElements.stream());
    }

    public Resource resourceFromName(String name) {
        return resources().filter(r -> r.entityName().equals(name)).findFirst()
                .orElseThrow(() -> new NotFoundException("No resource named %s in %s".formatted(name, entityName)));
    }

    /**
     * Removes a resource that no longer holds any process.
     */
    public void removeResource(String name) {
        var resource = resourceFromName(name);
        if (!resource.collection().isEmpty()) {
            throw new ConstraintViolationException("Resource must be empty");
        }
        if (resource instanceof Memory memory) {
            memories.remove(memory);
        } else {
            processingElements.remove(resource);
        }
    }

    public void assignResources(AssignmentHeuristic heuristic) {
        resources().forEach(r -> r.assign(heuristic));
    }

    public void assignResources() {
        assignResources(AssignmentHeuristic.LEFT_EDGE);
    }

    /**
     * Moves a process between two resources of the same kind. Both lose their
     * assignment.
     */
    public void moveProcess(String processName, String source, String destination) {
        var from = resourceFromName(source);
        var to = resourceFromName(destination);
        if (from.resourceKind() != to.resourceKind()) {
            throw new ConstraintViolationException("Cannot move %s from %s %s to %s %s".formatted(processName,
                    from.resourceKind(), source, to.resourceKind(), destination));
        }
        if (!from.collection().contains(processName)) {
            throw new NotFoundException("%s not in %s".formatted(processName, source));
        }
        to.addProcess(from.collection().fromName(processName));
        from.removeProcess(processName);
        logger.debug("Moved %s from %s to %s".formatted(processName, source, destination));
    }

    private Stream<MemoryProcess> storedAndDirectVariables() {
        var direct = directInterconnects == null ? Stream.<MemoryProcess>empty()
                : directInterconnects.memoryProcesses().stream();
        return Stream.concat(memories.stream().flatMap(m -> m.variables().stream()), direct);
    }

    /**
     * Checks that every port written by a memory or direct interconnect is an
     * output of a processing element, every port read is an input, and the
     * other way around.
     */
    public void validatePorts() {
        var readPorts = new TreeSet<String>();
        var writePorts = new TreeSet<String>();
        storedAndDirectVariables().forEach(v -> {
            writePorts.add(v.writePortName());
            readPorts.addAll(v.readPortNames());
        });
        var inputPorts = new TreeSet<String>(inputPortOwners().keySet());
        var outputPorts = new TreeSet<String>(outputPortOwners().keySet());
        var readDifference = symmetricDifference(readPorts, inputPorts);
        if (!readDifference.isEmpty()) {
            throw new ConstraintViolationException(
                    "Memory read port and PE input port difference: %s".formatted(readDifference));
        }
        var writeDifference = symmetricDifference(writePorts, outputPorts);
        if (!writeDifference.isEmpty()) {
            throw new ConstraintViolationException(
                    "Memory write port and PE output port difference: %s".formatted(writeDifference));
        }
    }

    private static Set<String> symmetricDifference(Set<String> a, Set<String> b) {
        var difference = new TreeSet<String>(a);
        difference.addAll(b);
        var both = new HashSet<String>(a);
        both.retainAll(b);
        difference.removeAll(both);
        return difference;
    }

    private Map<String, String> inputPortOwners() {
        var owners = new LinkedHashMap<String, String>();
        for (var pe : processingElements) {
            for (OperatorProcess p : pe.processes()) {
                for (int i = 0; i < p.operation().inputCount(); i++) {
                    owners.put(p.name() + "." + i, pe.entityName());
                }
            }
        }
        return owners;
    }

    private Map<String, String> outputPortOwners() {
        var owners = new LinkedHashMap<String, String>();
        for (var pe : processingElements) {
            for (OperatorProcess p : pe.processes()) {
                for (int i = 0; i < p.operation().outputCount(); i++) {
                    owners.put(p.name() + "." + i, pe.entityName());
                }
            }
        }
        return owners;
    }

    /**
     * @return the processing elements writing into and reading from the
     *         memory, with the number of accesses of each.
     */
    public MemoryInterconnects interconnectsForMemory(String memoryName) {
        if (!(resourceFromName(memoryName) instanceof Memory memory)) {
            throw new ConstraintViolationException("%s is not a memory".formatted(memoryName));
        }
        var inputOwners = inputPortOwners();
        var outputOwners = outputPortOwners();
        var writers = new LinkedHashMap<String, Integer>();
        var readers = new LinkedHashMap<String, Integer>();
        for (var variable : memory.variables()) {
            writers.merge(owner(outputOwners, variable.writePortName()), 1, Integer::sum);
            for (var port : variable.readPortNames()) {
                readers.merge(owner(inputOwners, port), 1, Integer::sum);
            }
        }
        return new MemoryInterconnects(writers, readers);
    }

    private String owner(Map<String, String> owners, String port) {
        var owner = owners.get(port);
        if (owner == null) {
            throw new NotFoundException("Port %s not in any processing element of %s".formatted(port, entityName));
        }
        return owner;
    }

    public ArchitectureReport report() {
        return new ArchitectureReport(entityName, scheduleTime,
                processingElements.stream()
                        .map(pe -> resourceReport(pe, pe.typeName())).collect(Collectors.toList()),
                memories.stream()
                        .map(m -> resourceReport(m, m.memoryType().label())).collect(Collectors.toList()),
                directInterconnects == null ? List.of() : directInterconnects.names());
    }

    private static ArchitectureReport.ResourceReport resourceReport(Resource resource, String typeName) {
        List<List<String>> cells = resource.assignment()
                .map(a -> a.stream().map(ProcessCollection::names).collect(Collectors.toList()))
                .orElse(List.of());
        return new ArchitectureReport.ResourceReport(resource.entityName(), resource.resourceKind(), typeName,
                resource.inputCount(), resource.outputCount(), resource.collection().names(), cells);
    }
}
