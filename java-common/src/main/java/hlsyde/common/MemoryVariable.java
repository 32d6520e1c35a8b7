package hlsyde.common;

import hlsyde.core.ConfigurationException;
import hlsyde.core.PortRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A value produced on an output port of the graph and consumed on input ports.
 */
public record MemoryVariable(
        String name,
        int startTime,
        PortRef writePort,
        Map<PortRef, Integer> reads) implements MemoryProcess {

    public MemoryVariable {
        if (startTime < 0) {
            throw new ConfigurationException("Process %s has negative start time".formatted(name));
        }
        if (reads.values().stream().anyMatch(l -> l < 0)) {
            throw new ConfigurationException("Memory variable %s is read before it is written".formatted(name));
        }
        reads = Collections.unmodifiableMap(new LinkedHashMap<>(reads));
    }

    @Override
    public ProcessKind kind() {
        return ProcessKind.MEMORY_VARIABLE;
    }

    @Override
    public List<Integer> lifeTimes() {
        return new ArrayList<>(reads.values());
    }

    @Override
    public String writePortName() {
        return writePort.toString();
    }

    @Override
    public List<String> readPortNames() {
        return reads.keySet().stream().map(PortRef::toString).collect(Collectors.toList());
    }

    @Override
    public MemoryVariable withStartTime(int startTime) {
        return new MemoryVariable(name, startTime, writePort, reads);
    }

    @Override
    public LengthSplit<MemoryProcess> splitOnLength(int threshold) {
        var shortReads = new LinkedHashMap<PortRef, Integer>();
        var longReads = new LinkedHashMap<PortRef, Integer>();
        reads.forEach((port, life) -> (life <= threshold ? shortReads : longReads).put(port, life));
        return new LengthSplit<MemoryProcess>(
                shortReads.isEmpty() ? Optional.empty()
                        : Optional.of(new MemoryVariable(name, startTime, writePort, shortReads)),
                longReads.isEmpty() ? Optional.empty()
                        : Optional.of(new MemoryVariable(name, startTime, writePort, longReads)));
    }

    @Override
    public MemoryVariable mergedWith(MemoryProcess other) {
        if (!(other instanceof MemoryVariable variable) || !variable.name.equals(name)
                || variable.startTime != startTime) {
            throw new ConfigurationException("Cannot merge %s with %s".formatted(name, other.name()));
        }
        var merged = new LinkedHashMap<>(reads);
        merged.putAll(variable.reads);
        return new MemoryVariable(name, startTime, writePort, merged);
    }
}
