package hlsyde.common;

import hlsyde.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Memory traffic not tied to a graph. Ports are plain integers, written as
 * {@code name.port}.
 */
public record PlainMemoryVariable(
        String name,
        int startTime,
        int writePort,
        Map<Integer, Integer> reads) implements MemoryProcess {

    public PlainMemoryVariable {
        if (startTime < 0) {
            throw new ConfigurationException("Process %s has negative start time".formatted(name));
        }
        if (reads.values().stream().anyMatch(l -> l < 0)) {
            throw new ConfigurationException("Memory variable %s is read before it is written".formatted(name));
        }
        reads = Collections.unmodifiableMap(new LinkedHashMap<>(reads));
    }

    /**
     * A variable written on port 0 and read on ports 0, 1, ... at the given life
     * times.
     */
    public static PlainMemoryVariable of(String name, int startTime, int... lifeTimes) {
        var reads = new LinkedHashMap<Integer, Integer>();
        for (int i = 0; i < lifeTimes.length; i++) {
            reads.put(i, lifeTimes[i]);
        }
        return new PlainMemoryVariable(name, startTime, 0, reads);
    }

    @Override
    public ProcessKind kind() {
        return ProcessKind.PLAIN_MEMORY_VARIABLE;
    }

    @Override
    public List<Integer> lifeTimes() {
        return new ArrayList<>(reads.values());
    }

    @Override
    public String writePortName() {
        return name + "." + writePort;
    }

    @Override
    public List<String> readPortNames() {
        return reads.keySet().stream().map(p -> name + "." + p).collect(Collectors.toList());
    }

    @Override
    public PlainMemoryVariable withStartTime(int startTime) {
        return new PlainMemoryVariable(name, startTime, writePort, reads);
    }

    @Override
    public LengthSplit<MemoryProcess> splitOnLength(int threshold) {
        var shortReads = new LinkedHashMap<Integer, Integer>();
        var longReads = new LinkedHashMap<Integer, Integer>();
        reads.forEach((port, life) -> (life <= threshold ? shortReads : longReads).put(port, life));
        return new LengthSplit<MemoryProcess>(
                shortReads.isEmpty() ? Optional.empty()
                        : Optional.of(new PlainMemoryVariable(name, startTime, writePort, shortReads)),
                longReads.isEmpty() ? Optional.empty()
                        : Optional.of(new PlainMemoryVariable(name, startTime, writePort, longReads)));
    }

    @Override
    public PlainMemoryVariable mergedWith(MemoryProcess other) {
        if (!(other instanceof PlainMemoryVariable variable) || !variable.name.equals(name)
                || variable.startTime != startTime) {
            throw new ConfigurationException("Cannot merge %s with %s".formatted(name, other.name()));
        }
        var merged = new LinkedHashMap<>(reads);
        merged.putAll(variable.reads);
        return new PlainMemoryVariable(name, startTime, writePort, merged);
    }
}
