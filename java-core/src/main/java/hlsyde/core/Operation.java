package hlsyde.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;

/**
 * A node of the dataflow graph as seen by the synthesis back end.
 *
 * Latency offsets are counted in clock cycles from the operation's start time:
 * an input offset tells when the value on that port is consumed, an output
 * offset when the result on that port becomes available. Both maps may be
 * partial; the scheduler complains about the missing ones it needs.
 */
public record Operation(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("type_name") String typeName,
        @JsonProperty("input_count") int inputCount,
        @JsonProperty("output_count") int outputCount,
        @JsonProperty("input_latency_offsets") Map<Integer, Integer> inputLatencyOffsets,
        @JsonProperty("output_latency_offsets") Map<Integer, Integer> outputLatencyOffsets,
        @JsonProperty("execution_time") Optional<Integer> executionTime) {

    public static final String INPUT = "in";
    public static final String OUTPUT = "out";
    public static final String DELAY = "t";
    public static final String ADD = "add";
    public static final String SUB = "sub";
    public static final String MUL = "mul";
    public static final String CONSTANT_MULTIPLICATION = "cmul";

    public Operation {
        if (graphId == null || graphId.isBlank()) {
            throw new ConfigurationException("Operation without graph_id");
        }
        if (typeName == null || typeName.isBlank()) {
            throw new ConfigurationException("Operation %s has no type_name".formatted(graphId));
        }
        if (inputCount < 0 || outputCount < 0) {
            throw new ConfigurationException("Operation %s has a negative port count".formatted(graphId));
        }
        inputLatencyOffsets = inputLatencyOffsets == null ? Map.of() : Map.copyOf(inputLatencyOffsets);
        outputLatencyOffsets = outputLatencyOffsets == null ? Map.of() : Map.copyOf(outputLatencyOffsets);
        executionTime = executionTime == null ? Optional.empty() : executionTime;
        checkPorts(graphId, "Input", inputLatencyOffsets, inputCount);
        checkPorts(graphId, "Output", outputLatencyOffsets, outputCount);
        if (executionTime.isPresent() && executionTime.get() < 0) {
            throw new ConfigurationException("Operation %s has a negative execution time".formatted(graphId));
        }
    }

    private static void checkPorts(String graphId, String side, Map<Integer, Integer> offsets, int count) {
        for (var port : offsets.keySet()) {
            if (port < 0 || port >= count) {
                throw new ConfigurationException(
                        "%s port %d of operation %s does not exist".formatted(side, port, graphId));
            }
        }
    }

    public static Operation of(String graphId, String typeName, int inputCount, int outputCount) {
        return new Operation(graphId, typeName, inputCount, outputCount, Map.of(), Map.of(), Optional.empty());
    }

    /**
     * An input with its single output available at its start.
     */
    public static Operation input(String graphId) {
        return new Operation(graphId, INPUT, 0, 1, Map.of(), Map.of(0, 0), Optional.empty());
    }

    /**
     * An output consuming its single input at its start.
     */
    public static Operation output(String graphId) {
        return new Operation(graphId, OUTPUT, 1, 0, Map.of(0, 0), Map.of(), Optional.empty());
    }

    public static Operation delay(String graphId) {
        return new Operation(graphId, DELAY, 1, 1, Map.of(), Map.of(), Optional.empty());
    }

    public Operation withLatencyOffsets(Map<Integer, Integer> inputOffsets, Map<Integer, Integer> outputOffsets) {
        return new Operation(graphId, typeName, inputCount, outputCount, inputOffsets, outputOffsets, executionTime);
    }

    /**
     * Sets every input offset to 0 and every output offset to {@code latency}.
     */
    public Operation withLatency(int latency) {
        var in = new HashMap<Integer, Integer>();
        for (int i = 0; i < inputCount; i++) {
            in.put(i, 0);
        }
        var out = new HashMap<Integer, Integer>();
        for (int i = 0; i < outputCount; i++) {
            out.put(i, latency);
        }
        return withLatencyOffsets(in, out);
    }

    public Operation withExecutionTime(int time) {
        return new Operation(graphId, typeName, inputCount, outputCount, inputLatencyOffsets,
                outputLatencyOffsets, Optional.of(time));
    }

    @JsonIgnore
    public boolean isDelay() {
        return DELAY.equals(typeName);
    }

    public Optional<Integer> inputLatencyOffset(int port) {
        return Optional.ofNullable(inputLatencyOffsets.get(port));
    }

    public Optional<Integer> outputLatencyOffset(int port) {
        return Optional.ofNullable(outputLatencyOffsets.get(port));
    }

    /**
     * @return true when every existing port has a latency offset.
     */
    @JsonIgnore
    public boolean hasAllLatencyOffsets() {
        return inputLatencyOffsets.size() == inputCount && outputLatencyOffsets.size() == outputCount;
    }

    /**
     * The largest distance between the consumption of an input and the
     * production of an output. A side without ports counts as a single port at
     * offset 0.
     */
    public int latency() {
        if (!hasAllLatencyOffsets()) {
            throw new ConfigurationException("Missing latency-offsets for operation %s".formatted(graphId));
        }
        int maxOut = outputLatencyOffsets.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        int minIn = inputLatencyOffsets.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        return maxOut - minIn;
    }

    /**
     * @return a copy with every offset and the execution time multiplied by the
     *         factor.
     */
    public Operation scaled(int factor) {
        return mapTimes(t -> t * factor);
    }

    /**
     * @return a copy with every offset and the execution time divided by the
     *         factor. The caller makes sure the division is exact.
     */
    public Operation divided(int factor) {
        return mapTimes(t -> t / factor);
    }

    private Operation mapTimes(IntUnaryOperator f) {
        return new Operation(graphId, typeName, inputCount, outputCount,
                inputLatencyOffsets.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> f.applyAsInt(e.getValue()))),
                outputLatencyOffsets.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> f.applyAsInt(e.getValue()))),
                executionTime.map(f::applyAsInt));
    }
}
