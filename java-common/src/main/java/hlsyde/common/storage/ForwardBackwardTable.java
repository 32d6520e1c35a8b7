package hlsyde.common.storage;

import hlsyde.common.MemoryProcess;
import hlsyde.common.ProcessCollection;
import hlsyde.core.AllocationInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Register allocation of memory variables following the forward-backward
 * scheme: values enter the first register the cycle after they are written and
 * shift one register per cycle until they are read. When a value reaches the
 * last register before being read, it is sent back into a free register of the
 * next cycle, which adds a back edge between the two registers.
 *
 * The table has one row per cycle of the schedule and as many registers as
 * values alive in the busiest cycle. A variable read several times is output
 * at every read and keeps shifting until its last one. Reads with a life time
 * of zero are taken from the input.
 */
public class ForwardBackwardTable {

    private static final Logger logger = LoggerFactory.getLogger(ForwardBackwardTable.class);

    /**
     * Marks a value passed straight from the input to the output.
     */
    public static final int FROM_INPUT = -1;

    private final ProcessCollection collection;
    private final int scheduleTime;
    private final int registerCount;
    private final List<Entry> table = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final Map<String, Set<Integer>> readCycles = new LinkedHashMap<>();

    public ForwardBackwardTable(ProcessCollection collection) {
        this.collection = collection;
        this.scheduleTime = collection.scheduleTime();
        var variables = collection.memoryProcesses();
        var alive = new int[scheduleTime];
        for (var variable : variables) {
            variable.occupiedCycles(scheduleTime).stream().forEach(t -> alive[t]++);
        }
        this.registerCount = Arrays.stream(alive).max().orElse(0);
        for (int t = 0; t < scheduleTime; t++) {
            table.add(new Entry(registerCount));
        }
        for (var variable : variables) {
            names.add(variable.name());
            readCycles.put(variable.name(), variable.lifeTimes().stream()
                    .map(life -> (variable.startTime() + life) % scheduleTime)
                    .collect(Collectors.toCollection(TreeSet::new)));
            var entry = table.get(variable.startTime());
            entry.inputs.add(variable.name());
            if (variable.lifeTimes().contains(0)) {
                entry.output(variable.name(), FROM_INPUT);
            }
            if (!variable.isZeroLength()) {
                table.get((variable.startTime() + 1) % scheduleTime).registers[0] = variable;
            }
        }
        allocate();
        logger.debug("Allocated %d registers for %d variables".formatted(registerCount, variables.size()));
    }

    private void allocate() {
        int backwardMoves = 0;
        int maxBackwardMoves = scheduleTime * Math.max(1, registerCount) + 1;
        while (!isComplete()) {
            forwardAllocation();
            if (isComplete()) {
                break;
            }
            backwardAllocation();
            backwardMoves++;
            if (backwardMoves > maxBackwardMoves) {
                throw invariantViolation("Backward allocation does not converge");
            }
        }
    }

    private boolean isComplete() {
        return readCycles.entrySet().stream().allMatch(
                reads -> reads.getValue().stream().allMatch(t -> table.get(t).outputs.contains(reads.getKey())));
    }

    private boolean endsAt(MemoryProcess variable, int cycle) {
        return (variable.startTime() + variable.executionTime()) % scheduleTime == cycle;
    }

    private boolean isReadAt(MemoryProcess variable, int cycle) {
        return variable.lifeTimes().stream()
                .anyMatch(life -> life > 0 && (variable.startTime() + life) % scheduleTime == cycle);
    }

    private void forwardAllocation() {
        // two passes so values wrapping from the last row reach the first ones
        for (int pass = 0; pass < 2; pass++) {
            for (int t = 0; t < scheduleTime; t++) {
                var entry = table.get(t);
                for (int reg = 0; reg < registerCount; reg++) {
                    var variable = entry.registers[reg];
                    if (variable == null) {
                        continue;
                    }
                    if (isReadAt(variable, t) && !entry.outputs.contains(variable.name())) {
                        entry.output(variable.name(), reg);
                    }
                    if (!endsAt(variable, t) && reg != registerCount - 1) {
                        var next = table.get((t + 1) % scheduleTime);
                        var occupant = next.registers[reg + 1];
                        if (occupant == null) {
                            next.registers[reg + 1] = variable;
                        } else if (!occupant.name().equals(variable.name())) {
                            throw invariantViolation("Register R%d collides in cycle %d: %s and %s".formatted(
                                    reg + 1, (t + 1) % scheduleTime, occupant.name(), variable.name()));
                        }
                    }
                }
            }
        }
    }

    private void backwardAllocation() {
        int last = registerCount - 1;
        // prefer a free register right after an occupied one, so the value keeps shifting
        for (boolean strict : new boolean[] { true, false }) {
            for (int t = 0; t < scheduleTime; t++) {
                var entry = table.get(t);
                var variable = entry.registers[last];
                if (variable == null || endsAt(variable, t)) {
                    continue;
                }
                var next = table.get((t + 1) % scheduleTime);
                if (next.holds(variable.name())) {
                    continue;
                }
                for (int reg = 0; reg < registerCount; reg++) {
                    boolean free = next.registers[reg] == null;
                    if (free && (!strict || reg == 0 || entry.registers[reg - 1] != null)) {
                        next.registers[reg] = variable;
                        entry.backEdgeTo.put(last, reg);
                        next.backEdgeFrom.put(reg, last);
                        return;
                    }
                }
            }
        }
        throw invariantViolation("No free register for a backward move");
    }

    private AllocationInvariantException invariantViolation(String message) {
        logger.error("%s in forward-backward table:%n%s".formatted(message, this));
        return new AllocationInvariantException(message);
    }

    public ProcessCollection collection() {
        return collection;
    }

    public int scheduleTime() {
        return scheduleTime;
    }

    public int registerCount() {
        return registerCount;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(table);
    }

    public Entry entry(int cycle) {
        return table.get(cycle);
    }

    @Override
    public String toString() {
        int width = Math.max(4, names.stream().mapToInt(String::length).max().orElse(0));
        var sb = new StringBuilder();
        var header = new StringBuilder(" T |").append(center("In", width)).append('|');
        for (int reg = 0; reg < registerCount; reg++) {
            header.append(center("R" + reg, width)).append('|');
        }
        header.append(center("Out", width)).append('|');
        sb.append(header).append('\n').append("-".repeat(header.length())).append('\n');
        for (int t = 0; t < scheduleTime; t++) {
            var entry = table.get(t);
            sb.append("%2d |".formatted(t)).append(center(String.join(",", entry.inputs), width)).append('|');
            for (var variable : entry.registers) {
                sb.append(center(variable == null ? "-" : variable.name(), width)).append('|');
            }
            sb.append(center(String.join(",", entry.outputs), width)).append('|').append('\n');
        }
        return sb.toString();
    }

    private static String center(String text, int width) {
        int padding = Math.max(0, width + 2 - text.length());
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    /**
     * One cycle of the table.
     */
    public static final class Entry {

        private final List<String> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private final MemoryProcess[] registers;
        private final Map<Integer, Integer> backEdgeTo = new LinkedHashMap<>();
        private final Map<Integer, Integer> backEdgeFrom = new LinkedHashMap<>();
        private final Map<String, Integer> outputSources = new LinkedHashMap<>();
        private Integer outputsFrom;

        private Entry(int registerCount) {
            this.registers = new MemoryProcess[registerCount];
        }

        private void output(String name, int source) {
            outputs.add(name);
            outputSources.put(name, source);
            outputsFrom = source;
        }

        private boolean holds(String name) {
            return Arrays.stream(registers).anyMatch(v -> v != null && v.name().equals(name));
        }

        public List<String> inputs() {
            return Collections.unmodifiableList(inputs);
        }

        public List<String> outputs() {
            return Collections.unmodifiableList(outputs);
        }

        public List<Optional<String>> registers() {
            return Arrays.stream(registers).map(v -> Optional.ofNullable(v).map(MemoryProcess::name)).toList();
        }

        /**
         * @return the register the last output of the cycle is taken from, or
         *         {@link #FROM_INPUT}.
         */
        public OptionalInt outputsFrom() {
            return outputsFrom == null ? OptionalInt.empty() : OptionalInt.of(outputsFrom);
        }

        /**
         * @return the register the named output is taken from, or
         *         {@link #FROM_INPUT}.
         */
        public OptionalInt outputSource(String name) {
            var source = outputSources.get(name);
            return source == null ? OptionalInt.empty() : OptionalInt.of(source);
        }

        public Map<Integer, Integer> backEdgeTo() {
            return Collections.unmodifiableMap(backEdgeTo);
        }

        public Map<Integer, Integer> backEdgeFrom() {
            return Collections.unmodifiableMap(backEdgeFrom);
        }
    }
}
