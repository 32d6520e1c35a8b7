package hlsyde.scheduling;

import hlsyde.common.MemoryVariable;
import hlsyde.common.OperatorProcess;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;
import hlsyde.core.ConstraintViolationException;
import hlsyde.core.DataflowGraph;
import hlsyde.core.NotFoundException;
import hlsyde.core.Operation;
import hlsyde.core.PortRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start times for the operations of a dataflow graph within a schedule time.
 *
 * Delays are not placed: they are folded into {@link Dependency dependencies}
 * and listed with start time 0. Every dependency carries a lap count, the
 * number of schedule periods between production and consumption. In a cyclic
 * schedule, operations may wrap around the period and the laps follow, so the
 * absolute timing of every dependency is kept.
 */
public class Schedule implements DataflowGraphMethods {

    /** Slack of a side without constraints. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Logger logger = LoggerFactory.getLogger(Schedule.class);

    private DataflowGraph graph;
    private final boolean cyclic;
    private final List<Dependency> dependencies;
    private final Map<String, Integer> startTimes = new LinkedHashMap<>();
    private final Map<String, Integer> laps = new LinkedHashMap<>();
    private int scheduleTime;

    public Schedule(DataflowGraph graph, OptionalInt scheduleTime, boolean cyclic, Scheduler scheduler) {
        if (scheduleTime.isPresent() && scheduleTime.getAsInt() <= 0) {
            throw new ConfigurationException("Schedule time must be positive, got %d".formatted(scheduleTime.getAsInt()));
        }
        this.graph = graph;
        this.cyclic = cyclic;
        this.scheduleTime = scheduleTime.orElse(-1);
        graph.operations().forEach(op -> startTimes.put(op.graphId(), 0));
        this.dependencies = foldDelays(graph);
        dependencies.forEach(d -> laps.put(d.signalId(), d.delays()));
        scheduler.applyScheduling(this);
        int maxEnd = maxEndTime();
        if (this.scheduleTime < 0) {
            this.scheduleTime = Math.max(maxEnd, 1);
        } else if (this.scheduleTime < maxEnd) {
            throw new ConfigurationException("Too short schedule time. Minimum is %d.".formatted(maxEnd));
        }
        if (cyclic) {
            for (var op : nonDelayOperations()) {
                if (startTimes.get(op.graphId()) >= this.scheduleTime) {
                    shift(op.graphId(), 0);
                }
            }
        }
        logger.debug("%s scheduled %d operations in %d cycles".formatted(
                scheduler.uniqueIdentifier(), startTimes.size(), this.scheduleTime));
    }

    public Schedule(DataflowGraph graph, int scheduleTime, boolean cyclic) {
        this(graph, OptionalInt.of(scheduleTime), cyclic, new ASAPScheduler());
    }

    /**
     * ASAP schedule, not cyclic, as long as the critical path.
     */
    public Schedule(DataflowGraph graph) {
        this(graph, OptionalInt.empty(), false, new ASAPScheduler());
    }

    private static List<Dependency> foldDelays(DataflowGraph graph) {
        var folded = new ArrayList<Dependency>();
        for (var s : graph.signals()) {
            if (graph.operation(s.destination().operation()).orElseThrow().isDelay()) {
                continue;
            }
            var source = s.source();
            var op = graph.operation(source.operation()).orElseThrow();
            int delays = 0;
            while (op.isDelay()) {
                if (++delays > graph.operations().size()) {
                    throw new ConfigurationException("Loop of delays through %s".formatted(op.graphId()));
                }
                var current = op;
                var driver = graph.inputSignal(current.graphId(), 0).orElseThrow(
                        () -> new ConfigurationException("Delay %s has no input".formatted(current.graphId())));
                source = driver.source();
                op = graph.operation(source.operation()).orElseThrow();
            }
            folded.add(new Dependency(s.graphId(), source, s.destination(), delays));
        }
        return Collections.unmodifiableList(folded);
    }

    public DataflowGraph graph() {
        return graph;
    }

    public int scheduleTime() {
        return scheduleTime;
    }

    public boolean isCyclic() {
        return cyclic;
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public List<Dependency> incomingDependencies(String operation) {
        return dependencies.stream()
                .filter(d -> d.destination().operation().equals(operation))
                .collect(Collectors.toList());
    }

    public List<Dependency> outgoingDependencies(String operation) {
        return dependencies.stream()
                .filter(d -> d.source().operation().equals(operation))
                .collect(Collectors.toList());
    }

    public int lapsOf(Dependency dependency) {
        return laps.get(dependency.signalId());
    }

    public Map<String, Integer> startTimes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(startTimes));
    }

    public Map<String, Integer> laps() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(laps));
    }

    public int startTime(String operation) {
        var start = startTimes.get(operation);
        if (start == null) {
            throw new NotFoundException("No operation with graph_id '%s' in schedule".formatted(operation));
        }
        return start;
    }

    void placeOperation(String operation, int startTime) {
        startTimes.put(operation, startTime);
    }

    void fixScheduleTime(int scheduleTime) {
        this.scheduleTime = Math.max(scheduleTime, 1);
    }

    private List<Operation> nonDelayOperations() {
        return graph.operations().stream().filter(op -> !op.isDelay()).collect(Collectors.toList());
    }

    private Operation placedOperation(String name) {
        var op = graph.operation(name)
                .orElseThrow(() -> new NotFoundException("No operation with graph_id '%s' in schedule".formatted(name)));
        if (op.isDelay()) {
            throw new ConfigurationException("Operation '%s' is a delay and is not scheduled".formatted(name));
        }
        return op;
    }

    /**
     * @return start time plus the largest latency offset of the operation.
     */
    public int endTime(String operation) {
        var op = placedOperation(operation);
        int lastOffset = 0;
        for (int offset : op.inputLatencyOffsets().values()) {
            lastOffset = Math.max(lastOffset, offset);
        }
        for (int offset : op.outputLatencyOffsets().values()) {
            lastOffset = Math.max(lastOffset, offset);
        }
        return startTimes.get(operation) + lastOffset;
    }

    public int maxEndTime() {
        return nonDelayOperations().stream().mapToInt(op -> endTime(op.graphId())).max().orElse(0);
    }

    /**
     * Cycles between the value being available and being used, including the
     * laps.
     */
    private long margin(Dependency dependency) {
        var src = graph.operation(dependency.source().operation()).orElseThrow();
        var dst = graph.operation(dependency.destination().operation()).orElseThrow();
        long available = startTimes.get(src.graphId()) + ASAPScheduler.outputOffset(src, dependency.source().index());
        long used = startTimes.get(dst.graphId()) + ASAPScheduler.inputOffset(dst, dependency.destination().index())
                + (long) scheduleTime * lapsOf(dependency);
        return used - available;
    }

    /**
     * How far the operation can move earlier and later without breaking a
     * dependency. A non-cyclic schedule also bounds the move by time 0 and the
     * schedule time.
     */
    public Slacks slacks(String operation) {
        placedOperation(operation);
        long backward = Long.MAX_VALUE;
        for (var d : incomingDependencies(operation)) {
            backward = Math.min(backward, margin(d));
        }
        long forward = Long.MAX_VALUE;
        for (var d : outgoingDependencies(operation)) {
            forward = Math.min(forward, margin(d));
        }
        if (!cyclic) {
            backward = Math.min(backward, startTimes.get(operation));
            forward = Math.min(forward, (long) scheduleTime - endTime(operation));
        }
        return new Slacks((int) Math.min(backward, UNBOUNDED), (int) Math.min(forward, UNBOUNDED));
    }

    public int forwardSlack(String operation) {
        return slacks(operation).forward();
    }

    public int backwardSlack(String operation) {
        return slacks(operation).backward();
    }

    /**
     * Moves an operation by {@code delta} cycles, within its slacks.
     */
    public Schedule moveOperation(String operation, int delta) {
        var slacks = slacks(operation);
        if (delta < -(long) slacks.backward() || delta > slacks.forward()) {
            throw new ConstraintViolationException("Operation '%s' got incorrect move: %d. Must be between %d and %d."
                    .formatted(operation, delta, -slacks.backward(), slacks.forward()));
        }
        shift(operation, delta);
        return this;
    }

    /**
     * Moves an operation as late as its consumers allow. Without consumers, it
     * ends at the schedule time.
     */
    public Schedule moveOperationAlap(String operation) {
        int forward = slacks(operation).forward();
        int delta = forward == UNBOUNDED ? Math.max(0, scheduleTime - endTime(operation)) : forward;
        return moveOperation(operation, delta);
    }

    private void shift(String operation, long delta) {
        long moved = startTimes.get(operation) + delta;
        if (!cyclic) {
            startTimes.put(operation, (int) moved);
            return;
        }
        int periods = (int) Math.floorDiv(moved, (long) scheduleTime);
        startTimes.put(operation, (int) Math.floorMod(moved, (long) scheduleTime));
        if (periods != 0) {
            for (var d : incomingDependencies(operation)) {
                laps.merge(d.signalId(), periods, Integer::sum);
            }
            for (var d : outgoingDependencies(operation)) {
                laps.merge(d.signalId(), -periods, Integer::sum);
            }
        }
    }

    public Schedule setScheduleTime(int time) {
        int minimum = maxEndTime();
        if (time < minimum) {
            throw new ConstraintViolationException(
                    "New schedule time (%d) too short, minimum: %d.".formatted(time, minimum));
        }
        int previous = scheduleTime;
        scheduleTime = time;
        var broken = dependencies.stream().filter(d -> margin(d) < 0).findFirst();
        if (broken.isPresent()) {
            scheduleTime = previous;
            throw new ConstraintViolationException("New schedule time (%d) breaks dependency %s."
                    .formatted(time, broken.get().signalId()));
        }
        return this;
    }

    public Schedule rotateForward() {
        return rotate(1);
    }

    public Schedule rotateBackward() {
        return rotate(-1);
    }

    private Schedule rotate(int delta) {
        if (!cyclic) {
            throw new ConstraintViolationException("Cannot rotate non-cyclic schedule.");
        }
        for (var op : nonDelayOperations()) {
            shift(op.graphId(), delta);
        }
        return this;
    }

    /**
     * Multiplies every time of the schedule and of its graph by the factor.
     */
    public Schedule increaseTimeResolution(int factor) {
        if (factor < 1) {
            throw new ConfigurationException("Time resolution factor must be positive, got %d".formatted(factor));
        }
        graph = graph.scaled(factor);
        scheduleTime *= factor;
        startTimes.replaceAll((op, start) -> start * factor);
        return this;
    }

    /**
     * @return every factor that divides all times of the schedule and of its
     *         graph, in ascending order.
     */
    public List<Integer> possibleTimeResolutionDecrements() {
        int divisor = scheduleTime;
        for (var op : nonDelayOperations()) {
            divisor = gcd(divisor, startTimes.get(op.graphId()));
        }
        for (var op : graph.operations()) {
            for (int offset : op.inputLatencyOffsets().values()) {
                divisor = gcd(divisor, offset);
            }
            for (int offset : op.outputLatencyOffsets().values()) {
                divisor = gcd(divisor, offset);
            }
            if (op.executionTime().isPresent()) {
                divisor = gcd(divisor, op.executionTime().get());
            }
        }
        var factors = new ArrayList<Integer>();
        for (int f = 1; f <= divisor; f++) {
            if (divisor % f == 0) {
                factors.add(f);
            }
        }
        return factors;
    }

    public Schedule decreaseTimeResolution(int factor) {
        var possible = possibleTimeResolutionDecrements();
        if (!possible.contains(factor)) {
            throw new ConfigurationException("Not possible to decrease resolution with %d. Possible values are %s."
                    .formatted(factor, possible));
        }
        graph = graph.divided(factor);
        scheduleTime /= factor;
        startTimes.replaceAll((op, start) -> start / factor);
        return this;
    }

    private static int gcd(int a, int b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            int r = a % b;
            a = b;
            b = r;
        }
        return a;
    }

    public int criticalPathTime() {
        return criticalPathTime(graph);
    }

    public Optional<Double> iterationPeriodBound() {
        return iterationPeriodBound(graph);
    }

    /**
     * @return one operator process per scheduled operation.
     */
    public ProcessCollection operations() {
        var collection = new ProcessCollection(scheduleTime, cyclic);
        for (var op : nonDelayOperations()) {
            collection.addProcess(OperatorProcess.of(op, startTimes.get(op.graphId())));
        }
        return collection;
    }

    /**
     * @return one memory variable per output port that has consumers. The
     *         variable is written when the value is available and read where
     *         each consumer uses it.
     */
    public ProcessCollection memoryVariables() {
        var collection = new ProcessCollection(scheduleTime, cyclic);
        for (var op : nonDelayOperations()) {
            var outgoing = outgoingDependencies(op.graphId());
            for (int port = 0; port < op.outputCount(); port++) {
                var writePort = new PortRef(op.graphId(), port);
                var consumers = outgoing.stream().filter(d -> d.source().equals(writePort)).toList();
                if (consumers.isEmpty()) {
                    continue;
                }
                int available = startTimes.get(op.graphId()) + ASAPScheduler.outputOffset(op, port);
                var reads = new LinkedHashMap<PortRef, Integer>();
                for (var d : consumers) {
                    reads.put(d.destination(), (int) margin(d));
                }
                collection.addProcess(new MemoryVariable(writePort.toString(), available, writePort, reads));
            }
        }
        return collection;
    }

    public ScheduleSnapshot snapshot() {
        return new ScheduleSnapshot(scheduleTime, cyclic, startTimes(), laps());
    }

    @Override
    public String toString() {
        return "Schedule(" + startTimes + "; schedule_time=" + scheduleTime + ", cyclic=" + cyclic + ")";
    }

    /**
     * Backward and forward slack of an operation, {@link #UNBOUNDED} where no
     * dependency limits the move.
     */
    public record Slacks(int backward, int forward) {
    }
}
