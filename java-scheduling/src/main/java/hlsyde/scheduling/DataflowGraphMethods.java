package hlsyde.scheduling;

import hlsyde.core.ConfigurationException;
import hlsyde.core.DataflowGraph;
import hlsyde.core.Operation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import org.jgrapht.alg.cycle.JohnsonSimpleCycles;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Timing analyses over a dataflow graph that do not need a schedule.
 */
interface DataflowGraphMethods {

    /**
     * Groups the non-delay operations in levels. An operation lands in the
     * first level after all of its producers, where signals leaving a delay
     * do not count as a precedence.
     */
    default List<List<String>> precedenceList(final DataflowGraph graph) {
        var remaining = new HashMap<String, Integer>();
        for (var op : graph.operations()) {
            if (!op.isDelay()) {
                remaining.put(op.graphId(), 0);
            }
        }
        for (var s : graph.signals()) {
            if (remaining.containsKey(s.source().operation()) && remaining.containsKey(s.destination().operation())) {
                remaining.merge(s.destination().operation(), 1, Integer::sum);
            }
        }
        var levels = new ArrayList<List<String>>();
        var current = graph.operations().stream()
                .filter(op -> !op.isDelay() && remaining.get(op.graphId()) == 0)
                .map(Operation::graphId)
                .collect(Collectors.toList());
        int placed = 0;
        while (!current.isEmpty()) {
            levels.add(current);
            placed += current.size();
            var next = new ArrayList<String>();
            for (var id : current) {
                for (var s : graph.signalsFrom(id)) {
                    var dst = s.destination().operation();
                    if (remaining.containsKey(dst) && remaining.merge(dst, -1, Integer::sum) == 0) {
                        next.add(dst);
                    }
                }
            }
            current = next;
        }
        if (placed != remaining.size()) {
            throw new ConfigurationException("Loop without delays in the dataflow graph");
        }
        return levels;
    }

    /**
     * @return the latest end time of the ASAP schedule of the graph, 0 when
     *         every operation is free.
     */
    default int criticalPathTime(final DataflowGraph graph) {
        return new Schedule(graph, OptionalInt.empty(), false, new ASAPScheduler()).maxEndTime();
    }

    /**
     * The iteration period bound: over all loops of the graph, the largest
     * total latency divided by the number of delays in the loop.
     *
     * @return empty when the graph has no loops.
     */
    default Optional<Double> iterationPeriodBound(final DataflowGraph graph) {
        var directed = new DefaultDirectedGraph<String, DefaultEdge>(DefaultEdge.class);
        graph.operations().forEach(op -> directed.addVertex(op.graphId()));
        for (var s : graph.signals()) {
            directed.addEdge(s.source().operation(), s.destination().operation());
        }
        var loops = new JohnsonSimpleCycles<>(directed).findSimpleCycles();
        double bound = Double.NEGATIVE_INFINITY;
        for (var loop : loops) {
            int delays = 0;
            int latency = 0;
            for (var id : loop) {
                var op = graph.operation(id).orElseThrow();
                if (op.isDelay()) {
                    delays++;
                } else {
                    latency += op.latency();
                }
            }
            if (delays == 0) {
                throw new ConfigurationException("Loop without delays: %s".formatted(loop));
            }
            bound = Math.max(bound, (double) latency / delays);
        }
        return loops.isEmpty() ? Optional.empty() : Optional.of(bound);
    }
}
