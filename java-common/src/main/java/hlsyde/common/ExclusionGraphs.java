package hlsyde.common;

import hlsyde.core.ConfigurationException;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import java.util.ArrayList;

/**
 * Builders of exclusion graphs. Both leave the collection untouched.
 */
public final class ExclusionGraphs {

    private ExclusionGraphs() {
    }

    /**
     * Two processes exclude each other when their cyclic life intervals share a
     * cycle.
     */
    public static ExclusionGraph fromExecutionTime(ProcessCollection collection) {
        var graph = emptyGraph(collection);
        var processes = collection.processes();
        var cycles = processes.stream().map(p -> p.occupiedCycles(collection.scheduleTime())).toList();
        for (int i = 0; i < processes.size(); i++) {
            for (int j = i + 1; j < processes.size(); j++) {
                if (cycles.get(i).intersects(cycles.get(j))) {
                    graph.addEdge(processes.get(i).name(), processes.get(j).name());
                }
            }
        }
        return new ExclusionGraph(collection, graph);
    }

    /**
     * Two memory processes exclude each other when, in a cycle they are both
     * active in, their reads and writes together do not fit the port budget.
     */
    public static ExclusionGraph fromPorts(ProcessCollection collection, int readPorts, int writePorts,
            int totalPorts) {
        var budget = PortBudget.sanitize(readPorts, writePorts, totalPorts);
        var graph = emptyGraph(collection);
        int scheduleTime = collection.scheduleTime();
        var processes = collection.memoryProcesses();
        var accesses = new ArrayList<PortAccess>();
        for (var process : processes) {
            var access = PortAccess.of(process, scheduleTime);
            for (int t = 0; t < scheduleTime; t++) {
                if (budget.exceededBy(access.reads(t), access.writes(t))) {
                    if (budget.total() == 1) {
                        throw new ConfigurationException("Cannot read and write in the same cycle.");
                    }
                    throw new ConfigurationException(
                            "Process %s needs more ports than available in cycle %d".formatted(process.name(), t));
                }
            }
            accesses.add(access);
        }
        for (int i = 0; i < processes.size(); i++) {
            for (int j = i + 1; j < processes.size(); j++) {
                if (conflict(accesses.get(i), accesses.get(j), budget, scheduleTime)) {
                    graph.addEdge(processes.get(i).name(), processes.get(j).name());
                }
            }
        }
        return new ExclusionGraph(collection, graph);
    }

    private static boolean conflict(PortAccess a, PortAccess b, PortBudget budget, int scheduleTime) {
        for (int t = 0; t < scheduleTime; t++) {
            if (a.isActive(t) && b.isActive(t)
                    && budget.exceededBy(a.reads(t) + b.reads(t), a.writes(t) + b.writes(t))) {
                return true;
            }
        }
        return false;
    }

    private static Graph<String, DefaultEdge> emptyGraph(ProcessCollection collection) {
        Graph<String, DefaultEdge> graph = new SimpleGraph<>(DefaultEdge.class);
        collection.processes().forEach(p -> graph.addVertex(p.name()));
        return graph;
    }
}
