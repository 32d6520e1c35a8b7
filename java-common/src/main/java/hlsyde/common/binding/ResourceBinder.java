package hlsyde.common.binding;

import hlsyde.common.ExclusionGraph;
import hlsyde.common.ExclusionGraphs;
import hlsyde.common.MemoryVariable;
import hlsyde.common.PortBudget;
import hlsyde.common.ProcessCollection;
import hlsyde.core.BindingAbortedException;
import hlsyde.core.InfeasibilityException;
import hlsyde.core.SynthesisConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds operator processes to processing elements and memory variables to
 * memories with as few resources as possible. Every operation type and the
 * memory variables get an exclusion graph, and all graphs are colored
 * together by a single program. Operators exclude each other when their
 * executions overlap, memory variables when together they need more ports than
 * a memory has.
 */
public class ResourceBinder {

    private static final Logger logger = LoggerFactory.getLogger(ResourceBinder.class);

    private final MilpSolver solver;

    public ResourceBinder(MilpSolver solver) {
        this.solver = solver;
    }

    /**
     * @param operations      operator processes of a schedule.
     * @param memoryVariables memory variables of the same schedule.
     * @throws InfeasibilityException  when a process does not fit the schedule
     *                                 time, a bound is too tight or the solver
     *                                 cannot prove optimality.
     * @throws BindingAbortedException when the solver was stopped.
     */
    public BindingResult bind(ProcessCollection operations, ProcessCollection memoryVariables,
            SynthesisConfiguration configuration) {
        checkExecutionTimes(operations);
        checkExecutionTimes(memoryVariables);

        var strategy = BindingStrategy.fromLabel(configuration.strategy);
        var targets = MuxTarget.forStrategy(configuration.muxTargets, strategy);

        var byType = operations.splitOnTypeName();
        var lengths = memoryVariables.splitOnLength(0);
        var collections = new ArrayList<ProcessCollection>(byType.values());
        collections.add(lengths.longProcesses());

        var graphs = new ArrayList<ExclusionGraph>();
        for (var group : byType.values()) {
            graphs.add(ExclusionGraphs.fromExecutionTime(group));
        }
        graphs.add(memoryGraph(lengths.longProcesses(), configuration));
        var types = new ArrayList<String>(byType.keySet());
        var bounds = new ArrayList<Integer>();
        for (int g = 0; g < graphs.size(); g++) {
            bounds.add(bound(graphs.get(g), g < types.size() ? types.get(g) : null, configuration));
        }
        logger.debug("Color bounds %s for %s and memories".formatted(bounds, types));

        var formulation = strategy == BindingStrategy.ILP_MIN_TOTAL_MUX
                ? ColoringFormulation.formulateMinMux(graphs, bounds,
                        links(collections, lengths.shortProcesses(), targets))
                : ColoringFormulation.formulate(graphs, bounds);
        var program = formulation.program();
        logger.debug("Binding program with %d variables and %d constraints"
                .formatted(program.variableCount(), program.constraints().size()));
        var solution = solver.solve(program, configuration.solverTimeout());
        logger.info("Binding solved by %s with status %s".formatted(solver.uniqueIdentifier(), solution.status()));
        if (solution.status() == MilpStatus.ABORTED) {
            throw new BindingAbortedException("binding aborted");
        }
        if (solution.status() != MilpStatus.OPTIMAL) {
            throw new InfeasibilityException("Optimal solution could not be found via ILP, use another method.");
        }
        if (strategy == BindingStrategy.ILP_MIN_TOTAL_MUX) {
            logger.info("%d connections for %s".formatted(formulation.connectionCount(solution), targets));
        }

        var colors = formulation.colors(solution);
        var processingElements = new LinkedHashMap<String, ProcessCollection>();
        for (int g = 0; g < types.size(); g++) {
            var cells = cells(collections.get(g), colors.get(g));
            for (int i = 0; i < cells.size(); i++) {
                processingElements.put(types.get(g) + i, cells.get(i));
            }
        }
        var memories = new LinkedHashMap<String, ProcessCollection>();
        var memoryCells = cells(lengths.longProcesses(), colors.get(types.size()));
        for (int i = 0; i < memoryCells.size(); i++) {
            memories.put("memory" + i, memoryCells.get(i));
        }
        logger.info("Bound to %d processing elements and %d memories".formatted(processingElements.size(),
                memories.size()));
        return new BindingResult(processingElements, memories, lengths.shortProcesses());
    }

    private static void checkExecutionTimes(ProcessCollection collection) {
        for (var process : collection) {
            if (process.executionTime() > collection.scheduleTime()) {
                throw new InfeasibilityException(
                        "Process %s has execution time greater than the schedule time.".formatted(process.name()));
            }
        }
    }

    /**
     * Memory variables conflict on the configured ports. Without any port
     * setting a memory has one read and one write port.
     */
    static ExclusionGraph memoryGraph(ProcessCollection variables, SynthesisConfiguration configuration) {
        if (configuration.memoryReadPorts < 0 && configuration.memoryWritePorts < 0
                && configuration.memoryTotalPorts < 0) {
            var ports = PortBudget.SIMPLE_DUAL_PORT;
            return ExclusionGraphs.fromPorts(variables, ports.read(), ports.write(), ports.total());
        }
        return ExclusionGraphs.fromPorts(variables, configuration.memoryReadPorts, configuration.memoryWritePorts,
                configuration.memoryTotalPorts);
    }

    /**
     * Connections through ports of the graph. Only memory variables taken from
     * a graph know their ports, plain ones are left out.
     */
    private static List<ColoringFormulation.Link> links(List<ProcessCollection> collections,
            ProcessCollection direct, Set<MuxTarget> targets) {
        int memoryGraph = collections.size() - 1;
        var graphOf = new HashMap<String, Integer>();
        for (int g = 0; g < memoryGraph; g++) {
            for (var process : collections.get(g)) {
                graphOf.put(process.name(), g);
            }
        }
        var links = new ArrayList<ColoringFormulation.Link>();
        for (var process : collections.get(memoryGraph)) {
            if (!(process instanceof MemoryVariable variable)) {
                continue;
            }
            var writer = graphOf.get(variable.writePort().operation());
            if (targets.contains(MuxTarget.PE_TO_MEM) && writer != null) {
                links.add(new ColoringFormulation.Link(writer, variable.writePort().operation(),
                        variable.writePort().index(), memoryGraph, variable.name(), 0));
            }
            if (targets.contains(MuxTarget.MEM_TO_PE)) {
                for (var read : variable.reads().keySet()) {
                    var reader = graphOf.get(read.operation());
                    if (reader != null) {
                        links.add(new ColoringFormulation.Link(memoryGraph, variable.name(), 0, reader,
                                read.operation(), read.index()));
                    }
                }
            }
        }
        if (targets.contains(MuxTarget.PE_TO_PE)) {
            for (var process : direct) {
                if (!(process instanceof MemoryVariable variable)) {
                    continue;
                }
                var writer = graphOf.get(variable.writePort().operation());
                for (var read : variable.reads().keySet()) {
                    var reader = graphOf.get(read.operation());
                    if (writer != null && reader != null) {
                        links.add(new ColoringFormulation.Link(writer, variable.writePort().operation(),
                                variable.writePort().index(), reader, read.operation(), read.index()));
                    }
                }
            }
        }
        logger.debug("%d links between resources".formatted(links.size()));
        return links;
    }

    /**
     * A caller-supplied cap is used as given, otherwise the saturation degree
     * coloring gives a valid bound.
     */
    private static int bound(ExclusionGraph graph, String typeName, SynthesisConfiguration configuration) {
        if (typeName != null && configuration.resources.containsKey(typeName)) {
            return configuration.resources.get(typeName);
        }
        if (typeName == null && configuration.maxMemoriesIfSet().isPresent()) {
            return configuration.maxMemoriesIfSet().getAsInt();
        }
        return graph.saturationDegreeColoring().getNumberColors();
    }

    private static List<ProcessCollection> cells(ProcessCollection collection, Map<String, Integer> colors) {
        var cells = new ArrayList<ProcessCollection>();
        for (var process : collection) {
            int color = colors.get(process.name());
            while (cells.size() <= color) {
                cells.add(collection.emptyCopy());
            }
            cells.get(color).addProcess(process);
        }
        return cells;
    }
}
