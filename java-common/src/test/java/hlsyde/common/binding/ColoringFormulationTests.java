package hlsyde.common.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import hlsyde.common.ExclusionGraphs;
import hlsyde.common.OperatorProcess;
import hlsyde.common.PlainMemoryVariable;
import hlsyde.common.ProcessCollection;
import hlsyde.core.BindingAbortedException;
import hlsyde.core.ConfigurationException;
import hlsyde.core.InfeasibilityException;
import hlsyde.core.Operation;
import hlsyde.core.SynthesisConfiguration;

class ColoringFormulationTests {

    static ProcessCollection triangle() {
        return new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 3),
                PlainMemoryVariable.of("b", 1, 3),
                PlainMemoryVariable.of("c", 2, 3)), 6, true);
    }

    @Test
    void testProgramShape() {
        var graph = ExclusionGraphs.fromExecutionTime(triangle());
        var formulation = ColoringFormulation.formulate(List.of(graph), List.of(3));
        var program = formulation.program();
        // 3 color variables and 3x3 node-color variables
        assertEquals(12, program.variableCount());
        assertEquals(Map.of(0, 1, 1, 1, 2, 1), program.objective());
        assertTrue(program.constraints().stream()
                .allMatch(c -> c.indices().length == c.coefficients().length));
    }

    @Test
    void testCliqueLargerThanBound() {
        var graph = ExclusionGraphs.fromExecutionTime(triangle());
        assertThrows(InfeasibilityException.class, () -> ColoringFormulation.formulate(List.of(graph), List.of(2)));
    }

    @Test
    void testColorsAreRenumbered() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 1),
                PlainMemoryVariable.of("b", 2, 1)), 4, true);
        var formulation = ColoringFormulation.formulate(List.of(ExclusionGraphs.fromExecutionTime(collection)),
                List.of(2));
        var names = formulation.program().variables();
        var values = new int[names.size()];
        // both nodes on color 1, leaving color 0 unused
        values[names.indexOf("c[0][1]")] = 1;
        values[names.indexOf("x[0][a][1]")] = 1;
        values[names.indexOf("x[0][b][1]")] = 1;
        var colors = formulation.colors(new MilpSolution(MilpStatus.OPTIMAL, values));
        assertEquals(Map.of("a", 0, "b", 0), colors.get(0));
    }

    @Test
    void testBinderStatusHandling() {
        var operations = new ProcessCollection(List.of(OperatorProcess.of(
                Operation.of("add", Operation.ADD, 2, 1).withLatency(1).withExecutionTime(1), 0)), 4, false);
        var memories = new ProcessCollection(4, false);
        var config = new SynthesisConfiguration();
        var aborted = new ResourceBinder((program, limit) -> MilpSolution.withoutValues(MilpStatus.ABORTED));
        var ex = assertThrows(BindingAbortedException.class, () -> aborted.bind(operations, memories, config));
        assertEquals("binding aborted", ex.getMessage());
        var feasible = new ResourceBinder((program, limit) -> MilpSolution.withoutValues(MilpStatus.FEASIBLE));
        var infeasible = assertThrows(InfeasibilityException.class,
                () -> feasible.bind(operations, memories, config));
        assertEquals("Optimal solution could not be found via ILP, use another method.", infeasible.getMessage());
    }

    @Test
    void testMinMuxObjectiveCountsConnections() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 1),
                PlainMemoryVariable.of("b", 2, 1)), 4, true);
        var graphs = List.of(ExclusionGraphs.fromExecutionTime(collection),
                ExclusionGraphs.fromExecutionTime(collection));
        var links = List.of(new ColoringFormulation.Link(0, "a", 0, 1, "b", 1));
        var formulation = ColoringFormulation.formulateMinMux(graphs, List.of(2, 2), links);
        var names = formulation.program().variables();
        // one connection variable per pair of colors, and nothing else minimized
        var connections = names.stream().filter(n -> n.startsWith("y[")).toList();
        assertEquals(4, connections.size());
        assertEquals(connections.stream().map(names::indexOf).collect(Collectors.toSet()),
                formulation.program().objective().keySet());

        var values = new int[names.size()];
        values[names.indexOf("y[0][0][0][1][1][1]")] = 1;
        assertEquals(1, formulation.connectionCount(new MilpSolution(MilpStatus.OPTIMAL, values)));
        assertThrows(IllegalArgumentException.class, () -> ColoringFormulation.formulateMinMux(graphs,
                List.of(2, 2), List.of(new ColoringFormulation.Link(0, "missing", 0, 1, "b", 0))));
    }

    @Test
    void testStrategyOptions() {
        var operations = new ProcessCollection(4, false);
        var memories = new ProcessCollection(4, false);
        var binder = new ResourceBinder((program, limit) -> MilpSolution.withoutValues(MilpStatus.OPTIMAL));
        var unknown = new SynthesisConfiguration();
        unknown.strategy = "greedy";
        assertThrows(ConfigurationException.class, () -> binder.bind(operations, memories, unknown));
        var misplaced = new SynthesisConfiguration();
        misplaced.muxTargets.add("pe_to_mem");
        var ex = assertThrows(ConfigurationException.class, () -> binder.bind(operations, memories, misplaced));
        assertTrue(ex.getMessage().startsWith("mux_targets can only be specified"));
        assertEquals(Set.of(MuxTarget.PE_TO_MEM, MuxTarget.MEM_TO_PE, MuxTarget.PE_TO_PE),
                MuxTarget.forStrategy(Set.of(), BindingStrategy.ILP_MIN_TOTAL_MUX));
    }

    @Test
    void testMemoryGraphUsesPortBudget() {
        var config = new SynthesisConfiguration();
        // lifetimes overlap but each cycle has at most one read and one write
        var graph = ResourceBinder.memoryGraph(triangle(), config);
        assertEquals(0, graph.graph().edgeSet().size());
        config.memoryTotalPorts = 1;
        var single = ResourceBinder.memoryGraph(new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 2, 1)), 4, true), config);
        assertTrue(single.excludes("a", "b"));
    }

    @Test
    void testExecutionTimeLongerThanSchedule() {
        var operations = new ProcessCollection(List.of(OperatorProcess.of(
                Operation.of("mul", Operation.MUL, 2, 1).withLatency(5).withExecutionTime(5), 0)), 4, false);
        var binder = new ResourceBinder((program, limit) -> MilpSolution.withoutValues(MilpStatus.INFEASIBLE));
        var ex = assertThrows(InfeasibilityException.class,
                () -> binder.bind(operations, new ProcessCollection(4, false), new SynthesisConfiguration()));
        assertTrue(ex.getMessage().contains("execution time greater than the schedule time"));
    }
}
