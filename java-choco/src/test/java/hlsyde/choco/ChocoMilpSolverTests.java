package hlsyde.choco;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import hlsyde.common.MemoryVariable;
import hlsyde.common.OperatorProcess;
import hlsyde.common.PlainMemoryVariable;
import hlsyde.common.ProcessCollection;
import hlsyde.common.binding.LinearProgram;
import hlsyde.common.binding.MilpStatus;
import hlsyde.common.binding.ResourceBinder;
import hlsyde.core.Operation;
import hlsyde.core.PortRef;
import hlsyde.core.SynthesisConfiguration;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class ChocoMilpSolverTests {

    private static OperatorProcess cmul(String name, int start, int executionTime) {
        var op = Operation.of(name, Operation.CONSTANT_MULTIPLICATION, 1, 1)
                .withLatency(executionTime)
                .withExecutionTime(executionTime);
        return OperatorProcess.of(op, start);
    }

    private static OperatorProcess add(String name, int start) {
        return OperatorProcess.of(Operation.of(name, Operation.ADD, 2, 1).withLatency(1).withExecutionTime(1), start);
    }

    @Test
    void testMinimalCover() {
        var builder = LinearProgram.builder();
        int a = builder.binaryVariable("a");
        int b = builder.binaryVariable("b");
        var program = builder.sum(List.of(a, b), LinearProgram.Relation.GREATER_EQUAL, 1)
                .minimize(a, 2)
                .minimize(b, 1)
                .build();
        var solution = new ChocoMilpSolver().solve(program, Optional.of(Duration.ofSeconds(10)));
        assertEquals(MilpStatus.OPTIMAL, solution.status());
        assertArrayEquals(new int[] { 0, 1 }, solution.values());
    }

    @Test
    void testInfeasibleProgram() {
        var builder = LinearProgram.builder();
        int a = builder.binaryVariable("a");
        int b = builder.binaryVariable("b");
        var program = builder.sum(List.of(a, b), LinearProgram.Relation.GREATER_EQUAL, 3).minimize(a, 1).build();
        assertEquals(MilpStatus.INFEASIBLE, new ChocoMilpSolver().solve(program, Optional.empty()).status());
    }

    @Test
    void testSharedProcessingElement() {
        var operations = new ProcessCollection(List.of(cmul("m1", 0, 1), cmul("m2", 1, 1)), 2, false);
        var result = new ResourceBinder(new ChocoMilpSolver())
                .bind(operations, new ProcessCollection(2, false), new SynthesisConfiguration());
        assertEquals(List.of("cmul0"), List.copyOf(result.processingElements().keySet()));
        assertEquals(2, result.processingElements().get("cmul0").size());
        assertEquals(0, result.memories().size());
    }

    @Test
    void testOverlappingProcessingElements() {
        var operations = new ProcessCollection(List.of(cmul("m1", 0, 2), cmul("m2", 0, 2)), 2, false);
        var result = new ResourceBinder(new ChocoMilpSolver())
                .bind(operations, new ProcessCollection(2, false), new SynthesisConfiguration());
        assertEquals(List.of("cmul0", "cmul1"), List.copyOf(result.processingElements().keySet()));
    }

    @Test
    void testOverlappingVariablesShareOneMemory() {
        // lifetimes overlap, but no cycle needs more than one read and one write
        var variables = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 3),
                PlainMemoryVariable.of("b", 1, 3),
                PlainMemoryVariable.of("c", 2, 3)), 6, true);
        var config = new SynthesisConfiguration();
        config.memoryReadPorts = 1;
        config.memoryWritePorts = 1;
        config.memoryTotalPorts = 2;
        var result = new ResourceBinder(new ChocoMilpSolver())
                .bind(new ProcessCollection(6, true), variables, config);
        assertEquals(List.of("memory0"), List.copyOf(result.memories().keySet()));
        assertEquals(List.of("a", "b", "c"), result.memories().get("memory0").names());
        assertEquals(0, result.directInterconnects().size());
    }

    @Test
    void testWritesInOneCycleNeedTwoMemories() {
        var variables = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 0, 3)), 4, true);
        var result = new ResourceBinder(new ChocoMilpSolver())
                .bind(new ProcessCollection(4, true), variables, new SynthesisConfiguration());
        assertEquals(2, result.memories().size());

        var config = new SynthesisConfiguration();
        config.memoryTotalPorts = 3;
        var wide = new ResourceBinder(new ChocoMilpSolver()).bind(new ProcessCollection(4, true), variables, config);
        assertEquals(1, wide.memories().size());
    }

    @Test
    void testMuxMinimizationSharesProcessingElements() {
        var x = add("x", 0);
        var y = add("y", 2);
        var z = new OperatorProcess("z", 5, 1, Operation.ADD,
                Operation.of("z", Operation.ADD, 2, 1).withLatency(1).withExecutionTime(1));
        var operations = new ProcessCollection(List.of(x, y, z), 6, true);
        var variables = new ProcessCollection(List.of(
                new MemoryVariable("x.0", 1, new PortRef("x", 0), Map.of(new PortRef("z", 0), 4)),
                new MemoryVariable("y.0", 3, new PortRef("y", 0), Map.of(new PortRef("z", 1), 2))), 6, true);
        var config = new SynthesisConfiguration();
        config.strategy = "ilp_min_total_mux";
        config.resources.put(Operation.ADD, 3);
        config.memoryReadPorts = 2;
        config.memoryWritePorts = 1;
        config.memoryTotalPorts = 3;
        var result = new ResourceBinder(new ChocoMilpSolver()).bind(operations, variables, config);
        assertEquals(1, result.memories().size());
        // x and y on one adder share the single connection into the memory
        var writer = result.processingElements().values().stream().filter(pe -> pe.contains("x")).findFirst()
                .orElseThrow();
        assertTrue(writer.contains("y"));
    }

    @Test
    void testDeterministicBinding() {
        var variables = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 1, 2),
                PlainMemoryVariable.of("c", 3, 2),
                PlainMemoryVariable.of("d", 4, 0)), 6, true);
        var binder = new ResourceBinder(new ChocoMilpSolver());
        var first = binder.bind(new ProcessCollection(6, true), variables, new SynthesisConfiguration());
        var second = binder.bind(new ProcessCollection(6, true), variables, new SynthesisConfiguration());
        assertEquals(first.memories().keySet(), second.memories().keySet());
        for (var name : first.memories().keySet()) {
            assertEquals(first.memories().get(name).names(), second.memories().get(name).names());
        }
        assertEquals(List.of("d"), first.directInterconnects().names());
    }
}
