package hlsyde.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

class DataflowGraphTests {

    static DataflowGraph fir() {
        return DataflowGraph.builder()
                .operation(Operation.input("in"))
                .operation(Operation.of("cmul", Operation.CONSTANT_MULTIPLICATION, 1, 1).withLatency(1))
                .operation(Operation.delay("t"))
                .operation(Operation.of("add", Operation.ADD, 2, 1).withLatency(1))
                .operation(Operation.output("out"))
                .connect("in", "cmul")
                .connect("cmul", 0, "add", 0)
                .connect("in", "t")
                .connect("t", 0, "add", 1)
                .connect("add", "out")
                .build();
    }

    @Test
    void testLookups() {
        var graph = fir();
        assertEquals(5, graph.signals().size());
        assertEquals("s1", graph.signals().get(0).graphId());
        assertEquals(2, graph.outputSignals("in", 0).size());
        assertEquals("t", graph.inputSignal("add", 1).get().source().operation());
        assertEquals(2, graph.signalsInto("add").size());
        assertEquals(1, graph.operationsOfType(Operation.DELAY).size());
        assertTrue(graph.operation("nothing").isEmpty());
    }

    @Test
    void testDrivenTwice() {
        var builder = DataflowGraph.builder()
                .operation(Operation.input("a"))
                .operation(Operation.input("b"))
                .operation(Operation.output("out"))
                .connect("a", "out")
                .connect("b", "out");
        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void testUnknownPort() {
        var builder = DataflowGraph.builder()
                .operation(Operation.input("a"))
                .operation(Operation.output("out"))
                .connect("a", 1, "out", 0);
        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void testLatency() {
        var op = Operation.of("bfly", "bfly", 2, 2).withLatencyOffsets(Map.of(0, 0, 1, 1), Map.of(0, 3, 1, 4));
        assertEquals(4, op.latency());
        assertEquals(8, op.scaled(2).latency());
        assertEquals(2, op.scaled(2).divided(4).latency());
        assertEquals(0, Operation.output("out").latency());
        var partial = Operation.of("bfly", "bfly", 2, 2).withLatencyOffsets(Map.of(0, 0), Map.of(0, 3, 1, 4));
        assertThrows(ConfigurationException.class, partial::latency);
    }

    @Test
    void testJsonRoundTrip() {
        var graph = fir();
        var json = graph.asJsonString().orElseThrow();
        var back = DataflowGraph.fromJsonString(json).orElseThrow();
        assertEquals(graph, back);
    }

    @Test
    void testJsonWithoutExecutionTime() {
        var json = """
                {
                  "operations": [
                    {"graph_id": "in", "type_name": "in", "input_count": 0, "output_count": 1,
                     "output_latency_offsets": {"0": 0}},
                    {"graph_id": "out", "type_name": "out", "input_count": 1, "output_count": 0,
                     "input_latency_offsets": {"0": 0}, "execution_time": 1}
                  ],
                  "signals": [
                    {"graph_id": "s1", "source": {"operation": "in", "index": 0},
                     "destination": {"operation": "out", "index": 0}}
                  ]
                }
                """;
        var graph = DataflowGraph.fromJsonString(json).orElseThrow();
        assertTrue(graph.operation("in").get().executionTime().isEmpty());
        assertEquals(1, graph.operation("out").get().executionTime().get());
        assertEquals(0, graph.operation("in").get().outputLatencyOffset(0).get());
    }
}
