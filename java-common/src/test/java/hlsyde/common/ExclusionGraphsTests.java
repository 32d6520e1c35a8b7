package hlsyde.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import hlsyde.core.ConfigurationException;

class ExclusionGraphsTests {

    @Test
    void testExecutionTimeOverlap() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 1, 2),
                PlainMemoryVariable.of("c", 2, 2)), 8, false);
        var graph = ExclusionGraphs.fromExecutionTime(collection);
        assertTrue(graph.excludes("a", "b"));
        assertTrue(graph.excludes("b", "c"));
        assertFalse(graph.excludes("a", "c"));
    }

    @Test
    void testExecutionTimeWrapsAround() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("late", 3, 3),
                PlainMemoryVariable.of("early", 0, 1),
                PlainMemoryVariable.of("middle", 2, 1)), 5, true);
        var graph = ExclusionGraphs.fromExecutionTime(collection);
        assertTrue(graph.excludes("late", "early"));
        assertFalse(graph.excludes("late", "middle"));
        assertFalse(graph.excludes("early", "middle"));
    }

    @Test
    void testZeroLengthNeverOverlaps() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("direct", 1, 0),
                PlainMemoryVariable.of("long", 0, 4)), 5, true);
        assertEquals(0, ExclusionGraphs.fromExecutionTime(collection).degreeOf("direct"));
    }

    @Test
    void testMultipleReadsExclusionGraph() {
        var collection = new ProcessCollection(List.of(
                PlainMemoryVariable.of("P0", 0, 3),
                PlainMemoryVariable.of("P1", 1, 2),
                PlainMemoryVariable.of("P2", 2, 2),
                PlainMemoryVariable.of("P3", 3, 3)), 5, true);
        var graph = ExclusionGraphs.fromPorts(collection, 1, 1, 1);
        assertEquals(2, graph.degreeOf("P0"));
        assertEquals(2, graph.degreeOf("P1"));
        assertEquals(0, graph.degreeOf("P2"));
        assertEquals(2, graph.degreeOf("P3"));

        collection.addProcess(new PlainMemoryVariable("P4", 0, 0, Map.of(0, 1, 1, 2, 2, 3, 3, 4)));
        graph = ExclusionGraphs.fromPorts(collection, 1, 1, 1);
        assertEquals(3, graph.degreeOf("P0"));
        assertEquals(3, graph.degreeOf("P1"));
        assertEquals(1, graph.degreeOf("P2"));
        assertEquals(3, graph.degreeOf("P3"));
    }

    @Test
    void testPortOptions() {
        var collection = new ProcessCollection(List.of(PlainMemoryVariable.of("a", 0, 2)), 4, true);
        var ex = assertThrows(ConfigurationException.class, () -> ExclusionGraphs.fromPorts(collection, 1, -1, -1));
        assertEquals("If total_ports is unset, both read_ports and write_ports must be provided.", ex.getMessage());
        ex = assertThrows(ConfigurationException.class, () -> ExclusionGraphs.fromPorts(collection, 2, 1, 1));
        assertEquals("Total ports (1) less then read ports (2)", ex.getMessage());
        assertEquals(new PortBudget(1, 1, 2), PortBudget.sanitize(1, 1, -1));
        assertEquals(new PortBudget(2, 2, 2), PortBudget.sanitize(-1, -1, 2));
    }

    @Test
    void testReadAndWriteInSameCycle() {
        var collection = new ProcessCollection(List.of(PlainMemoryVariable.of("a", 0, 4)), 4, true);
        var ex = assertThrows(ConfigurationException.class, () -> ExclusionGraphs.fromPorts(collection, 1, 1, 1));
        assertEquals("Cannot read and write in the same cycle.", ex.getMessage());
    }
}
