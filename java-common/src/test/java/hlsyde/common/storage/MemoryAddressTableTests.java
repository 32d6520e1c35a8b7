package hlsyde.common.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import hlsyde.common.AssignmentHeuristic;
import hlsyde.common.PlainMemoryVariable;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;

class MemoryAddressTableTests {

    static ProcessCollection memory() {
        return new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 1, 3),
                PlainMemoryVariable.of("c", 3, 2),
                PlainMemoryVariable.of("d", 4, 0)), 7, true);
    }

    @Test
    void testSizes() {
        var memory = memory();
        var cells = memory.splitOnExecutionTime(AssignmentHeuristic.LEFT_EDGE);
        var table = new MemoryAddressTable(cells, memory, 2, 1, true);
        assertEquals(2, table.totalRoms());
        assertEquals(4, table.elementsPerRom());
        assertEquals(3, table.counterLength());
        assertEquals(2, table.addressLength());
        assertEquals(List.of(new MemoryAddressTable.MuxLayer(0, 1, 2, 2)), table.muxLayers());
    }

    @Test
    void testWriteAndReadLists() {
        var memory = memory();
        var cells = memory.splitOnExecutionTime(AssignmentHeuristic.LEFT_EDGE);
        // left edge: a and c share cell 0, b gets cell 1
        var table = new MemoryAddressTable(cells, memory, 1, 0, true);
        assertEquals(List.of(new MemoryAddressTable.Access(0, "a")), table.writeList().get(0));
        assertEquals(List.of(new MemoryAddressTable.Access(1, "b")), table.writeList().get(1));
        assertEquals(List.of(new MemoryAddressTable.Access(0, "c")), table.writeList().get(3));
        assertTrue(table.writeList().get(4).isEmpty());
        assertEquals(List.of(new MemoryAddressTable.Access(0, "a")), table.readList().get(2));
        assertEquals(List.of(new MemoryAddressTable.Access(1, "b")), table.readList().get(4));
        assertEquals(List.of(new MemoryAddressTable.Bypass("d", 5)), table.bypasses());

        var unsynced = new MemoryAddressTable(cells, memory, 1, 0, false);
        assertEquals(List.of(new MemoryAddressTable.Access(0, "a")), unsynced.readList().get(1));
    }

    @Test
    void testRomContents() {
        var memory = memory();
        var cells = memory.splitOnExecutionTime(AssignmentHeuristic.LEFT_EDGE);
        var roms = new MemoryAddressTable(cells, memory, 2, 1, true).romContents();
        assertEquals(2, roms.size());
        assertEquals(List.of(new MemoryAddressTable.Access(0, "a")), roms.get(0).writes().get(0));
        // c written in cycle 3 lives in ROM 0, its read in cycle 5 in ROM 1 at address 1
        assertEquals(List.of(new MemoryAddressTable.Access(0, "c")), roms.get(1).reads().get(1));
    }

    @Test
    void testWritesInTheSameCycleAreAllKept() {
        var memory = new ProcessCollection(List.of(
                PlainMemoryVariable.of("a", 0, 2),
                PlainMemoryVariable.of("b", 0, 3)), 4, true);
        var cells = memory.splitOnExecutionTime(AssignmentHeuristic.LEFT_EDGE);
        var table = new MemoryAddressTable(cells, memory, 1, 0, true);
        var written = table.writeList().get(0);
        assertEquals(2, written.size());
        assertEquals(Set.of("a", "b"), written.stream().map(MemoryAddressTable.Access::variable)
                .collect(Collectors.toSet()));
        assertEquals(2, table.romContents().get(0).writes().get(0).size());
    }

    @Test
    void testInvalidOptions() {
        var memory = memory();
        var cells = memory.splitOnExecutionTime(AssignmentHeuristic.LEFT_EDGE);
        assertThrows(ConfigurationException.class, () -> new MemoryAddressTable(cells, memory, 2, 1, false));
        assertThrows(ConfigurationException.class, () -> new MemoryAddressTable(cells, memory, 3, 1, true));
        assertThrows(ConfigurationException.class, () -> new MemoryAddressTable(cells, memory, 4, 2, true));
        var foreign = List.of(new ProcessCollection(List.of(PlainMemoryVariable.of("x", 0, 1)), 7, true));
        assertThrows(ConfigurationException.class, () -> new MemoryAddressTable(foreign, memory, 1, 0, true));
    }
}
