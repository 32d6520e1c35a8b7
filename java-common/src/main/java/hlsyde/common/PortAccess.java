package hlsyde.common;

import java.util.Set;
import java.util.TreeSet;

/**
 * The cycles, modulo the schedule time, in which a memory process uses a write
 * port and read ports. Several reads landing in the same cycle use one port.
 */
public record PortAccess(int writeCycle, Set<Integer> readCycles) {

    public static PortAccess of(MemoryProcess process, int scheduleTime) {
        var reads = new TreeSet<Integer>();
        for (int life : process.lifeTimes()) {
            reads.add(Math.floorMod(process.startTime() + life, scheduleTime));
        }
        return new PortAccess(Math.floorMod(process.startTime(), scheduleTime), reads);
    }

    public int reads(int cycle) {
        return readCycles.contains(cycle) ? 1 : 0;
    }

    public int writes(int cycle) {
        return writeCycle == cycle ? 1 : 0;
    }

    public boolean isActive(int cycle) {
        return writeCycle == cycle || readCycles.contains(cycle);
    }
}
