package hlsyde.common;

import java.util.BitSet;
import java.util.Comparator;

/**
 * Something that occupies a resource during the half-open interval
 * {@code [startTime, startTime + executionTime)}, repeated every schedule
 * time when the schedule is cyclic.
 *
 * Processes are identified by their name only.
 */
public interface Process {

    String name();

    int startTime();

    int executionTime();

    ProcessKind kind();

    /**
     * @return a copy starting at the given time, which is taken as is.
     */
    Process withStartTime(int startTime);

    /**
     * Start time ascending, then execution time descending, then name.
     */
    Comparator<Process> LEFT_EDGE_ORDER = Comparator.comparingInt(Process::startTime)
            .thenComparing(Comparator.comparingInt(Process::executionTime).reversed())
            .thenComparing(Process::name);

    default boolean isZeroLength() {
        return executionTime() == 0;
    }

    /**
     * @return the cycles in {@code [0, scheduleTime)} in which the process is
     *         alive.
     */
    default BitSet occupiedCycles(int scheduleTime) {
        var cycles = new BitSet(scheduleTime);
        int length = Math.min(executionTime(), scheduleTime);
        for (int i = 0; i < length; i++) {
            cycles.set(Math.floorMod(startTime() + i, scheduleTime));
        }
        return cycles;
    }

    default boolean overlaps(Process other, int scheduleTime) {
        if (isZeroLength() || other.isZeroLength()) {
            return false;
        }
        return occupiedCycles(scheduleTime).intersects(other.occupiedCycles(scheduleTime));
    }
}
