package hlsyde.common;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A value written once and read one or more times. The life time of a read is
 * its distance from the write, and the execution time is the longest life
 * time.
 */
public interface MemoryProcess extends Process {

    /**
     * Life time of each read, in read order.
     */
    List<Integer> lifeTimes();

    /**
     * Absolute read times, {@code startTime + lifeTime}, not wrapped.
     */
    default List<Integer> readTimes() {
        return lifeTimes().stream().map(l -> startTime() + l).collect(Collectors.toList());
    }

    String writePortName();

    List<String> readPortNames();

    @Override
    default int executionTime() {
        return lifeTimes().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    @Override
    MemoryProcess withStartTime(int startTime);

    /**
     * Splits the reads on their life time: reads not longer than the threshold
     * go to the short part, the rest to the long part. Both parts keep the
     * name.
     */
    LengthSplit<MemoryProcess> splitOnLength(int threshold);

    /**
     * Merges the reads of another part of the same value.
     */
    MemoryProcess mergedWith(MemoryProcess other);

    record LengthSplit<P>(Optional<P> shortPart, Optional<P> longPart) {
    }
}
