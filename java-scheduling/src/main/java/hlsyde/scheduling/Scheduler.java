package hlsyde.scheduling;

/**
 * Places the operations of a schedule in time. Implementations write start
 * times through {@link Schedule#placeOperation(String, int)} and may fix the
 * schedule time when the caller left it open.
 */
public interface Scheduler {

    void applyScheduling(Schedule schedule);

    default String uniqueIdentifier() {
        return getClass().getSimpleName();
    }
}
