package hlsyde.scheduling;

import com.fasterxml.jackson.annotation.JsonProperty;
import hlsyde.core.SynthesisArtifact;

import java.util.Map;

/**
 * The serializable state of a {@link Schedule}: start times by operation and
 * laps by the id of the signal entering the consumer.
 */
public record ScheduleSnapshot(
        @JsonProperty("schedule_time") int scheduleTime,
        @JsonProperty("cyclic") boolean cyclic,
        @JsonProperty("start_times") Map<String, Integer> startTimes,
        @JsonProperty("laps") Map<String, Integer> laps) implements SynthesisArtifact {
}
