package hlsyde.blueprints;

import com.fasterxml.jackson.annotation.JsonProperty;
import hlsyde.common.architecture.ArchitectureReport;
import hlsyde.core.SynthesisArtifact;
import hlsyde.scheduling.ScheduleSnapshot;

import java.util.Map;

/**
 * What a synthesis run writes out: the schedule, the resources with their
 * processes, and a summary of the storage of every memory.
 */
public record SynthesisReport(
        @JsonProperty("schedule") ScheduleSnapshot schedule,
        @JsonProperty("architecture") ArchitectureReport architecture,
        @JsonProperty("storage") Map<String, StorageSummary> storage) implements SynthesisArtifact {

    /**
     * Address sizes for a RAM, register count for a register memory. Fields
     * that do not apply are 0.
     */
    public record StorageSummary(
            @JsonProperty("memory_type") String memoryType,
            @JsonProperty("cell_count") int cellCount,
            @JsonProperty("address_length") int addressLength,
            @JsonProperty("register_count") int registerCount) {
    }
}
