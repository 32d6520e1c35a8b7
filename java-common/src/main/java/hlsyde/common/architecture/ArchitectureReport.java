package hlsyde.common.architecture;

import com.fasterxml.jackson.annotation.JsonProperty;
import hlsyde.core.SynthesisArtifact;

import java.util.List;

/**
 * Plain data view of an {@link Architecture}.
 */
public record ArchitectureReport(
        @JsonProperty("entity_name") String entityName,
        @JsonProperty("schedule_time") int scheduleTime,
        @JsonProperty("processing_elements") List<ResourceReport> processingElements,
        List<ResourceReport> memories,
        @JsonProperty("direct_interconnects") List<String> directInterconnects) implements SynthesisArtifact {

    public record ResourceReport(
            @JsonProperty("entity_name") String entityName,
            ResourceKind kind,
            @JsonProperty("type_name") String typeName,
            @JsonProperty("input_count") int inputCount,
            @JsonProperty("output_count") int outputCount,
            List<String> processes,
            @JsonProperty("assignment") List<List<String>> assignment) {
    }
}
