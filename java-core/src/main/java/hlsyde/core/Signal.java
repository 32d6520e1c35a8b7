package hlsyde.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed edge from an output port to an input port.
 */
public record Signal(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("source") PortRef source,
        @JsonProperty("destination") PortRef destination) {

    public Signal {
        if (graphId == null || graphId.isBlank()) {
            throw new ConfigurationException("Signal without graph_id");
        }
        if (source == null || destination == null) {
            throw new ConfigurationException("Signal %s is not connected at both ends".formatted(graphId));
        }
    }
}
