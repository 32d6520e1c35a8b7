package hlsyde.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A port of an operation, addressed by the operation's graph id and the port
 * index.
 */
public record PortRef(
        @JsonProperty("operation") String operation,
        @JsonProperty("index") int index) {

    public PortRef {
        if (operation == null || operation.isBlank()) {
            throw new ConfigurationException("Port reference without operation");
        }
        if (index < 0) {
            throw new ConfigurationException("Negative port index %d for %s".formatted(index, operation));
        }
    }

    @Override
    public String toString() {
        return operation + "." + index;
    }
}
