package hlsyde.common.binding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import hlsyde.core.ConfigurationException;

/**
 * What the binding program minimizes. Both strategies color every exclusion
 * graph within its bound.
 */
public enum BindingStrategy {
    /**
     * The total number of processing elements and memories.
     */
    ILP_GRAPH_COLOR("ilp_graph_color"),
    /**
     * The number of distinct connections between resources, i.e. the
     * multiplexer inputs, within the resource bounds.
     */
    ILP_MIN_TOTAL_MUX("ilp_min_total_mux");

    private final String label;

    BindingStrategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BindingStrategy fromLabel(String label) {
        for (var strategy : values()) {
            if (strategy.label.equalsIgnoreCase(label)) {
                return strategy;
            }
        }
        throw new ConfigurationException("Invalid strategy '%s'".formatted(label));
    }
}
