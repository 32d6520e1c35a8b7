package hlsyde.common.binding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import hlsyde.core.ConfigurationException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of connections counted by {@link BindingStrategy#ILP_MIN_TOTAL_MUX}.
 */
public enum MuxTarget {
    PE_TO_MEM("pe_to_mem"),
    MEM_TO_PE("mem_to_pe"),
    PE_TO_PE("pe_to_pe");

    private final String label;

    MuxTarget(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static MuxTarget fromLabel(String label) {
        for (var target : values()) {
            if (target.label.equalsIgnoreCase(label)) {
                return target;
            }
        }
        throw new ConfigurationException("Invalid mux target '%s'".formatted(label));
    }

    /**
     * Parses the targets for a strategy. No labels means every target when
     * minimizing multiplexers.
     *
     * @throws ConfigurationException when targets are given to another
     *                                strategy or a label is unknown.
     */
    public static Set<MuxTarget> forStrategy(Collection<String> labels, BindingStrategy strategy) {
        if (strategy != BindingStrategy.ILP_MIN_TOTAL_MUX) {
            if (!labels.isEmpty()) {
                throw new ConfigurationException(
                        "mux_targets can only be specified with strategy='%s', not '%s'"
                                .formatted(BindingStrategy.ILP_MIN_TOTAL_MUX.label(), strategy.label()));
            }
            return EnumSet.noneOf(MuxTarget.class);
        }
        if (labels.isEmpty()) {
            return EnumSet.allOf(MuxTarget.class);
        }
        var targets = EnumSet.noneOf(MuxTarget.class);
        for (var label : labels) {
            targets.add(fromLabel(label));
        }
        return targets;
    }
}
