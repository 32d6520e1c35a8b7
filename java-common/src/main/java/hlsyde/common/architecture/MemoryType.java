package hlsyde.common.architecture;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import hlsyde.core.ConfigurationException;

public enum MemoryType {
    RAM("RAM"),
    REGISTER("register");

    private final String label;

    MemoryType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static MemoryType fromLabel(String label) {
        for (var type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new ConfigurationException("memory_type must be 'RAM' or 'register', not '%s'".formatted(label));
    }
}
