package hlsyde.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Knobs for one run of the synthesis pipeline. Numeric fields use -1 for
 * "not set".
 */
public class SynthesisConfiguration {

    @JsonProperty("schedule_time")
    public int scheduleTime = -1;
    public boolean cyclic = false;
    /**
     * Either "asap" or "alap".
     */
    public String scheduler = "asap";
    /**
     * Upper bound of processing elements per operation type name.
     */
    public Map<String, Integer> resources = new HashMap<>();
    @JsonProperty("max_memories")
    public int maxMemories = -1;
    @JsonProperty("memory_read_ports")
    public int memoryReadPorts = -1;
    @JsonProperty("memory_write_ports")
    public int memoryWritePorts = -1;
    @JsonProperty("memory_total_ports")
    public int memoryTotalPorts = -1;
    /**
     * Either "RAM" or "register".
     */
    @JsonProperty("memory_type")
    public String memoryType = "RAM";
    /**
     * Either "ilp_graph_color" or "ilp_min_total_mux".
     */
    public String strategy = "ilp_graph_color";
    /**
     * Connections counted by "ilp_min_total_mux", among "pe_to_mem",
     * "mem_to_pe" and "pe_to_pe". Empty means all of them.
     */
    @JsonProperty("mux_targets")
    public Set<String> muxTargets = new HashSet<>();
    @JsonProperty("solver_timeout")
    public long solverTimeOutInSecs = -1L;
    @JsonProperty("input_sync")
    public boolean inputSync = true;
    @JsonProperty("adr_mux_size")
    public int addressMuxSize = 1;
    @JsonProperty("adr_pipe_depth")
    public int addressPipelineDepth = 0;

    public SynthesisConfiguration() {
    }

    @JsonIgnore
    public OptionalInt scheduleTimeIfSet() {
        return scheduleTime > 0 ? OptionalInt.of(scheduleTime) : OptionalInt.empty();
    }

    @JsonIgnore
    public OptionalInt maxMemoriesIfSet() {
        return maxMemories > 0 ? OptionalInt.of(maxMemories) : OptionalInt.empty();
    }

    @JsonIgnore
    public Optional<Duration> solverTimeout() {
        return solverTimeOutInSecs > 0 ? Optional.of(Duration.ofSeconds(solverTimeOutInSecs)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "SynthesisConfiguration [scheduleTime=" + scheduleTime + ", cyclic=" + cyclic + ", scheduler="
                + scheduler + ", resources=" + resources + ", maxMemories=" + maxMemories + ", memoryReadPorts="
                + memoryReadPorts + ", memoryWritePorts=" + memoryWritePorts + ", memoryTotalPorts="
                + memoryTotalPorts + ", memoryType=" + memoryType + ", strategy=" + strategy + ", muxTargets=" + muxTargets
                + ", solverTimeOutInSecs=" + solverTimeOutInSecs
                + ", inputSync=" + inputSync + ", addressMuxSize=" + addressMuxSize + ", addressPipelineDepth="
                + addressPipelineDepth + "]";
    }

    public static Optional<SynthesisConfiguration> fromJsonString(String s) {
        try {
            return Optional.of(SynthesisArtifact.objectMapper.readValue(s, SynthesisConfiguration.class));
        } catch (JsonProcessingException ignored) {
            return Optional.empty();
        }
    }

    public static Optional<SynthesisConfiguration> fromCBORBytes(byte[] b) {
        try {
            return Optional.of(SynthesisArtifact.objectMapperCBOR.readValue(b, SynthesisConfiguration.class));
        } catch (IOException ignored) {
            return Optional.empty();
        }
    }
}
