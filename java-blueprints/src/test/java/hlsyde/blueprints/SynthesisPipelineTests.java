package hlsyde.blueprints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import hlsyde.common.MemoryProcess;
import hlsyde.core.ConfigurationException;
import hlsyde.core.DataflowGraph;
import hlsyde.core.SynthesisArtifact;
import hlsyde.core.SynthesisConfiguration;
import hlsyde.scheduling.ALAPScheduler;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class SynthesisPipelineTests {

    final ObjectMapper objectMapper = SynthesisArtifact.objectMapper;

    DataflowGraph delayedAdd() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/delayed_add.json")) {
            return objectMapper.readValue(is, DataflowGraph.class);
        }
    }

    SynthesisConfiguration configuration() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/delayed_add_config.json")) {
            return objectMapper.readValue(is, SynthesisConfiguration.class);
        }
    }

    @Test
    void testScheduleFromFixture() throws IOException {
        var schedule = new SynthesisPipeline().schedule(delayedAdd(), configuration());
        assertEquals(4, schedule.scheduleTime());
        assertEquals(Map.of("in", 0, "cmul", 0, "t", 0, "add", 0, "out", 1), schedule.startTimes());
    }

    @Test
    void testDelayedAddPipeline() throws IOException {
        var result = new SynthesisPipeline().run(delayedAdd(), configuration());
        var architecture = result.architecture();
        assertEquals(List.of("in0", "cmul0", "add0", "out0"),
                architecture.processingElements().stream().map(pe -> pe.entityName()).toList());
        assertEquals(1, architecture.memories().size());
        var memory = architecture.memories().get(0);
        assertEquals("memory0", memory.entityName());
        var variable = (MemoryProcess) memory.collection().fromName("cmul.0");
        assertEquals(List.of(3), variable.lifeTimes());
        assertEquals(List.of("in.0", "add.0"), architecture.directInterconnects().orElseThrow().names());
        assertEquals(Map.of("cmul0", 1), architecture.interconnectsForMemory("memory0").writers());
        assertEquals(Map.of("add0", 1), architecture.interconnectsForMemory("memory0").readers());
    }

    @Test
    void testReport() throws IOException {
        var report = new SynthesisPipeline().run(delayedAdd(), configuration()).report();
        var storage = report.storage().get("memory0");
        assertEquals("RAM", storage.memoryType());
        assertEquals(1, storage.cellCount());
        assertEquals(2, storage.addressLength());
        var json = report.asJsonString().orElseThrow();
        assertTrue(json.contains("\"schedule_time\":4"));
        assertTrue(json.contains("\"direct_interconnects\":[\"in.0\",\"add.0\"]"));
    }

    @Test
    void testRegisterMemory() throws IOException {
        var configuration = configuration();
        configuration.memoryType = "register";
        var result = new SynthesisPipeline().run(delayedAdd(), configuration);
        var memory = result.architecture().memories().get(0);
        assertEquals(1, memory.forwardBackwardTable().registerCount());
        assertEquals(1, result.report().storage().get("memory0").registerCount());
    }

    @Test
    void testInvalidMemoryType() throws IOException {
        var configuration = configuration();
        configuration.memoryType = "flash";
        var throwed = assertThrows(ConfigurationException.class,
                () -> new SynthesisPipeline().run(delayedAdd(), configuration));
        assertEquals("memory_type must be 'RAM' or 'register', not 'flash'", throwed.getMessage());
    }

    @Test
    void testSchedulerSelection() {
        assertInstanceOf(ALAPScheduler.class, SynthesisPipeline.scheduler("ALAP"));
        assertThrows(ConfigurationException.class, () -> SynthesisPipeline.scheduler("list"));
    }
}
