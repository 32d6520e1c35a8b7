package hlsyde.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SynthesisConfigurationTests {

    @Test
    void testDefaultsAreUnset() {
        var config = SynthesisConfiguration.fromJsonString("{}").orElseThrow();
        assertTrue(config.scheduleTimeIfSet().isEmpty());
        assertTrue(config.maxMemoriesIfSet().isEmpty());
        assertTrue(config.solverTimeout().isEmpty());
        assertEquals("asap", config.scheduler);
    }

    @Test
    void testSnakeCaseFields() {
        var config = SynthesisConfiguration.fromJsonString("""
                {"schedule_time": 4, "cyclic": true, "resources": {"cmul": 1},
                 "memory_total_ports": 2, "solver_timeout": 10, "adr_mux_size": 2}
                """).orElseThrow();
        assertEquals(4, config.scheduleTimeIfSet().getAsInt());
        assertTrue(config.cyclic);
        assertEquals(1, config.resources.get("cmul"));
        assertEquals(2, config.memoryTotalPorts);
        assertEquals(10L, config.solverTimeout().get().getSeconds());
        assertEquals(2, config.addressMuxSize);
    }

    @Test
    void testMalformed() {
        assertTrue(SynthesisConfiguration.fromJsonString("{\"schedule_time\": \"soon\"").isEmpty());
    }
}
