package hlsyde.blueprints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SynthesisCLITests {

    @TempDir
    Path workDir;

    private Path copyResource(String name) throws IOException {
        var target = workDir.resolve(name);
        try (InputStream is = getClass().getResourceAsStream("/" + name)) {
            Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    @Test
    void testWritesReport() throws IOException {
        var graph = copyResource("delayed_add.json");
        var config = copyResource("delayed_add_config.json");
        var output = workDir.resolve("report.json");
        int exitCode = new CommandLine(new SynthesisCLI()).execute(
                "--graph", graph.toString(), "--config", config.toString(), "--output", output.toString());
        assertEquals(0, exitCode);
        var report = Files.readString(output);
        assertTrue(report.contains("\"processing_elements\""));
        assertTrue(report.contains("\"memory0\""));
    }

    @Test
    void testSynthesisFailure() throws IOException {
        var graph = copyResource("delayed_add.json");
        var config = workDir.resolve("flash.json");
        Files.writeString(config, "{\"memory_type\": \"flash\"}");
        int exitCode = new CommandLine(new SynthesisCLI()).execute(
                "--graph", graph.toString(), "--config", config.toString());
        assertEquals(1, exitCode);
    }

    @Test
    void testUnreadableGraph() throws IOException {
        var graph = workDir.resolve("broken.json");
        Files.writeString(graph, "{not json");
        assertEquals(2, new CommandLine(new SynthesisCLI()).execute("--graph", graph.toString()));
    }

    @Test
    void testMissingGraphOption() {
        assertEquals(2, new CommandLine(new SynthesisCLI()).execute());
    }
}
