package hlsyde.blueprints;

import hlsyde.core.DataflowGraph;
import hlsyde.core.SynthesisConfiguration;
import hlsyde.core.SynthesisException;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@CommandLine.Command(name = "hlsyde", mixinStandardHelpOptions = true,
        description = "Schedules a dataflow graph and binds it to processing elements and memories.")
public class SynthesisCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisCLI.class);

    @CommandLine.Option(names = { "-g", "--graph" }, required = true,
            description = "The path of the dataflow graph in JSON.")
    Path graphPath;
    @CommandLine.Option(names = { "-c", "--config" },
            description = "The path of the synthesis configuration in JSON. Defaults are used when absent.")
    Path configPath;
    @CommandLine.Option(names = { "-o", "--output" },
            description = "The path where the synthesis report is written. Printed to stdout when absent.")
    Path outputPath;

    @Override
    public Integer call() throws IOException {
        var graph = DataflowGraph.fromJsonString(Files.readString(graphPath, StandardCharsets.UTF_8));
        if (graph.isEmpty()) {
            logger.error("Could not read a dataflow graph from %s".formatted(graphPath));
            return 2;
        }
        var configuration = new SynthesisConfiguration();
        if (configPath != null) {
            var read = SynthesisConfiguration.fromJsonString(Files.readString(configPath, StandardCharsets.UTF_8));
            if (read.isEmpty()) {
                logger.error("Could not read a configuration from %s".formatted(configPath));
                return 2;
            }
            configuration = read.get();
        }
        logger.debug("Running with %s".formatted(configuration));
        try {
            var report = new SynthesisPipeline().run(graph.get(), configuration).report();
            var json = report.asJsonString().orElseThrow();
            if (outputPath != null) {
                Files.writeString(outputPath, json, StandardCharsets.UTF_8);
                logger.info("Report written to %s".formatted(outputPath));
            } else {
                System.out.println(json);
            }
            return 0;
        } catch (SynthesisException e) {
            logger.error("Synthesis failed: %s".formatted(e.getMessage()));
            return 1;
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new SynthesisCLI()).execute(args));
    }
}
