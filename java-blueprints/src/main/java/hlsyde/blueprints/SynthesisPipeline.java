package hlsyde.blueprints;

import hlsyde.choco.ChocoMilpSolver;
import hlsyde.common.ProcessCollection;
import hlsyde.common.architecture.Architecture;
import hlsyde.common.architecture.Memory;
import hlsyde.common.architecture.MemoryType;
import hlsyde.common.architecture.ProcessingElement;
import hlsyde.common.binding.MilpSolver;
import hlsyde.common.binding.ResourceBinder;
import hlsyde.core.ConfigurationException;
import hlsyde.core.DataflowGraph;
import hlsyde.core.SynthesisConfiguration;
import hlsyde.scheduling.ALAPScheduler;
import hlsyde.scheduling.ASAPScheduler;
import hlsyde.scheduling.Schedule;
import hlsyde.scheduling.Scheduler;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes a dataflow graph from schedule to an architecture: the operations are
 * scheduled, operations and memory variables are bound to as few resources
 * as possible, and every resource gets its processes assigned.
 */
public class SynthesisPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisPipeline.class);

    private final MilpSolver solver;

    public SynthesisPipeline(MilpSolver solver) {
        this.solver = solver;
    }

    public SynthesisPipeline() {
        this(new ChocoMilpSolver());
    }

    public Schedule schedule(DataflowGraph graph, SynthesisConfiguration configuration) {
        var schedule = new Schedule(graph, configuration.scheduleTimeIfSet(), configuration.cyclic,
                scheduler(configuration.scheduler));
        logger.info("Scheduled %d operations in %d cycles".formatted(graph.operations().size(),
                schedule.scheduleTime()));
        return schedule;
    }

    static Scheduler scheduler(String name) {
        switch (name.toLowerCase()) {
            case "asap":
                return new ASAPScheduler();
            case "alap":
                return new ALAPScheduler();
            default:
                throw new ConfigurationException("Unknown scheduler '%s', use 'asap' or 'alap'".formatted(name));
        }
    }

    public SynthesisResult run(DataflowGraph graph, SynthesisConfiguration configuration) {
        return run(schedule(graph, configuration), configuration);
    }

    /**
     * Binds and assigns an existing schedule.
     */
    public SynthesisResult run(Schedule schedule, SynthesisConfiguration configuration) {
        var memoryType = MemoryType.fromLabel(configuration.memoryType);
        var binding = new ResourceBinder(solver).bind(schedule.operations(), schedule.memoryVariables(),
                configuration);

        var processingElements = new ArrayList<ProcessingElement>();
        binding.processingElements().forEach((name, collection) -> processingElements
                .add(new ProcessingElement(collection, name)));
        var memories = new ArrayList<Memory>();
        binding.memories().forEach((name, collection) -> memories.add(new Memory(collection, memoryType, name,
                configuration.memoryReadPorts, configuration.memoryWritePorts, configuration.memoryTotalPorts)));
        ProcessCollection direct = binding.directInterconnects().isEmpty() ? null : binding.directInterconnects();

        var architecture = new Architecture(processingElements, memories, "arch", direct);
        architecture.assignResources();
        architecture.validatePorts();
        logger.info("Architecture with %d processing elements, %d memories and %d direct interconnects"
                .formatted(processingElements.size(), memories.size(), binding.directInterconnects().size()));
        return new SynthesisResult(schedule, architecture, configuration);
    }
}
