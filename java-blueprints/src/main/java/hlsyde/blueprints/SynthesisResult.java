package hlsyde.blueprints;

import hlsyde.common.architecture.Architecture;
import hlsyde.common.architecture.MemoryType;
import hlsyde.core.SynthesisConfiguration;
import hlsyde.scheduling.Schedule;

import java.util.LinkedHashMap;

/**
 * The live objects of a synthesis run, kept so that callers can keep
 * refining the schedule and the architecture.
 */
public record SynthesisResult(Schedule schedule, Architecture architecture, SynthesisConfiguration configuration) {

    public SynthesisReport report() {
        var storage = new LinkedHashMap<String, SynthesisReport.StorageSummary>();
        for (var memory : architecture.memories()) {
            if (memory.memoryType() == MemoryType.REGISTER) {
                storage.put(memory.entityName(), new SynthesisReport.StorageSummary(memory.memoryType().label(), 0, 0,
                        memory.forwardBackwardTable().registerCount()));
            } else {
                var table = memory.addressTable(configuration.addressMuxSize, configuration.addressPipelineDepth,
                        configuration.inputSync);
                storage.put(memory.entityName(), new SynthesisReport.StorageSummary(memory.memoryType().label(),
                        table.cellCount(), table.addressLength(), 0));
            }
        }
        return new SynthesisReport(schedule.snapshot(), architecture.report(), storage);
    }
}
