package hlsyde.scheduling;

import hlsyde.core.ConfigurationException;
import hlsyde.core.Operation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts every operation as soon as all its inputs from the current iteration
 * are available. Inputs that pass a delay are taken as available at time 0.
 */
public class ASAPScheduler implements Scheduler, DataflowGraphMethods {

    private static final Logger logger = LoggerFactory.getLogger(ASAPScheduler.class);

    @Override
    public void applyScheduling(Schedule schedule) {
        var graph = schedule.graph();
        for (var level : precedenceList(graph)) {
            for (var id : level) {
                var op = graph.operation(id).orElseThrow();
                long start = 0;
                for (var dependency : schedule.incomingDependencies(id)) {
                    int inputOffset = inputOffset(op, dependency.destination().index());
                    if (schedule.lapsOf(dependency) > 0) {
                        start = Math.max(start, -inputOffset);
                    } else {
                        var src = graph.operation(dependency.source().operation()).orElseThrow();
                        long available = schedule.startTime(src.graphId())
                                + outputOffset(src, dependency.source().index());
                        start = Math.max(start, available - inputOffset);
                    }
                }
                schedule.placeOperation(id, (int) start);
            }
        }
        logger.debug("ASAP placed %d operations".formatted(graph.operations().size()));
    }

    static int inputOffset(Operation op, int port) {
        return op.inputLatencyOffset(port).orElseThrow(() -> new ConfigurationException(
                "Input port %d of operation %s has no latency-offset.".formatted(port, op.graphId())));
    }

    static int outputOffset(Operation op, int port) {
        return op.outputLatencyOffset(port).orElseThrow(() -> new ConfigurationException(
                "Output port %d of operation %s has no latency-offset.".formatted(port, op.graphId())));
    }
}
