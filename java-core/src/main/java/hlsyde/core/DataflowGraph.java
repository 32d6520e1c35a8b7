package hlsyde.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only view of a dataflow graph: operations connected port to port by
 * signals. Every input port is driven by at most one signal, an output port
 * may fan out.
 */
public record DataflowGraph(
        @JsonProperty("operations") List<Operation> operations,
        @JsonProperty("signals") List<Signal> signals) implements SynthesisArtifact {

    public DataflowGraph {
        operations = operations == null ? List.of() : List.copyOf(operations);
        signals = signals == null ? List.of() : List.copyOf(signals);
        var byId = new HashMap<String, Operation>();
        for (var op : operations) {
            if (byId.put(op.graphId(), op) != null) {
                throw new ConfigurationException("Duplicate operation graph_id %s".formatted(op.graphId()));
            }
        }
        var signalIds = new HashSet<String>();
        var driven = new HashSet<PortRef>();
        for (var s : signals) {
            if (!signalIds.add(s.graphId())) {
                throw new ConfigurationException("Duplicate signal graph_id %s".formatted(s.graphId()));
            }
            var src = byId.get(s.source().operation());
            var dst = byId.get(s.destination().operation());
            if (src == null || s.source().index() >= src.outputCount()) {
                throw new ConfigurationException(
                        "Signal %s starts at unknown port %s".formatted(s.graphId(), s.source()));
            }
            if (dst == null || s.destination().index() >= dst.inputCount()) {
                throw new ConfigurationException(
                        "Signal %s ends at unknown port %s".formatted(s.graphId(), s.destination()));
            }
            if (!driven.add(s.destination())) {
                throw new ConfigurationException("Input port %s is driven twice".formatted(s.destination()));
            }
        }
    }

    public Optional<Operation> operation(String graphId) {
        return operations.stream().filter(op -> op.graphId().equals(graphId)).findAny();
    }

    public Optional<Signal> inputSignal(String operation, int port) {
        var ref = new PortRef(operation, port);
        return signals.stream().filter(s -> s.destination().equals(ref)).findAny();
    }

    public List<Signal> outputSignals(String operation, int port) {
        var ref = new PortRef(operation, port);
        return signals.stream().filter(s -> s.source().equals(ref)).collect(Collectors.toList());
    }

    public List<Signal> signalsFrom(String operation) {
        return signals.stream().filter(s -> s.source().operation().equals(operation))
                .collect(Collectors.toList());
    }

    public List<Signal> signalsInto(String operation) {
        return signals.stream().filter(s -> s.destination().operation().equals(operation))
                .collect(Collectors.toList());
    }

    public List<Operation> operationsOfType(String typeName) {
        return operations.stream().filter(op -> op.typeName().equals(typeName)).collect(Collectors.toList());
    }

    public DataflowGraph scaled(int factor) {
        return new DataflowGraph(operations.stream().map(op -> op.scaled(factor)).collect(Collectors.toList()),
                signals);
    }

    public DataflowGraph divided(int factor) {
        return new DataflowGraph(operations.stream().map(op -> op.divided(factor)).collect(Collectors.toList()),
                signals);
    }

    public static Optional<DataflowGraph> fromJsonString(String str) {
        return SynthesisArtifact.fromJsonString(str, DataflowGraph.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<Operation> operations = new ArrayList<>();
        private final List<Signal> signals = new ArrayList<>();

        private Builder() {
        }

        public Builder operation(Operation operation) {
            operations.add(operation);
            return this;
        }

        public Builder connect(String source, int sourcePort, String destination, int destinationPort) {
            signals.add(new Signal("s" + (signals.size() + 1), new PortRef(source, sourcePort),
                    new PortRef(destination, destinationPort)));
            return this;
        }

        /**
         * Connects output 0 to input 0.
         */
        public Builder connect(String source, String destination) {
            return connect(source, 0, destination, 0);
        }

        public DataflowGraph build() {
            return new DataflowGraph(operations, signals);
        }
    }
}
