package hlsyde.scheduling;

import hlsyde.core.PortRef;

/**
 * A data dependency between two non-delay operations. Delays on the way are
 * folded into the dependency: {@code delays} counts them, and the id is the id
 * of the signal that enters the consumer.
 */
public record Dependency(String signalId, PortRef source, PortRef destination, int delays) {
}
