package hlsyde.common;

import hlsyde.core.ConfigurationException;

/**
 * Number of read, write and total ports of a memory. A negative value in
 * {@link #sanitize(int, int, int)} means "not given".
 */
public record PortBudget(int read, int write, int total) {

    /**
     * One read port and one write port, usable in the same cycle.
     */
    public static final PortBudget SIMPLE_DUAL_PORT = new PortBudget(1, 1, 2);

    public static PortBudget sanitize(int read, int write, int total) {
        if (total < 0) {
            if (read < 0 || write < 0) {
                throw new ConfigurationException(
                        "If total_ports is unset, both read_ports and write_ports must be provided.");
            }
            total = read + write;
        } else {
            read = read < 0 ? total : read;
            write = write < 0 ? total : write;
        }
        if (total < read) {
            throw new ConfigurationException("Total ports (%d) less then read ports (%d)".formatted(total, read));
        }
        if (total < write) {
            throw new ConfigurationException("Total ports (%d) less then write ports (%d)".formatted(total, write));
        }
        return new PortBudget(read, write, total);
    }

    boolean exceededBy(int reads, int writes) {
        return reads > read || writes > write || reads + writes > total;
    }
}
