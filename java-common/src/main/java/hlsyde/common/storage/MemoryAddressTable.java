package hlsyde.common.storage;

import hlsyde.common.MemoryProcess;
import hlsyde.common.ProcessCollection;
import hlsyde.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Address generation for a memory whose variables have been assigned to
 * cells. For each cycle of the schedule it lists the cells written and the
 * cells read, split over {@code muxSize^pipelineDepth} address ROMs that are
 * selected by the upper bits of the schedule counter.
 */
public class MemoryAddressTable {

    /**
     * A cell accessed by a variable.
     */
    public record Access(int cell, String variable) {
    }

    /**
     * Accesses of one ROM, keyed by the ROM address, i.e. the cycle modulo
     * the number of elements per ROM.
     */
    public record RomContents(int rom, Map<Integer, List<Access>> writes, Map<Integer, List<Access>> reads) {
    }

    /**
     * One pipeline layer of multiplexers, selected by the counter bits
     * {@code lowBit} to {@code highBit}, both included.
     */
    public record MuxLayer(int layer, int muxCount, int lowBit, int highBit) {
    }

    /**
     * A zero-length variable forwarded from the input to the output in the
     * given cycle.
     */
    public record Bypass(String variable, int cycle) {
    }

    private final int scheduleTime;
    private final int cellCount;
    private final int muxSize;
    private final int pipelineDepth;
    private final boolean inputSync;
    private final int totalRoms;
    private final int elementsPerRom;
    private final int counterLength;
    private final int addressLength;
    private final List<List<Access>> writeList;
    private final List<List<Access>> readList;
    private final List<Bypass> bypasses = new ArrayList<>();

    public MemoryAddressTable(List<ProcessCollection> assignment, ProcessCollection memory, int muxSize,
            int pipelineDepth, boolean inputSync) {
        if (!inputSync && (muxSize > 1 || pipelineDepth > 0)) {
            throw new ConfigurationException("input_sync needs to be set to use address pipelining");
        }
        if (muxSize < 1 || Integer.bitCount(muxSize) != 1) {
            throw new ConfigurationException("adr_mux_size must be a power of two, got %d".formatted(muxSize));
        }
        if (pipelineDepth < 0) {
            throw new ConfigurationException("adr_pipe_depth must be non-negative, got %d".formatted(pipelineDepth));
        }
        this.scheduleTime = memory.scheduleTime();
        this.cellCount = assignment.size();
        this.muxSize = muxSize;
        this.pipelineDepth = pipelineDepth;
        this.inputSync = inputSync;
        this.totalRoms = (int) Math.round(Math.pow(muxSize, pipelineDepth));
        if (totalRoms > scheduleTime) {
            throw new ConfigurationException("Too many address ROMs (%d) for schedule time %d"
                    .formatted(totalRoms, scheduleTime));
        }
        this.elementsPerRom = 1 << ceilLog2(ceilDiv(scheduleTime, totalRoms));
        this.counterLength = ceilLog2(scheduleTime);
        this.addressLength = counterLength - log2(muxSize) * pipelineDepth;

        var known = new HashSet<>(memory.names());
        this.writeList = new ArrayList<>();
        this.readList = new ArrayList<>();
        for (int t = 0; t < scheduleTime; t++) {
            writeList.add(new ArrayList<>());
            readList.add(new ArrayList<>());
        }
        for (int cell = 0; cell < assignment.size(); cell++) {
            for (var variable : assignment.get(cell).memoryProcesses()) {
                if (!known.contains(variable.name())) {
                    throw new ConfigurationException(
                            "%s in the assignment is not part of the memory".formatted(variable.name()));
                }
                place(cell, variable);
            }
        }
    }

    private void place(int cell, MemoryProcess variable) {
        if (variable.isZeroLength()) {
            bypasses.add(new Bypass(variable.name(), (variable.startTime() + (inputSync ? 1 : 0)) % scheduleTime));
            return;
        }
        writeList.get(variable.startTime()).add(new Access(cell, variable.name()));
        for (int life : variable.lifeTimes()) {
            int cycle = Math.floorMod(variable.startTime() + life - (inputSync ? 0 : 1), scheduleTime);
            readList.get(cycle).add(new Access(cell, variable.name()));
        }
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }

    static int ceilLog2(int value) {
        return value <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(value - 1);
    }

    private static int log2(int powerOfTwo) {
        return Integer.numberOfTrailingZeros(powerOfTwo);
    }

    public int scheduleTime() {
        return scheduleTime;
    }

    public int cellCount() {
        return cellCount;
    }

    public int totalRoms() {
        return totalRoms;
    }

    public int elementsPerRom() {
        return elementsPerRom;
    }

    public int counterLength() {
        return counterLength;
    }

    public int addressLength() {
        return addressLength;
    }

    public boolean inputSync() {
        return inputSync;
    }

    /**
     * @return per cycle, the cells written, one per write port in use.
     */
    public List<List<Access>> writeList() {
        return writeList.stream().map(Collections::unmodifiableList).toList();
    }

    public List<List<Access>> readList() {
        return readList.stream().map(Collections::unmodifiableList).toList();
    }

    public List<Bypass> bypasses() {
        return Collections.unmodifiableList(bypasses);
    }

    public List<RomContents> romContents() {
        var roms = new ArrayList<RomContents>();
        for (int rom = 0; rom < totalRoms; rom++) {
            var writes = new LinkedHashMap<Integer, List<Access>>();
            var reads = new LinkedHashMap<Integer, List<Access>>();
            int first = rom * elementsPerRom;
            for (int t = first; t < Math.min(first + elementsPerRom, scheduleTime); t++) {
                if (!writeList.get(t).isEmpty()) {
                    writes.put(t % elementsPerRom, List.copyOf(writeList.get(t)));
                }
                if (!readList.get(t).isEmpty()) {
                    reads.put(t % elementsPerRom, List.copyOf(readList.get(t)));
                }
            }
            roms.add(new RomContents(rom, writes, reads));
        }
        return roms;
    }

    public List<MuxLayer> muxLayers() {
        int bits = log2(muxSize);
        var layers = new ArrayList<MuxLayer>();
        for (int layer = 0; layer < pipelineDepth; layer++) {
            int muxCount = totalRoms / (int) Math.round(Math.pow(muxSize, layer + 1));
            int low = addressLength + layer * bits;
            layers.add(new MuxLayer(layer, muxCount, low, low + bits - 1));
        }
        return layers;
    }
}
