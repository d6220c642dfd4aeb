package io.github.manjago.pseudomem.persistence;

import io.github.manjago.pseudomem.core.Allocation;
import io.github.manjago.pseudomem.core.MemoryStats;
import io.github.manjago.pseudomem.trace.TraceEntry;
import io.github.manjago.pseudomem.trace.TraceOperation;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run archive storage using H2 MVStore.
 *
 * Structure:
 * - "meta" map: version, counters, seed, memory statistics
 * - "text" map: program source and failure message
 * - "output" map: output lines by index
 * - "trace" map: serialized trace entries by step
 * - "allocations" map: live blocks by start address
 */
public class TraceStore {

    private static final Logger log = LoggerFactory.getLogger(TraceStore.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_ITERATIONS = "iterations";
    private static final String KEY_SEED = "seed";
    private static final String KEY_MEM_TOTAL = "mem_total";
    private static final String KEY_MEM_RESERVED = "mem_reserved";
    private static final String KEY_MEM_ALLOCATED = "mem_allocated";
    private static final String KEY_MEM_FREE = "mem_free";
    private static final String KEY_MEM_BLOCKS = "mem_blocks";
    private static final String KEY_MEM_WATERMARK = "mem_watermark";

    // Text keys
    private static final String KEY_SOURCE = "source";
    private static final String KEY_FAILURE = "failure";

    /**
     * Save an archive, replacing any previous content of the file.
     */
    public static void save(TraceArchive archive, Path path) throws IOException {
        log.info("Saving run archive to {} (MVStore)", path);

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {

            MVMap<String, Long> meta = store.openMap("meta");
            MemoryStats memory = archive.memory();
            meta.put(KEY_VERSION, (long) VERSION);
            meta.put(KEY_ITERATIONS, archive.iterations());
            meta.put(KEY_SEED, archive.seed());
            meta.put(KEY_MEM_TOTAL, (long) memory.total());
            meta.put(KEY_MEM_RESERVED, (long) memory.reserved());
            meta.put(KEY_MEM_ALLOCATED, (long) memory.allocated());
            meta.put(KEY_MEM_FREE, (long) memory.free());
            meta.put(KEY_MEM_BLOCKS, (long) memory.blocks());
            meta.put(KEY_MEM_WATERMARK, (long) memory.nextFreeAddress());

            MVMap<String, String> text = store.openMap("text");
            text.clear();
            text.put(KEY_SOURCE, archive.source());
            if (archive.failure() != null) {
                text.put(KEY_FAILURE, archive.failure());
            }

            MVMap<Integer, String> output = store.openMap("output");
            output.clear();
            for (int i = 0; i < archive.output().size(); i++) {
                output.put(i, archive.output().get(i));
            }

            MVMap<Long, byte[]> trace = store.openMap("trace");
            trace.clear();
            for (TraceEntry entry : archive.entries()) {
                trace.put(entry.step(), serializeEntry(entry));
            }

            MVMap<Integer, byte[]> allocations = store.openMap("allocations");
            allocations.clear();
            for (Allocation allocation : archive.allocations()) {
                allocations.put(allocation.address(), serializeAllocation(allocation));
            }

            store.commit();
        }

        log.info("Run archive saved: {} output lines, {} trace entries",
            archive.output().size(), archive.entries().size());
    }

    /**
     * Load an archive written by {@link #save}.
     */
    public static TraceArchive load(Path path) throws IOException {
        log.info("Loading run archive from {} (MVStore)", path);

        try (MVStore store = MVStore.open(path.toString())) {

            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported archive version: " + version);
            }

            MemoryStats memory = new MemoryStats(
                meta.getOrDefault(KEY_MEM_TOTAL, 0L).intValue(),
                meta.getOrDefault(KEY_MEM_RESERVED, 0L).intValue(),
                meta.getOrDefault(KEY_MEM_ALLOCATED, 0L).intValue(),
                meta.getOrDefault(KEY_MEM_FREE, 0L).intValue(),
                meta.getOrDefault(KEY_MEM_BLOCKS, 0L).intValue(),
                meta.getOrDefault(KEY_MEM_WATERMARK, 0L).intValue()
            );

            MVMap<String, String> text = store.openMap("text");

            MVMap<Integer, String> outputMap = store.openMap("output");
            List<String> output = new ArrayList<>(outputMap.values());

            MVMap<Long, byte[]> traceMap = store.openMap("trace");
            List<TraceEntry> entries = new ArrayList<>(traceMap.size());
            for (byte[] data : traceMap.values()) {
                entries.add(deserializeEntry(data));
            }

            MVMap<Integer, byte[]> allocationMap = store.openMap("allocations");
            List<Allocation> allocations = new ArrayList<>(allocationMap.size());
            for (byte[] data : allocationMap.values()) {
                allocations.add(deserializeAllocation(data));
            }

            log.info("Run archive loaded: {} output lines, {} trace entries (v{})",
                output.size(), entries.size(), version);

            return new TraceArchive(
                text.getOrDefault(KEY_SOURCE, ""),
                output,
                entries,
                allocations,
                memory,
                meta.getOrDefault(KEY_ITERATIONS, 0L),
                meta.getOrDefault(KEY_SEED, 0L),
                text.get(KEY_FAILURE)
            );
        }
    }

    /**
     * Check if file is a valid run archive.
     */
    public static boolean isValidArchive(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            return version >= 1 && version <= VERSION;
        } catch (RuntimeException e) {
            log.debug("Not a run archive: {}", path, e);
            return false;
        }
    }

    /**
     * Get archive info without full load.
     */
    public static String getInfo(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            long iterations = meta.getOrDefault(KEY_ITERATIONS, 0L);
            long seed = meta.getOrDefault(KEY_SEED, 0L);

            int outputLines = store.<Integer, String>openMap("output").size();
            int traceEntries = store.<Long, byte[]>openMap("trace").size();
            boolean failed = store.<String, String>openMap("text").containsKey(KEY_FAILURE);

            return String.format(
                "Run archive v%d: %,d output lines, %,d trace entries, %,d iterations, seed=%d%s",
                version, outputLines, traceEntries, iterations, seed,
                failed ? " (failed)" : " (completed)"
            );
        } catch (RuntimeException e) {
            return "Invalid run archive: " + e.getMessage();
        }
    }

    // ========== Private helpers ==========

    private static byte[] serializeEntry(TraceEntry entry) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            out.writeLong(entry.step());
            out.writeUTF(entry.operation().name());
            out.writeInt(entry.line());
            out.writeLong(entry.timestamp());
            writeOptionalInt(out, entry.address());
            writeOptionalInt(out, entry.pointerAddress());
            writeOptionalString(out, entry.value());
            writeOptionalString(out, entry.variable());

            out.writeInt(entry.metadata().size());
            for (Map.Entry<String, String> e : entry.metadata().entrySet()) {
                out.writeUTF(e.getKey());
                out.writeUTF(e.getValue());
            }

            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static TraceEntry deserializeEntry(byte[] data) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(data);
             DataInputStream in = new DataInputStream(bais)) {

            long step = in.readLong();
            TraceOperation operation = TraceOperation.valueOf(in.readUTF());
            int line = in.readInt();
            long timestamp = in.readLong();
            Integer address = readOptionalInt(in);
            Integer pointerAddress = readOptionalInt(in);
            String value = readOptionalString(in);
            String variable = readOptionalString(in);

            int metadataSize = in.readInt();
            Map<String, String> metadata = new LinkedHashMap<>();
            for (int i = 0; i < metadataSize; i++) {
                metadata.put(in.readUTF(), in.readUTF());
            }

            return new TraceEntry(step, operation, line, timestamp, address, pointerAddress,
                value, variable, metadata);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] serializeAllocation(Allocation allocation) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {
            out.writeInt(allocation.address());
            out.writeInt(allocation.size());
            out.writeUTF(allocation.type());
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Allocation deserializeAllocation(byte[] data) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return new Allocation(in.readInt(), in.readInt(), in.readUTF());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeOptionalInt(DataOutputStream out, Integer value) throws IOException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeInt(value);
        }
    }

    private static Integer readOptionalInt(DataInputStream in) throws IOException {
        return in.readBoolean() ? in.readInt() : null;
    }

    private static void writeOptionalString(DataOutputStream out, String value) throws IOException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeUTF(value);
        }
    }

    private static String readOptionalString(DataInputStream in) throws IOException {
        return in.readBoolean() ? in.readUTF() : null;
    }
}
