package com.goerdes.textguard.index;

import com.goerdes.textguard.exception.IndexLoadException;
import com.goerdes.textguard.model.SeedTable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.zip.CRC32;

import static com.goerdes.textguard.components.MinHashProvider.isEmptySketch;

/**
 * LSH index using the banding technique.
 * <p>
 * A sketch of length {@code n} is cut into {@code bands} contiguous bands of {@code rows}
 * values; each band is hashed into a bucket key. Two documents are candidates when they share
 * at least one bucket. Bucket keys are bit-packed longs: bits 63-56 hold the band index, bits
 * 55-0 a 56-bit hash of the band's values.
 * <p>
 * Queries and snapshots take the read lock and may run concurrently; insert, remove and clear
 * take the write lock. The lock is fair, so a waiting writer is not starved by a stream of readers.
 */
public class BandedIndex {

    static final int MAGIC = 0x54474958; // "TGIX"
    static final int FORMAT_VERSION = 1;

    private final SeedTable seedTable;
    private final int bands;
    private final int rows;

    private final Map<Long, Set<Long>> buckets = new HashMap<>();
    private final Map<Long, int[]> sketches = new HashMap<>();
    private final Map<Long, long[]> keysByDoc = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    /**
     * @param seedTable the seed table every stored sketch was built with
     * @param bands     number of bands, at most 256
     * @param rows      rows (hash values) per band
     * @throws IllegalArgumentException if {@code bands * rows} exceeds the sketch length
     */
    public BandedIndex(SeedTable seedTable, int bands, int rows) {
        if (bands <= 0 || rows <= 0 || bands > 256) {
            throw new IllegalArgumentException("Invalid band configuration: bands=" + bands + ", rows=" + rows);
        }
        if (bands * rows > seedTable.permutations()) {
            throw new IllegalArgumentException(String.format(
                    "bands * rows (%d * %d = %d) must not exceed the sketch length (%d)",
                    bands, rows, bands * rows, seedTable.permutations()));
        }
        this.seedTable = seedTable;
        this.bands = bands;
        this.rows = rows;
    }

    public SeedTable seedTable() {
        return seedTable;
    }

    public int bands() {
        return bands;
    }

    public int rows() {
        return rows;
    }

    /**
     * Adds the document to every band bucket of its sketch. A previous entry under the same
     * id is removed first. Sketches built from empty shingle sets are stored but occupy no bucket.
     */
    public void insert(long docId, int[] sketch) {
        checkLength(sketch);
        lock.writeLock().lock();
        try {
            removeUnlocked(docId);
            int[] copy = sketch.clone();
            sketches.put(docId, copy);
            if (isEmptySketch(copy)) {
                keysByDoc.put(docId, new long[0]);
                return;
            }
            long[] keys = bucketKeys(copy);
            for (long key : keys) {
                buckets.computeIfAbsent(key, k -> new HashSet<>()).add(docId);
            }
            keysByDoc.put(docId, keys);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns every document sharing at least one band bucket with the sketch.
     *
     * @param sketch    the query sketch
     * @param excludeId the query's own id, or {@code null}
     * @return the candidate ids, possibly containing false positives
     */
    public Set<Long> query(int[] sketch, Long excludeId) {
        checkLength(sketch);
        Set<Long> candidates = new HashSet<>();
        if (isEmptySketch(sketch)) {
            return candidates;
        }
        long[] keys = bucketKeys(sketch);
        lock.readLock().lock();
        try {
            for (long key : keys) {
                Set<Long> bucket = buckets.get(key);
                if (bucket != null) {
                    candidates.addAll(bucket);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        if (excludeId != null) {
            candidates.remove(excludeId);
        }
        return candidates;
    }

    public Set<Long> query(int[] sketch) {
        return query(sketch, null);
    }

    /**
     * Removes the document from all buckets it occupies.
     *
     * @return {@code true} if the document was indexed
     */
    public boolean remove(long docId) {
        lock.writeLock().lock();
        try {
            return removeUnlocked(docId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean removeUnlocked(long docId) {
        long[] keys = keysByDoc.remove(docId);
        sketches.remove(docId);
        if (keys == null) {
            return false;
        }
        for (long key : keys) {
            Set<Long> bucket = buckets.get(key);
            if (bucket != null) {
                bucket.remove(docId);
                if (bucket.isEmpty()) {
                    buckets.remove(key);
                }
            }
        }
        return true;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            buckets.clear();
            sketches.clear();
            keysByDoc.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(long docId) {
        lock.readLock().lock();
        try {
            return sketches.containsKey(docId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sketches.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of entries for the document across all buckets.
     */
    public int bucketEntries(long docId) {
        lock.readLock().lock();
        try {
            int count = 0;
            for (Set<Long> bucket : buckets.values()) {
                if (bucket.contains(docId)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int[] sketchOf(long docId) {
        lock.readLock().lock();
        try {
            int[] sketch = sketches.get(docId);
            return sketch == null ? null : sketch.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<Long> documentIds() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new HashSet<>(sketches.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------- BANDING ----------------------------

    long[] bucketKeys(int[] sketch) {
        long[] keys = new long[bands];
        for (int b = 0; b < bands; b++) {
            keys[b] = generateBucketKey(b, sketch);
        }
        return keys;
    }

    private long generateBucketKey(int bandIndex, int[] sketch) {
        long bandPart = ((long) bandIndex) << 56;
        long hashPart = computeSegmentHash(sketch, bandIndex * rows, rows);
        return bandPart | hashPart;
    }

    private static long computeSegmentHash(int[] sketch, int start, int length) {
        long hash = 0x9e3779b97f4a7c15L;
        for (int i = 0; i < length; i++) {
            hash ^= sketch[start + i];
            hash *= 0xff51afd7ed558ccdL;
            hash ^= (hash >>> 33);
        }
        return hash & 0x00FFFFFFFFFFFFFFL;
    }

    private void checkLength(int[] sketch) {
        if (sketch.length != seedTable.permutations()) {
            throw new IllegalArgumentException("Sketch length " + sketch.length
                    + " does not match the seed table (" + seedTable.permutations() + ")");
        }
    }

    // ---------------------------- SERIALIZATION ----------------------------

    /**
     * Writes the seed table, band layout and every stored sketch, followed by a CRC32 of all
     * preceding bytes. Bucket tables are rebuilt from the sketches on load.
     */
    public void writeTo(OutputStream out) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        lock.readLock().lock();
        try (DataOutputStream data = new DataOutputStream(bytes)) {
            data.writeInt(MAGIC);
            data.writeInt(FORMAT_VERSION);
            data.writeLong(seedTable.seed());
            data.writeInt(seedTable.permutations());
            data.writeInt(seedTable.dictSize());
            data.writeInt(bands);
            data.writeInt(rows);
            data.writeInt(sketches.size());
            for (Map.Entry<Long, int[]> e : sketches.entrySet()) {
                data.writeLong(e.getKey());
                for (int v : e.getValue()) {
                    data.writeInt(v);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        byte[] body = bytes.toByteArray();
        CRC32 crc = new CRC32();
        crc.update(body);
        out.write(body);
        out.write(ByteBuffer.allocate(Long.BYTES).putLong(crc.getValue()).array());
        out.flush();
    }

    /**
     * Reads a snapshot written by {@link #writeTo(OutputStream)}.
     *
     * @param in       the snapshot stream
     * @param expected the seed table of the running process
     * @param bands    the configured band count
     * @param rows     the configured rows per band
     * @return the restored index
     * @throws IndexLoadException if the snapshot is corrupt, truncated, of another format
     *                            version, or was built with a different seed table
     */
    public static BandedIndex readFrom(InputStream in, SeedTable expected, int bands, int rows) throws IOException {
        byte[] all = in.readAllBytes();
        if (all.length < Long.BYTES + 2 * Integer.BYTES) {
            throw new IndexLoadException("Index snapshot truncated (" + all.length + " bytes)");
        }
        byte[] body = Arrays.copyOf(all, all.length - Long.BYTES);
        long storedCrc = ByteBuffer.wrap(all, all.length - Long.BYTES, Long.BYTES).getLong();
        CRC32 crc = new CRC32();
        crc.update(body);
        if (crc.getValue() != storedCrc) {
            throw new IndexLoadException("Index snapshot checksum mismatch");
        }

        try (DataInputStream data = new DataInputStream(new ByteArrayInputStream(body))) {
            if (data.readInt() != MAGIC) {
                throw new IndexLoadException("Not an index snapshot (bad magic)");
            }
            int version = data.readInt();
            if (version != FORMAT_VERSION) {
                throw new IndexLoadException("Unsupported index snapshot version " + version
                        + " (expected " + FORMAT_VERSION + ")");
            }
            SeedTable stored = new SeedTable(data.readLong(), data.readInt(), data.readInt());
            if (!stored.equals(expected)) {
                throw new IndexLoadException("Index snapshot was built with " + stored
                        + " but the running configuration uses " + expected);
            }
            data.readInt(); // stored band count, rebuilt from configuration
            data.readInt(); // stored rows per band

            BandedIndex index = new BandedIndex(expected, bands, rows);
            int count = data.readInt();
            if (count < 0) {
                throw new IndexLoadException("Negative entry count in index snapshot");
            }
            for (int i = 0; i < count; i++) {
                long docId = data.readLong();
                int[] sketch = new int[expected.permutations()];
                for (int j = 0; j < sketch.length; j++) {
                    sketch[j] = data.readInt();
                }
                index.insert(docId, sketch);
            }
            if (data.available() > 0) {
                throw new IndexLoadException("Trailing bytes after index snapshot entries");
            }
            return index;
        } catch (EOFException e) {
            throw new IndexLoadException("Index snapshot truncated", e);
        }
    }
}
