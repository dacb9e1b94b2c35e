package com.goerdes.textguard.index;

import com.goerdes.textguard.components.MinHashProvider;
import com.goerdes.textguard.exception.IndexLoadException;
import com.goerdes.textguard.model.SeedTable;
import com.goerdes.textguard.utils.ShingleUtils;
import com.goerdes.textguard.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandedIndexTest {

    private final MinHashProvider minHash = new MinHashProvider();

    private int[] sketch(String text) {
        return minHash.sketch(ShingleUtils.shingles(text, 5));
    }

    private BandedIndex newIndex() {
        return new BandedIndex(minHash.seedTable(), 32, 4);
    }

    @Test
    void testIdenticalDocumentIsFound() {
        BandedIndex index = newIndex();
        String text = TestUtils.randomWords(200, 1);
        index.insert(1L, sketch(text));
        index.insert(2L, sketch(TestUtils.randomWords(200, 2)));

        Set<Long> candidates = index.query(sketch(text));

        assertTrue(candidates.contains(1L));
        assertFalse(candidates.contains(2L));
    }

    @Test
    void testNearDuplicateIsFound() {
        BandedIndex index = newIndex();
        String original = TestUtils.randomWords(300, 3);
        // replace the last ten words, roughly 0.9 Jaccard on 5-shingles
        String edited = original.substring(0, original.lastIndexOf(' ', original.length() - 60)) + " "
                + TestUtils.randomWords(10, 4);
        index.insert(7L, sketch(original));

        assertTrue(index.query(sketch(edited)).contains(7L));
    }

    @Test
    void testQueryExcludesOwnId() {
        BandedIndex index = newIndex();
        int[] s = sketch(TestUtils.randomWords(50, 5));
        index.insert(1L, s);
        index.insert(2L, s);

        assertEquals(Set.of(2L), index.query(s, 1L));
    }

    @Test
    void testInsertIsIdempotent() {
        BandedIndex index = newIndex();
        int[] s = sketch(TestUtils.randomWords(80, 6));

        index.insert(9L, s);
        index.insert(9L, s);

        assertEquals(1, index.size());
        assertEquals(32, index.bucketEntries(9L));
    }

    @Test
    void testReinsertReplacesOldBuckets() {
        BandedIndex index = newIndex();
        int[] before = sketch(TestUtils.randomWords(80, 7));
        int[] after = sketch(TestUtils.randomWords(80, 8));

        index.insert(3L, before);
        index.insert(3L, after);

        assertFalse(index.query(before).contains(3L));
        assertTrue(index.query(after).contains(3L));
        assertEquals(32, index.bucketEntries(3L));
    }

    @Test
    void testRemove() {
        BandedIndex index = newIndex();
        int[] s = sketch(TestUtils.randomWords(80, 9));
        index.insert(4L, s);

        assertTrue(index.remove(4L));
        assertFalse(index.remove(4L));
        assertTrue(index.query(s).isEmpty());
        assertEquals(0, index.bucketEntries(4L));
        assertNull(index.sketchOf(4L));
    }

    @Test
    void testEmptySketchOccupiesNoBucket() {
        BandedIndex index = newIndex();
        int[] empty = minHash.sketch(Set.of());

        index.insert(5L, empty);

        assertTrue(index.contains(5L));
        assertEquals(0, index.bucketEntries(5L));
        assertTrue(index.query(empty).isEmpty());
    }

    @Test
    void testBucketKeysCarryBandIndex() {
        BandedIndex index = newIndex();
        long[] keys = index.bucketKeys(sketch(TestUtils.randomWords(40, 10)));

        assertEquals(32, keys.length);
        for (int b = 0; b < keys.length; b++) {
            assertEquals(b, keys[b] >>> 56);
        }
    }

    @Test
    void testRejectsInvalidLayout() {
        SeedTable table = minHash.seedTable();
        assertThrows(IllegalArgumentException.class, () -> new BandedIndex(table, 64, 4));
        assertThrows(IllegalArgumentException.class, () -> new BandedIndex(table, 0, 4));
        assertThrows(IllegalArgumentException.class, () -> newIndex().insert(1L, new int[16]));
    }

    @Test
    void testSnapshotRoundTrip() throws Exception {
        BandedIndex index = newIndex();
        String text = TestUtils.randomWords(120, 11);
        index.insert(10L, sketch(text));
        index.insert(11L, sketch(TestUtils.randomWords(120, 12)));
        index.insert(12L, minHash.sketch(Set.of()));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        index.writeTo(out);
        BandedIndex restored = BandedIndex.readFrom(new ByteArrayInputStream(out.toByteArray()),
                minHash.seedTable(), 32, 4);

        assertEquals(index.documentIds(), restored.documentIds());
        assertArrayEquals(index.sketchOf(10L), restored.sketchOf(10L));
        assertEquals(index.query(sketch(text)), restored.query(sketch(text)));
        assertEquals(32, restored.bucketEntries(11L));
        assertEquals(0, restored.bucketEntries(12L));
    }

    @Test
    void testSnapshotUsesConfiguredLayoutOnLoad() throws Exception {
        BandedIndex index = newIndex();
        index.insert(1L, sketch(TestUtils.randomWords(60, 13)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        index.writeTo(out);

        BandedIndex restored = BandedIndex.readFrom(new ByteArrayInputStream(out.toByteArray()),
                minHash.seedTable(), 16, 8);

        assertEquals(16, restored.bands());
        assertEquals(16, restored.bucketEntries(1L));
    }

    @Test
    void testCorruptSnapshotIsRejected() throws Exception {
        BandedIndex index = newIndex();
        index.insert(1L, sketch(TestUtils.randomWords(60, 14)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        index.writeTo(out);
        byte[] bytes = out.toByteArray();
        bytes[40] ^= 0x5A;

        assertThrows(IndexLoadException.class, () -> BandedIndex.readFrom(
                new ByteArrayInputStream(bytes), minHash.seedTable(), 32, 4));
        assertThrows(IndexLoadException.class, () -> BandedIndex.readFrom(
                new ByteArrayInputStream(new byte[]{1, 2, 3}), minHash.seedTable(), 32, 4));
    }

    @Test
    void testSeedTableMismatchIsRejected() throws Exception {
        BandedIndex index = newIndex();
        index.insert(1L, sketch(TestUtils.randomWords(60, 15)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        index.writeTo(out);
        SeedTable other = new SeedTable(99L, 128, MinHashProvider.MINHASH_DICT_SIZE);

        assertThrows(IndexLoadException.class, () -> BandedIndex.readFrom(
                new ByteArrayInputStream(out.toByteArray()), other, 32, 4));
    }
}
