package com.goerdes.textguard.index;

import com.goerdes.textguard.components.MinHashProvider;
import com.goerdes.textguard.exception.IndexLoadException;
import com.goerdes.textguard.model.SeedTable;
import com.goerdes.textguard.utils.ShingleUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexSnapshotStoreTest {

    @TempDir
    Path dir;

    private final MinHashProvider minHash = new MinHashProvider();

    @Test
    void testMissingSnapshotGivesEmptyIndex() {
        IndexSnapshotStore store = new IndexSnapshotStore(dir.resolve("none/index.bin"));

        BandedIndex index = store.load(minHash.seedTable(), 32, 4);

        assertFalse(store.exists());
        assertEquals(0, index.size());
    }

    @Test
    void testSaveThenLoad() throws Exception {
        IndexSnapshotStore store = new IndexSnapshotStore(dir.resolve("nested/index.bin"));
        BandedIndex index = new BandedIndex(minHash.seedTable(), 32, 4);
        int[] sketch = minHash.sketch(ShingleUtils.shingles("one two three four five six seven eight", 5));
        index.insert(42L, sketch);

        store.save(index);
        BandedIndex loaded = store.load(minHash.seedTable(), 32, 4);

        assertTrue(store.exists());
        assertFalse(Files.exists(dir.resolve("nested/index.bin.tmp")));
        assertArrayEquals(sketch, loaded.sketchOf(42L));
        assertTrue(loaded.query(sketch).contains(42L));
    }

    @Test
    void testSaveOverwritesPreviousSnapshot() throws Exception {
        IndexSnapshotStore store = new IndexSnapshotStore(dir.resolve("index.bin"));
        BandedIndex index = new BandedIndex(minHash.seedTable(), 32, 4);
        index.insert(1L, minHash.sketch(ShingleUtils.shingles("alpha beta gamma delta epsilon", 5)));
        store.save(index);

        index.remove(1L);
        store.save(index);

        assertEquals(0, store.load(minHash.seedTable(), 32, 4).size());
    }

    @Test
    void testCorruptSnapshotAbortsLoad() throws Exception {
        Path path = dir.resolve("index.bin");
        Files.write(path, "definitely not an index snapshot".getBytes());
        IndexSnapshotStore store = new IndexSnapshotStore(path);

        assertThrows(IndexLoadException.class, () -> store.load(minHash.seedTable(), 32, 4));
    }

    @Test
    void testSnapshotFromOtherSeedAbortsLoad() throws Exception {
        IndexSnapshotStore store = new IndexSnapshotStore(dir.resolve("index.bin"));
        store.save(new BandedIndex(minHash.seedTable(), 32, 4));
        SeedTable other = new SeedTable(1L, 128, MinHashProvider.MINHASH_DICT_SIZE);

        assertThrows(IndexLoadException.class, () -> store.load(other, 32, 4));
    }
}
