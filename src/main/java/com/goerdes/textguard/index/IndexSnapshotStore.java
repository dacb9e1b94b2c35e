package com.goerdes.textguard.index;

import com.goerdes.textguard.exception.IndexLoadException;
import com.goerdes.textguard.model.SeedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Loads and saves the {@link BandedIndex} snapshot file.
 * <p>
 * A missing file yields an empty index (first run). A file that exists but cannot be read
 * raises {@link IndexLoadException}. Saves go to a sibling temp file that is then moved over
 * the snapshot, so a crash mid-write never leaves a half-written snapshot behind.
 */
@Component
public class IndexSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotStore.class);

    private final Path path;

    @Autowired
    public IndexSnapshotStore(@Value("${textguard.index.path:data/lsh-index.bin}") String path) {
        this(Path.of(path));
    }

    public IndexSnapshotStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Restores the index from disk, or creates an empty one when no snapshot exists.
     *
     * @throws IndexLoadException if the snapshot is unreadable or incompatible
     */
    public BandedIndex load(SeedTable seedTable, int bands, int rows) {
        if (!Files.exists(path)) {
            log.info("No index snapshot at {}, starting with an empty index", path);
            return new BandedIndex(seedTable, bands, rows);
        }
        try (InputStream in = Files.newInputStream(path)) {
            BandedIndex index = BandedIndex.readFrom(in, seedTable, bands, rows);
            log.info("Loaded index snapshot {} with {} documents", path, index.size());
            return index;
        } catch (IOException e) {
            throw new IndexLoadException("Failed to read index snapshot " + path, e);
        }
    }

    /**
     * Writes the index atomically.
     *
     * @throws IOException if the snapshot cannot be written
     */
    public synchronized void save(BandedIndex index) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            index.writeTo(out);
        }
        try {
            Files.move(tmp, path, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace: {}", path, e.getMessage());
            Files.move(tmp, path, REPLACE_EXISTING);
        }
        log.debug("Index snapshot written to {} ({} documents)", path, index.size());
    }
}
