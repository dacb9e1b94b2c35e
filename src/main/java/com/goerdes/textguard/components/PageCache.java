package com.goerdes.textguard.components;

import com.goerdes.textguard.utils.ByteUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * On-disk cache of extracted page text, one file per URL named by the SHA-256 of the URL.
 * <p>
 * The file's modification time is the write time; an entry is fresh while
 * {@code now < writtenAt + ttl}. Stale entries are kept until the next write replaces them.
 */
@Component
public class PageCache {

    private static final Logger log = LoggerFactory.getLogger(PageCache.class);

    private static final String SUFFIX = ".txt";

    private final Path dir;
    private final Duration ttl;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    @Autowired
    public PageCache(@Value("${textguard.cache.dir:data/page-cache}") String dir,
                     @Value("${textguard.cache.ttl:24h}") Duration ttl,
                     Clock clock) {
        this(Path.of(dir), ttl, clock);
    }

    public PageCache(Path dir, Duration ttl, Clock clock) {
        this.dir = dir;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached text when the entry exists and is younger than the TTL.
     */
    public Optional<String> getFresh(String url) {
        Path file = fileFor(url);
        lock.readLock().lock();
        try {
            Instant writtenAt = Files.getLastModifiedTime(file).toInstant();
            if (!clock.instant().isBefore(writtenAt.plus(ttl))) {
                log.debug("Cache entry for {} is stale (written {})", url, writtenAt);
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable cache entry for {}: {}", url, e.getMessage());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String url) {
        lock.readLock().lock();
        try {
            return Files.exists(fileFor(url));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Writes the entry and stamps it with the current clock time.
     *
     * @throws UncheckedIOException if the entry cannot be written
     */
    public void put(String url, String text) {
        Path file = fileFor(url);
        lock.writeLock().lock();
        try {
            Files.createDirectories(dir);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, text, UTF_8);
            Files.setLastModifiedTime(tmp, FileTime.from(clock.instant()));
            Files.move(tmp, file, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to cache " + url, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Deletes every cache entry.
     */
    public void clear() {
        lock.writeLock().lock();
        try (Stream<Path> files = Files.exists(dir) ? Files.list(dir) : Stream.empty()) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear page cache " + dir, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Path fileFor(String url) {
        return dir.resolve(ByteUtils.computeSha256(url) + SUFFIX);
    }
}
