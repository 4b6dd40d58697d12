package com.taskdrive.engine.persistence.file;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.EntryNotFoundException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.exception.StorageUnavailableException;
import com.taskdrive.core.model.BackoffPolicy;
import com.taskdrive.core.storage.StorageAdapter;
import com.taskdrive.engine.persistence.StorageFaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage adapter over a directory tree on a (possibly network-synced) filesystem.
 *
 * Writes go to a hidden temp file next to the target ({@code .<name>.<random>.tmp})
 * and are renamed into place. Exclusive writes publish the temp file with a hard
 * link, which fails if the target exists, and fall back to a no-replace move on
 * filesystems without link support.
 */
public class FileStorageAdapter implements StorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(FileStorageAdapter.class);

    static final String TEMP_SUFFIX = ".tmp";

    private final Path root;
    private final BackoffPolicy retryPolicy;
    private final Clock clock;
    private volatile StorageFaults faults = StorageFaults.NONE;

    /**
     * @throws StorageUnavailableException if the root cannot be created or written
     */
    public FileStorageAdapter(Path root, BackoffPolicy retryPolicy, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageUnavailableException(this.root.toString(), e);
        }
        if (!Files.isDirectory(this.root) || !Files.isWritable(this.root)) {
            throw new StorageUnavailableException(this.root.toString(), null);
        }
    }

    public FileStorageAdapter(Path root) {
        this(root, BackoffPolicy.defaultPolicy(), Clock.systemUTC());
    }

    public Path getRoot() {
        return root;
    }

    public void setFaults(StorageFaults faults) {
        this.faults = faults != null ? faults : StorageFaults.NONE;
    }

    @Override
    public void writeAtomic(String path, byte[] content) {
        Path target = resolve(path);
        Path temp = writeTemp(target, content, path);
        try {
            moveReplacingWithRetry(temp, target, path);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public void writeExclusive(String path, byte[] content) {
        Path target = resolve(path);
        Path temp = writeTemp(target, content, path);
        try {
            faults.check(StorageFaults.RENAME, path);
            try {
                Files.createLink(target, temp);
            } catch (FileAlreadyExistsException e) {
                throw new EntryConflictException(path, e);
            } catch (UnsupportedOperationException | FileSystemException e) {
                // no hard links here; a plain move still refuses an existing target
                log.debug("Hard link unavailable for {}, falling back to move: {}", path, e.getMessage());
                Files.move(temp, target);
            }
        } catch (FileAlreadyExistsException e) {
            throw new EntryConflictException(path, e);
        } catch (IOException e) {
            throw new StorageException("Exclusive write failed: " + path, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public boolean replaceExisting(String path, byte[] content) {
        Path target = resolve(path);
        if (!Files.exists(target)) {
            return false;
        }
        Path temp = writeTemp(target, content, path);
        try {
            // re-check right before publishing; the window left is absorbed by recovery
            if (!Files.exists(target)) {
                return false;
            }
            moveReplacingWithRetry(temp, target, path);
            return true;
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public void renameAtomic(String from, String to) {
        Path source = resolve(from);
        Path target = resolve(to);
        try {
            faults.check(StorageFaults.RENAME, from);
            Files.createDirectories(target.getParent());
            // no ATOMIC_MOVE: it would silently replace an existing target
            Files.move(source, target);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(from, e);
        } catch (FileAlreadyExistsException e) {
            throw new EntryConflictException(to, e);
        } catch (IOException e) {
            throw new StorageException("Rename failed: " + from + " -> " + to, e);
        }
    }

    @Override
    public Optional<byte[]> read(String path) {
        try {
            faults.check(StorageFaults.READ, path);
            return Optional.of(Files.readAllBytes(resolve(path)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Read failed: " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public Optional<Instant> lastModified(String path) {
        try {
            return Optional.of(Files.getLastModifiedTime(resolve(path)).toInstant());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Stat failed: " + path, e);
        }
    }

    @Override
    public List<String> list(String directory, String suffix) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try {
            faults.check(StorageFaults.LIST, directory);
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path entry : stream) {
                    String name = entry.getFileName().toString();
                    if (!isHidden(name) && name.endsWith(suffix)) {
                        names.add(name);
                    }
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException | DirectoryIteratorException e) {
            throw new StorageException("Listing failed: " + directory, e);
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public boolean remove(String path) {
        try {
            faults.check(StorageFaults.REMOVE, path);
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new StorageException("Remove failed: " + path, e);
        }
    }

    @Override
    public int cleanupTempFiles(String directory, Duration olderThan) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, ".*" + TEMP_SUFFIX)) {
            for (Path entry : stream) {
                try {
                    Instant modified = Files.getLastModifiedTime(entry).toInstant();
                    if (modified.isBefore(cutoff) && Files.deleteIfExists(entry)) {
                        log.info("Removed orphaned temp file {} (modified {})", entry.getFileName(), modified);
                        removed++;
                    }
                } catch (NoSuchFileException e) {
                    log.debug("Temp file {} vanished during cleanup", entry.getFileName());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            throw new StorageException("Temp file cleanup failed: " + directory, e);
        }
        return removed;
    }

    @Override
    public void ensureDirectory(String directory) {
        try {
            Files.createDirectories(resolve(directory));
        } catch (IOException e) {
            throw new StorageException("Cannot create directory: " + directory, e);
        }
    }

    // ========== Helpers ==========

    private Path resolve(String relative) {
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + relative);
        }
        return resolved;
    }

    private Path writeTemp(Path target, byte[] content, String path) {
        Path temp = target.resolveSibling("." + target.getFileName() + "." +
            UUID.randomUUID().toString().substring(0, 8) + TEMP_SUFFIX);
        try {
            faults.check(StorageFaults.WRITE, path);
            Files.createDirectories(target.getParent());
            Files.write(temp, content);
            return temp;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Temp write failed: " + path, e);
        }
    }

    /**
     * Only the rename is retried; the temp file's content is already durable.
     */
    private void moveReplacingWithRetry(Path temp, Path target, String path) {
        int attempt = 1;
        while (true) {
            try {
                faults.check(StorageFaults.RENAME, path);
                moveReplacing(temp, target);
                return;
            } catch (IOException e) {
                if (!retryPolicy.hasMoreAttempts(attempt)) {
                    throw new StorageException(
                        "Rename into place failed after " + attempt + " attempts: " + path, e);
                }
                Duration backoff = retryPolicy.computeBackoff(attempt);
                log.warn("Rename into place failed for {} (attempt {}), retrying in {}ms: {}",
                    path, attempt, backoff.toMillis(), e.getMessage());
                pause(backoff, path);
                attempt++;
            }
        }
    }

    private static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void pause(Duration backoff, String path) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying rename: " + path, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}, cleanup will collect it: {}", temp, e.getMessage());
        }
    }

    private static boolean isHidden(String name) {
        return name.startsWith(".");
    }
}
