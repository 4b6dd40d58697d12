package com.taskdrive.core.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Primitives over the shared, weakly consistent store.
 * 
 * Paths are relative to the store root and use {@code /} as separator.
 * No directory state is cached between calls: a listing is a snapshot and
 * callers must tolerate entries that vanish or appear before they are used.
 * Hidden names (leading dot) are reserved for temp files and never listed.
 */
public interface StorageAdapter {

    /**
     * Write content so readers never observe a partial file:
     * write to a uniquely named temp file, then rename it into place.
     * Only the rename is retried on transient failure.
     *
     * @throws com.taskdrive.core.exception.StorageException if the rename keeps failing
     */
    void writeAtomic(String path, byte[] content);

    /**
     * Like {@link #writeAtomic} but fails if the target already exists.
     *
     * @throws com.taskdrive.core.exception.EntryConflictException if the target exists
     */
    void writeExclusive(String path, byte[] content);

    /**
     * Atomically replace a file only if it still exists.
     *
     * @return false if the target was gone (another actor moved it)
     */
    boolean replaceExisting(String path, byte[] content);

    /**
     * Rename an entry.
     *
     * @throws com.taskdrive.core.exception.EntryNotFoundException if {@code from} no longer exists
     * @throws com.taskdrive.core.exception.EntryConflictException if {@code to} already exists
     */
    void renameAtomic(String from, String to);

    /**
     * Read a whole file.
     *
     * @return empty if the file does not exist
     */
    Optional<byte[]> read(String path);

    /**
     * Check whether an entry exists.
     */
    boolean exists(String path);

    /**
     * Last modification time of an entry, empty if absent.
     */
    Optional<Instant> lastModified(String path);

    /**
     * Snapshot list of visible entry names in a directory ending with {@code suffix}.
     * A missing directory yields an empty list.
     */
    List<String> list(String directory, String suffix);

    /**
     * Remove an entry. Absence is not an error.
     *
     * @return true if something was removed
     */
    boolean remove(String path);

    /**
     * Remove orphaned temp files older than {@code olderThan}.
     *
     * @return number of files removed
     */
    int cleanupTempFiles(String directory, Duration olderThan);

    /**
     * Create a directory (and parents) if missing.
     */
    void ensureDirectory(String directory);
}
