package com.taskdrive.engine.persistence;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.EntryNotFoundException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.model.BackoffPolicy;
import com.taskdrive.core.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory implementation of StorageAdapter.
 * For demonstration and testing purposes.
 *
 * Can imitate a lagging listing: with {@link #setListingLag(int)} set, a name that
 * was removed or renamed away keeps showing up in {@link #list} for that many
 * further listings, although reads of it come back empty.
 */
public class InMemoryStorageAdapter implements StorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageAdapter.class);

    private record Entry(byte[] content, Instant modifiedAt) {
    }

    private final Map<String, Entry> entries = new TreeMap<>();
    private final Map<String, Integer> ghosts = new HashMap<>();
    private final Clock clock;
    private final BackoffPolicy retryPolicy;
    private volatile StorageFaults faults = StorageFaults.NONE;
    private int listingLag = 0;

    public InMemoryStorageAdapter(Clock clock, BackoffPolicy retryPolicy) {
        this.clock = clock;
        this.retryPolicy = retryPolicy;
    }

    public InMemoryStorageAdapter(Clock clock) {
        this(clock, BackoffPolicy.noRetry());
    }

    public void setFaults(StorageFaults faults) {
        this.faults = faults != null ? faults : StorageFaults.NONE;
    }

    public synchronized void setListingLag(int listings) {
        this.listingLag = listings;
    }

    @Override
    public void writeAtomic(String path, byte[] content) {
        check(StorageFaults.WRITE, path);
        int attempt = 1;
        while (true) {
            try {
                faults.check(StorageFaults.RENAME, path);
                break;
            } catch (IOException e) {
                if (!retryPolicy.hasMoreAttempts(attempt)) {
                    throw new StorageException(
                        "Rename into place failed after " + attempt + " attempts: " + path, e);
                }
                log.debug("Injected rename failure for {} (attempt {})", path, attempt);
                attempt++;
            }
        }
        synchronized (this) {
            put(path, content);
        }
    }

    @Override
    public synchronized void writeExclusive(String path, byte[] content) {
        check(StorageFaults.WRITE, path);
        check(StorageFaults.RENAME, path);
        if (entries.containsKey(path)) {
            throw new EntryConflictException(path);
        }
        put(path, content);
    }

    @Override
    public synchronized boolean replaceExisting(String path, byte[] content) {
        check(StorageFaults.WRITE, path);
        if (!entries.containsKey(path)) {
            return false;
        }
        put(path, content);
        return true;
    }

    @Override
    public synchronized void renameAtomic(String from, String to) {
        check(StorageFaults.RENAME, from);
        Entry source = entries.get(from);
        if (source == null) {
            throw new EntryNotFoundException(from);
        }
        if (entries.containsKey(to)) {
            throw new EntryConflictException(to);
        }
        entries.remove(from);
        ghost(from);
        entries.put(to, new Entry(source.content(), clock.instant()));
        ghosts.remove(to);
    }

    @Override
    public synchronized Optional<byte[]> read(String path) {
        check(StorageFaults.READ, path);
        Entry entry = entries.get(path);
        return entry == null ? Optional.empty() : Optional.of(entry.content().clone());
    }

    @Override
    public synchronized boolean exists(String path) {
        return entries.containsKey(path);
    }

    @Override
    public synchronized Optional<Instant> lastModified(String path) {
        Entry entry = entries.get(path);
        return entry == null ? Optional.empty() : Optional.of(entry.modifiedAt());
    }

    @Override
    public synchronized List<String> list(String directory, String suffix) {
        check(StorageFaults.LIST, directory);
        String prefix = directory.endsWith("/") ? directory : directory + "/";
        List<String> names = new ArrayList<>();
        for (String path : entries.keySet()) {
            addIfListed(names, path, prefix, suffix);
        }
        Iterator<Map.Entry<String, Integer>> it = ghosts.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> ghost = it.next();
            if (addIfListed(names, ghost.getKey(), prefix, suffix)) {
                if (ghost.getValue() <= 1) {
                    it.remove();
                } else {
                    ghost.setValue(ghost.getValue() - 1);
                }
            }
        }
        names.sort(null);
        return names;
    }

    @Override
    public synchronized boolean remove(String path) {
        check(StorageFaults.REMOVE, path);
        boolean removed = entries.remove(path) != null;
        if (removed) {
            ghost(path);
        }
        return removed;
    }

    @Override
    public synchronized int cleanupTempFiles(String directory, Duration olderThan) {
        String prefix = directory.endsWith("/") ? directory : directory + "/";
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> entry = it.next();
            String path = entry.getKey();
            if (!path.startsWith(prefix)) {
                continue;
            }
            String name = path.substring(prefix.length());
            if (name.startsWith(".") && name.endsWith(".tmp") && !name.contains("/")
                    && entry.getValue().modifiedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void ensureDirectory(String directory) {
        // directories are implicit
    }

    /**
     * Snapshot of every stored path, for assertions.
     */
    public synchronized List<String> paths() {
        return new ArrayList<>(entries.keySet());
    }

    // ========== Helpers ==========

    private void put(String path, byte[] content) {
        entries.put(path, new Entry(content.clone(), clock.instant()));
        ghosts.remove(path);
    }

    private void ghost(String path) {
        if (listingLag > 0) {
            ghosts.put(path, listingLag);
        }
    }

    private static boolean addIfListed(List<String> names, String path, String prefix, String suffix) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        String name = path.substring(prefix.length());
        if (name.contains("/") || name.startsWith(".") || !name.endsWith(suffix)) {
            return false;
        }
        if (!names.contains(name)) {
            names.add(name);
        }
        return true;
    }

    private void check(String operation, String path) {
        try {
            faults.check(operation, path);
        } catch (IOException e) {
            throw new StorageException("Injected " + operation + " failure: " + path, e);
        }
    }
}
