package com.taskdrive.engine.persistence;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.model.LockMarker;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.core.storage.StorageAdapter;
import com.taskdrive.engine.persistence.codec.LockMarkerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lock manager keeping one marker file per claimed task under {@code locks/}.
 *
 * A fresh claim publishes its marker with an exclusive write. A stale marker is
 * overwritten and read back: whichever claimant's write survives owns the task.
 * Two claimants can still both pass the read-back on a lagging store; recovery
 * and the owner checks at finalization absorb that window.
 */
public class StorageLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(StorageLockManager.class);

    public static final String LOCK_DIR = "locks";
    public static final String LOCK_SUFFIX = ".lock";

    private final StorageAdapter storage;
    private final LockMarkerCodec codec;
    private final Clock clock;

    public StorageLockManager(StorageAdapter storage, LockMarkerCodec codec, Clock clock) {
        this.storage = storage;
        this.codec = codec;
        this.clock = clock;
        storage.ensureDirectory(LOCK_DIR);
    }

    public StorageLockManager(StorageAdapter storage, Clock clock) {
        this(storage, new LockMarkerCodec(), clock);
    }

    public static String markerPath(String taskId) {
        return LOCK_DIR + "/" + taskId + LOCK_SUFFIX;
    }

    @Override
    public boolean tryAcquire(String taskId, String ownerId, Duration leaseDuration) {
        String path = markerPath(taskId);
        Instant now = clock.instant();
        LockMarker fresh = LockMarker.create(taskId, ownerId, leaseDuration, now);

        try {
            storage.writeExclusive(path, codec.encode(fresh));
            log.debug("Acquired marker for task {}", taskId);
            return true;
        } catch (EntryConflictException e) {
            log.debug("Marker for task {} already exists, checking staleness", taskId);
        }

        Optional<LockMarker> existing = readTolerant(path);
        if (existing.isPresent()) {
            LockMarker current = existing.get();
            if (current.isOwnedBy(ownerId)) {
                storage.writeAtomic(path, codec.encode(current.withHeartbeat(now)));
                return true;
            }
            if (!current.isStale(now, leaseDuration)) {
                return false;
            }
            log.info("Taking over stale marker for task {} (owner {}, last heartbeat {})",
                taskId, current.ownerId(), current.lastHeartbeat());
        } else {
            // vanished since our write attempt, or unreadable
            Optional<Instant> modified = storage.lastModified(path);
            if (modified.isEmpty()) {
                return false;
            }
            if (Duration.between(modified.get(), now).compareTo(leaseDuration) <= 0) {
                return false;
            }
            log.warn("Overwriting unreadable marker for task {} last modified {}", taskId, modified.get());
        }

        storage.writeAtomic(path, codec.encode(fresh));
        boolean won = isHeldBy(taskId, ownerId);
        if (!won) {
            log.debug("Lost stale-marker takeover for task {}", taskId);
        }
        return won;
    }

    @Override
    public boolean renew(String taskId, String ownerId) {
        String path = markerPath(taskId);
        Optional<LockMarker> existing = readTolerant(path);
        if (existing.isEmpty() || !existing.get().isOwnedBy(ownerId)) {
            return false;
        }
        LockMarker renewed = existing.get().withHeartbeat(clock.instant());
        return storage.replaceExisting(path, codec.encode(renewed));
    }

    @Override
    public void release(String taskId, String ownerId) {
        String path = markerPath(taskId);
        try {
            Optional<LockMarker> existing = readTolerant(path);
            if (existing.isEmpty()) {
                log.debug("Marker for task {} already gone", taskId);
                return;
            }
            if (!existing.get().isOwnedBy(ownerId)) {
                log.debug("Marker for task {} now owned by {}, leaving it", taskId, existing.get().ownerId());
                return;
            }
            storage.remove(path);
            log.debug("Released marker for task {}", taskId);
        } catch (StorageException e) {
            log.warn("Could not release marker for task {}, recovery will sweep it: {}", taskId, e.getMessage());
        }
    }

    @Override
    public boolean forceRelease(String taskId) {
        return storage.remove(markerPath(taskId));
    }

    @Override
    public Optional<LockMarker> read(String taskId) {
        return readTolerant(markerPath(taskId));
    }

    @Override
    public boolean isHeldBy(String taskId, String ownerId) {
        return read(taskId).map(m -> m.isOwnedBy(ownerId)).orElse(false);
    }

    @Override
    public List<String> listMarkedTaskIds() {
        return storage.list(LOCK_DIR, LOCK_SUFFIX).stream()
            .map(name -> name.substring(0, name.length() - LOCK_SUFFIX.length()))
            .collect(Collectors.toList());
    }

    private Optional<LockMarker> readTolerant(String path) {
        Optional<byte[]> content = storage.read(path);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(path, content.get()));
        } catch (MalformedDescriptorException e) {
            log.warn("Ignoring unreadable marker {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
