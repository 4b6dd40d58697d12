package com.taskdrive.engine.persistence;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.EntryNotFoundException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class InMemoryStorageAdapterTest {

    private TimeController time;
    private InMemoryStorageAdapter storage;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        storage = new InMemoryStorageAdapter(time);
    }

    @Test
    void renameAtomic_shouldFollowFileSemantics() {
        storage.writeAtomic("tasks/a.todo", bytes("a"));
        storage.writeAtomic("tasks/b.running", bytes("b"));

        storage.renameAtomic("tasks/a.todo", "tasks/a.running");

        assertThatThrownBy(() -> storage.renameAtomic("tasks/a.todo", "tasks/a.running"))
            .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> storage.renameAtomic("tasks/a.running", "tasks/b.running"))
            .isInstanceOf(EntryConflictException.class);
        assertThatThrownBy(() -> storage.writeExclusive("tasks/a.running", bytes("x")))
            .isInstanceOf(EntryConflictException.class);
    }

    @Test
    void listingLag_shouldKeepRenamedNamesVisibleForAWhile() {
        storage.setListingLag(2);
        storage.writeAtomic("tasks/a.todo", bytes("a"));

        storage.renameAtomic("tasks/a.todo", "tasks/a.running");

        assertThat(storage.list("tasks", ".todo")).containsExactly("a.todo");
        assertThat(storage.read("tasks/a.todo")).isEmpty();
        assertThat(storage.list("tasks", ".todo")).containsExactly("a.todo");
        assertThat(storage.list("tasks", ".todo")).isEmpty();
        assertThat(storage.list("tasks", ".running")).containsExactly("a.running");
    }

    @Test
    void list_shouldIgnoreNestedAndHiddenEntries() {
        storage.writeAtomic("tasks/a.todo", bytes("a"));
        storage.writeAtomic("tasks/.a.todo.1.tmp", bytes("partial"));
        storage.writeAtomic("tasks/archive/b.todo", bytes("b"));

        assertThat(storage.list("tasks", ".todo")).containsExactly("a.todo");
    }

    @Test
    void cleanupTempFiles_shouldHonourAge() {
        storage.writeAtomic("tasks/.old.tmp", bytes("x"));
        time.advance(Duration.ofHours(2));
        storage.writeAtomic("tasks/.new.tmp", bytes("y"));

        assertThat(storage.cleanupTempFiles("tasks", Duration.ofHours(1))).isEqualTo(1);
        assertThat(storage.paths()).containsExactly("tasks/.new.tmp");
    }

    @Test
    void faults_shouldSurfaceAsStorageException() {
        storage.setFaults((operation, path) -> {
            if (StorageFaults.LIST.equals(operation)) {
                throw new IOException("mount offline");
            }
        });

        assertThatThrownBy(() -> storage.list("tasks", ".todo"))
            .isInstanceOf(StorageException.class)
            .hasRootCauseMessage("mount offline");
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
