package com.taskdrive.engine.persistence;

import java.io.IOException;

/**
 * Hook invoked by storage adapters before each primitive touches the store.
 * Lets tests and chaos drills inject the transient failures a shared mount produces.
 */
@FunctionalInterface
public interface StorageFaults {

    String RENAME = "rename";
    String WRITE = "write";
    String READ = "read";
    String LIST = "list";
    String REMOVE = "remove";

    StorageFaults NONE = (operation, path) -> { };

    /**
     * Throw to make the named operation fail.
     *
     * @param operation one of the operation constants
     * @param path store-relative path being touched
     */
    void check(String operation, String path) throws IOException;
}
