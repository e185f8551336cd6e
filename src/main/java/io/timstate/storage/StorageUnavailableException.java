package io.timstate.storage;

/** The database file could not be created, opened or configured. Not retried. */
public class StorageUnavailableException extends StorageException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
