package io.timstate.storage;

/** Another connection kept the write lock for longer than the busy timeout. */
public class StorageBusyException extends StorageException {
    public StorageBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
