package io.timstate.storage;

/** A schema script failed; the whole migration run was rolled back. */
public class MigrationFailedException extends StorageException {
    private final int failedVersion;

    public MigrationFailedException(int failedVersion, String message, Throwable cause) {
        super(message, cause);
        this.failedVersion = failedVersion;
    }

    public int failedVersion() {
        return failedVersion;
    }
}
