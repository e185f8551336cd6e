package io.timstate.storage;

/** A unique, foreign key, check or not-null constraint rejected the write. */
public class ConstraintViolationException extends StorageException {
    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
