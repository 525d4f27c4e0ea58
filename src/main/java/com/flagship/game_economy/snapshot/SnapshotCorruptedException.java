package com.flagship.game_economy.snapshot;

/**
 * A persisted snapshot could not be parsed or violates an economy invariant.
 * Nothing is restored when this is thrown.
 */
public class SnapshotCorruptedException extends RuntimeException {

    public SnapshotCorruptedException(String message) {
        super(message);
    }

    public SnapshotCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
