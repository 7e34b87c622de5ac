package com.example.feedsync.exception;

/**
 * The ingestion queue cannot take the submitted stubs. Callers should retry later.
 */
public class QueueFullException extends RuntimeException {

    private final int requested;
    private final int remainingCapacity;

    public QueueFullException(int requested, int remainingCapacity) {
        super("Ingestion queue full: requested " + requested + ", remaining capacity " + remainingCapacity);
        this.requested = requested;
        this.remainingCapacity = remainingCapacity;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemainingCapacity() {
        return remainingCapacity;
    }
}
