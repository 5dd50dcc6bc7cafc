package com.buildsync.reconcile;

/**
 * Base type for conditions that abort a reconciliation. Never retried; side effects already
 * committed on the target stay in place.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
