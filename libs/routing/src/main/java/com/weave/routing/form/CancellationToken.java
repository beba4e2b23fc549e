package com.weave.routing.form;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal checked by long-running body reads.
 */
@FunctionalInterface
public interface CancellationToken {

    /** A token that is never cancelled. */
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    /**
     * @throws CancellationException if cancellation was requested
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Request body read was cancelled");
        }
    }

    /** A token that reports the state of {@code flag}. */
    static CancellationToken of(AtomicBoolean flag) {
        return flag::get;
    }
}
