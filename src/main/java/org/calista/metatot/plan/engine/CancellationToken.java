package org.calista.metatot.plan.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session-level cancellation flag, checked at the top of every iteration.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
