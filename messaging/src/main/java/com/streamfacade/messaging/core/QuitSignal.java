/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot shutdown notification for a delivery loop. It fires at most once; observing it is
 * idempotent and never consumes it.
 */
public final class QuitSignal {

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    /**
     * Fires the signal.
     *
     * @return {@code true} for the call that fired it, {@code false} if it had already fired
     */
    public boolean fire() {
        return fired.complete(null);
    }

    public boolean isFired() {
        return fired.isDone();
    }

    /** A view that completes when the signal fires. Completing the view has no effect on the signal. */
    public CompletableFuture<Void> whenFired() {
        return fired.copy();
    }
}
