package com.stargazer.tracker.crawl.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set-once flag shared by every query loop of one collect call.
 */
public final class StopSignal {
    private final AtomicBoolean set = new AtomicBoolean();

    /**
     * @return true only for the call that actually set the flag
     */
    public boolean signal() {
        return set.compareAndSet(false, true);
    }

    public boolean isSet() {
        return set.get();
    }
}
