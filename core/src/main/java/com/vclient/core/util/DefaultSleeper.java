package com.vclient.core.util;

import java.time.Duration;

/** Blocks the calling thread. Interruption ends the wait with {@link InterruptedException}. */
public final class DefaultSleeper implements Sleeper {
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override public void sleep(Duration d) throws InterruptedException {
        if (d == null || d.isNegative() || d.isZero()) return;
        long ms = d.toMillis();
        int nanos = d.minusMillis(ms).getNano();
        Thread.sleep(ms, nanos);
    }
}
