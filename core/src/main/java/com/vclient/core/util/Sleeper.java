package com.vclient.core.util;

import java.time.Duration;

/** Backoff wait seam. Tests swap in a recording implementation. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
