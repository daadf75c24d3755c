package com.vclient.core.http;

import com.vclient.core.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records every wait instead of sleeping. */
public final class RecordingSleeper implements Sleeper {
    public final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration d) {
        sleeps.add(d);
    }
}
