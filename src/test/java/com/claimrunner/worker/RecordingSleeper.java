package com.claimrunner.worker;

import com.claimrunner.shared.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingSleeper implements Sleeper {

    final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final List<String> sharedLog;

    RecordingSleeper() {
        this(null);
    }

    RecordingSleeper(List<String> sharedLog) {
        this.sharedLog = sharedLog;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (sharedLog != null) sharedLog.add("sleep:" + duration.toSeconds());
    }
}
