package com.gradeflow.grading;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that returns immediately and remembers every non-zero wait
 */
public class RecordingSleeper implements Sleeper {
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(Duration duration) {
        if (!duration.isZero()) {
            sleeps.add(duration);
        }
    }

    public synchronized List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }
}
