package com.nnstudio.orchestrator.support;

import com.nnstudio.orchestrator.retry.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records requested sleeps instead of sleeping. */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
    }

    public List<Long> sleeps() {
        return sleeps;
    }
}
