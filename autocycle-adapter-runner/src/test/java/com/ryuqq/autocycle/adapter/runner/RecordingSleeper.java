package com.ryuqq.autocycle.adapter.runner;

import java.util.ArrayList;
import java.util.List;

/**
 * 실제로 대기하지 않고 요청된 대기 시간만 기록하는 Sleeper.
 */
class RecordingSleeper implements Sleeper {

    private final List<Long> slices = new ArrayList<>();
    private Runnable onSleep = () -> { };

    RecordingSleeper onSleep(Runnable hook) {
        this.onSleep = hook;
        return this;
    }

    @Override
    public void sleep(long millis) {
        slices.add(millis);
        onSleep.run();
    }

    List<Long> slices() {
        return slices;
    }

    long totalSlept() {
        long total = 0;
        for (long slice : slices) {
            total += slice;
        }
        return total;
    }
}
