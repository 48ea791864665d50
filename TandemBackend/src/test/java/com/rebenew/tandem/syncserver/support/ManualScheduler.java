package com.rebenew.tandem.syncserver.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Mocked executor that records scheduled work instead of running it, so
 * tests fire timers by hand against a {@link MutableClock}.
 */
public final class ManualScheduler {

    public record Task(Runnable runnable, long delayMs, boolean periodic, ScheduledFuture<?> future) {
    }

    private final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
    private final List<Task> tasks = new ArrayList<>();

    public ManualScheduler() {
        doAnswer(inv -> capture(inv.getArgument(0), inv.getArgument(1), false))
                .when(executor).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        doAnswer(inv -> capture(inv.getArgument(0), inv.getArgument(2), true))
                .when(executor).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    }

    private ScheduledFuture<?> capture(Runnable runnable, Long delayMs, boolean periodic) {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        tasks.add(new Task(runnable, delayMs, periodic, future));
        return future;
    }

    public ScheduledExecutorService executor() {
        return executor;
    }

    public List<Task> tasks() {
        return tasks;
    }

    public List<Task> oneShots(long delayMs) {
        List<Task> matching = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.periodic() && task.delayMs() == delayMs)
                matching.add(task);
        }
        return matching;
    }

    public List<Task> periodic() {
        List<Task> matching = new ArrayList<>();
        for (Task task : tasks) {
            if (task.periodic())
                matching.add(task);
        }
        return matching;
    }
}
