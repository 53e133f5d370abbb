package com.p14n.eventbridge.broker;

import java.util.List;
import java.util.concurrent.*;

/**
 * Runs the bridge's background work: the periodic ticks and the long running
 * loops.
 */
public interface AsyncExecutor extends AutoCloseable {

    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
                                                  long initialDelay,
                                                  long period,
                                                  TimeUnit unit);

    List<Runnable> shutdownNow();

    <T> Future<T> submit(Callable<T> task);

    @Override
    default void close() {
        shutdownNow();
    }
}
