package com.p14n.eventbridge.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * {@link AsyncExecutor} used outside tests. Ticks run on a small scheduled
 * pool; loops that block for their whole life get a thread of their own from
 * a cached pool. All threads are daemons named after the bridge instance.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService ticks;
        private final ExecutorService loops;

        public DefaultExecutor(String name, int tickThreads) {
                this.ticks = Executors.newScheduledThreadPool(tickThreads, daemon(name + "-tick-%d"));
                this.loops = Executors.newCachedThreadPool(daemon(name + "-loop-%d"));
        }

        private static ThreadFactory daemon(String nameFormat) {
                return new ThreadFactoryBuilder().setDaemon(true).setNameFormat(nameFormat).build();
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return ticks.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return loops.submit(task);
        }

        /**
         * Interrupts running loops and cancels the ticks.
         *
         * @return work that never started
         */
        @Override
        public List<Runnable> shutdownNow() {
                List<Runnable> pending = new ArrayList<>(loops.shutdownNow());
                pending.addAll(ticks.shutdownNow());
                return pending;
        }
}
