package com.p14n.eventbridge.broker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer work queue. Every operation that touches the store
 * connection is enqueued here and run by one worker thread, strictly in
 * submission order, each task to completion before the next starts.
 *
 * <p>
 * The worker only waits when the queue is empty. Tasks have no timeout; a
 * task that blocks holds up everything queued behind it.
 * </p>
 *
 * <pre>{@code
 * var sequencer = new CommandSequencer("bridge");
 * sequencer.start();
 * sequencer.enqueue(supervisor::tick);
 * sequencer.enqueue(() -> publisher.publish(event));
 * }</pre>
 */
public class CommandSequencer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CommandSequencer.class);
    private static final Runnable STOP = () -> {
    };

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Thread worker;
    private final long shutdownTimeoutMillis;

    public CommandSequencer(String name) {
        this(name, 5000);
    }

    public CommandSequencer(String name, long shutdownTimeoutMillis) {
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
        this.worker = new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat(name + "-sequencer")
                .build()
                .newThread(this::drain);
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if already started or closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Sequencer is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Sequencer already started");
        }
        worker.start();
    }

    /**
     * Appends a task to the queue. Tasks enqueued before {@link #start()} run
     * once the worker starts.
     *
     * @param task the work to run on the worker thread
     * @throws IllegalArgumentException if the task is null
     * @throws IllegalStateException    if the sequencer is closed
     */
    public void enqueue(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        synchronized (queue) {
            if (closed.get()) {
                throw new IllegalStateException("Sequencer is closed");
            }
            queue.add(task);
        }
    }

    /**
     * @return number of tasks waiting to run
     */
    public int pending() {
        return (int) queue.stream().filter(t -> t != STOP).count();
    }

    /**
     * @return true if called from the worker thread
     */
    public boolean isWorkerThread() {
        return Thread.currentThread() == worker;
    }

    private void drain() {
        logger.atDebug().log("Command sequencer started");
        while (true) {
            Runnable task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == STOP) {
                break;
            }
            run(task);
        }
        logger.atDebug().addArgument(queue.size()).log("Command sequencer stopped with {} tasks pending");
    }

    private void run(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Task failed, continuing with the next one");
        }
    }

    /**
     * Stops accepting tasks, lets the worker finish what is already queued
     * and waits for it up to the shutdown timeout. A worker still busy after
     * that is interrupted.
     */
    @Override
    public void close() {
        close(null);
    }

    /**
     * Like {@link #close()}, but runs a last task on the worker after every
     * queued task. If the sequencer was never started the last task runs on
     * the calling thread instead. If the worker does not stop in time the
     * last task may never run.
     *
     * @param lastTask run after the queue drains, may be null
     * @return true if the worker stopped within the shutdown timeout
     */
    public boolean close(Runnable lastTask) {
        synchronized (queue) {
            if (!closed.compareAndSet(false, true)) {
                return !worker.isAlive();
            }
            if (started.get()) {
                if (lastTask != null) {
                    queue.add(lastTask);
                }
                queue.add(STOP);
            } else {
                queue.clear();
            }
        }
        if (!started.get()) {
            if (lastTask != null) {
                run(lastTask);
            }
            return true;
        }
        try {
            worker.join(shutdownTimeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            logger.atWarn()
                    .addArgument(shutdownTimeoutMillis)
                    .log("Command sequencer did not stop within {}ms, interrupting");
            worker.interrupt();
            return false;
        }
        return true;
    }
}
