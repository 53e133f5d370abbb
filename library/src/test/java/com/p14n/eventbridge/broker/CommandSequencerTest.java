package com.p14n.eventbridge.broker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class CommandSequencerTest {

    private CommandSequencer sequencer;

    @BeforeEach
    void setUp() {
        sequencer = new CommandSequencer("test");
    }

    @AfterEach
    void tearDown() {
        sequencer.close();
    }

    @Test
    void tasksRunInSubmissionOrder() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        sequencer.start();

        for (int i = 0; i < 100; i++) {
            int n = i;
            sequencer.enqueue(() -> order.add(n));
        }
        sequencer.enqueue(done::countDown);

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(IntStream.range(0, 100).boxed().collect(Collectors.toList()), order);
    }

    @Test
    void tasksFromManyThreadsNeverOverlap() throws InterruptedException {
        AtomicInteger running = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean(false);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        int producers = 4;
        int perProducer = 50;
        CountDownLatch done = new CountDownLatch(producers * perProducer);
        sequencer.start();

        for (int p = 0; p < producers; p++) {
            new Thread(() -> {
                for (int i = 0; i < perProducer; i++) {
                    sequencer.enqueue(() -> {
                        if (running.incrementAndGet() > 1) {
                            overlapped.set(true);
                        }
                        threads.add(Thread.currentThread().getName());
                        running.decrementAndGet();
                        done.countDown();
                    });
                }
            }).start();
        }

        assertTrue(done.await(3, TimeUnit.SECONDS));
        assertFalse(overlapped.get());
        assertEquals(Set.of("test-sequencer"), threads);
    }

    @Test
    void failingTaskDoesNotStopWorker() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        sequencer.start();

        sequencer.enqueue(() -> {
            throw new IllegalStateException("boom");
        });
        sequencer.enqueue(done::countDown);

        assertTrue(done.await(1, TimeUnit.SECONDS));
    }

    @Test
    void tasksEnqueuedBeforeStartRunOnceStarted() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(2);
        sequencer.enqueue(done::countDown);
        sequencer.enqueue(done::countDown);
        assertEquals(2, sequencer.pending());

        sequencer.start();

        assertTrue(done.await(1, TimeUnit.SECONDS));
    }

    @Test
    void closeLetsQueuedTasksFinish() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        sequencer.start();
        sequencer.enqueue(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            completed.incrementAndGet();
        });
        sequencer.enqueue(completed::incrementAndGet);

        release.countDown();
        sequencer.close();

        assertEquals(2, completed.get());
    }

    @Test
    void isWorkerThreadOnlyInsideTasks() throws InterruptedException {
        AtomicBoolean inside = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        sequencer.start();

        sequencer.enqueue(() -> {
            inside.set(sequencer.isWorkerThread());
            done.countDown();
        });

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(inside.get());
        assertFalse(sequencer.isWorkerThread());
    }

    @Test
    void lastTaskRunsOnWorkerAfterQueuedTasks() {
        List<String> order = new CopyOnWriteArrayList<>();
        sequencer.start();
        sequencer.enqueue(() -> order.add("queued"));

        boolean stopped = sequencer.close(() -> order.add("last:" + Thread.currentThread().getName()));

        assertTrue(stopped);
        assertEquals(List.of("queued", "last:test-sequencer"), order);
    }

    @Test
    void lastTaskRunsOnCallerWhenNeverStarted() {
        List<String> ran = new CopyOnWriteArrayList<>();
        sequencer.enqueue(() -> ran.add("queued"));

        assertTrue(sequencer.close(() -> ran.add(Thread.currentThread().getName())));

        assertEquals(List.of(Thread.currentThread().getName()), ran);
    }

    @Test
    void stuckWorkerIsReportedAndLastTaskNotRunByCaller() throws InterruptedException {
        CommandSequencer slow = new CommandSequencer("stuck", 100);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean lastRanOnCaller = new AtomicBoolean(false);
        Thread caller = Thread.currentThread();
        slow.start();
        slow.enqueue(() -> {
            entered.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(entered.await(1, TimeUnit.SECONDS));

        boolean stopped = slow.close(() -> lastRanOnCaller.set(Thread.currentThread() == caller));

        assertFalse(stopped);
        assertFalse(lastRanOnCaller.get());
        release.countDown();
    }

    @Test
    void rejectsInvalidUse() {
        assertThrows(IllegalArgumentException.class, () -> sequencer.enqueue(null));

        sequencer.start();
        assertThrows(IllegalStateException.class, sequencer::start);

        sequencer.close();
        assertThrows(IllegalStateException.class, () -> sequencer.enqueue(() -> {
        }));
    }
}
