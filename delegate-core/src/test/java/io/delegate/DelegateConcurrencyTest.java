package io.delegate;

import io.delegate.lifetime.Observer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DelegateConcurrencyTest {

    private static final int THREADS = 8;
    private static final int PER_THREAD = 500;

    @Test
    void concurrentAddsWhileInvokingLoseNoRegistration() throws Exception {
        assertNoLostRegistrations(new ActionDelegate());
    }

    @Test
    void concurrentAddsWhileInvokingLoseNoRegistrationInSnapshotMode() throws Exception {
        assertNoLostRegistrations(new ActionDelegate(
                new DelegateConfig().setInvocationMode(InvocationMode.SNAPSHOT)));
    }

    @Test
    void defaultInvocationWaitsForInvocationOnOtherThread() throws Exception {
        ActionDelegate delegate = new ActionDelegate();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        delegate.add(() -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inside.decrementAndGet();
        });

        Thread first = new Thread(delegate::invoke);
        first.start();
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        Thread second = new Thread(delegate::invoke);
        second.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (second.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(1);
        }

        assertEquals(Thread.State.WAITING, second.getState());
        assertEquals(1, calls.get());

        release.countDown();
        first.join(TimeUnit.SECONDS.toMillis(10));
        second.join(TimeUnit.SECONDS.toMillis(10));

        assertEquals(2, calls.get());
        assertEquals(1, maxInside.get());
    }

    @Test
    void concurrentInvocationsCallEveryCallableEachTime() throws Exception {
        ActionDelegate delegate = new ActionDelegate();
        AtomicInteger calls = new AtomicInteger();
        for (int i = 0; i < 10; i++) {
            delegate.add(calls::incrementAndGet);
        }

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < PER_THREAD; i++) {
                        delegate.invoke();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(THREADS * PER_THREAD * 10, calls.get());
    }

    @Test
    void defaultModeSerializesInvocations() throws Exception {
        ActionDelegate delegate = new ActionDelegate();
        AtomicInteger inside = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        delegate.add(() -> {
            if (inside.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            Thread.yield();
            inside.decrementAndGet();
        });

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < PER_THREAD; i++) {
                        delegate.invoke();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertFalse(overlapped.get());
    }

    @Test
    void observersClosedOnOtherThreadsAreEvicted() throws Exception {
        ActionDelegate delegate = new ActionDelegate();
        List<Observer> observers = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            Observer observer = new Observer();
            observers.add(observer);
            delegate.add(() -> {}, observer);
        }

        Thread closer = new Thread(() -> observers.forEach(Observer::close));
        closer.start();
        closer.join(TimeUnit.SECONDS.toMillis(10));
        delegate.invoke();

        assertEquals(0, delegate.size());
    }

    private static void assertNoLostRegistrations(ActionDelegate delegate) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean adding = new AtomicBoolean(true);
        try {
            Future<?> invoker = pool.submit(() -> {
                start.await();
                while (adding.get()) {
                    delegate.invoke();
                }
                return null;
            });
            List<Future<?>> adders = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                adders.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < PER_THREAD; i++) {
                        delegate.add(() -> {});
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> adder : adders) {
                adder.get(10, TimeUnit.SECONDS);
            }
            adding.set(false);
            invoker.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(THREADS * PER_THREAD, delegate.size());
    }
}
