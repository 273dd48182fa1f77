/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.herald.dispatch;

import io.herald.core.DispatchException;
import io.herald.core.ProtocolViolationException;
import io.herald.core.RunListener;
import io.herald.core.RunStoppedException;
import io.herald.core.Tracker;
import io.herald.sort.SuiteSortingGate;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs suites, and with test sorting their tests, on a fixed pool of worker threads.
 * Suite events go to a {@link SuiteSortingGate}, so the listener behind it still sees
 * one suite at a time.
 * <p>
 * A worker that waits for work of its own scope runs queued work itself instead of
 * blocking, so suites waiting for their tests or nested suites cannot starve the pool.
 * <p>
 * Example usage:
 * <pre>
 * try (SuiteSortingGate gate = new SuiteSortingGate(listener);
 *      ConcurrentDispatcher dispatcher = new ConcurrentDispatcher(gate, 4)) {
 *     for (SuiteUnit suite : suites) {
 *         dispatcher.submit(suite);
 *     }
 *     dispatcher.awaitAll();
 * }
 * </pre>
 */
public class ConcurrentDispatcher extends AbstractDispatcher {

    public static final int UNBOUNDED = 0;

    private final Pool pool;
    private final ConcurrentDispatcher parent;
    private final ConcurrentLinkedQueue<DispatchHandle> handles = new ConcurrentLinkedQueue<>();

    public ConcurrentDispatcher(SuiteSortingGate gate, int threads) {
        this(gate, threads, UNBOUNDED, true, new Tracker(), new Stopper());
    }

    /**
     * @param gate          receives suite events, and owns the test gates when test sorting is on
     * @param threads       number of worker threads
     * @param queueCapacity how many units may wait for a worker, {@link #UNBOUNDED} for no limit
     * @param testSorting   run tests concurrently and sort them, instead of inline on the suite thread
     * @param tracker       tracker top-level suites are forked from
     * @param stopper       stop flag shared with the caller
     */
    public ConcurrentDispatcher(SuiteSortingGate gate, int threads, int queueCapacity, boolean testSorting,
                                Tracker tracker, Stopper stopper) {
        super(tracker, stopper, null);
        if (gate == null) {
            throw new IllegalArgumentException("suite sorting gate is null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queue capacity must not be negative: " + queueCapacity);
        }
        this.pool = new Pool(gate, threads, queueCapacity, testSorting, this.stopper);
        this.parent = null;
        logger.debug("concurrent dispatcher started, threads: {}, queue capacity: {}, test sorting: {}",
                threads, queueCapacity == UNBOUNDED ? "unbounded" : queueCapacity, testSorting);
    }

    private ConcurrentDispatcher(ConcurrentDispatcher parent, Tracker tracker, String parentSuiteId) {
        super(tracker, parent.stopper, parentSuiteId);
        this.pool = parent.pool;
        this.parent = parent;
    }

    @Override
    public void awaitAll() {
        boolean worker = pool.isWorkerThread();
        DispatchHandle handle;
        while ((handle = handles.peek()) != null) {
            if (worker && !handle.isDone()) {
                handle.runIfQueued(pool.executor);
            }
            handle.await();
            handles.remove(handle);
        }
        if (parent == null) {
            pool.gate.flushReady();
            RuntimeException error = pool.firstError.get();
            if (error != null) {
                throw error;
            }
        }
    }

    @Override
    public boolean isConcurrent() {
        return true;
    }

    public int getThreadCount() {
        return pool.executor.getCorePoolSize();
    }

    /**
     * Shuts the worker pool down. Only the root dispatcher owns the pool, closing a
     * scope does nothing.
     */
    @Override
    public void close() {
        if (parent != null) {
            return;
        }
        pool.executor.shutdown();
        try {
            if (!pool.executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("worker pool did not terminate, interrupting workers");
                pool.executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.executor.shutdownNow();
        }
    }

    @Override
    DispatchHandle execute(Work work) {
        DispatchHandle handle = new DispatchHandle(work.getName(), () -> runWork(work));
        for (ConcurrentDispatcher d = this; d != null; d = d.parent) {
            d.handles.add(handle);
        }
        try {
            pool.executor.execute(handle.task());
        } catch (RejectedExecutionException e) {
            DispatchException error = new DispatchException("cannot schedule " + work.getName()
                    + ": worker queue is full or the dispatcher is shut down", e);
            pool.fail(error);
            work.skip(error);
            handle.cancel();
            throw error;
        }
        return handle;
    }

    @Override
    AbstractDispatcher scope(Tracker tracker, String parentSuiteId) {
        return new ConcurrentDispatcher(this, tracker, parentSuiteId);
    }

    @Override
    RunListener getSuiteListener() {
        return pool.gate;
    }

    @Override
    SuiteSortingGate getTestGateOwner() {
        return pool.testSorting ? pool.gate : null;
    }

    private void runWork(Work work) {
        try {
            if (stopper.isStopRequested()) {
                work.skip(new RunStoppedException("run stopped before " + work.getName() + " started"));
            } else {
                work.run();
            }
        } catch (RuntimeException e) {
            pool.record(work, e);
        }
    }

    // ========== Pool ==========

    /**
     * State shared by a root dispatcher and all of its scopes.
     */
    private static class Pool {

        final SuiteSortingGate gate;
        final boolean testSorting;
        final Stopper stopper;
        final ThreadPoolExecutor executor;
        final Set<Thread> workers = ConcurrentHashMap.newKeySet();
        final AtomicReference<RuntimeException> firstError = new AtomicReference<>();
        final AtomicBoolean failed = new AtomicBoolean();

        Pool(SuiteSortingGate gate, int threads, int queueCapacity, boolean testSorting, Stopper stopper) {
            this.gate = gate;
            this.testSorting = testSorting;
            this.stopper = stopper;
            BlockingQueue<Runnable> queue = queueCapacity == UNBOUNDED
                    ? new LinkedBlockingQueue<>()
                    : new ArrayBlockingQueue<>(queueCapacity);
            this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, queue,
                    workerThreadFactory("herald-worker-"));
        }

        private ThreadFactory workerThreadFactory(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return r -> {
                Thread t = new Thread(() -> {
                    workers.add(Thread.currentThread());
                    try {
                        r.run();
                    } finally {
                        workers.remove(Thread.currentThread());
                    }
                }, prefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }

        boolean isWorkerThread() {
            return workers.contains(Thread.currentThread());
        }

        void record(Work work, RuntimeException e) {
            if (e instanceof ProtocolViolationException) {
                logger.error("protocol violation in {}: {}", work.getName(), e.getMessage());
            } else {
                logger.error("{} failed outside of its body: {}", work.getName(), e.getMessage(), e);
            }
            firstError.compareAndSet(null, e);
        }

        void fail(DispatchException e) {
            if (failed.compareAndSet(false, true)) {
                logger.error("dispatch failed, stopping the run: {}", e.getMessage());
            }
            firstError.compareAndSet(null, e);
            stopper.requestStop();
        }

    }

}
