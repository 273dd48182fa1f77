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
package io.herald.sort;

import io.herald.core.Ordinal;
import io.herald.core.ProtocolViolationException;
import io.herald.core.RunEvent;
import io.herald.core.RunEventType;
import io.herald.core.RunListener;
import io.herald.core.SortingTimeoutException;
import io.herald.core.SuiteRunEvent;
import io.herald.log.LogContext;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers the events of concurrently running suites to a sink one suite at a time,
 * in the order the suites started.
 * <p>
 * The head suite (the oldest one not yet completed) streams live: its events reach the
 * sink as soon as they are recorded. Events of the suites behind it are buffered until
 * they become the head. A suite leaves the head once its terminal event is recorded and
 * the {@link TestSortingGate} attached to it, if any, has released all of its tests.
 * <p>
 * The sink is called under the gate's lock, so it sees exactly one event at a time, in
 * final order, and needs no synchronization of its own.
 */
public class SuiteSortingGate implements RunListener, AutoCloseable {

    private static final Logger logger = LogContext.SORT_LOGGER;

    private final RunListener sink;
    private final Duration timeout;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, SuiteSlot> slots = new LinkedHashMap<>();
    private final Set<String> flushedSuites = new HashSet<>();
    private final Set<String> forcedSuites = new HashSet<>();
    // nested suite id to parent suite id, while the nested suite is pending
    private final Map<String, String> parents = new HashMap<>();

    private Ordinal lastOrdinal;
    private ScheduledFuture<?> pendingTimeout;
    private String armedSuiteId;

    public SuiteSortingGate(RunListener sink) {
        this(sink, null, null);
    }

    public SuiteSortingGate(RunListener sink, Duration timeout) {
        this(sink, timeout, null);
    }

    /**
     * @param sink    receives the ordered stream
     * @param timeout how long a blocking head slot may stay idle, null or zero to wait forever
     * @param timer   shared timer for timeouts, created (and owned) by the gate when null
     */
    public SuiteSortingGate(RunListener sink, Duration timeout, ScheduledExecutorService timer) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is null");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.sink = sink;
        this.timeout = timeout;
        boolean enabled = timeout != null && !timeout.isZero();
        if (timer == null && enabled) {
            this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "herald-sort-timer");
                t.setDaemon(true);
                return t;
            });
            this.ownsTimer = true;
        } else {
            this.timer = timer;
            this.ownsTimer = false;
        }
    }

    @Override
    public void onEvent(RunEvent event) {
        recordEvent(event);
    }

    public void recordEvent(RunEvent event) {
        lock.lock();
        try {
            String suiteId = event.getSuiteId();
            if (suiteId == null) {
                // run-level event, not owned by any suite
                dispatch(event);
                return;
            }
            lastOrdinal = event.getOrdinal();
            RunEventType type = event.getType();
            if (type == RunEventType.SUITE_STARTING) {
                if (slots.containsKey(suiteId) || flushedSuites.contains(suiteId)) {
                    throw new ProtocolViolationException("suite '" + suiteId + "' started twice", event);
                }
                slots.put(suiteId, SuiteSlot.open(event));
                String parentSuiteId = ((SuiteRunEvent) event).parentSuiteId();
                if (parentSuiteId != null) {
                    parents.put(suiteId, parentSuiteId);
                }
            } else {
                SuiteSlot slot = slots.get(suiteId);
                if (slot == null || slot.forced()) {
                    if (forcedSuites.contains(suiteId)) {
                        logger.warn("dropping {} for suite '{}': the suite was already reported as timed out",
                                type, event.getSuiteName());
                        return;
                    }
                    if (flushedSuites.contains(suiteId)) {
                        throw new ProtocolViolationException(type + " for suite '" + suiteId + "' after it completed", event);
                    }
                    throw new ProtocolViolationException(type + " for suite '" + suiteId + "' that never started", event);
                }
                if (type.isSuiteTerminal()) {
                    if (slot.terminal() != null) {
                        throw new ProtocolViolationException("second terminal event for suite '" + suiteId + "'", event);
                    }
                    slots.put(suiteId, slot.withTerminal(event));
                } else {
                    slots.put(suiteId, slot.withEvent(event));
                }
            }
            flush(suiteId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attaches the gate that sorts the tests of a running suite. The suite is held
     * back after its terminal event until that gate is finished.
     */
    public void attachTestSortingGate(String suiteId, TestSortingGate gate) {
        lock.lock();
        try {
            SuiteSlot slot = slots.get(suiteId);
            if (slot == null) {
                throw new IllegalStateException("suite '" + suiteId + "' is not running");
            }
            if (slot.testGate() != null) {
                throw new IllegalStateException("suite '" + suiteId + "' already has a test sorting gate");
            }
            slots.put(suiteId, slot.withTestGate(gate));
            gate.setCompletionCallback(this::flushReady);
            flush(null);
        } finally {
            lock.unlock();
        }
    }

    public TestSortingGate createTestSortingGate(String suiteId, SuiteStructure structure) {
        TestSortingGate gate = TestSortingGate.forStructure(suiteId, suiteNameOf(suiteId), this, structure, timeout, timer);
        attachTestSortingGate(suiteId, gate);
        return gate;
    }

    public TestSortingGate createTestSortingGate(String suiteId, int testCount) {
        TestSortingGate gate = TestSortingGate.forTestCount(suiteId, suiteNameOf(suiteId), this, testCount, timeout, timer);
        attachTestSortingGate(suiteId, gate);
        return gate;
    }

    public TestSortingGate getTestSortingGate(String suiteId) {
        lock.lock();
        try {
            SuiteSlot slot = slots.get(suiteId);
            return slot == null ? null : slot.testGate();
        } finally {
            lock.unlock();
        }
    }

    public void flushReady() {
        lock.lock();
        try {
            flush(null);
        } finally {
            lock.unlock();
        }
    }

    public SlotState stateOf(String suiteId) {
        lock.lock();
        try {
            SuiteSlot slot = slots.get(suiteId);
            if (slot != null) {
                return slot.state();
            }
            return flushedSuites.contains(suiteId) ? SlotState.FLUSHED : null;
        } finally {
            lock.unlock();
        }
    }

    public int pendingSuiteCount() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes what is ready and stops the timer. Suites still pending are reported
     * in the log, their events are not delivered.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            flush(null);
            cancelTimeout();
            if (!slots.isEmpty()) {
                logger.warn("closing with {} suites not completed: {}", slots.size(), slots.keySet());
            }
        } finally {
            lock.unlock();
        }
        if (ownsTimer) {
            timer.shutdownNow();
        }
    }

    // ========== Flushing ==========

    private void flush(String touched) {
        Iterator<Map.Entry<String, SuiteSlot>> it = slots.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, SuiteSlot> entry = it.next();
            SuiteSlot slot = entry.getValue();
            if (!slot.buffered().isEmpty()) {
                List<RunEvent> buffered = slot.buffered();
                int delivered = 0;
                try {
                    for (RunEvent event : buffered) {
                        dispatch(event);
                        delivered++;
                    }
                } finally {
                    // a failing sink must not see the events before the failure twice
                    slot = slot.drained(delivered);
                    entry.setValue(slot);
                }
            }
            if (!slot.isReady()) {
                break;
            }
            if (slot.terminal() != null) {
                dispatch(slot.terminal());
            }
            it.remove();
            flushedSuites.add(slot.suiteId());
            parents.remove(slot.suiteId());
        }
        armTimeout(touched);
    }

    private void dispatch(RunEvent event) {
        try {
            sink.onEvent(event);
        } catch (RuntimeException e) {
            logger.error("listener failed on {} of suite '{}': {}", event.getType(), event.getSuiteName(), e.getMessage());
            throw e;
        }
    }

    private String suiteNameOf(String suiteId) {
        lock.lock();
        try {
            SuiteSlot slot = slots.get(suiteId);
            if (slot == null) {
                throw new IllegalStateException("suite '" + suiteId + "' is not running");
            }
            return slot.suiteName();
        } finally {
            lock.unlock();
        }
    }

    // ========== Timeout ==========

    private void armTimeout(String touched) {
        if (timer == null || timeout == null || timeout.isZero()) {
            return;
        }
        SuiteSlot head = slots.isEmpty() ? null : slots.values().iterator().next();
        if (head == null) {
            cancelTimeout();
            return;
        }
        if (head.isSubOrderingPending() && head.testGate().hasTimeout()) {
            // the test gate gives up on its own, the suite follows once it is finished
            cancelTimeout();
            return;
        }
        String headId = head.suiteId();
        if (pendingTimeout != null && headId.equals(armedSuiteId) && !isWithin(touched, headId)) {
            return;
        }
        cancelTimeout();
        armedSuiteId = headId;
        try {
            pendingTimeout = timer.schedule(() -> onTimeout(headId), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("sort timer is shut down, no timeout armed for suite {}: {}", headId, e.getMessage());
            pendingTimeout = null;
        }
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
        armedSuiteId = null;
    }

    private void onTimeout(String suiteId) {
        TestSortingGate gate;
        lock.lock();
        try {
            if (!isArmedHead(suiteId)) {
                return;
            }
            gate = slots.get(suiteId).testGate();
        } finally {
            lock.unlock();
        }
        // outside our lock: the test gate calls back into this gate while holding its own
        if (gate != null && !gate.isFinished()) {
            gate.forceFlush(timeout);
        }
        lock.lock();
        try {
            SuiteSlot slot = slots.get(suiteId);
            if (slot == null || !isHead(suiteId) || slot.isReady()) {
                return;
            }
            cancelTimeout();
            forcedSuites.add(suiteId);
            if (slot.terminal() == null) {
                SortingTimeoutException cause = new SortingTimeoutException("Timed out after " + timeout.toMillis()
                        + " ms waiting for suite '" + slot.suiteName() + "' to complete", timeout);
                logger.warn(cause.getMessage());
                Ordinal ordinal = lastOrdinal == null ? new Ordinal(0) : lastOrdinal.next();
                slot = slot.withTerminal(SuiteRunEvent.aborted(ordinal, suiteId, slot.suiteName(), cause, 0));
            } else {
                logger.warn("timed out after {} ms waiting for the tests of suite '{}'", timeout.toMillis(), slot.suiteName());
            }
            slots.put(suiteId, slot.asForced());
            flush(null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when the suite is the given one or nested in it. Nested suites are buffered
     * behind their parent, so their progress counts as progress of the parent.
     */
    private boolean isWithin(String suiteId, String ancestorId) {
        for (String id = suiteId; id != null; id = parents.get(id)) {
            if (id.equals(ancestorId)) {
                return true;
            }
        }
        return false;
    }

    private boolean isArmedHead(String suiteId) {
        return suiteId.equals(armedSuiteId) && isHead(suiteId);
    }

    private boolean isHead(String suiteId) {
        return !slots.isEmpty() && slots.keySet().iterator().next().equals(suiteId);
    }

}
