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

import io.herald.core.InfoRunEvent;
import io.herald.core.Ordinal;
import io.herald.core.ProtocolViolationException;
import io.herald.core.RunEvent;
import io.herald.core.RunListener;
import io.herald.core.ScopeRunEvent;
import io.herald.core.SortingTimeoutException;
import io.herald.core.TestRunEvent;
import io.herald.log.LogContext;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Puts the events of one suite's concurrently running tests back into order.
 * <p>
 * The order is either declared up front with a {@link SuiteStructure}, or discovered:
 * tests take the position in which they are announced with {@link #distributingTest(String)}
 * or, failing that, in which their TEST_STARTING arrives. Slots are released strictly from
 * the head: a test that has not finished holds back every test behind it, so tests written
 * one after the other are reported one after the other even though they ran in parallel.
 * <p>
 * A gate never decides on its own that a missing test is gone, unless a timeout is set.
 * With a timeout, a head slot that makes no progress for that long is forced out with a
 * synthetic TEST_FAILED carrying a {@link SortingTimeoutException}; events that show up
 * for it later are logged and dropped.
 * <p>
 * Thread safety: all mutations run under one lock per gate. Released events are passed
 * to the sink while the lock is held.
 */
public class TestSortingGate implements RunListener {

    private static final Logger logger = LogContext.SORT_LOGGER;

    private final String suiteId;
    private final String suiteName;
    private final RunListener sink;
    private final boolean declared;
    private final int expectedTests;
    private final Duration timeout;
    private final ScheduledExecutorService timer;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TestSlot> slots;
    private final Map<String, Integer> testIndex = new HashMap<>();
    private final Set<String> forcedTests = new HashSet<>();

    // index of the first slot not yet flushed
    private int head;
    private int flushedTests;
    private int discoveredTests;
    private boolean abandoned;
    private Ordinal lastOrdinal;
    private ScheduledFuture<?> pendingTimeout;
    private int armedIndex = -1;

    private volatile boolean finished;
    private volatile Runnable completionCallback;

    private TestSortingGate(String suiteId, String suiteName, RunListener sink, SuiteStructure structure,
                            int testCount, Duration timeout, ScheduledExecutorService timer) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is null");
        }
        this.suiteId = suiteId;
        this.suiteName = suiteName == null ? suiteId : suiteName;
        this.sink = sink;
        this.timeout = timeout;
        this.timer = timer;
        if (structure != null) {
            declared = true;
            slots = structure.linearize();
            int count = 0;
            for (int i = 0; i < slots.size(); i++) {
                TestSlot slot = slots.get(i);
                if (slot.isTest()) {
                    if (testIndex.put(slot.key(), i) != null) {
                        throw new IllegalArgumentException("duplicate test name in suite " + suiteId + ": " + slot.key());
                    }
                    count++;
                }
            }
            expectedTests = count;
            finished = slots.isEmpty();
        } else {
            if (testCount < 0) {
                throw new IllegalArgumentException("test count must not be negative: " + testCount);
            }
            declared = false;
            slots = new ArrayList<>();
            expectedTests = testCount;
            finished = testCount == 0;
        }
    }

    public static TestSortingGate forStructure(String suiteId, String suiteName, RunListener sink, SuiteStructure structure) {
        return forStructure(suiteId, suiteName, sink, structure, null, null);
    }

    public static TestSortingGate forStructure(String suiteId, String suiteName, RunListener sink, SuiteStructure structure,
                                               Duration timeout, ScheduledExecutorService timer) {
        if (structure == null) {
            throw new IllegalArgumentException("structure is null");
        }
        return new TestSortingGate(suiteId, suiteName, sink, structure, 0, timeout, timer);
    }

    public static TestSortingGate forTestCount(String suiteId, String suiteName, RunListener sink, int testCount) {
        return forTestCount(suiteId, suiteName, sink, testCount, null, null);
    }

    public static TestSortingGate forTestCount(String suiteId, String suiteName, RunListener sink, int testCount,
                                               Duration timeout, ScheduledExecutorService timer) {
        return new TestSortingGate(suiteId, suiteName, sink, null, testCount, timeout, timer);
    }

    @Override
    public void onEvent(RunEvent event) {
        recordEvent(event);
    }

    public void recordEvent(RunEvent event) {
        lock.lock();
        try {
            if (!Objects.equals(suiteId, event.getSuiteId())) {
                throw new ProtocolViolationException("event of suite '" + event.getSuiteId()
                        + "' sent to the test sorting gate of suite '" + suiteId + "'", event);
            }
            lastOrdinal = event.getOrdinal();
            int touched = handle(event);
            flush(touched);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserves the next position for a test about to be handed to another thread.
     * With a declared structure the position is already known and this only checks the name.
     */
    public void distributingTest(String testName) {
        lock.lock();
        try {
            if (declared) {
                if (!testIndex.containsKey(testName)) {
                    throw new ProtocolViolationException("test '" + testName + "' is not declared in suite '" + suiteId + "'", null);
                }
            } else {
                if (testIndex.containsKey(testName)) {
                    throw new ProtocolViolationException("test '" + testName + "' distributed twice in suite '" + suiteId + "'", null);
                }
                discover(testName, null);
            }
            flush(-1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases every slot at the head that is ready. Calling it again without new events
     * releases nothing.
     */
    public void flushReady() {
        lock.lock();
        try {
            flush(-1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives up on everything still pending: unfinished tests get a synthetic failure,
     * unmatched scopes and infos are skipped.
     *
     * @param waited how long the caller waited, reported in the failure message
     */
    public void forceFlush(Duration waited) {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            cancelTimeout();
            for (int i = head; i < slots.size(); i++) {
                TestSlot slot = slots.get(i);
                if (!slot.isReady()) {
                    slots.set(i, force(slot, waited));
                }
            }
            if (!declared && discoveredTests < expectedTests) {
                abandon(waited);
            }
            flush(-1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once every expected slot has been released. Does not take the gate's lock.
     */
    public boolean isFinished() {
        return finished;
    }

    public SlotState stateOf(String testName) {
        lock.lock();
        try {
            Integer idx = testIndex.get(testName);
            if (idx == null) {
                return null;
            }
            if (idx < head) {
                return SlotState.FLUSHED;
            }
            return slots.get(idx).isReady() ? SlotState.READY : SlotState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    public String getSuiteId() {
        return suiteId;
    }

    public int getExpectedTestCount() {
        return expectedTests;
    }

    public boolean isDeclared() {
        return declared;
    }

    boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && timer != null;
    }

    public int getPendingSlotCount() {
        lock.lock();
        try {
            return slots.size() - head;
        } finally {
            lock.unlock();
        }
    }

    void setCompletionCallback(Runnable callback) {
        this.completionCallback = callback;
    }

    // ========== Event handling ==========

    private int handle(RunEvent event) {
        switch (event.getType()) {
            case TEST_STARTING:
                return handleStart(event);
            case TEST_IGNORED:
                return handleIgnored(event);
            case TEST_SUCCEEDED:
            case TEST_FAILED:
            case TEST_PENDING:
            case TEST_CANCELED:
                return handleTerminal(event);
            case INFO_PROVIDED:
            case MARKUP_PROVIDED:
                if (event.getTestName() != null) {
                    return handleTestInfo(event);
                }
                return handleFree(TestSlot.Kind.INFO, ((InfoRunEvent) event).message(), event);
            case SCOPE_OPENED:
                return handleFree(TestSlot.Kind.SCOPE_OPENED, ((ScopeRunEvent) event).message(), event);
            case SCOPE_CLOSED:
                return handleFree(TestSlot.Kind.SCOPE_CLOSED, ((ScopeRunEvent) event).message(), event);
            default:
                throw new ProtocolViolationException("suite event sent to the test sorting gate of suite '" + suiteId + "'", event);
        }
    }

    private int handleStart(RunEvent event) {
        String name = event.getTestName();
        if (isLate(name, event)) {
            return -1;
        }
        int idx = lookupOrDiscover(name, event);
        TestSlot slot = slots.get(idx);
        if (slot.start() != null || slot.terminal() != null) {
            throw new ProtocolViolationException("test '" + name + "' started twice in suite '" + suiteId + "'", event);
        }
        slots.set(idx, slot.withStart(event));
        return idx;
    }

    private int handleIgnored(RunEvent event) {
        String name = event.getTestName();
        if (isLate(name, event)) {
            return -1;
        }
        int idx = lookupOrDiscover(name, event);
        TestSlot slot = slots.get(idx);
        if (slot.start() != null || slot.terminal() != null) {
            throw new ProtocolViolationException("test '" + name + "' ignored after it was reported in suite '" + suiteId + "'", event);
        }
        slots.set(idx, slot.withTerminal(event));
        return idx;
    }

    private int handleTerminal(RunEvent event) {
        String name = event.getTestName();
        if (isLate(name, event)) {
            return -1;
        }
        TestSlot slot = requireOpenTest(name, event);
        int idx = testIndex.get(name);
        if (slot.start() == null) {
            throw new ProtocolViolationException("terminal event for test '" + name + "' that never started", event);
        }
        if (slot.terminal() != null) {
            throw new ProtocolViolationException("second terminal event for test '" + name + "'", event);
        }
        slots.set(idx, slot.withTerminal(event));
        return idx;
    }

    private int handleTestInfo(RunEvent event) {
        String name = event.getTestName();
        if (isLate(name, event)) {
            return -1;
        }
        TestSlot slot = requireOpenTest(name, event);
        int idx = testIndex.get(name);
        slots.set(idx, slot.withInfo(event));
        return idx;
    }

    private int handleFree(TestSlot.Kind kind, String message, RunEvent event) {
        if (!declared) {
            slots.add(TestSlot.matched(kind, event));
            return slots.size() - 1;
        }
        for (int i = head; i < slots.size(); i++) {
            TestSlot slot = slots.get(i);
            if (slot.kind() == kind && !slot.isMatched() && !slot.forced() && Objects.equals(slot.key(), message)) {
                slots.set(i, slot.withStart(event));
                return i;
            }
        }
        // not part of the declared structure, nothing to hold it back for
        logger.debug("no declared {} slot for '{}' in suite {}, passing it through", kind, message, suiteId);
        sink.onEvent(event);
        return -1;
    }

    private boolean isLate(String testName, RunEvent event) {
        if (forcedTests.contains(testName) || (abandoned && !testIndex.containsKey(testName))) {
            logger.warn("dropping {} for test '{}' of suite '{}': the test was already reported as timed out",
                    event.getType(), testName, suiteName);
            return true;
        }
        return false;
    }

    private int lookupOrDiscover(String testName, RunEvent event) {
        Integer idx = testIndex.get(testName);
        if (idx == null) {
            if (declared) {
                throw new ProtocolViolationException("test '" + testName + "' is not declared in suite '" + suiteId + "'", event);
            }
            return discover(testName, event);
        }
        if (idx < head) {
            throw new ProtocolViolationException("test '" + testName + "' was already reported", event);
        }
        return idx;
    }

    private TestSlot requireOpenTest(String testName, RunEvent event) {
        Integer idx = testIndex.get(testName);
        if (idx == null) {
            throw new ProtocolViolationException("event for test '" + testName + "' that never started", event);
        }
        if (idx < head) {
            throw new ProtocolViolationException("event for test '" + testName + "' after it was reported", event);
        }
        return slots.get(idx);
    }

    private int discover(String testName, RunEvent event) {
        if (discoveredTests >= expectedTests) {
            throw new ProtocolViolationException("suite '" + suiteId + "' expected " + expectedTests
                    + " tests but test '" + testName + "' is one more", event);
        }
        slots.add(TestSlot.test(testName));
        int idx = slots.size() - 1;
        testIndex.put(testName, idx);
        discoveredTests++;
        return idx;
    }

    // ========== Flushing ==========

    private void flush(int touched) {
        while (head < slots.size()) {
            TestSlot slot = slots.get(head);
            if (!slot.isReady()) {
                break;
            }
            slots.set(head, null);
            head++;
            if (slot.isTest()) {
                flushedTests++;
            }
            for (RunEvent event : slot.toDispatch()) {
                sink.onEvent(event);
            }
        }
        boolean done = head == slots.size() && (declared || flushedTests >= expectedTests || abandoned);
        if (done && !finished) {
            finished = true;
            cancelTimeout();
            Runnable callback = completionCallback;
            if (callback != null) {
                callback.run();
            }
        } else if (!done) {
            armTimeout(touched);
        }
    }

    // ========== Timeout ==========

    private void armTimeout(int touched) {
        if (!hasTimeout()) {
            return;
        }
        // head == slots.size() means waiting for a test that was never announced
        int blocking = head;
        if (pendingTimeout != null && armedIndex == blocking && touched != blocking) {
            return;
        }
        cancelTimeout();
        armedIndex = blocking;
        try {
            pendingTimeout = timer.schedule(() -> onTimeout(blocking), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("sort timer is shut down, no timeout armed for suite {}: {}", suiteId, e.getMessage());
            pendingTimeout = null;
        }
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
        armedIndex = -1;
    }

    private void onTimeout(int index) {
        lock.lock();
        try {
            if (finished || index != head || armedIndex != index) {
                return;
            }
            pendingTimeout = null;
            armedIndex = -1;
            if (head < slots.size()) {
                slots.set(head, force(slots.get(head), timeout));
            } else {
                abandon(timeout);
            }
            flush(-1);
        } finally {
            lock.unlock();
        }
    }

    private TestSlot force(TestSlot slot, Duration waited) {
        long millis = waited == null ? 0 : waited.toMillis();
        if (!slot.isTest()) {
            logger.warn("timed out after {} ms waiting for {} '{}' in suite '{}', skipping it",
                    millis, slot.kind(), slot.key(), suiteName);
            return slot.asForced();
        }
        String testName = slot.key();
        forcedTests.add(testName);
        if (slot.terminal() != null) {
            logger.warn("timed out after {} ms waiting for info events of test '{}' in suite '{}', got {}",
                    millis, testName, suiteName, slot.infos().size());
            return slot.asForced();
        }
        SortingTimeoutException cause = new SortingTimeoutException("Timed out after " + millis
                + " ms waiting for test '" + testName + "' of suite '" + suiteName + "' to complete", waited);
        logger.warn(cause.getMessage());
        RunEvent start = slot.start();
        if (start == null) {
            start = TestRunEvent.starting(syntheticOrdinal(), suiteId, suiteName, testName);
        }
        RunEvent failed = TestRunEvent.failed(start.getOrdinal().next(), suiteId, suiteName, testName,
                cause, slot.infos().size(), 0);
        return slot.withStart(start).withTerminal(failed).asForced();
    }

    private void abandon(Duration waited) {
        long millis = waited == null ? 0 : waited.toMillis();
        logger.warn("timed out after {} ms waiting for {} of {} tests of suite '{}' to start",
                millis, expectedTests - discoveredTests, expectedTests, suiteName);
        abandoned = true;
    }

    private Ordinal syntheticOrdinal() {
        return lastOrdinal == null ? new Ordinal(0) : lastOrdinal.next();
    }

}
