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
import io.herald.core.ProtocolViolationException;
import io.herald.core.RecordingListener;
import io.herald.core.RunEvent;
import io.herald.core.RunEventType;
import io.herald.core.ScopeRunEvent;
import io.herald.core.SortingTimeoutException;
import io.herald.core.SuiteRunEvent;
import io.herald.core.TestRunEvent;
import io.herald.core.Tracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TestSortingGateTest {

    private static final String SUITE = "calc";

    private RecordingListener sink;
    private Tracker tracker;
    private ScheduledExecutorService timer;

    @BeforeEach
    void beforeEach() {
        sink = new RecordingListener();
        tracker = new Tracker();
        timer = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void afterEach() {
        timer.shutdownNow();
    }

    private RunEvent start(String test) {
        return TestRunEvent.starting(tracker.nextOrdinal(), SUITE, "Calc", test);
    }

    private RunEvent succeeded(String test) {
        return succeeded(test, 0);
    }

    private RunEvent succeeded(String test, int infos) {
        return TestRunEvent.succeeded(tracker.nextOrdinal(), SUITE, "Calc", test, infos, 1);
    }

    private RunEvent info(String test, String message) {
        return InfoRunEvent.info(tracker.nextOrdinal(), SUITE, "Calc", test, message);
    }

    @Test
    void testDeclaredOrderRestored() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add", "sub", "mul"));
        gate.recordEvent(start("mul"));
        gate.recordEvent(succeeded("mul"));
        gate.recordEvent(start("sub"));
        gate.recordEvent(succeeded("sub"));
        assertEquals(0, sink.size());
        assertFalse(gate.isFinished());
        gate.recordEvent(start("add"));
        gate.recordEvent(succeeded("add"));
        assertEquals(List.of(
                "TEST_STARTING:calc/add", "TEST_SUCCEEDED:calc/add",
                "TEST_STARTING:calc/sub", "TEST_SUCCEEDED:calc/sub",
                "TEST_STARTING:calc/mul", "TEST_SUCCEEDED:calc/mul"), sink.describe());
        assertTrue(gate.isFinished());
    }

    @Test
    void testHeadBlocksUntilTerminal() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add", "sub"));
        gate.recordEvent(start("add"));
        gate.recordEvent(start("sub"));
        gate.recordEvent(succeeded("sub"));
        assertEquals(0, sink.size());
        assertEquals(SlotState.OPEN, gate.stateOf("add"));
        assertEquals(SlotState.READY, gate.stateOf("sub"));
        gate.recordEvent(succeeded("add"));
        assertEquals(4, sink.size());
        assertEquals(SlotState.FLUSHED, gate.stateOf("add"));
        assertEquals(SlotState.FLUSHED, gate.stateOf("sub"));
        assertNull(gate.stateOf("div"));
    }

    @Test
    void testFlushReadyIsIdempotent() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add", "sub"));
        gate.recordEvent(start("add"));
        gate.recordEvent(succeeded("add"));
        assertEquals(2, sink.size());
        gate.flushReady();
        gate.flushReady();
        assertEquals(2, sink.size());
    }

    @Test
    void testInfoEventsHeldUntilCountReached() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add"));
        gate.recordEvent(start("add"));
        gate.recordEvent(succeeded("add", 2));
        assertEquals(0, sink.size());
        gate.recordEvent(info("add", "one"));
        assertEquals(0, sink.size());
        gate.recordEvent(info("add", "two"));
        assertEquals(List.of(
                "TEST_STARTING:calc/add", "INFO_PROVIDED:calc/add", "INFO_PROVIDED:calc/add",
                "TEST_SUCCEEDED:calc/add"), sink.describe());
        assertTrue(gate.isFinished());
    }

    @Test
    void testIgnoredTestIsStartAndEnd() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add", "sub"));
        gate.recordEvent(TestRunEvent.ignored(tracker.nextOrdinal(), SUITE, "Calc", "add"));
        gate.recordEvent(start("sub"));
        gate.recordEvent(succeeded("sub"));
        assertEquals(List.of("TEST_IGNORED:calc/add", "TEST_STARTING:calc/sub", "TEST_SUCCEEDED:calc/sub"), sink.describe());
    }

    @Test
    void testScopesAndInfoLeavesKeepTheirPlace() {
        SuiteStructure structure = SuiteStructure.of(
                SuiteStructure.scope("A stack",
                        SuiteStructure.test("pop"),
                        SuiteStructure.test("push")),
                SuiteStructure.info("done"));
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, structure);
        gate.recordEvent(ScopeRunEvent.opened(tracker.nextOrdinal(), SUITE, "Calc", "A stack"));
        gate.recordEvent(start("push"));
        gate.recordEvent(succeeded("push"));
        gate.recordEvent(ScopeRunEvent.closed(tracker.nextOrdinal(), SUITE, "Calc", "A stack"));
        gate.recordEvent(info(null, "done"));
        assertEquals(List.of("SCOPE_OPENED:calc/A stack"), sink.describe());
        gate.recordEvent(start("pop"));
        gate.recordEvent(succeeded("pop"));
        assertEquals(List.of(
                "SCOPE_OPENED:calc/A stack",
                "TEST_STARTING:calc/pop", "TEST_SUCCEEDED:calc/pop",
                "TEST_STARTING:calc/push", "TEST_SUCCEEDED:calc/push",
                "SCOPE_CLOSED:calc/A stack",
                "INFO_PROVIDED:calc/done"), sink.describe());
        assertTrue(gate.isFinished());
    }

    @Test
    void testUndeclaredInfoPassesThrough() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add"));
        gate.recordEvent(info(null, "not declared"));
        assertEquals(List.of("INFO_PROVIDED:calc/not declared"), sink.describe());
        assertFalse(gate.isFinished());
    }

    @Test
    void testDiscoveryOrderFollowsDistribution() {
        TestSortingGate gate = TestSortingGate.forTestCount(SUITE, "Calc", sink, 3);
        gate.distributingTest("x");
        gate.distributingTest("y");
        gate.distributingTest("z");
        gate.recordEvent(start("z"));
        gate.recordEvent(succeeded("z"));
        gate.recordEvent(start("y"));
        gate.recordEvent(succeeded("y"));
        gate.recordEvent(start("x"));
        assertEquals(0, sink.size());
        gate.recordEvent(succeeded("x"));
        assertEquals(List.of(
                "TEST_STARTING:calc/x", "TEST_SUCCEEDED:calc/x",
                "TEST_STARTING:calc/y", "TEST_SUCCEEDED:calc/y",
                "TEST_STARTING:calc/z", "TEST_SUCCEEDED:calc/z"), sink.describe());
        assertTrue(gate.isFinished());
    }

    @Test
    void testDiscoveryByArrival() {
        TestSortingGate gate = TestSortingGate.forTestCount(SUITE, "Calc", sink, 2);
        gate.recordEvent(start("b"));
        gate.recordEvent(start("a"));
        gate.recordEvent(succeeded("a"));
        assertEquals(0, sink.size());
        gate.recordEvent(succeeded("b"));
        assertEquals(List.of(
                "TEST_STARTING:calc/b", "TEST_SUCCEEDED:calc/b",
                "TEST_STARTING:calc/a", "TEST_SUCCEEDED:calc/a"), sink.describe());
        assertTrue(gate.isFinished());
    }

    @Test
    void testNotFinishedUntilAllExpectedTestsFlushed() {
        TestSortingGate gate = TestSortingGate.forTestCount(SUITE, "Calc", sink, 2);
        gate.recordEvent(start("a"));
        gate.recordEvent(succeeded("a"));
        assertEquals(2, sink.size());
        assertFalse(gate.isFinished());
        assertEquals(2, gate.getExpectedTestCount());
    }

    @Test
    void testEmptyGateIsFinished() {
        assertTrue(TestSortingGate.forTestCount(SUITE, "Calc", sink, 0).isFinished());
        assertTrue(TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests()).isFinished());
    }

    @Test
    void testCompletionCallbackRunsOnce() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add"));
        AtomicInteger calls = new AtomicInteger();
        gate.setCompletionCallback(calls::incrementAndGet);
        gate.recordEvent(start("add"));
        assertEquals(0, calls.get());
        gate.recordEvent(succeeded("add"));
        gate.flushReady();
        assertEquals(1, calls.get());
    }

    @Test
    void testProtocolViolations() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("add", "sub"));
        gate.recordEvent(start("add"));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(start("add")));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(succeeded("sub")));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(start("div")));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(info("mul", "?")));
        assertThrows(ProtocolViolationException.class,
                () -> gate.recordEvent(TestRunEvent.starting(tracker.nextOrdinal(), "other", "Other", "add")));
        assertThrows(ProtocolViolationException.class,
                () -> gate.recordEvent(SuiteRunEvent.completed(tracker.nextOrdinal(), SUITE, "Calc", 1)));
        gate.recordEvent(succeeded("add"));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(succeeded("add")));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(start("add")));
    }

    @Test
    void testTooManyTestsInDiscoveryMode() {
        TestSortingGate gate = TestSortingGate.forTestCount(SUITE, "Calc", sink, 1);
        gate.distributingTest("a");
        assertThrows(ProtocolViolationException.class, () -> gate.distributingTest("a"));
        assertThrows(ProtocolViolationException.class, () -> gate.recordEvent(start("b")));
    }

    @Test
    void testDuplicateDeclaredTestRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("a", "a")));
    }

    @Test
    void testTimeoutForcesBlockingTest() throws Exception {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink,
                SuiteStructure.ofTests("slow", "fast"), Duration.ofMillis(100), timer);
        CountDownLatch finished = new CountDownLatch(1);
        gate.setCompletionCallback(finished::countDown);
        gate.recordEvent(start("slow"));
        gate.recordEvent(start("fast"));
        gate.recordEvent(succeeded("fast"));
        assertEquals(0, sink.size());
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        List<RunEvent> events = sink.getEvents();
        assertEquals(List.of(
                "TEST_STARTING:calc/slow", "TEST_FAILED:calc/slow",
                "TEST_STARTING:calc/fast", "TEST_SUCCEEDED:calc/fast"), sink.describe());
        TestRunEvent failed = (TestRunEvent) events.get(1);
        assertInstanceOf(SortingTimeoutException.class, failed.error());
        assertTrue(events.get(0).getOrdinal().compareTo(failed.getOrdinal()) < 0);
        // the real outcome shows up late and is dropped
        gate.recordEvent(succeeded("slow"));
        assertEquals(4, sink.size());
        assertTrue(gate.isFinished());
    }

    @Test
    void testTimeoutSynthesizesMissingStart() throws Exception {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink,
                SuiteStructure.ofTests("never"), Duration.ofMillis(50), timer);
        CountDownLatch finished = new CountDownLatch(1);
        gate.setCompletionCallback(finished::countDown);
        gate.flushReady();
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        List<RunEvent> events = sink.getEvents();
        assertEquals(2, events.size());
        assertEquals(RunEventType.TEST_STARTING, events.get(0).getType());
        assertEquals(RunEventType.TEST_FAILED, events.get(1).getType());
        gate.recordEvent(start("never"));
        assertEquals(2, sink.size());
    }

    @Test
    void testTimeoutWhileWaitingForDiscovery() throws Exception {
        TestSortingGate gate = TestSortingGate.forTestCount(SUITE, "Calc", sink, 2, Duration.ofMillis(50), timer);
        CountDownLatch finished = new CountDownLatch(1);
        gate.setCompletionCallback(finished::countDown);
        gate.recordEvent(start("a"));
        gate.recordEvent(succeeded("a"));
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(2, sink.size());
        // the test that never announced itself is dropped when it finally does
        gate.recordEvent(start("b"));
        assertEquals(2, sink.size());
    }

    @Test
    void testProgressPostponesTimeout() throws Exception {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink,
                SuiteStructure.ofTests("a", "b"), Duration.ofMillis(500), timer);
        gate.recordEvent(start("a"));
        gate.recordEvent(succeeded("a"));
        Thread.sleep(300);
        gate.recordEvent(start("b"));
        Thread.sleep(300);
        gate.recordEvent(succeeded("b"));
        assertEquals(List.of(
                "TEST_STARTING:calc/a", "TEST_SUCCEEDED:calc/a",
                "TEST_STARTING:calc/b", "TEST_SUCCEEDED:calc/b"), sink.describe());
    }

    @Test
    void testForceFlush() {
        TestSortingGate gate = TestSortingGate.forStructure(SUITE, "Calc", sink, SuiteStructure.ofTests("a", "b"));
        gate.recordEvent(start("b"));
        gate.recordEvent(succeeded("b"));
        gate.forceFlush(Duration.ofSeconds(1));
        assertTrue(gate.isFinished());
        assertEquals(List.of(
                "TEST_STARTING:calc/a", "TEST_FAILED:calc/a",
                "TEST_STARTING:calc/b", "TEST_SUCCEEDED:calc/b"), sink.describe());
        assertEquals(0, gate.getPendingSlotCount());
    }

}
