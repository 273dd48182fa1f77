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

import io.herald.core.InfoRunEvent;
import io.herald.core.Ordinal;
import io.herald.core.ProtocolViolationException;
import io.herald.core.RunListener;
import io.herald.core.RunStoppedException;
import io.herald.core.TestCanceledException;
import io.herald.core.TestPendingException;
import io.herald.core.TestRunEvent;
import io.herald.core.Tracker;
import io.herald.log.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one test and reports it, also the {@link TestContext} the test body sees.
 */
class TestRunner implements Work, TestContext {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestUnit unit;
    private final String testName;
    private final Tracker tracker;
    private final RunListener listener;
    private final SuiteContext suite;
    private final AtomicInteger infoCount = new AtomicInteger();

    TestRunner(TestUnit unit, Tracker tracker, RunListener listener, SuiteContext suite) {
        this.unit = unit;
        this.testName = unit.getName();
        this.tracker = tracker;
        this.listener = listener;
        this.suite = suite;
    }

    @Override
    public void run() {
        String suiteId = suite.getSuiteId();
        String suiteName = suite.getSuiteName();
        if (unit.isIgnored()) {
            listener.onEvent(TestRunEvent.ignored(tracker.nextOrdinal(), suiteId, suiteName, testName));
            return;
        }
        if (suite.isStopRequested()) {
            skip(new RunStoppedException("run stopped before test '" + testName + "' started"));
            return;
        }
        listener.onEvent(TestRunEvent.starting(tracker.nextOrdinal(), suiteId, suiteName, testName));
        long start = System.currentTimeMillis();
        Throwable error = null;
        boolean pending = false;
        boolean canceled = false;
        try {
            unit.run(this);
        } catch (ProtocolViolationException e) {
            throw e;
        } catch (TestPendingException e) {
            pending = true;
        } catch (TestCanceledException e) {
            canceled = true;
            error = e;
        } catch (Throwable t) {
            error = t;
        }
        long duration = System.currentTimeMillis() - start;
        Ordinal ordinal = tracker.nextOrdinal();
        int infos = infoCount.get();
        TestRunEvent terminal;
        if (pending) {
            terminal = TestRunEvent.pending(ordinal, suiteId, suiteName, testName, infos, duration);
        } else if (canceled) {
            terminal = TestRunEvent.canceled(ordinal, suiteId, suiteName, testName, error, infos, duration);
        } else if (error != null) {
            logger.debug("test '{}' of suite {} failed: {}", testName, suiteId, error.getMessage());
            terminal = TestRunEvent.failed(ordinal, suiteId, suiteName, testName, error, infos, duration);
        } else {
            terminal = TestRunEvent.succeeded(ordinal, suiteId, suiteName, testName, infos, duration);
        }
        listener.onEvent(terminal);
    }

    @Override
    public void skip(Throwable reason) {
        String suiteId = suite.getSuiteId();
        String suiteName = suite.getSuiteName();
        if (unit.isIgnored()) {
            listener.onEvent(TestRunEvent.ignored(tracker.nextOrdinal(), suiteId, suiteName, testName));
            return;
        }
        listener.onEvent(TestRunEvent.starting(tracker.nextOrdinal(), suiteId, suiteName, testName));
        listener.onEvent(TestRunEvent.canceled(tracker.nextOrdinal(), suiteId, suiteName, testName, reason, 0, 0));
    }

    @Override
    public String getName() {
        return "test '" + testName + "' of suite '" + suite.getSuiteId() + "'";
    }

    // ========== TestContext ==========

    @Override
    public String getSuiteId() {
        return suite.getSuiteId();
    }

    @Override
    public String getTestName() {
        return testName;
    }

    @Override
    public void info(String message) {
        infoCount.incrementAndGet();
        listener.onEvent(InfoRunEvent.info(tracker.nextOrdinal(), suite.getSuiteId(), suite.getSuiteName(), testName, message));
    }

    @Override
    public void markup(String text) {
        infoCount.incrementAndGet();
        listener.onEvent(InfoRunEvent.markup(tracker.nextOrdinal(), suite.getSuiteId(), suite.getSuiteName(), testName, text));
    }

    @Override
    public boolean isStopRequested() {
        return suite.isStopRequested();
    }

    @Override
    public String toString() {
        return testName;
    }

}
