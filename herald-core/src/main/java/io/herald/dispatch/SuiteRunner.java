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
import io.herald.core.InfoRunEvent;
import io.herald.core.ProtocolViolationException;
import io.herald.core.RunListener;
import io.herald.core.ScopeRunEvent;
import io.herald.core.SuiteRunEvent;
import io.herald.core.Tracker;
import io.herald.log.LogContext;
import io.herald.sort.SuiteSortingGate;
import io.herald.sort.SuiteStructure;
import io.herald.sort.TestSortingGate;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one suite: reports its start, runs the body, reports its end. Also the
 * {@link SuiteContext} the body sees.
 */
class SuiteRunner implements Work, SuiteContext {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final SuiteUnit unit;
    private final String suiteId;
    private final String suiteName;
    private final Tracker tracker;
    private final AbstractDispatcher dispatcher;
    private final String parentSuiteId;
    private final RunListener listener;

    private long startTime;
    private boolean testsStarted;
    private volatile TestSortingGate testGate;

    SuiteRunner(SuiteUnit unit, Tracker tracker, AbstractDispatcher dispatcher, String parentSuiteId) {
        this.unit = unit;
        this.suiteId = unit.getSuiteId();
        this.suiteName = unit.getSuiteName() == null ? suiteId : unit.getSuiteName();
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.parentSuiteId = parentSuiteId;
        this.listener = dispatcher.getSuiteListener();
    }

    /**
     * Reports SUITE_STARTING, on the submitting thread.
     */
    void start() {
        startTime = System.currentTimeMillis();
        listener.onEvent(SuiteRunEvent.starting(tracker.nextOrdinal(), suiteId, suiteName, parentSuiteId));
    }

    @Override
    public void run() {
        logger.debug("running suite: {}", suiteId);
        Throwable error = null;
        try {
            unit.run(this);
        } catch (ProtocolViolationException e) {
            throw e;
        } catch (Throwable t) {
            logger.debug("suite {} aborted: {}", suiteId, t.getMessage());
            error = t;
        }
        long duration = System.currentTimeMillis() - startTime;
        if (error == null) {
            listener.onEvent(SuiteRunEvent.completed(tracker.nextOrdinal(), suiteId, suiteName, duration));
        } else {
            listener.onEvent(SuiteRunEvent.aborted(tracker.nextOrdinal(), suiteId, suiteName, error, duration));
        }
    }

    @Override
    public void skip(Throwable reason) {
        logger.debug("skipping suite {}: {}", suiteId, reason.getMessage());
        listener.onEvent(SuiteRunEvent.aborted(tracker.nextOrdinal(), suiteId, suiteName, reason, 0));
    }

    @Override
    public String getName() {
        return "suite '" + suiteId + "'";
    }

    // ========== SuiteContext ==========

    @Override
    public String getSuiteId() {
        return suiteId;
    }

    @Override
    public String getSuiteName() {
        return suiteName;
    }

    @Override
    public Tracker getTracker() {
        return tracker;
    }

    @Override
    public RunListener getListener() {
        return listener;
    }

    @Override
    public boolean isStopRequested() {
        return dispatcher.isStopRequested();
    }

    @Override
    public void info(String message) {
        freeEventListener().onEvent(InfoRunEvent.info(tracker.nextOrdinal(), suiteId, suiteName, null, message));
    }

    @Override
    public void markup(String text) {
        freeEventListener().onEvent(InfoRunEvent.markup(tracker.nextOrdinal(), suiteId, suiteName, null, text));
    }

    @Override
    public void openScope(String message) {
        freeEventListener().onEvent(ScopeRunEvent.opened(tracker.nextOrdinal(), suiteId, suiteName, message));
    }

    @Override
    public void closeScope(String message) {
        freeEventListener().onEvent(ScopeRunEvent.closed(tracker.nextOrdinal(), suiteId, suiteName, message));
    }

    @Override
    public void runTests(List<TestUnit> tests) {
        startTests(null, tests, true);
    }

    @Override
    public void runTests(SuiteStructure structure, List<TestUnit> tests) {
        startTests(structure, tests, true);
    }

    @Override
    public void distributeTests(List<TestUnit> tests) {
        startTests(null, tests, false);
    }

    @Override
    public void distributeTests(SuiteStructure structure, List<TestUnit> tests) {
        startTests(structure, tests, false);
    }

    @Override
    public void runNestedSuites(List<SuiteUnit> suites) {
        AbstractDispatcher scope = dispatcher.scope(tracker, suiteId);
        for (SuiteUnit suite : suites) {
            scope.submit(suite);
        }
        scope.awaitAll();
    }

    // ========== Tests ==========

    /**
     * Scope and info events go through the test gate while it is sorting, so they keep
     * their place between the tests.
     */
    private RunListener freeEventListener() {
        TestSortingGate gate = testGate;
        return gate == null || gate.isFinished() ? listener : gate;
    }

    private void startTests(SuiteStructure structure, List<TestUnit> tests, boolean wait) {
        if (testsStarted) {
            throw new IllegalStateException("tests of suite '" + suiteId + "' were already started");
        }
        testsStarted = true;
        Map<String, TestUnit> byName = new LinkedHashMap<>();
        for (TestUnit test : tests) {
            if (byName.put(test.getName(), test) != null) {
                throw new IllegalArgumentException("duplicate test name in suite '" + suiteId + "': " + test.getName());
            }
        }
        boolean declared = structure != null;
        if (declared) {
            List<String> names = structure.getTestNames();
            if (names.size() != byName.size() || !byName.keySet().containsAll(names)) {
                throw new IllegalArgumentException("tests of suite '" + suiteId + "' do not match its structure: "
                        + byName.keySet() + " vs " + names);
            }
        } else {
            structure = SuiteStructure.ofTests(List.copyOf(byName.keySet()));
        }
        SuiteSortingGate owner = dispatcher.getTestGateOwner();
        if (owner == null) {
            walk(structure.getNodes(), byName, null, null);
            return;
        }
        TestSortingGate gate = declared
                ? owner.createTestSortingGate(suiteId, structure)
                : owner.createTestSortingGate(suiteId, byName.size());
        testGate = gate;
        AbstractDispatcher scope = dispatcher.scope(tracker, suiteId);
        try {
            walk(structure.getNodes(), byName, gate, scope);
        } catch (DispatchException e) {
            // tests that could not be scheduled will never report, stop waiting for them
            gate.forceFlush(Duration.ZERO);
            throw e;
        }
        if (wait) {
            scope.awaitAll();
        }
    }

    private void walk(List<SuiteStructure.Node> nodes, Map<String, TestUnit> byName,
                      TestSortingGate gate, AbstractDispatcher scope) {
        RunListener target = gate == null ? listener : gate;
        for (SuiteStructure.Node node : nodes) {
            if (node instanceof SuiteStructure.TestLeaf leaf) {
                TestUnit test = byName.get(leaf.testName());
                if (gate == null) {
                    new TestRunner(test, tracker.nextTracker(), listener, this).run();
                } else {
                    if (!gate.isDeclared()) {
                        gate.distributingTest(test.getName());
                    }
                    scope.execute(new TestRunner(test, tracker.nextTracker(), gate, this));
                }
            } else if (node instanceof SuiteStructure.InfoLeaf leaf) {
                target.onEvent(InfoRunEvent.info(tracker.nextOrdinal(), suiteId, suiteName, null, leaf.message()));
            } else if (node instanceof SuiteStructure.ScopeBranch branch) {
                target.onEvent(ScopeRunEvent.opened(tracker.nextOrdinal(), suiteId, suiteName, branch.message()));
                walk(branch.children(), byName, gate, scope);
                target.onEvent(ScopeRunEvent.closed(tracker.nextOrdinal(), suiteId, suiteName, branch.message()));
            }
        }
    }

    @Override
    public String toString() {
        return suiteId;
    }

}
