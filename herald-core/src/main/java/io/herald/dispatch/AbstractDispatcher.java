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

import io.herald.core.RunListener;
import io.herald.core.Tracker;
import io.herald.log.LogContext;
import io.herald.sort.SuiteSortingGate;
import org.slf4j.Logger;

/**
 * What the concurrent and sequential dispatchers share, and the hooks running suites
 * use to hand out their tests and nested suites.
 */
abstract class AbstractDispatcher implements Dispatcher {

    protected static final Logger logger = LogContext.RUNTIME_LOGGER;

    protected final Tracker tracker;
    protected final Stopper stopper;
    protected final String parentSuiteId;

    AbstractDispatcher(Tracker tracker, Stopper stopper, String parentSuiteId) {
        if (tracker == null) {
            throw new IllegalArgumentException("tracker is null");
        }
        this.tracker = tracker;
        this.stopper = stopper == null ? new Stopper() : stopper;
        this.parentSuiteId = parentSuiteId;
    }

    @Override
    public DispatchHandle submit(SuiteUnit unit) {
        return submit(unit, tracker.nextTracker());
    }

    @Override
    public DispatchHandle submit(SuiteUnit unit, Tracker suiteTracker) {
        SuiteRunner runner = new SuiteRunner(unit, suiteTracker, this, parentSuiteId);
        runner.start();
        return execute(runner);
    }

    @Override
    public void requestStop() {
        if (stopper.requestStop()) {
            logger.info("stop requested, suites and tests not yet started will be skipped");
        }
    }

    @Override
    public boolean isStopRequested() {
        return stopper.isStopRequested();
    }

    @Override
    public Dispatcher newScope() {
        return scope(tracker, parentSuiteId);
    }

    /**
     * Runs the work now or schedules it, the handle tells which.
     */
    abstract DispatchHandle execute(Work work);

    abstract AbstractDispatcher scope(Tracker tracker, String parentSuiteId);

    /**
     * Where suite events go: the suite gate, or the user listener when nothing is sorted.
     */
    abstract RunListener getSuiteListener();

    /**
     * The suite gate test gates are attached to, null when tests run inline.
     */
    abstract SuiteSortingGate getTestGateOwner();

}
