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
import io.herald.core.RunStoppedException;
import io.herald.core.Tracker;
import io.herald.sort.SuiteSortingGate;

/**
 * Runs every suite and test inline on the calling thread. Events are already in order,
 * so they go straight to the listener and no gates are involved.
 */
public class SequentialDispatcher extends AbstractDispatcher {

    private final RunListener listener;

    public SequentialDispatcher(RunListener listener) {
        this(listener, new Tracker(), new Stopper());
    }

    public SequentialDispatcher(RunListener listener, Tracker tracker, Stopper stopper) {
        this(listener, tracker, stopper, null);
    }

    private SequentialDispatcher(RunListener listener, Tracker tracker, Stopper stopper, String parentSuiteId) {
        super(tracker, stopper, parentSuiteId);
        if (listener == null) {
            throw new IllegalArgumentException("listener is null");
        }
        this.listener = listener;
    }

    @Override
    public void awaitAll() {
        // everything already ran in submit
    }

    @Override
    public boolean isConcurrent() {
        return false;
    }

    @Override
    public void close() {
        // no threads to release
    }

    @Override
    DispatchHandle execute(Work work) {
        if (stopper.isStopRequested()) {
            work.skip(new RunStoppedException("run stopped before " + work.getName() + " started"));
        } else {
            work.run();
        }
        return DispatchHandle.completed(work.getName());
    }

    @Override
    AbstractDispatcher scope(Tracker tracker, String parentSuiteId) {
        return new SequentialDispatcher(listener, tracker, stopper, parentSuiteId);
    }

    @Override
    RunListener getSuiteListener() {
        return listener;
    }

    @Override
    SuiteSortingGate getTestGateOwner() {
        return null;
    }

}
