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

import io.herald.core.Tracker;

/**
 * Runs suites. The dispatcher reports each suite's start on the submitting thread, so the
 * order of {@code submit} calls is the order in which suites are reported.
 */
public interface Dispatcher extends AutoCloseable {

    /**
     * Submits a suite with a tracker forked from this dispatcher's own.
     */
    DispatchHandle submit(SuiteUnit unit);

    DispatchHandle submit(SuiteUnit unit, Tracker tracker);

    /**
     * Blocks until everything submitted through this dispatcher, and everything that
     * work submitted in turn, is done. On the root dispatcher the first protocol
     * violation or dispatch failure seen during the run is rethrown afterwards.
     */
    void awaitAll();

    void requestStop();

    boolean isStopRequested();

    /**
     * A view sharing this dispatcher's threads and stop flag whose {@link #awaitAll()}
     * only waits for what was submitted through it.
     */
    Dispatcher newScope();

    boolean isConcurrent();

    @Override
    void close();

}
