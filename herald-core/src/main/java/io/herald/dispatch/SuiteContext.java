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
import io.herald.sort.SuiteStructure;

import java.util.List;

/**
 * Handed to a running {@link SuiteUnit}. Everything a suite reports goes through here,
 * so ordinals come from the suite's own {@link Tracker} and events end up in the right gate.
 * <p>
 * Tests are run at most once per suite, by one of the {@code runTests} or
 * {@code distributeTests} methods. On a concurrent dispatcher with test sorting they run
 * on the pool and their events are put back in order, otherwise they run one by one on
 * the suite's thread.
 */
public interface SuiteContext {

    String getSuiteId();

    String getSuiteName();

    Tracker getTracker();

    /**
     * The listener suite-level events of this suite are reported to.
     */
    RunListener getListener();

    boolean isStopRequested();

    void info(String message);

    void markup(String text);

    void openScope(String message);

    void closeScope(String message);

    /**
     * Runs the tests and returns once all of them completed. Tests are reported in
     * list order.
     */
    void runTests(List<TestUnit> tests);

    /**
     * Runs the tests laid out by the structure and returns once all of them completed.
     * Scopes and info leaves of the structure are reported by this call. Every test of
     * the structure must be in the list and the other way round.
     */
    void runTests(SuiteStructure structure, List<TestUnit> tests);

    /**
     * Like {@link #runTests(List)} but does not wait: the suite may end while its
     * tests still run, it is reported as completed after the last of them.
     */
    void distributeTests(List<TestUnit> tests);

    void distributeTests(SuiteStructure structure, List<TestUnit> tests);

    /**
     * Runs suites nested in this one and waits for them. Each is reported as a suite of
     * its own, with this suite as its parent.
     */
    void runNestedSuites(List<SuiteUnit> suites);

}
