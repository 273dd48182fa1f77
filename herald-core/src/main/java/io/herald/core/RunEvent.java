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
package io.herald.core;

import java.util.Map;

/**
 * A lifecycle event produced while suites and tests run.
 * <p>
 * The set of event shapes is closed: suite, test, scope and info events. Consumers
 * dispatch on {@link #getType()}, which the compiler checks for exhaustiveness in a
 * switch expression:
 * <pre>
 * listener = event -> {
 *     switch (event.getType()) {
 *         case SUITE_STARTING -> openSuite(event.getSuiteName());
 *         case TEST_FAILED -> markFailed(event.getTestName());
 *         default -> { }
 *     }
 * };
 * </pre>
 * The {@link Ordinal} is the ordering authority, the wall-clock time stamp is
 * informational only. Events compare by ordinal.
 */
public sealed interface RunEvent extends Comparable<RunEvent>
        permits SuiteRunEvent, TestRunEvent, ScopeRunEvent, InfoRunEvent {

    RunEventType getType();

    Ordinal getOrdinal();

    /**
     * Returns the id of the owning suite, or null for run-level events.
     */
    String getSuiteId();

    String getSuiteName();

    /**
     * Returns the test this event belongs to, or null if it is not tied to a test.
     */
    default String getTestName() {
        return null;
    }

    String getThreadName();

    long getTimeStamp();

    /**
     * Serializes the event payload to a map for JSON output.
     */
    Map<String, Object> toJson();

    @Override
    default int compareTo(RunEvent other) {
        return getOrdinal().compareTo(other.getOrdinal());
    }

}
