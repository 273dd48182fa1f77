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

/**
 * Lifecycle event kinds. Every {@link RunEvent} carries exactly one of these.
 */
public enum RunEventType {

    SUITE_STARTING,
    SUITE_COMPLETED,
    SUITE_ABORTED,
    TEST_STARTING,
    TEST_SUCCEEDED,
    TEST_FAILED,
    TEST_IGNORED,
    TEST_PENDING,
    TEST_CANCELED,
    SCOPE_OPENED,
    SCOPE_CLOSED,
    INFO_PROVIDED,
    MARKUP_PROVIDED;

    public boolean isSuiteTerminal() {
        return this == SUITE_COMPLETED || this == SUITE_ABORTED;
    }

    /**
     * True for the events that end a test. {@link #TEST_IGNORED} both starts and ends one.
     */
    public boolean isTestTerminal() {
        switch (this) {
            case TEST_SUCCEEDED:
            case TEST_FAILED:
            case TEST_IGNORED:
            case TEST_PENDING:
            case TEST_CANCELED:
                return true;
            default:
                return false;
        }
    }

    public boolean isFailure() {
        return this == TEST_FAILED || this == SUITE_ABORTED;
    }

}
