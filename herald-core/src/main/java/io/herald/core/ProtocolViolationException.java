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
 * Thrown when an event producer breaks the lifecycle protocol, e.g. a second
 * SUITE_STARTING for the same suite id or a terminal event for a test that never
 * started. Ordering guarantees no longer hold once this happens, so it is propagated
 * to the run driver rather than reported as a test failure.
 */
public class ProtocolViolationException extends RuntimeException {

    private final transient RunEvent event;

    public ProtocolViolationException(String message, RunEvent event) {
        super(message + (event == null ? "" : " - event: " + event.getType() + " " + event.getOrdinal()));
        this.event = event;
    }

    public RunEvent getEvent() {
        return event;
    }

}
