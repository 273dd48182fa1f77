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

import net.minidev.json.JSONObject;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    @Test
    void testCountsAndStatus() {
        Tracker tracker = new Tracker();
        RunResult result = new RunResult();
        result.setStartTime(1000);
        result.onEvent(SuiteRunEvent.starting(tracker.nextOrdinal(), "calc", "Calculator"));
        result.onEvent(TestRunEvent.starting(tracker.nextOrdinal(), "calc", "Calculator", "add"));
        result.onEvent(TestRunEvent.succeeded(tracker.nextOrdinal(), "calc", "Calculator", "add", 0, 3));
        result.onEvent(TestRunEvent.ignored(tracker.nextOrdinal(), "calc", "Calculator", "pow"));
        result.onEvent(SuiteRunEvent.completed(tracker.nextOrdinal(), "calc", "Calculator", 10));
        result.setEndTime(1250);
        assertTrue(result.isPassed());
        assertEquals(1, result.getSuiteCount());
        assertEquals(2, result.getTestCount());
        assertEquals(250, result.getDurationMillis());
        assertTrue(result.getErrors().isEmpty());

        result.onEvent(SuiteRunEvent.starting(tracker.nextOrdinal(), "stack", "Stack"));
        result.onEvent(SuiteRunEvent.aborted(tracker.nextOrdinal(), "stack", "Stack",
                new IllegalStateException("no stack"), 1));
        assertTrue(result.isFailed());
        assertEquals(List.of("Stack: no stack"), result.getErrors());
    }

    @Test
    void testJson() {
        RunResult result = new RunResult();
        result.onEvent(TestRunEvent.failed(new Ordinal(0), "calc", "Calculator", "div",
                new ArithmeticException("/ by zero"), 0, 1));
        JSONObject json = (JSONObject) JSONValue.parse(result.toJson());
        assertEquals("failed", json.get("status"));
        assertEquals(1, ((Number) json.get("test_failed")).intValue());
        assertEquals(List.of("Calculator > div: / by zero"), json.get("errors"));
    }

}
