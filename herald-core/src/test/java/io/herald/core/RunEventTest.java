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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunEventTest {

    @Test
    void testEventsCompareByOrdinal() {
        Tracker tracker = new Tracker();
        RunEvent start = SuiteRunEvent.starting(tracker.nextOrdinal(), "s", "S");
        RunEvent test = TestRunEvent.starting(tracker.nextOrdinal(), "s", "S", "t");
        RunEvent end = SuiteRunEvent.completed(tracker.nextOrdinal(), "s", "S", 5);
        List<RunEvent> list = new ArrayList<>(List.of(end, test, start));
        Collections.sort(list);
        assertEquals(List.of(start, test, end), list);
    }

    @Test
    void testTestEventRequiresName() {
        assertThrows(IllegalArgumentException.class,
                () -> TestRunEvent.starting(new Ordinal(0), "s", "S", null));
    }

    @Test
    void testTerminalKinds() {
        assertTrue(RunEventType.SUITE_ABORTED.isSuiteTerminal());
        assertFalse(RunEventType.SUITE_STARTING.isSuiteTerminal());
        assertTrue(RunEventType.TEST_IGNORED.isTestTerminal());
        assertTrue(RunEventType.TEST_CANCELED.isTestTerminal());
        assertFalse(RunEventType.TEST_STARTING.isTestTerminal());
        assertTrue(RunEventType.TEST_FAILED.isFailure());
        assertFalse(RunEventType.TEST_CANCELED.isFailure());
    }

    @Test
    void testToJson() {
        TestRunEvent failed = TestRunEvent.failed(new Ordinal(0), "calc", "Calc", "add",
                new IllegalStateException("boom"), 2, 15);
        Map<String, Object> json = failed.toJson();
        assertEquals("calc", json.get("suiteId"));
        assertEquals("add", json.get("testName"));
        assertEquals("boom", json.get("error"));
        assertEquals("add", failed.getTestName());
        assertEquals(2, failed.postEventCount());

        SuiteRunEvent starting = SuiteRunEvent.starting(new Ordinal(0), "inner", "Inner", "outer");
        assertEquals("outer", starting.toJson().get("parentSuiteId"));
        assertNull(starting.getTestName());
        assertEquals(Thread.currentThread().getName(), starting.getThreadName());
    }

    @Test
    void testInfoEvent() {
        InfoRunEvent free = InfoRunEvent.info(new Ordinal(0), "s", "S", null, "hello");
        assertNull(free.getTestName());
        assertEquals("hello", free.toJson().get("message"));
        InfoRunEvent markup = InfoRunEvent.markup(new Ordinal(0), "s", "S", "t", "*bold*");
        assertEquals(RunEventType.MARKUP_PROVIDED, markup.getType());
        assertEquals("t", markup.getTestName());
    }

    @Test
    void testProtocolViolationMessage() {
        RunEvent event = SuiteRunEvent.starting(new Ordinal(3), "s", "S");
        ProtocolViolationException e = new ProtocolViolationException("suite 's' started twice", event);
        assertSame(event, e.getEvent());
        assertTrue(e.getMessage().contains("SUITE_STARTING"));
        assertTrue(e.getMessage().contains("[3, 0]"));
    }

}
