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
package io.herald.sort;

import io.herald.core.RunEvent;
import io.herald.core.RunEventType;
import io.herald.core.TestRunEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Pending events of one position in a suite's test order. Immutable: every update
 * returns a new slot, which the owning {@link TestSortingGate} swaps in under its lock.
 * <p>
 * A TEST slot is keyed by test name and holds the start event, the test's info and
 * markup events, and the terminal event. SCOPE_* and INFO slots are keyed by message
 * and hold the single event matched to them.
 */
record TestSlot(Kind kind, String key, RunEvent start, List<RunEvent> infos, RunEvent terminal, boolean forced) {

    enum Kind {
        TEST,
        SCOPE_OPENED,
        SCOPE_CLOSED,
        INFO
    }

    TestSlot {
        infos = List.copyOf(infos);
    }

    static TestSlot test(String testName) {
        return new TestSlot(Kind.TEST, testName, null, List.of(), null, false);
    }

    static TestSlot expect(Kind kind, String message) {
        return new TestSlot(kind, message, null, List.of(), null, false);
    }

    /**
     * A scope or info slot that is already matched, used when no declared order exists.
     */
    static TestSlot matched(Kind kind, RunEvent event) {
        return new TestSlot(kind, null, event, List.of(), null, false);
    }

    TestSlot withStart(RunEvent event) {
        return new TestSlot(kind, key, event, infos, terminal, forced);
    }

    TestSlot withInfo(RunEvent event) {
        List<RunEvent> list = new ArrayList<>(infos.size() + 1);
        list.addAll(infos);
        list.add(event);
        return new TestSlot(kind, key, start, list, terminal, forced);
    }

    TestSlot withTerminal(RunEvent event) {
        return new TestSlot(kind, key, start, infos, event, forced);
    }

    TestSlot asForced() {
        return new TestSlot(kind, key, start, infos, terminal, true);
    }

    boolean isTest() {
        return kind == Kind.TEST;
    }

    boolean isMatched() {
        return start != null;
    }

    boolean isReady() {
        if (forced) {
            return true;
        }
        if (kind != Kind.TEST) {
            return start != null;
        }
        if (terminal == null) {
            return false;
        }
        int expected = terminal instanceof TestRunEvent tre ? tre.postEventCount() : 0;
        return infos.size() >= expected;
    }

    boolean isIgnored() {
        return terminal != null && terminal.getType() == RunEventType.TEST_IGNORED;
    }

    /**
     * Events in the order they are released: start, infos, terminal.
     */
    List<RunEvent> toDispatch() {
        List<RunEvent> list = new ArrayList<>(infos.size() + 2);
        if (start != null) {
            list.add(start);
        }
        list.addAll(infos);
        if (terminal != null) {
            list.add(terminal);
        }
        return list;
    }

}
