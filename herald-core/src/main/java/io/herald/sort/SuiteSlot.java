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

import java.util.ArrayList;
import java.util.List;

/**
 * Pending events of one suite in a {@link SuiteSortingGate}. Immutable, replaced under the gate's lock.
 */
record SuiteSlot(String suiteId, String suiteName, List<RunEvent> buffered, RunEvent terminal,
                 TestSortingGate testGate, boolean forced) {

    SuiteSlot {
        buffered = List.copyOf(buffered);
    }

    static SuiteSlot open(RunEvent starting) {
        return new SuiteSlot(starting.getSuiteId(), starting.getSuiteName(), List.of(starting), null, null, false);
    }

    SuiteSlot withEvent(RunEvent event) {
        List<RunEvent> list = new ArrayList<>(buffered.size() + 1);
        list.addAll(buffered);
        list.add(event);
        return new SuiteSlot(suiteId, suiteName, list, terminal, testGate, forced);
    }

    /**
     * Drops the first {@code count} buffered events, the ones already delivered.
     */
    SuiteSlot drained(int count) {
        return new SuiteSlot(suiteId, suiteName, buffered.subList(count, buffered.size()), terminal, testGate, forced);
    }

    SuiteSlot withTerminal(RunEvent event) {
        return new SuiteSlot(suiteId, suiteName, buffered, event, testGate, forced);
    }

    SuiteSlot withTestGate(TestSortingGate gate) {
        return new SuiteSlot(suiteId, suiteName, buffered, terminal, gate, forced);
    }

    SuiteSlot asForced() {
        return new SuiteSlot(suiteId, suiteName, buffered, terminal, testGate, true);
    }

    boolean isSubOrderingPending() {
        return testGate != null && !testGate.isFinished();
    }

    boolean isReady() {
        return forced || (terminal != null && !isSubOrderingPending());
    }

    SlotState state() {
        if (isReady()) {
            return SlotState.READY;
        }
        return terminal == null ? SlotState.OPEN : SlotState.PENDING_SUB_ORDERING;
    }

}
