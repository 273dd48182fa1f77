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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Info and markup events (INFO_PROVIDED, MARKUP_PROVIDED).
 * <p>
 * With a test name the event belongs to that test and counts towards its terminal
 * event's {@code postEventCount}. Without one it is a free-floating message of the
 * suite, and without a suite id it is a run-level message.
 */
public record InfoRunEvent(
        RunEventType type,
        Ordinal ordinal,
        String suiteId,
        String suiteName,
        String testName,
        String message,
        String threadName,
        long timeStamp
) implements RunEvent {

    public static InfoRunEvent info(Ordinal ordinal, String suiteId, String suiteName, String testName, String message) {
        return new InfoRunEvent(RunEventType.INFO_PROVIDED, ordinal, suiteId, suiteName, testName, message,
                SuiteRunEvent.currentThreadName(), System.currentTimeMillis());
    }

    public static InfoRunEvent markup(Ordinal ordinal, String suiteId, String suiteName, String testName, String text) {
        return new InfoRunEvent(RunEventType.MARKUP_PROVIDED, ordinal, suiteId, suiteName, testName, text,
                SuiteRunEvent.currentThreadName(), System.currentTimeMillis());
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public Ordinal getOrdinal() {
        return ordinal;
    }

    @Override
    public String getSuiteId() {
        return suiteId;
    }

    @Override
    public String getSuiteName() {
        return suiteName;
    }

    @Override
    public String getTestName() {
        return testName;
    }

    @Override
    public String getThreadName() {
        return threadName;
    }

    @Override
    public long getTimeStamp() {
        return timeStamp;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (suiteId != null) {
            map.put("suiteId", suiteId);
        }
        if (testName != null) {
            map.put("testName", testName);
        }
        map.put("message", message);
        return map;
    }

}
