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
 * Scope events (SCOPE_OPENED, SCOPE_CLOSED) that bracket a described group of tests.
 */
public record ScopeRunEvent(
        RunEventType type,
        Ordinal ordinal,
        String suiteId,
        String suiteName,
        String message,
        String threadName,
        long timeStamp
) implements RunEvent {

    public static ScopeRunEvent opened(Ordinal ordinal, String suiteId, String suiteName, String message) {
        return new ScopeRunEvent(RunEventType.SCOPE_OPENED, ordinal, suiteId, suiteName, message,
                SuiteRunEvent.currentThreadName(), System.currentTimeMillis());
    }

    public static ScopeRunEvent closed(Ordinal ordinal, String suiteId, String suiteName, String message) {
        return new ScopeRunEvent(RunEventType.SCOPE_CLOSED, ordinal, suiteId, suiteName, message,
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
        map.put("suiteId", suiteId);
        map.put("message", message);
        return map;
    }

}
