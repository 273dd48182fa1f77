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
 * Suite-level events (SUITE_STARTING, SUITE_COMPLETED, SUITE_ABORTED).
 */
public record SuiteRunEvent(
        RunEventType type,
        Ordinal ordinal,
        String suiteId,
        String suiteName,
        String parentSuiteId,  // null for a top-level suite
        Throwable error,       // SUITE_ABORTED only
        long durationMillis,
        String threadName,
        long timeStamp
) implements RunEvent {

    public static SuiteRunEvent starting(Ordinal ordinal, String suiteId, String suiteName) {
        return starting(ordinal, suiteId, suiteName, null);
    }

    public static SuiteRunEvent starting(Ordinal ordinal, String suiteId, String suiteName, String parentSuiteId) {
        return new SuiteRunEvent(RunEventType.SUITE_STARTING, ordinal, suiteId, suiteName, parentSuiteId,
                null, 0, currentThreadName(), System.currentTimeMillis());
    }

    public static SuiteRunEvent completed(Ordinal ordinal, String suiteId, String suiteName, long durationMillis) {
        return new SuiteRunEvent(RunEventType.SUITE_COMPLETED, ordinal, suiteId, suiteName, null,
                null, durationMillis, currentThreadName(), System.currentTimeMillis());
    }

    public static SuiteRunEvent aborted(Ordinal ordinal, String suiteId, String suiteName, Throwable error, long durationMillis) {
        return new SuiteRunEvent(RunEventType.SUITE_ABORTED, ordinal, suiteId, suiteName, null,
                error, durationMillis, currentThreadName(), System.currentTimeMillis());
    }

    static String currentThreadName() {
        return Thread.currentThread().getName();
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
        map.put("suiteName", suiteName);
        if (parentSuiteId != null) {
            map.put("parentSuiteId", parentSuiteId);
        }
        if (type != RunEventType.SUITE_STARTING) {
            map.put("durationMs", durationMillis);
        }
        if (error != null) {
            map.put("error", error.getMessage());
            map.put("errorType", error.getClass().getSimpleName());
        }
        return map;
    }

}
