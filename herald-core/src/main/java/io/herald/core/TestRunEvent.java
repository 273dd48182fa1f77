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
 * Test-level events (TEST_STARTING and the terminal TEST_* kinds).
 * <p>
 * A terminal event declares {@code postEventCount}: the number of info and markup
 * events that belong to the test. Sorting gates hold the test back until that many
 * have arrived, whichever order the producer sent them in.
 */
public record TestRunEvent(
        RunEventType type,
        Ordinal ordinal,
        String suiteId,
        String suiteName,
        String testName,
        int postEventCount,
        Throwable error,  // TEST_FAILED / TEST_CANCELED only
        long durationMillis,
        String threadName,
        long timeStamp
) implements RunEvent {

    public static TestRunEvent starting(Ordinal ordinal, String suiteId, String suiteName, String testName) {
        return of(RunEventType.TEST_STARTING, ordinal, suiteId, suiteName, testName, 0, null, 0);
    }

    public static TestRunEvent succeeded(Ordinal ordinal, String suiteId, String suiteName, String testName,
                                         int postEventCount, long durationMillis) {
        return of(RunEventType.TEST_SUCCEEDED, ordinal, suiteId, suiteName, testName, postEventCount, null, durationMillis);
    }

    public static TestRunEvent failed(Ordinal ordinal, String suiteId, String suiteName, String testName,
                                      Throwable error, int postEventCount, long durationMillis) {
        return of(RunEventType.TEST_FAILED, ordinal, suiteId, suiteName, testName, postEventCount, error, durationMillis);
    }

    public static TestRunEvent ignored(Ordinal ordinal, String suiteId, String suiteName, String testName) {
        return of(RunEventType.TEST_IGNORED, ordinal, suiteId, suiteName, testName, 0, null, 0);
    }

    public static TestRunEvent pending(Ordinal ordinal, String suiteId, String suiteName, String testName,
                                       int postEventCount, long durationMillis) {
        return of(RunEventType.TEST_PENDING, ordinal, suiteId, suiteName, testName, postEventCount, null, durationMillis);
    }

    public static TestRunEvent canceled(Ordinal ordinal, String suiteId, String suiteName, String testName,
                                        Throwable error, int postEventCount, long durationMillis) {
        return of(RunEventType.TEST_CANCELED, ordinal, suiteId, suiteName, testName, postEventCount, error, durationMillis);
    }

    private static TestRunEvent of(RunEventType type, Ordinal ordinal, String suiteId, String suiteName, String testName,
                                   int postEventCount, Throwable error, long durationMillis) {
        if (testName == null) {
            throw new IllegalArgumentException("testName is null");
        }
        return new TestRunEvent(type, ordinal, suiteId, suiteName, testName, postEventCount, error, durationMillis,
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
        map.put("suiteId", suiteId);
        map.put("testName", testName);
        if (type.isTestTerminal() && type != RunEventType.TEST_IGNORED) {
            map.put("durationMs", durationMillis);
            if (postEventCount > 0) {
                map.put("postEventCount", postEventCount);
            }
        }
        if (error != null) {
            map.put("error", error.getMessage());
            map.put("errorType", error.getClass().getSimpleName());
        }
        return map;
    }

}
