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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tally of one run, built by listening to the ordered event stream.
 */
public class RunResult implements RunListener {

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private final List<String> errors = new ArrayList<>();
    private int suitesStarted;
    private int suitesCompleted;
    private int suitesAborted;
    private int testsSucceeded;
    private int testsFailed;
    private int testsIgnored;
    private int testsPending;
    private int testsCanceled;
    private long startTime;
    private long endTime;

    @Override
    public synchronized void onEvent(RunEvent event) {
        switch (event.getType()) {
            case SUITE_STARTING:
                suitesStarted++;
                break;
            case SUITE_COMPLETED:
                suitesCompleted++;
                break;
            case SUITE_ABORTED:
                suitesAborted++;
                errors.add(describe(event, ((SuiteRunEvent) event).error()));
                break;
            case TEST_SUCCEEDED:
                testsSucceeded++;
                break;
            case TEST_FAILED:
                testsFailed++;
                errors.add(describe(event, ((TestRunEvent) event).error()));
                break;
            case TEST_IGNORED:
                testsIgnored++;
                break;
            case TEST_PENDING:
                testsPending++;
                break;
            case TEST_CANCELED:
                testsCanceled++;
                break;
            default:
                break;
        }
    }

    private static String describe(RunEvent event, Throwable error) {
        String where = event.getTestName() == null
                ? event.getSuiteName()
                : event.getSuiteName() + " > " + event.getTestName();
        return where + ": " + (error == null ? "unknown error" : error.getMessage());
    }

    public synchronized void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public synchronized void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    // ========== Aggregation ==========

    public synchronized int getSuiteCount() {
        return suitesStarted;
    }

    public synchronized int getSuitesCompleted() {
        return suitesCompleted;
    }

    public synchronized int getSuitesAborted() {
        return suitesAborted;
    }

    public synchronized int getTestCount() {
        return testsSucceeded + testsFailed + testsIgnored + testsPending + testsCanceled;
    }

    public synchronized int getTestsSucceeded() {
        return testsSucceeded;
    }

    public synchronized int getTestsFailed() {
        return testsFailed;
    }

    public synchronized int getTestsIgnored() {
        return testsIgnored;
    }

    public synchronized int getTestsPending() {
        return testsPending;
    }

    public synchronized int getTestsCanceled() {
        return testsCanceled;
    }

    public synchronized List<String> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public synchronized boolean isFailed() {
        return testsFailed > 0 || suitesAborted > 0;
    }

    public boolean isPassed() {
        return !isFailed();
    }

    public synchronized long getDurationMillis() {
        return endTime - startTime;
    }

    // ========== Serialization ==========

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("suite_count", suitesStarted);
        map.put("suite_completed", suitesCompleted);
        map.put("suite_aborted", suitesAborted);
        map.put("test_succeeded", testsSucceeded);
        map.put("test_failed", testsFailed);
        map.put("test_ignored", testsIgnored);
        map.put("test_pending", testsPending);
        map.put("test_canceled", testsCanceled);
        map.put("duration_millis", endTime - startTime);
        map.put("status", isFailed() ? "failed" : "passed");
        if (!errors.isEmpty()) {
            map.put("errors", new ArrayList<>(errors));
        }
        return map;
    }

    public String toJson() {
        return JSONValue.toJSONString(toMap(), JSON_STYLE);
    }

    @Override
    public String toString() {
        return toJson();
    }

}
