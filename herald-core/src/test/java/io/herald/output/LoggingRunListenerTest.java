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
package io.herald.output;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.herald.core.InfoRunEvent;
import io.herald.core.Ordinal;
import io.herald.core.SuiteRunEvent;
import io.herald.core.TestRunEvent;
import io.herald.core.Tracker;
import net.minidev.json.JSONObject;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingRunListenerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void beforeEach() {
        logger = (Logger) LoggerFactory.getLogger("herald.test.events");
        logger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void afterEach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void testOneLinePerEvent() {
        Tracker tracker = new Tracker();
        LoggingRunListener listener = new LoggingRunListener(logger);
        listener.onEvent(SuiteRunEvent.starting(tracker.nextOrdinal(), "calc", "Calculator"));
        listener.onEvent(TestRunEvent.starting(tracker.nextOrdinal(), "calc", "Calculator", "add"));
        listener.onEvent(InfoRunEvent.info(tracker.nextOrdinal(), "calc", "Calculator", "add", "1 + 2 = 3"));
        listener.onEvent(TestRunEvent.succeeded(tracker.nextOrdinal(), "calc", "Calculator", "add", 1, 12));
        assertEquals(4, appender.list.size());
        for (ILoggingEvent event : appender.list) {
            assertEquals(Level.INFO, event.getLevel());
            assertFalse(event.getFormattedMessage().contains("\n"));
        }
        JSONObject last = (JSONObject) JSONValue.parse(appender.list.get(3).getFormattedMessage());
        assertEquals("TEST_SUCCEEDED", last.get("type"));
        Map<?, ?> data = (Map<?, ?>) last.get("data");
        assertEquals("add", data.get("testName"));
        assertEquals(1, ((Number) data.get("postEventCount")).intValue());
    }

    @Test
    void testEnvelope() {
        Ordinal ordinal = new Ordinal(3).nextNewBranch().branch();
        String line = LoggingRunListener.toJsonLine(SuiteRunEvent.aborted(ordinal, "calc", "Calculator",
                new IllegalStateException("no calculator"), 5));
        JSONObject json = (JSONObject) JSONValue.parse(line);
        assertEquals("SUITE_ABORTED", json.get("type"));
        assertEquals(ordinal.toList(), toIntegers((List<?>) json.get("ordinal")));
        assertEquals(Thread.currentThread().getName(), json.get("threadName"));
        assertTrue(((Number) json.get("timeStamp")).longValue() > 0);
        Map<?, ?> data = (Map<?, ?>) json.get("data");
        assertEquals("calc", data.get("suiteId"));
        assertEquals("no calculator", data.get("error"));
    }

    @Test
    void testNothingLoggedWhenDisabled() {
        logger.setLevel(Level.WARN);
        new LoggingRunListener(logger).onEvent(SuiteRunEvent.starting(new Ordinal(0), "s", "s"));
        assertTrue(appender.list.isEmpty());
    }

    private static List<Integer> toIntegers(List<?> list) {
        return list.stream().map(o -> ((Number) o).intValue()).toList();
    }

}
