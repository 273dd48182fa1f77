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
package io.herald.log;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    private final Logger herald = (Logger) LoggerFactory.getLogger("herald");
    private final Level previous = herald.getLevel();

    @AfterEach
    void afterEach() {
        herald.setLevel(previous);
    }

    @Test
    void testSetRuntimeLogLevel() {
        assertTrue(LogContext.setRuntimeLogLevel("debug"));
        assertEquals(Level.DEBUG, herald.getLevel());
        assertTrue(LogContext.RUNTIME_LOGGER.isDebugEnabled());
        assertTrue(LogContext.setRuntimeLogLevel("warn"));
        assertFalse(LogContext.RUNTIME_LOGGER.isInfoEnabled());
    }

    @Test
    void testBlankOrUnknownLevelIgnored() {
        herald.setLevel(Level.INFO);
        assertFalse(LogContext.setRuntimeLogLevel(null));
        assertFalse(LogContext.setRuntimeLogLevel(" "));
        assertFalse(LogContext.setRuntimeLogLevel("loud"));
        assertEquals(Level.INFO, herald.getLevel());
        assertTrue(LogContext.setRuntimeLogLevel(" Error "));
        assertEquals(Level.ERROR, herald.getLevel());
    }

}
