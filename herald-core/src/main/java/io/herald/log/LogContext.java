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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers shared across the code base. All of them sit below the
 * {@code herald} logger, so one level setting covers the whole library.
 */
public final class LogContext {

    private static final String ROOT_CATEGORY = "herald";
    private static final String LOGBACK_LOGGER = "ch.qos.logback.classic.Logger";
    private static final String LOGBACK_LEVEL = "ch.qos.logback.classic.Level";

    /** Logger for the run driver and dispatchers */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("herald.runtime");

    /** Logger for the sorting gates (timeouts, late events, leftovers on close) */
    public static final Logger SORT_LOGGER = LoggerFactory.getLogger("herald.sort");

    /** Logger the ordered event stream is written to by the logging listener */
    public static final Logger EVENT_LOGGER = LoggerFactory.getLogger("herald.events");

    private LogContext() {
    }

    /**
     * Sets the level of the {@code herald} logger, and so of every category below it.
     * Only works with Logback as the SLF4J binding, which is looked up reflectively so
     * the library does not depend on it.
     *
     * @param level a Logback level name such as {@code debug} or {@code WARN}
     * @return false when the level is blank or unknown, or the binding is not Logback
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isBlank()) {
            return false;
        }
        Logger herald = LoggerFactory.getLogger(ROOT_CATEGORY);
        Class<?> loggerType = herald.getClass();
        if (!LOGBACK_LOGGER.equals(loggerType.getName())) {
            RUNTIME_LOGGER.debug("log level {} not applied, {} is not a Logback logger", level, loggerType.getName());
            return false;
        }
        try {
            Class<?> levelType = Class.forName(LOGBACK_LEVEL, true, loggerType.getClassLoader());
            // unknown names map to the null default instead of DEBUG
            Object value = levelType.getMethod("toLevel", String.class, levelType).invoke(null, level.trim(), null);
            if (value == null) {
                RUNTIME_LOGGER.warn("unknown log level: {}", level);
                return false;
            }
            loggerType.getMethod("setLevel", levelType).invoke(herald, value);
        } catch (ReflectiveOperationException e) {
            RUNTIME_LOGGER.warn("log level {} not applied: {}", level, e.toString());
            return false;
        }
        RUNTIME_LOGGER.debug("log level of '{}' set to {}", ROOT_CATEGORY, level);
        return true;
    }

}
