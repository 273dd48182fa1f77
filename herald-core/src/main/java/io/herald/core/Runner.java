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

import io.herald.dispatch.ConcurrentDispatcher;
import io.herald.dispatch.DispatchHandle;
import io.herald.dispatch.Dispatcher;
import io.herald.dispatch.SequentialDispatcher;
import io.herald.dispatch.Stopper;
import io.herald.dispatch.SuiteUnit;
import io.herald.log.LogContext;
import io.herald.sort.SuiteSortingGate;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for running suites.
 * <p>
 * Example usage:
 * <pre>
 * RunResult result = Runner.suites(new CalcSuite(), new StackSuite())
 *     .listener(new LoggingRunListener())
 *     .sortTimeout(Duration.ofSeconds(30))
 *     .parallel(4);
 * </pre>
 * With more than one thread suites run concurrently, and so do the tests of each suite
 * unless test sorting is turned off. Listeners still receive the events one suite at a
 * time, in submission order.
 */
public final class Runner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String THREADS_PROPERTY = "herald.threads";
    public static final String SORT_TIMEOUT_PROPERTY = "herald.sort.timeout";
    public static final String TEST_SORTING_PROPERTY = "herald.test.sorting";
    public static final String LOG_LEVEL_PROPERTY = "herald.log.level";

    public static final Duration DEFAULT_SORT_TIMEOUT = Duration.ofSeconds(10);

    private Runner() {
    }

    public static Builder suites(SuiteUnit... suites) {
        return new Builder().suites(suites);
    }

    public static Builder suites(Collection<SuiteUnit> suites) {
        return new Builder().suites(suites);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<SuiteUnit> suites = new ArrayList<>();
        private final List<RunListener> listeners = new ArrayList<>();

        // null means not set: taken from the properties, then the default
        private Integer threads;
        private Duration sortTimeout;
        private Boolean testSorting;
        private String logLevel;

        private int queueCapacity = ConcurrentDispatcher.UNBOUNDED;
        private int runStamp;
        private Stopper stopper = new Stopper();
        private Map<String, String> systemProperties;

        Builder() {
        }

        public Builder suites(SuiteUnit... values) {
            suites.addAll(Arrays.asList(values));
            return this;
        }

        public Builder suites(Collection<SuiteUnit> values) {
            if (values != null) {
                suites.addAll(values);
            }
            return this;
        }

        /**
         * Adds a listener for the ordered event stream. Listeners are called in the
         * order they were added.
         */
        public Builder listener(RunListener listener) {
            if (listener != null) {
                listeners.add(listener);
            }
            return this;
        }

        public Builder threads(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("threads must be at least 1: " + value);
            }
            threads = value;
            return this;
        }

        /**
         * How long a sorting gate waits for the suite or test at its head to make
         * progress before reporting it as timed out. {@link Duration#ZERO} waits forever.
         */
        public Builder sortTimeout(Duration value) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException("sort timeout must not be null or negative: " + value);
            }
            sortTimeout = value;
            return this;
        }

        public Builder testSorting(boolean value) {
            testSorting = value;
            return this;
        }

        /**
         * Limits how many suites and tests may wait for a worker. Exceeding it fails the run.
         */
        public Builder queueCapacity(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("queue capacity must not be negative: " + value);
            }
            queueCapacity = value;
            return this;
        }

        public Builder runStamp(int value) {
            runStamp = value;
            return this;
        }

        public Builder stopper(Stopper value) {
            if (value == null) {
                throw new IllegalArgumentException("stopper is null");
            }
            stopper = value;
            return this;
        }

        public Builder logLevel(String value) {
            logLevel = value;
            return this;
        }

        /**
         * Properties consulted for settings not set on the builder, on top of the JVM
         * system properties.
         */
        public Builder systemProperties(Map<String, String> value) {
            systemProperties = value;
            return this;
        }

        /**
         * Runs the suites with the given number of threads.
         */
        public RunResult parallel(int threadCount) {
            threads(threadCount);
            return run();
        }

        public RunResult run() {
            Map<String, String> props = getSystemProperties();
            int resolvedThreads = threads != null ? threads : intProperty(props, THREADS_PROPERTY, 1);
            Duration resolvedTimeout = sortTimeout != null ? sortTimeout
                    : Duration.ofMillis(intProperty(props, SORT_TIMEOUT_PROPERTY, (int) DEFAULT_SORT_TIMEOUT.toMillis()));
            boolean resolvedSorting = testSorting != null ? testSorting
                    : Boolean.parseBoolean(props.getOrDefault(TEST_SORTING_PROPERTY, "true"));
            String resolvedLevel = logLevel != null ? logLevel : props.get(LOG_LEVEL_PROPERTY);
            if (resolvedThreads < 1) {
                throw new IllegalArgumentException(THREADS_PROPERTY + " must be at least 1: " + resolvedThreads);
            }
            if (resolvedTimeout.isNegative()) {
                throw new IllegalArgumentException(SORT_TIMEOUT_PROPERTY + " must not be negative: " + resolvedTimeout);
            }
            if (resolvedLevel != null) {
                LogContext.setRuntimeLogLevel(resolvedLevel);
            }
            logger.info("running {} suites, threads: {}, test sorting: {}, sort timeout: {} ms",
                    suites.size(), resolvedThreads, resolvedSorting, resolvedTimeout.toMillis());

            RunResult result = new RunResult();
            RunListener sink = event -> {
                result.onEvent(event);
                for (RunListener listener : listeners) {
                    listener.onEvent(event);
                }
            };
            Tracker tracker = Tracker.forRun(runStamp);
            result.setStartTime(System.currentTimeMillis());
            if (resolvedThreads == 1) {
                try (Dispatcher dispatcher = new SequentialDispatcher(sink, tracker, stopper)) {
                    submitAll(dispatcher);
                    dispatcher.awaitAll();
                }
            } else {
                try (SuiteSortingGate gate = new SuiteSortingGate(sink, resolvedTimeout);
                     Dispatcher dispatcher = new ConcurrentDispatcher(gate, resolvedThreads, queueCapacity,
                             resolvedSorting, tracker, stopper)) {
                    submitAll(dispatcher);
                    dispatcher.awaitAll();
                }
            }
            result.setEndTime(System.currentTimeMillis());
            logger.info("run finished in {} ms: {}", result.getDurationMillis(), result.toJson());
            return result;
        }

        private void submitAll(Dispatcher dispatcher) {
            for (SuiteUnit suite : suites) {
                try {
                    DispatchHandle handle = dispatcher.submit(suite);
                    logger.trace("submitted: {}", handle.getName());
                } catch (DispatchException e) {
                    // already recorded, awaitAll rethrows it once running work is done
                    logger.debug("no more suites submitted: {}", e.getMessage());
                    return;
                }
            }
        }

        /**
         * JVM system properties, overridden by the ones set on the builder.
         */
        Map<String, String> getSystemProperties() {
            Map<String, String> merged = new HashMap<>();
            System.getProperties().forEach((k, v) -> merged.put(k.toString(), v.toString()));
            if (systemProperties != null) {
                merged.putAll(systemProperties);
            }
            return merged;
        }

        private static int intProperty(Map<String, String> props, String name, int defaultValue) {
            String value = props.get(name);
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid value for " + name + ": " + value, e);
            }
        }

        @Override
        public String toString() {
            return "Runner.Builder{suites=" + suites.size() + ", listeners=" + listeners.size() + "}";
        }

    }

}
