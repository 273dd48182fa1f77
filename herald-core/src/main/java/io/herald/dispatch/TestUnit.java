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
package io.herald.dispatch;

/**
 * A single test of a suite. Unique by name within its suite.
 * <p>
 * How the body ends decides the terminal event: normal return is TEST_SUCCEEDED,
 * {@link io.herald.core.TestPendingException} is TEST_PENDING,
 * {@link io.herald.core.TestCanceledException} is TEST_CANCELED and anything else is TEST_FAILED.
 */
public interface TestUnit {

    String getName();

    default boolean isIgnored() {
        return false;
    }

    void run(TestContext context) throws Exception;

    static TestUnit of(String name, TestBody body) {
        return new TestUnit() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public void run(TestContext context) throws Exception {
                body.run(context);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    static TestUnit ignored(String name) {
        return new TestUnit() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean isIgnored() {
                return true;
            }

            @Override
            public void run(TestContext context) {
                throw new IllegalStateException("ignored test run: " + name);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    @FunctionalInterface
    interface TestBody {

        void run(TestContext context) throws Exception;

    }

}
