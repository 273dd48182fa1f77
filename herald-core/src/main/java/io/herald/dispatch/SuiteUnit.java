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
 * A suite handed to a {@link Dispatcher}. The dispatcher reports its start and end,
 * the body reports everything in between through the {@link SuiteContext}.
 * <p>
 * A body that throws ends the suite with SUITE_ABORTED.
 */
public interface SuiteUnit {

    /**
     * Unique within a run. A second suite with the same id is a protocol violation.
     */
    String getSuiteId();

    default String getSuiteName() {
        return getSuiteId();
    }

    void run(SuiteContext context) throws Exception;

    static SuiteUnit of(String suiteId, SuiteBody body) {
        return of(suiteId, suiteId, body);
    }

    static SuiteUnit of(String suiteId, String suiteName, SuiteBody body) {
        return new SuiteUnit() {
            @Override
            public String getSuiteId() {
                return suiteId;
            }

            @Override
            public String getSuiteName() {
                return suiteName;
            }

            @Override
            public void run(SuiteContext context) throws Exception {
                body.run(context);
            }

            @Override
            public String toString() {
                return suiteId;
            }
        };
    }

    @FunctionalInterface
    interface SuiteBody {

        void run(SuiteContext context) throws Exception;

    }

}
