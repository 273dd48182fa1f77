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

/**
 * Holds the current {@link Ordinal} of one logical activity (a run, a suite or a test).
 * Each event producer owns a tracker and asks it for the ordinal of the next event;
 * distributing work to another thread hands that work a forked tracker.
 */
public class Tracker {

    private Ordinal current;

    public Tracker() {
        this(new Ordinal(0));
    }

    public Tracker(Ordinal seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed ordinal is null");
        }
        this.current = seed;
    }

    public static Tracker forRun(int runStamp) {
        return new Tracker(new Ordinal(runStamp));
    }

    /**
     * Returns the ordinal for the next event and advances.
     */
    public synchronized Ordinal nextOrdinal() {
        Ordinal ordinal = current;
        current = current.next();
        return ordinal;
    }

    /**
     * Forks the lineage for a child activity. The returned tracker produces ordinals
     * that sort before anything this tracker produces afterwards.
     */
    public synchronized Tracker nextTracker() {
        Ordinal.Fork fork = current.nextNewBranch();
        current = fork.continuation();
        return new Tracker(fork.branch());
    }

    public synchronized Ordinal peek() {
        return current;
    }

}
