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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Logical timestamp attached to every {@link RunEvent}.
 * <p>
 * An ordinal is a run stamp followed by a path of stamps. {@link #next()} bumps the
 * last stamp, {@link #nextNewBranch()} forks the path so that everything a child
 * activity produces sorts after the fork point and before whatever the parent
 * does next:
 * <pre>
 * [99, 0, 1]      this
 * [99, 0, 1, 0]   fork.branch()
 * [99, 0, 2]      fork.continuation()
 * </pre>
 * Instances are immutable.
 */
public final class Ordinal implements Comparable<Ordinal> {

    private final int runStamp;
    private final int[] stamps;

    public Ordinal(int runStamp) {
        this(runStamp, new int[]{0});
    }

    private Ordinal(int runStamp, int[] stamps) {
        this.runStamp = runStamp;
        this.stamps = stamps;
    }

    public Ordinal next() {
        int[] copy = Arrays.copyOf(stamps, stamps.length);
        copy[copy.length - 1]++;
        return new Ordinal(runStamp, copy);
    }

    public Fork nextNewBranch() {
        int[] branch = Arrays.copyOf(stamps, stamps.length + 1);
        return new Fork(new Ordinal(runStamp, branch), next());
    }

    public int getRunStamp() {
        return runStamp;
    }

    public int getDepth() {
        return stamps.length;
    }

    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(stamps.length + 1);
        list.add(runStamp);
        for (int stamp : stamps) {
            list.add(stamp);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public int compareTo(Ordinal that) {
        int diff = Integer.compare(runStamp, that.runStamp);
        if (diff != 0) {
            return diff;
        }
        int shorter = Math.min(stamps.length, that.stamps.length);
        for (int i = 0; i < shorter; i++) {
            diff = Integer.compare(stamps[i], that.stamps[i]);
            if (diff != 0) {
                return diff;
            }
        }
        // equal up to the shorter length: the branch (longer path) happened
        // before the parent's next step, which is always a shorter path
        return Integer.compare(stamps.length, that.stamps.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ordinal)) {
            return false;
        }
        Ordinal that = (Ordinal) o;
        return runStamp == that.runStamp && Arrays.equals(stamps, that.stamps);
    }

    @Override
    public int hashCode() {
        return 31 * runStamp + Arrays.hashCode(stamps);
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    /**
     * Result of {@link #nextNewBranch()}: the seed for the child activity and
     * the ordinal the parent continues with.
     */
    public record Fork(Ordinal branch, Ordinal continuation) {
    }

}
