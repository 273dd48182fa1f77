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

import io.herald.core.DispatchException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Tracks one submitted suite or test.
 */
public class DispatchHandle {

    private final String name;
    private final FutureTask<Void> task;

    DispatchHandle(String name, Runnable body) {
        this.name = name;
        this.task = new FutureTask<>(body, null);
    }

    static DispatchHandle completed(String name) {
        DispatchHandle handle = new DispatchHandle(name, () -> {
        });
        handle.task.run();
        return handle;
    }

    public String getName() {
        return name;
    }

    public boolean isDone() {
        return task.isDone();
    }

    /**
     * Waits for the unit. Failures of the unit itself are reported as events, this
     * only throws when waiting is no longer possible.
     */
    public void await() {
        try {
            task.get();
        } catch (CancellationException e) {
            // never scheduled, the unit was reported as skipped instead
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            throw new DispatchException(name + " failed outside of its body", e.getCause());
        }
    }

    FutureTask<Void> task() {
        return task;
    }

    void cancel() {
        task.cancel(false);
    }

    /**
     * Takes the task off the queue and runs it on the calling thread, unless a worker
     * already picked it up.
     */
    boolean runIfQueued(ThreadPoolExecutor executor) {
        if (executor.remove(task)) {
            task.run();
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name + (isDone() ? " (done)" : "");
    }

}
