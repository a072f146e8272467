package org.replikativ.chunkcache;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Executor that parks tasks until the test runs them.
 */
class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.add(command);
    }

    synchronized int queued() {
        return tasks.size();
    }

    /**
     * Run the oldest parked task.
     */
    void runNext() {
        Runnable next;
        synchronized (this) {
            next = tasks.poll();
        }
        if (next == null) {
            throw new IllegalStateException("No task queued");
        }
        next.run();
    }

    void runAll() {
        while (queued() > 0) {
            runNext();
        }
    }
}
