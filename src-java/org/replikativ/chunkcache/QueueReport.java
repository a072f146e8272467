package org.replikativ.chunkcache;

/**
 * Summary of one drain step of the load queue.
 */
public final class QueueReport {

    static final QueueReport EMPTY = new QueueReport(0, 0, 0);

    private final int processed;
    private final int failed;
    private final int remaining;

    QueueReport(int processed, int failed, int remaining) {
        this.processed = processed;
        this.failed = failed;
        this.remaining = remaining;
    }

    /** Number of fetches dispatched in this step (successful or not). */
    public int getProcessed() { return processed; }
    /** Number of dispatched fetches that failed. */
    public int getFailed() { return failed; }
    /** Keys still queued after the step completed. */
    public int getRemaining() { return remaining; }

    @Override
    public String toString() {
        return "QueueReport{processed=" + processed + ", failed=" + failed + ", remaining=" + remaining + "}";
    }
}
