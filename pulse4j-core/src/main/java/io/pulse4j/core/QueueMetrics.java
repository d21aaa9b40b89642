package io.pulse4j.core;

/**
 * Queue counts per status.
 *
 * <p>{@code throughput} is the number of jobs this process completed during the last minute;
 * stores report it as 0 and the dispatcher fills it in.
 */
public record QueueMetrics(
        long pending,
        long processing,
        long completed,
        long failed,
        long total,
        long throughput
) {

    public static QueueMetrics empty() {
        return new QueueMetrics(0, 0, 0, 0, 0, 0);
    }

    public QueueMetrics withThroughput(long throughput) {
        return new QueueMetrics(pending, processing, completed, failed, total, throughput);
    }
}
