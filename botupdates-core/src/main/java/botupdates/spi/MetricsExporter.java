package botupdates.spi;

/**
 * Observability hook for exporting hub counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system; one exporter is shared by all pollers of
 * a hub, so implementations must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of completed {@code getUpdates} calls.
     */
    void incrementPolls();

    /**
     * Increments the count of updates received from upstream.
     *
     * @param count number of updates in the batch
     */
    void incrementUpdatesReceived(int count);

    /**
     * Increments the count of 409 conflicts.
     */
    void incrementConflicts();

    /**
     * Increments the count of 429 responses.
     */
    void incrementRateLimited();

    /**
     * Increments the count of other upstream failures.
     */
    void incrementPollFailures();

    /**
     * Increments the count of updates discarded because a subscription queue was full.
     */
    void incrementDropped();

    /**
     * Increments the count of buffered {@code my_chat_member} updates evicted by newer ones.
     */
    default void incrementHighValueEvicted() {
    }

    /**
     * Increments the count of failed cursor writes.
     */
    default void incrementCursorSaveFailures() {
    }

    /**
     * Called when a subscription is attached.
     */
    void subscriptionOpened();

    /**
     * Called when a subscription is detached or closed by its poller.
     */
    void subscriptionClosed();

    /**
     * Called when a poller thread starts.
     */
    void pollerStarted();

    /**
     * Called when a poller is stopped.
     */
    void pollerStopped();

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPolls() {
        }

        @Override
        public void incrementUpdatesReceived(int count) {
        }

        @Override
        public void incrementConflicts() {
        }

        @Override
        public void incrementRateLimited() {
        }

        @Override
        public void incrementPollFailures() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void subscriptionOpened() {
        }

        @Override
        public void subscriptionClosed() {
        }

        @Override
        public void pollerStarted() {
        }

        @Override
        public void pollerStopped() {
        }
    }
}
