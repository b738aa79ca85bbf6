package botupdates.subscription;

import botupdates.BotUpdate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One consumer's live view of a bot's update stream.
 *
 * <p>Obtained from {@link botupdates.BotUpdateHub#attach}. Reads block only on this
 * subscription's own queue; a slow reader loses its oldest queued updates and never slows
 * down the poller or other subscribers.
 *
 * <pre>{@code
 * try (BotUpdateSubscription sub = hub.attach(botId)) {
 *     while (true) {
 *         ReadResult r = sub.read(Duration.ofSeconds(30));
 *         if (r.isEndOfStream()) break;
 *         BotUpdate update = r.updateOrNull();
 *         if (update != null) handle(update);
 *     }
 * }
 * }</pre>
 *
 * <p>{@link #close()} detaches and is idempotent, so it is safe in a {@code finally} block
 * even after the hub has shut down.
 */
public final class BotUpdateSubscription implements AutoCloseable {
    private final long botId;
    private final UpdateQueue queue;
    private final Runnable detach;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Created by {@link botupdates.poller.BotPoller#subscribe()}.
     *
     * @param botId  bot this subscription belongs to
     * @param queue  inbound queue fed by the poller
     * @param detach removes the queue from the poller; invoked at most once
     */
    public BotUpdateSubscription(long botId, UpdateQueue queue, Runnable detach) {
        this.botId = botId;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.detach = Objects.requireNonNull(detach, "detach");
    }

    public long botId() {
        return botId;
    }

    /**
     * Blocks until the next update arrives or the stream ends.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ReadResult read() throws InterruptedException {
        return queue.take();
    }

    /**
     * Blocks until the next update arrives, the stream ends, or the timeout elapses.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ReadResult read(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Returns everything queued right now without waiting.
     */
    public List<BotUpdate> drain() {
        return queue.drain();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return queue.capacity();
    }

    /**
     * Number of updates this subscription lost to overflow.
     */
    public long droppedCount() {
        return queue.droppedCount();
    }

    /**
     * Returns {@code true} once detached, either by {@link #close()} or by the poller stopping.
     */
    public boolean isClosed() {
        return queue.isClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            detach.run();
        } finally {
            queue.close();
        }
    }

    @Override
    public String toString() {
        return "BotUpdateSubscription{botId=" + botId + ", size=" + queue.size() + "}";
    }
}
