package botupdates.subscription;

import botupdates.BotUpdate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded single-consumer queue with drop-oldest overflow and an end-of-stream marker.
 *
 * <p>The producer never blocks: {@link #offer} evicts the oldest queued update when the queue
 * is full. After {@link #close()} offers are ignored, and readers receive whatever was still
 * queued followed by {@link ReadResult#END_OF_STREAM}.
 *
 * <p>This class is thread-safe.
 */
public final class UpdateQueue {
    private final int capacity;
    private final ArrayDeque<BotUpdate> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;
    private long dropped;

    public UpdateQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Appends an update, evicting the oldest one if the queue is full.
     *
     * @return {@code true} if an older update was evicted to make room
     */
    public boolean offer(BotUpdate update) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            boolean evicted = false;
            if (items.size() >= capacity) {
                items.pollFirst();
                dropped++;
                evicted = true;
            }
            items.addLast(update);
            notEmpty.signal();
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until an update is available or the queue is closed and empty.
     */
    public ReadResult take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed) {
                    return ReadResult.END_OF_STREAM;
                }
                notEmpty.await();
            }
            return new ReadResult.Update(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take()} but gives up after the timeout.
     */
    public ReadResult poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed) {
                    return ReadResult.END_OF_STREAM;
                }
                if (nanos <= 0L) {
                    return ReadResult.TIMED_OUT;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return new ReadResult.Update(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns everything currently queued, oldest first.
     */
    public List<BotUpdate> drain() {
        lock.lock();
        try {
            List<BotUpdate> out = new ArrayList<>(items);
            items.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks end-of-stream and wakes all waiting readers. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Number of updates evicted by overflow since creation.
     */
    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }
}
