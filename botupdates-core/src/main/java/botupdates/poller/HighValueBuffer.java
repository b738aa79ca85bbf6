package botupdates.poller;

import botupdates.BotUpdate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded FIFO holding {@code my_chat_member} updates until a subscriber picks them up.
 *
 * <p>Not thread-safe; the owning {@link BotPoller} guards it with its subscriber lock.
 */
final class HighValueBuffer {
    private final int capacity;
    private final ArrayDeque<BotUpdate> items = new ArrayDeque<>();

    HighValueBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    /**
     * Appends an update, evicting the oldest if full.
     *
     * @return {@code true} if an update was evicted
     */
    boolean add(BotUpdate update) {
        boolean evicted = false;
        if (items.size() >= capacity) {
            items.pollFirst();
            evicted = true;
        }
        items.addLast(update);
        return evicted;
    }

    /**
     * Moves all buffered updates out, oldest first, leaving the buffer empty.
     */
    List<BotUpdate> drainAll() {
        if (items.isEmpty()) {
            return List.of();
        }
        List<BotUpdate> out = new ArrayList<>(items);
        items.clear();
        return out;
    }

    int size() {
        return items.size();
    }

    int capacity() {
        return capacity;
    }
}
