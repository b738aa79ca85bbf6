package botupdates.spi;

import java.util.OptionalLong;

/**
 * Durable storage for per-token poll cursors.
 *
 * <p>The poller only calls {@link #saveCursor} with a value larger than anything it saved
 * before. Implementations should still refuse to move a stored cursor backwards, since two
 * processes may share one store.
 *
 * @see botupdates.poller.BotPoller
 */
public interface CursorStore {

    /**
     * Returns the persisted next offset for the token, or empty on first use.
     */
    OptionalLong loadCursor(String token);

    /**
     * Persists the next offset for the token.
     *
     * @param token  bot token
     * @param cursor next update id to request
     */
    void saveCursor(String token, long cursor);
}
