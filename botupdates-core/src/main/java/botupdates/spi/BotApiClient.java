package botupdates.spi;

import botupdates.BotUpdate;
import botupdates.UpstreamConflictException;
import botupdates.UpstreamFailureException;
import botupdates.UpstreamRateLimitedException;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Single {@code getUpdates} call against the Bot API.
 *
 * <p>Implementations perform no retries; the poller owns retry policy. The call must
 * honour a hard timeout and must return promptly when the calling thread is interrupted.
 *
 * @see botupdates.poller.BotPoller
 */
public interface BotApiClient {

    /**
     * Fetches the next batch of updates.
     *
     * @param token          bot token
     * @param offset         first update id to return; all lower ids are confirmed upstream
     * @param timeout        long-poll timeout; {@link Duration#ZERO} for a short poll
     * @param limit          maximum number of updates (1-100)
     * @param allowedUpdates update kinds to receive, as wire names
     * @return updates in ascending {@code updateId} order, possibly empty
     * @throws UpstreamConflictException    another poller holds the token
     * @throws UpstreamRateLimitedException the server asked to slow down
     * @throws UpstreamFailureException     anything else
     * @throws InterruptedException         if the calling thread was interrupted
     */
    List<BotUpdate> getUpdates(String token, long offset, Duration timeout, int limit,
                               Set<String> allowedUpdates) throws InterruptedException;
}
