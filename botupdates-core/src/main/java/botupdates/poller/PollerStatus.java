package botupdates.poller;

/**
 * Point-in-time view of one poller, for administrative pages.
 *
 * @param botId            bot the poller was created for
 * @param state            lifecycle state
 * @param pauseReason      why the poller is paused, or {@code null}
 * @param cursor           next update id to request
 * @param conflictStreak   consecutive 409 responses
 * @param subscribers      live subscriptions
 * @param bufferedHighValue {@code my_chat_member} updates waiting for a subscriber
 */
public record PollerStatus(
        long botId,
        PollerState state,
        PauseReason pauseReason,
        long cursor,
        int conflictStreak,
        int subscribers,
        int bufferedHighValue
) {}
