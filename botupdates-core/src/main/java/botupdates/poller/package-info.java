/**
 * Per-token long-polling loop.
 *
 * <p>{@link botupdates.poller.BotPoller} fast-forwards past the upstream backlog on first
 * use of a token, then long-polls, fanning updates out to its subscriptions. Timing is
 * controlled by {@link botupdates.poller.PollerConfig}.
 *
 * @see botupdates.poller.BotPoller
 * @see botupdates.poller.PollerConfig
 */
package botupdates.poller;
