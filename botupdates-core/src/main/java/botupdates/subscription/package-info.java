/**
 * Consumer side of the hub: per-consumer bounded queues with drop-oldest overflow.
 *
 * @see botupdates.subscription.BotUpdateSubscription
 * @see botupdates.subscription.ReadResult
 */
package botupdates.subscription;
