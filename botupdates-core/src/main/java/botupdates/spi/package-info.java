/**
 * Service Provider Interfaces through which the hub reaches its collaborators.
 *
 * <p>{@link botupdates.spi.BotApiClient} talks to the upstream endpoint,
 * {@link botupdates.spi.CredentialSource} and {@link botupdates.spi.CursorStore} are the
 * source of truth for tokens and resume positions, and {@link botupdates.spi.MetricsExporter}
 * receives counters and gauges.
 */
package botupdates.spi;
