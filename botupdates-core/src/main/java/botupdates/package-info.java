/**
 * Shared Telegram Bot API long-polling with in-process fan-out.
 *
 * <h2>Core Design</h2>
 * <p>The upstream {@code getUpdates} endpoint allows one poller per bot token; a second one
 * gets HTTP 409. {@link botupdates.BotUpdateHub} therefore keeps exactly one
 * {@linkplain botupdates.poller.BotPoller poller} per token and lets any number of consumers
 * {@linkplain botupdates.BotUpdateHub#attach(long) attach} to it. Each consumer reads from its
 * own bounded {@linkplain botupdates.subscription.BotUpdateSubscription subscription}; a slow
 * consumer loses its oldest updates and never blocks the poller or other consumers.
 *
 * <p>{@code my_chat_member} updates are also buffered while nobody is attached and handed to
 * the next subscriber. The resume cursor is persisted through a
 * {@link botupdates.spi.CursorStore}, so a restart continues where the last process stopped
 * instead of replaying the backlog.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>botupdates-core</b>: model, SPI, poller, hub (zero external deps)</li>
 *   <li><b>botupdates-telegram</b>: HTTP client and chat-membership reconciler</li>
 *   <li><b>botupdates-jdbc</b>: cursor, credential and membership stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>botupdates-micrometer</b>: metrics exporter</li>
 *   <li><b>botupdates-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * @see botupdates.BotUpdateHub
 * @see botupdates.BotUpdate
 */
package botupdates;
