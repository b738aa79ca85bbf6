package botupdates.poller;

/**
 * Lifecycle of a {@link BotPoller}.
 *
 * <pre>
 * BOOTSTRAPPING → RUNNING ⇄ PAUSED
 *        └────────────┴────────┴──→ STOPPED
 * </pre>
 */
public enum PollerState {
    /** Loading the cursor, or fast-forwarding past the backlog on first use of a token. */
    BOOTSTRAPPING,
    /** Long-polling and fanning out. */
    RUNNING,
    /** The credential check failed; no upstream calls until it passes again. */
    PAUSED,
    /** Terminal, reached only through {@link BotPoller#close()}. */
    STOPPED
}
