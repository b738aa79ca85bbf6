package botupdates.poller;

/**
 * Why a poller stopped calling upstream.
 */
public enum PauseReason {
    /** The bot record no longer exists. */
    CREDENTIAL_REMOVED(true),
    /** The bot record is deactivated. */
    CREDENTIAL_INACTIVE(false),
    /** The bot record now carries a different token; a new poller serves the new one. */
    TOKEN_ROTATED(true);

    private final boolean stale;

    PauseReason(boolean stale) {
        this.stale = stale;
    }

    /**
     * Returns {@code true} if the poller can never resume and may be evicted.
     */
    public boolean isStale() {
        return stale;
    }
}
