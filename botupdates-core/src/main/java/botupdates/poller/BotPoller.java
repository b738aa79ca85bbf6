package botupdates.poller;

import botupdates.BotUpdate;
import botupdates.UpdateType;
import botupdates.UpstreamConflictException;
import botupdates.UpstreamRateLimitedException;
import botupdates.model.BotCredential;
import botupdates.spi.BotApiClient;
import botupdates.spi.CredentialSource;
import botupdates.spi.CursorStore;
import botupdates.spi.MetricsExporter;
import botupdates.subscription.BotUpdateSubscription;
import botupdates.subscription.UpdateQueue;
import botupdates.util.DaemonThreadFactory;
import botupdates.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single long-polling loop for one bot token, fanning every update out to any number of
 * subscriptions.
 *
 * <p>On first use of a token (no persisted cursor) the poller fast-forwards past the upstream
 * backlog so that historical traffic is not replayed, while collecting every pending
 * {@code my_chat_member} update. It then long-polls forever, backing off on 409 conflicts,
 * 429 rate limits and other failures, and pausing while the bot is deactivated or its token
 * has been replaced.
 *
 * <p>{@code my_chat_member} updates are additionally kept in a bounded buffer whether or not
 * anyone is subscribed. The next {@link #subscribe()} call moves the buffer into the new
 * subscription before any later update.
 *
 * <p>Create instances via {@link #builder()} and call {@link #start()}. This class is
 * thread-safe. {@link #start()} and {@link #close()} are synchronized.
 *
 * @see botupdates.BotUpdateHub
 */
public final class BotPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(BotPoller.class.getName());

    private static final Set<String> HIGH_VALUE_ONLY = Set.of(UpdateType.MY_CHAT_MEMBER.wireName());

    private final long botId;
    private final String token;
    private final BotApiClient apiClient;
    private final CredentialSource credentialSource;
    private final CursorStore cursorStore;
    private final MetricsExporter metrics;
    private final Sleeper sleeper;
    private final PollerConfig config;
    private final Set<String> allowedUpdates;

    // Guards subscribers and highValue
    private final Object subscriberLock = new Object();
    private final Map<Long, UpdateQueue> subscribers = new LinkedHashMap<>();
    private final HighValueBuffer highValue;
    private final AtomicLong subscriptionIds = new AtomicLong();

    private volatile PollerState state = PollerState.BOOTSTRAPPING;
    private volatile PauseReason pauseReason;
    private volatile long cursor;
    private volatile int conflictStreak;
    private volatile boolean closed;

    // Loop-thread only
    private long persistedCursor = -1L;
    private long lastCredentialCheckNanos;
    private boolean credentialChecked;

    private ExecutorService executor;

    private BotPoller(Builder builder) {
        this.token = Objects.requireNonNull(builder.token, "token").trim();
        if (token.isEmpty()) {
            throw new IllegalArgumentException("token must not be blank");
        }
        this.apiClient = Objects.requireNonNull(builder.apiClient, "apiClient");
        this.credentialSource = Objects.requireNonNull(builder.credentialSource, "credentialSource");
        this.cursorStore = Objects.requireNonNull(builder.cursorStore, "cursorStore");
        this.botId = builder.botId;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.config = (builder.config != null ? builder.config : new PollerConfig()).copy().validate();
        this.allowedUpdates = UpdateType.wireNames(config.getAllowedUpdates());
        this.highValue = new HighValueBuffer(config.getHighValueBufferCapacity());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the background loop. Subsequent calls are no-ops.
     *
     * @throws IllegalStateException if the poller has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("BotPoller has been closed");
        }
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("bot-poller-" + botId + "-"));
        executor.execute(this::run);
        metrics.pollerStarted();
    }

    /**
     * Attaches a subscription with the configured capacity.
     */
    public BotUpdateSubscription subscribe() {
        return subscribe(config.getSubscriptionCapacity());
    }

    /**
     * Attaches a subscription and moves every buffered {@code my_chat_member} update into it.
     *
     * <p>If the buffer holds more updates than {@code capacity}, the oldest ones are dropped.
     * Subscribing to a closed poller returns a subscription that is already at end-of-stream.
     *
     * @param capacity queue capacity for the new subscription
     * @return the new subscription
     */
    public BotUpdateSubscription subscribe(int capacity) {
        UpdateQueue queue = new UpdateQueue(capacity);
        long id = subscriptionIds.incrementAndGet();
        int dropped = 0;
        int handedOver;
        synchronized (subscriberLock) {
            if (closed) {
                queue.close();
                return new BotUpdateSubscription(botId, queue, () -> {
                });
            }
            subscribers.put(id, queue);
            List<BotUpdate> pending = highValue.drainAll();
            handedOver = pending.size();
            for (BotUpdate update : pending) {
                if (queue.offer(update)) {
                    dropped++;
                }
            }
        }
        metrics.subscriptionOpened();
        if (dropped > 0) {
            logger.log(Level.FINE, "Subscription for botId=" + botId + " too small for buffered updates; dropped "
                    + dropped + " of " + handedOver);
            for (int i = 0; i < dropped; i++) {
                metrics.incrementDropped();
            }
        }
        return new BotUpdateSubscription(botId, queue, () -> unsubscribe(id));
    }

    private void unsubscribe(long id) {
        UpdateQueue removed;
        synchronized (subscriberLock) {
            removed = subscribers.remove(id);
        }
        if (removed != null) {
            removed.close();
            metrics.subscriptionClosed();
        }
    }

    private void run() {
        try {
            bootstrap();
            state = PollerState.RUNNING;
            sleeper.sleep(config.getInitialDelay());
            pollLoop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (closed) {
                state = PollerState.STOPPED;
            }
        }
    }

    private void bootstrap() throws InterruptedException {
        while (true) {
            try {
                OptionalLong persisted = loadCursor();
                if (persisted.isPresent()) {
                    cursor = persisted.getAsLong();
                    persistedCursor = cursor;
                } else {
                    fastForward();
                }
                return;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Bootstrap failed for botId=" + botId + ", retrying", e);
                sleeper.sleep(config.getFailureDelay());
            }
        }
    }

    private OptionalLong loadCursor() throws InterruptedException {
        while (!closed) {
            try {
                return cursorStore.loadCursor(token);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to load cursor for botId=" + botId + ", retrying", e);
                sleeper.sleep(config.getFailureDelay());
            }
        }
        throw new InterruptedException("closed");
    }

    /**
     * Cold-start sequence: collect pending {@code my_chat_member} updates, then skip to the
     * upstream tip and persist the resulting cursor.
     */
    private void fastForward() throws InterruptedException {
        int maxBatches = config.getFastForwardMaxBatches();

        long offset = 0L;
        int batches = 0;
        boolean drained = false;
        int collected = 0;
        while (batches < maxBatches) {
            List<BotUpdate> batch = fetch(offset, Duration.ZERO, HIGH_VALUE_ONLY);
            if (batch == null) {
                continue;
            }
            batches++;
            long max = maxUpdateId(batch);
            if (max < 0) {
                drained = true;
                break;
            }
            for (BotUpdate update : batch) {
                if (update.is(UpdateType.MY_CHAT_MEMBER)) {
                    publish(update);
                    collected++;
                }
            }
            offset = max + 1;
        }
        if (!drained) {
            logger.warning("Fast-forward for botId=" + botId + " stopped after " + maxBatches
                    + " batches of my_chat_member updates; older membership changes may be missing");
        }

        batches = 0;
        drained = false;
        while (batches < maxBatches) {
            List<BotUpdate> batch = fetch(offset, Duration.ZERO, allowedUpdates);
            if (batch == null) {
                continue;
            }
            batches++;
            long max = maxUpdateId(batch);
            if (max < 0) {
                drained = true;
                break;
            }
            // membership changes that landed after the first phase drained
            for (BotUpdate update : batch) {
                if (update.is(UpdateType.MY_CHAT_MEMBER)) {
                    publish(update);
                    collected++;
                }
            }
            offset = max + 1;
        }
        if (!drained) {
            logger.warning("Fast-forward for botId=" + botId + " stopped after " + maxBatches
                    + " batches; remaining backlog will be delivered");
        }

        cursor = offset;
        if (offset > 0) {
            persist(offset);
        }
        logger.info("Bootstrapped botId=" + botId + " at cursor " + offset + " with " + collected
                + " buffered my_chat_member updates");
    }

    private void pollLoop() throws InterruptedException {
        while (!closed && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Poll cycle failed for botId=" + botId, e);
                sleeper.sleep(config.getFailureDelay());
            }
        }
    }

    /**
     * One loop iteration. The cursor only moves once the whole batch is published, so a
     * failure part way through makes the next iteration fetch the same batch again.
     */
    private void pollOnce() throws InterruptedException {
        if (!pollingEnabled()) {
            state = PollerState.PAUSED;
            conflictStreak = 0;
            sleeper.sleep(config.getCredentialCheckInterval());
            return;
        }
        state = PollerState.RUNNING;

        List<BotUpdate> batch = fetch(cursor, config.getPollTimeout(), allowedUpdates);
        if (batch == null || batch.isEmpty()) {
            return;
        }
        metrics.incrementUpdatesReceived(batch.size());
        long max = -1L;
        for (BotUpdate update : batch) {
            publish(update);
            max = Math.max(max, update.updateId());
        }
        advanceCursor(max + 1);
    }

    /**
     * Issues one upstream call. Returns {@code null} after a handled failure, once the
     * matching backoff has elapsed.
     */
    private List<BotUpdate> fetch(long offset, Duration timeout, Set<String> allowed) throws InterruptedException {
        if (closed) {
            throw new InterruptedException("closed");
        }
        try {
            List<BotUpdate> batch = apiClient.getUpdates(token, offset, timeout, config.getPollLimit(), allowed);
            metrics.incrementPolls();
            conflictStreak = 0;
            return batch == null ? List.of() : batch;
        } catch (UpstreamConflictException e) {
            int streak = conflictStreak + 1;
            conflictStreak = streak;
            metrics.incrementConflicts();
            long delayMs = config.getConflictBackoff().computeDelayMs(streak);
            logger.warning("getUpdates conflict for botId=" + botId + " (streak " + streak + "), retrying in "
                    + delayMs + "ms; another process is polling the same bot token");
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (UpstreamRateLimitedException e) {
            metrics.incrementRateLimited();
            Duration wait = clamp(e.retryAfter(), config.getMinRateLimitWait(), config.getMaxRateLimitWait());
            logger.warning("getUpdates rate limited for botId=" + botId + ", retrying in " + wait.toSeconds() + "s");
            sleeper.sleep(wait);
        } catch (RuntimeException e) {
            metrics.incrementPollFailures();
            logger.log(Level.WARNING, "getUpdates failed for botId=" + botId, e);
            sleeper.sleep(config.getFailureDelay());
        }
        return null;
    }

    private void publish(BotUpdate update) {
        int dropped = 0;
        boolean evicted = false;
        synchronized (subscriberLock) {
            if (update.is(UpdateType.MY_CHAT_MEMBER)) {
                evicted = highValue.add(update);
            }
            for (UpdateQueue queue : subscribers.values()) {
                if (queue.offer(update)) {
                    dropped++;
                }
            }
        }
        if (evicted) {
            metrics.incrementHighValueEvicted();
        }
        if (dropped > 0) {
            logger.log(Level.FINE, "Dropped oldest queued update for " + dropped + " slow subscriber(s) of botId="
                    + botId);
            for (int i = 0; i < dropped; i++) {
                metrics.incrementDropped();
            }
        }
    }

    private void advanceCursor(long next) {
        if (next <= cursor) {
            return;
        }
        cursor = next;
        persist(next);
    }

    private void persist(long value) {
        if (value <= persistedCursor) {
            return;
        }
        try {
            cursorStore.saveCursor(token, value);
            persistedCursor = value;
        } catch (RuntimeException e) {
            metrics.incrementCursorSaveFailures();
            logger.log(Level.WARNING, "Failed to persist cursor " + value + " for botId=" + botId, e);
        }
    }

    private boolean pollingEnabled() {
        long now = System.nanoTime();
        if (credentialChecked && pauseReason == null
                && now - lastCredentialCheckNanos < config.getCredentialCheckInterval().toNanos()) {
            return true;
        }
        credentialChecked = true;
        lastCredentialCheckNanos = now;

        PauseReason reason = checkCredential();
        PauseReason previous = pauseReason;
        pauseReason = reason;
        if (reason == null) {
            if (previous != null) {
                logger.info("Resuming poller for botId=" + botId);
            }
            return true;
        }
        if (reason != previous) {
            logger.warning("Pausing poller for botId=" + botId + ": " + reason);
        }
        return false;
    }

    private PauseReason checkCredential() {
        Optional<BotCredential> credential;
        try {
            credential = credentialSource.findCredential(botId);
        } catch (RuntimeException e) {
            // A flaky lookup must not stop polling
            logger.log(Level.WARNING, "Credential check failed for botId=" + botId + ", keeping poller running", e);
            return null;
        }
        if (credential.isEmpty()) {
            return PauseReason.CREDENTIAL_REMOVED;
        }
        if (!credential.get().active()) {
            return PauseReason.CREDENTIAL_INACTIVE;
        }
        if (!token.equals(credential.get().token())) {
            return PauseReason.TOKEN_ROTATED;
        }
        return null;
    }

    private static long maxUpdateId(List<BotUpdate> batch) {
        long max = -1L;
        for (BotUpdate update : batch) {
            max = Math.max(max, update.updateId());
        }
        return max;
    }

    private static Duration clamp(Duration value, Duration min, Duration max) {
        if (value.compareTo(min) < 0) {
            return min;
        }
        return value.compareTo(max) > 0 ? max : value;
    }

    public long botId() {
        return botId;
    }

    /**
     * Returns {@code true} if this poller serves the given token.
     */
    public boolean servesToken(String candidate) {
        return token.equals(candidate);
    }

    public PollerState state() {
        return state;
    }

    /**
     * Reason for the current pause, or {@code null} while not paused.
     */
    public PauseReason pauseReason() {
        return state == PollerState.PAUSED ? pauseReason : null;
    }

    /**
     * Returns {@code true} if the poller is paused for a reason it cannot recover from.
     */
    public boolean isStale() {
        PauseReason reason = pauseReason();
        return reason != null && reason.isStale();
    }

    public long cursor() {
        return cursor;
    }

    public int conflictStreak() {
        return conflictStreak;
    }

    public int subscriberCount() {
        synchronized (subscriberLock) {
            return subscribers.size();
        }
    }

    public int bufferedHighValueCount() {
        synchronized (subscriberLock) {
            return highValue.size();
        }
    }

    public PollerStatus status() {
        int subs;
        int buffered;
        synchronized (subscriberLock) {
            subs = subscribers.size();
            buffered = highValue.size();
        }
        return new PollerStatus(botId, state, pauseReason(), cursor, conflictStreak, subs, buffered);
    }

    /**
     * Stops the loop, waits up to the configured shutdown timeout for it to exit, and closes
     * every subscription so readers observe end-of-stream. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warning("Poller for botId=" + botId + " did not stop within "
                            + config.getShutdownTimeout().toMillis() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            metrics.pollerStopped();
        }
        state = PollerState.STOPPED;

        List<UpdateQueue> remaining;
        synchronized (subscriberLock) {
            remaining = new ArrayList<>(subscribers.values());
            subscribers.clear();
        }
        for (UpdateQueue queue : remaining) {
            queue.close();
            metrics.subscriptionClosed();
        }
    }

    @Override
    public String toString() {
        return "BotPoller{botId=" + botId + ", state=" + state + ", cursor=" + cursor + "}";
    }

    /**
     * Builder for {@link BotPoller}.
     */
    public static final class Builder {
        private long botId;
        private String token;
        private BotApiClient apiClient;
        private CredentialSource credentialSource;
        private CursorStore cursorStore;
        private MetricsExporter metrics;
        private Sleeper sleeper;
        private PollerConfig config;

        private Builder() {
        }

        /**
         * Sets the bot record id used for credential checks and log messages.
         *
         * <p><b>Required.</b>
         */
        public Builder botId(long botId) {
            this.botId = botId;
            return this;
        }

        /**
         * Sets the token this poller serves for its whole lifetime.
         *
         * <p><b>Required.</b>
         */
        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets the upstream client.
         *
         * <p><b>Required.</b>
         */
        public Builder apiClient(BotApiClient apiClient) {
            this.apiClient = apiClient;
            return this;
        }

        /**
         * Sets the credential source consulted by the pause check.
         *
         * <p><b>Required.</b>
         */
        public Builder credentialSource(CredentialSource credentialSource) {
            this.credentialSource = credentialSource;
            return this;
        }

        /**
         * Sets the cursor store.
         *
         * <p><b>Required.</b>
         */
        public Builder cursorStore(CursorStore cursorStore) {
            this.cursorStore = cursorStore;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@link Sleeper#SYSTEM}.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Optional. Defaults to a new {@link PollerConfig}. The config is copied.
         */
        public Builder config(PollerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Builds the poller. Call {@link BotPoller#start()} to begin polling.
         *
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if the token is blank or the config is invalid
         */
        public BotPoller build() {
            return new BotPoller(this);
        }
    }
}
