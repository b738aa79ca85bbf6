package botupdates;

import botupdates.model.BotCredential;
import botupdates.poller.BotPoller;
import botupdates.poller.PollerConfig;
import botupdates.poller.PollerStatus;
import botupdates.spi.BotApiClient;
import botupdates.spi.CredentialSource;
import botupdates.spi.CursorStore;
import botupdates.spi.MetricsExporter;
import botupdates.subscription.BotUpdateSubscription;
import botupdates.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide registry that owns at most one {@link BotPoller} per bot token and hands out
 * subscriptions to it.
 *
 * <p>Consumers call {@link #attach(long)} to receive a live copy of a bot's update stream.
 * The first attach for a token creates and starts its poller; later attaches share it. Closing
 * the returned subscription detaches the consumer while the poller keeps running, so
 * {@code my_chat_member} updates keep being buffered for the next consumer.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (BotUpdateHub hub = BotUpdateHub.builder()
 *     .credentialSource(credentials)
 *     .cursorStore(cursors)
 *     .apiClient(TelegramBotApiClient.builder().build())
 *     .build();
 *     BotUpdateSubscription sub = hub.attach(botId)) {
 *   ReadResult r;
 *   while (!(r = sub.read()).isEndOfStream()) {
 *     handle(r.updateOrNull());
 *   }
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see BotPoller
 * @see BotUpdateSubscription
 */
public final class BotUpdateHub implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BotUpdateHub.class.getName());

  private static final Duration NO_TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  private final CredentialSource credentialSource;
  private final CursorStore cursorStore;
  private final BotApiClient apiClient;
  private final PollerConfig pollerConfig;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;

  private final ReentrantLock registryLock = new ReentrantLock();
  // Keyed by token. Guarded by registryLock
  private final Map<String, BotPoller> pollers = new HashMap<>();
  private volatile boolean closed;

  private BotUpdateHub(Builder builder) {
    this.credentialSource = Objects.requireNonNull(builder.credentialSource, "credentialSource");
    this.cursorStore = Objects.requireNonNull(builder.cursorStore, "cursorStore");
    this.apiClient = Objects.requireNonNull(builder.apiClient, "apiClient");
    this.pollerConfig = (builder.pollerConfig != null ? builder.pollerConfig : new PollerConfig())
        .copy().validate();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Attaches to the update stream of a bot, waiting as long as needed for the registry.
   *
   * @param botId bot record id
   * @return a new subscription; close it to detach
   * @throws CredentialNotFoundException if the bot does not exist or has no token
   * @throws CredentialInactiveException if the bot is deactivated
   * @throws AttachCancelledException    if the calling thread is interrupted
   * @throws IllegalStateException       if the hub has been closed
   */
  public BotUpdateSubscription attach(long botId) {
    return attach(botId, NO_TIMEOUT);
  }

  /**
   * Attaches to the update stream of a bot.
   *
   * <p>The credential is resolved before the registry lock is taken. Waiting for the lock is
   * bounded by {@code timeout} and can be interrupted. Stale pollers are evicted on the way.
   *
   * @param botId   bot record id
   * @param timeout maximum time to wait for the registry lock
   * @return a new subscription; close it to detach
   * @throws CredentialNotFoundException if the bot does not exist or has no token
   * @throws CredentialInactiveException if the bot is deactivated
   * @throws AttachCancelledException    if the timeout elapses or the thread is interrupted
   * @throws IllegalStateException       if the hub has been closed
   */
  public BotUpdateSubscription attach(long botId, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ensureOpen();
    BotCredential credential = resolveCredential(botId);

    List<BotPoller> stale;
    BotPoller poller;
    acquire(botId, timeout);
    try {
      ensureOpen();
      stale = removeStaleLocked();
      poller = pollers.get(credential.token());
      if (poller == null) {
        poller = BotPoller.builder()
            .botId(botId)
            .token(credential.token())
            .apiClient(apiClient)
            .credentialSource(credentialSource)
            .cursorStore(cursorStore)
            .metrics(metrics)
            .sleeper(sleeper)
            .config(pollerConfig)
            .build();
        pollers.put(credential.token(), poller);
        poller.start();
        logger.info("Started poller for botId=" + botId);
      }
    } finally {
      registryLock.unlock();
    }
    closeAll(stale);
    return poller.subscribe();
  }

  /**
   * Removes and stops every poller whose bot record was deleted or whose token was replaced.
   *
   * @return the number of pollers evicted
   */
  public int evictStalePollers() {
    List<BotPoller> stale;
    registryLock.lock();
    try {
      stale = removeStaleLocked();
    } finally {
      registryLock.unlock();
    }
    closeAll(stale);
    return stale.size();
  }

  /**
   * Returns the number of registered pollers.
   */
  public int pollerCount() {
    registryLock.lock();
    try {
      return pollers.size();
    } finally {
      registryLock.unlock();
    }
  }

  /**
   * Returns a snapshot of every registered poller.
   */
  public List<PollerStatus> status() {
    List<BotPoller> snapshot;
    registryLock.lock();
    try {
      snapshot = new ArrayList<>(pollers.values());
    } finally {
      registryLock.unlock();
    }
    List<PollerStatus> result = new ArrayList<>(snapshot.size());
    for (BotPoller poller : snapshot) {
      result.add(poller.status());
    }
    return result;
  }

  /**
   * Stops every poller and closes every subscription. Idempotent.
   */
  @Override
  public void close() {
    List<BotPoller> all;
    registryLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      all = new ArrayList<>(pollers.values());
      pollers.clear();
    } finally {
      registryLock.unlock();
    }
    RuntimeException first = null;
    for (BotPoller poller : all) {
      try {
        poller.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private BotCredential resolveCredential(long botId) {
    Optional<BotCredential> found = credentialSource.findCredential(botId);
    if (found.isEmpty() || !found.get().hasToken()) {
      throw new CredentialNotFoundException(botId);
    }
    if (!found.get().active()) {
      throw new CredentialInactiveException(botId);
    }
    return found.get();
  }

  private void acquire(long botId, Duration timeout) {
    try {
      if (!registryLock.tryLock(toNanos(timeout), TimeUnit.NANOSECONDS)) {
        throw new AttachCancelledException("Timed out attaching to botId=" + botId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AttachCancelledException("Interrupted attaching to botId=" + botId, e);
    }
  }

  private List<BotPoller> removeStaleLocked() {
    List<BotPoller> stale = new ArrayList<>();
    Iterator<BotPoller> it = pollers.values().iterator();
    while (it.hasNext()) {
      BotPoller poller = it.next();
      if (poller.isStale()) {
        it.remove();
        stale.add(poller);
      }
    }
    return stale;
  }

  private void closeAll(List<BotPoller> stale) {
    for (BotPoller poller : stale) {
      logger.info("Evicting stale poller for botId=" + poller.botId() + " (" + poller.pauseReason() + ")");
      try {
        poller.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to stop poller for botId=" + poller.botId(), e);
      }
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("BotUpdateHub has been closed");
    }
  }

  private static long toNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  /**
   * Builder for {@link BotUpdateHub}.
   */
  public static final class Builder {
    private CredentialSource credentialSource;
    private CursorStore cursorStore;
    private BotApiClient apiClient;
    private PollerConfig pollerConfig;
    private MetricsExporter metrics;
    private Sleeper sleeper;

    private Builder() {}

    /** <b>Required.</b> Source of bot records, consulted on attach and by every poller. */
    public Builder credentialSource(CredentialSource credentialSource) {
      this.credentialSource = credentialSource;
      return this;
    }

    /** <b>Required.</b> Store for per-token resume cursors. */
    public Builder cursorStore(CursorStore cursorStore) {
      this.cursorStore = cursorStore;
      return this;
    }

    /** <b>Required.</b> Upstream client shared by all pollers. */
    public Builder apiClient(BotApiClient apiClient) {
      this.apiClient = apiClient;
      return this;
    }

    /** Optional. Settings applied to every poller the hub creates. */
    public Builder pollerConfig(PollerConfig pollerConfig) {
      this.pollerConfig = pollerConfig;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public BotUpdateHub build() {
      return new BotUpdateHub(this);
    }
  }
}
