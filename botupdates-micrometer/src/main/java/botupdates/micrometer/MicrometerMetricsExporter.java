package botupdates.micrometer;

import botupdates.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code botupdates.polls}: completed {@code getUpdates} calls</li>
 *   <li>{@code botupdates.updates.received}: updates received from upstream</li>
 *   <li>{@code botupdates.polls.conflict}: 409 responses</li>
 *   <li>{@code botupdates.polls.rate_limited}: 429 responses</li>
 *   <li>{@code botupdates.polls.failure}: other upstream failures</li>
 *   <li>{@code botupdates.updates.dropped}: updates lost to full subscription queues</li>
 *   <li>{@code botupdates.buffer.evicted}: buffered {@code my_chat_member} updates evicted</li>
 *   <li>{@code botupdates.cursor.save.failure}: failed cursor writes</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code botupdates.pollers.active}: running pollers</li>
 *   <li>{@code botupdates.subscriptions.active}: attached subscriptions</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter polls;
  private final Counter updatesReceived;
  private final Counter conflicts;
  private final Counter rateLimited;
  private final Counter pollFailures;
  private final Counter dropped;
  private final Counter highValueEvicted;
  private final Counter cursorSaveFailures;
  private final Gauge pollersGauge;
  private final Gauge subscriptionsGauge;

  private final AtomicInteger activePollers = new AtomicInteger();
  private final AtomicInteger activeSubscriptions = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "botupdates"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "botupdates");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.botupdates"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.polls = Counter.builder(namePrefix + ".polls")
        .description("Completed getUpdates calls")
        .register(registry);
    this.updatesReceived = Counter.builder(namePrefix + ".updates.received")
        .description("Updates received from the Bot API")
        .register(registry);
    this.conflicts = Counter.builder(namePrefix + ".polls.conflict")
        .description("getUpdates calls rejected with 409")
        .register(registry);
    this.rateLimited = Counter.builder(namePrefix + ".polls.rate_limited")
        .description("getUpdates calls rejected with 429")
        .register(registry);
    this.pollFailures = Counter.builder(namePrefix + ".polls.failure")
        .description("getUpdates calls failed for other reasons")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".updates.dropped")
        .description("Updates evicted from full subscription queues")
        .register(registry);
    this.highValueEvicted = Counter.builder(namePrefix + ".buffer.evicted")
        .description("Buffered my_chat_member updates evicted before any subscriber attached")
        .register(registry);
    this.cursorSaveFailures = Counter.builder(namePrefix + ".cursor.save.failure")
        .description("Failed cursor writes")
        .register(registry);

    this.pollersGauge = Gauge.builder(namePrefix + ".pollers.active", activePollers, AtomicInteger::get)
        .register(registry);
    this.subscriptionsGauge = Gauge.builder(namePrefix + ".subscriptions.active", activeSubscriptions,
            AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementPolls() {
    if (closed) return;
    polls.increment();
  }

  @Override
  public void incrementUpdatesReceived(int count) {
    if (closed) return;
    updatesReceived.increment(count);
  }

  @Override
  public void incrementConflicts() {
    if (closed) return;
    conflicts.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void incrementPollFailures() {
    if (closed) return;
    pollFailures.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementHighValueEvicted() {
    if (closed) return;
    highValueEvicted.increment();
  }

  @Override
  public void incrementCursorSaveFailures() {
    if (closed) return;
    cursorSaveFailures.increment();
  }

  @Override
  public void subscriptionOpened() {
    activeSubscriptions.incrementAndGet();
  }

  @Override
  public void subscriptionClosed() {
    activeSubscriptions.decrementAndGet();
  }

  @Override
  public void pollerStarted() {
    activePollers.incrementAndGet();
  }

  @Override
  public void pollerStopped() {
    activePollers.decrementAndGet();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(polls, updatesReceived, conflicts, rateLimited, pollFailures,
        dropped, highValueEvicted, cursorSaveFailures, pollersGauge, subscriptionsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
