package botupdates.poller;

import botupdates.UpdateType;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Tunables shared by every {@link BotPoller} a hub creates.
 *
 * <p>Setters return {@code this} for chaining. {@link BotPoller} takes a {@link #copy()} so
 * later changes do not affect running pollers.
 */
public final class PollerConfig {
  private Duration pollTimeout = Duration.ofSeconds(25);
  private int pollLimit = 100;
  private Set<UpdateType> allowedUpdates = EnumSet.copyOf(UpdateType.DEFAULT_ALLOWED);

  private int subscriptionCapacity = 512;
  private int highValueBufferCapacity = 2000;

  private Duration initialDelay = Duration.ofSeconds(2);
  private Duration credentialCheckInterval = Duration.ofSeconds(5);
  private int fastForwardMaxBatches = 20;

  private BackoffPolicy conflictBackoff = LinearBackoffPolicy.conflictDefault();
  private Duration failureDelay = Duration.ofSeconds(2);
  private Duration minRateLimitWait = Duration.ofSeconds(1);
  private Duration maxRateLimitWait = Duration.ofMinutes(5);
  private Duration shutdownTimeout = Duration.ofSeconds(5);

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  /**
   * Long-poll timeout sent upstream. Default 25 s.
   */
  public PollerConfig setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
    return this;
  }

  public int getPollLimit() {
    return pollLimit;
  }

  /**
   * Maximum updates per call, 1-100. Default 100.
   */
  public PollerConfig setPollLimit(int pollLimit) {
    this.pollLimit = pollLimit;
    return this;
  }

  public Set<UpdateType> getAllowedUpdates() {
    return allowedUpdates;
  }

  /**
   * Update kinds requested by the running loop. Must include {@link UpdateType#MY_CHAT_MEMBER}.
   */
  public PollerConfig setAllowedUpdates(Set<UpdateType> allowedUpdates) {
    this.allowedUpdates = allowedUpdates == null || allowedUpdates.isEmpty()
        ? null : EnumSet.copyOf(allowedUpdates);
    return this;
  }

  public int getSubscriptionCapacity() {
    return subscriptionCapacity;
  }

  public PollerConfig setSubscriptionCapacity(int subscriptionCapacity) {
    this.subscriptionCapacity = subscriptionCapacity;
    return this;
  }

  public int getHighValueBufferCapacity() {
    return highValueBufferCapacity;
  }

  public PollerConfig setHighValueBufferCapacity(int highValueBufferCapacity) {
    this.highValueBufferCapacity = highValueBufferCapacity;
    return this;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  /**
   * Pause between bootstrap and the first long poll. Default 2 s.
   */
  public PollerConfig setInitialDelay(Duration initialDelay) {
    this.initialDelay = initialDelay;
    return this;
  }

  public Duration getCredentialCheckInterval() {
    return credentialCheckInterval;
  }

  public PollerConfig setCredentialCheckInterval(Duration credentialCheckInterval) {
    this.credentialCheckInterval = credentialCheckInterval;
    return this;
  }

  public int getFastForwardMaxBatches() {
    return fastForwardMaxBatches;
  }

  /**
   * Cap on calls per bootstrap phase. Default 20, i.e. 2000 updates at the default limit.
   */
  public PollerConfig setFastForwardMaxBatches(int fastForwardMaxBatches) {
    this.fastForwardMaxBatches = fastForwardMaxBatches;
    return this;
  }

  public BackoffPolicy getConflictBackoff() {
    return conflictBackoff;
  }

  public PollerConfig setConflictBackoff(BackoffPolicy conflictBackoff) {
    this.conflictBackoff = conflictBackoff;
    return this;
  }

  public Duration getFailureDelay() {
    return failureDelay;
  }

  public PollerConfig setFailureDelay(Duration failureDelay) {
    this.failureDelay = failureDelay;
    return this;
  }

  public Duration getMinRateLimitWait() {
    return minRateLimitWait;
  }

  public PollerConfig setMinRateLimitWait(Duration minRateLimitWait) {
    this.minRateLimitWait = minRateLimitWait;
    return this;
  }

  public Duration getMaxRateLimitWait() {
    return maxRateLimitWait;
  }

  public PollerConfig setMaxRateLimitWait(Duration maxRateLimitWait) {
    this.maxRateLimitWait = maxRateLimitWait;
    return this;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  /**
   * How long {@link BotPoller#close()} waits for the loop thread. Default 5 s.
   */
  public PollerConfig setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
    return this;
  }

  public PollerConfig copy() {
    PollerConfig c = new PollerConfig();
    c.pollTimeout = pollTimeout;
    c.pollLimit = pollLimit;
    c.allowedUpdates = allowedUpdates == null ? null : EnumSet.copyOf(allowedUpdates);
    c.subscriptionCapacity = subscriptionCapacity;
    c.highValueBufferCapacity = highValueBufferCapacity;
    c.initialDelay = initialDelay;
    c.credentialCheckInterval = credentialCheckInterval;
    c.fastForwardMaxBatches = fastForwardMaxBatches;
    c.conflictBackoff = conflictBackoff;
    c.failureDelay = failureDelay;
    c.minRateLimitWait = minRateLimitWait;
    c.maxRateLimitWait = maxRateLimitWait;
    c.shutdownTimeout = shutdownTimeout;
    return c;
  }

  /**
   * Checks every value, throwing on the first invalid one.
   *
   * @return this config
   * @throws NullPointerException     if a required value is null
   * @throws IllegalArgumentException if a value is out of range
   */
  public PollerConfig validate() {
    requireNonNegative(pollTimeout, "pollTimeout");
    if (pollLimit < 1 || pollLimit > 100) {
      throw new IllegalArgumentException("pollLimit must be within 1..100, got: " + pollLimit);
    }
    Objects.requireNonNull(allowedUpdates, "allowedUpdates");
    if (!allowedUpdates.contains(UpdateType.MY_CHAT_MEMBER)) {
      throw new IllegalArgumentException("allowedUpdates must include my_chat_member");
    }
    if (subscriptionCapacity <= 0) {
      throw new IllegalArgumentException("subscriptionCapacity must be > 0");
    }
    if (highValueBufferCapacity <= 0) {
      throw new IllegalArgumentException("highValueBufferCapacity must be > 0");
    }
    requireNonNegative(initialDelay, "initialDelay");
    requireNonNegative(credentialCheckInterval, "credentialCheckInterval");
    if (fastForwardMaxBatches < 1) {
      throw new IllegalArgumentException("fastForwardMaxBatches must be >= 1");
    }
    Objects.requireNonNull(conflictBackoff, "conflictBackoff");
    requireNonNegative(failureDelay, "failureDelay");
    requireNonNegative(minRateLimitWait, "minRateLimitWait");
    requireNonNegative(maxRateLimitWait, "maxRateLimitWait");
    if (maxRateLimitWait.compareTo(minRateLimitWait) < 0) {
      throw new IllegalArgumentException("maxRateLimitWait must be >= minRateLimitWait");
    }
    requireNonNegative(shutdownTimeout, "shutdownTimeout");
    return this;
  }

  private static void requireNonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }
}
