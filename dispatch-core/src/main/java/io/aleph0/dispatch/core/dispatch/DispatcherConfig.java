/*-
 * =================================LICENSE_START==================================
 * dispatch-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.dispatch.core.dispatch;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import io.aleph0.dispatch.core.broker.DeadLetterPolicy;

/**
 * Tuning for an {@link OrderedDispatcher}. Use {@link #builder()} to start from the defaults.
 */
public record DispatcherConfig(
    /**
     * How long a received message stays invisible to other receivers before the broker delivers it
     * again, unless its lease is extended. Applied when queues are created.
     */
    Duration leaseDuration,

    /**
     * How often the lease of an in-flight message is extended.
     */
    Duration heartbeatInterval,

    /**
     * How far each extension pushes the lease out. Must be at least {@link #heartbeatInterval()},
     * or the lease could run out between two extensions.
     */
    Duration heartbeatExtension,

    /**
     * The pause between two sweeps over the known queues.
     */
    Duration pollInterval,

    /**
     * The maximum number of messages in flight from any one queue.
     */
    int maxPrefetchPerQueue,

    /**
     * The maximum number of messages in flight across all queues, at most
     * {@value #MAX_INFLIGHT_TOTAL}.
     */
    int maxInflightTotal,

    /**
     * How long the broker keeps messages nobody received. Applied when queues are created.
     */
    Duration retentionPeriod,

    /**
     * How long one receive call may wait for a message. Zero means return immediately.
     */
    Duration receiveWait,

    /**
     * How long {@link OrderedDispatcher#close()} waits for cancelled messages to wind down before
     * giving up on them.
     */
    Duration shutdownGrace,

    /**
     * The number of threads that run receive calls.
     */
    int ioThreads,

    /**
     * Prepended to each owner key to name its queue.
     */
    String queuePrefix,

    /**
     * Passed through to the broker when queues are created, or {@code null} for none.
     */
    DeadLetterPolicy deadLetterPolicy,

    /**
     * Sent when a message arrives while an earlier message of the same queue is still pending.
     */
    String busyNoticeText,

    /**
     * Sent in place of a blank handler result.
     */
    String emptyResultText,

    /**
     * Sent when the handler fails permanently and the message is deleted.
     */
    String permanentFailureText,

    /**
     * Whether to prefix handler results with a short job tag derived from the message id.
     */
    boolean tagResults,

    /**
     * How often the activity indicator is repeated while a message is being worked on.
     */
    Duration activityInterval) {
  public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(900);
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_HEARTBEAT_EXTENSION = Duration.ofSeconds(120);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
  public static final int DEFAULT_MAX_PREFETCH_PER_QUEUE = 2;
  public static final int DEFAULT_MAX_INFLIGHT_TOTAL = 50;

  /**
   * In-flight messages are tracked as parties of a {@link java.util.concurrent.Phaser}, which also
   * has one party of its own.
   */
  public static final int MAX_INFLIGHT_TOTAL = 65534;
  public static final Duration DEFAULT_RETENTION_PERIOD = Duration.ofSeconds(86400);
  public static final Duration DEFAULT_RECEIVE_WAIT = Duration.ZERO;
  public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);
  public static final int DEFAULT_IO_THREADS = 4;
  public static final String DEFAULT_QUEUE_PREFIX = "owner-";
  public static final String DEFAULT_BUSY_NOTICE_TEXT =
      "I'm still working on your previous request. "
          + "I queued this one and will reply as soon as I'm done.";
  public static final String DEFAULT_EMPTY_RESULT_TEXT =
      "I processed your request but couldn't generate a response. "
          + "Please try again or rephrase your request.";
  public static final String DEFAULT_PERMANENT_FAILURE_TEXT =
      "I hit an internal error I can't recover from while processing that request. "
          + "Please resend your last message.";
  public static final boolean DEFAULT_TAG_RESULTS = true;
  public static final Duration DEFAULT_ACTIVITY_INTERVAL = Duration.ofSeconds(4);

  public DispatcherConfig {
    requirePositive(leaseDuration, "leaseDuration");
    requirePositive(heartbeatInterval, "heartbeatInterval");
    requirePositive(heartbeatExtension, "heartbeatExtension");
    requirePositive(pollInterval, "pollInterval");
    requirePositive(retentionPeriod, "retentionPeriod");
    requireNonNull(receiveWait, "receiveWait");
    requireNonNull(shutdownGrace, "shutdownGrace");
    requirePositive(activityInterval, "activityInterval");
    requireNonNull(queuePrefix, "queuePrefix");
    requireNonNull(busyNoticeText, "busyNoticeText");
    requireNonNull(emptyResultText, "emptyResultText");
    requireNonNull(permanentFailureText, "permanentFailureText");
    if (receiveWait.isNegative())
      throw new IllegalArgumentException("receiveWait must not be negative");
    if (shutdownGrace.isNegative())
      throw new IllegalArgumentException("shutdownGrace must not be negative");
    if (heartbeatExtension.compareTo(heartbeatInterval) < 0)
      throw new IllegalArgumentException("heartbeatExtension must not be less than heartbeatInterval");
    if (maxPrefetchPerQueue < 1)
      throw new IllegalArgumentException("maxPrefetchPerQueue must be at least 1");
    if (maxInflightTotal < 1)
      throw new IllegalArgumentException("maxInflightTotal must be at least 1");
    if (maxInflightTotal > MAX_INFLIGHT_TOTAL)
      throw new IllegalArgumentException(
          "maxInflightTotal must be at most " + MAX_INFLIGHT_TOTAL);
    if (ioThreads < 1)
      throw new IllegalArgumentException("ioThreads must be at least 1");
  }

  private static void requirePositive(Duration value, String name) {
    requireNonNull(value, name);
    if (value.isNegative() || value.isZero())
      throw new IllegalArgumentException(name + " must be positive");
  }

  public static DispatcherConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Duration leaseDuration = DEFAULT_LEASE_DURATION;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Duration heartbeatExtension = DEFAULT_HEARTBEAT_EXTENSION;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private int maxPrefetchPerQueue = DEFAULT_MAX_PREFETCH_PER_QUEUE;
    private int maxInflightTotal = DEFAULT_MAX_INFLIGHT_TOTAL;
    private Duration retentionPeriod = DEFAULT_RETENTION_PERIOD;
    private Duration receiveWait = DEFAULT_RECEIVE_WAIT;
    private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
    private int ioThreads = DEFAULT_IO_THREADS;
    private String queuePrefix = DEFAULT_QUEUE_PREFIX;
    private DeadLetterPolicy deadLetterPolicy = null;
    private String busyNoticeText = DEFAULT_BUSY_NOTICE_TEXT;
    private String emptyResultText = DEFAULT_EMPTY_RESULT_TEXT;
    private String permanentFailureText = DEFAULT_PERMANENT_FAILURE_TEXT;
    private boolean tagResults = DEFAULT_TAG_RESULTS;
    private Duration activityInterval = DEFAULT_ACTIVITY_INTERVAL;

    public Builder setLeaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
      return this;
    }

    public Builder setHeartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    public Builder setHeartbeatExtension(Duration heartbeatExtension) {
      this.heartbeatExtension = heartbeatExtension;
      return this;
    }

    public Builder setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder setMaxPrefetchPerQueue(int maxPrefetchPerQueue) {
      this.maxPrefetchPerQueue = maxPrefetchPerQueue;
      return this;
    }

    public Builder setMaxInflightTotal(int maxInflightTotal) {
      this.maxInflightTotal = maxInflightTotal;
      return this;
    }

    public Builder setRetentionPeriod(Duration retentionPeriod) {
      this.retentionPeriod = retentionPeriod;
      return this;
    }

    public Builder setReceiveWait(Duration receiveWait) {
      this.receiveWait = receiveWait;
      return this;
    }

    public Builder setShutdownGrace(Duration shutdownGrace) {
      this.shutdownGrace = shutdownGrace;
      return this;
    }

    public Builder setIoThreads(int ioThreads) {
      this.ioThreads = ioThreads;
      return this;
    }

    public Builder setQueuePrefix(String queuePrefix) {
      this.queuePrefix = queuePrefix;
      return this;
    }

    public Builder setDeadLetterPolicy(DeadLetterPolicy deadLetterPolicy) {
      this.deadLetterPolicy = deadLetterPolicy;
      return this;
    }

    public Builder setBusyNoticeText(String busyNoticeText) {
      this.busyNoticeText = busyNoticeText;
      return this;
    }

    public Builder setEmptyResultText(String emptyResultText) {
      this.emptyResultText = emptyResultText;
      return this;
    }

    public Builder setPermanentFailureText(String permanentFailureText) {
      this.permanentFailureText = permanentFailureText;
      return this;
    }

    public Builder setTagResults(boolean tagResults) {
      this.tagResults = tagResults;
      return this;
    }

    public Builder setActivityInterval(Duration activityInterval) {
      this.activityInterval = activityInterval;
      return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     * @throws NullPointerException if any required value is {@code null}
     */
    public DispatcherConfig build() {
      return new DispatcherConfig(leaseDuration, heartbeatInterval, heartbeatExtension,
          pollInterval, maxPrefetchPerQueue, maxInflightTotal, retentionPeriod, receiveWait,
          shutdownGrace, ioThreads, queuePrefix, deadLetterPolicy, busyNoticeText, emptyResultText,
          permanentFailureText, tagResults, activityInterval);
    }
  }
}
