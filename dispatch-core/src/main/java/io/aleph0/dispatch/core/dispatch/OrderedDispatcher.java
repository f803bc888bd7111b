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
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.ActivityNotifier;
import io.aleph0.dispatch.core.Handler;
import io.aleph0.dispatch.core.HandlerContext;
import io.aleph0.dispatch.core.MalformedPayloadException;
import io.aleph0.dispatch.core.Measureable;
import io.aleph0.dispatch.core.Notifier;
import io.aleph0.dispatch.core.Payload;
import io.aleph0.dispatch.core.PermanentHandlerException;
import io.aleph0.dispatch.core.broker.Broker;
import io.aleph0.dispatch.core.broker.BrokerMessage;
import io.aleph0.dispatch.core.directory.DefaultQueueDirectory;
import io.aleph0.dispatch.core.directory.QueueDirectory;
import io.aleph0.dispatch.core.governor.ConcurrencyGovernor;
import io.aleph0.dispatch.core.governor.DefaultConcurrencyGovernor;
import io.aleph0.dispatch.core.governor.Reservation;
import io.aleph0.dispatch.core.lease.LeaseHeartbeat;
import io.aleph0.dispatch.core.lease.LeaseKeeper;
import io.aleph0.dispatch.core.payload.JsonPayloadCodec;
import io.aleph0.dispatch.core.payload.PayloadCodec;

/**
 * Consumes messages from every queue in a {@link QueueDirectory} and hands each one to a
 * {@link Handler}, one message at a time per queue, in the order the messages were received, with
 * many queues in parallel.
 *
 * <p>
 * A poll thread sweeps the known queues every {@link DispatcherConfig#pollInterval() poll
 * interval}. For each queue that has no receive in flight, it reserves capacity from the
 * {@link ConcurrencyGovernor} and, if that succeeds, hands one receive call to the I/O pool. Each
 * received message becomes an independent unit of work on the worker pool that:
 *
 * <ol>
 * <li>starts a {@link LeaseHeartbeat} for the message,</li>
 * <li>parses the payload, deleting the message if it cannot be parsed,</li>
 * <li>starts the activity indicator, if there is an {@link ActivityNotifier},</li>
 * <li>sends a busy notice if an earlier message of the same queue is still pending,</li>
 * <li>waits for its turn on the queue's {@link OrderLock},</li>
 * <li>runs the handler, and</li>
 * <li>forwards the result to the {@link Notifier} and deletes the message on success, or leaves
 * the message on its queue for redelivery on failure.</li>
 * </ol>
 *
 * <p>
 * Heartbeats and activity indicators are timed by a shared scheduler, but their broker and
 * notifier calls run on a separate signal pool, so a call that hangs for one queue does not delay
 * lease renewal for any other.
 *
 * <p>
 * The dispatcher moves through the states of {@link DispatcherState}. It can be started once and
 * stopped once. Stopping cancels all units, waits up to a grace period for them to wind down, and
 * then abandons whatever is left. Abandoned messages are redelivered by the broker once their lease
 * runs out, so no message is lost.
 */
public class OrderedDispatcher implements Measureable<DispatcherMetrics>, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(OrderedDispatcher.class);

  public static Builder builder(Broker broker, Handler handler) {
    return new Builder(broker, handler);
  }

  public static class Builder {
    private final Broker broker;
    private final Handler handler;
    private DispatcherConfig config = DispatcherConfig.defaults();
    private QueueDirectory directory = null;
    private ConcurrencyGovernor governor = null;
    private Notifier notifier = null;
    private ActivityNotifier activityNotifier = null;
    private PayloadCodec codec = null;

    public Builder(Broker broker, Handler handler) {
      this.broker = requireNonNull(broker, "broker");
      this.handler = requireNonNull(handler, "handler");
    }

    public Builder setConfig(DispatcherConfig config) {
      this.config = requireNonNull(config, "config");
      return this;
    }

    /**
     * Optional. Defaults to a {@link DefaultQueueDirectory} configured from the
     * {@link DispatcherConfig}.
     */
    public Builder setDirectory(QueueDirectory directory) {
      this.directory = directory;
      return this;
    }

    /**
     * Optional. Defaults to a {@link DefaultConcurrencyGovernor} configured from the
     * {@link DispatcherConfig}.
     */
    public Builder setGovernor(ConcurrencyGovernor governor) {
      this.governor = governor;
      return this;
    }

    public Builder setNotifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    public Builder setActivityNotifier(ActivityNotifier activityNotifier) {
      this.activityNotifier = activityNotifier;
      return this;
    }

    /**
     * Optional. Defaults to {@link JsonPayloadCodec}.
     */
    public Builder setCodec(PayloadCodec codec) {
      this.codec = codec;
      return this;
    }

    public OrderedDispatcher build() {
      final QueueDirectory directory = this.directory != null ? this.directory
          : DefaultQueueDirectory.builder(broker).setPrefix(config.queuePrefix())
              .setLeaseDuration(config.leaseDuration())
              .setRetentionPeriod(config.retentionPeriod())
              .setDeadLetterPolicy(config.deadLetterPolicy()).build();
      final ConcurrencyGovernor governor = this.governor != null ? this.governor
          : new DefaultConcurrencyGovernor(config.maxInflightTotal(),
              config.maxPrefetchPerQueue());
      final PayloadCodec codec = this.codec != null ? this.codec : new JsonPayloadCodec();
      return new OrderedDispatcher(broker, directory, governor, handler, config, notifier,
          activityNotifier, codec);
    }
  }

  /**
   * Guards the dispatcher state and the registration of new units, so that no unit is registered
   * once the dispatcher has started stopping.
   */
  private final Object lifecycleLock = new Object();
  private final AtomicReference<DispatcherState> state =
      new AtomicReference<>(DispatcherState.READY);
  private final List<DispatchListener> listeners = new CopyOnWriteArrayList<>();
  private final Map<String, OrderLock> orderLocks = new ConcurrentHashMap<>();
  private final Set<String> receiving = ConcurrentHashMap.newKeySet();
  private final Set<Unit> units = ConcurrentHashMap.newKeySet();
  private final Phaser phaser = new Phaser(1);
  private final AtomicLong receivedMetric = new AtomicLong(0);
  private final AtomicLong acknowledgedMetric = new AtomicLong(0);
  private final AtomicLong abandonedMetric = new AtomicLong(0);
  private final AtomicLong rejectedMetric = new AtomicLong(0);
  private final AtomicLong busyNoticesMetric = new AtomicLong(0);
  private final AtomicLong receiveFailuresMetric = new AtomicLong(0);
  private final Broker broker;
  private final QueueDirectory directory;
  private final ConcurrencyGovernor governor;
  private final Handler handler;
  private final DispatcherConfig config;
  private final Notifier notifier;
  private final ActivityNotifier activityNotifier;
  private final PayloadCodec codec;
  private final ResultFormatter formatter;
  private final ScheduledThreadPoolExecutor scheduler;
  private final ExecutorService ioExecutor;
  private final ExecutorService workerExecutor;

  /**
   * Runs lease extensions and activity signals. Each heartbeat and indicator has at most one call in
   * flight, so the pool never grows past two threads per in-flight message.
   */
  private final ExecutorService signalExecutor;
  private final LeaseKeeper leaseKeeper;
  private final Thread pollThread;

  public OrderedDispatcher(Broker broker, QueueDirectory directory, ConcurrencyGovernor governor,
      Handler handler, DispatcherConfig config, Notifier notifier,
      ActivityNotifier activityNotifier, PayloadCodec codec) {
    this.broker = requireNonNull(broker, "broker");
    this.directory = requireNonNull(directory, "directory");
    this.governor = requireNonNull(governor, "governor");
    this.handler = requireNonNull(handler, "handler");
    this.config = requireNonNull(config, "config");
    this.notifier = notifier;
    this.activityNotifier = activityNotifier;
    this.codec = requireNonNull(codec, "codec");
    this.formatter = new ResultFormatter(config.tagResults(), config.emptyResultText());
    this.scheduler = new ScheduledThreadPoolExecutor(2, threadFactory("dispatch-scheduler"));
    this.scheduler.setRemoveOnCancelPolicy(true);
    this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), threadFactory("dispatch-io"));
    this.workerExecutor = Executors.newCachedThreadPool(threadFactory("dispatch-worker"));
    this.signalExecutor = Executors.newCachedThreadPool(threadFactory("dispatch-signal"));
    this.leaseKeeper = new LeaseKeeper(broker, scheduler, signalExecutor,
        config.heartbeatInterval(), config.heartbeatExtension());
    this.pollThread = new Thread(this::poll, "dispatch-poll");
  }

  public QueueDirectory getDirectory() {
    return directory;
  }

  public DispatcherConfig getConfig() {
    return config;
  }

  public DispatcherState getState() {
    return state.get();
  }

  public void addListener(DispatchListener listener) {
    listeners.add(requireNonNull(listener, "listener"));
  }

  public void removeListener(DispatchListener listener) {
    listeners.remove(listener);
  }

  /**
   * Starts the poll loop.
   *
   * @throws IllegalStateException if the dispatcher was already started or stopped
   */
  public void start() {
    synchronized (lifecycleLock) {
      state.set(state.get().to(DispatcherState.RUNNING));
      pollThread.start();
    }
    LOGGER.atInfo().addKeyValue("maxInflightTotal", config.maxInflightTotal())
        .addKeyValue("maxPrefetchPerQueue", config.maxPrefetchPerQueue())
        .addKeyValue("pollInterval", config.pollInterval()).log("Dispatcher started");
  }

  /**
   * Stops the dispatcher, waiting up to the configured
   * {@link DispatcherConfig#shutdownGrace() shutdown grace} for in-flight messages to wind down.
   */
  @Override
  public void close() {
    stop(config.shutdownGrace());
  }

  /**
   * Stops the dispatcher. No receives are issued after this method is called. Every unit is
   * cancelled by interrupting it, and this method waits up to {@code grace} for them to finish.
   * Any unit still running after that is abandoned and its message is left for redelivery. Lease
   * heartbeats and activity indicators still running at the end are cancelled. Idempotent.
   *
   * <p>
   * If the calling thread is interrupted while waiting, the remaining units are abandoned right
   * away and the interrupt flag is restored.
   *
   * @param grace how long to wait for cancelled units to finish
   */
  public void stop(Duration grace) {
    requireNonNull(grace, "grace");
    if (grace.isNegative())
      throw new IllegalArgumentException("grace must not be negative");

    final List<Unit> cancelled;
    synchronized (lifecycleLock) {
      final DispatcherState current = state.get();
      if (current == DispatcherState.STOPPING || current == DispatcherState.STOPPED)
        return;
      if (current == DispatcherState.READY) {
        state.set(current.to(DispatcherState.STOPPED));
        shutdownExecutors();
        LOGGER.atInfo().log("Dispatcher stopped before it was started");
        return;
      }
      state.set(current.to(DispatcherState.STOPPING));
      cancelled = new ArrayList<>(units);
    }

    LOGGER.atInfo().addKeyValue("inflight", cancelled.size()).addKeyValue("grace", grace)
        .log("Stopping dispatcher");

    // Stop issuing receives
    pollThread.interrupt();
    ioExecutor.shutdownNow();

    for (Unit unit : cancelled)
      unit.cancel();

    boolean interrupted = false;
    boolean graceful;
    try {
      final int phase = phaser.arrive();
      phaser.awaitAdvanceInterruptibly(phase, grace.toMillis(), TimeUnit.MILLISECONDS);
      graceful = true;
    } catch (TimeoutException e) {
      graceful = false;
    } catch (InterruptedException e) {
      interrupted = true;
      graceful = false;
    }

    if (graceful) {
      workerExecutor.shutdown();
    } else {
      final List<Unit> remaining = new ArrayList<>(units);
      LOGGER.atWarn().addKeyValue("remaining", remaining.size())
          .log("Units did not finish in time. Abandoning...");
      for (Unit unit : remaining)
        unit.detach();
      for (Runnable dropped : workerExecutor.shutdownNow())
        if (dropped instanceof Unit unit)
          unit.discard();
    }

    try {
      pollThread.join(Math.max(1L, grace.toMillis()));
    } catch (InterruptedException e) {
      interrupted = true;
    }

    for (Unit unit : new ArrayList<>(units))
      unit.cancelActivity();
    leaseKeeper.cancelAll();
    scheduler.shutdownNow();
    signalExecutor.shutdownNow();

    synchronized (lifecycleLock) {
      state.set(state.get().to(DispatcherState.STOPPED));
    }

    LOGGER.atInfo().addKeyValue("graceful", graceful).log("Dispatcher stopped");

    if (interrupted)
      Thread.currentThread().interrupt();
  }

  private void shutdownExecutors() {
    ioExecutor.shutdownNow();
    workerExecutor.shutdownNow();
    scheduler.shutdownNow();
    signalExecutor.shutdownNow();
  }

  private void poll() {
    LOGGER.atDebug().log("Poll loop started");
    try {
      while (state.get() == DispatcherState.RUNNING) {
        try {
          sweep();
        } catch (RuntimeException e) {
          LOGGER.atError().setCause(e).log("Sweep failed. Continuing...");
        }
        Thread.sleep(config.pollInterval().toMillis());
      }
    } catch (InterruptedException e) {
      // Stop requested
      Thread.currentThread().interrupt();
    }
    LOGGER.atDebug().log("Poll loop stopped");
  }

  /**
   * Issues at most one receive for every known queue that has no receive in flight and has
   * capacity left. Never blocks.
   */
  void sweep() {
    for (String address : directory.addresses()) {
      if (state.get() != DispatcherState.RUNNING)
        return;

      if (!receiving.add(address))
        continue;

      final Reservation reservation = governor.tryReserve(address);
      if (reservation == null) {
        receiving.remove(address);
        continue;
      }

      try {
        ioExecutor.execute(() -> receive(address, reservation));
      } catch (RejectedExecutionException e) {
        receiving.remove(address);
        reservation.release();
        return;
      }
    }
  }

  private void receive(String address, Reservation reservation) {
    boolean dispatched = false;
    try {
      final BrokerMessage message = broker.receive(address, config.receiveWait());
      if (message == null)
        return;

      receivedMetric.incrementAndGet();
      LOGGER.atDebug().addKeyValue("address", address).addKeyValue("messageId", message.id())
          .log("Received message");

      dispatched = dispatch(address, message, reservation);
    } catch (InterruptedException e) {
      LOGGER.atDebug().addKeyValue("address", address).log("Receive interrupted");
      Thread.currentThread().interrupt();
    } catch (IOException e) {
      receiveFailuresMetric.incrementAndGet();
      LOGGER.atWarn().addKeyValue("address", address).setCause(e)
          .log("Failed to receive message. Continuing...");
    } catch (RuntimeException e) {
      receiveFailuresMetric.incrementAndGet();
      LOGGER.atError().addKeyValue("address", address).setCause(e)
          .log("Unexpected failure receiving message. Continuing...");
    } finally {
      if (!dispatched)
        reservation.release();
      receiving.remove(address);
    }
  }

  /**
   * Turns a received message into a unit of work. The order ticket is taken here, on the thread
   * that received the message, so that ticket order is receipt order.
   *
   * @return {@code true} if the unit took over the reservation, {@code false} if the message was
   *         left for redelivery
   */
  private boolean dispatch(String address, BrokerMessage message, Reservation reservation) {
    final Unit unit;
    synchronized (lifecycleLock) {
      if (state.get() != DispatcherState.RUNNING) {
        LOGGER.atInfo().addKeyValue("address", address).addKeyValue("messageId", message.id())
            .log("Dispatcher is stopping. Leaving message for redelivery...");
        abandonedMetric.incrementAndGet();
        fireMessageAbandoned(address, message.id(), null);
        return false;
      }

      // Register before any side effect that would need undoing
      phaser.register();

      final OrderLock orderLock = orderLocks.computeIfAbsent(address, k -> new OrderLock());
      final long ticket = orderLock.nextTicket();

      final LeaseHeartbeat heartbeat;
      try {
        heartbeat = leaseKeeper.start(address, message.id(), message.leaseToken());
      } catch (RuntimeException e) {
        orderLock.release(ticket);
        phaser.arriveAndDeregister();
        throw e;
      }

      unit = new Unit(address, message, reservation, orderLock, ticket, heartbeat);
      unit.transition(MessageState.LEASED);
      units.add(unit);
    }

    fireMessageReceived(address, message.id());

    try {
      workerExecutor.execute(unit);
    } catch (RejectedExecutionException e) {
      unit.discard();
      return true;
    }

    return true;
  }

  private final class Unit implements Runnable {
    private final AtomicReference<MessageState> state =
        new AtomicReference<>(MessageState.RECEIVED);
    private final String address;
    private final BrokerMessage message;
    private final Reservation reservation;
    private final OrderLock orderLock;
    private final long ticket;
    private final LeaseHeartbeat heartbeat;
    private Thread thread;
    private boolean cancelled;
    private boolean detached;
    private boolean finished;
    private ActivityIndicator activity;

    public Unit(String address, BrokerMessage message, Reservation reservation,
        OrderLock orderLock, long ticket, LeaseHeartbeat heartbeat) {
      this.address = address;
      this.message = message;
      this.reservation = reservation;
      this.orderLock = orderLock;
      this.ticket = ticket;
      this.heartbeat = heartbeat;
    }

    public void transition(MessageState target) {
      state.set(state.get().to(target));
    }

    /**
     * Requests cooperative cancellation by interrupting the unit's thread, if it is running.
     */
    public synchronized void cancel() {
      cancelled = true;
      if (thread != null)
        thread.interrupt();
    }

    /**
     * Marks the unit as given up on. A detached unit never deletes its message, even if its handler
     * finishes successfully later.
     */
    public synchronized void detach() {
      detached = true;
      cancel();
    }

    public void cancelActivity() {
      final ActivityIndicator activity;
      synchronized (this) {
        activity = this.activity;
      }
      if (activity != null)
        activity.cancel();
    }

    private synchronized boolean isCancelled() {
      return cancelled;
    }

    private synchronized boolean isDetached() {
      return detached;
    }

    @Override
    public void run() {
      synchronized (this) {
        if (finished)
          return;
        thread = Thread.currentThread();
      }
      try {
        if (isCancelled())
          throw new InterruptedException();
        process();
      } catch (InterruptedException e) {
        abandon(e);
        Thread.currentThread().interrupt();
      } catch (Exception e) {
        abandon(e);
      } finally {
        synchronized (this) {
          thread = null;
        }
        finish();
      }
    }

    /**
     * Cleans up a unit that never ran.
     */
    public void discard() {
      synchronized (this) {
        if (finished || thread != null)
          return;
      }
      abandon(new InterruptedException());
      finish();
    }

    private void process() throws InterruptedException {
      final Payload payload;
      try {
        payload = codec.decode(message.body());
      } catch (MalformedPayloadException e) {
        LOGGER.atError().addKeyValue("address", address).addKeyValue("messageId", message.id())
            .setCause(e).log("Malformed message. Deleting...");
        reject(e);
        return;
      }

      startActivity(payload);

      if (orderLock.isBusy(ticket))
        sendBusyNotice(payload);

      orderLock.await(ticket);

      final String result;
      try {
        result = handler.process(payload, new UnitContext(payload));
      } catch (PermanentHandlerException e) {
        LOGGER.atError().addKeyValue("address", address).addKeyValue("messageId", message.id())
            .setCause(e).log("Handler failed permanently. Deleting...");
        cancelActivity();
        sendNotification(payload.correlationId(), config.permanentFailureText());
        reject(e);
        return;
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        LOGGER.atWarn().addKeyValue("address", address).addKeyValue("messageId", message.id())
            .addKeyValue("deliveryAttempt", message.deliveryAttempt()).setCause(e)
            .log("Handler failed. Leaving message for redelivery...");
        abandon(e);
        return;
      }

      cancelActivity();

      if (isDetached()) {
        abandon(new InterruptedException());
        return;
      }

      if (formatter.isEmpty(result))
        LOGGER.atWarn().addKeyValue("messageId", message.id())
            .log("Handler returned an empty result. Sending fallback text");
      sendNotification(payload.correlationId(), formatter.format(message.id(), result));

      acknowledge();
    }

    private void startActivity(Payload payload) {
      if (activityNotifier == null)
        return;
      final ActivityIndicator activity = new ActivityIndicator(activityNotifier,
          payload.correlationId(), ActivityNotifier.TYPING, config.activityInterval());
      synchronized (this) {
        this.activity = activity;
      }
      try {
        activity.start(scheduler, signalExecutor);
      } catch (RejectedExecutionException e) {
        LOGGER.atDebug().addKeyValue("messageId", message.id())
            .log("Scheduler shut down. No activity indicator");
      }
    }

    private void sendBusyNotice(Payload payload) {
      if (notifier == null)
        return;
      LOGGER.atInfo().addKeyValue("address", address).addKeyValue("messageId", message.id())
          .log("Earlier message still pending. Sending busy notice");
      busyNoticesMetric.incrementAndGet();
      sendNotification(payload.correlationId(), config.busyNoticeText());
      fireBusyNotice(address, message.id(), payload.correlationId());
    }

    private void acknowledge() {
      if (!delete()) {
        abandon(null);
        return;
      }
      transition(MessageState.ACKNOWLEDGED);
      acknowledgedMetric.incrementAndGet();
      LOGGER.atInfo().addKeyValue("address", address).addKeyValue("messageId", message.id())
          .log("Acknowledged message");
      fireMessageAcknowledged(address, message.id());
    }

    private void reject(Exception cause) {
      if (!delete()) {
        abandon(cause);
        return;
      }
      transition(MessageState.REJECTED);
      rejectedMetric.incrementAndGet();
      fireMessageRejected(address, message.id(), cause);
    }

    private void abandon(Throwable cause) {
      if (state.get().isTerminal())
        return;
      transition(MessageState.ABANDONED);
      abandonedMetric.incrementAndGet();
      LOGGER.atDebug().addKeyValue("address", address).addKeyValue("messageId", message.id())
          .log("Abandoned message");
      fireMessageAbandoned(address, message.id(), cause);
    }

    private boolean delete() {
      try {
        broker.delete(address, message.leaseToken());
        return true;
      } catch (IOException e) {
        LOGGER.atError().addKeyValue("address", address).addKeyValue("messageId", message.id())
            .setCause(e).log("Failed to delete message. Leaving for redelivery...");
        return false;
      }
    }

    private void finish() {
      synchronized (this) {
        if (finished)
          return;
        finished = true;
      }
      cancelActivity();
      orderLock.release(ticket);
      heartbeat.cancel();
      reservation.release();
      units.remove(this);
      phaser.arriveAndDeregister();
    }

    private final class UnitContext implements HandlerContext {
      private final Payload payload;

      public UnitContext(Payload payload) {
        this.payload = payload;
      }

      @Override
      public String messageId() {
        return message.id();
      }

      @Override
      public String address() {
        return address;
      }

      @Override
      public int deliveryAttempt() {
        return message.deliveryAttempt();
      }

      @Override
      public boolean notify(String text) {
        requireNonNull(text, "text");
        return sendNotification(payload.correlationId(), text);
      }
    }
  }

  private boolean sendNotification(String correlationId, String text) {
    if (notifier == null)
      return false;
    try {
      notifier.notify(correlationId, text);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (Exception e) {
      LOGGER.atWarn().addKeyValue("correlationId", correlationId).setCause(e)
          .log("Failed to send notification");
      return false;
    }
  }

  @Override
  public DispatcherMetrics checkMetrics() {
    final DispatcherState state = this.state.get();
    final int queues = directory.size();
    final int inflight = units.size();
    final long received = receivedMetric.get();
    final long acknowledged = acknowledgedMetric.get();
    final long abandoned = abandonedMetric.get();
    final long rejected = rejectedMetric.get();
    final long busyNotices = busyNoticesMetric.get();
    final long receiveFailures = receiveFailuresMetric.get();
    return new DispatcherMetrics(state, queues, inflight, received, acknowledged, abandoned,
        rejected, busyNotices, receiveFailures, governor.checkMetrics(),
        leaseKeeper.checkMetrics());
  }

  @Override
  public DispatcherMetrics flushMetrics() {
    final DispatcherState state = this.state.get();
    final int queues = directory.size();
    final int inflight = units.size();
    final long received = receivedMetric.getAndSet(0);
    final long acknowledged = acknowledgedMetric.getAndSet(0);
    final long abandoned = abandonedMetric.getAndSet(0);
    final long rejected = rejectedMetric.getAndSet(0);
    final long busyNotices = busyNoticesMetric.getAndSet(0);
    final long receiveFailures = receiveFailuresMetric.getAndSet(0);
    return new DispatcherMetrics(state, queues, inflight, received, acknowledged, abandoned,
        rejected, busyNotices, receiveFailures, governor.flushMetrics(),
        leaseKeeper.flushMetrics());
  }

  private void fireMessageReceived(String address, String messageId) {
    for (DispatchListener listener : listeners) {
      try {
        listener.onMessageReceived(address, messageId);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying dispatch listener");
      }
    }
  }

  private void fireMessageRejected(String address, String messageId, Exception cause) {
    for (DispatchListener listener : listeners) {
      try {
        listener.onMessageRejected(address, messageId, cause);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying dispatch listener");
      }
    }
  }

  private void fireMessageAcknowledged(String address, String messageId) {
    for (DispatchListener listener : listeners) {
      try {
        listener.onMessageAcknowledged(address, messageId);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying dispatch listener");
      }
    }
  }

  private void fireMessageAbandoned(String address, String messageId, Throwable cause) {
    for (DispatchListener listener : listeners) {
      try {
        listener.onMessageAbandoned(address, messageId, cause);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying dispatch listener");
      }
    }
  }

  private void fireBusyNotice(String address, String messageId, String correlationId) {
    for (DispatchListener listener : listeners) {
      try {
        listener.onBusyNotice(address, messageId, correlationId);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying dispatch listener");
      }
    }
  }

  private static ThreadFactory threadFactory(String prefix) {
    final AtomicInteger counter = new AtomicInteger(0);
    return r -> new Thread(r, prefix + "-" + counter.incrementAndGet());
  }
}
