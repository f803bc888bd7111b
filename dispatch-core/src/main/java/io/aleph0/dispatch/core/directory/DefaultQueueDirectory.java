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
package io.aleph0.dispatch.core.directory;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.broker.Broker;
import io.aleph0.dispatch.core.broker.DeadLetterPolicy;
import io.aleph0.dispatch.core.broker.QueueAttributes;

/**
 * A {@link QueueDirectory} that creates queues named {@code <prefix><owner>} on a {@link Broker}
 * and caches their addresses in memory.
 */
public class DefaultQueueDirectory implements QueueDirectory {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultQueueDirectory.class);

  public static final String DEFAULT_PREFIX = "owner-";

  public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(900);

  public static final Duration DEFAULT_RETENTION_PERIOD = Duration.ofSeconds(86400);

  public static Builder builder(Broker broker) {
    return new Builder(broker);
  }

  public static class Builder {
    private final Broker broker;
    private String prefix = DEFAULT_PREFIX;
    private Duration leaseDuration = DEFAULT_LEASE_DURATION;
    private Duration retentionPeriod = DEFAULT_RETENTION_PERIOD;
    private DeadLetterPolicy deadLetterPolicy = null;

    public Builder(Broker broker) {
      this.broker = requireNonNull(broker, "broker");
    }

    public Builder setPrefix(String prefix) {
      this.prefix = requireNonNull(prefix, "prefix");
      return this;
    }

    public Builder setLeaseDuration(Duration leaseDuration) {
      this.leaseDuration = requireNonNull(leaseDuration, "leaseDuration");
      return this;
    }

    public Builder setRetentionPeriod(Duration retentionPeriod) {
      this.retentionPeriod = requireNonNull(retentionPeriod, "retentionPeriod");
      return this;
    }

    public Builder setDeadLetterPolicy(DeadLetterPolicy deadLetterPolicy) {
      this.deadLetterPolicy = deadLetterPolicy;
      return this;
    }

    public DefaultQueueDirectory build() {
      return new DefaultQueueDirectory(broker, prefix, leaseDuration, retentionPeriod,
          deadLetterPolicy);
    }
  }

  /**
   * owner -> address
   */
  private final Map<String, String> addresses = new ConcurrentHashMap<>();

  /**
   * Serializes queue creation per owner, so that concurrent first requests create once.
   */
  private final Map<String, Object> creationLocks = new ConcurrentHashMap<>();

  private final Broker broker;
  private final String prefix;
  private final Duration leaseDuration;
  private final Duration retentionPeriod;
  private final DeadLetterPolicy deadLetterPolicy;

  public DefaultQueueDirectory(Broker broker, String prefix, Duration leaseDuration,
      Duration retentionPeriod, DeadLetterPolicy deadLetterPolicy) {
    this.broker = requireNonNull(broker, "broker");
    this.prefix = requireNonNull(prefix, "prefix");
    this.leaseDuration = requireNonNull(leaseDuration, "leaseDuration");
    this.retentionPeriod = requireNonNull(retentionPeriod, "retentionPeriod");
    this.deadLetterPolicy = deadLetterPolicy;
  }

  @Override
  public String getOrCreate(String owner) throws IOException {
    requireNonNull(owner, "owner");

    String address = addresses.get(owner);
    if (address != null)
      return address;

    final Object lock = creationLocks.computeIfAbsent(owner, k -> new Object());
    synchronized (lock) {
      address = addresses.get(owner);
      if (address != null)
        return address;

      final String name = prefix + owner;
      LOGGER.atInfo().addKeyValue("owner", owner).addKeyValue("name", name)
          .log("Creating queue");

      address = broker.createQueue(
          new QueueAttributes(name, leaseDuration, retentionPeriod, deadLetterPolicy));
      addresses.put(owner, address);

      LOGGER.atInfo().addKeyValue("owner", owner).addKeyValue("address", address)
          .log("Created queue");

      return address;
    }
  }

  @Override
  public String lookup(String owner) {
    return addresses.get(requireNonNull(owner, "owner"));
  }

  @Override
  public Set<String> addresses() {
    return unmodifiableSet(new HashSet<>(addresses.values()));
  }

  @Override
  public boolean forget(String owner) {
    final String address = addresses.remove(requireNonNull(owner, "owner"));
    if (address == null)
      return false;
    LOGGER.atInfo().addKeyValue("owner", owner).addKeyValue("address", address)
        .log("Stopped tracking queue");
    return true;
  }

  @Override
  public boolean delete(String owner) throws IOException {
    requireNonNull(owner, "owner");

    final Object lock = creationLocks.computeIfAbsent(owner, k -> new Object());
    synchronized (lock) {
      final String address = addresses.get(owner);
      if (address == null) {
        LOGGER.atWarn().addKeyValue("owner", owner).log("No queue to delete");
        return false;
      }

      final boolean existed;
      try {
        existed = broker.deleteQueue(address);
      } catch (IOException e) {
        LOGGER.atError().addKeyValue("owner", owner).addKeyValue("address", address).setCause(e)
            .log("Failed to delete queue");
        throw e;
      }

      addresses.remove(owner);

      LOGGER.atInfo().addKeyValue("owner", owner).addKeyValue("address", address)
          .addKeyValue("existed", existed).log("Deleted queue");

      return existed;
    }
  }

  @Override
  public int size() {
    return addresses.size();
  }
}
