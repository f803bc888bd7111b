/*-
 * =================================LICENSE_START==================================
 * dispatch-gcp
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
package io.aleph0.dispatch.gcp;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.api.core.ApiFuture;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminSettings;
import com.google.cloud.pubsub.v1.stub.GrpcSubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStubSettings;
import com.google.pubsub.v1.AcknowledgeRequest;
import com.google.pubsub.v1.ModifyAckDeadlineRequest;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.PullRequest;
import com.google.pubsub.v1.PullResponse;
import com.google.pubsub.v1.ReceivedMessage;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.SubscriptionName;
import com.google.pubsub.v1.TopicName;
import io.aleph0.dispatch.core.broker.Broker;
import io.aleph0.dispatch.core.broker.BrokerMessage;
import io.aleph0.dispatch.core.broker.DeadLetterPolicy;
import io.aleph0.dispatch.core.broker.QueueAttributes;

/**
 * A {@link Broker} on Google Pubsub. Each queue is a topic and a single subscription of the same
 * name, and the queue address is the subscription's full resource name, e.g.,
 * {@code projects/my-project/subscriptions/owner-u1}. Producers publish to the topic of the same
 * name, and should set the owner as the ordering key, since subscriptions are created with message
 * ordering enabled.
 *
 * <p>
 * Messages are received with synchronous pulls of one message at a time. The lease token is the
 * Pubsub ack id, the lease duration is the subscription's ack deadline, and extending a lease
 * modifies the ack deadline. Pubsub bounds ack deadlines to {@value #MAX_ACK_DEADLINE_SECONDS}
 * seconds, so longer lease durations are capped there and the dispatcher's lease heartbeat must
 * fire more often than that.
 *
 * <p>
 * The dead-letter address of a {@link DeadLetterPolicy} is the full resource name of the
 * dead-letter topic.
 */
public class PubsubBroker implements Broker, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubsubBroker.class);

  public static final int MIN_ACK_DEADLINE_SECONDS = 10;

  public static final int MAX_ACK_DEADLINE_SECONDS = 600;

  public static final Duration MIN_RETENTION = Duration.ofMinutes(10);

  public static final Duration MAX_RETENTION = Duration.ofDays(7);

  public static final int MIN_DELIVERY_ATTEMPTS = 5;

  public static final int MAX_DELIVERY_ATTEMPTS = 100;

  /**
   * Creates a broker for the given project using application default credentials.
   */
  public static PubsubBroker create(String projectId) throws IOException {
    requireNonNull(projectId, "projectId");
    final TopicAdminClient topicAdmin = TopicAdminClient.create();
    final SubscriptionAdminClient subscriptionAdmin = SubscriptionAdminClient.create();
    final SubscriberStub subscriber =
        GrpcSubscriberStub.create(SubscriberStubSettings.newBuilder().build());
    return new PubsubBroker(projectId, topicAdmin, subscriptionAdmin, subscriber);
  }

  /**
   * Creates a broker for the given project using the given transport and credentials, e.g., to
   * connect to the Pubsub emulator.
   */
  public static PubsubBroker create(String projectId, TransportChannelProvider channelProvider,
      CredentialsProvider credentialsProvider) throws IOException {
    requireNonNull(projectId, "projectId");
    requireNonNull(channelProvider, "channelProvider");
    requireNonNull(credentialsProvider, "credentialsProvider");

    final TopicAdminClient topicAdmin =
        TopicAdminClient.create(TopicAdminSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider).build());
    final SubscriptionAdminClient subscriptionAdmin =
        SubscriptionAdminClient.create(SubscriptionAdminSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider).build());
    final SubscriberStub subscriber =
        GrpcSubscriberStub.create(SubscriberStubSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider).build());

    return new PubsubBroker(projectId, topicAdmin, subscriptionAdmin, subscriber);
  }

  private final String projectId;
  private final TopicAdminClient topicAdmin;
  private final SubscriptionAdminClient subscriptionAdmin;
  private final SubscriberStub subscriber;

  public PubsubBroker(String projectId, TopicAdminClient topicAdmin,
      SubscriptionAdminClient subscriptionAdmin, SubscriberStub subscriber) {
    this.projectId = requireNonNull(projectId, "projectId");
    this.topicAdmin = requireNonNull(topicAdmin, "topicAdmin");
    this.subscriptionAdmin = requireNonNull(subscriptionAdmin, "subscriptionAdmin");
    this.subscriber = requireNonNull(subscriber, "subscriber");
  }

  /**
   * Creates the topic and subscription for the given queue, if they do not exist yet.
   */
  @Override
  public String createQueue(QueueAttributes attributes) throws IOException {
    requireNonNull(attributes, "attributes");

    final TopicName topic = TopicName.of(projectId, attributes.name());
    final SubscriptionName subscription = SubscriptionName.of(projectId, attributes.name());

    try {
      topicAdmin.createTopic(topic);
      LOGGER.atDebug().addKeyValue("topic", topic).log("Created topic");
    } catch (AlreadyExistsException e) {
      LOGGER.atDebug().addKeyValue("topic", topic).log("Topic already exists");
    } catch (ApiException e) {
      throw new IOException("Failed to create topic " + topic, e);
    }

    final Subscription.Builder request = Subscription.newBuilder()
        .setName(subscription.toString()).setTopic(topic.toString())
        .setAckDeadlineSeconds(ackDeadlineSeconds(attributes.leaseDuration()))
        .setMessageRetentionDuration(toProtoDuration(retention(attributes.retentionPeriod())))
        .setEnableMessageOrdering(true);
    if (attributes.deadLetterPolicy() != null)
      request.setDeadLetterPolicy(toProtoDeadLetterPolicy(attributes.deadLetterPolicy()));

    try {
      subscriptionAdmin.createSubscription(request.build());
      LOGGER.atDebug().addKeyValue("subscription", subscription).log("Created subscription");
    } catch (AlreadyExistsException e) {
      LOGGER.atDebug().addKeyValue("subscription", subscription)
          .log("Subscription already exists");
    } catch (ApiException e) {
      throw new IOException("Failed to create subscription " + subscription, e);
    }

    return subscription.toString();
  }

  /**
   * Pulls at most one message. If {@code wait} is zero, returns immediately. Otherwise waits up to
   * {@code wait} for a message to arrive.
   */
  @Override
  public BrokerMessage receive(String address, Duration wait)
      throws IOException, InterruptedException {
    requireNonNull(address, "address");
    requireNonNull(wait, "wait");

    final PullResponse response;
    if (wait.isZero()) {
      response = pullImmediately(address);
    } else {
      final ApiFuture<PullResponse> future = subscriber.pullCallable()
          .futureCall(PullRequest.newBuilder().setSubscription(address).setMaxMessages(1).build());
      try {
        response = future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        return null;
      } catch (InterruptedException e) {
        future.cancel(true);
        throw e;
      } catch (ExecutionException e) {
        throw new IOException("Failed to receive from " + address, e.getCause());
      }
    }

    if (response.getReceivedMessagesCount() == 0)
      return null;

    final ReceivedMessage received = response.getReceivedMessages(0);
    final PubsubMessage message = received.getMessage();

    return new BrokerMessage(message.getMessageId(), received.getAckId(),
        message.getData().toStringUtf8(), message.getAttributesMap(),
        received.getDeliveryAttempt());
  }

  @SuppressWarnings("deprecation")
  private PullResponse pullImmediately(String address) throws IOException {
    try {
      return subscriber.pullCallable().call(PullRequest.newBuilder().setSubscription(address)
          .setMaxMessages(1).setReturnImmediately(true).build());
    } catch (ApiException e) {
      throw new IOException("Failed to receive from " + address, e);
    }
  }

  @Override
  public void extendLease(String address, String leaseToken, Duration duration)
      throws IOException {
    requireNonNull(address, "address");
    requireNonNull(leaseToken, "leaseToken");
    requireNonNull(duration, "duration");
    try {
      subscriber.modifyAckDeadlineCallable()
          .call(ModifyAckDeadlineRequest.newBuilder().setSubscription(address)
              .addAllAckIds(List.of(leaseToken))
              .setAckDeadlineSeconds(ackDeadlineSeconds(duration)).build());
    } catch (ApiException e) {
      throw new IOException("Failed to extend lease on " + address, e);
    }
  }

  @Override
  public void delete(String address, String leaseToken) throws IOException {
    requireNonNull(address, "address");
    requireNonNull(leaseToken, "leaseToken");
    try {
      subscriber.acknowledgeCallable().call(AcknowledgeRequest.newBuilder()
          .setSubscription(address).addAllAckIds(List.of(leaseToken)).build());
    } catch (ApiException e) {
      throw new IOException("Failed to acknowledge message on " + address, e);
    }
  }

  /**
   * Deletes the subscription and its topic.
   */
  @Override
  public boolean deleteQueue(String address) throws IOException {
    requireNonNull(address, "address");

    final Subscription subscription;
    try {
      subscription = subscriptionAdmin.getSubscription(address);
    } catch (NotFoundException e) {
      return false;
    } catch (ApiException e) {
      throw new IOException("Failed to look up subscription " + address, e);
    }

    try {
      subscriptionAdmin.deleteSubscription(address);
    } catch (NotFoundException e) {
      return false;
    } catch (ApiException e) {
      throw new IOException("Failed to delete subscription " + address, e);
    }

    try {
      topicAdmin.deleteTopic(subscription.getTopic());
    } catch (NotFoundException e) {
      LOGGER.atDebug().addKeyValue("topic", subscription.getTopic())
          .log("Topic already deleted");
    } catch (ApiException e) {
      throw new IOException("Failed to delete topic " + subscription.getTopic(), e);
    }

    LOGGER.atInfo().addKeyValue("address", address).log("Deleted queue");

    return true;
  }

  @Override
  public void close() {
    subscriber.close();
    subscriptionAdmin.close();
    topicAdmin.close();
  }

  static int ackDeadlineSeconds(Duration duration) {
    final long seconds = duration.getSeconds() + (duration.getNano() > 0 ? 1 : 0);
    if (seconds > MAX_ACK_DEADLINE_SECONDS) {
      LOGGER.atDebug().addKeyValue("requested", duration)
          .addKeyValue("max", MAX_ACK_DEADLINE_SECONDS).log("Capping ack deadline");
      return MAX_ACK_DEADLINE_SECONDS;
    }
    return (int) Math.max(seconds, MIN_ACK_DEADLINE_SECONDS);
  }

  static Duration retention(Duration retention) {
    if (retention.compareTo(MIN_RETENTION) < 0)
      return MIN_RETENTION;
    if (retention.compareTo(MAX_RETENTION) > 0)
      return MAX_RETENTION;
    return retention;
  }

  private static com.google.protobuf.Duration toProtoDuration(Duration duration) {
    return com.google.protobuf.Duration.newBuilder().setSeconds(duration.getSeconds())
        .setNanos(duration.getNano()).build();
  }

  private static com.google.pubsub.v1.DeadLetterPolicy toProtoDeadLetterPolicy(
      DeadLetterPolicy policy) {
    final int attempts = Math.max(MIN_DELIVERY_ATTEMPTS,
        Math.min(MAX_DELIVERY_ATTEMPTS, policy.maxDeliveryAttempts()));
    if (attempts != policy.maxDeliveryAttempts())
      LOGGER.atWarn().addKeyValue("requested", policy.maxDeliveryAttempts())
          .addKeyValue("effective", attempts).log("Adjusted max delivery attempts to Pubsub range");
    return com.google.pubsub.v1.DeadLetterPolicy.newBuilder()
        .setDeadLetterTopic(policy.deadLetterAddress()).setMaxDeliveryAttempts(attempts).build();
  }
}
