// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package io.resilientmq.client.impl;

import static io.resilientmq.client.Resource.State.CLOSED;
import static io.resilientmq.client.Resource.State.CLOSING;
import static io.resilientmq.client.Resource.State.DEGRADED;
import static io.resilientmq.client.Resource.State.FAILED;
import static io.resilientmq.client.Resource.State.OPEN;
import static io.resilientmq.client.Resource.State.RECOVERING;

import io.resilientmq.client.BackOffDelayPolicy;
import io.resilientmq.client.Client;
import io.resilientmq.client.ConnectionClient;
import io.resilientmq.client.Consumer;
import io.resilientmq.client.ConsumerOptions;
import io.resilientmq.client.Exchange;
import io.resilientmq.client.MqException;
import io.resilientmq.client.Queue;
import io.resilientmq.client.metrics.MetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MqClient extends ResourceBase implements Client {

  private static final Logger LOGGER = LoggerFactory.getLogger(MqClient.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final String name;
  private final BrokerConnection connection;
  private final MetricsCollector metricsCollector;
  private final BackOffDelayPolicy recoveryBackOffDelayPolicy;
  private final Duration connectionCheckInterval;
  // registered for reconnection, in registration order
  private final List<ConnectionClient> connectionClients = new ArrayList<>();
  private final Lock connectionClientsLock = new ReentrantLock();
  // clients whose last reconnection failed
  private final Set<ConnectionClient> pendingClients = ConcurrentHashMap.newKeySet();
  private final List<RetryingConsumer> consumers = new CopyOnWriteArrayList<>();
  private final CompletableFuture<Void> closeSignal = new CompletableFuture<>();
  private final CountDownLatch closeLatch = new CountDownLatch(1);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean listening = new AtomicBoolean(false);
  private volatile ExecutorService listenExecutor;

  MqClient(MqClientBuilder builder) {
    super(builder.listeners());
    this.id = ID_SEQUENCE.getAndIncrement();
    this.name = builder.name() == null ? "resilientmq-client-" + this.id : builder.name();
    this.metricsCollector = builder.metricsCollector();
    this.recoveryBackOffDelayPolicy = builder.recoveryConfiguration().backOffDelayPolicy();
    this.connectionCheckInterval = builder.recoveryConfiguration().connectionCheckInterval();
    this.connection =
        new BrokerConnection(
            builder.transport(),
            builder.uri(),
            this.name,
            builder.prefetchLimit(),
            builder.publisherConfirms(),
            builder.confirmTimeout(),
            this.metricsCollector);
    try {
      this.connection.connect();
    } catch (MqException e) {
      this.state(FAILED, e);
      throw e;
    }
    LOGGER.info(
        "Client '{}' connected to broker {}",
        this.name,
        BrokerConnection.maskedUri(builder.uri()));
    this.state(OPEN);
  }

  @Override
  public Queue queue(String name) {
    this.checkNotClosed();
    return new MqQueue(this, name);
  }

  @Override
  public Exchange exchange(String name) {
    this.checkNotClosed();
    return new MqExchange(this, name);
  }

  @Override
  public Consumer consumer(
      String queue, ConsumerOptions options, Consumer.MessageHandler handler) {
    this.checkNotClosed();
    RetryingConsumer consumer =
        new RetryingConsumer(
            this, new MqQueue(this, queue), options, handler, Collections.emptyList());
    this.consumers.add(consumer);
    return consumer;
  }

  @Override
  public void startConsumers(Consumer... consumers) {
    for (Consumer consumer : consumers) {
      consumer.start();
      this.addConnectionClient(consumer);
    }
  }

  @Override
  public void addConnectionClient(ConnectionClient connectionClient) {
    this.connectionClientsLock.lock();
    try {
      this.connectionClients.add(connectionClient);
    } finally {
      this.connectionClientsLock.unlock();
    }
  }

  @Override
  public void listenConnection() {
    this.checkNotClosed();
    if (!this.listening.compareAndSet(false, true)) {
      throw new IllegalStateException("Client '" + this.name + "' is already listening");
    }
    try {
      this.superviseConnection();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.info("Connection listener of client '{}' interrupted", this.name);
    } finally {
      this.listening.set(false);
    }
  }

  private void superviseConnection() throws InterruptedException {
    LOGGER.info("Listening to connection of client '{}'", this.name);
    CloseNotifications notifications = this.connection.notifyClose();
    CompletableFuture<Throwable> connectionClosed = notifications.connectionClosed();
    CompletableFuture<Throwable> channelClosed = notifications.channelClosed();
    while (true) {
      if (this.closed.get()) {
        this.closeConnection();
        LOGGER.info("Stopped listening to connection of client '{}'", this.name);
        return;
      }
      try {
        CompletableFuture.anyOf(this.closeSignal, connectionClosed, channelClosed)
            .get(this.connectionCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        if (!this.connection.isOpen() && !connectionClosed.isDone()) {
          LOGGER.warn("Connection of client '{}' is closed, no notification received", this.name);
          connectionClosed = CompletableFuture.completedFuture(null);
        } else {
          this.retryPendingClients();
          continue;
        }
      } catch (ExecutionException e) {
        // the signals never complete exceptionally
        LOGGER.warn("Unexpected error in connection listener", e);
      }

      if (this.closed.get()) {
        continue;
      }

      if (channelClosed.isDone()) {
        Throwable cause = channelClosed.getNow(null);
        LOGGER.info(
            "Management channel of client '{}' closed: {}",
            this.name,
            ExceptionUtils.exceptionMessage(cause));
        // the channel signal fires only once per connection
        channelClosed = new CompletableFuture<>();
        if (this.connection.isOpen() && !connectionClosed.isDone()) {
          try {
            this.connection.close();
          } catch (MqException ex) {
            LOGGER.warn(
                "Error while closing connection of client '{}', reconnecting anyway",
                this.name,
                ex);
            connectionClosed = CompletableFuture.completedFuture(cause);
          }
        }
        continue;
      }

      if (connectionClosed.isDone()) {
        Throwable cause = connectionClosed.getNow(null);
        LOGGER.info(
            "Connection of client '{}' closed: {}",
            this.name,
            ExceptionUtils.exceptionMessage(cause));
        this.state(DEGRADED, cause);
        if (!this.reconnectWithRetry()) {
          continue;
        }
        notifications = this.connection.notifyClose();
        connectionClosed = notifications.connectionClosed();
        channelClosed = notifications.channelClosed();
      }
    }
  }

  /**
   * Reconnect the broker connection, then the registered clients.
   *
   * @return false if the client has been closed in the meantime
   */
  private boolean reconnectWithRetry() throws InterruptedException {
    this.state(RECOVERING);
    try {
      RetryUtils.callWithBackOff(
          attempt -> {
            this.metricsCollector.reconnectionAttempt();
            LOGGER.info("Reconnecting client '{}', attempt #{}", this.name, attempt);
            this.connection.reconnect();
            return null;
          },
          ExceptionUtils::isConnectionFailure,
          this.recoveryBackOffDelayPolicy,
          this::waitUnlessClosed,
          "Reconnection of client '%s'",
          this.name);
    } catch (CancellationException e) {
      LOGGER.info("Reconnection of client '{}' cancelled, client closed", this.name);
      return false;
    } catch (RetryUtils.RetryExhaustedException e) {
      MqException exhausted =
          new MqException.MqReconnectExhaustedException(e.attempts(), e.getCause());
      LOGGER.error(
          "Client '{}' could not reconnect after {} attempt(s), giving up",
          this.name,
          e.attempts());
      this.state(FAILED, exhausted);
      throw exhausted;
    } catch (MqException e) {
      LOGGER.error("Client '{}' could not reconnect, giving up", this.name, e);
      this.state(FAILED, e);
      throw e;
    }
    LOGGER.info("Client '{}' reconnected", this.name);
    this.pendingClients.clear();
    for (ConnectionClient client : this.connectionClientsSnapshot()) {
      this.reconnect(client);
    }
    this.state(OPEN);
    return true;
  }

  private boolean waitUnlessClosed(Duration delay) throws InterruptedException {
    return !this.closeLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void retryPendingClients() {
    if (this.pendingClients.isEmpty() || !this.connection.isOpen()) {
      return;
    }
    for (ConnectionClient client : this.connectionClientsSnapshot()) {
      if (this.pendingClients.remove(client)) {
        LOGGER.info("Retrying reconnection of {}", client);
        this.reconnect(client);
      }
    }
  }

  private void reconnect(ConnectionClient client) {
    if (this.closed.get()) {
      return;
    }
    try {
      client.reconnect();
    } catch (Exception e) {
      LOGGER.error("Error while reconnecting {}, will retry later", client, e);
      this.pendingClients.add(client);
    }
  }

  private List<ConnectionClient> connectionClientsSnapshot() {
    this.connectionClientsLock.lock();
    try {
      return new ArrayList<>(this.connectionClients);
    } finally {
      this.connectionClientsLock.unlock();
    }
  }

  @Override
  public CompletableFuture<Void> listenConnectionAsync() {
    this.checkNotClosed();
    ExecutorService executor = this.listenExecutor;
    if (executor == null) {
      executor =
          Executors.newSingleThreadExecutor(
              Utils.threadFactory("resilientmq-listener-" + this.name + "-"));
      this.listenExecutor = executor;
    }
    return CompletableFuture.runAsync(this::listenConnection, executor);
  }

  @Override
  public void healthCheck() {
    this.checkNotClosed();
    this.connection.healthCheck();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.info("Closing client '{}'", this.name);
      this.state(CLOSING);
      this.closeLatch.countDown();
      this.closeSignal.complete(null);
      for (RetryingConsumer consumer : new ArrayList<>(this.consumers)) {
        try {
          consumer.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing {}", consumer, e);
        }
      }
      this.closeConnection();
      ExecutorService executor = this.listenExecutor;
      if (executor != null) {
        executor.shutdown();
      }
      this.state(CLOSED);
      LOGGER.info("Client '{}' closed", this.name);
    }
  }

  private void closeConnection() {
    try {
      this.connection.close();
    } catch (MqException e) {
      LOGGER.warn("Error while closing connection of client '{}'", this.name, e);
    }
  }

  BrokerConnection connection() {
    return this.connection;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  void removeConsumer(RetryingConsumer consumer) {
    this.consumers.remove(consumer);
    this.connectionClientsLock.lock();
    try {
      this.connectionClients.remove(consumer);
    } finally {
      this.connectionClientsLock.unlock();
    }
    this.pendingClients.remove(consumer);
  }

  @Override
  public String toString() {
    return "Client{name='" + name + "'}";
  }
}
