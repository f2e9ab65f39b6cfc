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

import io.resilientmq.client.DeclareOptions;
import io.resilientmq.client.MqException;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.metrics.MetricsCollector;
import io.resilientmq.client.transport.Transport;
import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportConnection;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A broker connection with its management channel.
 *
 * <p>The management channel carries publishing and topology operations, consumers open their own
 * channels. The connection does not recover by itself: {@link #reconnect()} swaps in fresh
 * handles when the owner decides so.
 */
final class BrokerConnection implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(BrokerConnection.class);

  private static final Pattern URI_CREDENTIALS = Pattern.compile("//[^/@]*@");

  private final Transport transport;
  private final String uri;
  private final String name;
  private final int prefetchLimit;
  private final boolean publisherConfirms;
  private final Duration confirmTimeout;
  private final MetricsCollector metricsCollector;
  // guards the swap of the handles
  private final Lock instanceLock = new ReentrantLock();
  // serializes the operations on the management channel
  private final Lock channelLock = new ReentrantLock();
  private volatile TransportConnection connection;
  private volatile TransportChannel channel;

  BrokerConnection(
      Transport transport,
      String uri,
      String name,
      int prefetchLimit,
      boolean publisherConfirms,
      Duration confirmTimeout,
      MetricsCollector metricsCollector) {
    this.transport = transport;
    this.uri = uri;
    this.name = name;
    this.prefetchLimit = prefetchLimit;
    this.publisherConfirms = publisherConfirms;
    this.confirmTimeout = confirmTimeout;
    this.metricsCollector = metricsCollector;
  }

  void connect() {
    this.reconnect();
  }

  /**
   * Dial the broker again and replace the current handles.
   *
   * <p>The previous handles are closed if still open. The current handles stay in place if the
   * dial fails.
   *
   * @throws MqException.MqConnectException if the broker cannot be reached
   */
  void reconnect() {
    LOGGER.debug("Connecting to broker {}", maskedUri(this.uri));
    TransportConnection newConnection;
    try {
      newConnection = this.transport.connect(this.uri, this.name);
    } catch (IOException | TimeoutException e) {
      throw ExceptionUtils.convertConnect(
          e, "Error while connecting to broker %s", maskedUri(this.uri));
    }
    TransportChannel newChannel;
    try {
      newChannel = newConnection.openChannel();
      if (this.prefetchLimit > 0) {
        newChannel.qos(this.prefetchLimit, true);
      }
      if (this.publisherConfirms) {
        newChannel.confirmSelect();
      }
    } catch (IOException | RuntimeException e) {
      // the driver reports a connection dying during setup with unchecked exceptions
      Utils.closeQuietly(LOGGER, "connection", newConnection::close);
      throw ExceptionUtils.convertConnect(e, "Error while opening management channel");
    }
    newConnection.addCloseListener(cause -> this.metricsCollector.closeConnection());
    this.metricsCollector.openConnection();

    TransportConnection previousConnection;
    TransportChannel previousChannel;
    this.instanceLock.lock();
    try {
      previousConnection = this.connection;
      previousChannel = this.channel;
      this.connection = newConnection;
      this.channel = newChannel;
    } finally {
      this.instanceLock.unlock();
    }
    if (previousChannel != null && previousChannel.isOpen()) {
      Utils.closeQuietly(LOGGER, "previous management channel", previousChannel::close);
    }
    if (previousConnection != null && previousConnection.isOpen()) {
      Utils.closeQuietly(LOGGER, "previous connection", previousConnection::close);
    }
    LOGGER.debug("Connected to broker {}", maskedUri(this.uri));
  }

  /**
   * Close the management channel and the connection.
   *
   * <p>Errors while closing the channel are logged, errors while closing the connection are
   * thrown. Does nothing on closed handles.
   */
  @Override
  public void close() {
    TransportConnection currentConnection;
    TransportChannel currentChannel;
    this.instanceLock.lock();
    try {
      currentConnection = this.connection;
      currentChannel = this.channel;
    } finally {
      this.instanceLock.unlock();
    }
    if (currentChannel != null && currentChannel.isOpen()) {
      Utils.closeQuietly(LOGGER, "management channel", currentChannel::close);
    }
    if (currentConnection != null && currentConnection.isOpen()) {
      try {
        currentConnection.close();
      } catch (IOException e) {
        throw ExceptionUtils.convert(e, "Error while closing connection");
      }
    }
  }

  boolean isOpen() {
    TransportConnection c = this.connection;
    return c != null && c.isOpen();
  }

  void healthCheck() {
    if (!this.isOpen()) {
      throw new MqException.MqConnectException("Connection to broker is closed");
    }
  }

  /**
   * Subscribe to the close signals of the current handles.
   *
   * @return fresh one-shot notifications
   */
  CloseNotifications notifyClose() {
    this.instanceLock.lock();
    try {
      return new CloseNotifications(this.connection, this.channel);
    } finally {
      this.instanceLock.unlock();
    }
  }

  TransportChannel openChannel() {
    TransportConnection c = this.connection;
    if (c == null) {
      throw new MqException.MqConnectException("Connection to broker is not established");
    }
    try {
      return c.openChannel();
    } catch (IOException e) {
      throw ExceptionUtils.convertConnect(e, "Error while opening channel");
    }
  }

  int prefetchLimit() {
    return this.prefetchLimit;
  }

  void publish(String exchange, String routingKey, byte[] body, PublishConfig config) {
    this.publishAll(exchange, routingKey, Collections.singletonList(body), config);
  }

  /**
   * Publish messages on the management channel.
   *
   * <p>With publisher confirms, waits once for the whole group.
   *
   * @throws MqException.MqPublishException if the transport fails or the broker nacks
   */
  void publishAll(String exchange, String routingKey, List<byte[]> bodies, PublishConfig config) {
    Map<String, Object> headers = headers(config);
    this.channelLock.lock();
    try {
      TransportChannel c = this.channel;
      for (byte[] body : bodies) {
        c.publish(exchange, routingKey, headers, body, config.deliveryMode());
        this.metricsCollector.publish();
      }
      if (this.publisherConfirms && !c.waitForConfirms(this.confirmTimeout)) {
        throw new MqException.MqPublishException(
            "Broker nacked message(s) published to exchange '%s' with routing key '%s'",
            exchange,
            routingKey);
      }
    } catch (IOException | TimeoutException | RuntimeException e) {
      throw ExceptionUtils.convertPublish(
          e,
          "Error while publishing to exchange '%s' with routing key '%s'",
          exchange,
          routingKey);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MqException.MqPublishException("Interrupted while waiting for confirms", e);
    } finally {
      this.channelLock.unlock();
    }
  }

  void declareQueue(String queue, DeclareOptions options) {
    this.withChannel(
        c ->
            c.declareQueue(
                queue,
                options.isDurable(),
                options.isExclusive(),
                options.isAutoDelete(),
                options.arguments()),
        "Error while declaring queue '%s'",
        queue);
  }

  void declareExchange(String exchange, String type) {
    this.withChannel(
        c -> c.declareExchange(exchange, type, true, false),
        "Error while declaring exchange '%s'",
        exchange);
  }

  void bindQueue(String queue, String exchange, String routingKey) {
    this.withChannel(
        c -> c.bindQueue(queue, exchange, routingKey),
        "Error while binding queue '%s' to exchange '%s'",
        queue,
        exchange);
  }

  private void withChannel(ChannelOperation operation, String format, Object... args) {
    this.channelLock.lock();
    try {
      operation.run(this.channel);
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e, format, args);
    } finally {
      this.channelLock.unlock();
    }
  }

  private static Map<String, Object> headers(PublishConfig config) {
    if (config.maxRetries().isPresent()) {
      return Collections.singletonMap(
          PublishConfig.REMAINING_RETRIES_HEADER, config.maxRetries().getAsInt());
    } else {
      return Collections.emptyMap();
    }
  }

  static String maskedUri(String uri) {
    return uri == null ? null : URI_CREDENTIALS.matcher(uri).replaceFirst("//***@");
  }

  @FunctionalInterface
  private interface ChannelOperation {

    void run(TransportChannel channel) throws IOException;
  }
}
