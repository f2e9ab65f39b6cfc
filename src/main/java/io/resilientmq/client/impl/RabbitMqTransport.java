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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.resilientmq.client.DeliveryMode;
import io.resilientmq.client.transport.Transport;
import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportConnection;
import io.resilientmq.client.transport.TransportDelivery;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} over the RabbitMQ AMQP 0-9-1 Java client.
 *
 * <p>The driver's automatic recovery is disabled, the client recovers connections itself.
 */
final class RabbitMqTransport implements Transport {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMqTransport.class);

  private static final String CONTENT_TYPE = "text/plain";

  @Override
  public TransportConnection connect(String uri, String connectionName)
      throws IOException, TimeoutException {
    ConnectionFactory factory = new ConnectionFactory();
    try {
      factory.setUri(uri);
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid broker URI", e);
    }
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    Connection connection = factory.newConnection(connectionName);
    LOGGER.debug("Connection {} opened", connectionName);
    return new RabbitMqConnection(connection);
  }

  private static Throwable closeCause(ShutdownSignalException signal) {
    return signal.isInitiatedByApplication() ? null : signal;
  }

  private static final class RabbitMqConnection implements TransportConnection {

    private final Connection delegate;

    private RabbitMqConnection(Connection delegate) {
      this.delegate = delegate;
    }

    @Override
    public TransportChannel openChannel() throws IOException {
      Channel channel;
      try {
        channel = this.delegate.createChannel();
      } catch (ShutdownSignalException e) {
        throw new IOException("Connection is closed", e);
      }
      if (channel == null) {
        throw new IOException("No channel available on connection");
      }
      return new RabbitMqChannel(channel);
    }

    @Override
    public boolean isOpen() {
      return this.delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
      if (this.delegate.isOpen()) {
        this.delegate.close();
      }
    }

    @Override
    public void addCloseListener(Consumer<Throwable> listener) {
      this.delegate.addShutdownListener(signal -> listener.accept(closeCause(signal)));
    }
  }

  private static final class RabbitMqChannel implements TransportChannel {

    private final Channel delegate;

    private RabbitMqChannel(Channel delegate) {
      this.delegate = delegate;
    }

    @Override
    public void qos(int prefetchCount, boolean global) throws IOException {
      this.delegate.basicQos(prefetchCount, global);
    }

    @Override
    public void confirmSelect() throws IOException {
      this.delegate.confirmSelect();
    }

    @Override
    public boolean waitForConfirms(Duration timeout)
        throws InterruptedException, TimeoutException {
      return this.delegate.waitForConfirms(timeout.toMillis());
    }

    @Override
    public void declareQueue(
        String queue,
        boolean durable,
        boolean exclusive,
        boolean autoDelete,
        Map<String, Object> arguments)
        throws IOException {
      this.delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
    }

    @Override
    public void declareExchange(String exchange, String type, boolean durable, boolean autoDelete)
        throws IOException {
      this.delegate.exchangeDeclare(exchange, type, durable, autoDelete, null);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
      this.delegate.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void publish(
        String exchange,
        String routingKey,
        Map<String, Object> headers,
        byte[] body,
        DeliveryMode deliveryMode)
        throws IOException {
      AMQP.BasicProperties properties =
          new AMQP.BasicProperties.Builder()
              .contentType(CONTENT_TYPE)
              .deliveryMode(deliveryMode.code())
              .headers(headers)
              .build();
      this.delegate.basicPublish(exchange, routingKey, properties, body);
    }

    @Override
    public String consume(String queue, DeliveryListener listener) throws IOException {
      return this.delegate.basicConsume(
          queue,
          false,
          new DefaultConsumer(this.delegate) {
            @Override
            public void handleDelivery(
                String consumerTag,
                Envelope envelope,
                AMQP.BasicProperties properties,
                byte[] body) {
              listener.handle(
                  new TransportDelivery(
                      RabbitMqChannel.this,
                      envelope.getDeliveryTag(),
                      envelope.isRedeliver(),
                      properties.getHeaders(),
                      DeliveryMode.fromCode(properties.getDeliveryMode()),
                      body));
            }

            @Override
            public void handleCancel(String consumerTag) {
              listener.cancelled();
            }
          });
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
      this.delegate.basicCancel(consumerTag);
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
      this.delegate.basicAck(deliveryTag, false);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
      this.delegate.basicReject(deliveryTag, requeue);
    }

    @Override
    public boolean isOpen() {
      return this.delegate.isOpen();
    }

    @Override
    public void close() throws IOException, TimeoutException {
      if (this.delegate.isOpen()) {
        this.delegate.close();
      }
    }

    @Override
    public void addCloseListener(Consumer<Throwable> listener) {
      this.delegate.addShutdownListener(signal -> listener.accept(closeCause(signal)));
    }
  }
}
