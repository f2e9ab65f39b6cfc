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

import static io.resilientmq.client.PublishConfig.REMAINING_RETRIES_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.resilientmq.client.Client;
import io.resilientmq.client.DeclareOptions;
import io.resilientmq.client.DeliveryMode;
import io.resilientmq.client.MqException;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.Queue;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MqQueueTest {

  FakeTransport transport;
  Client client;

  @BeforeEach
  void init() {
    transport = new FakeTransport();
    client = new MqClientBuilder().transport(transport).build();
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void declareShouldCreateQueue() {
    Queue queue = client.queue("invoices");
    assertThat(transport.queueDeclared("invoices")).isFalse();
    queue.declare();
    assertThat(transport.queueDeclared("invoices")).isTrue();
    // declaring twice with the same settings is fine
    queue.declare(DeclareOptions.durable());
    assertThat(queue.name()).isEqualTo("invoices");
  }

  @Test
  void publishShouldUseDefaultExchangeAndQueueNameAsRoutingKey() {
    Queue queue = client.queue("invoices");
    queue.declare();

    queue.publish(bytes("invoice-1"));
    queue.publish(
        bytes("invoice-2"), PublishConfig.withMaxRetries(5).deliveryMode(DeliveryMode.TRANSIENT));

    assertThat(transport.published()).hasSize(2);
    FakeTransport.Published first = transport.published().get(0);
    assertThat(first.exchange()).isEmpty();
    assertThat(first.routingKey()).isEqualTo("invoices");
    assertThat(first.headers()).isEmpty();
    assertThat(first.deliveryMode()).isEqualTo(DeliveryMode.PERSISTENT);
    FakeTransport.Published second = transport.published().get(1);
    assertThat(second.headers()).containsEntry(REMAINING_RETRIES_HEADER, 5);
    assertThat(second.deliveryMode()).isEqualTo(DeliveryMode.TRANSIENT);
    assertThat(new String(second.body(), StandardCharsets.UTF_8)).isEqualTo("invoice-2");
    assertThat(transport.messageCount("invoices")).isEqualTo(2);
  }

  @Test
  void publishBatchShouldPublishAllMessagesInOrder() {
    Queue queue = client.queue("invoices");
    queue.declare();
    List<byte[]> messages =
        IntStream.range(0, 25).mapToObj(i -> bytes("invoice-" + i)).collect(Collectors.toList());

    queue.publishBatch(messages, 10, PublishConfig.withMaxRetries(1));

    assertThat(transport.published()).hasSize(25);
    assertThat(transport.published())
        .extracting(p -> new String(p.body(), StandardCharsets.UTF_8))
        .containsExactlyElementsOf(
            IntStream.range(0, 25).mapToObj(i -> "invoice-" + i).collect(Collectors.toList()));
    assertThat(transport.published())
        .allSatisfy(p -> assertThat(p.headers()).containsEntry(REMAINING_RETRIES_HEADER, 1));
  }

  @Test
  void publishBatchWithEmptyListShouldDoNothing() {
    client.queue("invoices").publishBatch(List.of(), 10, PublishConfig.defaults());
    assertThat(transport.published()).isEmpty();
  }

  @Test
  void publisherConfirmsShouldReportNacks() {
    FakeTransport confirmTransport = new FakeTransport();
    try (Client confirmClient =
        new MqClientBuilder().transport(confirmTransport).publisherConfirms(true).build()) {
      assertThat(confirmTransport.lastConnection().managementChannel().confirms()).isTrue();
      Queue queue = confirmClient.queue("invoices");
      queue.publish(bytes("accepted"));

      confirmTransport.nackConfirms(true);
      assertThatThrownBy(() -> queue.publish(bytes("nacked")))
          .isInstanceOf(MqException.MqPublishException.class);
    }
  }

  @Test
  void publishOnLostConnectionShouldFail() {
    Queue queue = client.queue("invoices");
    transport.lastConnection().kill();
    assertThatThrownBy(() -> queue.publish(bytes("invoice-1")))
        .isInstanceOf(MqException.MqPublishException.class);
    assertThatThrownBy(queue::healthCheck).isInstanceOf(MqException.MqConnectException.class);
  }

  @Test
  void operationsOnClosedClientShouldFail() {
    Queue queue = client.queue("invoices");
    client.close();
    assertThatThrownBy(queue::declare).isInstanceOf(MqException.MqResourceClosedException.class);
    assertThatThrownBy(() -> queue.publish(bytes("invoice-1")))
        .isInstanceOf(MqException.MqResourceClosedException.class);
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
