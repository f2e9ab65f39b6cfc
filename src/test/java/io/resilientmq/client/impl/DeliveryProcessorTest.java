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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.resilientmq.client.Consumer;
import io.resilientmq.client.ConsumerOptions;
import io.resilientmq.client.DeliveryMode;
import io.resilientmq.client.MqException;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.metrics.MetricsCollector;
import io.resilientmq.client.metrics.NoOpMetricsCollector;
import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportDelivery;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class DeliveryProcessorTest {

  private static final byte[] BODY = "hello".getBytes(StandardCharsets.UTF_8);

  @Mock TransportChannel channel;
  @Mock BiConsumer<byte[], PublishConfig> republisher;
  @Mock MetricsCollector metricsCollector;

  AtomicInteger invocations = new AtomicInteger(0);

  Consumer.MessageHandler failing =
      message -> {
        invocations.incrementAndGet();
        throw new IllegalStateException("processing failed");
      };

  Consumer.MessageHandler succeeding = message -> invocations.incrementAndGet();

  @Test
  void successShouldAckOnce() throws Exception {
    DeliveryProcessor processor = processor(succeeding, ConsumerOptions.defaults(1));

    DeliveryProcessor.Outcome outcome = processor.process(delivery(1, Collections.emptyMap()));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.ACKED);
    assertThat(invocations).hasValue(1);
    verify(channel, times(1)).ack(1);
    verify(channel, never()).reject(anyLong(), anyBoolean());
    verifyNoInteractions(republisher);
    verify(metricsCollector).consume();
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.ACKED);
  }

  @Test
  void failureWithoutRetryOnErrorShouldAck() throws Exception {
    DeliveryProcessor processor =
        processor(failing, ConsumerOptions.builder().retryOnError(false).build());

    assertThat(processor.process(delivery(1, Collections.emptyMap())))
        .isEqualTo(DeliveryProcessor.Outcome.ACKED);
    verify(channel).ack(1);
    verify(channel, never()).reject(anyLong(), anyBoolean());
    verifyNoInteractions(republisher);
  }

  @Test
  void failureWithBudgetShouldRepublishWithDecrementedHeaderThenAck() throws Exception {
    DeliveryProcessor processor = processor(failing, noDelay().maxRetries(-1).build());

    DeliveryProcessor.Outcome outcome =
        processor.process(
            delivery(3, Map.of(REMAINING_RETRIES_HEADER, 2), DeliveryMode.TRANSIENT));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.REPUBLISHED);
    ArgumentCaptor<PublishConfig> config = ArgumentCaptor.forClass(PublishConfig.class);
    verify(republisher).accept(eq(BODY), config.capture());
    assertThat(config.getValue().maxRetries()).hasValue(1);
    assertThat(config.getValue().deliveryMode()).isEqualTo(DeliveryMode.TRANSIENT);
    verify(channel).ack(3);
    verify(channel, never()).reject(anyLong(), anyBoolean());
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.REPUBLISHED);
  }

  @Test
  void failureWithSpentBudgetShouldDropMessage() throws Exception {
    DeliveryProcessor processor = processor(failing, noDelay().build());

    DeliveryProcessor.Outcome outcome =
        processor.process(delivery(4, Map.of(REMAINING_RETRIES_HEADER, 0)));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.DROPPED);
    verify(channel).ack(4);
    verifyNoInteractions(republisher);
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.DROPPED);
  }

  @Test
  void failureWithoutBudgetShouldRequeue() throws Exception {
    DeliveryProcessor processor = processor(failing, noDelay().maxRetries(-1).build());

    DeliveryProcessor.Outcome outcome = processor.process(delivery(5, Collections.emptyMap()));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.REQUEUED);
    verify(channel).reject(5, true);
    verify(channel, never()).ack(anyLong());
    verifyNoInteractions(republisher);
  }

  @Test
  void missingHeaderShouldFallBackToConsumerBudget() throws Exception {
    DeliveryProcessor processor = processor(failing, noDelay().maxRetries(2).build());

    processor.process(delivery(6, Collections.emptyMap()));

    ArgumentCaptor<PublishConfig> config = ArgumentCaptor.forClass(PublishConfig.class);
    verify(republisher).accept(eq(BODY), config.capture());
    assertThat(config.getValue().maxRetries()).hasValue(1);
    verify(channel).ack(6);
  }

  @Test
  void failedRepublishShouldRequeueInsteadOfLosingMessage() throws Exception {
    doThrow(new MqException.MqPublishException("broker gone"))
        .when(republisher)
        .accept(any(), any());
    DeliveryProcessor processor = processor(failing, noDelay().build());

    DeliveryProcessor.Outcome outcome =
        processor.process(delivery(7, Map.of(REMAINING_RETRIES_HEADER, 3)));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.REQUEUED);
    verify(channel).reject(7, true);
    verify(channel, never()).ack(anyLong());
  }

  @Test
  void interruptedRetryDelayShouldRequeue() throws Exception {
    DeliveryProcessor processor =
        new DeliveryProcessor(
            "q",
            failing,
            ConsumerOptions.builder().retryDelay(Duration.ofSeconds(1)).maxRetries(5).build(),
            republisher,
            delay -> {
              throw new InterruptedException();
            },
            metricsCollector);

    DeliveryProcessor.Outcome outcome = processor.process(delivery(8, Collections.emptyMap()));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.REQUEUED);
    assertThat(Thread.interrupted()).isTrue();
    verify(channel).reject(8, true);
    verifyNoInteractions(republisher);
  }

  @Test
  void retryDelayShouldBeAppliedBeforeSettling() throws Exception {
    AtomicInteger waits = new AtomicInteger(0);
    Duration retryDelay = Duration.ofMillis(250);
    DeliveryProcessor processor =
        new DeliveryProcessor(
            "q",
            failing,
            ConsumerOptions.builder().retryDelay(retryDelay).build(),
            republisher,
            delay -> {
              assertThat(delay).isEqualTo(retryDelay);
              waits.incrementAndGet();
              return true;
            },
            metricsCollector);

    processor.process(delivery(9, Collections.emptyMap()));

    assertThat(waits).hasValue(1);
    verify(channel).reject(9, true);
  }

  @Test
  void deliveryWithoutBodyShouldBeSkipped() throws Exception {
    DeliveryProcessor processor = processor(succeeding, ConsumerOptions.defaults(1));

    DeliveryProcessor.Outcome outcome =
        processor.process(
            new TransportDelivery(
                channel, 10, false, null, DeliveryMode.PERSISTENT, null));

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.SKIPPED);
    assertThat(invocations).hasValue(0);
    verifyNoInteractions(channel);
  }

  @Test
  void emptyBodyShouldBeProcessed() throws Exception {
    DeliveryProcessor processor = processor(succeeding, ConsumerOptions.defaults(1));

    processor.process(
        new TransportDelivery(channel, 11, false, null, DeliveryMode.PERSISTENT, new byte[0]));

    assertThat(invocations).hasValue(1);
    verify(channel).ack(11);
  }

  @Test
  void ackFailureShouldNotPropagate() throws Exception {
    doThrow(new IOException("channel closed")).when(channel).ack(anyLong());
    DeliveryProcessor processor = processor(succeeding, ConsumerOptions.defaults(1));

    assertThat(processor.process(delivery(12, Collections.emptyMap())))
        .isEqualTo(DeliveryProcessor.Outcome.ACKED);
  }

  @Test
  void remainingRetriesShouldAcceptIntegersOnly() {
    assertThat(DeliveryProcessor.remainingRetries(Map.of(REMAINING_RETRIES_HEADER, 3)))
        .hasValue(3);
    assertThat(DeliveryProcessor.remainingRetries(Map.of(REMAINING_RETRIES_HEADER, 4L)))
        .hasValue(4);
    assertThat(DeliveryProcessor.remainingRetries(Map.of(REMAINING_RETRIES_HEADER, (short) 1)))
        .hasValue(1);
    assertThat(DeliveryProcessor.remainingRetries(Map.of(REMAINING_RETRIES_HEADER, "3")))
        .isEmpty();
    assertThat(
            DeliveryProcessor.remainingRetries(
                Map.of(REMAINING_RETRIES_HEADER, Long.MAX_VALUE)))
        .isEmpty();
    assertThat(DeliveryProcessor.remainingRetries(Collections.emptyMap())).isEmpty();
    assertThat(DeliveryProcessor.remainingRetries(null)).isEqualTo(OptionalInt.empty());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 5})
  void budgetShouldGiveExactlyOneRepublishPerRetry(int maxRetries) throws Exception {
    AtomicInteger republished = new AtomicInteger(0);
    ArgumentCaptor<PublishConfig> config = ArgumentCaptor.forClass(PublishConfig.class);
    DeliveryProcessor processor =
        new DeliveryProcessor(
            "q",
            failing,
            noDelay().maxRetries(maxRetries).build(),
            (body, c) -> republished.incrementAndGet(),
            RetryUtils.SLEEP,
            NoOpMetricsCollector.INSTANCE);

    Map<String, Object> headers = Collections.emptyMap();
    DeliveryProcessor.Outcome outcome;
    long tag = 0;
    do {
      outcome = processor.process(delivery(++tag, headers));
      headers = Map.of(REMAINING_RETRIES_HEADER, maxRetries - republished.get());
    } while (outcome == DeliveryProcessor.Outcome.REPUBLISHED);

    assertThat(outcome).isEqualTo(DeliveryProcessor.Outcome.DROPPED);
    assertThat(republished).hasValue(maxRetries);
    assertThat(invocations).hasValue(maxRetries + 1);
    verify(channel, times(maxRetries + 1)).ack(anyLong());
    verify(channel, never()).reject(anyLong(), anyBoolean());
  }

  private DeliveryProcessor processor(Consumer.MessageHandler handler, ConsumerOptions options) {
    return new DeliveryProcessor(
        "q", handler, options, republisher, RetryUtils.SLEEP, metricsCollector);
  }

  private static ConsumerOptions.Builder noDelay() {
    return ConsumerOptions.builder().retryDelay(Duration.ZERO);
  }

  private TransportDelivery delivery(long tag, Map<String, Object> headers) {
    return delivery(tag, headers, DeliveryMode.PERSISTENT);
  }

  private TransportDelivery delivery(long tag, Map<String, Object> headers, DeliveryMode mode) {
    return new TransportDelivery(channel, tag, false, headers, mode, BODY);
  }
}
