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
package io.resilientmq.client.transport;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.resilientmq.client.DeliveryMode;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * A message received by a subscription, with the handle to settle it on the channel it came from.
 */
public final class TransportDelivery {

  private final TransportChannel channel;
  private final long deliveryTag;
  private final boolean redelivered;
  private final Map<String, Object> headers;
  private final DeliveryMode deliveryMode;
  private final byte[] body;

  public TransportDelivery(
      TransportChannel channel,
      long deliveryTag,
      boolean redelivered,
      Map<String, Object> headers,
      DeliveryMode deliveryMode,
      byte[] body) {
    this.channel = channel;
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.headers = headers == null ? Collections.emptyMap() : headers;
    this.deliveryMode = deliveryMode == null ? DeliveryMode.PERSISTENT : deliveryMode;
    this.body = body;
  }

  public long deliveryTag() {
    return this.deliveryTag;
  }

  public boolean redelivered() {
    return this.redelivered;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  public DeliveryMode deliveryMode() {
    return this.deliveryMode;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  /**
   * Acknowledge this delivery only (not multiple).
   *
   * @throws IOException if the channel is closed or the acknowledgment fails
   */
  public void ack() throws IOException {
    this.channel.ack(this.deliveryTag);
  }

  /**
   * Reject this delivery.
   *
   * @param requeue whether the broker should requeue the message
   * @throws IOException if the channel is closed or the rejection fails
   */
  public void reject(boolean requeue) throws IOException {
    this.channel.reject(this.deliveryTag, requeue);
  }

  @Override
  public String toString() {
    return "TransportDelivery{"
        + "deliveryTag="
        + deliveryTag
        + ", redelivered="
        + redelivered
        + ", headers="
        + headers
        + ", deliveryMode="
        + deliveryMode
        + '}';
  }
}
