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
package io.resilientmq.client;

import java.util.List;

/**
 * A named exchange of the broker.
 *
 * <p>Instances do not own the connection, they must not be used after the {@link Client} is
 * closed.
 *
 * @see Client#exchange(String)
 */
public interface Exchange {

  String name();

  /**
   * Declare a durable, non-auto-delete exchange. Idempotent.
   *
   * @param type exchange type
   * @throws MqException if the declaration fails
   */
  void declare(ExchangeType type);

  /**
   * Bind queues with an empty binding key.
   *
   * @param queues queues to bind
   * @throws MqException at the first failing binding
   */
  void bind(List<? extends Queue> queues);

  /**
   * Bind queues with a binding key.
   *
   * @param queues queues to bind
   * @param key binding key
   * @throws MqException at the first failing binding
   */
  void bind(List<? extends Queue> queues, String key);

  /**
   * Publish a persistent message with an empty routing key.
   *
   * @param body message body
   * @throws MqException.MqPublishException if the broker call fails
   */
  void publish(byte[] body);

  /**
   * Publish a persistent message with a routing key.
   *
   * @param body message body
   * @param key routing key
   * @throws MqException.MqPublishException if the broker call fails
   */
  void publish(byte[] body, String key);

  /**
   * Publish a message with a routing key and settings.
   *
   * @param body message body
   * @param key routing key
   * @param config message settings
   * @throws MqException.MqPublishException if the broker call fails
   */
  void publish(byte[] body, String key, PublishConfig config);

  /** Exchange type. */
  enum ExchangeType {
    DIRECT("direct"),
    FANOUT("fanout"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String type;

    ExchangeType(String type) {
      this.type = type;
    }

    public String type() {
      return this.type;
    }
  }
}
