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

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Access to an AMQP 0-9-1 broker.
 *
 * <p>The client relies only on this contract to talk to the broker, the default implementation
 * delegates to the RabbitMQ Java client. Implementations must not recover connections on their
 * own: recovery is the job of the {@link io.resilientmq.client.Client}.
 */
public interface Transport {

  /**
   * Dial the broker.
   *
   * @param uri broker URI
   * @param connectionName name to advertise to the broker, can be null
   * @return an open connection
   * @throws IOException if the broker cannot be reached or rejects the connection
   * @throws TimeoutException if the connection handshake times out
   */
  TransportConnection connect(String uri, String connectionName)
      throws IOException, TimeoutException;
}
