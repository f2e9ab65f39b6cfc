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

/**
 * Component that depends on the broker connection and must be restored after the {@link Client}
 * reconnects.
 *
 * @see Client#addConnectionClient(ConnectionClient)
 */
@FunctionalInterface
public interface ConnectionClient {

  /**
   * Restore the component on the new connection.
   *
   * <p>Called by the client only, after a successful reconnection, in registration order.
   *
   * @throws MqException if the component cannot be restored
   */
  void reconnect();
}
