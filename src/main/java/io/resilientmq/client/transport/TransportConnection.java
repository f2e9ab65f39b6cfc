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
import java.util.function.Consumer;

/** A physical connection to the broker. */
public interface TransportConnection {

  /**
   * Open a new channel.
   *
   * @return the channel
   * @throws IOException if the channel cannot be opened
   */
  TransportChannel openChannel() throws IOException;

  boolean isOpen();

  /**
   * Close the connection and its channels.
   *
   * @throws IOException if the closing handshake fails
   */
  void close() throws IOException;

  /**
   * Register a listener called once when the connection closes.
   *
   * <p>The cause is null when the application closed the connection. The listener is called
   * immediately if the connection is already closed.
   *
   * @param listener close listener
   */
  void addCloseListener(Consumer<Throwable> listener);
}
