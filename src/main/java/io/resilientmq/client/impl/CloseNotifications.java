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

import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportConnection;
import java.util.concurrent.CompletableFuture;

/**
 * One-shot close signals of a connection and of its management channel.
 *
 * <p>Each future completes once, with the close cause (null for a close initiated by the
 * application). Signals of a replaced connection are never reused: subscribe again after a
 * reconnection.
 */
final class CloseNotifications {

  private final CompletableFuture<Throwable> connectionClosed = new CompletableFuture<>();
  private final CompletableFuture<Throwable> channelClosed = new CompletableFuture<>();

  CloseNotifications(TransportConnection connection, TransportChannel channel) {
    connection.addCloseListener(this.connectionClosed::complete);
    channel.addCloseListener(this.channelClosed::complete);
  }

  CompletableFuture<Throwable> connectionClosed() {
    return this.connectionClosed;
  }

  CompletableFuture<Throwable> channelClosed() {
    return this.channelClosed;
  }
}
