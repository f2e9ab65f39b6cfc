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

/** Root of the exceptions thrown by the client. */
public class MqException extends RuntimeException {

  public MqException(Throwable cause) {
    super(cause);
  }

  public MqException(String format, Object... args) {
    super(String.format(format, args));
  }

  public MqException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * The broker cannot be reached: dial failure, channel opening failure, or closed transport.
   *
   * <p>The client retries on this exception when it recovers a connection, the low-level
   * connection never does.
   */
  public static class MqConnectException extends MqException {

    public MqConnectException(String format, Object... args) {
      super(format, args);
    }

    public MqConnectException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A publish call failed. Surfaced to the caller, never retried internally. */
  public static class MqPublishException extends MqException {

    public MqPublishException(String format, Object... args) {
      super(format, args);
    }

    public MqPublishException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class MqResourceClosedException extends MqException {

    public MqResourceClosedException(String format, Object... args) {
      super(format, args);
    }
  }

  /**
   * The client could not reconnect to the broker within its attempt budget.
   *
   * <p>This is fatal: a messaging-only service has nothing left to do without a broker and is
   * expected to terminate.
   */
  public static class MqReconnectExhaustedException extends MqException {

    private final int attempts;

    public MqReconnectExhaustedException(int attempts, Throwable cause) {
      super(
          String.format("Could not re-establish broker connection after %d attempt(s)", attempts),
          cause);
      this.attempts = attempts;
    }

    public int attempts() {
      return this.attempts;
    }
  }
}
