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

import com.rabbitmq.client.ShutdownSignalException;
import io.resilientmq.client.MqException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static MqException convert(Exception e) {
    return convert(e, null);
  }

  /**
   * Map a transport exception to the client's hierarchy.
   *
   * <p>Closed connections and channels, network errors and handshake timeouts become {@link
   * MqException.MqConnectException}s.
   */
  static MqException convert(Exception e, String format, Object... args) {
    if (e instanceof MqException) {
      return (MqException) e;
    }
    String message = format == null ? exceptionMessage(e) : String.format(format, args);
    if (isConnectionFailure(e)) {
      return new MqException.MqConnectException(message, e);
    } else {
      return new MqException(message, e);
    }
  }

  static MqException.MqConnectException convertConnect(
      Exception e, String format, Object... args) {
    if (e instanceof MqException.MqConnectException) {
      return (MqException.MqConnectException) e;
    }
    return new MqException.MqConnectException(String.format(format, args), e);
  }

  static MqException.MqPublishException convertPublish(
      Exception e, String format, Object... args) {
    if (e instanceof MqException.MqPublishException) {
      return (MqException.MqPublishException) e;
    }
    return new MqException.MqPublishException(String.format(format, args), e);
  }

  static boolean isConnectionFailure(Throwable e) {
    Throwable current = e;
    // shutdown signals are often wrapped in IOExceptions by the driver
    while (current != null) {
      if (current instanceof MqException.MqConnectException
          || current instanceof ShutdownSignalException
          || current instanceof ConnectException
          || current instanceof SocketException
          || current instanceof UnknownHostException
          || current instanceof TimeoutException) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  static String exceptionMessage(Throwable e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
