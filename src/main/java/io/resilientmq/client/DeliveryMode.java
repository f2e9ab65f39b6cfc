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

/** AMQP 0-9-1 delivery mode of a message. */
public enum DeliveryMode {
  TRANSIENT(1),
  PERSISTENT(2);

  private final int code;

  DeliveryMode(int code) {
    this.code = code;
  }

  /**
   * Protocol value of the delivery mode.
   *
   * @return 1 for transient, 2 for persistent
   */
  public int code() {
    return this.code;
  }

  /**
   * Delivery mode from its protocol value. Unknown or missing values map to {@link #PERSISTENT}.
   *
   * @param code protocol value, can be null
   * @return the delivery mode
   */
  public static DeliveryMode fromCode(Integer code) {
    if (code != null && code == TRANSIENT.code) {
      return TRANSIENT;
    }
    return PERSISTENT;
  }
}
