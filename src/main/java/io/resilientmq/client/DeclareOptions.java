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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Queue declaration settings. The default is a durable, non-exclusive, non-auto-delete queue. */
public final class DeclareOptions {

  private static final DeclareOptions DURABLE = builder().build();

  private final boolean durable;
  private final boolean exclusive;
  private final boolean autoDelete;
  private final Map<String, Object> arguments;

  private DeclareOptions(Builder builder) {
    this.durable = builder.durable;
    this.exclusive = builder.exclusive;
    this.autoDelete = builder.autoDelete;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
  }

  public static DeclareOptions durable() {
    return DURABLE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isDurable() {
    return this.durable;
  }

  public boolean isExclusive() {
    return this.exclusive;
  }

  public boolean isAutoDelete() {
    return this.autoDelete;
  }

  public Map<String, Object> arguments() {
    return this.arguments;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DeclareOptions that = (DeclareOptions) o;
    return durable == that.durable
        && exclusive == that.exclusive
        && autoDelete == that.autoDelete
        && arguments.equals(that.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(durable, exclusive, autoDelete, arguments);
  }

  @Override
  public String toString() {
    return "DeclareOptions{"
        + "durable="
        + durable
        + ", exclusive="
        + exclusive
        + ", autoDelete="
        + autoDelete
        + ", arguments="
        + arguments
        + '}';
  }

  public static final class Builder {

    private boolean durable = true;
    private boolean exclusive = false;
    private boolean autoDelete = false;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    private Builder() {}

    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public Builder exclusive(boolean exclusive) {
      this.exclusive = exclusive;
      return this;
    }

    public Builder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    /**
     * Queue argument, e.g. <code>x-message-ttl</code> or <code>x-dead-letter-exchange</code>.
     *
     * @param key argument key
     * @param value argument value
     * @return this builder
     */
    public Builder argument(String key, Object value) {
      this.arguments.put(key, value);
      return this;
    }

    public DeclareOptions build() {
      return new DeclareOptions(this);
    }
  }
}
