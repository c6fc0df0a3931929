// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.wmibo.model;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Solver options from {@code opt <key> <value>} lines.
 *
 * <p>Values are numbers when they parse as a decimal literal and strings otherwise. They are stored
 * in a protobuf {@link Struct} so they can be handed to a backend as is. Options are not
 * interpreted by the loader.
 */
public final class Options {
  public static final String TIME_LIMIT = "time_limit";
  public static final String NODE_LIMIT = "node_limit";
  public static final String FEASIBILITY_TOLERANCE = "feas_tol";
  public static final String INTEGRALITY_TOLERANCE = "int_tol";

  private static final Pattern NUMBER =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private static final Options EMPTY = new Options(Struct.getDefaultInstance());

  private Options(Struct struct) {
    this.struct = struct;
  }

  public static Options empty() {
    return EMPTY;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Converts a raw token into a number or string value. */
  public static Value parseValue(String raw) {
    if (NUMBER.matcher(raw).matches()) {
      return Value.newBuilder().setNumberValue(Double.parseDouble(raw)).build();
    }
    return Value.newBuilder().setStringValue(raw).build();
  }

  public boolean contains(String key) {
    return struct.containsFields(key);
  }

  /** Returns the value for key, or null. */
  public Value get(String key) {
    return struct.getFieldsOrDefault(key, null);
  }

  /** Returns the numeric value for key, or defaultValue if it is absent or not a number. */
  public double getNumber(String key, double defaultValue) {
    Value value = get(key);
    if (value == null || value.getKindCase() != Value.KindCase.NUMBER_VALUE) {
      return defaultValue;
    }
    return value.getNumberValue();
  }

  /** Returns the value for key as written, or defaultValue if absent. */
  public String getString(String key, String defaultValue) {
    Value value = get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value.getKindCase() == Value.KindCase.NUMBER_VALUE) {
      double number = value.getNumberValue();
      if (number == Math.rint(number) && Math.abs(number) < 1e15) {
        return Long.toString((long) number);
      }
      return Double.toString(number);
    }
    return value.getStringValue();
  }

  public int size() {
    return struct.getFieldsCount();
  }

  /** Returns a read-only view of all options. */
  public Map<String, Value> asMap() {
    return struct.getFieldsMap();
  }

  public Struct toStruct() {
    return struct;
  }

  @Override
  public String toString() {
    return asMap().toString();
  }

  /** Accumulates options, the last write for a key wins. */
  public static final class Builder {
    private final Struct.Builder struct = Struct.newBuilder();

    private Builder() {}

    public Builder put(String key, String rawValue) {
      struct.putFields(key, parseValue(rawValue));
      return this;
    }

    public Builder putAll(Map<String, String> rawValues) {
      for (Map.Entry<String, String> entry : rawValues.entrySet()) {
        put(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Options build() {
      return new Options(struct.build());
    }
  }

  private final Struct struct;
}
