package io.nosqlbench.layoutprep.schema;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Per token class labels, stored as one byte each
public enum TokenLabel {
  NONE(0),
  TITLE(1),
  AUTHOR(2);

  private final byte code;

  TokenLabel(int code) {
    this.code = (byte) code;
  }

  /// @return the stored byte value
  public byte code() {
    return code;
  }

  /// @param code
  ///     a stored byte value
  /// @return the label for it
  public static TokenLabel fromCode(byte code) {
    for (TokenLabel label : values()) {
      if (label.code == code) {
        return label;
      }
    }
    throw new IllegalArgumentException("unknown token label code " + code);
  }

  /// Labels written over the same token keep the one with the higher precedence, authors
  /// over titles over nothing.
  /// @param other
  ///     the label being written
  /// @return the label which should remain on the token
  public TokenLabel merge(TokenLabel other) {
    return other.precedence() > precedence() ? other : this;
  }

  private int precedence() {
    return switch (this) {
      case NONE -> 0;
      case TITLE -> 1;
      case AUTHOR -> 2;
    };
  }
}
