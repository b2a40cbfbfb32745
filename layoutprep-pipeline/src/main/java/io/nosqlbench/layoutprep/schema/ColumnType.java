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

/// Storage types of artifact columns
public enum ColumnType {
  /// UTF-8 heap with an offset table
  STRING,
  /// 32 bit floats
  FLOAT,
  /// 32 bit signed ints
  INT,
  /// signed bytes
  BYTE
}
