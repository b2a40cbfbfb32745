package io.nosqlbench.layoutprep.labeling;


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

/// Why a document was left out of the labeled artifact
public enum RejectionReason {
  MISSING_METADATA("no reference metadata file"),
  UNDECODABLE_METADATA("reference metadata is not valid UTF-8"),
  TITLE_COUNT("not exactly one gold title"),
  SHORT_TITLE("gold title too short"),
  NO_AUTHORS("no gold authors"),
  AUTHOR_COUNT_MISMATCH("authors without surnames"),
  NO_COMMON_AUTHOR_PAGE("authors not found on one page"),
  TITLE_NOT_FOUND("title not found");

  private final String description;

  RejectionReason(String description) {
    this.description = description;
  }

  /// @return a short human readable description
  public String description() {
    return description;
  }
}
