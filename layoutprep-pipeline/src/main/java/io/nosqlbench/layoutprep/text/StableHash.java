package io.nosqlbench.layoutprep.text;

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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/// MurmurHash3 x86 32 bit with seed 0 over UTF-8 bytes.
///
/// This is the only hash used for anything that must be reproducible across processes:
/// out-of-vocabulary embedding seeds, font hashes and featurization cache keys.
public class StableHash {

  private static final HashFunction MURMUR3 = Hashing.murmur3_32_fixed();
  private static final int SEED_MODULUS = Integer.MAX_VALUE;

  private StableHash() {
  }

  /// @param text
  ///     text to hash
  /// @return the signed 32 bit hash
  public static int murmur3(String text) {
    return MURMUR3.hashString(text, StandardCharsets.UTF_8).asInt();
  }

  /// @param text
  ///     text to hash
  /// @return the hash as an unsigned value
  public static long unsignedMurmur3(String text) {
    return Integer.toUnsignedLong(murmur3(text));
  }

  /// @param text
  ///     text to hash
  /// @return a non-negative seed in `[0, 2^31 - 1)`
  public static int seedFor(String text) {
    return Math.floorMod(murmur3(text), SEED_MODULUS);
  }

  /// @param text
  ///     text to hash
  /// @return the hash as 8 lower case hex digits
  public static String hex(String text) {
    return String.format("%08x", murmur3(text));
  }
}
