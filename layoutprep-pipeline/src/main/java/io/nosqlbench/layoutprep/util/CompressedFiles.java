package io.nosqlbench.layoutprep.util;

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

import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Opens corpus input files whatever their compression. The format is detected from the
/// stream signature, so file extensions do not matter, and files without a known signature
/// are read as plain bytes.
public class CompressedFiles {

  private CompressedFiles() {
  }

  /// @param path
  ///     the file to open
  /// @return a decompressing stream over the file contents
  /// @throws IOException
  ///     if the file cannot be opened
  public static InputStream open(Path path) throws IOException {
    BufferedInputStream buffered = new BufferedInputStream(Files.newInputStream(path));
    String format;
    try {
      format = CompressorStreamFactory.detect(buffered);
    } catch (CompressorException notCompressed) {
      return buffered;
    }
    try {
      return new BufferedInputStream(
          new CompressorStreamFactory(true).createCompressorInputStream(format, buffered));
    } catch (CompressorException e) {
      buffered.close();
      throw new IOException("unable to decompress " + path + " as " + format, e);
    }
  }

  /// @param path
  ///     the file to open
  /// @return a UTF-8 reader over the decompressed file contents
  /// @throws IOException
  ///     if the file cannot be opened
  public static BufferedReader openReader(Path path) throws IOException {
    return new BufferedReader(new InputStreamReader(open(path), StandardCharsets.UTF_8));
  }
}
