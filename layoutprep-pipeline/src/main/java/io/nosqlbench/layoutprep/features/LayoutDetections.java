package io.nosqlbench.layoutprep.features;


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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.nosqlbench.layoutprep.util.CompressedFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Title and author regions from the external layout detector, by document hash and page.
///
/// The detections file has one JSON object per line:
/// ```json
/// {"docSha": "<40 hex>", "pages": [[["title", left, top, right, bottom, confidence], ...], ...]}
/// ```
/// A bucket without the file has no detections. A later line for the same hash replaces an
/// earlier one.
public class LayoutDetections {
  private final static Logger logger = LogManager.getLogger(LayoutDetections.class);

  private final Map<String, List<List<DetectionBox>>> boxes;
  private final boolean present;
  private final Set<String> reportedMissing = new HashSet<>();

  private LayoutDetections(Map<String, List<List<DetectionBox>>> boxes, boolean present) {
    this.boxes = boxes;
    this.present = present;
  }

  /// @return detections with no boxes at all
  public static LayoutDetections none() {
    return new LayoutDetections(Map.of(), false);
  }

  /// @param path
  ///     the detections file, which may be absent
  /// @return the detections it holds
  /// @throws IOException
  ///     if the file exists but cannot be read
  public static LayoutDetections load(Path path) throws IOException {
    if (!Files.exists(path)) {
      logger.info("no layout detections at {}, box features will be 0", path);
      return none();
    }
    Map<String, List<List<DetectionBox>>> boxes = new HashMap<>();
    try (BufferedReader reader = CompressedFiles.openReader(path)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          JsonObject document = JsonParser.parseString(line).getAsJsonObject();
          String sha = member(document, "docSha").getAsString();
          List<List<DetectionBox>> pages = new ArrayList<>();
          for (JsonElement page : member(document, "pages").getAsJsonArray()) {
            List<DetectionBox> pageBoxes = new ArrayList<>();
            for (JsonElement box : page.getAsJsonArray()) {
              pageBoxes.add(parseBox(box.getAsJsonArray()));
            }
            pages.add(pageBoxes);
          }
          if (boxes.put(sha, pages) != null) {
            logger.warn("Duplicate sha {} in {}", sha, path);
          }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | NumberFormatException e) {
          logger.warn("skipping malformed detections at {}:{}: {}", path, lineNumber, e.toString());
        }
      }
    }
    logger.info("loaded layout detections for {} documents from {}", boxes.size(), path);
    return new LayoutDetections(boxes, true);
  }

  private static JsonElement member(JsonObject object, String name) {
    JsonElement element = object.get(name);
    if (element == null) {
      throw new IllegalStateException("missing '" + name + "'");
    }
    return element;
  }

  private static DetectionBox parseBox(JsonArray values) {
    if (values.size() != 6) {
      throw new IllegalStateException("a detection has 6 values, not " + values.size());
    }
    return new DetectionBox(
        values.get(0).getAsString(),
        values.get(1).getAsFloat(),
        values.get(2).getAsFloat(),
        values.get(3).getAsFloat(),
        values.get(4).getAsFloat(),
        values.get(5).getAsFloat()
    );
  }

  /// @param docSha
  ///     a document hash
  /// @param page
  ///     a page number within the document
  /// @return the detections of that page, empty when there are none
  public List<DetectionBox> boxesFor(String docSha, int page) {
    List<List<DetectionBox>> pages = boxes.get(docSha);
    if (pages == null) {
      if (present && reportedMissing.add(docSha)) {
        logger.warn("Missing vision output for {}", docSha);
      }
      return List.of();
    }
    if (page < 0 || page >= pages.size()) {
      return List.of();
    }
    return pages.get(page);
  }

  /// @return number of documents with detections
  public int documentCount() {
    return boxes.size();
  }
}
