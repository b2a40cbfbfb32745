package io.nosqlbench.layoutprep;


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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.config.CorpusLayout;
import io.nosqlbench.layoutprep.stats.TokenStatisticsFile;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes tiny corpora for tests.
///
/// The standard corpus has one bucket, `00`, with five documents:
/// 1. `Deep Learning for NLP` by John Smith, found on page 0 (accepted)
/// 2. no reference metadata
/// 3. a too short title
/// 4. a title which is not on any page
/// 5. an author who is not on any page
public class CorpusFixture {

  public static final String BUCKET = "00";
  public static final String TITLE = "Deep Learning for NLP";

  private static final Gson GSON = new Gson();

  private final Path root;

  public CorpusFixture(Path root) {
    this.root = root;
  }

  public Path root() {
    return root;
  }

  public CorpusLayout layout() {
    return new CorpusLayout(root);
  }

  public BucketLayout bucket(String name) {
    return layout().bucket(name);
  }

  /// @return a 40 hex character content hash for a small number
  public static String sha(int n) {
    return String.format("%040x", n);
  }

  /// @return the raw dump id of document n
  public static String rawDocId(int n) {
    return "pdfs/" + sha(n) + "/paper.pdf";
  }

  /// @return the stored id of document n
  public static String docId(int n) {
    return sha(n) + "/paper.pdf";
  }

  public static JsonObject token(String text, String font, float left, float top, float fontSize) {
    JsonObject token = new JsonObject();
    token.addProperty("text", text);
    token.addProperty("font", font);
    token.addProperty("left", left);
    token.addProperty("right", left + 10.0f * text.length());
    token.addProperty("top", top);
    token.addProperty("bottom", top + fontSize);
    token.addProperty("fontSize", fontSize);
    token.addProperty("fontSpaceWidth", fontSize / 4.0f);
    return token;
  }

  public static JsonObject page(float width, float height, JsonObject... tokens) {
    JsonObject page = new JsonObject();
    page.addProperty("width", width);
    page.addProperty("height", height);
    JsonArray array = new JsonArray();
    for (JsonObject token : tokens) {
      array.add(token);
    }
    page.add("tokens", array);
    return page;
  }

  public static JsonObject document(String rawDocId, JsonObject... pages) {
    JsonObject document = new JsonObject();
    document.addProperty("docId", rawDocId);
    JsonArray array = new JsonArray();
    for (JsonObject page : pages) {
      array.add(page);
    }
    document.add("pages", array);
    return document;
  }

  /// tokens of a body text line, 10pt Times-Roman
  public static JsonObject[] line(float top, String... words) {
    JsonObject[] tokens = new JsonObject[words.length];
    float left = 50.0f;
    for (int i = 0; i < words.length; i++) {
      tokens[i] = token(words[i], "Times-Roman", left, top, 10.0f);
      left += 10.0f * words[i].length() + 5.0f;
    }
    return tokens;
  }

  /// a title page: title words at 20pt, author words at 12pt, then a body line
  public static JsonObject titlePage(String title, String authors) {
    List<JsonObject> tokens = new java.util.ArrayList<>();
    float left = 50.0f;
    for (String word : title.split(" ")) {
      tokens.add(token(word, "Times-Bold", left, 60.0f, 20.0f));
      left += 10.0f * word.length() + 5.0f;
    }
    left = 50.0f;
    for (String word : authors.split(" ")) {
      tokens.add(token(word, "Times-Italic", left, 100.0f, 12.0f));
      left += 10.0f * word.length() + 5.0f;
    }
    tokens.addAll(List.of(line(140.0f, "Abstract", "We", "study", "neural", "models")));
    return page(612.0f, 792.0f, tokens.toArray(new JsonObject[0]));
  }

  public static JsonObject bodyPage(String... words) {
    return page(612.0f, 792.0f, line(80.0f, words));
  }

  /// write the standard corpus
  /// @return this fixture
  public CorpusFixture writeStandardCorpus() throws IOException {
    writeStatistics();
    writeVectors();
    writeTokens(BUCKET, List.of(
        document(rawDocId(1),
            titlePage(TITLE, "John Smith"),
            bodyPage("Results", "show", "that", "deep", "networks", "work")),
        document(rawDocId(2), titlePage("Missing Metadata Paper", "Ann Lee")),
        document(rawDocId(3), titlePage("AI", "Bo Chen")),
        document(rawDocId(4), titlePage("Convex Optimization Methods", "Maria Garcia")),
        document(rawDocId(5), titlePage("Graph Neural Networks Today", "Wei Zhang"))
    ));
    writeNxml(BUCKET, docId(1), TITLE + ".", new String[][]{{"John", "Smith"}});
    writeNxml(BUCKET, docId(3), "AI", new String[][]{{"Bo", "Chen"}});
    writeNxml(BUCKET, docId(4), "Quantum Chromodynamics Revisited",
        new String[][]{{"Maria", "Garcia"}});
    writeNxml(BUCKET, docId(5), "Graph Neural Networks Today",
        new String[][]{{"Henrietta", "Featherstonehaugh"}});
    return this;
  }

  /// write the corpus statistics file
  public void writeStatistics() throws IOException {
    Map<String, Long> tokens = new LinkedHashMap<>();
    tokens.put("the", 500L);
    tokens.put("Deep", 40L);
    tokens.put("deep", 20L);
    tokens.put("learning", 50L);
    tokens.put("for", 300L);
    tokens.put("nlp", 12L);
    tokens.put("john", 15L);
    tokens.put("smith", 11L);
    tokens.put("abstract", 30L);
    tokens.put("rare", 2L);
    Map<Float, Long> fontSizes = new LinkedHashMap<>();
    fontSizes.put(10.0f, 500L);
    fontSizes.put(12.0f, 50L);
    fontSizes.put(20.0f, 5L);
    Map<Float, Long> spaceWidths = new LinkedHashMap<>();
    spaceWidths.put(2.5f, 500L);
    spaceWidths.put(3.0f, 50L);
    spaceWidths.put(5.0f, 5L);
    writeStatistics(new TokenStatisticsFile(tokens, Map.of("Times-Roman", 900L), fontSizes,
        spaceWidths));
  }

  public void writeStatistics(TokenStatisticsFile statistics) throws IOException {
    JsonObject json = new JsonObject();
    json.add("tokens", GSON.toJsonTree(statistics.tokens()));
    json.add("fonts", GSON.toJsonTree(statistics.fonts()));
    JsonObject fontSizes = new JsonObject();
    statistics.fontSizes().forEach((k, v) -> fontSizes.addProperty(k.toString(), v));
    json.add("font_sizes", fontSizes);
    JsonObject spaceWidths = new JsonObject();
    statistics.spaceWidths().forEach((k, v) -> spaceWidths.addProperty(k.toString(), v));
    json.add("space_widths", spaceWidths);
    writeGzip(root.resolve(TokenStatisticsFile.FILE_NAME), GSON.toJson(json));
  }

  public Path vectorsPath() {
    return root.resolve("vectors.3d.txt.gz");
  }

  /// write a three dimensional pretrained vector file
  public void writeVectors() throws IOException {
    writeGzip(vectorsPath(), String.join("\n",
        "the 0.1 0.2 0.3",
        "Deep 0.5 -0.5 1.0",
        "learning -1.0 0.0 0.5",
        "for 0.0 0.0 0.1",
        ""));
  }

  public void writeTokens(String bucket, List<JsonObject> documents) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (JsonObject document : documents) {
      sb.append(GSON.toJson(document)).append('\n');
    }
    writeTokenLines(bucket, sb.toString());
  }

  public void writeTokenLines(String bucket, String lines) throws IOException {
    Path path = bucket(bucket).tokensFile();
    Files.createDirectories(path.getParent());
    try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(path));
         Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
      writer.write(lines);
    }
  }

  /// @param authors
  ///     `{given names, surname}` pairs
  public void writeNxml(String bucket, String docId, String title, String[][] authors)
      throws IOException
  {
    StringBuilder contribs = new StringBuilder();
    for (String[] author : authors) {
      contribs.append("<contrib contrib-type=\"author\"><name><surname>")
          .append(author[1]).append("</surname><given-names>").append(author[0])
          .append("</given-names></name></contrib>");
    }
    writeRawNxml(bucket, docId, """
        <?xml version="1.0" encoding="UTF-8"?>
        <!DOCTYPE article PUBLIC "-//NLM//DTD Journal Archiving and Interchange DTD v3.0 20080202//EN" "archivearticle3.dtd">
        <article article-type="research-article">
          <front>
            <journal-meta><journal-title>Test Journal</journal-title></journal-meta>
            <article-meta>
              <title-group><article-title>%s</article-title></title-group>
              <contrib-group>%s</contrib-group>
            </article-meta>
          </front>
          <body><p>Body text.</p></body>
        </article>
        """.formatted(title, contribs));
  }

  public void writeRawNxml(String bucket, String docId, String xml) throws IOException {
    Path path = bucket(bucket).referenceMetadataFor(docId);
    Files.createDirectories(path.getParent());
    Files.writeString(path, xml, StandardCharsets.UTF_8);
  }

  public void writeVision(String bucket, String jsonLines) throws IOException {
    Path path = bucket(bucket).visionFile();
    Files.createDirectories(path.getParent());
    Files.writeString(path, jsonLines, StandardCharsets.UTF_8);
  }

  public static void writeGzip(Path path, String content) throws IOException {
    Files.createDirectories(path.toAbsolutePath().getParent());
    try (OutputStream out = new GzipCompressorOutputStream(Files.newOutputStream(path));
         Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
      writer.write(content);
    }
  }
}
