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

import io.nosqlbench.layoutprep.schema.GoldAuthor;
import io.nosqlbench.layoutprep.text.GoldTextTokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Gold title and authors of a document, read from its JATS (NXML) reference metadata.
///
/// The title is the single `front/article-meta/title-group/article-title` below the root
/// element. Authors are the `name` elements of every
/// `front/article-meta/contrib-group/contrib` with `contrib-type="author"`. All gold text is
/// tokenized the way the token dump is, so the fuzzy matcher compares like with like.
/// @param goldTitle
///     tokenized title with leading and trailing periods removed
/// @param authors
///     tokenized authors in document order
public record ReferenceMetadata(String goldTitle, List<GoldAuthor> authors) {
  private final static Logger logger = LogManager.getLogger(ReferenceMetadata.class);

  /// titles of at most this many characters are not trusted
  public static final int MINIMUM_TITLE_LENGTH = 5;

  /// @param path
  ///     the NXML file
  /// @param docId
  ///     the document it belongs to, for messages
  /// @return the metadata
  /// @throws DocumentRejectedException
  ///     if the file is missing or unreadable, or the metadata fails one of the checks
  /// @throws IOException
  ///     for any other read failure
  public static ReferenceMetadata read(Path path, String docId)
      throws DocumentRejectedException, IOException
  {
    String xml;
    try {
      xml = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(Files.readAllBytes(path)))
          .toString();
    } catch (NoSuchFileException e) {
      throw new DocumentRejectedException(
          RejectionReason.MISSING_METADATA, "Could not find " + path + "; skipping doc");
    } catch (CharacterCodingException e) {
      throw new DocumentRejectedException(
          RejectionReason.UNDECODABLE_METADATA, "Could not decode " + path + "; skipping doc");
    }
    return parse(xml, docId);
  }

  /// @param xml
  ///     NXML text
  /// @param docId
  ///     the document it belongs to, for messages
  /// @return the metadata
  /// @throws DocumentRejectedException
  ///     if the metadata fails one of the checks
  public static ReferenceMetadata parse(String xml, String docId)
      throws DocumentRejectedException
  {
    Document document = Jsoup.parse(xml, "", Parser.xmlParser());
    Element root = document.children().first();
    List<Element> articleMeta =
        root == null ? List.of() : childPath(List.of(root), "front", "article-meta");

    List<Element> titles = childPath(articleMeta, "title-group", "article-title");
    if (titles.size() != 1) {
      throw new DocumentRejectedException(
          RejectionReason.TITLE_COUNT,
          "Found " + titles.size() + " gold titles for " + docId + "; skipping doc");
    }
    String title =
        GoldTextTokenizer.trimPunctuation(GoldTextTokenizer.tokenizeAndJoin(titles.get(0).wholeText()));
    if (title.length() < MINIMUM_TITLE_LENGTH) {
      throw new DocumentRejectedException(
          RejectionReason.SHORT_TITLE, "Title '" + title + "' is too short; skipping doc");
    }

    List<Element> contributors = childPath(articleMeta, "contrib-group", "contrib").stream()
        .filter(contrib -> "author".equals(contrib.attr("contrib-type")))
        .collect(Collectors.toList());
    List<Element> names = childPath(contributors, "name");
    List<GoldAuthor> authors = new ArrayList<>(names.size());
    for (Element name : names) {
      String givenNames = tokenizedText(childPath(List.of(name), "given-names"));
      String surnames = tokenizedText(childPath(List.of(name), "surname"));
      if (surnames.isEmpty()) {
        logger.warn("No surnames for one of the authors of {}; skipping author", docId);
        continue;
      }
      authors.add(new GoldAuthor(givenNames, surnames));
    }
    if (authors.isEmpty()) {
      throw new DocumentRejectedException(
          RejectionReason.NO_AUTHORS, "Found no gold authors for " + docId + "; skipping doc");
    }
    if (authors.size() != names.size()) {
      throw new DocumentRejectedException(
          RejectionReason.AUTHOR_COUNT_MISMATCH,
          "Didn't find the expected " + names.size() + " authors in " + docId + "; skipping doc");
    }
    return new ReferenceMetadata(title, List.copyOf(authors));
  }

  private static String tokenizedText(List<Element> elements) {
    String joined = elements.stream().map(Element::wholeText).collect(Collectors.joining(" "));
    return GoldTextTokenizer.tokenizeAndJoin(joined);
  }

  private static List<Element> childPath(List<Element> from, String... tags) {
    List<Element> current = from;
    for (String tag : tags) {
      List<Element> next = new ArrayList<>();
      for (Element element : current) {
        for (Element child : element.children()) {
          if (child.tagName().equals(tag)) {
            next.add(child);
          }
        }
      }
      current = next;
    }
    return current;
  }
}
