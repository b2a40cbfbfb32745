package io.nosqlbench.layoutprep.config;


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

import io.nosqlbench.layoutprep.artifacts.ArtifactKind;

import java.nio.file.Path;

/**
 * The inputs and cached artifacts of one bucket directory.
 *
 * <pre>{@code
 * tokens3.json.bz2
 * docs/<doc id>.nxml
 * vision_output.json                  (optional)
 * unlabeled-tokens-v3.h5
 * labeled-tokens-v12.h5
 * featurized-tokens-XXXXXXXX-v12.h5
 * }</pre>
 *
 * @param name the bucket name
 * @param directory the bucket directory
 */
public record BucketLayout(String name, Path directory) {

    public static final String TOKENS_FILE = "tokens3.json.bz2";
    public static final String DOCS_DIRECTORY = "docs";
    public static final String VISION_FILE = "vision_output.json";

    public Path tokensFile() {
        return directory.resolve(TOKENS_FILE);
    }

    public Path docsDirectory() {
        return directory.resolve(DOCS_DIRECTORY);
    }

    /**
     * @param docId a stored document id
     * @return the reference metadata file of the document, a trailing {@code .pdf} replaced
     *     by {@code .nxml}
     */
    public Path referenceMetadataFor(String docId) {
        String name = docId.endsWith(".pdf")
            ? docId.substring(0, docId.length() - ".pdf".length()) + ".nxml"
            : docId;
        return docsDirectory().resolve(name);
    }

    public Path visionFile() {
        return directory.resolve(VISION_FILE);
    }

    public Path unlabeledArtifact() {
        return directory.resolve(ArtifactKind.UNLABELED_TOKENS.fileName());
    }

    public Path labeledArtifact() {
        return directory.resolve(ArtifactKind.LABELED_TOKENS.fileName());
    }

    /**
     * @param configKey the featurization key
     * @return the featurized artifact for that key
     */
    public Path featurizedArtifact(String configKey) {
        return directory.resolve(ArtifactKind.FEATURIZED_TOKENS.fileName(configKey));
    }
}
