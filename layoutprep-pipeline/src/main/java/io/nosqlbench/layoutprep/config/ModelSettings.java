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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable settings shared by the classifier and the featurization stage.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "max_page_number": 3,
 *   "font_hash_size": 1024,
 *   "minimum_token_frequency": 10,
 *   "pretrained_vectors": "glove.6B.100d.txt.gz"
 * }
 * }</pre>
 *
 * <p>Every field is optional; absent fields take the defaults shown above. The
 * {@code max_page_number} value belongs to the classifier but is part of the featurization
 * cache key, so changing it produces a fresh featurized artifact.
 */
public class ModelSettings {

    public static final int DEFAULT_MAX_PAGE_NUMBER = 3;
    public static final int DEFAULT_FONT_HASH_SIZE = 1024;
    public static final int DEFAULT_MINIMUM_TOKEN_FREQUENCY = 10;
    public static final String DEFAULT_PRETRAINED_VECTORS = "glove.6B.100d.txt.gz";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("max_page_number")
    private Integer maxPageNumber;

    @SerializedName("font_hash_size")
    private Integer fontHashSize;

    @SerializedName("minimum_token_frequency")
    private Integer minimumTokenFrequency;

    /** Path or file name of the pretrained vector file */
    @SerializedName("pretrained_vectors")
    private String pretrainedVectors;

    public ModelSettings() {
    }

    public int getMaxPageNumber() {
        return maxPageNumber != null ? maxPageNumber : DEFAULT_MAX_PAGE_NUMBER;
    }

    public void setMaxPageNumber(Integer maxPageNumber) {
        this.maxPageNumber = maxPageNumber;
    }

    public int getFontHashSize() {
        return fontHashSize != null ? fontHashSize : DEFAULT_FONT_HASH_SIZE;
    }

    public void setFontHashSize(Integer fontHashSize) {
        this.fontHashSize = fontHashSize;
    }

    public int getMinimumTokenFrequency() {
        return minimumTokenFrequency != null ? minimumTokenFrequency : DEFAULT_MINIMUM_TOKEN_FREQUENCY;
    }

    public void setMinimumTokenFrequency(Integer minimumTokenFrequency) {
        this.minimumTokenFrequency = minimumTokenFrequency;
    }

    public String getPretrainedVectors() {
        return pretrainedVectors != null ? pretrainedVectors : DEFAULT_PRETRAINED_VECTORS;
    }

    public void setPretrainedVectors(String pretrainedVectors) {
        this.pretrainedVectors = pretrainedVectors;
    }

    /**
     * Checks that every numeric setting is usable.
     *
     * @return this settings object
     * @throws IllegalArgumentException if a value is out of range
     */
    public ModelSettings validate() {
        if (getMaxPageNumber() < 1) {
            throw new IllegalArgumentException("max_page_number must be at least 1, not " + getMaxPageNumber());
        }
        if (getFontHashSize() < 1) {
            throw new IllegalArgumentException("font_hash_size must be at least 1, not " + getFontHashSize());
        }
        if (getMinimumTokenFrequency() < 1) {
            throw new IllegalArgumentException(
                "minimum_token_frequency must be at least 1, not " + getMinimumTokenFrequency());
        }
        return this;
    }

    /**
     * Parses settings from JSON.
     *
     * @param json the JSON string
     * @return the parsed settings
     * @throws IllegalArgumentException if the text is not a settings object
     */
    public static ModelSettings fromJson(String json) {
        try {
            ModelSettings settings = GSON.fromJson(json, ModelSettings.class);
            return settings != null ? settings : new ModelSettings();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid model settings: " + e.getMessage(), e);
        }
    }

    /**
     * Parses settings from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the parsed settings
     * @throws IllegalArgumentException if the text is not a settings object
     */
    public static ModelSettings fromJson(Reader reader) {
        try {
            ModelSettings settings = GSON.fromJson(reader, ModelSettings.class);
            return settings != null ? settings : new ModelSettings();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid model settings: " + e.getMessage(), e);
        }
    }

    /**
     * Loads settings from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the loaded settings
     * @throws IOException if the file cannot be read
     */
    public static ModelSettings loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Serializes these settings, with defaults filled in, to JSON.
     *
     * @return the JSON string
     */
    public String toJson() {
        ModelSettings resolved = new ModelSettings();
        resolved.setMaxPageNumber(getMaxPageNumber());
        resolved.setFontHashSize(getFontHashSize());
        resolved.setMinimumTokenFrequency(getMinimumTokenFrequency());
        resolved.setPretrainedVectors(getPretrainedVectors());
        return GSON.toJson(resolved);
    }

    @Override
    public String toString() {
        return "ModelSettings{max_page_number=" + getMaxPageNumber()
            + ", font_hash_size=" + getFontHashSize()
            + ", minimum_token_frequency=" + getMinimumTokenFrequency()
            + ", pretrained_vectors=" + getPretrainedVectors() + "}";
    }
}
