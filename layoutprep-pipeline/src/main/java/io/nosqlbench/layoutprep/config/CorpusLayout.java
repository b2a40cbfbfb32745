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

import io.nosqlbench.layoutprep.stats.TokenStatisticsFile;

import java.nio.file.Path;

/**
 * The root directory of a corpus: the statistics file plus one directory per bucket.
 *
 * <pre>{@code
 * <corpus>/all.tokenstats3.gz
 * <corpus>/00/ .. <corpus>/ff/
 * }</pre>
 *
 * @param root the corpus directory
 */
public record CorpusLayout(Path root) {

    /** number of bucket directories in a full corpus */
    public static final int BUCKET_COUNT = 256;

    public Path statisticsFile() {
        return root.resolve(TokenStatisticsFile.FILE_NAME);
    }

    /**
     * @param name a bucket directory name, like {@code 3f}
     * @return the layout of that bucket
     */
    public BucketLayout bucket(String name) {
        return new BucketLayout(name, root.resolve(name));
    }

    /**
     * @param number a bucket number in [0, 255]
     * @return the layout of that bucket
     */
    public BucketLayout bucket(int number) {
        return bucket(bucketName(number));
    }

    /**
     * @param number a bucket number in [0, 255]
     * @return its two hex digit directory name
     */
    public static String bucketName(int number) {
        if (number < 0 || number >= BUCKET_COUNT) {
            throw new IllegalArgumentException("bucket number must be in [0, 255], not " + number);
        }
        return String.format("%02x", number);
    }
}
