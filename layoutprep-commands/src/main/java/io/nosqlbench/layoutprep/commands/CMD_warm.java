package io.nosqlbench.layoutprep.commands;


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

import io.nosqlbench.layoutprep.config.CorpusLayout;
import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.pipeline.DataPrepPipeline;
import io.nosqlbench.layoutprep.pipeline.WarmSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/// Build the unlabeled, labeled and featurized artifacts of one or more buckets
///
/// Artifacts which already exist are reused, so running the command twice does no work the
/// second time. Each bucket is warmed on its own; a failing bucket is reported and the
/// remaining buckets are still warmed.
@CommandLine.Command(name = "warm",
    description = "Build the cached artifacts of the given buckets and print one summary line per bucket")
public class CMD_warm implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_warm.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_BUCKET_FAILED = 1;

    private static final Pattern BUCKET_NAME = Pattern.compile("[0-9a-f]{2}");

    @CommandLine.Option(names = {"-d", "--corpus-dir"},
        description = "The corpus directory holding the statistics file and bucket directories (default: ${DEFAULT-VALUE})",
        defaultValue = ".")
    private Path corpusDir;

    @CommandLine.Option(names = {"--pretrained-vectors"},
        description = "The pretrained vector file (default: pretrained_vectors of the settings)")
    private Path pretrainedVectors;

    @CommandLine.Option(names = {"-s", "--settings"},
        description = "A JSON model settings file")
    private Path settingsFile;

    @CommandLine.Option(names = {"--max-page-number"},
        description = "Override max_page_number of the settings")
    private Integer maxPageNumber;

    @CommandLine.Option(names = {"--font-hash-size"},
        description = "Override font_hash_size of the settings")
    private Integer fontHashSize;

    @CommandLine.Option(names = {"--minimum-token-frequency"},
        description = "Override minimum_token_frequency of the settings")
    private Integer minimumTokenFrequency;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "BUCKET",
        description = "Bucket directory names, two lowercase hex digits each")
    private List<String> buckets;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Reads the settings file, if any, and applies the option overrides.
     *
     * @return the effective settings
     */
    ModelSettings effectiveSettings() {
        ModelSettings settings = new ModelSettings();
        if (settingsFile != null) {
            try {
                settings = ModelSettings.loadFromFile(settingsFile);
            } catch (IOException | IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Error: unable to read settings " + settingsFile + ": " + e.getMessage(), e);
            }
        }
        if (maxPageNumber != null) {
            settings.setMaxPageNumber(maxPageNumber);
        }
        if (fontHashSize != null) {
            settings.setFontHashSize(fontHashSize);
        }
        if (minimumTokenFrequency != null) {
            settings.setMinimumTokenFrequency(minimumTokenFrequency);
        }
        if (pretrainedVectors != null) {
            settings.setPretrainedVectors(pretrainedVectors.toString());
        }
        try {
            return settings.validate();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
    }

    private void validateArguments() {
        if (!Files.isDirectory(corpusDir)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: corpus directory " + corpusDir + " does not exist");
        }
        for (String bucket : buckets) {
            if (!BUCKET_NAME.matcher(bucket).matches()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Error: '" + bucket + "' is not a bucket name like 0a or f3");
            }
        }
    }

    @Override
    public Integer call() {
        validateArguments();
        ModelSettings settings = effectiveSettings();
        logger.info("warming {} buckets of {} with {}", buckets.size(), corpusDir, settings);

        DataPrepPipeline pipeline = new DataPrepPipeline(new CorpusLayout(corpusDir), settings);

        int failed = 0;
        for (String bucket : buckets) {
            try {
                WarmSummary summary = pipeline.warm(bucket);
                System.out.println(summary.summaryLine());
            } catch (RuntimeException e) {
                failed++;
                logger.error("unable to warm bucket {}", bucket, e);
                System.err.println(bucket + ": failed: " + e.getMessage());
            }
        }
        if (failed > 0) {
            logger.warn("{} of {} buckets failed", failed, buckets.size());
            return EXIT_BUCKET_FAILED;
        }
        return EXIT_SUCCESS;
    }
}
