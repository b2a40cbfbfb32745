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

import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Prepare page layout token data for the title and author classifier
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "layoutprep",
    header = "Prepare page layout token data for the title and author classifier",
    description = "Contains subcommands to build the cached token artifacts of corpus buckets",
    subcommands = {
        CMD_warm.class,
        CommandLine.HelpCommand.class
    })
public class CMD_layoutprep implements Callable<Integer> {

    /// Create the CMD_layoutprep command
    public CMD_layoutprep() {}

    /// run a layoutprep command
    /// @param args command line args
    public static void main(String[] args) {
        CMD_layoutprep command = new CMD_layoutprep();
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
