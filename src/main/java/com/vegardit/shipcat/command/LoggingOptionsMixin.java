/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command;

import java.nio.file.Path;

import org.eclipse.jdt.annotation.Nullable;

import picocli.CommandLine.Option;

/**
 * Logging options shared by all commands. They are evaluated by the main entry point before the command line is parsed.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class LoggingOptionsMixin {

   @Option(names = "--log-file", paramLabel = "<path>", description = "Write console output also to the given log file.")
   public @Nullable Path logFile;

   @Option(names = "--log-errors-to-stdout", description = "Log errors to stdout instead of stderr.")
   public boolean logErrorsToStdOut;

   @Option(names = "--no-color", description = "Disable colored console output.")
   public boolean noColor;
}
