/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command.exec;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.command.AbstractCommand;
import com.vegardit.shipcat.process.ProcessOutcome;
import com.vegardit.shipcat.process.ProcessSupervisor;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "exec", //
   description = "Runs an external deployment tool, streaming its output and killing it on cancellation or timeout." //
)
public class ExecCommand extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   @Parameters(index = "0", paramLabel = "EXECUTABLE", description = "Path or name of the tool to run.")
   private String executable = lateNonNull();

   @Parameters(index = "1..*", arity = "0..*", paramLabel = "ARG", description = "Arguments passed to the tool.")
   private List<String> args = new ArrayList<>();

   @Option(names = "--env", paramLabel = "<key=value>", description = "Additional environment variable for the tool.")
   private Map<String, String> env = new LinkedHashMap<>();

   @Option(names = "--inherit-io", description = "Pass the tool's output directly to the console instead of logging it.")
   private boolean inheritIO;

   @Option(names = "--poll-interval", paramLabel = "<duration>", description = "ISO-8601 interval for checking completion. Default: PT0.05S")
   private Duration pollInterval = ProcessSupervisor.Options.DEFAULT_POLL_INTERVAL;

   @Option(names = "--timeout", paramLabel = "<duration>", description = "ISO-8601 duration after which the tool is killed, e.g. PT10M.")
   private @Nullable Duration timeout;

   @Option(names = "--working-dir", paramLabel = "<path>", description = "Working directory of the tool.")
   private @Nullable Path workingDir;

   private @Nullable ProcessOutcome outcome;

   public @Nullable ProcessOutcome getOutcome() {
      return outcome;
   }

   @Override
   protected int execute() throws Exception {
      final var options = new ProcessSupervisor.Options();
      options.pollInterval = pollInterval;
      options.timeout = timeout;
      options.workingDirectory = workingDir;

      final ProcessOutcome outcome;
      try {
         final var supervisor = new ProcessSupervisor(options);
         outcome = inheritIO //
               ? supervisor.execute(executable, args, env, null, null, cancellation)
               : supervisor.execute(executable, args, env, //
                  line -> LOG.info("@|faint [out]|@ %s", line), //
                  line -> LOG.warn("[err] %s", line), //
                  cancellation);
      } catch (final IllegalArgumentException ex) {
         throw new ParameterException(commandSpec.commandLine(), ex.getMessage(), ex);
      }
      this.outcome = outcome;

      if (outcome.isSuccess())
         return 0;
      if (!outcome.started()) {
         LOG.error("Tool [" + executable + "] could not be started.");
         return 1;
      }
      LOG.error("Tool [" + executable + "] failed with exit code " + outcome.exitCode() + ".");
      return outcome.exitCode() > 0 ? outcome.exitCode() : 1;
   }
}
