/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.*;

import java.io.IOException;
import java.util.List;
import java.util.logging.FileHandler;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiRenderer;

import com.vegardit.shipcat.command.AbstractCommand;
import com.vegardit.shipcat.command.LoggingOptionsMixin;
import com.vegardit.shipcat.command.exec.ExecCommand;
import com.vegardit.shipcat.command.publish.PublishCommand;
import com.vegardit.shipcat.util.JdkLoggingUtils;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.io.StringPrintWriter;
import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.RunLast;
import picocli.CommandLine.Unmatched;
import picocli.CommandLine.UnmatchedArgumentException;
import picocli.jansi.graalvm.AnsiConsole;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "shipcat", //
   description = "Publishes prepared applications to deployment targets and supervises deployment tools.", //
   synopsisSubcommandLabel = "COMMAND", //
   subcommands = { //
      PublishCommand.class, //
      ExecCommand.class //
   } //
)
public class ShipCatMain extends AbstractCommand {

   public static class LoggingOptions extends LoggingOptionsMixin {
      @Unmatched
      List<String> ignored = lateNonNull();
   }

   private static final Logger LOG = Logger.create();

   private static @Nullable FileHandler configureLogging(final String[] args) throws IOException {
      final var loggingOptions = new LoggingOptions();
      CommandLine.populateCommand(loggingOptions, args);
      JdkLoggingUtils.configureConsoleHandler(!loggingOptions.logErrorsToStdOut, new JdkLoggingUtils.ConsoleFormatter(
         !loggingOptions.noColor));

      final var logFile = loggingOptions.logFile;
      if (logFile == null)
         return null;
      return JdkLoggingUtils.addFileHandler(logFile.toAbsolutePath().toString());
   }

   public static void main(final String[] args) throws Exception {
      Thread.currentThread().setName("main");

      // evaluate the logging options before any other component starts logging, see https://github.com/remkop/picocli/issues/1295
      final var fileHandler = configureLogging(args);

      AnsiConsole.systemInstall();

      final int exitCode = newCommandLine().execute(args);
      if (fileHandler != null) {
         fileHandler.close();
      }
      System.exit(exitCode);
   }

   /**
    * Creates the command line handler with the exception handlers logging through the application logger.
    */
   public static CommandLine newCommandLine() {
      final var handler = new CommandLine(new ShipCatMain());
      handler.setCaseInsensitiveEnumValuesAllowed(true);
      handler.setExecutionStrategy(new RunLast());
      // everything after the executable is passed to the tool, e.g. "shipcat exec sh -c 'echo hi'"
      handler.getSubcommands().get("exec").setStopAtPositional(true);
      handler.setHelpFactory((commandSpec, colorScheme) -> new Help(commandSpec, colorScheme) {

         @Nullable
         @Override
         public String headerHeading(final Object @Nullable... params) {
            return AnsiRenderer.render(super.headerHeading(params));
         }
      });

      handler.setParameterExceptionHandler((ex, args) -> {
         if (args.length == 0) {
            CommandLine.usage(handler, System.err);
            System.err.println();
            LOG.error(ex.getMessage());
         } else {
            LOG.error(ex.getMessage());
            try (var sw = new StringPrintWriter()) {
               UnmatchedArgumentException.printSuggestions(ex, sw);
               final var suggestions = sw.toString();
               if (Strings.isNotBlank(suggestions)) {
                  LOG.info(Strings.trim(suggestions));
               }
            }
            LOG.info("Execute 'shipcat --help' for usage help.");
         }
         return 1;
      });
      handler.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
         ex = asNonNullUnsafe(ex);
         if (LOG.isDebugEnabled() || ex instanceof UnsupportedOperationException || ex instanceof NullPointerException) {
            LOG.error(ex); // log with stacktrace
         } else {
            LOG.error(ex.getClass().getSimpleName() + ": " + ex.getMessage());
         }
         return 1;
      });
      return handler;
   }

   @Override
   protected int execute() throws Exception {
      throw new ParameterException(commandSpec.commandLine(), "Missing required subcommand.");
   }
}
