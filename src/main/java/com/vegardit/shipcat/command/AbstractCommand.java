/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;

import com.vegardit.shipcat.command.AbstractCommand.VersionProvider;
import com.vegardit.shipcat.util.CancellationSignal;

import net.sf.jstuff.core.logging.Logger;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.reflection.Types;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command( //
   headerHeading = "" //
      + "          __    _                 __%n" //
      + "    _____/ /_  (_)___  _________ _/ /_%n" //
      + "   / ___/ __ \\/ / __ \\/ ___/ __ `/ __/%n" //
      + "  (__  ) / / / / /_/ / /__/ /_/ / /_%n" //
      + " /____/_/ /_/_/ .___/\\___/\\__,_/\\__/%n" //
      + "             /_/%n" //
      + "      https://github.com/vegardit/shipcat%n" //
      + "%n", //
   mixinStandardHelpOptions = true, //
   descriptionHeading = "%n", //
   commandListHeading = "%nCommands%n", //
   parameterListHeading = "%nPositional parameters:%n", //
   optionListHeading = "%nOptions:%n", //
   requiredOptionMarker = '*', //
   usageHelpAutoWidth = true, //
   separator = " ", //
   showDefaultValues = true, //
   sortOptions = true, //
   versionProvider = VersionProvider.class //
)
public abstract class AbstractCommand implements Callable<Integer> {
   public static final class VersionProvider implements IVersionProvider {
      @Override
      public String[] getVersion() throws Exception {
         return new String[] {Types.getVersion(AbstractCommand.class)};
      }
   }

   private static final Logger LOG = Logger.create();

   public static final int EXIT_CODE_SIGINT = 128 + 2;
   public static final int EXIT_CODE_SIGTERM = 128 + 15;

   @Spec
   protected CommandSpec commandSpec = lateNonNull();

   /**
    * logging options are not further evaluated, since it is already done in main entry point
    */
   @Mixin
   private LoggingOptionsMixin loggingOptions = lateNonNull();

   protected final CancellationSignal cancellation = new CancellationSignal();

   private volatile int signalExitCode;
   private int verbosity = 0;

   public boolean isQuiet() {
      return verbosity == -1;
   }

   public int getVerbosity() {
      return verbosity;
   }

   @Override
   public final Integer call() throws Exception {
      installSignalHandler("INT", EXIT_CODE_SIGINT, "SIGINT(2) signal (CTRL+C)");
      installSignalHandler("TERM", EXIT_CODE_SIGTERM, "SIGTERM(15) signal");

      final int exitCode;
      try {
         exitCode = execute();
      } catch (final CancellationException ex) {
         LOG.warn("The operation was cancelled.");
         return signalExitCode == 0 ? 1 : signalExitCode;
      }

      if (signalExitCode != 0) {
         LOG.warn("The operation was cancelled.");
         return signalExitCode;
      }
      if (exitCode == 0) {
         LOG.info("");
         LOG.info("The operation completed successfully.");
      }
      return exitCode;
   }

   /**
    * @return the exit code of the command
    */
   protected abstract int execute() throws Exception;

   /**
    * The first signal cancels the running operation, a second one terminates the JVM.
    */
   private void installSignalHandler(final String signalName, final int exitCode, final String label) {
      // Runtime.getRuntime().addShutdownHook() is not working reliable
      try {
         sun.misc.Signal.handle(new sun.misc.Signal(signalName), signal -> {
            if (cancellation.cancel(signalName)) {
               LOG.warn("Canceling operation due to %s received...", label);
               signalExitCode = exitCode;
            } else {
               LOG.warn("Terminating due to repeated %s...", label);
               System.exit(exitCode);
            }
         });
      } catch (final IllegalArgumentException ex) {
         // unknown signal on this platform, e.g. TERM on some Windows JVMs
         LOG.debug(ex);
      }
   }

   @Option(names = {"-q", "--quiet"}, description = "Quiet mode.")
   private void setQuiet(final boolean flag) {
      if (flag) {
         Levels.setRootLevel(Level.SEVERE);
         verbosity = -1;
      }
   }

   @Option(names = {"-v", "--verbose"}, description = {"Specify multiple -v options to increase verbosity.", "For example `-v -v -v` or `-vvv`."})
   private void setVerbosity(final boolean[] flags) {
      switch (flags.length) {
         case 0:
            Levels.setRootLevel(Level.INFO);
            break;
         case 1:
            Levels.setRootLevel(Level.FINE);
            break;
         case 2:
            Levels.setRootLevel(Level.FINER);
            break;
         default:
            Levels.setRootLevel(Level.FINEST);
      }
      verbosity = flags.length;
   }
}
