/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.util.CancellationSignal;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.io.Processes;
import net.sf.jstuff.core.io.Processes.ProcessWrapper;
import net.sf.jstuff.core.logging.Logger;

/**
 * Runs an external tool as a managed subprocess.
 * <p>
 * Standard output and error are either streamed line by line to the given callbacks or inherited from the current process. Completion
 * is awaited with a bounded polling interval during which the {@link CancellationSignal} is checked. A cancelled or timed out process
 * is killed forcibly and always reported as failure.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ProcessSupervisor {

   private static final Logger LOG = Logger.create();

   public static class Options {
      public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
      public static final Duration DEFAULT_KILL_WAIT_TIMEOUT = Duration.ofSeconds(10);

      /** how often completion and cancellation are checked */
      public Duration pollInterval = DEFAULT_POLL_INTERVAL;

      /** the process is killed if it does not complete within this duration */
      public @Nullable Duration timeout;

      /** how long to wait for the process to disappear after a kill request */
      public Duration killWaitTimeout = DEFAULT_KILL_WAIT_TIMEOUT;

      /** working directory of the process, defaults to the current directory */
      public @Nullable Path workingDirectory;

      public void validate() {
         if (pollInterval.isZero() || pollInterval.isNegative())
            throw new IllegalArgumentException("Poll interval must be positive.");
         final var t = timeout;
         if (t != null && t.isNegative())
            throw new IllegalArgumentException("Timeout must not be negative.");
         if (killWaitTimeout.isNegative())
            throw new IllegalArgumentException("Kill wait timeout must not be negative.");
      }
   }

   private final Options options;
   private final ProcessKiller killer;
   private volatile ProcessState state = ProcessState.NOT_STARTED;

   public ProcessSupervisor() {
      this(new Options());
   }

   public ProcessSupervisor(final Options options) {
      this(options, new ProcessKiller());
   }

   public ProcessSupervisor(final Options options, final ProcessKiller killer) {
      options.validate();
      this.options = options;
      this.killer = killer;
   }

   /**
    * @param onStdout if non-null standard output is redirected and each line is passed to this callback, otherwise it is inherited
    * @param onStderr if non-null standard error is redirected and each line is passed to this callback, otherwise it is inherited
    * @return the outcome, never a success if the process was cancelled, timed out or could not be started
    * @throws IllegalArgumentException if {@code executable} is blank or does not exist
    */
   public synchronized ProcessOutcome execute(final String executable, final List<String> args, final Map<String, String> env,
         final @Nullable Consumer<String> onStdout, final @Nullable Consumer<String> onStderr, final CancellationSignal cancellation) {
      final var exePath = resolveExecutable(executable);
      state = ProcessState.NOT_STARTED;

      final var commandLine = args.isEmpty() ? exePath.toString() : exePath + " " + String.join(" ", args);

      if (cancellation.isCancelled()) {
         LOG.warn("Not starting [%s] as the operation was already cancelled.", commandLine);
         return ProcessOutcome.NOT_STARTED;
      }

      final var builder = Processes.builder(exePath) //
         .withArgs(args) //
         .withEnvironment(vars -> vars.putAll(env));
      final var workDir = options.workingDirectory;
      if (workDir != null) {
         builder.withWorkingDirectory(workDir);
      }
      if (onStdout == null) {
         builder.withRedirectOutput(System.out);
      } else {
         builder.withRedirectOutput(line -> deliver(line, onStdout, commandLine));
      }
      if (onStderr == null) {
         builder.withRedirectError(System.err);
      } else {
         builder.withRedirectError(line -> deliver(line, onStderr, commandLine));
      }

      final ProcessWrapper proc;
      try {
         LOG.info("Starting [@|magenta %s|@]...", commandLine);
         proc = builder.start();
      } catch (final IOException | RuntimeException ex) {
         state = ProcessState.FAULTED;
         LOG.error("Failed to start [" + commandLine + "]: " + ex.getMessage(), ex);
         return ProcessOutcome.NOT_STARTED;
      }
      state = ProcessState.RUNNING;
      final long pid = proc.getProcess().pid();
      LOG.debug("Process %s started.", pid);

      final ProcessOutcome outcome = awaitCompletion(proc, pid, commandLine, cancellation);

      // liveness double check in case a kill did not take full effect
      if (proc.isAlive()) {
         state = ProcessState.FAULTED;
         LOG.error("Process " + pid + " [" + commandLine + "] is still running.");
         return ProcessOutcome.failure(true);
      }
      return outcome;
   }

   public ProcessOutcome execute(final String executable, final List<String> args, final CancellationSignal cancellation) {
      return execute(executable, args, Map.of(), null, null, cancellation);
   }

   private ProcessOutcome awaitCompletion(final ProcessWrapper proc, final long pid, final String commandLine,
         final CancellationSignal cancellation) {
      final var exitFuture = proc.onExit();
      final var timeout = options.timeout;
      final long deadline = timeout == null || timeout.isZero() ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
      final long pollMillis = Math.max(1, options.pollInterval.toMillis());

      while (true) {
         try {
            final int exitCode = exitFuture.get(pollMillis, TimeUnit.MILLISECONDS).exitStatus();
            state = ProcessState.COMPLETED;
            if (exitCode == 0) {
               LOG.info("Process [@|magenta %s|@] completed successfully.", commandLine);
            } else {
               LOG.warn("Process [%s] exited with code %s.", commandLine, exitCode);
            }
            return ProcessOutcome.completed(exitCode);
         } catch (final TimeoutException ex) {
            if (cancellation.isCancelled()) {
               LOG.warn("Cancellation requested, killing process %s [%s]...", pid, commandLine);
               return kill(proc, pid);
            }
            if (System.nanoTime() - deadline >= 0) {
               LOG.warn("Process %s [%s] did not complete within %s, killing it...", pid, commandLine, timeout);
               return kill(proc, pid);
            }
         } catch (final InterruptedException ex) {
            LOG.warn("Interrupted while waiting for process %s [%s], killing it...", pid, commandLine);
            final var outcome = kill(proc, pid);
            Thread.currentThread().interrupt();
            return outcome;
         } catch (final ExecutionException ex) {
            state = ProcessState.FAULTED;
            LOG.error("Waiting for process [" + commandLine + "] failed.", ex);
            return ProcessOutcome.failure(true);
         }
      }
   }

   private void deliver(final String line, final Consumer<String> onLine, final String commandLine) {
      try {
         onLine.accept(line);
      } catch (final RuntimeException ex) {
         LOG.warn("Output callback of [%s] failed: %s", commandLine, ex.getMessage());
         LOG.debug(ex);
      }
   }

   public ProcessState getState() {
      return state;
   }

   private ProcessOutcome kill(final ProcessWrapper proc, final long pid) {
      state = ProcessState.KILL_REQUESTED;
      killer.kill(proc.getProcess().toHandle());
      try {
         proc.onExit().get(options.killWaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
         state = ProcessState.KILLED;
         LOG.info("Process %s was killed.", pid);
      } catch (final InterruptedException ex) {
         state = ProcessState.FAULTED;
         Thread.currentThread().interrupt();
      } catch (final ExecutionException | TimeoutException ex) {
         state = ProcessState.FAULTED;
         LOG.error("Process " + pid + " did not terminate after kill request.", ex);
      }
      return ProcessOutcome.failure(true);
   }

   private Path resolveExecutable(final String executable) {
      if (Strings.isBlank(executable))
         throw new IllegalArgumentException("[executable] must not be blank.");

      final var path = Path.of(executable.strip());
      if (path.getParent() != null || path.isAbsolute()) {
         if (!Files.isRegularFile(path))
            throw new IllegalArgumentException("Executable [" + path + "] does not exist.");
         return path;
      }
      if (Files.isRegularFile(path))
         return path.toAbsolutePath();
      final var found = SystemUtils.findExecutable(path.toString(), false);
      if (found == null || !Files.isRegularFile(found))
         throw new IllegalArgumentException("Executable [" + path + "] does not exist.");
      return found;
   }
}
