/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.io.Processes;
import net.sf.jstuff.core.logging.Logger;

/**
 * Forcibly terminates a process tree by process id using the platform's kill utility ({@code taskkill} on Windows, {@code kill}
 * elsewhere). Falls back to {@link ProcessHandle#destroyForcibly()} if no utility is available or it fails.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ProcessKiller {

   private static final Logger LOG = Logger.create();

   private static final Duration KILL_COMMAND_TIMEOUT = Duration.ofSeconds(10);

   private static @Nullable Path detectKillExecutable() {
      final var path = SystemUtils.findExecutable(SystemUtils.IS_OS_WINDOWS ? "taskkill.exe" : "kill", false);
      if (path != null && Files.exists(path))
         return path;
      return null;
   }

   private final @Nullable Path killExecutable;

   public ProcessKiller() {
      this(detectKillExecutable());
   }

   protected ProcessKiller(final @Nullable Path killExecutable) {
      this.killExecutable = killExecutable;
   }

   /**
    * @return true if the kill request was issued successfully, which does not guarantee that the process has already exited
    */
   public boolean kill(final ProcessHandle process) {
      if (!process.isAlive())
         return true;

      final long pid = process.pid();
      final var executable = killExecutable;
      if (executable != null) {
         LOG.debug("Killing process %s using [@|magenta %s|@]...", pid, executable);
         try {
            final var builder = Processes.builder(executable) //
               .withRedirectOutput(line -> LOG.debug("[kill] %s", line)) //
               .withRedirectError(line -> LOG.debug("[kill] %s", line));
            if (SystemUtils.IS_OS_WINDOWS) {
               builder.withArgs("/F", "/T", "/PID", Long.toString(pid));
            } else {
               builder.withArgs("-9", Long.toString(pid));
            }
            final var proc = builder.start();
            final int exitCode = proc.onExit().get(KILL_COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS).exitStatus();
            if (exitCode == 0)
               return true;
            LOG.warn("Killing process %s using [%s] failed with exit code %s.", pid, executable.getFileName(), exitCode);
         } catch (final IOException | ExecutionException | TimeoutException ex) {
            LOG.warn("Killing process %s using [%s] failed: %s", pid, executable.getFileName(), ex.getMessage());
            LOG.debug(ex);
         } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.debug(ex);
         }
      }

      LOG.debug("Destroying process %s forcibly...", pid);
      process.descendants().forEach(ProcessHandle::destroyForcibly);
      return process.destroyForcibly() || !process.isAlive();
   }
}
