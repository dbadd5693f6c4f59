/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.util;

import java.io.IOException;
import java.util.Date;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.TimeUnit;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiRenderer;

import net.sf.jstuff.core.exception.Exceptions;
import net.sf.jstuff.core.logging.LoggerConfig;
import net.sf.jstuff.core.logging.jul.DualPrintStreamHandler;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.logging.jul.Loggers;
import net.sf.jstuff.core.logging.jul.PrintStreamHandler;

/**
 * Console and log file setup for java.util.logging.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class JdkLoggingUtils {

   private static final Pattern ANSI_MARKUP = Pattern.compile("(@\\|[a-z,]+\\s)|(\\|@)");

   static {
      // flush console output regularly, e.g. while long running uploads or external tools produce no log records
      new Timer("shipcat-log-flusher", true).schedule(new TimerTask() {
         @Override
         public void run() {
            synchronized (JdkLoggingUtils.class) {
               final var handler = consoleHandler;
               if (handler != null) {
                  handler.flush();
               }
            }
         }
      }, TimeUnit.SECONDS.toMillis(2), TimeUnit.SECONDS.toMillis(2));
   }

   /**
    * Renders jansi markup like {@code @|magenta text|@} either as ANSI colors or strips it.
    */
   public static class ConsoleFormatter extends Formatter {

      private final boolean colored;

      public ConsoleFormatter(final boolean colored) {
         this.colored = colored;
      }

      protected String render(final String template, final Object... args) {
         return String.format(colored ? AnsiRenderer.render(template) : stripAnsiMarkup(template), args);
      }

      @Override
      public synchronized String format(final LogRecord entry) {
         final var rawMsg = entry.getMessage() == null ? "null" : entry.getMessage();
         final var msg = colored ? AnsiRenderer.render(rawMsg) : stripAnsiMarkup(rawMsg);
         final var time = new Date(entry.getMillis());
         final var thread = Thread.currentThread().getName();
         final var thrown = entry.getThrown();

         switch (entry.getLevel().intValue()) {
            case Levels.INFO_INT:
               return render("%1$tT @|green [%2$s]|@ %3$s%n", time, thread, msg);
            case Levels.WARNING_INT:
               return render("@|yellow %1$tT [%2$s] WARN: %3$s%n|@", time, thread, msg);
            case Levels.SEVERE_INT:
               return thrown == null //
                  ? render("@|red %1$tT [%2$s] ERROR: %3$s%n|@", time, thread, msg)
                  : render("@|red %1$tT [%2$s] ERROR: %3$s %4$s|@", time, thread, msg, Exceptions.getStackTrace(thrown));
            default:
               return String.format("%1$tT [%2$s] %3$-6s: %4$s%n", time, thread, entry.getLevel().getLocalizedName(), msg) //
                     + (thrown == null ? "" : Exceptions.getStackTrace(thrown));
         }
      }
   }

   /**
    * Used for log files.
    */
   public static final class PlainFormatter extends Formatter {
      @Override
      public synchronized String format(final LogRecord entry) {
         final var msg = entry.getMessage() == null ? "null" : stripAnsiMarkup(entry.getMessage());
         final var thrown = entry.getThrown();
         return String.format("%1$tF %1$tT [%2$s] %3$-6s: %4$s%n", //
            new Date(entry.getMillis()), Thread.currentThread().getName(), entry.getLevel().getLocalizedName(), msg) //
               + (thrown == null ? "" : Exceptions.getStackTrace(thrown));
      }
   }

   private static @Nullable Handler consoleHandler;

   public static FileHandler addFileHandler(final String fileNamePattern) throws IOException {
      synchronized (Loggers.ROOT_LOGGER) {
         final var handler = new FileHandler(fileNamePattern, 0, 1, true);
         handler.setFormatter(new PlainFormatter());
         Loggers.ROOT_LOGGER.addHandler(handler);
         return handler;
      }
   }

   /**
    * Replaces all console handlers of the root logger. Warnings and errors go to stderr if {@code useStdErr} is set.
    */
   public static void configureConsoleHandler(final boolean useStdErr, final Formatter formatter) {
      synchronized (Loggers.ROOT_LOGGER) {
         LoggerConfig.setCompactExceptionLogging(false);
         Loggers.ROOT_LOGGER.setUseParentHandlers(false);
         for (final Handler handler : Loggers.ROOT_LOGGER.getHandlers()) {
            if (!(handler instanceof FileHandler)) {
               Loggers.ROOT_LOGGER.removeHandler(handler);
            }
         }
         final Handler handler = useStdErr //
               ? new DualPrintStreamHandler(System.out, System.err, formatter)
               : new PrintStreamHandler(System.out, formatter);
         synchronized (JdkLoggingUtils.class) {
            consoleHandler = handler;
         }
         Loggers.ROOT_LOGGER.addHandler(handler);
      }
   }

   public static String stripAnsiMarkup(final String text) {
      return ANSI_MARKUP.matcher(text).replaceAll("");
   }

   /**
    * Executes the given code block with the root logger set to at least the required granularity, e.g. to print a report in quiet
    * mode.
    */
   public static void withRootLogLevel(final Level requiredLevel, final Runnable code) {
      synchronized (Loggers.ROOT_LOGGER) {
         final var currentLevel = Levels.getRootLevel();
         if (currentLevel.intValue() <= requiredLevel.intValue()) {
            code.run();
            return;
         }
         Levels.setRootLevel(requiredLevel);
         try {
            code.run();
         } finally {
            Levels.setRootLevel(currentLevel);
         }
      }
   }

   private JdkLoggingUtils() {
   }
}
