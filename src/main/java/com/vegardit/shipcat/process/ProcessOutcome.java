/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.process;

/**
 * Result of a supervised process invocation.
 *
 * @param exitCode the exit code of the process, {@link #UNKNOWN_EXIT_CODE} if the process never completed
 * @param started whether the process was started at all
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record ProcessOutcome(int exitCode, boolean started) {

   public static final int UNKNOWN_EXIT_CODE = -1;
   public static final int FAILURE_EXIT_CODE = 1;

   public static final ProcessOutcome NOT_STARTED = new ProcessOutcome(UNKNOWN_EXIT_CODE, false);

   public static ProcessOutcome failure(final boolean started) {
      return new ProcessOutcome(FAILURE_EXIT_CODE, started);
   }

   public static ProcessOutcome completed(final int exitCode) {
      return new ProcessOutcome(exitCode, true);
   }

   public boolean isSuccess() {
      return started && exitCode == 0;
   }
}
