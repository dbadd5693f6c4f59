/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.process;

/**
 * Lifecycle of a supervised process invocation.
 *
 * <pre>
 * NOT_STARTED -> RUNNING -> COMPLETED
 *                        -> KILL_REQUESTED -> KILLED
 *             -> FAULTED
 * </pre>
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public enum ProcessState {
   NOT_STARTED,
   RUNNING,
   COMPLETED,
   KILL_REQUESTED,
   KILLED,
   FAULTED;

   public boolean isTerminal() {
      return this == COMPLETED || this == KILLED || this == FAULTED;
   }
}
