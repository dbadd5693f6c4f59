/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Thread-safe one-shot cancellation flag shared between an operation and the party that may abort it.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class CancellationSignal {

   /**
    * A signal that can never be cancelled.
    */
   public static final CancellationSignal NONE = new CancellationSignal() {
      @Override
      public boolean cancel(final @Nullable String reason) {
         throw new UnsupportedOperationException("CancellationSignal.NONE cannot be cancelled.");
      }
   };

   private final AtomicBoolean cancelled = new AtomicBoolean();
   private volatile @Nullable String reason;

   public boolean cancel() {
      return cancel(null);
   }

   /**
    * @return true if this call cancelled the signal, false if it was already cancelled
    */
   public boolean cancel(final @Nullable String reason) {
      if (cancelled.compareAndSet(false, true)) {
         this.reason = reason;
         return true;
      }
      return false;
   }

   public @Nullable String getReason() {
      return reason;
   }

   public boolean isCancelled() {
      return cancelled.get();
   }

   /**
    * @throws CancellationException if cancellation was requested
    */
   public void throwIfCancelled() {
      if (cancelled.get()) {
         final var r = reason;
         throw new CancellationException(r == null ? "Operation was cancelled." : "Operation was cancelled: " + r);
      }
   }
}
