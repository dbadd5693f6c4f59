/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.io.IOException;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Signals that a remote operation (connecting, listing, creating, deleting or uploading) failed.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class RemoteSessionException extends IOException {

   private static final long serialVersionUID = 1L;

   public RemoteSessionException(final String message) {
      super(message);
   }

   public RemoteSessionException(final String message, final @Nullable Throwable cause) {
      super(message, cause);
   }
}
