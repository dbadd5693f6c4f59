/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import java.io.IOException;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.remote.RemotePath;

/**
 * Thrown when a batch of files could not be uploaded within the configured number of attempts.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class BatchUploadException extends IOException {

   private static final long serialVersionUID = 1L;

   private final int batchNumber;
   private final RemotePath remoteDir;

   public BatchUploadException(final int batchNumber, final RemotePath remoteDir, final @Nullable Throwable lastError) {
      super("The batch " + batchNumber + " failed (target directory: " + remoteDir + ")", lastError);
      this.batchNumber = batchNumber;
      this.remoteDir = remoteDir;
   }

   /**
    * @return 1-based number of the failed batch within its directory
    */
   public int getBatchNumber() {
      return batchNumber;
   }

   public RemotePath getRemoteDir() {
      return remoteDir;
   }
}
