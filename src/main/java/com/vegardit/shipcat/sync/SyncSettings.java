/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import com.vegardit.shipcat.remote.RemotePath;

/**
 * Tuning parameters of {@link RemoteSyncEngine} and {@link BatchUploader}.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class SyncSettings {

   public static final int DEFAULT_BATCH_SIZE = 20;
   public static final int DEFAULT_MAX_ATTEMPTS = 3;

   /** remote directory the source tree is mirrored into */
   public RemotePath basePath = RemotePath.ROOT;

   /** number of files uploaded per transport call */
   public int batchSize = DEFAULT_BATCH_SIZE;

   /** number of attempts per batch before the publish is aborted */
   public int maxAttempts = DEFAULT_MAX_ATTEMPTS;

   /** delete remote directories that have no counterpart in the source tree */
   public boolean deleteEmptyDirectories;

   /** compare the remote file size after each upload */
   public boolean verifyUploads = true;

   public SyncSettings copy() {
      final var copy = new SyncSettings();
      copy.basePath = basePath;
      copy.batchSize = batchSize;
      copy.maxAttempts = maxAttempts;
      copy.deleteEmptyDirectories = deleteEmptyDirectories;
      copy.verifyUploads = verifyUploads;
      return copy;
   }

   /**
    * @throws IllegalArgumentException if a parameter is invalid
    */
   public void validate() {
      basePath.requireDirectory("base");
      if (batchSize < 1)
         throw new IllegalArgumentException("Batch size must be at least 1 but was " + batchSize + ".");
      if (maxAttempts < 1)
         throw new IllegalArgumentException("Max attempts must be at least 1 but was " + maxAttempts + ".");
   }

   @Override
   public String toString() {
      return "SyncSettings[basePath=" + basePath + ", batchSize=" + batchSize + ", maxAttempts=" + maxAttempts
            + ", deleteEmptyDirectories=" + deleteEmptyDirectories + ", verifyUploads=" + verifyUploads + "]";
   }
}
