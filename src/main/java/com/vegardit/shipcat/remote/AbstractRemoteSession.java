/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import net.sf.jstuff.core.logging.Logger;

/**
 * Base class providing bulk upload on top of single file uploads.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public abstract class AbstractRemoteSession implements RemoteSession {

   private static final Logger LOG = Logger.create();

   @Override
   public int uploadFiles(final List<Path> localFiles, final RemotePath remoteDir, final boolean overwrite, final boolean verify)
         throws RemoteSessionException {
      remoteDir.requireDirectory("upload");

      int uploaded = 0;
      for (final Path localFile : localFiles) {
         final var fileName = localFile.getFileName();
         if (fileName == null || !Files.isRegularFile(localFile)) {
            LOG.warn("Skipping upload of [@|magenta %s|@] which is not a regular file.", localFile);
            continue;
         }
         final var remoteFile = remoteDir.append(fileName.toString(), RemotePath.Kind.FILE);
         try {
            uploadFile(localFile, remoteFile, overwrite, verify);
            uploaded++;
         } catch (final RemoteSessionException ex) {
            LOG.warn("Upload of [@|magenta %s|@] failed: %s", remoteFile, ex.getMessage());
            LOG.debug(ex);
         }
      }
      return uploaded;
   }

   @Override
   public String toString() {
      return getClass().getSimpleName() + "[" + getDescription() + "]";
   }
}
