/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.remote.RemotePath;
import com.vegardit.shipcat.remote.RemoteSession;
import com.vegardit.shipcat.remote.RemoteSessionException;
import com.vegardit.shipcat.util.CancellationSignal;

import net.sf.jstuff.core.logging.Logger;

/**
 * Uploads a local directory tree in fixed-size batches, one directory at a time, retrying failed batches.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class BatchUploader {

   private static final Logger LOG = Logger.create();

   private final RemoteSession session;
   private final SyncSettings settings;
   private final RuleConfiguration rules;

   public BatchUploader(final RemoteSession session, final SyncSettings settings) {
      this(session, settings, RuleConfiguration.NONE);
   }

   /**
    * @param rules source entries whose remote counterpart is kept by these rules are not uploaded
    */
   public BatchUploader(final RemoteSession session, final SyncSettings settings, final RuleConfiguration rules) {
      settings.validate();
      this.session = session;
      this.settings = settings;
      this.rules = rules;
   }

   /**
    * Mirrors {@code sourceDir} into {@code remoteBase}, using the location of {@code sourceDir} relative to {@code baseDir} as
    * remote sub-directory. Sub-directories are processed depth-first after all files of a directory have been uploaded.
    *
    * @return summary listing the created directories and all uploaded files as created
    * @throws BatchUploadException if a batch could not be uploaded within the configured number of attempts
    * @throws java.util.concurrent.CancellationException if cancellation was requested before a batch or an existence check
    */
   public ChangeSummary uploadDirectory(final Path sourceDir, final Path baseDir, final RemotePath remoteBase,
         final CancellationSignal cancellation) throws IOException {
      remoteBase.requireDirectory("upload");
      if (!Files.isDirectory(sourceDir))
         throw new IllegalArgumentException("Source [" + sourceDir + "] is not a directory.");

      final var remoteDir = remoteBase.resolve(baseDir.relativize(sourceDir), RemotePath.Kind.DIRECTORY);
      final var summary = new ChangeSummary();

      cancellation.throwIfCancelled();
      if (!session.exists(remoteDir)) {
         LOG.info("NEW [@|magenta %s|@]...", remoteDir);
         session.createDirectory(remoteDir);
         summary.onDirectoryCreated(remoteDir);
      }

      final var files = new ArrayList<Path>();
      final var subDirs = new ArrayList<Path>();
      try (var ds = Files.newDirectoryStream(sourceDir)) {
         for (final Path entry : ds) {
            final var name = entry.getFileName().toString();
            if (Files.isDirectory(entry)) {
               if (rules.isKept(remoteDir.append(name, RemotePath.Kind.DIRECTORY))) {
                  LOG.debug("Not uploading kept directory [@|magenta %s|@]...", entry);
               } else {
                  subDirs.add(entry);
               }
            } else if (Files.isRegularFile(entry)) {
               if (rules.isKept(remoteDir.append(name, RemotePath.Kind.FILE))) {
                  LOG.debug("Not uploading kept file [@|magenta %s|@]...", entry);
               } else {
                  files.add(entry);
               }
            } else {
               LOG.warn("Skipping [@|magenta %s|@] which is neither a file nor a directory.", entry);
            }
         }
      }
      Collections.sort(files);
      Collections.sort(subDirs);

      uploadFiles(files, remoteDir, summary, cancellation);

      for (final Path subDir : subDirs) {
         summary.merge(uploadDirectory(subDir, baseDir, remoteBase, cancellation));
      }
      return summary;
   }

   private void uploadFiles(final List<Path> files, final RemotePath remoteDir, final ChangeSummary summary,
         final CancellationSignal cancellation) throws BatchUploadException {
      if (files.isEmpty())
         return;

      final int batchSize = settings.batchSize;
      final int batchCount = (files.size() - 1) / batchSize + 1;
      LOG.info("Uploading %s files to [@|magenta %s|@]...", files.size(), remoteDir);

      for (int i = 0; i < batchCount; i++) {
         final int batchNumber = i + 1;
         final int from = (int) Math.min(files.size(), (long) i * batchSize);
         final int to = (int) Math.min(files.size(), (long) from + batchSize);
         final var batch = files.subList(from, to);

         cancellation.throwIfCancelled();
         uploadBatch(batch, batchNumber, remoteDir);

         for (final Path file : batch) {
            summary.onFileCreated(remoteDir.append(file.getFileName().toString(), RemotePath.Kind.FILE));
         }
         LOG.info("Uploaded batch %s of %s using batch size %s", batchNumber, batchCount, batchSize);
      }
   }

   private void uploadBatch(final List<Path> batch, final int batchNumber, final RemotePath remoteDir) throws BatchUploadException {
      @Nullable
      Exception lastError = null;
      for (int attempt = 1; attempt <= settings.maxAttempts; attempt++) {
         try {
            final int uploaded = session.uploadFiles(batch, remoteDir, true, settings.verifyUploads);
            if (uploaded == batch.size())
               return;

            LOG.error("The expected number of uploaded files was " + batch.size() + " but result was " + uploaded
                  + ", retrying batch " + batchNumber);
         } catch (final RemoteSessionException | RuntimeException ex) {
            lastError = ex;
            LOG.error("Upload error in batch " + batchNumber + " (attempt " + attempt + " of " + settings.maxAttempts + ")", ex);
         }
      }
      throw new BatchUploadException(batchNumber, remoteDir, lastError);
   }
}
