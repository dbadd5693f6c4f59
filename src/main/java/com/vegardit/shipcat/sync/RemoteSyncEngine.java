/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.vegardit.shipcat.remote.RemotePath;
import com.vegardit.shipcat.remote.RemoteSession;
import com.vegardit.shipcat.util.CancellationSignal;

import net.sf.jstuff.core.logging.Logger;

/**
 * Reconciles a remote directory tree with a local source tree.
 * <p>
 * Remote files without a local counterpart are deleted unless they are kept by the {@link RuleConfiguration}. Afterwards the
 * source tree is uploaded, overwriting existing remote files. Source entries whose remote path is kept are not uploaded.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class RemoteSyncEngine {

   private static final Logger LOG = Logger.create();

   private final RemoteSession session;
   private final SyncSettings settings;

   public RemoteSyncEngine(final RemoteSession session) {
      this(session, new SyncSettings());
   }

   public RemoteSyncEngine(final RemoteSession session, final SyncSettings settings) {
      settings.validate();
      this.session = session;
      this.settings = settings.copy();
   }

   public SyncSettings getSettings() {
      return settings.copy();
   }

   public ChangeSummary publish(final RuleConfiguration rules, final Path sourceDir) throws IOException {
      return publish(rules, sourceDir, CancellationSignal.NONE);
   }

   /**
    * @throws IllegalArgumentException if {@code sourceDir} is not an existing directory
    * @throws com.vegardit.shipcat.remote.RemoteSessionException if a remote operation failed
    * @throws BatchUploadException if a batch of files could not be uploaded
    * @throws java.util.concurrent.CancellationException if the operation was cancelled
    */
   public synchronized ChangeSummary publish(final RuleConfiguration rules, final Path sourceDir, final CancellationSignal cancellation)
         throws IOException {
      if (!Files.isDirectory(sourceDir))
         throw new IllegalArgumentException("Source directory [" + sourceDir + "] does not exist or is not a directory.");

      final var source = sourceDir.toAbsolutePath().normalize();
      final long startAt = System.nanoTime();
      final var summary = new ChangeSummary();
      final var basePath = settings.basePath;

      LOG.info("Publishing [@|magenta %s|@] to [@|magenta %s%s|@]...", source, session.getDescription(), basePath.isRoot() ? ""
            : basePath);

      cancellation.throwIfCancelled();
      if (!session.exists(basePath)) {
         LOG.info("NEW [@|magenta %s|@]...", basePath);
         session.createDirectory(basePath);
         summary.onDirectoryCreated(basePath);
      }

      cancellation.throwIfCancelled();
      final List<RemotePath> remoteEntries = session.list(basePath, true);
      final Set<RemotePath> sourceFiles = new HashSet<>();
      final Set<RemotePath> sourceDirs = new HashSet<>();
      collectSourceTree(source, basePath, sourceFiles, sourceDirs);
      LOG.debug("Found %s remote entries and %s source files.", remoteEntries.size(), sourceFiles.size());

      /*
       * classify remote files
       */
      final var filesToKeep = new ArrayList<RemotePath>();
      final var filesToRemove = new ArrayList<RemotePath>();
      final var updated = new ArrayList<RemotePath>();
      for (final RemotePath entry : remoteEntries) {
         if (!entry.isFile()) {
            continue;
         }
         if (rules.isKept(entry)) {
            filesToKeep.add(entry);
         } else if (sourceFiles.contains(entry)) {
            updated.add(entry);
         } else {
            filesToRemove.add(entry);
         }
      }

      cancellation.throwIfCancelled();
      deleteFiles(rules, filesToRemove, summary, cancellation);

      for (final RemotePath kept : filesToKeep) {
         if (rules.isExcluded(kept)) {
            LOG.debug("Ignoring excluded file [@|magenta %s|@]...", kept);
         } else {
            LOG.debug("Ignoring app data file [@|magenta %s|@]...", kept);
         }
         summary.onFileIgnored(kept);
      }
      for (final RemotePath file : updated) {
         summary.onFileUpdated(file);
      }

      cancellation.throwIfCancelled();
      summary.merge(new BatchUploader(session, settings, rules).uploadDirectory(source, source, basePath, cancellation));

      if (settings.deleteEmptyDirectories) {
         cancellation.throwIfCancelled();
         final var obsoleteDirs = new ArrayList<RemotePath>();
         for (final RemotePath entry : remoteEntries) {
            if (entry.isDirectory() && !sourceDirs.contains(entry)) {
               obsoleteDirs.add(entry);
            }
         }
         deleteDirectories(rules, obsoleteDirs, filesToKeep, summary, new ArrayList<>(), cancellation);
      }

      summary.setTotalTime(Duration.ofNanos(System.nanoTime() - startAt));
      LOG.info("Publishing to [@|magenta %s|@] done.", session.getDescription());
      return summary;
   }

   private void collectSourceTree(final Path source, final RemotePath basePath, final Set<RemotePath> files, final Set<RemotePath> dirs)
         throws IOException {
      Files.walkFileTree(source, new SimpleFileVisitor<>() {
         @Override
         public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
            dirs.add(basePath.resolve(source.relativize(dir), RemotePath.Kind.DIRECTORY));
            return FileVisitResult.CONTINUE;
         }

         @Override
         public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
            if (attrs.isRegularFile()) {
               files.add(basePath.resolve(source.relativize(file), RemotePath.Kind.FILE));
            }
            return FileVisitResult.CONTINUE;
         }
      });
   }

   /**
    * Deletes the given remote directories deepest first. App data and excluded directories are skipped and added to
    * {@code excluded}. Directories located below an excluded directory or containing a kept file are skipped too.
    */
   void deleteDirectories(final RuleConfiguration rules, final List<RemotePath> dirs, final List<RemotePath> keptFiles,
         final ChangeSummary summary, final List<RemotePath> excluded, final CancellationSignal cancellation) throws IOException {
      final var sorted = new ArrayList<>(dirs);
      sorted.sort(RemotePath.DESCENDING);

      for (final RemotePath dir : sorted) {
         if (!dir.isDirectory() || dir.isRoot()) {
            continue;
         }
         cancellation.throwIfCancelled();

         if (rules.isAppData(dir)) {
            excluded.add(dir);
            continue;
         }
         if (rules.isExcluded(dir)) {
            LOG.debug("Ignoring excluded directory [@|magenta %s|@]...", dir);
            excluded.add(dir);
            summary.onDirectoryIgnored(dir);
            continue;
         }
         if (excluded.stream().anyMatch(ex -> ex.contains(dir))) {
            continue;
         }
         if (keptFiles.stream().anyMatch(dir::contains) || excluded.stream().anyMatch(dir::contains)) {
            LOG.debug("Keeping directory [@|magenta %s|@] which contains kept entries...", dir);
            continue;
         }

         LOG.info("DELETE [@|magenta %s|@]...", dir);
         session.deleteDirectory(dir, true);
         summary.onDirectoryDeleted(dir);
      }
   }

   private void deleteFiles(final RuleConfiguration rules, final List<RemotePath> files, final ChangeSummary summary,
         final CancellationSignal cancellation) throws IOException {
      for (final RemotePath file : files) {
         cancellation.throwIfCancelled();

         if (rules.isAppData(file)) {
            continue;
         }
         if (rules.isExcluded(file)) {
            summary.onFileIgnored(file);
            continue;
         }

         LOG.info("DELETE [@|magenta %s|@]...", file);
         session.deleteFile(file);
         summary.onFileDeleted(file);
      }
   }
}
