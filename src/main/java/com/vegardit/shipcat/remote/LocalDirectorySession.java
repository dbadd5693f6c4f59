/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.file.PathUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * {@link RemoteSession} backed by a local or mounted directory, e.g. a network share of the target machine.
 * <p>
 * The remote root {@code /} maps to the configured root directory.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class LocalDirectorySession extends AbstractRemoteSession {

   private static final Logger LOG = Logger.create();

   private static final LinkOption[] NOFOLLOW_LINKS = {LinkOption.NOFOLLOW_LINKS};

   private final Path rootDir;
   private volatile boolean closed;

   public LocalDirectorySession(final Path rootDir) throws RemoteSessionException {
      this.rootDir = rootDir.toAbsolutePath().normalize();
      if (!Files.isDirectory(this.rootDir))
         throw new RemoteSessionException("Target directory [" + this.rootDir + "] does not exist or is not a directory.");
   }

   private void ensureOpen() throws RemoteSessionException {
      if (closed)
         throw new RemoteSessionException("Session to [" + rootDir + "] is closed.");
   }

   @Override
   public void close() {
      closed = true;
   }

   @Override
   public void createDirectory(final RemotePath dir) throws RemoteSessionException {
      dir.requireDirectory("create");
      ensureOpen();
      try {
         Files.createDirectories(toLocal(dir));
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not create directory '" + dir + "'", ex);
      }
   }

   @Override
   public void deleteDirectory(final RemotePath dir, final boolean recursive) throws RemoteSessionException {
      dir.requireDirectory("delete");
      if (dir.isRoot())
         throw new IllegalArgumentException("Deleting the root directory of a target is not supported.");
      ensureOpen();
      try {
         final var target = toLocal(dir);
         if (!recursive) {
            Files.delete(target);
            return;
         }
         final var counters = PathUtils.deleteDirectory(target);
         LOG.trace("Deleted %s files and %s directories below [@|magenta %s|@].", counters.getFileCounter().get(), counters
            .getDirectoryCounter().get(), dir);
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not delete directory '" + dir + "'", ex);
      }
   }

   @Override
   public void deleteFile(final RemotePath file) throws RemoteSessionException {
      file.requireFile("delete");
      ensureOpen();
      try {
         Files.delete(toLocal(file));
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not delete file '" + file + "'", ex);
      }
   }

   @Override
   public boolean exists(final RemotePath path) throws RemoteSessionException {
      ensureOpen();
      final Path target;
      try {
         target = toLocal(path);
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not check existence of '" + path + "'", ex);
      }
      return path.isDirectory() //
            ? Files.isDirectory(target, NOFOLLOW_LINKS)
            : Files.isRegularFile(target, NOFOLLOW_LINKS);
   }

   @Override
   public String getDescription() {
      return rootDir.toString();
   }

   public Path getRootDir() {
      return rootDir;
   }

   @Override
   public List<RemotePath> list(final RemotePath dir, final boolean recursive) throws RemoteSessionException {
      dir.requireDirectory("list");
      ensureOpen();
      final var result = new ArrayList<RemotePath>();
      try {
         listInto(dir, toLocal(dir), recursive, result);
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not list files for directory '" + dir + "'", ex);
      }
      return result;
   }

   private void listInto(final RemotePath dir, final Path localDir, final boolean recursive, final List<RemotePath> result)
         throws IOException {
      final var children = new ArrayList<Path>();
      try (var ds = Files.newDirectoryStream(localDir)) {
         ds.forEach(children::add);
      }
      Collections.sort(children);
      for (final Path child : children) {
         final var name = child.getFileName().toString();
         if (Files.isDirectory(child, NOFOLLOW_LINKS)) {
            final var childDir = dir.append(name, RemotePath.Kind.DIRECTORY);
            result.add(childDir);
            if (recursive) {
               listInto(childDir, child, true, result);
            }
         } else {
            result.add(dir.append(name, RemotePath.Kind.FILE));
         }
      }
   }

   /**
    * Maps a remote path to the local file system. Remote paths are case-insensitive, so each segment is resolved to the casing of an
    * already existing entry, if any.
    */
   private Path toLocal(final RemotePath path) throws IOException {
      var result = rootDir;
      if (path.isRoot())
         return result;
      for (final String segment : path.getPath().substring(1).split("/")) {
         result = resolveSegment(result, segment);
      }
      return result;
   }

   private static Path resolveSegment(final Path dir, final String name) throws IOException {
      final var exact = dir.resolve(name);
      if (Files.exists(exact, NOFOLLOW_LINKS) || !Files.isDirectory(dir, NOFOLLOW_LINKS))
         return exact;
      try (var ds = Files.newDirectoryStream(dir)) {
         for (final Path child : ds) {
            if (child.getFileName().toString().equalsIgnoreCase(name))
               return child;
         }
      }
      return exact;
   }

   @Override
   public void uploadFile(final Path localFile, final RemotePath remoteFile, final boolean overwrite, final boolean verify)
         throws RemoteSessionException {
      remoteFile.requireFile("upload");
      ensureOpen();
      if (!Files.isRegularFile(localFile))
         throw new RemoteSessionException("Source file '" + localFile + "' does not exist");

      try {
         final var target = toLocal(remoteFile);
         if (!overwrite && Files.exists(target, NOFOLLOW_LINKS)) {
            LOG.debug("Keeping existing file [@|magenta %s|@]...", remoteFile);
            return;
         }
         final var parent = target.getParent();
         if (parent != null) {
            Files.createDirectories(parent);
         }
         Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
         if (verify && Files.size(target) != Files.size(localFile)) {
            Files.deleteIfExists(target);
            throw new RemoteSessionException("Verification of uploaded file '" + remoteFile + "' failed: size mismatch");
         }
      } catch (final IOException ex) {
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not copy source file '" + localFile + "' to path '" + remoteFile + "'", ex);
      }
   }
}
