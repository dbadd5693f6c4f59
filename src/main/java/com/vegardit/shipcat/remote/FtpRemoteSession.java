/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.net.ProtocolCommandEvent;
import org.apache.commons.net.ProtocolCommandListener;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.logging.Logger;

/**
 * {@link RemoteSession} talking to an FTP or explicit FTPS server using Apache Commons Net.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class FtpRemoteSession extends AbstractRemoteSession {

   private static final Logger LOG = Logger.create();

   /**
    * Logs the FTP control connection traffic at trace level. Passwords are masked.
    */
   private static final class TraceCommandListener implements ProtocolCommandListener {
      @Override
      public void protocolCommandSent(final ProtocolCommandEvent event) {
         if (LOG.isTraceEnabled()) {
            final var cmd = event.getCommand();
            LOG.trace("> %s", "PASS".equalsIgnoreCase(cmd) ? "PASS *******" : event.getMessage().stripTrailing());
         }
      }

      @Override
      public void protocolReplyReceived(final ProtocolCommandEvent event) {
         if (LOG.isTraceEnabled()) {
            LOG.trace("< %s", event.getMessage().stripTrailing());
         }
      }
   }

   /**
    * Opens and authenticates a new session.
    */
   public static FtpRemoteSession connect(final FtpSettings settings) throws RemoteSessionException {
      settings.validate();

      final FTPClient ftp = settings.secure ? new FTPSClient("TLSv1.2", false) : new FTPClient();
      ftp.addProtocolCommandListener(new TraceCommandListener());
      ftp.setConnectTimeout((int) settings.connectTimeout.toMillis());
      ftp.setDefaultTimeout((int) settings.readTimeout.toMillis());
      ftp.setDataTimeout(settings.readTimeout);

      final var description = settings.toUriString();
      LOG.info("Connecting to [@|magenta %s|@]...", description);
      try {
         ftp.connect(settings.host, settings.port);
         if (!FTPReply.isPositiveCompletion(ftp.getReplyCode()))
            throw new RemoteSessionException("FTP server [" + description + "] refused connection: " + ftp.getReplyString().strip());
         ftp.setSoTimeout((int) settings.readTimeout.toMillis());

         final var username = settings.username == null ? "anonymous" : settings.username;
         final var password = settings.password == null ? "" : settings.password;
         if (!ftp.login(username, password))
            throw new RemoteSessionException("Login of user [" + username + "] at [" + description + "] failed: " + ftp.getReplyString()
               .strip());

         if (ftp instanceof final FTPSClient ftps) {
            ftps.execPBSZ(0);
            ftps.execPROT("P");
         }
         if (settings.passive) {
            ftp.enterLocalPassiveMode();
         }
         if (!ftp.setFileType(FTP.BINARY_FILE_TYPE))
            throw new RemoteSessionException("Could not switch [" + description + "] to binary transfer mode.");
      } catch (final IOException ex) {
         disconnectQuietly(ftp);
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not connect to [" + description + "]", ex);
      }
      return new FtpRemoteSession(ftp, description);
   }

   private static void disconnectQuietly(final FTPClient ftp) {
      if (!ftp.isConnected())
         return;
      try {
         ftp.disconnect();
      } catch (final IOException ex) {
         LOG.debug(ex);
      }
   }

   private final FTPClient ftp;
   private final String description;

   protected FtpRemoteSession(final FTPClient ftp, final String description) {
      this.ftp = ftp;
      this.description = description;
   }

   @Override
   public void close() throws RemoteSessionException {
      if (!ftp.isConnected())
         return;
      try {
         ftp.logout();
      } catch (final IOException ex) {
         LOG.debug(ex);
      }
      try {
         ftp.disconnect();
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not disconnect from [" + description + "]", ex);
      }
   }

   @Override
   public void createDirectory(final RemotePath dir) throws RemoteSessionException {
      dir.requireDirectory("create");
      if (dir.isRoot())
         return;
      try {
         final var sb = new StringBuilder();
         for (final String segment : dir.getPath().substring(1).split("/")) {
            sb.append(RemotePath.SEPARATOR).append(segment);
            final var current = sb.toString();
            if (!ftp.changeWorkingDirectory(current) && !ftp.makeDirectory(current))
               throw new RemoteSessionException("Could not create directory '" + current + "': " + ftp.getReplyString().strip());
         }
      } catch (final IOException ex) {
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not create directory '" + dir + "'", ex);
      }
   }

   @Override
   public void deleteDirectory(final RemotePath dir, final boolean recursive) throws RemoteSessionException {
      dir.requireDirectory("delete");
      if (dir.isRoot())
         throw new IllegalArgumentException("Deleting the root directory of a target is not supported.");

      if (recursive) {
         final var children = list(dir, true);
         children.sort(RemotePath.DESCENDING);
         for (final RemotePath child : children) {
            if (child.isFile()) {
               deleteFile(child);
            } else {
               deleteDirectory(child, false);
            }
         }
      }
      try {
         if (!ftp.removeDirectory(dir.getPath()))
            throw new RemoteSessionException("Could not delete directory '" + dir + "': " + ftp.getReplyString().strip());
      } catch (final IOException ex) {
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not delete directory '" + dir + "'", ex);
      }
   }

   @Override
   public void deleteFile(final RemotePath file) throws RemoteSessionException {
      file.requireFile("delete");
      try {
         if (!ftp.deleteFile(file.getPath()))
            throw new RemoteSessionException("Could not delete file '" + file + "': " + ftp.getReplyString().strip());
      } catch (final IOException ex) {
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not delete file '" + file + "'", ex);
      }
   }

   @Override
   public boolean exists(final RemotePath path) throws RemoteSessionException {
      if (path.isRoot())
         return path.isDirectory();
      return findEntry(path) != null;
   }

   private @Nullable FTPFile findEntry(final RemotePath path) throws RemoteSessionException {
      final var parent = path.getParent();
      if (parent == null)
         return null;
      try {
         for (final FTPFile entry : ftp.listFiles(parent.getPath())) {
            if (entry != null && entry.getName().equalsIgnoreCase(path.getName()) && entry.isDirectory() == path.isDirectory())
               return entry;
         }
         return null;
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not check existence of '" + path + "'", ex);
      }
   }

   @Override
   public String getDescription() {
      return description;
   }

   @Override
   public List<RemotePath> list(final RemotePath dir, final boolean recursive) throws RemoteSessionException {
      dir.requireDirectory("list");

      final var result = new ArrayList<RemotePath>();
      final var pending = new ArrayDeque<RemotePath>();
      pending.add(dir);
      while (!pending.isEmpty()) {
         final var current = pending.poll();
         final FTPFile[] entries;
         try {
            entries = ftp.listFiles(current.getPath());
         } catch (final IOException ex) {
            throw new RemoteSessionException("Could not list files for directory '" + current + "'", ex);
         }
         Arrays.sort(entries, Comparator.comparing(f -> f == null ? "" : f.getName()));
         for (final FTPFile entry : entries) {
            if (entry == null || ".".equals(entry.getName()) || "..".equals(entry.getName())) {
               continue;
            }
            if (entry.isDirectory()) {
               final var childDir = current.append(entry.getName(), RemotePath.Kind.DIRECTORY);
               result.add(childDir);
               if (recursive) {
                  pending.add(childDir);
               }
            } else {
               result.add(current.append(entry.getName(), RemotePath.Kind.FILE));
            }
         }
      }
      return result;
   }

   @Override
   public void uploadFile(final Path localFile, final RemotePath remoteFile, final boolean overwrite, final boolean verify)
         throws RemoteSessionException {
      remoteFile.requireFile("upload");
      if (!Files.isRegularFile(localFile))
         throw new RemoteSessionException("Source file '" + localFile + "' does not exist");

      if (!overwrite && exists(remoteFile)) {
         LOG.debug("Keeping existing file [@|magenta %s|@]...", remoteFile);
         return;
      }

      store(localFile, remoteFile);
      if (!verify)
         return;

      if (!isSizeMatching(localFile, remoteFile)) {
         LOG.warn("Size of uploaded file [@|magenta %s|@] does not match, uploading again...", remoteFile);
         deleteFile(remoteFile);
         store(localFile, remoteFile);
         if (!isSizeMatching(localFile, remoteFile))
            throw new RemoteSessionException("Verification of uploaded file '" + remoteFile + "' failed: size mismatch");
      }
   }

   private boolean isSizeMatching(final Path localFile, final RemotePath remoteFile) throws RemoteSessionException {
      final var entry = findEntry(remoteFile);
      if (entry == null)
         return false;
      try {
         return entry.getSize() == Files.size(localFile);
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not determine size of '" + localFile + "'", ex);
      }
   }

   private void store(final Path localFile, final RemotePath remoteFile) throws RemoteSessionException {
      LOG.debug("Uploading [@|magenta %s|@]...", remoteFile);
      try (InputStream in = Files.newInputStream(localFile)) {
         if (!ftp.storeFile(remoteFile.getPath(), in))
            throw new RemoteSessionException("Could not upload file '" + remoteFile + "': " + ftp.getReplyString().strip());
      } catch (final IOException ex) {
         if (ex instanceof final RemoteSessionException rse)
            throw rse;
         throw new RemoteSessionException("Could not copy source file '" + localFile + "' to path '" + remoteFile + "'", ex);
      }
   }
}
