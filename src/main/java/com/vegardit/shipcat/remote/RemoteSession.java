/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.nio.file.Path;
import java.util.List;

/**
 * A stateful connection to a deployment target.
 * <p>
 * Implementations are not thread-safe. A session serves one publish operation at a time.
 * <p>
 * All operations validate the {@link RemotePath.Kind} of their arguments and throw {@link IllegalArgumentException} before any I/O
 * takes place if a file path is passed where a directory is required or vice versa.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public interface RemoteSession extends AutoCloseable {

   /**
    * @return a human readable description of the target, e.g. {@code ftp://example.com:21}
    */
   String getDescription();

   /**
    * @return true if an entry of the kind denoted by {@code path} exists
    */
   boolean exists(RemotePath path) throws RemoteSessionException;

   /**
    * @return all entries located in the given directory, including the entries of all sub-directories if {@code recursive} is set
    */
   List<RemotePath> list(RemotePath dir, boolean recursive) throws RemoteSessionException;

   /**
    * Creates the given directory including any missing parent directories.
    */
   void createDirectory(RemotePath dir) throws RemoteSessionException;

   void deleteFile(RemotePath file) throws RemoteSessionException;

   void deleteDirectory(RemotePath dir, boolean recursive) throws RemoteSessionException;

   /**
    * @param overwrite if false an already existing remote file is left untouched
    * @param verify if true the transferred size is compared with the local file size
    */
   void uploadFile(Path localFile, RemotePath remoteFile, boolean overwrite, boolean verify) throws RemoteSessionException;

   /**
    * Uploads the given local files into {@code remoteDir} using their file names.
    * <p>
    * Failures of individual files are not propagated; they are reflected by the returned count only.
    *
    * @return number of files that were successfully uploaded
    */
   int uploadFiles(List<Path> localFiles, RemotePath remoteDir, boolean overwrite, boolean verify) throws RemoteSessionException;

   @Override
   void close() throws RemoteSessionException;
}
