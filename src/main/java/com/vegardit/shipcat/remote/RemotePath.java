/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;

import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.Strings;

/**
 * Immutable, normalized path on a remote target together with the kind of entry it denotes.
 * <p>
 * Normalized paths always start with a single {@code /}, never end with one (except the root {@code /}) and contain no empty,
 * {@code .} or {@code ..} segments. Remote filesystems are treated as case-insensitive, i.e. equality and ordering ignore case.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RemotePath implements Comparable<RemotePath> {

   public enum Kind {
      FILE,
      DIRECTORY
   }

   public static final char SEPARATOR = '/';

   public static final RemotePath ROOT = new RemotePath("/", Kind.DIRECTORY);

   /**
    * Orders paths descending, which places every directory after all of its descendants (deepest first).
    */
   public static final Comparator<RemotePath> DESCENDING = Comparator.<RemotePath> naturalOrder().reversed();

   public static RemotePath dir(final String path) {
      return of(path, Kind.DIRECTORY);
   }

   public static RemotePath file(final String path) {
      return of(path, Kind.FILE);
   }

   /**
    * @throws IllegalArgumentException if the path is blank or contains {@code ..} segments
    */
   public static RemotePath of(final String path, final Kind kind) {
      if (kind == null)
         throw new IllegalArgumentException("[kind] must not be null");
      final var normalized = normalize(path);
      if ("/".equals(normalized))
         return kind == Kind.DIRECTORY ? ROOT : new RemotePath(normalized, kind);
      return new RemotePath(normalized, kind);
   }

   static String normalize(final @Nullable String path) {
      if (path == null || Strings.isBlank(path))
         throw new IllegalArgumentException("Remote path must not be null or blank.");

      final var sb = new StringBuilder(path.length() + 1);
      for (final String segment : path.strip().replace('\\', '/').split("/")) {
         if (segment.isEmpty() || ".".equals(segment)) {
            continue;
         }
         if ("..".equals(segment))
            throw new IllegalArgumentException("Remote path [" + path + "] must not contain '..' segments.");
         sb.append(SEPARATOR).append(segment);
      }
      return sb.length() == 0 ? "/" : sb.toString();
   }

   private final String path;
   private final String key;
   private final Kind kind;

   private RemotePath(final String path, final Kind kind) {
      this.path = path;
      this.kind = kind;
      key = path.toLowerCase(Locale.ROOT);
   }

   /**
    * @return a new path with the segments of {@code child} appended to this path; the result has the kind of {@code child}
    */
   public RemotePath append(final RemotePath child) {
      if (child.isRoot())
         return withKind(child.kind);
      if (isRoot())
         return child;
      return new RemotePath(path + child.path, child.kind);
   }

   public RemotePath append(final String relativePath, final Kind childKind) {
      if (Strings.isBlank(relativePath))
         return withKind(childKind);
      return append(of(relativePath, childKind));
   }

   /**
    * Appends the name elements of a local relative path. An empty relative path yields this path with the given kind.
    */
   public RemotePath resolve(final Path relativePath, final Kind childKind) {
      if (relativePath.isAbsolute())
         throw new IllegalArgumentException("Path [" + relativePath + "] is not relative.");
      final var sb = new StringBuilder();
      for (final Path name : relativePath) {
         final var segment = name.toString();
         if (!segment.isEmpty()) {
            sb.append(SEPARATOR).append(segment);
         }
      }
      return append(sb.toString(), childKind);
   }

   /**
    * @return true if {@code other} is located below this path; a path does not contain itself and {@code /app} does not contain
    *         {@code /application}
    */
   public boolean contains(final RemotePath other) {
      if (isRoot())
         return !other.isRoot();
      return other.key.length() > key.length() //
            && other.key.startsWith(key) //
            && other.key.charAt(key.length()) == SEPARATOR;
   }

   public Kind getKind() {
      return kind;
   }

   public String getName() {
      return path.substring(path.lastIndexOf(SEPARATOR) + 1);
   }

   public @Nullable RemotePath getParent() {
      if (isRoot())
         return null;
      final int idx = path.lastIndexOf(SEPARATOR);
      return idx == 0 ? ROOT : new RemotePath(path.substring(0, idx), Kind.DIRECTORY);
   }

   public String getPath() {
      return path;
   }

   public boolean isDirectory() {
      return kind == Kind.DIRECTORY;
   }

   public boolean isFile() {
      return kind == Kind.FILE;
   }

   public boolean isRoot() {
      return path.length() == 1;
   }

   /**
    * @throws IllegalArgumentException if this path does not denote a directory
    */
   public RemotePath requireDirectory(final String operation) {
      if (kind != Kind.DIRECTORY)
         throw new IllegalArgumentException("The remote " + operation + " path '" + path + "' is not a directory.");
      return this;
   }

   /**
    * @throws IllegalArgumentException if this path does not denote a file
    */
   public RemotePath requireFile(final String operation) {
      if (kind != Kind.FILE)
         throw new IllegalArgumentException("The remote " + operation + " path '" + path + "' is not a file.");
      return this;
   }

   public RemotePath withKind(final Kind newKind) {
      if (newKind == kind)
         return this;
      return of(path, newKind);
   }

   @Override
   public int compareTo(final RemotePath other) {
      final int result = key.compareTo(other.key);
      return result == 0 ? kind.compareTo(other.kind) : result;
   }

   @Override
   public boolean equals(final @Nullable Object obj) {
      if (this == obj)
         return true;
      if (!(obj instanceof final RemotePath other))
         return false;
      return kind == other.kind && key.equals(other.key);
   }

   @Override
   public int hashCode() {
      return 31 * key.hashCode() + kind.hashCode();
   }

   @Override
   public String toString() {
      return path;
   }
}
