/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.time.DurationFormatUtils;

import com.vegardit.shipcat.remote.RemotePath;

import net.sf.jstuff.core.logging.Logger;

/**
 * Record of every create/update/delete/ignore decision made during one publish.
 * <p>
 * Instances are not thread-safe. They are owned by the operation that creates them until handed to the caller.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ChangeSummary {
   private static final Logger LOG = Logger.create();

   private List<String> createdFiles = new ArrayList<>();
   private final List<String> updatedFiles = new ArrayList<>();
   private final List<String> deletedFiles = new ArrayList<>();
   private final List<String> createdDirectories = new ArrayList<>();
   private final List<String> deletedDirectories = new ArrayList<>();
   private final List<String> ignoredFiles = new ArrayList<>();
   private final List<String> ignoredDirectories = new ArrayList<>();
   private Duration totalTime = Duration.ZERO;
   private int exitCode;

   public List<String> getCreatedDirectories() {
      return Collections.unmodifiableList(createdDirectories);
   }

   public List<String> getCreatedFiles() {
      return Collections.unmodifiableList(createdFiles);
   }

   public List<String> getDeletedDirectories() {
      return Collections.unmodifiableList(deletedDirectories);
   }

   public List<String> getDeletedFiles() {
      return Collections.unmodifiableList(deletedFiles);
   }

   public int getExitCode() {
      return exitCode;
   }

   public List<String> getIgnoredDirectories() {
      return Collections.unmodifiableList(ignoredDirectories);
   }

   public List<String> getIgnoredFiles() {
      return Collections.unmodifiableList(ignoredFiles);
   }

   public Duration getTotalTime() {
      return totalTime;
   }

   public List<String> getUpdatedFiles() {
      return Collections.unmodifiableList(updatedFiles);
   }

   public boolean isEmpty() {
      return createdFiles.isEmpty() && updatedFiles.isEmpty() && deletedFiles.isEmpty() //
            && createdDirectories.isEmpty() && deletedDirectories.isEmpty() //
            && ignoredFiles.isEmpty() && ignoredDirectories.isEmpty();
   }

   public void logStats() {
      LOG.info("***************************************");
      LOG.info("Created files: %s", createdFiles.size());
      LOG.info("Updated files: %s", updatedFiles.size());
      LOG.info("Deleted files: %s", deletedFiles.size());
      LOG.info("Ignored files: %s", ignoredFiles.size());
      LOG.info("Created dirs: %s", createdDirectories.size());
      LOG.info("Deleted dirs: %s", deletedDirectories.size());
      LOG.info("Ignored dirs: %s", ignoredDirectories.size());
      LOG.info("Duration: %s", DurationFormatUtils.formatDurationWords(totalTime.toMillis(), true, true));
      LOG.info("***************************************");
   }

   /**
    * Appends all entries of {@code other} to this summary. Files that ended up being recorded as created and as updated are
    * afterwards only reported as updated. Paths are compared case-insensitively.
    *
    * @return this instance
    */
   public ChangeSummary merge(final ChangeSummary other) {
      if (other == this)
         throw new IllegalArgumentException("Cannot merge a summary into itself.");

      deletedFiles.addAll(other.deletedFiles);
      deletedDirectories.addAll(other.deletedDirectories);
      createdDirectories.addAll(other.createdDirectories);
      updatedFiles.addAll(other.updatedFiles);
      createdFiles.addAll(other.createdFiles);
      ignoredFiles.addAll(other.ignoredFiles);
      ignoredDirectories.addAll(other.ignoredDirectories);

      final var updatedKeys = new HashSet<String>(updatedFiles.size());
      for (final String updated : updatedFiles) {
         updatedKeys.add(updated.toLowerCase(Locale.ROOT));
      }
      final var remaining = new ArrayList<String>(createdFiles.size());
      for (final String created : createdFiles) {
         if (!updatedKeys.contains(created.toLowerCase(Locale.ROOT))) {
            remaining.add(created);
         }
      }
      createdFiles = remaining;
      return this;
   }

   public void onDirectoryCreated(final RemotePath dir) {
      createdDirectories.add(dir.requireDirectory("created").getPath());
   }

   public void onDirectoryDeleted(final RemotePath dir) {
      deletedDirectories.add(dir.requireDirectory("deleted").getPath());
   }

   public void onDirectoryIgnored(final RemotePath dir) {
      ignoredDirectories.add(dir.requireDirectory("ignored").getPath());
   }

   public void onFileCreated(final RemotePath file) {
      createdFiles.add(file.requireFile("created").getPath());
   }

   public void onFileDeleted(final RemotePath file) {
      deletedFiles.add(file.requireFile("deleted").getPath());
   }

   public void onFileIgnored(final RemotePath file) {
      ignoredFiles.add(file.requireFile("ignored").getPath());
   }

   public void onFileUpdated(final RemotePath file) {
      updatedFiles.add(file.requireFile("updated").getPath());
   }

   public void setExitCode(final int exitCode) {
      this.exitCode = exitCode;
   }

   public void setTotalTime(final Duration totalTime) {
      this.totalTime = totalTime;
   }

   /**
    * @return operator facing report listing the changed files followed by counters and the elapsed time
    */
   public String toDisplayValue() {
      final var sb = new StringBuilder();
      appendListing(sb, "Created files:", createdFiles);
      appendListing(sb, "Updated files:", updatedFiles);
      appendListing(sb, "Deleted files:", deletedFiles);
      sb.append("Ignored files: ").append(ignoredFiles.size()).append('\n');
      sb.append("Created files: ").append(createdFiles.size()).append('\n');
      sb.append("Updated files: ").append(updatedFiles.size()).append('\n');
      sb.append("Deleted files: ").append(deletedFiles.size()).append('\n');
      sb.append(String.format(Locale.ROOT, "Total time: %.1f seconds", totalTime.toMillis() / 1000.0)).append('\n');
      return sb.toString();
   }

   private static void appendListing(final StringBuilder sb, final String title, final List<String> entries) {
      if (entries.isEmpty())
         return;
      sb.append(title).append('\n');
      for (final String entry : entries) {
         sb.append("* ").append(entry).append('\n');
      }
   }

   @Override
   public String toString() {
      return "ChangeSummary[created=" + createdFiles.size() + ", updated=" + updatedFiles.size() + ", deleted=" + deletedFiles.size()
            + ", ignored=" + ignoredFiles.size() + ", totalTime=" + totalTime + "]";
   }
}
