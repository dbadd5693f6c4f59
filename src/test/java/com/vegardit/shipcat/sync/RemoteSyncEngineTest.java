/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vegardit.shipcat.remote.InMemoryRemoteSession;
import com.vegardit.shipcat.remote.RemotePath;
import com.vegardit.shipcat.remote.RemoteSessionException;
import com.vegardit.shipcat.util.CancellationSignal;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class RemoteSyncEngineTest {

   @TempDir
   Path source;

   private static SyncSettings settings(final int batchSize, final int maxAttempts) {
      final var settings = new SyncSettings();
      settings.batchSize = batchSize;
      settings.maxAttempts = maxAttempts;
      return settings;
   }

   private void createFiles(final String... relativePaths) throws Exception {
      for (final String relativePath : relativePaths) {
         final var file = source.resolve(relativePath);
         Files.createDirectories(file.getParent());
         Files.writeString(file, "new:" + relativePath);
      }
   }

   @Test
   void replacesRemoteTree() throws Exception {
      createFiles("a.txt", "sub/b.txt");
      final var session = new InMemoryRemoteSession() //
         .withFile("/old.txt", "old") //
         .withFile("/sub/b.txt", "old");

      final var summary = new RemoteSyncEngine(session, settings(10, 1)).publish(RuleConfiguration.NONE, source);

      assertThat(summary.getDeletedFiles()).containsExactly("/old.txt");
      assertThat(summary.getCreatedFiles()).containsExactly("/a.txt");
      assertThat(summary.getUpdatedFiles()).containsExactly("/sub/b.txt");
      assertThat(summary.getIgnoredFiles()).isEmpty();
      assertThat(summary.getIgnoredDirectories()).isEmpty();
      assertThat(summary.getCreatedDirectories()).isEmpty();
      assertThat(summary.getTotalTime().isNegative()).isFalse();

      assertThat(session.filePaths()).containsExactly("/a.txt", "/sub/b.txt");
      assertThat(session.files.get(RemotePath.file("/sub/b.txt"))).isEqualTo("new:sub/b.txt");
   }

   @Test
   void secondPublishOnlyUpdates() throws Exception {
      createFiles("a.txt", "sub/b.txt", "sub/c.txt");
      final var session = new InMemoryRemoteSession();
      final var engine = new RemoteSyncEngine(session, settings(2, 1));

      final var first = engine.publish(RuleConfiguration.NONE, source);
      assertThat(first.getCreatedFiles()).containsExactly("/a.txt", "/sub/b.txt", "/sub/c.txt");
      assertThat(first.getCreatedDirectories()).containsExactly("/sub");

      final var second = engine.publish(RuleConfiguration.NONE, source);
      assertThat(second.getDeletedFiles()).isEmpty();
      assertThat(second.getCreatedFiles()).isEmpty();
      assertThat(second.getCreatedDirectories()).isEmpty();
      assertThat(second.getUpdatedFiles()).containsExactlyInAnyOrder("/a.txt", "/sub/b.txt", "/sub/c.txt");
      assertThat(session.filePaths()).containsExactly("/a.txt", "/sub/b.txt", "/sub/c.txt");
   }

   @Test
   void pathsAreMatchedCaseInsensitively() throws Exception {
      createFiles("a.txt");
      final var session = new InMemoryRemoteSession().withFile("/A.TXT", "old");

      final var summary = new RemoteSyncEngine(session, settings(10, 1)).publish(RuleConfiguration.NONE, source);

      assertThat(summary.getDeletedFiles()).isEmpty();
      assertThat(summary.getCreatedFiles()).isEmpty();
      assertThat(summary.getUpdatedFiles()).containsExactly("/A.TXT");
   }

   @Test
   void keptEntriesAreOnlyReportedAsIgnored() throws Exception {
      createFiles("index.html", "web.config");
      final var session = new InMemoryRemoteSession() //
         .withFile("/web.config", "remote") //
         .withFile("/App_Data/db.sqlite", "data") //
         .withFile("/Logs/x.log", "log") //
         .withFile("/old.txt", "old");

      final var rules = new RuleConfiguration(List.of("/web.config", "/logs"), true);
      final var summary = new RemoteSyncEngine(session, settings(10, 1)).publish(rules, source);

      assertThat(summary.getDeletedFiles()).containsExactly("/old.txt");
      assertThat(summary.getIgnoredFiles()).containsExactlyInAnyOrder("/web.config", "/App_Data/db.sqlite", "/Logs/x.log");
      assertThat(summary.getCreatedFiles()).containsExactly("/index.html");
      assertThat(summary.getUpdatedFiles()).isEmpty();

      assertThat(session.files.get(RemotePath.file("/web.config"))).isEqualTo("remote");
      assertThat(session.filePaths()).containsExactlyInAnyOrder("/App_Data/db.sqlite", "/Logs/x.log", "/index.html", "/web.config");
   }

   @Test
   void appDataIsDeletedUnlessPreserved() throws Exception {
      createFiles("index.html");
      final var session = new InMemoryRemoteSession().withFile("/App_Data/db.sqlite", "data");

      final var summary = new RemoteSyncEngine(session, settings(10, 1)) //
         .publish(new RuleConfiguration(List.of(), false), source);

      assertThat(summary.getDeletedFiles()).containsExactly("/App_Data/db.sqlite");
      assertThat(summary.getIgnoredFiles()).isEmpty();
   }

   @Test
   void obsoleteDirectoriesAreDeletedDeepestFirst() throws Exception {
      createFiles("index.html");
      final var session = new InMemoryRemoteSession() //
         .withFile("/old/deep/x.txt", "x") //
         .withFile("/old/y.txt", "y") //
         .withFile("/logs/a/b.log", "b") //
         .withFile("/mixed/keep.cfg", "k") //
         .withFile("/mixed/z.txt", "z") //
         .withFile("/App_Data/cache/c.bin", "c");

      final var settings = settings(10, 1);
      settings.deleteEmptyDirectories = true;
      final var rules = new RuleConfiguration(List.of("/logs", "/mixed/keep.cfg"), true);
      final var summary = new RemoteSyncEngine(session, settings).publish(rules, source);

      assertThat(summary.getDeletedFiles()).containsExactlyInAnyOrder("/old/deep/x.txt", "/old/y.txt", "/mixed/z.txt");
      assertThat(summary.getDeletedDirectories()).containsExactly("/old/deep", "/old");
      assertThat(summary.getIgnoredDirectories()).containsExactly("/logs/a", "/logs");
      assertThat(session.ops).containsSubsequence("delete-dir /old/deep", "delete-dir /old");
      assertThat(session.dirPaths()).containsExactlyInAnyOrder("/", "/App_Data", "/App_Data/cache", "/logs", "/logs/a", "/mixed");
   }

   @Test
   void directoriesAreKeptByDefault() throws Exception {
      createFiles("index.html");
      final var session = new InMemoryRemoteSession().withFile("/old/y.txt", "y");

      final var summary = new RemoteSyncEngine(session, settings(10, 1)).publish(RuleConfiguration.NONE, source);

      assertThat(summary.getDeletedFiles()).containsExactly("/old/y.txt");
      assertThat(summary.getDeletedDirectories()).isEmpty();
      assertThat(session.dirs).contains(RemotePath.dir("/old"));
   }

   @Test
   void missingBasePathIsCreated() throws Exception {
      createFiles("a.txt");
      final var session = new InMemoryRemoteSession().withFile("/other.txt", "other");

      final var settings = settings(10, 1);
      settings.basePath = RemotePath.dir("/www/site");
      final var summary = new RemoteSyncEngine(session, settings).publish(RuleConfiguration.NONE, source);

      assertThat(session.ops.get(0)).isEqualTo("mkdir /www/site");
      assertThat(summary.getCreatedDirectories()).containsExactly("/www/site");
      assertThat(summary.getCreatedFiles()).containsExactly("/www/site/a.txt");
      assertThat(session.filePaths()).containsExactlyInAnyOrder("/other.txt", "/www/site/a.txt");
   }

   @Test
   void failingBatchAbortsPublish() throws Exception {
      createFiles("a.txt", "b.txt");
      final var session = new InMemoryRemoteSession();
      session.failBulkUploads = Integer.MAX_VALUE;

      final var engine = new RemoteSyncEngine(session, settings(10, 3));
      assertThatThrownBy(() -> engine.publish(RuleConfiguration.NONE, source)) //
         .isInstanceOfSatisfying(BatchUploadException.class, ex -> assertThat(ex.getBatchNumber()).isEqualTo(1));
      assertThat(session.bulkUploadCalls).isEqualTo(3);
      assertThat(session.files).isEmpty();
   }

   @Test
   void cancelledBeforeStartDoesNothing() throws Exception {
      createFiles("a.txt");
      final var session = new InMemoryRemoteSession().withFile("/old.txt", "old");
      final var cancellation = new CancellationSignal();
      cancellation.cancel("shutdown");

      final var engine = new RemoteSyncEngine(session, settings(10, 1));
      assertThatThrownBy(() -> engine.publish(RuleConfiguration.NONE, source, cancellation)) //
         .isInstanceOf(CancellationException.class) //
         .hasMessageContaining("shutdown");
      assertThat(session.ops).isEmpty();
   }

   @Test
   void cancellationStopsDeletion() throws Exception {
      createFiles("a.txt");
      final var cancellation = new CancellationSignal();
      final var session = new InMemoryRemoteSession() {
         @Override
         public void deleteFile(final RemotePath file) throws RemoteSessionException {
            super.deleteFile(file);
            cancellation.cancel();
         }
      }.withFile("/x1.txt", "1").withFile("/x2.txt", "2");

      final var engine = new RemoteSyncEngine(session, settings(10, 1));
      assertThatThrownBy(() -> engine.publish(RuleConfiguration.NONE, source, cancellation)) //
         .isInstanceOf(CancellationException.class);
      assertThat(session.ops).containsExactly("delete-file /x1.txt");
      assertThat(session.bulkUploadCalls).isZero();
   }

   @Test
   void missingSourceIsRejected() {
      final var engine = new RemoteSyncEngine(new InMemoryRemoteSession());
      assertThatThrownBy(() -> engine.publish(RuleConfiguration.NONE, source.resolve("missing"))) //
         .isInstanceOf(IllegalArgumentException.class);
   }
}
