/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import static org.assertj.core.api.Assertions.*;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockftpserver.fake.FakeFtpServer;
import org.mockftpserver.fake.UserAccount;
import org.mockftpserver.fake.filesystem.DirectoryEntry;
import org.mockftpserver.fake.filesystem.FileEntry;
import org.mockftpserver.fake.filesystem.UnixFakeFileSystem;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class FtpRemoteSessionTest {

   private FakeFtpServer server;
   private UnixFakeFileSystem fs;

   @TempDir
   Path tempDir;

   @BeforeEach
   void startServer() {
      fs = new UnixFakeFileSystem();
      fs.add(new DirectoryEntry("/"));
      fs.add(new DirectoryEntry("/site"));
      fs.add(new FileEntry("/site/old.txt", "old"));

      server = new FakeFtpServer();
      server.setServerControlPort(0);
      server.setSystemName("UNIX");
      server.addUserAccount(new UserAccount("deploy", "secret", "/"));
      server.setFileSystem(fs);
      server.start();
   }

   @AfterEach
   void stopServer() {
      server.stop();
   }

   private FtpSettings settings(final String password) {
      return FtpSettings.fromUri(URI.create("ftp://localhost:" + server.getServerControlPort() + "/site"), "deploy", password);
   }

   @Test
   void uploadListAndDelete() throws Exception {
      final Path a = Files.writeString(tempDir.resolve("a.txt"), "hello");
      final Path b = Files.writeString(tempDir.resolve("b.txt"), "world!");

      try (var session = FtpRemoteSession.connect(settings("secret"))) {
         assertThat(session.getDescription()).startsWith("ftp://localhost:").endsWith("/site");
         assertThat(session.exists(RemotePath.dir("/site"))).isTrue();
         assertThat(session.exists(RemotePath.file("/site/old.txt"))).isTrue();
         assertThat(session.exists(RemotePath.dir("/site/sub"))).isFalse();

         final var sub = RemotePath.dir("/site/sub/deeper");
         session.createDirectory(sub);
         assertThat(fs.isDirectory("/site/sub/deeper")).isTrue();

         assertThat(session.uploadFiles(List.of(a, b), sub, true, true)).isEqualTo(2);
         assertThat(fs.isFile("/site/sub/deeper/a.txt")).isTrue();
         assertThat(((FileEntry) fs.getEntry("/site/sub/deeper/b.txt")).getSize()).isEqualTo(6);

         assertThat(session.list(RemotePath.dir("/site"), true)).containsExactlyInAnyOrder( //
            RemotePath.file("/site/old.txt"), //
            RemotePath.dir("/site/sub"), //
            RemotePath.dir("/site/sub/deeper"), //
            RemotePath.file("/site/sub/deeper/a.txt"), //
            RemotePath.file("/site/sub/deeper/b.txt"));

         session.deleteFile(RemotePath.file("/site/old.txt"));
         assertThat(fs.exists("/site/old.txt")).isFalse();

         session.deleteDirectory(RemotePath.dir("/site/sub"), true);
         assertThat(fs.exists("/site/sub")).isFalse();
      }
   }

   @Test
   void failedOperationsNameThePath() throws Exception {
      try (var session = FtpRemoteSession.connect(settings("secret"))) {
         assertThatThrownBy(() -> session.deleteFile(RemotePath.file("/site/missing.txt"))) //
            .isInstanceOf(RemoteSessionException.class) //
            .hasMessageContaining("/site/missing.txt");
      }
   }

   @Test
   void wrongPasswordFailsToConnect() {
      assertThatThrownBy(() -> FtpRemoteSession.connect(settings("wrong"))) //
         .isInstanceOf(RemoteSessionException.class) //
         .hasMessageContaining("deploy");
   }

   @Test
   void settingsAreParsedFromUri() {
      final var settings = FtpSettings.fromUri(URI.create("ftps://user:pw@example.com/site/wwwroot"), null, null);
      assertThat(settings.host).isEqualTo("example.com");
      assertThat(settings.port).isEqualTo(FtpSettings.DEFAULT_PORT);
      assertThat(settings.secure).isTrue();
      assertThat(settings.username).isEqualTo("user");
      assertThat(settings.password).isEqualTo("pw");
      assertThat(settings.basePath).isEqualTo(RemotePath.dir("/site/wwwroot"));

      assertThatThrownBy(() -> FtpSettings.fromUri(URI.create("sftp://example.com"), null, null)) //
         .isInstanceOf(IllegalArgumentException.class);
   }
}
