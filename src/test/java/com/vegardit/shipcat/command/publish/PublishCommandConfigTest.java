/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command.publish;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vegardit.shipcat.remote.RemotePath;
import com.vegardit.shipcat.sync.SyncSettings;
import com.vegardit.shipcat.util.YamlUtils;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class PublishCommandConfigTest {

   @TempDir
   Path tempDir;

   @Test
   void testApplyFromMap() {
      final var cfg = new PublishCommandConfig();
      final var yaml = new HashMap<String, Object>();
      yaml.put("source", "build/site");
      yaml.put("target", "ftp://example.com/www");
      yaml.put("excludes", List.of("/App_Data", "/web.config"));
      yaml.put("batch-size", 5);
      yaml.put("delete-empty-dirs", "yes");
      yaml.put("connect-timeout", "PT10S");
      yaml.put("colour", "blue");

      final var unused = cfg.applyFrom(yaml, true);

      assertThat(unused).containsOnlyKeys("colour");
      assertThat(yaml).containsKey("source"); // input is not modified
      assertThat(cfg.source).isEqualTo(Path.of("build/site"));
      assertThat(cfg.target).isEqualTo("ftp://example.com/www");
      assertThat(cfg.excludes).containsExactly("/App_Data", "/web.config");
      assertThat(cfg.batchSize).isEqualTo(5);
      assertThat(cfg.deleteEmptyDirectories).isTrue();
      assertThat(cfg.connectTimeout).isEqualTo(Duration.ofSeconds(10));
   }

   @Test
   void testApplyFromPrecedence() {
      final var cli = new PublishCommandConfig();
      cli.batchSize = 7;

      final var task = new PublishCommandConfig();
      task.batchSize = 3;
      task.maxAttempts = 2;

      final var defaults = new PublishCommandConfig();
      defaults.maxAttempts = 9;
      defaults.username = "deploy";

      task.applyFrom(cli, false);
      task.applyFrom(defaults, false);
      assertThat(task.batchSize).isEqualTo(3);
      assertThat(task.maxAttempts).isEqualTo(2);
      assertThat(task.username).isEqualTo("deploy");

      task.applyFrom(cli, true);
      assertThat(task.batchSize).isEqualTo(7);
      assertThat(task.maxAttempts).isEqualTo(2);
   }

   @Test
   void testApplyDefaults() {
      final var cfg = new PublishCommandConfig();
      cfg.batchSize = 50;
      cfg.applyDefaults();
      assertThat(cfg.batchSize).isEqualTo(50);
      assertThat(cfg.maxAttempts).isEqualTo(SyncSettings.DEFAULT_MAX_ATTEMPTS);
      assertThat(cfg.excludes).isEmpty();
      assertThat(cfg.preserveAppData).isFalse();
      assertThat(cfg.verifyUploads).isTrue();
   }

   @Test
   void testCompute() {
      final var cfg = new PublishCommandConfig();
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Source");

      cfg.source = tempDir.resolve("missing");
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("does not exist");

      cfg.source = tempDir;
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Target");

      cfg.target = "ftp://example.com";
      cfg.batchSize = 0;
      assertThatThrownBy(cfg::compute).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("batch-size");

      cfg.batchSize = 1;
      cfg.compute();
      assertThat(cfg.sourceRootAbsolute).isEqualTo(tempDir.toAbsolutePath().normalize());
   }

   @Test
   void testFtpTarget() {
      final var cfg = new PublishCommandConfig();
      cfg.target = "FTPS://ci@ftp.example.com:2121/www/site";
      cfg.password = "secret";
      cfg.batchSize = 4;
      cfg.verifyUploads = false;
      assertThat(cfg.isFtpTarget()).isTrue();

      final var ftp = cfg.toFtpSettings();
      assertThat(ftp.secure).isTrue();
      assertThat(ftp.host).isEqualTo("ftp.example.com");
      assertThat(ftp.port).isEqualTo(2121);
      assertThat(ftp.username).isEqualTo("ci");
      assertThat(ftp.password).isEqualTo("secret");

      final var sync = cfg.toSyncSettings();
      assertThat(sync.basePath).isEqualTo(RemotePath.dir("/www/site"));
      assertThat(sync.batchSize).isEqualTo(4);
      assertThat(sync.verifyUploads).isFalse();
   }

   @Test
   void testLocalTarget() {
      final var cfg = new PublishCommandConfig();
      cfg.target = tempDir.toString();
      cfg.excludes = List.of("/logs");
      cfg.preserveAppData = true;
      assertThat(cfg.isFtpTarget()).isFalse();
      assertThat(cfg.toSyncSettings().basePath).isEqualTo(RemotePath.ROOT);

      final var rules = cfg.toRuleConfiguration();
      assertThat(rules.getExcludePrefixes()).containsExactly("/logs");
      assertThat(rules.isPreserveAppData()).isTrue();
   }

   @Test
   void testPasswordIsMasked() {
      final var cfg = new PublishCommandConfig();
      cfg.source = tempDir;
      cfg.target = "ftp://example.com";
      cfg.password = "top-secret";
      cfg.applyDefaults();
      cfg.compute();

      final var yaml = YamlUtils.toYamlString(cfg);
      assertThat(yaml).doesNotContain("top-secret").contains(YamlUtils.MASKED_VALUE).contains("delete-empty-dirs: false");
   }
}
