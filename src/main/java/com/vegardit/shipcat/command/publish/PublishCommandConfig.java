/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command.publish;

import static com.vegardit.shipcat.util.MapUtils.*;
import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.remote.FtpRemoteSession;
import com.vegardit.shipcat.remote.FtpSettings;
import com.vegardit.shipcat.remote.LocalDirectorySession;
import com.vegardit.shipcat.remote.RemotePath;
import com.vegardit.shipcat.remote.RemoteSession;
import com.vegardit.shipcat.remote.RemoteSessionException;
import com.vegardit.shipcat.sync.RuleConfiguration;
import com.vegardit.shipcat.sync.SyncSettings;
import com.vegardit.shipcat.util.YamlUtils.ToYamlString;

import net.sf.jstuff.core.Strings;

/**
 * Settings of one publish task, merged from command line options, the {@code defaults} section and a {@code publish} task entry of
 * the YAML config file.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class PublishCommandConfig {

   public @Nullable @ToYamlString(ignore = true) Path source;
   public @ToYamlString(name = "source") Path sourceRootAbsolute = lateNonNull(); // computed value

   /** ftp://host[:port][/base/path], ftps://... or a local directory */
   public @Nullable String target;

   public @Nullable String username;
   public @Nullable @ToYamlString(mask = true) String password;

   public @Nullable List<String> excludes;
   public @Nullable Boolean preserveAppData;
   public @Nullable Integer batchSize;
   public @Nullable Integer maxAttempts;
   public @Nullable @ToYamlString(name = "delete-empty-dirs") Boolean deleteEmptyDirectories;
   public @Nullable Boolean verifyUploads;
   public @Nullable Duration connectTimeout;

   /**
    * Applies default values to null settings
    */
   public void applyDefaults() {
      final var defaults = new PublishCommandConfig();
      defaults.excludes = Collections.emptyList();
      defaults.preserveAppData = false;
      defaults.batchSize = SyncSettings.DEFAULT_BATCH_SIZE;
      defaults.maxAttempts = SyncSettings.DEFAULT_MAX_ATTEMPTS;
      defaults.deleteEmptyDirectories = false;
      defaults.verifyUploads = true;
      defaults.connectTimeout = FtpSettings.DEFAULT_TIMEOUT;
      applyFrom(defaults, false);
   }

   /**
    * Applies all non-null settings from the given config object to this config object
    */
   public void applyFrom(final @Nullable PublishCommandConfig other, final boolean override) {
      if (other == null)
         return;

      if (override && other.source != null || source == null) {
         source = other.source;
      }
      if (override && other.target != null || target == null) {
         target = other.target;
      }
      if (override && other.username != null || username == null) {
         username = other.username;
      }
      if (override && other.password != null || password == null) {
         password = other.password;
      }
      if (override && other.excludes != null || excludes == null) {
         excludes = other.excludes;
      }
      if (override && other.preserveAppData != null || preserveAppData == null) {
         preserveAppData = other.preserveAppData;
      }
      if (override && other.batchSize != null || batchSize == null) {
         batchSize = other.batchSize;
      }
      if (override && other.maxAttempts != null || maxAttempts == null) {
         maxAttempts = other.maxAttempts;
      }
      if (override && other.deleteEmptyDirectories != null || deleteEmptyDirectories == null) {
         deleteEmptyDirectories = other.deleteEmptyDirectories;
      }
      if (override && other.verifyUploads != null || verifyUploads == null) {
         verifyUploads = other.verifyUploads;
      }
      if (override && other.connectTimeout != null || connectTimeout == null) {
         connectTimeout = other.connectTimeout;
      }
   }

   /**
    * @return a map with any unused config parameters
    */
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();

      final var cfg = new HashMap<>(config);
      final var other = new PublishCommandConfig();
      other.source = getPath(cfg, "source", true);
      other.target = getString(cfg, "target", true);
      other.username = getString(cfg, "username", true);
      other.password = getString(cfg, "password", true);
      other.excludes = getStringList(cfg, "excludes", true);
      other.preserveAppData = getBoolean(cfg, "preserve-app-data", true);
      other.batchSize = getInteger(cfg, "batch-size", true);
      other.maxAttempts = getInteger(cfg, "max-attempts", true);
      other.deleteEmptyDirectories = getBoolean(cfg, "delete-empty-dirs", true);
      other.verifyUploads = getBoolean(cfg, "verify-uploads", true);
      other.connectTimeout = getDuration(cfg, "connect-timeout", true);
      applyFrom(other, override);
      return cfg;
   }

   /**
    * Validates the settings and computes derived values.
    *
    * @throws IllegalArgumentException if a setting is invalid
    */
   public void compute() {
      final var source = this.source;
      if (source == null)
         throw new IllegalArgumentException("Source directory is not specified.");
      sourceRootAbsolute = source.toAbsolutePath().normalize();
      if (!Files.isDirectory(sourceRootAbsolute))
         throw new IllegalArgumentException("Source directory [" + sourceRootAbsolute + "] does not exist or is not a directory.");

      if (Strings.isBlank(target))
         throw new IllegalArgumentException("Target is not specified.");

      final var batchSize = this.batchSize;
      if (batchSize != null && batchSize < 1)
         throw new IllegalArgumentException("batch-size must be >= 1");
      final var maxAttempts = this.maxAttempts;
      if (maxAttempts != null && maxAttempts < 1)
         throw new IllegalArgumentException("max-attempts must be >= 1");
   }

   public boolean isFtpTarget() {
      final var t = target;
      if (t == null)
         return false;
      final var lower = t.strip().toLowerCase(Locale.ROOT);
      return lower.startsWith("ftp://") || lower.startsWith("ftps://");
   }

   /**
    * Opens a session to the configured target.
    */
   public RemoteSession openSession() throws RemoteSessionException {
      final var t = target;
      if (t == null)
         throw new IllegalStateException("Target is not specified.");

      if (isFtpTarget())
         return FtpRemoteSession.connect(toFtpSettings());

      try {
         final var targetDir = Path.of(t);
         if (!Files.exists(targetDir)) {
            Files.createDirectories(targetDir);
         }
         return new LocalDirectorySession(targetDir);
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("Target [" + t + "] is neither an FTP URI nor a valid path: " + ex.getMessage(), ex);
      } catch (final RemoteSessionException ex) {
         throw ex;
      } catch (final IOException ex) {
         throw new RemoteSessionException("Could not create target directory [" + t + "]", ex);
      }
   }

   public FtpSettings toFtpSettings() {
      final var t = target;
      if (t == null)
         throw new IllegalStateException("Target is not specified.");
      final URI uri;
      try {
         uri = new URI(t.strip());
      } catch (final URISyntaxException ex) {
         throw new IllegalArgumentException("Invalid target URI [" + target + "]: " + ex.getMessage(), ex);
      }
      final var settings = FtpSettings.fromUri(uri, username, password);
      final var timeout = connectTimeout;
      if (timeout != null) {
         settings.connectTimeout = timeout;
      }
      return settings;
   }

   public RuleConfiguration toRuleConfiguration() {
      final var excludes = this.excludes;
      return new RuleConfiguration(excludes == null ? List.of() : excludes, Boolean.TRUE.equals(preserveAppData));
   }

   /**
    * For FTP targets the base path is taken from the path of the target URI.
    */
   public SyncSettings toSyncSettings() {
      final var settings = new SyncSettings();
      if (isFtpTarget()) {
         settings.basePath = toFtpSettings().basePath;
      } else {
         settings.basePath = RemotePath.ROOT;
      }
      final var batchSize = this.batchSize;
      if (batchSize != null) {
         settings.batchSize = batchSize;
      }
      final var maxAttempts = this.maxAttempts;
      if (maxAttempts != null) {
         settings.maxAttempts = maxAttempts;
      }
      settings.deleteEmptyDirectories = Boolean.TRUE.equals(deleteEmptyDirectories);
      settings.verifyUploads = !Boolean.FALSE.equals(verifyUploads);
      return settings;
   }
}
