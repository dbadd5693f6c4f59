/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.command.publish;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.shipcat.command.AbstractCommand;
import com.vegardit.shipcat.sync.ChangeSummary;
import com.vegardit.shipcat.sync.RemoteSyncEngine;
import com.vegardit.shipcat.util.JdkLoggingUtils;
import com.vegardit.shipcat.util.YamlUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "publish", //
   description = "Publishes a local directory to an FTP/FTPS server or a target directory, deleting obsolete remote files." //
)
public class PublishCommand extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   private final PublishCommandConfig cfgCLI = new PublishCommandConfig();
   private @Nullable PublishCommandConfig cfgYamlDefaults;
   private @Nullable List<PublishCommandConfig> cfgYamlTasks;

   private final List<ChangeSummary> summaries = new ArrayList<>();

   /**
    * @return the summaries of all publish tasks executed so far
    */
   public List<ChangeSummary> getSummaries() {
      return summaries;
   }

   @Override
   protected int execute() throws Exception {
      final var cfgYamlTasks = this.cfgYamlTasks;

      if (cfgCLI.source != null && cfgCLI.target == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameter: 'TARGET'");

      if (cfgCLI.source == null && cfgYamlTasks == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameters: 'SOURCE', 'TARGET'");

      final var taskCfgs = new ArrayList<PublishCommandConfig>();
      try {
         if (cfgYamlTasks == null) {
            cfgCLI.applyFrom(cfgYamlDefaults, false);
            cfgCLI.applyDefaults();
            cfgCLI.compute();
            taskCfgs.add(cfgCLI);
         } else {
            for (final var cfgYamlTask : cfgYamlTasks) {
               cfgYamlTask.applyFrom(cfgCLI, false);
               cfgYamlTask.applyFrom(cfgYamlDefaults, false);
               cfgYamlTask.applyDefaults();
               cfgYamlTask.compute();
               taskCfgs.add(cfgYamlTask);
            }
         }
      } catch (final IllegalArgumentException ex) {
         throw new ParameterException(commandSpec.commandLine(), ex.getMessage(), ex);
      }

      int taskNo = 0;
      for (final var taskCfg : taskCfgs) {
         taskNo++;
         if (taskCfgs.size() > 1) {
            LOG.info("Executing publish task %s of %s...", taskNo, taskCfgs.size());
         }
         LOG.info("Effective config:\n%s", YamlUtils.toYamlString(taskCfg).stripTrailing());

         final ChangeSummary summary;
         try (var session = taskCfg.openSession()) {
            final var engine = new RemoteSyncEngine(session, taskCfg.toSyncSettings());
            summary = engine.publish(taskCfg.toRuleConfiguration(), taskCfg.sourceRootAbsolute, cancellation);
         }
         summaries.add(summary);

         JdkLoggingUtils.withRootLogLevel(Level.INFO, () -> {
            for (final String line : summary.toDisplayValue().split("\n")) {
               LOG.info("%s", line);
            }
            summary.logStats();
         });
      }
      return 0;
   }

   @SuppressWarnings("unchecked")
   @Option(names = "--config", paramLabel = "<path>", description = "Path to a YAML config file.")
   private void setConfig(final String configPath) throws IOException {
      LOG.info("Loading config [%s]...", configPath);
      try (var in = Files.newBufferedReader(Path.of(configPath))) {
         final Map<String, Object> yamlCfg = YamlUtils.parseYaml(in);

         final var yamlDefaults = (Map<String, Object>) yamlCfg.remove("defaults");
         if (yamlDefaults != null) {
            final var cfgYamlDefaults = this.cfgYamlDefaults = new PublishCommandConfig();
            final var unusedParams = cfgYamlDefaults.applyFrom(yamlDefaults, true);
            if (!unusedParams.isEmpty()) {
               yamlCfg.put("defaults", unusedParams);
            }
         }

         final var yamlTasks = (List<Map<String, Object>>) yamlCfg.remove("publish");
         if (yamlTasks != null && !yamlTasks.isEmpty()) {
            final var cfgYamlTasks = this.cfgYamlTasks = new ArrayList<>();
            for (final var yamlTask : yamlTasks) {
               final var taskCfg = new PublishCommandConfig();
               final var unusedParams = taskCfg.applyFrom(yamlTask, true);
               if (!unusedParams.isEmpty()) {
                  ((List<Map<String, Object>>) yamlCfg.computeIfAbsent("publish", k -> new ArrayList<>())).add(unusedParams);
               }
               cfgYamlTasks.add(taskCfg);
            }
         }

         if (!yamlCfg.isEmpty())
            throw new IllegalArgumentException("The following settings found in the config file are unknown:\n" + YamlUtils.toYamlString(
               yamlCfg));
      }
   }

   @Option(names = "--batch-size", paramLabel = "<count>", description = "Number of files uploaded per batch. Default: 20")
   private void setBatchSize(final int batchSize) {
      if (batchSize < 1)
         throw new ParameterException(commandSpec.commandLine(), "--batch-size must be >= 1");
      cfgCLI.batchSize = batchSize;
   }

   @Option(names = "--delete-empty-dirs", description = "Delete remote directories that do not exist in the source directory.")
   private void setDeleteEmptyDirs(final boolean deleteEmptyDirs) {
      cfgCLI.deleteEmptyDirectories = deleteEmptyDirs;
   }

   @Option(names = "--exclude", paramLabel = "<prefix>", description = "Remote path prefix to keep untouched, e.g. /uploads.")
   private void setExcludes(final List<String> excludes) {
      cfgCLI.excludes = excludes;
   }

   @Option(names = "--max-attempts", paramLabel = "<count>", description = "Upload attempts per batch. Default: 3")
   private void setMaxAttempts(final int maxAttempts) {
      if (maxAttempts < 1)
         throw new ParameterException(commandSpec.commandLine(), "--max-attempts must be >= 1");
      cfgCLI.maxAttempts = maxAttempts;
   }

   @Option(names = "--no-verify", description = "Don't compare the remote file size after uploading.")
   private void setNoVerify(final boolean noVerify) {
      cfgCLI.verifyUploads = !noVerify;
   }

   @Option(names = "--password", paramLabel = "<password>", description = "FTP password.")
   private void setPassword(final String password) {
      cfgCLI.password = password;
   }

   @Option(names = "--preserve-app-data", description = "Keep all remote entries located in App_Data directories.")
   private void setPreserveAppData(final boolean preserveAppData) {
      cfgCLI.preserveAppData = preserveAppData;
   }

   @Option(names = "--username", paramLabel = "<user>", description = "FTP user name.")
   private void setUsername(final String username) {
      cfgCLI.username = username;
   }

   @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE", description = "Directory containing the prepared application.")
   private void setSource(final String source) {
      try {
         cfgCLI.source = Path.of(source);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Source path: " + ex.getMessage());
      }
   }

   @Parameters(index = "1", arity = "0..1", paramLabel = "TARGET", description = "ftp://host[:port]/path, ftps://... or a directory.")
   private void setTarget(final String target) {
      cfgCLI.target = target;
   }
}
