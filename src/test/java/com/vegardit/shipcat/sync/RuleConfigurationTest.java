/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vegardit.shipcat.remote.RemotePath;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class RuleConfigurationTest {

   @Test
   void excludePrefixesAreCaseInsensitiveStringPrefixes() {
      final var rules = new RuleConfiguration(List.of("/Uploads", "logs/", " "), false);

      assertThat(rules.getExcludePrefixes()).containsExactly("/Uploads", "logs/");
      assertThat(rules.isExcluded(RemotePath.file("/uploads/a.jpg"))).isTrue();
      assertThat(rules.isExcluded(RemotePath.file("/UPLOADS.txt"))).isTrue();
      assertThat(rules.isExcluded(RemotePath.dir("/logs"))).isTrue();
      assertThat(rules.isExcluded(RemotePath.file("/logs/today.log"))).isTrue();
      assertThat(rules.isExcluded(RemotePath.file("/logs.txt"))).isFalse();
      assertThat(rules.isExcluded(RemotePath.file("/site/uploads/a.jpg"))).isFalse();
   }

   @Test
   void appDataIsOnlyKeptWhenEnabled() {
      final var file = RemotePath.file("/site/App_Data/db.sqlite");

      assertThat(new RuleConfiguration(List.of(), false).isKept(file)).isFalse();

      final var rules = new RuleConfiguration(List.of(), true);
      assertThat(rules.isKept(file)).isTrue();
      assertThat(rules.isAppData(RemotePath.dir("/site/app_data"))).isTrue();
      assertThat(rules.isAppData(RemotePath.file("/site/App_Data.txt"))).isFalse();
      assertThat(rules.isAppData(RemotePath.dir("/site"))).isFalse();
   }

   @Test
   void customAppDataConvention() {
      final var rules = new RuleConfiguration(List.of(), true, AppDataConvention.directoryNamed("storage"));
      assertThat(rules.isKept(RemotePath.file("/storage/x"))).isTrue();
      assertThat(rules.isKept(RemotePath.file("/App_Data/x"))).isFalse();

      assertThatThrownBy(() -> AppDataConvention.directoryNamed("a/b")).isInstanceOf(IllegalArgumentException.class);
   }
}
