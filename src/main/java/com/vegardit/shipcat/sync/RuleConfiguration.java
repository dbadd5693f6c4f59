/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

import com.vegardit.shipcat.remote.RemotePath;

import net.sf.jstuff.core.Strings;

/**
 * Immutable rules deciding which remote entries survive a publish untouched.
 * <p>
 * An entry is <i>kept</i> if it is classified as application data by the {@link AppDataConvention} (when preserving app data is
 * enabled) or if its normalized path starts with one of the exclude prefixes. Prefix matching is a plain case-insensitive string
 * comparison, i.e. {@code /bin} also matches {@code /binaries.txt}. Prefixes not starting with {@code /} are anchored at the
 * remote root.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RuleConfiguration {

   public static final RuleConfiguration NONE = new RuleConfiguration(Collections.emptyList(), false);

   private static String normalizePrefix(final String prefix) {
      final var p = prefix.strip().replace('\\', '/').toLowerCase(Locale.ROOT);
      return p.startsWith("/") ? p : "/" + p;
   }

   private final List<String> excludePrefixes;
   private final List<String> excludePrefixKeys;
   private final boolean preserveAppData;
   private final AppDataConvention appDataConvention;

   public RuleConfiguration(final Collection<String> excludePrefixes, final boolean preserveAppData) {
      this(excludePrefixes, preserveAppData, AppDataConvention.DEFAULT);
   }

   public RuleConfiguration(final Collection<String> excludePrefixes, final boolean preserveAppData,
         final AppDataConvention appDataConvention) {
      final var prefixes = new LinkedHashSet<String>();
      for (final String prefix : excludePrefixes) {
         if (Strings.isNotBlank(prefix)) {
            prefixes.add(prefix.strip());
         }
      }
      this.excludePrefixes = List.copyOf(prefixes);
      final var keys = new ArrayList<String>(prefixes.size());
      for (final String prefix : prefixes) {
         keys.add(normalizePrefix(prefix));
      }
      excludePrefixKeys = List.copyOf(keys);
      this.preserveAppData = preserveAppData;
      this.appDataConvention = appDataConvention;
   }

   public AppDataConvention getAppDataConvention() {
      return appDataConvention;
   }

   /**
    * @return the exclude prefixes as configured
    */
   public List<String> getExcludePrefixes() {
      return excludePrefixes;
   }

   /**
    * @return true if app data preservation is enabled and the entry is classified as app data
    */
   public boolean isAppData(final RemotePath path) {
      return preserveAppData && appDataConvention.isAppData(path);
   }

   /**
    * @return true if the entry's path starts with any exclude prefix
    */
   public boolean isExcluded(final RemotePath path) {
      if (excludePrefixKeys.isEmpty())
         return false;
      final var key = path.getPath().toLowerCase(Locale.ROOT);
      for (final String prefix : excludePrefixKeys) {
         if (key.startsWith(prefix) || path.isDirectory() && (key + "/").startsWith(prefix))
            return true;
      }
      return false;
   }

   public boolean isKept(final RemotePath path) {
      return isAppData(path) || isExcluded(path);
   }

   public boolean isPreserveAppData() {
      return preserveAppData;
   }

   @Override
   public String toString() {
      return "RuleConfiguration[excludes=" + excludePrefixes + ", preserveAppData=" + preserveAppData + "]";
   }
}
