/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Typed accessors for values of parsed YAML documents.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class MapUtils {

   private static @Nullable Object getValue(final Map<String, ?> map, final String key, final boolean remove) {
      return remove ? map.remove(key) : map.get(key);
   }

   public static @Nullable Boolean getBoolean(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null; // CHECKSTYLE:IGNORE .*
      if (value instanceof final Boolean b)
         return b;
      final var str = value.toString().strip();
      if ("true".equalsIgnoreCase(str) || "yes".equalsIgnoreCase(str))
         return Boolean.TRUE;
      if ("false".equalsIgnoreCase(str) || "no".equalsIgnoreCase(str))
         return Boolean.FALSE;
      throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as boolean.");
   }

   /**
    * Accepts ISO-8601 durations ({@code PT30S}) or a plain number of seconds.
    */
   public static @Nullable Duration getDuration(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof final Number n)
         return Duration.ofSeconds(n.longValue());
      try {
         return Duration.parse(value.toString().strip());
      } catch (final DateTimeParseException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as duration. " + ex
            .getMessage(), ex);
      }
   }

   public static @Nullable Integer getInteger(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof final Number n)
         return n.intValue();
      try {
         return Integer.parseInt(value.toString().strip());
      } catch (final NumberFormatException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as integer. " + ex
            .getMessage(), ex);
      }
   }

   public static @Nullable Path getPath(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      try {
         return Path.of(value.toString());
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as path. " + ex.getMessage(),
            ex);
      }
   }

   public static @Nullable String getString(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof Map || value instanceof List)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as string.");
      return value.toString();
   }

   /**
    * A single scalar value is treated as a list with one element.
    */
   public static @Nullable List<String> getStringList(final Map<String, ?> map, final String key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      final var result = new ArrayList<String>();
      if (value instanceof final List<?> list) {
         for (final Object item : list) {
            if (item == null || item instanceof Map || item instanceof List)
               throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list of strings.");
            result.add(item.toString());
         }
         return result;
      }
      if (value instanceof Map)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list.");
      result.add(value.toString());
      return result;
   }

   private MapUtils() {
   }
}
