/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.util;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class MapUtilsTest {

   @Test
   void testGetBoolean() {
      final var map = new HashMap<String, Object>(Map.of("a", true, "b", "yes", "c", " No ", "d", "maybe"));
      assertThat(MapUtils.getBoolean(map, "a", false)).isTrue();
      assertThat(MapUtils.getBoolean(map, "b", false)).isTrue();
      assertThat(MapUtils.getBoolean(map, "c", false)).isFalse();
      assertThat(MapUtils.getBoolean(map, "missing", false)).isNull();
      assertThatThrownBy(() -> MapUtils.getBoolean(map, "d", false)) //
         .isInstanceOf(IllegalArgumentException.class) //
         .hasMessage("Cannot parse attribute [d] with value [maybe] as boolean.");
   }

   @Test
   void testGetDuration() {
      final var map = Map.<String, Object> of("a", 30, "b", "PT2M", "c", "soon");
      assertThat(MapUtils.getDuration(map, "a", false)).isEqualTo(Duration.ofSeconds(30));
      assertThat(MapUtils.getDuration(map, "b", false)).isEqualTo(Duration.ofMinutes(2));
      assertThatThrownBy(() -> MapUtils.getDuration(map, "c", false)).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   void testGetInteger() {
      final var map = Map.<String, Object> of("a", 5, "b", " 7 ", "c", "many");
      assertThat(MapUtils.getInteger(map, "a", false)).isEqualTo(5);
      assertThat(MapUtils.getInteger(map, "b", false)).isEqualTo(7);
      assertThatThrownBy(() -> MapUtils.getInteger(map, "c", false)).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   void testGetStringAndRemove() {
      final var map = new HashMap<String, Object>(Map.of("a", "x", "b", List.of("y")));
      assertThat(MapUtils.getString(map, "a", true)).isEqualTo("x");
      assertThat(map).doesNotContainKey("a");
      assertThatThrownBy(() -> MapUtils.getString(map, "b", false)).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   void testGetStringList() {
      final var map = Map.<String, Object> of("a", List.of("/bin", "logs"), "b", "/web.config", "c", Map.of("x", 1));
      assertThat(MapUtils.getStringList(map, "a", false)).containsExactly("/bin", "logs");
      assertThat(MapUtils.getStringList(map, "b", false)).containsExactly("/web.config");
      assertThat(MapUtils.getStringList(map, "missing", false)).isNull();
      assertThatThrownBy(() -> MapUtils.getStringList(map, "c", false)).isInstanceOf(IllegalArgumentException.class);
   }
}
