/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.util;

import java.io.Reader;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import com.vegardit.shipcat.remote.RemotePath;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class YamlUtils {

   public static final String MASKED_VALUE = "********";

   /**
    * Controls how a config field is rendered by {@link YamlUtils#toYamlString(Object)}.
    */
   @Retention(RetentionPolicy.RUNTIME)
   @Target(ElementType.FIELD)
   public @interface ToYamlString {
      boolean ignore() default false;

      /** render a placeholder instead of the actual value, e.g. for passwords */
      boolean mask() default false;

      String name() default "";
   }

   static String camelCaseToHyphen(final String str) {
      final var sb = new StringBuilder(str.length() + 4);
      boolean previousIsLowerCase = false;
      for (final char ch : str.toCharArray()) {
         if (Character.isUpperCase(ch)) {
            if (previousIsLowerCase) {
               sb.append('-');
            }
            sb.append(Character.toLowerCase(ch));
            previousIsLowerCase = false;
         } else {
            sb.append(ch);
            previousIsLowerCase = true;
         }
      }
      return sb.toString();
   }

   /**
    * @return the top-level mapping of the document, an empty map for an empty document
    * @throws IllegalArgumentException if the document's root is not a mapping
    */
   @SuppressWarnings("unchecked")
   public static Map<String, Object> parseYaml(final Reader reader) {
      final var loaderOpts = new LoaderOptions();
      loaderOpts.setAllowDuplicateKeys(false);
      final var dumperOpts = new DumperOptions();
      final var yaml = new Yaml(new SafeConstructor(loaderOpts), new Representer(dumperOpts), dumperOpts, loaderOpts, new Resolver() {
         @Override
         protected void addImplicitResolvers() {
            // keep date-like values such as release names as plain strings
            addImplicitResolver(Tag.STR, TIMESTAMP, "0123456789", 50);
            super.addImplicitResolvers();
         }
      });
      final Object doc = yaml.load(reader);
      if (doc == null)
         return new LinkedHashMap<>();
      if (!(doc instanceof Map))
         throw new IllegalArgumentException("Config file must contain a mapping at top level but found: " + doc.getClass().getSimpleName());
      return new LinkedHashMap<>((Map<String, Object>) doc);
   }

   public static String toYamlString(final Object obj) {
      final var options = new DumperOptions();
      options.setIndent(2);
      options.setPrettyFlow(true);
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      final var representer = new Representer(options) {
         {
            multiRepresenters.put(Path.class, value -> representScalar(Tag.STR, value.toString()));
            representers.put(RemotePath.class, value -> representScalar(Tag.STR, value.toString()));
            representers.put(Duration.class, value -> representScalar(Tag.STR, value.toString()));
         }

         @Override
         protected MappingNode representJavaBean(final Set<Property> properties, final Object javaBean) {
            if (!classTags.containsKey(javaBean.getClass())) {
               // no type tag line for config beans
               addClassTag(javaBean.getClass(), Tag.MAP);
            }
            return super.representJavaBean(properties, javaBean);
         }

         @Override
         protected @Nullable NodeTuple representJavaBeanProperty(final Object javaBean, final Property property,
               final @Nullable Object propertyValue, final Tag customTag) {
            final var anno = property.getAnnotation(ToYamlString.class);
            if (anno != null && anno.ignore())
               return null;

            final Object value;
            if (propertyValue == null) {
               value = "<not configured>";
            } else if (anno != null && anno.mask()) {
               value = MASKED_VALUE;
            } else {
               value = propertyValue;
            }

            final var node = super.representJavaBeanProperty(javaBean, property, value, customTag);
            if (node == null)
               return null;

            final var name = anno == null || anno.name().isEmpty() ? property.getName() : anno.name();
            return new NodeTuple(representData(camelCaseToHyphen(name)), node.getValueNode());
         }
      };

      return new Yaml(representer, options).dump(obj);
   }

   private YamlUtils() {
   }
}
