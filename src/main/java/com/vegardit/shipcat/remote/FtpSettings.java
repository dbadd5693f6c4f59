/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.remote;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.Strings;

/**
 * Connection parameters of an FTP/FTPS deployment target.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class FtpSettings {

   public static final int DEFAULT_PORT = 21;
   public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

   /**
    * Parses a target URI of the form {@code ftp://host[:port][/base/path]} or {@code ftps://...}. Credentials are taken from the
    * user-info part of the URI unless given explicitly.
    */
   public static FtpSettings fromUri(final URI uri, final @Nullable String username, final @Nullable String password) {
      final var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!"ftp".equals(scheme) && !"ftps".equals(scheme))
         throw new IllegalArgumentException("Unsupported target URI scheme [" + uri.getScheme() + "]. Expected ftp or ftps.");
      if (Strings.isBlank(uri.getHost()))
         throw new IllegalArgumentException("Target URI [" + uri + "] does not specify a host.");

      final var settings = new FtpSettings();
      settings.host = uri.getHost();
      settings.port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
      settings.secure = "ftps".equals(scheme);
      settings.basePath = Strings.isBlank(uri.getPath()) ? RemotePath.ROOT : RemotePath.dir(uri.getPath());

      final var userInfo = uri.getUserInfo();
      if (userInfo != null) {
         final int idx = userInfo.indexOf(':');
         settings.username = idx < 0 ? userInfo : userInfo.substring(0, idx);
         settings.password = idx < 0 ? null : userInfo.substring(idx + 1);
      }
      if (username != null) {
         settings.username = username;
      }
      if (password != null) {
         settings.password = password;
      }
      return settings;
   }

   public String host = "localhost";
   public int port = DEFAULT_PORT;
   public @Nullable String username;
   public @Nullable String password;

   /** use explicit FTPS (AUTH TLS) */
   public boolean secure;
   public boolean passive = true;

   public RemotePath basePath = RemotePath.ROOT;

   public Duration connectTimeout = DEFAULT_TIMEOUT;
   public Duration readTimeout = DEFAULT_TIMEOUT;

   public String toUriString() {
      return (secure ? "ftps" : "ftp") + "://" + host + ":" + port + (basePath.isRoot() ? "" : basePath.getPath());
   }

   /**
    * @throws IllegalArgumentException if a parameter is invalid
    */
   public void validate() {
      if (Strings.isBlank(host))
         throw new IllegalArgumentException("FTP host must not be blank.");
      if (port < 1 || port > 65_535)
         throw new IllegalArgumentException("FTP port " + port + " is out of range.");
      basePath.requireDirectory("base");
      if (connectTimeout.isNegative() || readTimeout.isNegative())
         throw new IllegalArgumentException("FTP timeouts must not be negative.");
   }

   @Override
   public String toString() {
      return toUriString();
   }
}
