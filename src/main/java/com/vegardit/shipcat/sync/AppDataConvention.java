/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.shipcat.sync;

import com.vegardit.shipcat.remote.RemotePath;

/**
 * Classifies remote entries holding persistent application data that must survive a publish.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@FunctionalInterface
public interface AppDataConvention {

   String DEFAULT_DIRECTORY_NAME = "App_Data";

   /**
    * Matches every entry that is named {@code App_Data} or is located below a directory of that name (case-insensitive).
    */
   AppDataConvention DEFAULT = directoryNamed(DEFAULT_DIRECTORY_NAME);

   static AppDataConvention directoryNamed(final String directoryName) {
      if (directoryName.isBlank() || directoryName.indexOf(RemotePath.SEPARATOR) > -1)
         throw new IllegalArgumentException("Invalid app data directory name [" + directoryName + "].");

      return path -> {
         var current = path.isDirectory() ? path : path.getParent();
         while (current != null && !current.isRoot()) {
            if (current.getName().equalsIgnoreCase(directoryName))
               return true;
            current = current.getParent();
         }
         return false;
      };
   }

   boolean isAppData(RemotePath path);
}
