/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sparkbridge.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.UUID;

import com.google.common.base.Preconditions;

import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.MDC;

public class JavaFileUtils {

  private static final Logger logger = LoggerFactory.getLogger(JavaFileUtils.class);

  private static final int MAX_DIR_CREATION_ATTEMPTS = 10;

  private JavaFileUtils() { }

  /**
   * Create a directory inside the given parent directory with default namePrefix "bridge".
   * The directory is guaranteed to be newly created, and is not marked for automatic deletion.
   */
  public static File createDirectory(String root) throws IOException {
    return createDirectory(root, "bridge");
  }

  /**
   * Create a directory inside the given parent directory. The directory is guaranteed to be
   * newly created, and is not marked for automatic deletion.
   */
  public static File createDirectory(String root, String namePrefix) throws IOException {
    Preconditions.checkNotNull(root, "root directory");
    String prefix = namePrefix == null ? "bridge" : namePrefix;
    int attempts = 0;
    File dir = null;
    while (dir == null) {
      attempts += 1;
      if (attempts > MAX_DIR_CREATION_ATTEMPTS) {
        throw new IOException("Failed to create a temp directory (under " + root + ") after " +
          MAX_DIR_CREATION_ATTEMPTS + " attempts!");
      }
      File candidate = new File(root, prefix + "-" + UUID.randomUUID());
      try {
        // createDirectory (not createDirectories) fails if the name is already taken.
        Files.createDirectories(candidate.getParentFile().toPath());
        Files.createDirectory(candidate.toPath());
        dir = candidate;
      } catch (IOException | SecurityException e) {
        logger.warn("Failed to create directory {}", e, MDC.of(LogKeys.PATH, candidate));
      }
    }
    return dir.getCanonicalFile();
  }

  /**
   * Delete a file or directory and its contents recursively.
   * Don't follow directories if they are symlinks.
   *
   * @param file Input file / dir to be deleted
   * @throws IOException if deletion is unsuccessful
   */
  public static void deleteRecursively(File file) throws IOException {
    if (file == null || !file.exists()) {
      return;
    }
    BasicFileAttributes fileAttributes =
      Files.readAttributes(file.toPath(), BasicFileAttributes.class);
    if (fileAttributes.isDirectory() && !isSymlink(file)) {
      IOException savedIOException = null;
      for (File child : listFilesSafely(file)) {
        try {
          deleteRecursively(child);
        } catch (IOException e) {
          // In case of multiple exceptions, only last one will be thrown
          savedIOException = e;
        }
      }
      if (savedIOException != null) {
        throw savedIOException;
      }
    }

    boolean deleted = file.delete();
    // Delete can also fail if the file simply did not exist.
    if (!deleted && file.exists()) {
      throw new IOException("Failed to delete: " + file.getAbsolutePath());
    }
  }

  private static File[] listFilesSafely(File file) throws IOException {
    File[] files = file.listFiles();
    if (files == null) {
      throw new IOException("Failed to list files for dir: " + file);
    }
    return files;
  }

  private static boolean isSymlink(File file) throws IOException {
    Preconditions.checkNotNull(file);
    File fileInCanonicalDir;
    if (file.getParent() == null) {
      fileInCanonicalDir = file;
    } else {
      fileInCanonicalDir = new File(file.getParentFile().getCanonicalFile(), file.getName());
    }
    return !fileInCanonicalDir.getCanonicalFile().equals(fileInCanonicalDir.getAbsoluteFile());
  }

}
