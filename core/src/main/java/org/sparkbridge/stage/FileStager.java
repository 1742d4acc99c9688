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

package org.sparkbridge.stage;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import com.google.common.base.Preconditions;

import org.sparkbridge.SerializerException;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.MDC;
import org.sparkbridge.serializer.Serializer;

/**
 * Writes the encoded collection to a uniquely named file in the context's temp directory,
 * closes it, lets the engine ingest it by path and deletes it. The file is deleted on every
 * exit path, and never before the engine call returned.
 */
public class FileStager implements PartitionStager {

  private static final Logger LOG = LoggerFactory.getLogger(FileStager.class);

  static final String FILE_PREFIX = "to_parallelize";

  private final EngineConnection engine;
  private final File tempDir;

  public FileStager(EngineConnection engine, File tempDir) {
    this.engine = engine;
    this.tempDir = Preconditions.checkNotNull(tempDir, "tempDir");
  }

  @Override
  public StagingStrategy strategy() {
    return StagingStrategy.FILE;
  }

  @Override
  public EngineDataset stage(List<?> data, int numSlices, Serializer serializer) {
    File file;
    try {
      file = File.createTempFile(FILE_PREFIX, ".bin", tempDir);
    } catch (IOException e) {
      throw new SerializerException("Failed to create a staging file in " + tempDir, e);
    }
    try {
      try (OutputStream out = new BufferedOutputStream(new FileOutputStream(file))) {
        serializer.dump(data.iterator(), out);
      }
      LOG.debug("Staged {} elements into {} ({} bytes)", data.size(), file, file.length());
      return engine.readRDDFromFile(file.getAbsolutePath(), numSlices);
    } catch (IOException e) {
      throw new SerializerException("Failed to write staging file " + file, e);
    } finally {
      if (!file.delete() && file.exists()) {
        LOG.warn("Could not delete staging file {}", MDC.of(LogKeys.PATH, file));
      }
    }
  }
}
