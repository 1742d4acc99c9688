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

package org.sparkbridge;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import org.sparkbridge.serializer.SerializerKind;
import org.sparkbridge.stage.StagingStrategy;

/**
 * Configuration of a bridge application, as key-value pairs.
 *
 * <p>A conf is immutable: every setter returns a new instance, so a conf handed to
 * {@link BridgeContext#create(BridgeConf)} cannot change under the running context.</p>
 *
 * <p>{@code new BridgeConf()} starts from the {@value #DEFAULT_PROPERTIES_FILE} file on the
 * classpath, if present, then applies any Java system property starting with
 * {@code spark.}. Settings made through the setters take priority over both.</p>
 */
public final class BridgeConf {

  public static final String MASTER = "spark.master";
  public static final String APP_NAME = "spark.app.name";
  public static final String LOCAL_DIR = "spark.local.dir";
  public static final String DEFAULT_PARALLELISM = "spark.default.parallelism";

  /** Name of the serializer used when an operation does not ask for one. */
  public static final String SERIALIZER = "spark.bridge.serializer";
  /** Elements per frame for batched serializers. */
  public static final String BATCH_SIZE = "spark.bridge.batch_size";
  /** How parallelize hands data to the engine: "file" or "direct". */
  public static final String STAGING = "spark.bridge.staging";
  /** Label attached to every job, attributing it to this binding layer. */
  public static final String CALL_SITE = "spark.bridge.call_site";

  public static final String DEFAULT_SERIALIZER = SerializerKind.MARSHAL.serializerName();
  public static final int DEFAULT_BATCH_SIZE = 1024;
  public static final String DEFAULT_CALL_SITE = "Java";

  public static final String DEFAULT_PROPERTIES_FILE = "spark-bridge-defaults.conf";

  private final ImmutableMap<String, String> settings;

  public BridgeConf() {
    this(true);
  }

  /**
   * @param loadDefaults whether to read the classpath defaults file and system properties
   */
  public BridgeConf(boolean loadDefaults) {
    this(loadDefaults ? loadDefaults() : ImmutableMap.of());
  }

  private BridgeConf(Map<String, String> settings) {
    this.settings = ImmutableMap.copyOf(new TreeMap<>(settings));
  }

  /** Reads a conf from a properties file. Values are trimmed. */
  public static BridgeConf fromPropertiesFile(File file) throws IOException {
    Preconditions.checkArgument(file.isFile(), "Invalid properties file '%s'.", file);
    try (Reader reader = new InputStreamReader(new FileInputStream(file),
        StandardCharsets.UTF_8)) {
      return new BridgeConf(false).setAll(readProperties(reader));
    }
  }

  public BridgeConf set(String key, String value) {
    Preconditions.checkNotNull(key, "null key");
    Preconditions.checkNotNull(value, "null value for %s", key);
    Map<String, String> copy = new TreeMap<>(settings);
    copy.put(key, value);
    return new BridgeConf(copy);
  }

  public BridgeConf setIfMissing(String key, String value) {
    return contains(key) ? this : set(key, value);
  }

  public BridgeConf setAll(Map<String, String> values) {
    Map<String, String> copy = new TreeMap<>(settings);
    copy.putAll(values);
    return new BridgeConf(copy);
  }

  public BridgeConf remove(String key) {
    Map<String, String> copy = new TreeMap<>(settings);
    copy.remove(key);
    return new BridgeConf(copy);
  }

  public BridgeConf setMaster(String master) {
    return set(MASTER, master);
  }

  public BridgeConf setAppName(String name) {
    return set(APP_NAME, name);
  }

  public boolean contains(String key) {
    return settings.containsKey(key);
  }

  /** @throws NoSuchElementException if the key is not set */
  public String get(String key) {
    String value = settings.get(key);
    if (value == null) {
      throw new NoSuchElementException(key);
    }
    return value;
  }

  public String get(String key, String defaultValue) {
    return settings.getOrDefault(key, defaultValue);
  }

  public Optional<String> getOption(String key) {
    return Optional.ofNullable(settings.get(key));
  }

  /** @throws ConfigException if the value is not an integer */
  public int getInt(String key, int defaultValue) {
    String value = settings.get(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(key + " should be an integer, but was '" + value + "'", e);
    }
  }

  public Map<String, String> getAll() {
    return settings;
  }

  public String serializerName() {
    return get(SERIALIZER, DEFAULT_SERIALIZER);
  }

  public int batchSize() {
    return getInt(BATCH_SIZE, DEFAULT_BATCH_SIZE);
  }

  public StagingStrategy stagingStrategy() {
    return StagingStrategy.fromName(get(STAGING, StagingStrategy.FILE.strategyName()));
  }

  public String callSite() {
    return get(CALL_SITE, DEFAULT_CALL_SITE);
  }

  /**
   * Checks that the conf can back a context.
   *
   * @return this conf
   * @throws ConfigException describing the first invalid setting
   */
  public BridgeConf validate() {
    if (StringUtils.isBlank(settings.get(MASTER))) {
      throw new ConfigException("A master URL must be set in your configuration (" +
        MASTER + ")");
    }
    if (StringUtils.isBlank(settings.get(APP_NAME))) {
      throw new ConfigException("An application name must be set in your configuration (" +
        APP_NAME + ")");
    }
    if (batchSize() < 1) {
      throw new ConfigException(BATCH_SIZE + " must be positive, but was " + batchSize());
    }
    if (!SerializerKind.isRegistered(serializerName())) {
      throw new ConfigException(SERIALIZER + " names an unknown serializer '" +
        serializerName() + "'");
    }
    stagingStrategy();
    if (contains(DEFAULT_PARALLELISM) && getInt(DEFAULT_PARALLELISM, 1) < 1) {
      throw new ConfigException(DEFAULT_PARALLELISM + " must be positive, but was " +
        get(DEFAULT_PARALLELISM));
    }
    return this;
  }

  public String toDebugString() {
    StringBuilder sb = new StringBuilder();
    settings.forEach((k, v) -> sb.append(k).append('=').append(v).append('\n'));
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BridgeConf && ((BridgeConf) o).settings.equals(settings);
  }

  @Override
  public int hashCode() {
    return settings.hashCode();
  }

  @Override
  public String toString() {
    return "BridgeConf" + settings;
  }

  private static Map<String, String> loadDefaults() {
    Map<String, String> defaults = new TreeMap<>();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = BridgeConf.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
      if (in != null) {
        defaults.putAll(readProperties(new InputStreamReader(in, StandardCharsets.UTF_8)));
      }
    } catch (IOException e) {
      throw new ConfigException("Failed to read " + DEFAULT_PROPERTIES_FILE, e);
    }
    Properties system = System.getProperties();
    for (String key : system.stringPropertyNames()) {
      if (key.startsWith("spark.")) {
        defaults.put(key, system.getProperty(key));
      }
    }
    return defaults;
  }

  private static Map<String, String> readProperties(Reader reader) throws IOException {
    Properties props = new Properties();
    props.load(reader);
    Map<String, String> result = new TreeMap<>();
    for (String key : props.stringPropertyNames()) {
      result.put(key, props.getProperty(key).trim());
    }
    return result;
  }
}
