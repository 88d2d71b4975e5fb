/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jointax.config;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A system property that configures the join taxonomy.
 *
 * <p>Properties live in the "jointax" namespace. Values are taken from the
 * JVM system properties, falling back to a file "jointax.properties" on the
 * class path. Each value is read once, when this class is initialized.
 *
 * @param <T> the type of the property value
 */
public final class JointaxSystemProperty<T> {
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run in debug mode.
   *
   * <p>In debug mode every {@link org.jointax.runtime.JointaxException} is
   * logged at ERROR level as soon as it is created.</p>
   */
  public static final JointaxSystemProperty<Boolean> DEBUG =
      booleanProperty("jointax.debug", false);

  /**
   * Strictness given to a join whose strictness was not specified in the
   * query. One of "ALL", "ANY", "RIGHT_ANY"; an invalid value falls back
   * to "ALL".
   */
  public static final JointaxSystemProperty<String> JOIN_DEFAULT_STRICTNESS =
      stringProperty("jointax.join.default.strictness", "ALL",
          ImmutableSet.of("ALL", "ANY", "RIGHT_ANY"));

  /**
   * Comma-separated list of join algorithms the planner may try, in order
   * of preference, for example "direct,parallel_hash,hash".
   *
   * @see org.jointax.rel.join.JoinAlgorithm#parseList(String)
   */
  public static final JointaxSystemProperty<String> JOIN_ALGORITHM =
      stringProperty("jointax.join.algorithm", "direct,parallel_hash,hash");

  private static JointaxSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new JointaxSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  private static JointaxSystemProperty<String> stringProperty(String key,
      String defaultValue) {
    return new JointaxSystemProperty<>(key, v -> v == null ? defaultValue : v);
  }

  private static JointaxSystemProperty<String> stringProperty(
      String key,
      String defaultValue,
      Set<String> allowedValues) {
    return new JointaxSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      String normalizedValue = v.trim().toUpperCase(Locale.ROOT);
      return allowedValues.contains(normalizedValue) ? normalizedValue : defaultValue;
    });
  }

  private static Properties loadProperties() {
    final Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        JointaxSystemProperty.class.getClassLoader());
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("jointax.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from jointax.properties file", e);
    }

    // System properties override the file
    final Properties allProperties = new Properties();
    for (Properties source : new Properties[] {fileProperties, System.getProperties()}) {
      for (String key : source.stringPropertyNames()) {
        if (key.startsWith("jointax.")) {
          allProperties.setProperty(key, source.getProperty(key));
        }
      }
    }
    return allProperties;
  }

  private final T value;

  private JointaxSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the value of this property. */
  public T value() {
    return value;
  }
}
