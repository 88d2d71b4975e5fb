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
package org.jointax.rel.join;

import com.google.common.base.Enums;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Physical strategy used to execute a join.
 */
public enum JoinAlgorithm {
  /** Deprecated; equivalent to "direct,hash". */
  DEFAULT,
  AUTO,
  HASH,
  PARTIAL_MERGE,
  PREFER_PARTIAL_MERGE,
  PARALLEL_HASH,
  GRACE_HASH,
  DIRECT,
  FULL_SORTING_MERGE;

  private static final Logger LOGGER = LoggerFactory.getLogger(JoinAlgorithm.class);

  /** Algorithms that {@link #DEFAULT} stands for, in order of preference. */
  public static final ImmutableList<JoinAlgorithm> DEFAULT_EXPANSION =
      ImmutableList.of(DIRECT, HASH);

  /** Lower-case name, as used in settings; e.g. "partial_merge". */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  /**
   * Parses a comma-separated list of algorithms, such as
   * "direct,parallel_hash,hash".
   *
   * <p>Names are case-insensitive and surrounding white space is ignored.
   * Duplicates are removed, keeping the first occurrence. "default", and an
   * empty list, expand to {@link #DEFAULT_EXPANSION}.
   *
   * @param value Setting value
   * @return Algorithms in order of preference, never empty
   * @throws IllegalArgumentException if a name is not a known algorithm
   */
  public static ImmutableList<JoinAlgorithm> parseList(String value) {
    final Set<JoinAlgorithm> algorithms = new LinkedHashSet<>();
    for (String name
        : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
      final Optional<JoinAlgorithm> algorithm =
          Enums.getIfPresent(JoinAlgorithm.class, name.toUpperCase(Locale.ROOT));
      if (!algorithm.isPresent()) {
        throw new IllegalArgumentException("Unknown join algorithm '" + name
            + "' in '" + value + "'; expected one of "
            + Joiner.on(", ").join(lowerNames()));
      }
      if (algorithm.get() == DEFAULT) {
        LOGGER.warn("Join algorithm 'default' is deprecated; use '{}'",
            Joiner.on(',').join(lowerNames(DEFAULT_EXPANSION)));
        algorithms.addAll(DEFAULT_EXPANSION);
      } else {
        algorithms.add(algorithm.get());
      }
    }
    if (algorithms.isEmpty()) {
      return DEFAULT_EXPANSION;
    }
    return ImmutableList.copyOf(algorithms);
  }

  private static ImmutableList<String> lowerNames() {
    return lowerNames(ImmutableList.copyOf(values()));
  }

  private static ImmutableList<String> lowerNames(
      ImmutableList<JoinAlgorithm> algorithms) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (JoinAlgorithm algorithm : algorithms) {
      names.add(algorithm.lowerName);
    }
    return names.build();
  }

  public void writeTo(DataOutput out) throws IOException {
    JoinCodes.write(out, this);
  }

  public static JoinAlgorithm readFrom(DataInput in) throws IOException {
    return JoinCodes.read(in, JoinAlgorithm.class);
  }
}
