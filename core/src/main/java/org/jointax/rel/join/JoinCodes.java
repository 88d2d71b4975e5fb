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

import org.jointax.runtime.JoinProtocolException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedBytes;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Wire codec shared by the join enumerations.
 *
 * <p>A constant is written as a single unsigned byte holding its ordinal,
 * so the declaration order of each enumeration is part of the plan
 * protocol: a constant may be appended, but never reordered or removed.
 *
 * <p>A code outside {@code [0, count)} is rejected with a
 * {@link JoinProtocolException}; it is never mapped to a default constant.
 */
public final class JoinCodes {
  private static final Logger LOGGER = LoggerFactory.getLogger(JoinCodes.class);

  /** Constants of each enum class, indexed by code. */
  private static final ClassValue<ImmutableList<?>> CONSTANTS =
      new ClassValue<ImmutableList<?>>() {
        @Override protected ImmutableList<?> computeValue(Class<?> type) {
          return ImmutableList.copyOf(
              requireNonNull(type.getEnumConstants(), type.getName()));
        }
      };

  /** Constants of each enum class, indexed by lower-case name. */
  private static final ClassValue<ImmutableMap<String, ?>> BY_LOWER_NAME =
      new ClassValue<ImmutableMap<String, ?>>() {
        @Override protected ImmutableMap<String, ?> computeValue(Class<?> type) {
          final ImmutableMap.Builder<String, Enum<?>> builder =
              ImmutableMap.builder();
          for (Object constant : CONSTANTS.get(type)) {
            final Enum<?> e = (Enum<?>) constant;
            builder.put(e.name().toLowerCase(Locale.ROOT), e);
          }
          return builder.build();
        }
      };

  private JoinCodes() {}

  /** Returns the wire code of a constant. */
  public static byte encode(Enum<?> value) {
    // throws IllegalArgumentException if an enum outgrows one byte
    return UnsignedBytes.checkedCast(value.ordinal());
  }

  /** Returns the constant with the given wire code.
   *
   * @param type Enum class
   * @param code Code, as an unsigned value
   * @throws JoinProtocolException if no constant has this code
   */
  public static <E extends Enum<E>> E decode(Class<E> type, int code) {
    final List<E> constants = constants(type);
    if (code < 0 || code >= constants.size()) {
      LOGGER.debug("Rejected {} code {}", type.getSimpleName(), code);
      throw JoinProtocolException.unknownCode(type.getSimpleName(), code,
          constants.size());
    }
    return constants.get(code);
  }

  /** Writes a constant as one byte. */
  public static void write(DataOutput out, Enum<?> value) throws IOException {
    out.writeByte(encode(value));
  }

  /** Reads one byte and maps it to a constant. */
  public static <E extends Enum<E>> E read(DataInput in, Class<E> type)
      throws IOException {
    return decode(type, in.readUnsignedByte());
  }

  /** Returns the constant whose lower-case name is {@code name}.
   *
   * <p>The match is exact; no case folding is applied to {@code name}.
   *
   * @throws JoinProtocolException if there is no such constant
   */
  public static <E extends Enum<E>> E forLowerName(Class<E> type,
      @Nullable String name) {
    final Object value = name == null ? null : BY_LOWER_NAME.get(type).get(name);
    if (value != null) {
      return type.cast(value);
    }
    throw JoinProtocolException.unknownName(type.getSimpleName(),
        String.valueOf(name));
  }

  /** Returns the number of codes in use by an enum class. */
  public static int count(Class<? extends Enum<?>> type) {
    return CONSTANTS.get(type).size();
  }

  @SuppressWarnings("unchecked")
  private static <E extends Enum<E>> List<E> constants(Class<E> type) {
    return (List<E>) CONSTANTS.get(type);
  }
}
