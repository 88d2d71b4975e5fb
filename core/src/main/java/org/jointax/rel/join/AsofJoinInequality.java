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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Locale;

/**
 * Comparison applied to the last key of an ASOF join.
 *
 * <p>The inequality is read with the left input's column on the left:
 * {@link #LESS} means {@code left.ts < right.ts}.
 */
public enum AsofJoinInequality {
  /** Not an ASOF predicate. */
  NONE("", ""),
  LESS("less", "<"),
  GREATER("greater", ">"),
  LESS_OR_EQUALS("lessOrEquals", "<="),
  GREATER_OR_EQUALS("greaterOrEquals", ">=");

  private static final ImmutableMap<String, AsofJoinInequality> BY_FUNCTION_NAME =
      ImmutableMap.of(LESS.functionName, LESS,
          GREATER.functionName, GREATER,
          LESS_OR_EQUALS.functionName, LESS_OR_EQUALS,
          GREATER_OR_EQUALS.functionName, GREATER_OR_EQUALS);

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  /** Name of the comparison function, e.g. "lessOrEquals"; empty for
   * {@link #NONE}. */
  public final String functionName;

  /** Comparison operator, e.g. "&lt;="; empty for {@link #NONE}. */
  public final String symbol;

  AsofJoinInequality(String functionName, String symbol) {
    this.functionName = functionName;
    this.symbol = symbol;
  }

  /**
   * Returns the inequality computed by a comparison function.
   *
   * <p>Recognizes exactly "less", "greater", "lessOrEquals" and
   * "greaterOrEquals" (case-sensitive). Any other name, including null and
   * the empty string, gives {@link #NONE}: the call is not an ASOF
   * predicate.
   */
  public static AsofJoinInequality ofFunctionName(@Nullable String functionName) {
    if (functionName == null) {
      return NONE;
    }
    return BY_FUNCTION_NAME.getOrDefault(functionName, NONE);
  }

  /**
   * Returns the inequality that holds after the two operands of the
   * comparison are swapped; {@code a < b} is equivalent to {@code b > a}.
   *
   * <p>Applying this method twice returns the original inequality.
   */
  public AsofJoinInequality reverse() {
    switch (this) {
    case LESS:
      return GREATER;
    case GREATER:
      return LESS;
    case LESS_OR_EQUALS:
      return GREATER_OR_EQUALS;
    case GREATER_OR_EQUALS:
      return LESS_OR_EQUALS;
    case NONE:
      return NONE;
    default:
      throw new AssertionError("unknown: " + this);
    }
  }

  public void writeTo(DataOutput out) throws IOException {
    JoinCodes.write(out, this);
  }

  public static AsofJoinInequality readFrom(DataInput in) throws IOException {
    return JoinCodes.read(in, AsofJoinInequality.class);
  }
}
