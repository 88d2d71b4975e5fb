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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Locale;

/**
 * Which rows of the inputs a join preserves.
 *
 * <p>Declaration order is the wire order; see {@link JoinCodes}.
 */
public enum JoinKind {
  /** Keeps only joined rows. */
  INNER,

  /** Keeps all rows from the left input. Fills the right columns with
   * default values where there is no match. */
  LEFT,

  /** Keeps all rows from the right input. Fills the left columns with
   * default values where there is no match. */
  RIGHT,

  /** Keeps all rows from both inputs. Fills with default values where there
   * is no match. */
  FULL,

  /** Direct product. Strictness and condition do not matter. */
  CROSS,

  /** Same as direct product. Intended to be converted to an INNER join with
   * conditions from WHERE. */
  COMMA,

  /** Stacks the columns of the left and right inputs side by side. There is
   * no condition and no key matching. */
  PASTE;

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  public boolean isLeft() {
    return this == LEFT;
  }

  public boolean isRight() {
    return this == RIGHT;
  }

  public boolean isInner() {
    return this == INNER;
  }

  public boolean isFull() {
    return this == FULL;
  }

  /** Returns whether unmatched rows of some input may need padding with
   * default values; that is, LEFT, RIGHT or FULL. */
  public boolean isOuter() {
    return this == LEFT || this == RIGHT || this == FULL;
  }

  /** Returns whether the join ignores its condition and strictness. */
  public boolean isCrossOrComma() {
    return this == CROSS || this == COMMA;
  }

  public boolean isRightOrFull() {
    return this == RIGHT || this == FULL;
  }

  public boolean isLeftOrFull() {
    return this == LEFT || this == FULL;
  }

  /** Returns whether unmatched rows of the left input are dropped. */
  public boolean isInnerOrRight() {
    return this == INNER || this == RIGHT;
  }

  /** Returns whether unmatched rows of the right input are dropped. */
  public boolean isInnerOrLeft() {
    return this == INNER || this == LEFT;
  }

  public boolean isPaste() {
    return this == PASTE;
  }

  /** Returns whether the left columns of the output may be padded, and
   * therefore must be nullable. */
  public boolean generatesNullsOnLeft() {
    return isRightOrFull();
  }

  /** Returns whether the right columns of the output may be padded, and
   * therefore must be nullable. */
  public boolean generatesNullsOnRight() {
    return isLeftOrFull();
  }

  /**
   * Returns the kind that has the same meaning after the left and right
   * inputs are swapped.
   *
   * <p>LEFT becomes RIGHT and vice versa; every other kind is symmetric and
   * is returned unchanged. Applying this method twice returns the original
   * kind.
   */
  public JoinKind reverse() {
    switch (this) {
    case LEFT:
      return RIGHT;
    case RIGHT:
      return LEFT;
    default:
      return this;
    }
  }

  public void writeTo(DataOutput out) throws IOException {
    JoinCodes.write(out, this);
  }

  public static JoinKind readFrom(DataInput in) throws IOException {
    return JoinCodes.read(in, JoinKind.class);
  }
}
