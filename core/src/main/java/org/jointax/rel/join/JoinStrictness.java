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
 * How a join resolves a row that matches several rows of the other input.
 */
public enum JoinStrictness {
  /** Not given in the query; the planner applies its default. */
  UNSPECIFIED,

  /** Old ANY join. If several rows of the right input match, any one of them
   * is joined. */
  RIGHT_ANY,

  /** Semi join with any value from the filtering input. For a LEFT join,
   * ANY and RIGHT_ANY are the same. */
  ANY,

  /** If several rows match, joins all of them and replicates rows of the
   * other input. The usual semantic of a join. */
  ALL,

  /** For the last join key, picks the closest value according to an
   * {@link AsofJoinInequality}. */
  ASOF,

  /** LEFT or RIGHT. SEMI LEFT keeps the left rows that have a match in the
   * right input; SEMI RIGHT the other way around. */
  SEMI,

  /** LEFT or RIGHT. Like SEMI, but keeps the rows that have no match. */
  ANTI;

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  public void writeTo(DataOutput out) throws IOException {
    JoinCodes.write(out, this);
  }

  public static JoinStrictness readFrom(DataInput in) throws IOException {
    return JoinCodes.read(in, JoinStrictness.class);
  }
}
