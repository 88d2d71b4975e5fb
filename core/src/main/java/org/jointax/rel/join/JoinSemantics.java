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

import org.jointax.config.JointaxSystemProperty;
import org.jointax.util.Litmus;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedBytes;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Semantics of one join: kind, strictness, locality, ASOF inequality and the
 * algorithms the executor may use.
 *
 * <p>Immutable. The {@code with} methods return a modified copy.
 *
 * <p>The enumerations do not check how they are combined; a planner calls
 * {@link #isValid(Litmus)} once the join has been analyzed.
 */
public class JoinSemantics {
  /** Algorithms from {@link JointaxSystemProperty#JOIN_ALGORITHM}. */
  private static final ImmutableList<JoinAlgorithm> DEFAULT_ALGORITHMS =
      JoinAlgorithm.parseList(JointaxSystemProperty.JOIN_ALGORITHM.value());

  /** Largest number of algorithms a join may list. */
  public static final int MAX_ALGORITHMS = 255;

  //~ Instance fields --------------------------------------------------------

  public final JoinKind kind;
  public final JoinStrictness strictness;
  public final JoinLocality locality;

  /** Comparison of the last key; {@link AsofJoinInequality#NONE} unless
   * strictness is ASOF. */
  public final AsofJoinInequality inequality;

  /** Algorithms to try, in order of preference. */
  public final ImmutableList<JoinAlgorithm> algorithms;

  //~ Constructors -----------------------------------------------------------

  protected JoinSemantics(JoinKind kind, JoinStrictness strictness,
      JoinLocality locality, AsofJoinInequality inequality,
      List<JoinAlgorithm> algorithms) {
    this.kind = requireNonNull(kind, "kind");
    this.strictness = requireNonNull(strictness, "strictness");
    this.locality = requireNonNull(locality, "locality");
    this.inequality = requireNonNull(inequality, "inequality");
    this.algorithms = ImmutableList.copyOf(algorithms);
    // the wire form carries the count in one byte
    checkArgument(this.algorithms.size() <= MAX_ALGORITHMS,
        "at most %s algorithms, got %s", MAX_ALGORITHMS,
        this.algorithms.size());
  }

  /** Creates a join of a given kind, with unspecified strictness and
   * locality and the configured algorithms. */
  public static JoinSemantics of(JoinKind kind) {
    return of(kind, JoinStrictness.UNSPECIFIED);
  }

  /** Creates a join of a given kind and strictness, with unspecified
   * locality and the configured algorithms. */
  public static JoinSemantics of(JoinKind kind, JoinStrictness strictness) {
    return new JoinSemantics(kind, strictness, JoinLocality.UNSPECIFIED,
        AsofJoinInequality.NONE, DEFAULT_ALGORITHMS);
  }

  /** Creates a join. */
  public static JoinSemantics of(JoinKind kind, JoinStrictness strictness,
      JoinLocality locality, AsofJoinInequality inequality,
      List<JoinAlgorithm> algorithms) {
    return new JoinSemantics(kind, strictness, locality, inequality,
        algorithms);
  }

  //~ Methods ----------------------------------------------------------------

  public JoinSemantics withKind(JoinKind kind) {
    return kind == this.kind ? this
        : new JoinSemantics(kind, strictness, locality, inequality, algorithms);
  }

  public JoinSemantics withStrictness(JoinStrictness strictness) {
    return strictness == this.strictness ? this
        : new JoinSemantics(kind, strictness, locality, inequality, algorithms);
  }

  public JoinSemantics withLocality(JoinLocality locality) {
    return locality == this.locality ? this
        : new JoinSemantics(kind, strictness, locality, inequality, algorithms);
  }

  public JoinSemantics withInequality(AsofJoinInequality inequality) {
    return inequality == this.inequality ? this
        : new JoinSemantics(kind, strictness, locality, inequality, algorithms);
  }

  public JoinSemantics withAlgorithms(List<JoinAlgorithm> algorithms) {
    return algorithms.equals(this.algorithms) ? this
        : new JoinSemantics(kind, strictness, locality, inequality, algorithms);
  }

  /**
   * Returns the semantics of this join after its inputs are swapped.
   *
   * <p>Reverses the kind (LEFT becomes RIGHT) and the ASOF inequality
   * ({@code <} becomes {@code >}), keeping everything else.
   */
  public JoinSemantics swap() {
    return withKind(kind.reverse()).withInequality(inequality.reverse());
  }

  /**
   * Replaces an unspecified strictness with
   * {@link JointaxSystemProperty#JOIN_DEFAULT_STRICTNESS}.
   *
   * <p>Kinds that ignore strictness (CROSS, COMMA and PASTE) are returned
   * unchanged.
   */
  public JoinSemantics resolve() {
    if (strictness != JoinStrictness.UNSPECIFIED
        || kind.isCrossOrComma()
        || kind.isPaste()) {
      return this;
    }
    return withStrictness(
        JoinStrictness.valueOf(
            JointaxSystemProperty.JOIN_DEFAULT_STRICTNESS.value()));
  }

  /**
   * Checks that kind, strictness and inequality are combined in a way the
   * executor supports.
   *
   * @param litmus What to do if invalid
   * @return Whether valid
   */
  public boolean isValid(Litmus litmus) {
    final boolean takesStrictness = !kind.isCrossOrComma() && !kind.isPaste();
    final boolean asof = strictness == JoinStrictness.ASOF;
    final boolean semiOrAnti = strictness == JoinStrictness.SEMI
        || strictness == JoinStrictness.ANTI;
    return litmus.check(takesStrictness
            || strictness == JoinStrictness.UNSPECIFIED,
            "{} join does not take strictness, got {}", kind, strictness)
        && litmus.check(!asof || kind.isInnerOrLeft(),
            "ASOF join must be INNER or LEFT, got {}", kind)
        && litmus.check(!asof || inequality != AsofJoinInequality.NONE,
            "ASOF join requires an inequality on its last key")
        && litmus.check(!semiOrAnti || kind.isLeft() || kind.isRight(),
            "{} join must be LEFT or RIGHT, got {}", strictness, kind)
        && litmus.check(asof || inequality == AsofJoinInequality.NONE,
            "inequality {} requires ASOF strictness, got {}", inequality,
            strictness)
        && litmus.check(!algorithms.isEmpty(), "no join algorithm");
  }

  /**
   * Returns a description for plan output, such as
   * "GLOBAL LEFT ASOF JOIN (&gt;=)" or "INNER JOIN".
   */
  public String explain() {
    final StringBuilder buf = new StringBuilder();
    if (locality != JoinLocality.UNSPECIFIED) {
      buf.append(locality).append(' ');
    }
    buf.append(kind).append(' ');
    if (strictness != JoinStrictness.UNSPECIFIED) {
      buf.append(strictness).append(' ');
    }
    buf.append("JOIN");
    if (inequality != AsofJoinInequality.NONE) {
      buf.append(" (").append(inequality.symbol).append(')');
    }
    return buf.toString();
  }

  /**
   * Writes this join: kind, strictness, locality, inequality, the number of
   * algorithms, then each algorithm; one byte each.
   */
  public void writeTo(DataOutput out) throws IOException {
    kind.writeTo(out);
    strictness.writeTo(out);
    locality.writeTo(out);
    inequality.writeTo(out);
    out.writeByte(UnsignedBytes.checkedCast(algorithms.size()));
    for (JoinAlgorithm algorithm : algorithms) {
      algorithm.writeTo(out);
    }
  }

  /** Reads a join written by {@link #writeTo(DataOutput)}. */
  public static JoinSemantics readFrom(DataInput in) throws IOException {
    final JoinKind kind = JoinKind.readFrom(in);
    final JoinStrictness strictness = JoinStrictness.readFrom(in);
    final JoinLocality locality = JoinLocality.readFrom(in);
    final AsofJoinInequality inequality = AsofJoinInequality.readFrom(in);
    final int count = in.readUnsignedByte();
    final ImmutableList.Builder<JoinAlgorithm> algorithms =
        ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      algorithms.add(JoinAlgorithm.readFrom(in));
    }
    return new JoinSemantics(kind, strictness, locality, inequality,
        algorithms.build());
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof JoinSemantics
        && kind == ((JoinSemantics) obj).kind
        && strictness == ((JoinSemantics) obj).strictness
        && locality == ((JoinSemantics) obj).locality
        && inequality == ((JoinSemantics) obj).inequality
        && algorithms.equals(((JoinSemantics) obj).algorithms);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, strictness, locality, inequality, algorithms);
  }

  @Override public String toString() {
    return explain() + " " + algorithms;
  }
}
