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

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link JoinCodes} and the {@code writeTo} and
 * {@code readFrom} methods of the join enumerations.
 */
class JoinCodesTest {
  private static <E extends Enum<E>> void checkRoundTrip(Class<E> type)
      throws IOException {
    for (E value : type.getEnumConstants()) {
      final ByteArrayDataOutput out = ByteStreams.newDataOutput();
      JoinCodes.write(out, value);
      final byte[] bytes = out.toByteArray();
      assertThat(bytes.length, is(1));
      assertThat(bytes[0], is((byte) value.ordinal()));
      assertThat(JoinCodes.read(ByteStreams.newDataInput(bytes), type),
          is(value));
    }
  }

  private static <E extends Enum<E>> void checkOutOfRange(Class<E> type) {
    final int count = type.getEnumConstants().length;
    assertThat(JoinCodes.count(type), is(count));
    final JoinProtocolException e =
        assertThrows(JoinProtocolException.class,
            () -> JoinCodes.decode(type, count));
    assertThat(e.enumName(), is(type.getSimpleName()));
    assertThat(e.offendingValue(), is(Integer.toString(count)));
    assertThat(e.getMessage(), containsString(type.getSimpleName()));

    final JoinProtocolException e2 =
        assertThrows(JoinProtocolException.class,
            () -> JoinCodes.read(
                ByteStreams.newDataInput(new byte[] {(byte) 0xFF}), type));
    assertThat(e2.offendingValue(), is("255"));
  }

  private static <E extends Enum<E>> void checkNames(Class<E> type) {
    final Set<String> names = new HashSet<>();
    for (E value : type.getEnumConstants()) {
      assertThat(value.toString().isEmpty(), is(false));
      assertThat(value.toString(), names.add(value.toString()), is(true));
    }
  }

  @Test void testRoundTrip() throws IOException {
    checkRoundTrip(JoinKind.class);
    checkRoundTrip(JoinStrictness.class);
    checkRoundTrip(JoinLocality.class);
    checkRoundTrip(AsofJoinInequality.class);
    checkRoundTrip(JoinAlgorithm.class);
    checkRoundTrip(JoinTableSide.class);
  }

  @Test void testOutOfRange() {
    checkOutOfRange(JoinKind.class);
    checkOutOfRange(JoinStrictness.class);
    checkOutOfRange(JoinLocality.class);
    checkOutOfRange(AsofJoinInequality.class);
    checkOutOfRange(JoinAlgorithm.class);
    checkOutOfRange(JoinTableSide.class);
  }

  @Test void testNamesDistinct() {
    checkNames(JoinKind.class);
    checkNames(JoinStrictness.class);
    checkNames(JoinLocality.class);
    checkNames(AsofJoinInequality.class);
    checkNames(JoinAlgorithm.class);
    checkNames(JoinTableSide.class);
  }

  @Test void testNegativeCode() {
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.decode(JoinKind.class, -1));
  }

  /** Codes are part of the protocol; they must not move. */
  @Test void testCodesAreStable() {
    assertThat(JoinCodes.encode(JoinKind.INNER), is((byte) 0));
    assertThat(JoinCodes.encode(JoinKind.PASTE), is((byte) 6));
    assertThat(JoinCodes.encode(JoinStrictness.UNSPECIFIED), is((byte) 0));
    assertThat(JoinCodes.encode(JoinStrictness.ANTI), is((byte) 6));
    assertThat(JoinCodes.encode(JoinLocality.GLOBAL), is((byte) 2));
    assertThat(JoinCodes.encode(AsofJoinInequality.GREATER_OR_EQUALS),
        is((byte) 4));
    assertThat(JoinCodes.encode(JoinAlgorithm.DEFAULT), is((byte) 0));
    assertThat(JoinCodes.encode(JoinAlgorithm.FULL_SORTING_MERGE),
        is((byte) 8));
    assertThat(JoinCodes.encode(JoinTableSide.RIGHT), is((byte) 1));
  }

  @Test void testWriteToReadFrom() throws IOException {
    final ByteArrayDataOutput out = ByteStreams.newDataOutput();
    JoinKind.FULL.writeTo(out);
    JoinStrictness.SEMI.writeTo(out);
    JoinLocality.LOCAL.writeTo(out);
    AsofJoinInequality.LESS.writeTo(out);
    JoinAlgorithm.GRACE_HASH.writeTo(out);
    JoinTableSide.RIGHT.writeTo(out);
    final byte[] bytes = out.toByteArray();
    assertThat(bytes, is(new byte[] {3, 5, 1, 1, 6, 1}));

    final DataInputStream in =
        new DataInputStream(new ByteArrayInputStream(bytes));
    assertThat(JoinKind.readFrom(in), is(JoinKind.FULL));
    assertThat(JoinStrictness.readFrom(in), is(JoinStrictness.SEMI));
    assertThat(JoinLocality.readFrom(in), is(JoinLocality.LOCAL));
    assertThat(AsofJoinInequality.readFrom(in), is(AsofJoinInequality.LESS));
    assertThat(JoinAlgorithm.readFrom(in), is(JoinAlgorithm.GRACE_HASH));
    assertThat(JoinTableSide.readFrom(in), is(JoinTableSide.RIGHT));
  }

  /** A code that is valid for one enumeration is rejected by a smaller
   * one, instead of being mapped to some default. */
  @Test void testCodeFromLargerEnum() throws IOException {
    final ByteArrayDataOutput out = ByteStreams.newDataOutput();
    JoinKind.COMMA.writeTo(out);
    final JoinProtocolException e =
        assertThrows(JoinProtocolException.class,
            () -> JoinLocality.readFrom(
                ByteStreams.newDataInput(out.toByteArray())));
    assertThat(e.getMessage(),
        is("Unknown JoinLocality code 5 on the wire; expected a value in [0, 3)"));
  }

  @Test void testEndOfStream() {
    final DataInputStream in =
        new DataInputStream(new ByteArrayInputStream(new byte[0]));
    assertThrows(EOFException.class, () -> JoinKind.readFrom(in));
  }

  @Test void testForLowerName() {
    assertThat(JoinCodes.forLowerName(JoinStrictness.class, "right_any"),
        is(JoinStrictness.RIGHT_ANY));
    assertThat(JoinCodes.forLowerName(JoinAlgorithm.class, "partial_merge"),
        is(JoinAlgorithm.PARTIAL_MERGE));
    final JoinProtocolException e =
        assertThrows(JoinProtocolException.class,
            () -> JoinCodes.forLowerName(JoinKind.class, "outer"));
    assertThat(e.enumName(), is("JoinKind"));
    assertThat(e.offendingValue(), is("outer"));
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.forLowerName(JoinKind.class, "LEFT"));
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.forLowerName(JoinKind.class, null));
  }

  /** Names are matched exactly; characters that only case-fold to a
   * constant's name do not match it. */
  @Test void testForLowerNameNoCaseFolding() {
    // dotless i
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.forLowerName(JoinKind.class, "\u0131nner"));
    // long s
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.forLowerName(JoinStrictness.class, "\u017Femi"));
    assertThrows(JoinProtocolException.class,
        () -> JoinCodes.forLowerName(JoinKind.class, "Inner"));
    assertThat(JoinCodes.forLowerName(JoinKind.class, "inner"),
        is(JoinKind.INNER));
  }
}
