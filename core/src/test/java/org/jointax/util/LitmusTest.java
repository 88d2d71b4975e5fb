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
package org.jointax.util;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Litmus}.
 */
class LitmusTest {
  @Test void testThrow() {
    assertThat(Litmus.THROW.check(true, "unused"), is(true));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> Litmus.THROW.check(false, "{} is not {}", "LEFT", "INNER"));
    assertThat(e.getMessage(), is("LEFT is not INNER"));
  }

  @Test void testIgnore() {
    assertThat(Litmus.IGNORE.check(true, "unused"), is(true));
    assertThat(Litmus.IGNORE.check(false, "unused"), is(false));
    assertThat(Litmus.IGNORE.fail("{}", "unused"), is(false));
  }
}
