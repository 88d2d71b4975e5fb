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
package org.jointax.runtime;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit tests for {@link JoinProtocolException}.
 */
class JoinProtocolExceptionTest {
  @Test void testUnknownCode() {
    final JoinProtocolException e =
        JoinProtocolException.unknownCode("JoinStrictness", 7, 7);
    assertThat(e.getMessage(),
        is("Unknown JoinStrictness code 7 on the wire; expected a value in [0, 7)"));
    assertThat(e.enumName(), is("JoinStrictness"));
    assertThat(e.offendingValue(), is("7"));
    assertThat(e, instanceOf(JointaxException.class));
  }

  @Test void testUnknownName() {
    final JoinProtocolException e =
        JoinProtocolException.unknownName("JoinAlgorithm", "nested_loop");
    assertThat(e.getMessage(), is("Unknown JoinAlgorithm name 'nested_loop'"));
    assertThat(e.offendingValue(), is("nested_loop"));
  }
}
