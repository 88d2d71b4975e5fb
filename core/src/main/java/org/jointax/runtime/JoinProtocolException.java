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

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a join attribute received from another node cannot be
 * mapped to a known constant.
 *
 * <p>Usually means that the two nodes run incompatible versions of the
 * plan protocol. The reader never substitutes a default value.
 */
public class JoinProtocolException extends JointaxException {
  private static final long serialVersionUID = -6310975524218852213L;

  private final String enumName;
  private final String offendingValue;

  private JoinProtocolException(String message, String enumName,
      String offendingValue) {
    super(message);
    this.enumName = requireNonNull(enumName, "enumName");
    this.offendingValue = requireNonNull(offendingValue, "offendingValue");
  }

  /** Creates an exception for a wire code outside {@code [0, count)}. */
  public static JoinProtocolException unknownCode(String enumName, int code,
      int count) {
    return new JoinProtocolException(
        String.format(Locale.ROOT,
            "Unknown %s code %d on the wire; expected a value in [0, %d)",
            enumName, code, count),
        enumName, Integer.toString(code));
  }

  /** Creates an exception for a name that matches no constant. */
  public static JoinProtocolException unknownName(String enumName,
      String name) {
    return new JoinProtocolException(
        String.format(Locale.ROOT, "Unknown %s name '%s'", enumName, name),
        enumName, name);
  }

  /** Returns the simple name of the enumeration being read,
   * e.g. "JoinKind". */
  public String enumName() {
    return enumName;
  }

  /** Returns the code or name that could not be mapped. */
  public String offendingValue() {
    return offendingValue;
  }
}
