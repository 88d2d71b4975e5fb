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

import org.jointax.config.JointaxSystemProperty;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all exceptions originating from the join taxonomy.
 *
 * @see JoinProtocolException
 */
public class JointaxException extends RuntimeException {
  private static final long serialVersionUID = 4276310839125017654L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(JointaxException.class);

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a JointaxException.
   *
   * @param message error message
   */
  public JointaxException(String message) {
    this(message, null);
  }

  /**
   * Creates a JointaxException.
   *
   * @param message error message
   * @param cause   underlying cause, or null
   */
  public JointaxException(String message, @Nullable Throwable cause) {
    super(message, cause);

    LOGGER.trace("JointaxException", this);
    if (JointaxSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }
}
