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
 * How a join runs over distributed data.
 */
public enum JoinLocality {
  /** Not given in the query; the optimizer picks LOCAL or GLOBAL from the
   * cluster topology. */
  UNSPECIFIED,

  /** Joins using only the data available on the same server (co-located
   * data). */
  LOCAL,

  /** Collects and merges the data from remote servers, then broadcasts it to
   * each server. */
  GLOBAL;

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  public void writeTo(DataOutput out) throws IOException {
    JoinCodes.write(out, this);
  }

  public static JoinLocality readFrom(DataInput in) throws IOException {
    return JoinCodes.read(in, JoinLocality.class);
  }
}
