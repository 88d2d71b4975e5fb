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

/**
 * Semantics of a join: which rows it keeps ({@link org.jointax.rel.join.JoinKind}),
 * how it resolves multiple matches ({@link org.jointax.rel.join.JoinStrictness}),
 * where it runs ({@link org.jointax.rel.join.JoinLocality}), the comparison of
 * an ASOF join ({@link org.jointax.rel.join.AsofJoinInequality}), and how it is
 * executed ({@link org.jointax.rel.join.JoinAlgorithm}).
 *
 * <p>Planning rules classify joins with the predicates of
 * {@link org.jointax.rel.join.JoinKind}, and call the {@code reverse} methods
 * when they swap the inputs of a join. Plan fragments shipped to another node
 * carry each value as a one-byte code; see
 * {@link org.jointax.rel.join.JoinCodes}.
 */
package org.jointax.rel.join;
