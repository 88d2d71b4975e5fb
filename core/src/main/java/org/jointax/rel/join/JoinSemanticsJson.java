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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/**
 * Converts {@link JoinSemantics} to and from the JSON used in plan
 * descriptions, for example
 *
 * <blockquote><pre>{"kind": "left", "strictness": "asof",
 *  "locality": "global", "inequality": "less_or_equals",
 *  "algorithms": ["direct", "hash"]}</pre></blockquote>
 *
 * <p>Every value is the {@code lowerName} of a constant. When reading,
 * "kind" is required; a missing "strictness" or "locality" is UNSPECIFIED,
 * a missing "inequality" is NONE, and missing "algorithms" are the
 * configured ones.
 */
public final class JoinSemanticsJson {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
      .configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);

  private JoinSemanticsJson() {}

  /** Converts a join to a JSON object. */
  public static ObjectNode toJson(JoinSemantics semantics) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("kind", semantics.kind.lowerName);
    node.put("strictness", semantics.strictness.lowerName);
    node.put("locality", semantics.locality.lowerName);
    node.put("inequality", semantics.inequality.lowerName);
    final ArrayNode algorithms = node.putArray("algorithms");
    for (JoinAlgorithm algorithm : semantics.algorithms) {
      algorithms.add(algorithm.lowerName);
    }
    return node;
  }

  /** Converts a join to a JSON string. */
  public static String toJsonString(JoinSemantics semantics) {
    return toJson(semantics).toString();
  }

  /** Converts a JSON object to a join.
   *
   * @throws JoinProtocolException if a value is not the name of a
   *   constant, "kind" is missing, or "algorithms" is not an array
   */
  public static JoinSemantics fromJson(JsonNode node) {
    JoinSemantics semantics =
        JoinSemantics.of(JoinCodes.forLowerName(JoinKind.class, text(node, "kind")));
    final String strictness = text(node, "strictness");
    if (strictness != null) {
      semantics = semantics.withStrictness(
          JoinCodes.forLowerName(JoinStrictness.class, strictness));
    }
    final String locality = text(node, "locality");
    if (locality != null) {
      semantics = semantics.withLocality(
          JoinCodes.forLowerName(JoinLocality.class, locality));
    }
    final String inequality = text(node, "inequality");
    if (inequality != null) {
      semantics = semantics.withInequality(
          JoinCodes.forLowerName(AsofJoinInequality.class, inequality));
    }
    final JsonNode algorithms = node.get("algorithms");
    if (algorithms != null && !algorithms.isNull()) {
      if (!algorithms.isArray()) {
        throw JoinProtocolException.unknownName(
            JoinAlgorithm.class.getSimpleName(),
            algorithms.isTextual() ? algorithms.asText() : algorithms.toString());
      }
      final ImmutableList.Builder<JoinAlgorithm> list = ImmutableList.builder();
      for (JsonNode algorithm : algorithms) {
        list.add(JoinCodes.forLowerName(JoinAlgorithm.class, algorithm.asText()));
      }
      semantics = semantics.withAlgorithms(list.build());
    }
    return semantics;
  }

  /** Parses a JSON string to a join. */
  public static JoinSemantics fromJsonString(String json) throws IOException {
    return fromJson(MAPPER.readTree(json));
  }

  private static @Nullable String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
