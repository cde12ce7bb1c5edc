/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.hexpr.type;

import static java.lang.String.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads operation tables from JSON.
 *
 * <p>The document is an object that maps each operation name to its input
 * and output types:
 *
 * <pre>{@code
 * {
 *   "add":  {"inputs": ["ℝ", "ℝ"], "outputs": ["ℝ"]},
 *   "copy": {"inputs": ["ℝ"], "outputs": ["ℝ", "ℝ"]},
 *   "zero": {"inputs": [], "outputs": ["ℕ"]}
 * }
 * }</pre>
 *
 * <p>A type named "{@code ?}" is unresolved.
 */
public abstract class Signatures {
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);

  private Signatures() {}

  /** Reads a table from a UTF-8 file. */
  public static Signature read(File file) throws IOException {
    return parse(Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  /**
   * Parses a table.
   *
   * @throws IllegalArgumentException if the text is not valid JSON, or does
   *     not have the expected structure
   */
  public static Signature parse(String text) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(
          "expected an object that maps operation names to signatures");
    }
    final Signature signature = Signature.empty();
    final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final String name = field.getKey();
      if (name.isEmpty()) {
        throw new IllegalArgumentException("empty operation name");
      }
      final JsonNode node = field.getValue();
      if (!node.isObject()) {
        throw new IllegalArgumentException(
            format("operation '%s': expected an object with 'inputs' and "
                + "'outputs'", name));
      }
      signature.add(name,
          OperationSignature.of(labels(name, node, "inputs"),
              labels(name, node, "outputs")));
    }
    return signature;
  }

  private static List<ObjectLabel> labels(String name, JsonNode node,
      String key) {
    final JsonNode array = node.get(key);
    if (array == null || !array.isArray()) {
      throw new IllegalArgumentException(
          format("operation '%s': '%s' must be an array of type names",
              name, key));
    }
    final ImmutableList.Builder<ObjectLabel> b = ImmutableList.builder();
    for (JsonNode element : array) {
      if (!element.isTextual() || element.asText().isEmpty()) {
        throw new IllegalArgumentException(
            format("operation '%s': '%s' must be an array of type names",
                name, key));
      }
      b.add(ObjectLabel.parse(element.asText()));
    }
    return b.build();
  }
}

// End Signatures.java
