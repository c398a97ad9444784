/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ghaverify.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Order-preserving tree of a parsed workflow document.
 *
 * <p>The tree is closed over three variants so that every consumer can handle each shape
 * explicitly. Mapping keys keep their document order and sequences keep their element order,
 * because both are compared as structural evidence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface YamlNode permits YamlNode.Mapping, YamlNode.Sequence, YamlNode.Scalar {

    NodeKind kind();

    /**
     * Deterministic single-line rendering, used wherever a node's content has to be
     * compared or used as a key.
     */
    String toCanonicalString();

    default boolean isMapping() {
        return kind() == NodeKind.MAPPING;
    }

    default boolean isSequence() {
        return kind() == NodeKind.SEQUENCE;
    }

    default boolean isScalar() {
        return kind() == NodeKind.SCALAR;
    }

    static Mapping emptyMapping() {
        return new Mapping(new LinkedHashMap<>());
    }

    static Scalar string(String value) {
        return new Scalar(value, ScalarType.STRING);
    }

    static Sequence sequenceOf(List<? extends YamlNode> items) {
        return new Sequence(new ArrayList<>(items));
    }

    /**
     * A mapping node with string keys in document order.
     */
    record Mapping(Map<String, YamlNode> entries) implements YamlNode {

        public Mapping {
            Objects.requireNonNull(entries, "Entries cannot be null");
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAPPING;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public YamlNode get(String key) {
            return entries.get(key);
        }

        public Mapping getMapping(String key) {
            YamlNode node = entries.get(key);
            return node instanceof Mapping mapping ? mapping : null;
        }

        public Sequence getSequence(String key) {
            YamlNode node = entries.get(key);
            return node instanceof Sequence sequence ? sequence : null;
        }

        /**
         * Returns the text of a scalar entry, or null when the key is absent, not a scalar,
         * or an explicit null.
         */
        public String getString(String key) {
            YamlNode node = entries.get(key);
            if (node instanceof Scalar scalar && scalar.type() != ScalarType.NULL) {
                return scalar.value();
            }
            return null;
        }

        public List<String> keys() {
            return List.copyOf(entries.keySet());
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        /**
         * Returns a copy with {@code key} set to {@code value}, keeping the key's position
         * when it already exists and appending it otherwise.
         */
        public Mapping with(String key, YamlNode value) {
            LinkedHashMap<String, YamlNode> copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new Mapping(copy);
        }

        /**
         * Returns a copy without the given keys.
         */
        public Mapping without(Iterable<String> keys) {
            LinkedHashMap<String, YamlNode> copy = new LinkedHashMap<>(entries);
            for (String key : keys) {
                copy.remove(key);
            }
            return new Mapping(copy);
        }

        @Override
        public String toCanonicalString() {
            return entries.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue().toCanonicalString())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * An ordered sequence node.
     */
    record Sequence(List<YamlNode> items) implements YamlNode {

        public Sequence {
            Objects.requireNonNull(items, "Items cannot be null");
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEQUENCE;
        }

        public YamlNode get(int index) {
            return items.get(index);
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        @Override
        public String toCanonicalString() {
            return items.stream()
                    .map(YamlNode::toCanonicalString)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * A scalar leaf. The value is null only for {@link ScalarType#NULL}.
     */
    record Scalar(String value, ScalarType type) implements YamlNode {

        public Scalar {
            Objects.requireNonNull(type, "Scalar type cannot be null");
            if (type == ScalarType.NULL) {
                value = null;
            } else {
                Objects.requireNonNull(value, "Scalar value cannot be null");
            }
        }

        public static Scalar nullValue() {
            return new Scalar(null, ScalarType.NULL);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SCALAR;
        }

        public boolean isNull() {
            return type == ScalarType.NULL;
        }

        @Override
        public String toCanonicalString() {
            if (type == ScalarType.NULL) {
                return "null";
            }
            if (type == ScalarType.STRING) {
                return "'" + value.replace("'", "''") + "'";
            }
            return value;
        }
    }
}
