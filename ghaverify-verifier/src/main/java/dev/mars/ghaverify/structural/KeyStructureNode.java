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

package dev.mars.ghaverify.structural;

import dev.mars.ghaverify.workflow.NodeKind;
import dev.mars.ghaverify.workflow.ScalarType;

import java.util.List;
import java.util.Objects;

/**
 * Shape of one node of a workflow document. Mappings record their keys in order, sequences
 * their length and scalars only their primitive type; scalar values are opaque.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record KeyStructureNode(String path, NodeKind kind, List<String> keys, int length, ScalarType scalarType) {

    public KeyStructureNode {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        keys = keys != null ? List.copyOf(keys) : List.of();
    }

    public static KeyStructureNode mapping(String path, List<String> keys) {
        return new KeyStructureNode(path, NodeKind.MAPPING, keys, keys.size(), null);
    }

    public static KeyStructureNode sequence(String path, int length) {
        return new KeyStructureNode(path, NodeKind.SEQUENCE, List.of(), length, null);
    }

    public static KeyStructureNode scalar(String path, ScalarType type) {
        return new KeyStructureNode(path, NodeKind.SCALAR, List.of(), 0, type);
    }
}
