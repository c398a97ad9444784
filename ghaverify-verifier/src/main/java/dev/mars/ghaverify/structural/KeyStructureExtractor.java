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

import dev.mars.ghaverify.workflow.YamlNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a workflow tree into a path-indexed map of {@link KeyStructureNode}s.
 * Paths look like {@code root}, {@code root.jobs.build} or {@code root.jobs.build.steps[0].uses};
 * the map iterates in document order.
 */
public final class KeyStructureExtractor {

    public static final String ROOT = "root";

    private KeyStructureExtractor() {
    }

    public static Map<String, KeyStructureNode> extract(YamlNode root) {
        Map<String, KeyStructureNode> result = new LinkedHashMap<>();
        walk(ROOT, root, result);
        return result;
    }

    private static void walk(String path, YamlNode node, Map<String, KeyStructureNode> result) {
        if (node instanceof YamlNode.Mapping mapping) {
            result.put(path, KeyStructureNode.mapping(path, mapping.keys()));
            for (Map.Entry<String, YamlNode> entry : mapping.entries().entrySet()) {
                walk(path + "." + entry.getKey(), entry.getValue(), result);
            }
        } else if (node instanceof YamlNode.Sequence sequence) {
            result.put(path, KeyStructureNode.sequence(path, sequence.size()));
            for (int i = 0; i < sequence.size(); i++) {
                walk(path + "[" + i + "]", sequence.get(i), result);
            }
        } else if (node instanceof YamlNode.Scalar scalar) {
            result.put(path, KeyStructureNode.scalar(path, scalar.type()));
        }
    }

    /**
     * Whether {@code path} lies strictly below {@code ancestor}.
     */
    public static boolean isDescendant(String path, String ancestor) {
        return path.length() > ancestor.length()
                && path.startsWith(ancestor)
                && (path.charAt(ancestor.length()) == '.' || path.charAt(ancestor.length()) == '[');
    }

    /**
     * Path of the enclosing node, or null for the root.
     */
    public static String parentOf(String path) {
        int dot = path.lastIndexOf('.');
        int bracket = path.lastIndexOf('[');
        int cut = Math.max(dot, bracket);
        return cut > 0 ? path.substring(0, cut) : null;
    }
}
