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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pattern over key-structure paths.
 *
 * <p>Segments are separated by dots; sequence indices form their own segment. Supported
 * segment forms are a literal key, {@code *} for any single key, {@code [*]} for any index and
 * {@code **} for any number of segments. A pattern matches a path when it matches the path or
 * one of its ancestors, so a rule for {@code root.permissions} also covers
 * {@code root.permissions.contents}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class PathPattern {

    private static final String ANY_KEY = "*";
    private static final String ANY_INDEX = "[*]";
    private static final String ANY_DEPTH = "**";

    private final String pattern;
    private final List<String> segments;

    private PathPattern(String pattern) {
        this.pattern = pattern;
        this.segments = segments(pattern);
    }

    public static PathPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern cannot be blank");
        }
        return new PathPattern(pattern.trim());
    }

    /**
     * Whether this pattern covers the path itself or one of its ancestors.
     */
    public boolean covers(String path) {
        return match(0, segments(path), 0, true);
    }

    /**
     * Whether this pattern matches exactly the given path.
     */
    public boolean matchesExactly(String path) {
        return match(0, segments(path), 0, false);
    }

    public String getPattern() {
        return pattern;
    }

    private boolean match(int pi, List<String> path, int si, boolean prefix) {
        if (pi == segments.size()) {
            return prefix || si == path.size();
        }
        String expected = segments.get(pi);
        if (ANY_DEPTH.equals(expected)) {
            for (int skip = si; skip <= path.size(); skip++) {
                if (match(pi + 1, path, skip, prefix)) {
                    return true;
                }
            }
            return false;
        }
        if (si == path.size()) {
            return false;
        }
        String actual = path.get(si);
        boolean index = actual.startsWith("[");
        boolean segmentMatches;
        if (ANY_INDEX.equals(expected)) {
            segmentMatches = index;
        } else if (ANY_KEY.equals(expected)) {
            segmentMatches = !index;
        } else {
            segmentMatches = expected.equals(actual);
        }
        return segmentMatches && match(pi + 1, path, si + 1, prefix);
    }

    /**
     * Splits a path such as {@code root.jobs.a.steps[2].run} into
     * {@code [root, jobs, a, steps, [2], run]}.
     */
    static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.') {
                flush(current, result);
            } else if (c == '[') {
                flush(current, result);
                int close = path.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated index in path: " + path);
                }
                result.add(path.substring(i, close + 1));
                i = close;
            } else {
                current.append(c);
            }
        }
        flush(current, result);
        return result;
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return pattern.equals(((PathPattern) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
