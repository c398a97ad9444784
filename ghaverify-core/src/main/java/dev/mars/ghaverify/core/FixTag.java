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

package dev.mars.ghaverify.core;

import dev.mars.ghaverify.core.exceptions.ConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Enabling tags for intentional repairs (smell fixes). A structural or logical delta
 * that belongs to a tagged category is only tolerated when the caller lists the tag
 * in its permitted-fix set.
 *
 * <p>Each tag has a canonical id and may be referred to by the smell identifiers used
 * by the upstream repair tooling (for example {@code smell_3} for permissions).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0.0
 */
public enum FixTag {

    /**
     * Adding or expanding a {@code permissions} block.
     */
    PERMISSIONS("permissions", "Restrict GITHUB_TOKEN permissions", "smell_3"),

    /**
     * Adding (or dropping a stray) {@code timeout-minutes}.
     */
    TIMEOUT("timeout", "Bound job and step run time", "smell_6"),

    /**
     * Adding a {@code concurrency} block or {@code cancel-in-progress}.
     */
    CONCURRENCY("concurrency", "Cancel superseded runs", "smell_7"),

    /**
     * Adding a guard to an {@code if} condition that stops execution on forks.
     */
    FORK_PREVENTION("fork-prevention", "Prevent execution on forked repositories",
            "smell_5", "smell_9", "smell_10", "smell_12"),

    /**
     * Adding {@code paths} or {@code paths-ignore} filters to a trigger.
     */
    PATH_FILTER("path-filter", "Skip runs when no relevant file changed", "smell_8"),

    /**
     * Adding {@code continue-on-error}.
     */
    CONTINUE_ON_ERROR("continue-on-error", "Tolerate failures of non-critical steps"),

    /**
     * Rewriting a {@code run} body to pin package versions.
     */
    PACKAGE_PINNING("package-pinning", "Install packages with explicit versions", "smell_18");

    private final String id;
    private final String description;
    private final List<String> aliases;

    FixTag(String id, String description, String... aliases) {
        this.id = id;
        this.description = description;
        this.aliases = List.of(aliases);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * Resolves a tag from its id or one of its aliases, ignoring case.
     *
     * @param value the id or alias
     * @return the matching tag
     * @throws ConfigurationException if nothing matches
     */
    public static FixTag parse(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("permitted-fixes", "Fix tag cannot be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FixTag tag : values()) {
            if (tag.id.equals(normalized) || tag.aliases.contains(normalized)
                    || tag.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return tag;
            }
        }
        throw new ConfigurationException("permitted-fixes", "Unknown fix tag: " + value);
    }

    /**
     * Parses a comma separated list of tags. The literal {@code all} selects every tag,
     * an empty or null string selects none.
     */
    public static Set<FixTag> parseList(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            return Collections.emptySet();
        }
        if ("all".equalsIgnoreCase(value.trim())) {
            return Collections.unmodifiableSet(EnumSet.allOf(FixTag.class));
        }
        EnumSet<FixTag> tags = EnumSet.noneOf(FixTag.class);
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                tags.add(parse(part));
            }
        }
        return Collections.unmodifiableSet(tags);
    }

    @Override
    public String toString() {
        return id;
    }
}
