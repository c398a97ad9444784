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

import dev.mars.ghaverify.core.FixTag;
import dev.mars.ghaverify.workflow.NodeKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates the {@link AllowedChangeRules} table for one verification run.
 *
 * <p>In strict mode no rule applies, whatever tags were permitted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RuleMatcher {

    private final AllowedChangeRules rules;
    private final Set<FixTag> permittedFixes;
    private final boolean strictMode;

    public RuleMatcher(AllowedChangeRules rules, Set<FixTag> permittedFixes, boolean strictMode) {
        this.rules = rules;
        this.permittedFixes = permittedFixes == null || permittedFixes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(permittedFixes));
        this.strictMode = strictMode;
    }

    /**
     * Finds the first active rule that permits a change of the given kind at the given path.
     */
    public Optional<AllowedChangeRule> findRule(String path, ChangeKind kind) {
        if (strictMode) {
            return Optional.empty();
        }
        for (AllowedChangeRule rule : rules.getRules()) {
            if (rule.changeKind() == kind && isActive(rule) && rule.pathPattern().covers(path)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean isAllowed(String path, ChangeKind kind) {
        return findRule(path, kind).isPresent();
    }

    /**
     * Type changes are only ever tolerated when a scalar is expanded into a structure,
     * for example {@code permissions: read-all} becoming a per-scope mapping.
     */
    public boolean isTypeChangeAllowed(String path, NodeKind from, NodeKind to) {
        return from == NodeKind.SCALAR && to != NodeKind.SCALAR && isAllowed(path, ChangeKind.TYPE_CHANGE);
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public Set<FixTag> getPermittedFixes() {
        return permittedFixes;
    }

    private boolean isActive(AllowedChangeRule rule) {
        return rule.isUniversal() || permittedFixes.contains(rule.enablingTag());
    }
}
