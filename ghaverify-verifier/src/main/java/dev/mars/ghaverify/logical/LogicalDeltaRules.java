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

package dev.mars.ghaverify.logical;

import dev.mars.ghaverify.core.FixTag;
import dev.mars.ghaverify.logical.expression.Comparison;
import dev.mars.ghaverify.logical.expression.ContextRef;
import dev.mars.ghaverify.logical.expression.Expression;
import dev.mars.ghaverify.logical.expression.Expressions;
import dev.mars.ghaverify.logical.expression.Literal;
import dev.mars.ghaverify.logical.expression.Not;
import dev.mars.ghaverify.logical.expression.Or;
import dev.mars.ghaverify.workflow.YamlNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Recognised deltas in gating conditions that a smell fix is allowed to introduce.
 *
 * <p>A rule only applies when its enabling tag is permitted and strict mode is off. The rules
 * recognise the shape of a delta; where a rule leaves a residue (the fork guard rule), the caller
 * still has to prove the residue equivalent to the original condition.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class LogicalDeltaRules {

    private static final String REPOSITORY = "github.repository";
    private static final String REPOSITORY_OWNER = "github.repository_owner";
    private static final String EVENT_NAME = "github.event_name";
    private static final String HEAD_FULL_NAME = "github.event.pull_request.head.repo.full_name";
    private static final String HEAD_FORK = "github.event.pull_request.head.repo.fork";

    private static final Set<String> PATH_KEYS = Set.of("paths", "paths-ignore");

    private final Set<FixTag> permittedFixes;
    private final boolean strictMode;

    public LogicalDeltaRules(Set<FixTag> permittedFixes, boolean strictMode) {
        this.permittedFixes = Set.copyOf(Objects.requireNonNull(permittedFixes, "Permitted fixes cannot be null"));
        this.strictMode = strictMode;
    }

    public boolean isEnabled(FixTag tag) {
        return !strictMode && permittedFixes.contains(tag);
    }

    /**
     * Removes top-level fork guard conjuncts from a modified condition.
     *
     * @return the remaining condition, or empty when the rule is disabled or no guard was found
     */
    public Optional<Expression> stripForkGuards(Expression modified) {
        if (!isEnabled(FixTag.FORK_PREVENTION)) {
            return Optional.empty();
        }
        List<Expression> residue = new ArrayList<>();
        boolean removed = false;
        for (Expression conjunct : Expressions.conjuncts(modified)) {
            if (isForkGuard(conjunct) || isScopedForkGuard(conjunct)) {
                removed = true;
            } else {
                residue.add(conjunct);
            }
        }
        return removed ? Optional.of(Expressions.conjunction(residue)) : Optional.empty();
    }

    /**
     * True when the modified triggers equal the original ones once newly added
     * {@code paths} and {@code paths-ignore} filters are dropped.
     */
    public boolean isPathFilterAddition(Map<String, YamlNode> original, Map<String, YamlNode> modified) {
        if (!isEnabled(FixTag.PATH_FILTER) || !original.keySet().equals(modified.keySet())) {
            return false;
        }
        boolean added = false;
        Map<String, YamlNode> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, YamlNode> entry : modified.entrySet()) {
            YamlNode before = original.get(entry.getKey());
            YamlNode after = entry.getValue();
            if (after instanceof YamlNode.Mapping config && before instanceof YamlNode.Mapping previous) {
                List<String> newKeys = new ArrayList<>();
                for (String key : PATH_KEYS) {
                    if (config.containsKey(key) && !previous.containsKey(key)) {
                        newKeys.add(key);
                    }
                }
                added |= !newKeys.isEmpty();
                after = config.without(newKeys);
            }
            stripped.put(entry.getKey(), after);
        }
        return added && canonical(stripped).equals(canonical(original));
    }

    /**
     * True for a concurrency block added where none existed, or for {@code cancel-in-progress}
     * added to a block whose group is unchanged.
     */
    public boolean isConcurrencyAddition(YamlNode original, YamlNode modified) {
        if (!isEnabled(FixTag.CONCURRENCY) || modified == null) {
            return false;
        }
        if (original == null) {
            return true;
        }
        String originalGroup = groupOf(original);
        String modifiedGroup = groupOf(modified);
        boolean originalCancels = original instanceof YamlNode.Mapping mapping && mapping.containsKey("cancel-in-progress");
        boolean modifiedCancels = modified instanceof YamlNode.Mapping mapping && mapping.containsKey("cancel-in-progress");
        return originalGroup != null && originalGroup.equals(modifiedGroup) && !originalCancels && modifiedCancels;
    }

    static boolean isForkGuard(Expression expression) {
        if (expression instanceof Not not) {
            return isRef(not.operand(), HEAD_FORK);
        }
        if (!(expression instanceof Comparison comparison)) {
            return false;
        }
        Expression left = comparison.left();
        Expression right = comparison.right();
        if (comparison.operator() == Comparison.Operator.EQ) {
            return isRefAgainstString(left, right, REPOSITORY_OWNER)
                    || isRefAgainstString(left, right, REPOSITORY)
                    || (isRef(left, HEAD_FULL_NAME) && isRef(right, REPOSITORY))
                    || (isRef(left, REPOSITORY) && isRef(right, HEAD_FULL_NAME))
                    || isRefAgainstBoolean(left, right, HEAD_FORK, false);
        }
        if (comparison.operator() == Comparison.Operator.NE) {
            return isRefAgainstBoolean(left, right, HEAD_FORK, true);
        }
        return false;
    }

    /**
     * A guard limited to some events, as in {@code github.event_name == 'push' || <guard>}.
     */
    static boolean isScopedForkGuard(Expression expression) {
        if (!(expression instanceof Or or)) {
            return false;
        }
        return (isEventNameTest(or.left()) && isForkGuard(or.right()))
                || (isForkGuard(or.left()) && isEventNameTest(or.right()));
    }

    private static boolean isEventNameTest(Expression expression) {
        return expression instanceof Comparison comparison
                && (comparison.operator() == Comparison.Operator.EQ || comparison.operator() == Comparison.Operator.NE)
                && isRefAgainstString(comparison.left(), comparison.right(), EVENT_NAME);
    }

    private static boolean isRef(Expression expression, String path) {
        return expression instanceof ContextRef ref && ref.path().equals(path);
    }

    private static boolean isRefAgainstString(Expression left, Expression right, String path) {
        return (isRef(left, path) && isLiteral(right, Literal.Type.STRING))
                || (isRef(right, path) && isLiteral(left, Literal.Type.STRING));
    }

    private static boolean isRefAgainstBoolean(Expression left, Expression right, String path, boolean value) {
        return (isRef(left, path) && isBoolean(right, value)) || (isRef(right, path) && isBoolean(left, value));
    }

    private static boolean isLiteral(Expression expression, Literal.Type type) {
        return expression instanceof Literal literal && literal.type() == type;
    }

    private static boolean isBoolean(Expression expression, boolean value) {
        return expression instanceof Literal literal && (value ? literal.isTrue() : literal.isFalse());
    }

    private static String groupOf(YamlNode concurrency) {
        if (concurrency instanceof YamlNode.Scalar scalar) {
            return scalar.value();
        }
        if (concurrency instanceof YamlNode.Mapping mapping) {
            return mapping.getString("group");
        }
        return null;
    }

    private static String canonical(Map<String, YamlNode> triggers) {
        return new YamlNode.Mapping(new LinkedHashMap<>(triggers)).toCanonicalString();
    }
}
