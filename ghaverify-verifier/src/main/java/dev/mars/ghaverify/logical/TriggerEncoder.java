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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.ReSort;
import com.microsoft.z3.SeqSort;
import dev.mars.ghaverify.workflow.YamlNode;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Encodes the {@code on} section of a workflow as the condition under which a run starts.
 *
 * <p>Each event contributes {@code github.event_name == event} conjoined with its filters, and
 * the events are disjoined. Branch and tag filters constrain {@code github.ref}; for pull request
 * events branch filters constrain {@code github.base_ref}. Path filters are abstracted to
 * {@code true}. Activity {@code types} and other gating keys become opaque atoms keyed by their
 * content, so identical filters on both sides cancel out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TriggerEncoder {

    private static final String BRANCH_PREFIX = "refs/heads/";
    private static final String TAG_PREFIX = "refs/tags/";

    private static final Set<String> PULL_REQUEST_EVENTS = Set.of("pull_request", "pull_request_target");
    private static final Set<String> REF_KEYS = Set.of("branches", "branches-ignore", "tags", "tags-ignore");
    private static final Set<String> PATH_KEYS = Set.of("paths", "paths-ignore");
    private static final Set<String> NON_GATING_KEYS = Set.of("inputs", "secrets", "outputs");

    private final SymbolicContext symbols;
    private final Logger logger;

    public TriggerEncoder(SymbolicContext symbols, Logger logger) {
        this.symbols = Objects.requireNonNull(symbols, "Symbolic context cannot be null");
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
    }

    public BoolExpr encode(Map<String, YamlNode> triggers) {
        Context ctx = symbols.getContext();
        List<BoolExpr> events = new ArrayList<>();
        for (Map.Entry<String, YamlNode> entry : triggers.entrySet()) {
            events.add(encodeEvent(entry.getKey(), entry.getValue()));
        }
        if (events.isEmpty()) {
            return ctx.mkFalse();
        }
        return events.size() == 1 ? events.get(0) : ctx.mkOr(events.toArray(new BoolExpr[0]));
    }

    private BoolExpr encodeEvent(String event, YamlNode config) {
        Context ctx = symbols.getContext();
        BoolExpr fired = ctx.mkEq(symbols.stringVariable("github.event_name", 0), ctx.mkString(event));

        if (config == null || (config instanceof YamlNode.Scalar scalar && scalar.isNull())) {
            return fired;
        }
        if (!(config instanceof YamlNode.Mapping filters)) {
            return ctx.mkAnd(fired, symbols.atom("on." + event + " = " + config.toCanonicalString(), 0));
        }

        List<BoolExpr> conditions = new ArrayList<>();
        conditions.add(fired);
        conditions.add(encodeRefFilters(event, filters));

        for (String key : filters.keys()) {
            if (REF_KEYS.contains(key) || NON_GATING_KEYS.contains(key)) {
                continue;
            }
            if (PATH_KEYS.contains(key)) {
                logger.debug("Path filter on.{}.{} abstracted to true", event, key);
                continue;
            }
            conditions.add(symbols.atom("on." + event + "." + key + " = " + filters.get(key).toCanonicalString(), 0));
        }
        return ctx.mkAnd(conditions.toArray(new BoolExpr[0]));
    }

    private BoolExpr encodeRefFilters(String event, YamlNode.Mapping filters) {
        Context ctx = symbols.getContext();
        boolean pullRequest = PULL_REQUEST_EVENTS.contains(event);

        YamlNode branches = filters.get("branches");
        YamlNode branchesIgnore = filters.get("branches-ignore");
        // tag filters have no meaning for pull request events
        YamlNode tags = pullRequest ? null : filters.get("tags");
        YamlNode tagsIgnore = pullRequest ? null : filters.get("tags-ignore");

        boolean hasBranchFilter = branches != null || branchesIgnore != null;
        boolean hasTagFilter = tags != null || tagsIgnore != null;
        if (!hasBranchFilter && !hasTagFilter) {
            return ctx.mkTrue();
        }

        Expr<SeqSort<CharSort>> subject = pullRequest
                ? symbols.stringVariable("github.base_ref", 0)
                : symbols.stringVariable("github.ref", 0);
        String branchPrefix = pullRequest ? "" : BRANCH_PREFIX;

        BoolExpr branchCondition = hasBranchFilter
                ? refCondition(event, subject, branchPrefix, branches, branchesIgnore, !pullRequest)
                : ctx.mkFalse();
        BoolExpr tagCondition = hasTagFilter
                ? refCondition(event, subject, TAG_PREFIX, tags, tagsIgnore, true)
                : ctx.mkFalse();
        return ctx.mkOr(branchCondition, tagCondition);
    }

    private BoolExpr refCondition(String event, Expr<SeqSort<CharSort>> subject, String prefix,
                                  YamlNode include, YamlNode exclude, boolean constrainPrefix) {
        Context ctx = symbols.getContext();
        List<BoolExpr> parts = new ArrayList<>();
        if (constrainPrefix) {
            parts.add(ctx.mkPrefixOf(ctx.mkString(prefix), subject));
        }
        if (include != null) {
            parts.add(anyPattern(event, subject, prefix, include));
        }
        if (exclude != null) {
            parts.add(ctx.mkNot(anyPattern(event, subject, prefix, exclude)));
        }
        return ctx.mkAnd(parts.toArray(new BoolExpr[0]));
    }

    private BoolExpr anyPattern(String event, Expr<SeqSort<CharSort>> subject, String prefix, YamlNode patterns) {
        Context ctx = symbols.getContext();
        List<String> values = patternValues(patterns);
        if (values == null) {
            String clause = "on." + event + " ref filter " + patterns.toCanonicalString();
            symbols.recordUnsupported(clause, "filter is not a list of patterns");
            return symbols.atom(clause, 0);
        }
        List<BoolExpr> matches = new ArrayList<>();
        for (String pattern : values) {
            matches.add(matchPattern(event, subject, prefix, pattern));
        }
        if (matches.isEmpty()) {
            return ctx.mkFalse();
        }
        return matches.size() == 1 ? matches.get(0) : ctx.mkOr(matches.toArray(new BoolExpr[0]));
    }

    private BoolExpr matchPattern(String event, Expr<SeqSort<CharSort>> subject, String prefix, String pattern) {
        Context ctx = symbols.getContext();
        if (pattern.startsWith("!") || pattern.indexOf('?') >= 0
                || pattern.indexOf('+') >= 0 || pattern.indexOf('[') >= 0) {
            String clause = "on." + event + " ref pattern '" + pattern + "'";
            symbols.recordUnsupported(clause, "glob syntax is not modelled");
            return symbols.atom(clause, 0);
        }
        if (pattern.indexOf('*') < 0) {
            return ctx.mkEq(subject, ctx.mkString(prefix + pattern));
        }
        return ctx.mkInRe(subject, globToRegex(prefix + pattern));
    }

    /**
     * {@code **} matches any text and {@code *} matches any text without a slash.
     */
    @SuppressWarnings("unchecked")
    private ReExpr<SeqSort<CharSort>> globToRegex(String glob) {
        Context ctx = symbols.getContext();
        ReSort<SeqSort<CharSort>> reSort = ctx.mkReSort(ctx.getStringSort());
        ReExpr<SeqSort<CharSort>> anything = ctx.mkFullRe(reSort);
        ReExpr<SeqSort<CharSort>> slash = ctx.mkToRe(ctx.mkString("/"));
        ReExpr<SeqSort<CharSort>> segment = ctx.mkComplement(ctx.mkConcat(anything, slash, anything));

        List<ReExpr<SeqSort<CharSort>>> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (literal.length() > 0) {
                    parts.add(ctx.mkToRe(ctx.mkString(literal.toString())));
                    literal.setLength(0);
                }
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                parts.add(doubleStar ? anything : segment);
                i += doubleStar ? 2 : 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(ctx.mkToRe(ctx.mkString(literal.toString())));
        }
        ReExpr<SeqSort<CharSort>> regex = parts.get(0);
        for (int k = 1; k < parts.size(); k++) {
            regex = ctx.mkConcat(regex, parts.get(k));
        }
        return regex;
    }

    private static List<String> patternValues(YamlNode node) {
        if (node instanceof YamlNode.Scalar scalar) {
            return scalar.isNull() ? List.of() : List.of(scalar.value());
        }
        if (!(node instanceof YamlNode.Sequence sequence)) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (YamlNode item : sequence.items()) {
            if (!(item instanceof YamlNode.Scalar scalar) || scalar.isNull()) {
                return null;
            }
            values.add(scalar.value());
        }
        return values;
    }
}
