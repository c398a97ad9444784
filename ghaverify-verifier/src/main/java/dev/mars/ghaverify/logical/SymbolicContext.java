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
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.SeqSort;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Symbolic variables shared by every formula of one verification.
 *
 * <p>Owns a single Z3 {@link Context}; it must be closed when the verification is done and must
 * never be shared between threads. Variables are declared lazily and are keyed by context path
 * and copy index. Copy 0 is the run being reasoned about; concurrency checks add copy 1 to model
 * a second, independent run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class SymbolicContext implements AutoCloseable {

    public enum FieldType {
        STRING, BOOLEAN
    }

    /** Job status as seen by {@code failure()} and {@code cancelled()}. */
    public static final String STATUS_FAILURE = "job.status.failure";
    public static final String STATUS_CANCELLED = "job.status.cancelled";

    private static final Map<String, FieldType> KNOWN_FIELDS;

    static {
        Map<String, FieldType> fields = new LinkedHashMap<>();
        fields.put("github.event_name", FieldType.STRING);
        fields.put("github.ref", FieldType.STRING);
        fields.put("github.ref_name", FieldType.STRING);
        fields.put("github.base_ref", FieldType.STRING);
        fields.put("github.head_ref", FieldType.STRING);
        fields.put("github.repository", FieldType.STRING);
        fields.put("github.repository_owner", FieldType.STRING);
        fields.put("github.actor", FieldType.STRING);
        fields.put("github.workflow", FieldType.STRING);
        fields.put("github.event.pull_request.draft", FieldType.BOOLEAN);
        fields.put("github.event.pull_request.head.repo.full_name", FieldType.STRING);
        fields.put("github.event.pull_request.head.repo.fork", FieldType.BOOLEAN);
        fields.put(STATUS_FAILURE, FieldType.BOOLEAN);
        fields.put(STATUS_CANCELLED, FieldType.BOOLEAN);
        KNOWN_FIELDS = Collections.unmodifiableMap(fields);
    }

    private final Logger logger;
    private final Context context;
    private final Map<String, Expr<?>> variables = new LinkedHashMap<>();
    private final Map<String, String> displayNames = new LinkedHashMap<>();
    private final Set<String> unsupportedClauses = new LinkedHashSet<>();
    private boolean closed;

    public SymbolicContext(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        this.context = new Context();
    }

    public static boolean isKnownField(String path) {
        return KNOWN_FIELDS.containsKey(path);
    }

    public static FieldType fieldType(String path) {
        return KNOWN_FIELDS.get(path);
    }

    public Context getContext() {
        ensureOpen();
        return context;
    }

    public SeqSort<CharSort> stringSort() {
        return getContext().getStringSort();
    }

    /**
     * Returns the string variable for a context path, declaring it on first use. Paths outside
     * the known field set are accepted and become unconstrained variables.
     */
    @SuppressWarnings("unchecked")
    public Expr<SeqSort<CharSort>> stringVariable(String path, int copy) {
        ensureOpen();
        String name = variableName("s", path, copy);
        return (Expr<SeqSort<CharSort>>) variables.computeIfAbsent(name, key -> {
            displayNames.put(key, displayName(path, copy));
            return context.mkConst(key, context.getStringSort());
        });
    }

    public BoolExpr booleanVariable(String path, int copy) {
        ensureOpen();
        String name = variableName("b", path, copy);
        return (BoolExpr) variables.computeIfAbsent(name, key -> {
            displayNames.put(key, displayName(path, copy));
            return context.mkBoolConst(key);
        });
    }

    /**
     * Returns the opaque boolean standing for a clause that cannot be encoded. The same clause
     * text always maps to the same atom within this context.
     */
    public BoolExpr atom(String clause, int copy) {
        ensureOpen();
        String name = variableName("atom", clause, copy);
        return (BoolExpr) variables.computeIfAbsent(name, key -> {
            displayNames.put(key, displayName("[" + clause + "]", copy));
            return context.mkBoolConst(key);
        });
    }

    /**
     * Returns the opaque string standing for a value expression that cannot be encoded.
     */
    @SuppressWarnings("unchecked")
    public Expr<SeqSort<CharSort>> opaqueString(String expression, int copy) {
        ensureOpen();
        String name = variableName("opaque", expression, copy);
        return (Expr<SeqSort<CharSort>>) variables.computeIfAbsent(name, key -> {
            displayNames.put(key, displayName("[" + expression + "]", copy));
            return context.mkConst(key, context.getStringSort());
        });
    }

    /**
     * Records a clause that was abstracted away. Each distinct clause is logged once.
     */
    public void recordUnsupported(String clause, String reason) {
        if (unsupportedClauses.add(clause)) {
            logger.warn("Unsupported clause '{}' treated as unconstrained: {}", clause, reason);
        }
    }

    public Set<String> getUnsupportedClauses() {
        return Collections.unmodifiableSet(unsupportedClauses);
    }

    /**
     * Renders the constants assigned by a model as display name to value.
     */
    public Map<String, String> describe(Model model) {
        Map<String, String> valuation = new TreeMap<>();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            String name = decl.getName().toString();
            String display = displayNames.get(name);
            if (display == null) {
                continue;
            }
            Expr<?> value = model.getConstInterp(decl);
            if (value == null) {
                continue;
            }
            if (value.isString()) {
                valuation.put(display, value.getString());
            } else if (value.isTrue() || value.isFalse()) {
                valuation.put(display, Boolean.toString(value.isTrue()));
            } else {
                valuation.put(display, value.toString());
            }
        }
        return valuation;
    }

    public int getVariableCount() {
        return variables.size();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            context.close();
            logger.debug("Closed symbolic context with {} variable(s)", variables.size());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Symbolic context is closed");
        }
    }

    private static String variableName(String prefix, String key, int copy) {
        return prefix + ":" + key + "#" + copy;
    }

    private static String displayName(String path, int copy) {
        return copy == 0 ? path : path + "#" + copy;
    }
}
