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
import com.microsoft.z3.SeqSort;
import dev.mars.ghaverify.logical.expression.And;
import dev.mars.ghaverify.logical.expression.Comparison;
import dev.mars.ghaverify.logical.expression.Contains;
import dev.mars.ghaverify.logical.expression.ContextRef;
import dev.mars.ghaverify.logical.expression.EndsWith;
import dev.mars.ghaverify.logical.expression.Expression;
import dev.mars.ghaverify.logical.expression.Expressions;
import dev.mars.ghaverify.logical.expression.FunctionCall;
import dev.mars.ghaverify.logical.expression.Literal;
import dev.mars.ghaverify.logical.expression.Not;
import dev.mars.ghaverify.logical.expression.Or;
import dev.mars.ghaverify.logical.expression.StartsWith;

import java.util.Objects;

/**
 * Translates expressions into Z3 formulas over a {@link SymbolicContext}.
 *
 * <p>Strings compare case-sensitively. Anything outside the modelled fragment (relational
 * operators, operands of different types, functions other than the status functions and the
 * string predicates) becomes an opaque atom keyed by its canonical text and is recorded as
 * unsupported.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ExpressionEncoder {

    private enum TermType {
        STRING, BOOLEAN, NUMBER, NULL
    }

    private record Term(TermType type, Expr<?> expr, String literal) {

        @SuppressWarnings("unchecked")
        Expr<SeqSort<CharSort>> string() {
            return (Expr<SeqSort<CharSort>>) expr;
        }

        BoolExpr bool() {
            return (BoolExpr) expr;
        }
    }

    private final SymbolicContext symbols;
    private final int copy;

    public ExpressionEncoder(SymbolicContext symbols) {
        this(symbols, 0);
    }

    public ExpressionEncoder(SymbolicContext symbols, int copy) {
        this.symbols = Objects.requireNonNull(symbols, "Symbolic context cannot be null");
        this.copy = copy;
    }

    /**
     * Encodes an expression in condition position, applying the usual truthiness rules.
     */
    public BoolExpr encodeCondition(Expression expression) {
        return truthy(encode(expression));
    }

    /**
     * Encodes a job or step {@code if}. A condition that calls none of the status functions
     * only runs while no earlier job or step failed or was cancelled, so it is conjoined with
     * {@code success()}.
     */
    public BoolExpr encodeRunCondition(Expression expression) {
        BoolExpr condition = encodeCondition(expression);
        if (Expressions.callsStatusFunction(expression)) {
            return condition;
        }
        return symbols.getContext().mkAnd(success(), condition);
    }

    /**
     * Encodes an expression in value position, as used by concurrency group templates.
     */
    public Expr<SeqSort<CharSort>> encodeString(Expression expression) {
        Term term = encode(expression);
        Context ctx = symbols.getContext();
        switch (term.type()) {
            case STRING:
                return term.string();
            case BOOLEAN:
                return ctx.mkITE(term.bool(), ctx.mkString("true"), ctx.mkString("false"));
            case NUMBER:
                return ctx.mkString(term.literal());
            default:
                return ctx.mkString("");
        }
    }

    private Term encode(Expression expression) {
        Context ctx = symbols.getContext();

        if (expression instanceof Literal literal) {
            return encodeLiteral(literal);
        }
        if (expression instanceof ContextRef ref) {
            return encodeReference(ref);
        }
        if (expression instanceof Comparison comparison) {
            return bool(encodeComparison(comparison));
        }
        if (expression instanceof Contains contains) {
            return stringPredicate(expression, contains.haystack(), contains.needle(),
                    (haystack, needle) -> ctx.mkContains(haystack, needle));
        }
        if (expression instanceof StartsWith startsWith) {
            return stringPredicate(expression, startsWith.subject(), startsWith.prefix(),
                    (subject, prefix) -> ctx.mkPrefixOf(prefix, subject));
        }
        if (expression instanceof EndsWith endsWith) {
            return stringPredicate(expression, endsWith.subject(), endsWith.suffix(),
                    (subject, suffix) -> ctx.mkSuffixOf(suffix, subject));
        }
        if (expression instanceof And and) {
            Term left = encode(and.left());
            Term right = encode(and.right());
            if (left.type() == TermType.STRING && right.type() == TermType.STRING) {
                // a && b yields a when a is falsy, otherwise b
                return string(ctx.mkITE(truthy(left), right.string(), left.string()));
            }
            return bool(ctx.mkAnd(truthy(left), truthy(right)));
        }
        if (expression instanceof Or or) {
            Term left = encode(or.left());
            Term right = encode(or.right());
            if (left.type() == TermType.STRING && right.type() == TermType.STRING) {
                return string(ctx.mkITE(truthy(left), left.string(), right.string()));
            }
            return bool(ctx.mkOr(truthy(left), truthy(right)));
        }
        if (expression instanceof Not not) {
            return bool(ctx.mkNot(truthy(encode(not.operand()))));
        }
        return encodeFunction((FunctionCall) expression);
    }

    private Term encodeLiteral(Literal literal) {
        Context ctx = symbols.getContext();
        switch (literal.type()) {
            case STRING:
                return string(ctx.mkString(literal.value()));
            case BOOLEAN:
                return bool(ctx.mkBool(literal.isTrue()));
            case NUMBER:
                return new Term(TermType.NUMBER, null, literal.value());
            default:
                return new Term(TermType.NULL, null, null);
        }
    }

    private Term encodeReference(ContextRef ref) {
        SymbolicContext.FieldType type = SymbolicContext.fieldType(ref.path());
        if (type == SymbolicContext.FieldType.BOOLEAN) {
            return bool(symbols.booleanVariable(ref.path(), copy));
        }
        if (type == null) {
            symbols.recordUnsupported(ref.path(), "unknown context field");
        }
        return string(symbols.stringVariable(ref.path(), copy));
    }

    private BoolExpr encodeComparison(Comparison comparison) {
        Context ctx = symbols.getContext();
        Comparison.Operator operator = comparison.operator();
        if (operator != Comparison.Operator.EQ && operator != Comparison.Operator.NE) {
            return unsupported(comparison, "relational operator " + operator.getSymbol());
        }

        Term left = encode(comparison.left());
        Term right = encode(comparison.right());
        BoolExpr equal;
        if (left.type() != right.type()) {
            return unsupported(comparison, "operands of type " + left.type() + " and " + right.type());
        } else if (left.type() == TermType.STRING) {
            equal = ctx.mkEq(left.string(), right.string());
        } else if (left.type() == TermType.BOOLEAN) {
            equal = ctx.mkEq(left.bool(), right.bool());
        } else if (left.type() == TermType.NUMBER) {
            equal = ctx.mkBool(numericallyEqual(left.literal(), right.literal()));
        } else {
            equal = ctx.mkTrue();
        }
        return operator == Comparison.Operator.EQ ? equal : ctx.mkNot(equal);
    }

    private Term stringPredicate(Expression whole, Expression first, Expression second,
                                 StringPredicate predicate) {
        Term left = encode(first);
        Term right = encode(second);
        if (left.type() != TermType.STRING || right.type() != TermType.STRING) {
            return bool(unsupported(whole, "non-string operand"));
        }
        return bool(predicate.apply(left.string(), right.string()));
    }

    private Term encodeFunction(FunctionCall call) {
        Context ctx = symbols.getContext();
        if (call.isStatusFunction()) {
            switch (call.name()) {
                case "failure":
                    return bool(symbols.booleanVariable(SymbolicContext.STATUS_FAILURE, copy));
                case "cancelled":
                    return bool(symbols.booleanVariable(SymbolicContext.STATUS_CANCELLED, copy));
                case "success":
                    return bool(success());
                default:
                    return bool(ctx.mkTrue());
            }
        }
        String text = call.toCanonicalString();
        symbols.recordUnsupported(text, "function " + call.name() + " is not modelled");
        return string(symbols.opaqueString(text, copy));
    }

    private BoolExpr success() {
        Context ctx = symbols.getContext();
        return ctx.mkAnd(
                ctx.mkNot(symbols.booleanVariable(SymbolicContext.STATUS_FAILURE, copy)),
                ctx.mkNot(symbols.booleanVariable(SymbolicContext.STATUS_CANCELLED, copy)));
    }

    private BoolExpr truthy(Term term) {
        Context ctx = symbols.getContext();
        switch (term.type()) {
            case BOOLEAN:
                return term.bool();
            case STRING:
                return ctx.mkNot(ctx.mkEq(term.string(), ctx.mkString("")));
            case NUMBER:
                return ctx.mkBool(!numericallyEqual(term.literal(), "0"));
            default:
                return ctx.mkFalse();
        }
    }

    private BoolExpr unsupported(Expression clause, String reason) {
        String text = clause.toCanonicalString();
        symbols.recordUnsupported(text, reason);
        return symbols.atom(text, copy);
    }

    private static boolean numericallyEqual(String left, String right) {
        try {
            return Double.parseDouble(left) == Double.parseDouble(right);
        } catch (NumberFormatException e) {
            return left.equals(right);
        }
    }

    private static Term string(Expr<SeqSort<CharSort>> expr) {
        return new Term(TermType.STRING, expr, null);
    }

    private static Term bool(BoolExpr expr) {
        return new Term(TermType.BOOLEAN, expr, null);
    }

    @FunctionalInterface
    private interface StringPredicate {
        BoolExpr apply(Expr<SeqSort<CharSort>> first, Expr<SeqSort<CharSort>> second);
    }
}
