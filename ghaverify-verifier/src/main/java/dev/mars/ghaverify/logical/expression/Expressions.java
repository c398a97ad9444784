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

package dev.mars.ghaverify.logical.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for working with conjunctions.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Flattens nested {@link And} nodes into their operands, left to right.
     */
    public static List<Expression> conjuncts(Expression expression) {
        List<Expression> result = new ArrayList<>();
        collect(expression, result);
        return result;
    }

    /**
     * Rebuilds a conjunction from its operands; an empty list yields {@code true}.
     */
    public static Expression conjunction(List<Expression> operands) {
        if (operands.isEmpty()) {
            return Literal.bool(true);
        }
        Expression result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new And(result, operands.get(i));
        }
        return result;
    }

    /**
     * True if any node of the expression is a call of {@code success()}, {@code always()},
     * {@code failure()} or {@code cancelled()}.
     */
    public static boolean callsStatusFunction(Expression expression) {
        if (expression instanceof FunctionCall call) {
            return call.isStatusFunction() || call.arguments().stream().anyMatch(Expressions::callsStatusFunction);
        }
        if (expression instanceof And and) {
            return callsStatusFunction(and.left()) || callsStatusFunction(and.right());
        }
        if (expression instanceof Or or) {
            return callsStatusFunction(or.left()) || callsStatusFunction(or.right());
        }
        if (expression instanceof Not not) {
            return callsStatusFunction(not.operand());
        }
        if (expression instanceof Comparison comparison) {
            return callsStatusFunction(comparison.left()) || callsStatusFunction(comparison.right());
        }
        if (expression instanceof Contains contains) {
            return callsStatusFunction(contains.haystack()) || callsStatusFunction(contains.needle());
        }
        if (expression instanceof StartsWith startsWith) {
            return callsStatusFunction(startsWith.subject()) || callsStatusFunction(startsWith.prefix());
        }
        if (expression instanceof EndsWith endsWith) {
            return callsStatusFunction(endsWith.subject()) || callsStatusFunction(endsWith.suffix());
        }
        return false;
    }

    private static void collect(Expression expression, List<Expression> result) {
        if (expression instanceof And and) {
            collect(and.left(), result);
            collect(and.right(), result);
        } else {
            result.add(expression);
        }
    }
}
