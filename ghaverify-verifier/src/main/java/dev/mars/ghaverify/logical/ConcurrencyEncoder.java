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
import dev.mars.ghaverify.core.exceptions.UnsupportedExpressionException;
import dev.mars.ghaverify.logical.expression.ExpressionParseException;
import dev.mars.ghaverify.logical.expression.ExpressionParser;
import dev.mars.ghaverify.workflow.ScalarType;
import dev.mars.ghaverify.workflow.YamlNode;

import java.util.Locale;
import java.util.Objects;

/**
 * Encodes concurrency settings.
 *
 * <p>A group name only matters through the way it partitions runs: two runs share a lane iff
 * their group names are equal. {@link #sameLane(Setting)} therefore encodes "two independent runs
 * land in the same lane" over copies 0 and 1 of the context, and two group templates are
 * equivalent iff these formulas are.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ConcurrencyEncoder {

    /**
     * A concurrency block reduced to its group template and {@code cancel-in-progress} node.
     */
    public record Setting(GroupTemplate group, YamlNode cancelInProgress) {

        public static Setting of(YamlNode node, ExpressionParser parser)
                throws UnsupportedExpressionException, ExpressionParseException {
            if (node instanceof YamlNode.Scalar scalar && !scalar.isNull()) {
                return new Setting(GroupTemplate.parse(scalar.value(), parser), null);
            }
            if (node instanceof YamlNode.Mapping mapping) {
                YamlNode group = mapping.get("group");
                if (!(group instanceof YamlNode.Scalar groupScalar) || groupScalar.isNull()) {
                    throw new UnsupportedExpressionException(node.toCanonicalString(),
                            "concurrency block has no scalar group");
                }
                return new Setting(GroupTemplate.parse(groupScalar.value(), parser), mapping.get("cancel-in-progress"));
            }
            throw new UnsupportedExpressionException(String.valueOf(node), "concurrency must be a group name or a mapping");
        }
    }

    private final SymbolicContext symbols;
    private final ExpressionParser parser;

    public ConcurrencyEncoder(SymbolicContext symbols, ExpressionParser parser) {
        this.symbols = Objects.requireNonNull(symbols, "Symbolic context cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
    }

    public BoolExpr sameLane(Setting setting) {
        return symbols.getContext().mkEq(groupName(setting.group(), 0), groupName(setting.group(), 1));
    }

    public Expr<SeqSort<CharSort>> groupName(GroupTemplate template, int copy) {
        Context ctx = symbols.getContext();
        ExpressionEncoder encoder = new ExpressionEncoder(symbols, copy);
        Expr<SeqSort<CharSort>> result = null;
        for (GroupTemplate.Part part : template.getParts()) {
            Expr<SeqSort<CharSort>> encoded = part.isLiteral()
                    ? ctx.mkString(part.text())
                    : encoder.encodeString(part.expression());
            result = result == null ? encoded : ctx.mkConcat(result, encoded);
        }
        return result != null ? result : ctx.mkString("");
    }

    /**
     * Encodes {@code cancel-in-progress}; an absent setting is {@code false}.
     */
    public BoolExpr cancelInProgress(Setting setting) throws ExpressionParseException {
        Context ctx = symbols.getContext();
        YamlNode node = setting.cancelInProgress();
        if (!(node instanceof YamlNode.Scalar scalar) || scalar.isNull()) {
            return ctx.mkFalse();
        }
        if (scalar.type() == ScalarType.STRING && scalar.value().contains("${{")) {
            return new ExpressionEncoder(symbols).encodeCondition(parser.parse(scalar.value()));
        }
        return ctx.mkBool("true".equals(scalar.value().toLowerCase(Locale.ROOT)));
    }
}
