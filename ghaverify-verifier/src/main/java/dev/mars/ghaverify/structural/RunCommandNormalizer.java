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
import java.util.regex.Pattern;

/**
 * Normalizes {@code run} bodies for comparison: comments and blank lines are dropped,
 * whitespace is collapsed and the {@link CommandRewriteTable} is applied.
 *
 * <p>A {@code #} at the start of a line or after whitespace starts a comment unless it sits
 * inside single or double quotes. Quotes are tracked per line only.
 */
public class RunCommandNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // pip/poetry style: name==1.2, name>=1.2, name~=1.2
    private static final Pattern PIP_PIN = Pattern.compile("([A-Za-z0-9_.\\-\\[\\]]+)(?:===|==|>=|<=|~=)[^\\s;&|]+");
    // npm style: name@1.2.3, @scope/name@^1.2
    private static final Pattern NPM_PIN = Pattern.compile("((?:@[\\w.\\-]+/)?[\\w.\\-]+)@[~^]?\\d[^\\s;&|]*");
    // apt style: name=1.2-3
    private static final Pattern APT_PIN = Pattern.compile("(\\b[a-z0-9][a-z0-9+.\\-]*)=\\d[^\\s;&|]*");

    private final CommandRewriteTable rewriteTable;

    public RunCommandNormalizer(CommandRewriteTable rewriteTable) {
        this.rewriteTable = Objects.requireNonNull(rewriteTable, "Rewrite table cannot be null");
    }

    public String normalize(String body) {
        if (body == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\\R")) {
            String stripped = stripComment(line).trim();
            if (stripped.isEmpty()) {
                continue;
            }
            String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ");
            String rewritten = rewriteTable.apply(collapsed);
            lines.add(WHITESPACE.matcher(rewritten).replaceAll(" ").trim());
        }
        return String.join("\n", lines);
    }

    static String stripComment(String line) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && !inSingle) {
                i++;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == '#' && !inSingle && !inDouble
                    && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /**
     * Whether two bodies differ only in package version pins.
     */
    public boolean isPinningRewrite(String originalBody, String modifiedBody) {
        String original = normalize(originalBody);
        String modified = normalize(modifiedBody);
        return !original.equals(modified) && unpin(original).equals(unpin(modified));
    }

    static String unpin(String normalized) {
        String result = PIP_PIN.matcher(normalized).replaceAll("$1");
        result = NPM_PIN.matcher(result).replaceAll("$1");
        return APT_PIN.matcher(result).replaceAll("$1");
    }
}
