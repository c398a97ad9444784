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

import dev.mars.ghaverify.config.VerifierConfiguration;
import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Table of recognized safe rewrites for {@code run} bodies, such as the migration from the
 * deprecated {@code ::set-output} command to the {@code $GITHUB_OUTPUT} file.
 *
 * <p>The table is data, not code: it is read from {@code command-rewrites.yaml} on the classpath
 * unless configuration names another file.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CommandRewriteTable {

    public static final String DEFAULT_RESOURCE = "command-rewrites.yaml";

    private final List<Rewrite> rewrites;

    public CommandRewriteTable(List<Rewrite> rewrites) {
        this.rewrites = List.copyOf(Objects.requireNonNull(rewrites, "Rewrites cannot be null"));
    }

    public static CommandRewriteTable empty() {
        return new CommandRewriteTable(List.of());
    }

    public static CommandRewriteTable loadDefault() throws ConfigurationException {
        try (InputStream input = CommandRewriteTable.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                        "Bundled rewrite table " + DEFAULT_RESOURCE + " not found on classpath");
            }
            return load(input, "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                    "Failed to read bundled rewrite table: " + e.getMessage());
        }
    }

    public static CommandRewriteTable load(Path file) throws ConfigurationException {
        try (InputStream input = Files.newInputStream(file)) {
            return load(input, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                    "Failed to read rewrite table " + file + ": " + e.getMessage());
        }
    }

    /**
     * Loads the table named by configuration, or the bundled one when none is configured.
     */
    public static CommandRewriteTable fromConfiguration(VerifierConfiguration configuration) throws ConfigurationException {
        String location = configuration.getRewriteTableLocation();
        return location == null ? loadDefault() : load(Path.of(location));
    }

    public static CommandRewriteTable load(InputStream input, String origin) throws ConfigurationException {
        Object data;
        try {
            data = new Yaml(new SafeConstructor(new LoaderOptions())).load(input);
        } catch (YAMLException e) {
            throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                    "Malformed rewrite table " + origin + ": " + e.getMessage());
        }
        if (!(data instanceof Map<?, ?> root) || !(root.get("rewrites") instanceof List<?> entries)) {
            throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                    "Rewrite table " + origin + " must contain a 'rewrites' list");
        }

        List<Rewrite> rewrites = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Map<?, ?> entry)) {
                throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                        "Rewrite #" + i + " in " + origin + " must be a mapping");
            }
            String name = text(entry.get("name"));
            String pattern = text(entry.get("pattern"));
            String replacement = text(entry.get("replacement"));
            if (name == null || pattern == null || replacement == null) {
                throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                        "Rewrite #" + i + " in " + origin + " needs name, pattern and replacement");
            }
            try {
                rewrites.add(new Rewrite(name, Pattern.compile(pattern, Pattern.MULTILINE), replacement));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(VerifierConfiguration.REWRITE_TABLE,
                        "Rewrite '" + name + "' has an invalid pattern: " + e.getDescription());
            }
        }
        return new CommandRewriteTable(rewrites);
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Applies every rewrite in table order.
     */
    public String apply(String text) {
        String result = text;
        for (Rewrite rewrite : rewrites) {
            result = rewrite.pattern().matcher(result).replaceAll(rewrite.replacement());
        }
        return result;
    }

    public List<Rewrite> getRewrites() {
        return rewrites;
    }

    public record Rewrite(String name, Pattern pattern, String replacement) {
    }
}
