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

import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for run body normalization and the rewrite table behind it.
 */
class RunCommandNormalizerTest {

    private RunCommandNormalizer normalizer;

    @BeforeEach
    void setUp() throws ConfigurationException {
        normalizer = new RunCommandNormalizer(CommandRewriteTable.loadDefault());
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should drop comments and blank lines and collapse whitespace")
        void testCosmetics() {
            String body = "# build it\n\n  make    build   # fast\nmake test\n";

            assertEquals("make build\nmake test", normalizer.normalize(body));
        }

        @Test
        @DisplayName("Should keep a # inside quotes")
        void testQuotedHash() {
            assertEquals("echo \"build #1\" && make deploy",
                    normalizer.normalize("echo \"build #1\" && make deploy"));
            assertEquals("echo 'a #b'", normalizer.normalize("echo 'a #b' # trailing"));
            assertNotEquals(normalizer.normalize("echo \"build #1\" && make deploy"),
                    normalizer.normalize("echo \"build #1\" && rm -rf ~"));
        }

        @Test
        @DisplayName("Should only start a comment at a word boundary")
        void testHashInsideWord() {
            assertEquals("echo ${#ARGS[@]} issue#12", normalizer.normalize("echo ${#ARGS[@]} issue#12 # count"));
        }

        @Test
        @DisplayName("Should treat a missing body as empty")
        void testNull() {
            assertEquals("", normalizer.normalize(null));
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "echo \"::set-output name=tag::v1\"   | echo tag=v1 >> $GITHUB_OUTPUT",
                "echo ::save-state name=pid::42       | echo pid=42 >> $GITHUB_STATE",
                "echo ::set-env name=MODE::ci         | echo MODE=ci >> $GITHUB_ENV",
                "echo \"::add-path::/opt/bin\"        | echo /opt/bin >> $GITHUB_PATH",
                "echo \"tag=v1\" >> \"${GITHUB_OUTPUT}\" | echo tag=v1 >> $GITHUB_OUTPUT"
        })
        @DisplayName("Should map workflow commands onto environment files")
        void testKnownRewrites(String body, String expected) {
            assertEquals(expected, normalizer.normalize(body));
        }
    }

    @Nested
    @DisplayName("Pinning")
    class Pinning {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "pip install requests flask         | pip install requests==2.31.0 flask>=3.0",
                "npm install lodash                 | npm install lodash@4.17.21",
                "npm i @types/node                  | npm i @types/node@^20.1",
                "apt-get install -y curl            | apt-get install -y curl=7.81.0-1"
        })
        @DisplayName("Should recognise added version pins")
        void testPinningRewrite(String original, String modified) {
            assertTrue(normalizer.isPinningRewrite(original, modified));
        }

        @Test
        @DisplayName("Should not treat an identical body as a pinning rewrite")
        void testIdentical() {
            assertFalse(normalizer.isPinningRewrite("pip install requests", "pip install requests"));
        }

        @Test
        @DisplayName("Should not treat a different package as a pinning rewrite")
        void testDifferentPackage() {
            assertFalse(normalizer.isPinningRewrite("pip install requests", "pip install httpx==0.27"));
        }
    }

    @Nested
    @DisplayName("Rewrite table loading")
    class Loading {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Should load the bundled table")
        void testDefaultTable() throws ConfigurationException {
            CommandRewriteTable table = CommandRewriteTable.loadDefault();

            assertFalse(table.getRewrites().isEmpty());
            assertEquals("set-output", table.getRewrites().get(0).name());
        }

        @Test
        @DisplayName("Should load a table from a file")
        void testFileTable() throws Exception {
            Path file = tempDir.resolve("rewrites.yaml");
            Files.writeString(file, """
                    rewrites:
                      - name: yarn
                        pattern: '^yarn install --frozen-lockfile$'
                        replacement: 'yarn install --immutable'
                    """);

            CommandRewriteTable table = CommandRewriteTable.load(file);
            RunCommandNormalizer custom = new RunCommandNormalizer(table);

            assertEquals(1, table.getRewrites().size());
            assertEquals(custom.normalize("yarn install --immutable"), custom.normalize("yarn  install --frozen-lockfile"));
        }

        @Test
        @DisplayName("Should reject a table without a rewrites list")
        void testMissingList() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> load("other: []"));

            assertTrue(e.getMessage().contains("rewrites"));
        }

        @Test
        @DisplayName("Should reject incomplete entries and invalid patterns")
        void testInvalidEntries() {
            assertThrows(ConfigurationException.class, () -> load("rewrites:\n  - name: x\n    pattern: a\n"));
            assertThrows(ConfigurationException.class,
                    () -> load("rewrites:\n  - name: x\n    pattern: '('\n    replacement: b\n"));
            assertThrows(ConfigurationException.class, () -> load("rewrites:\n  - just-a-string\n"));
        }

        @Test
        @DisplayName("Should reject a missing file")
        void testMissingFile() {
            assertThrows(ConfigurationException.class, () -> CommandRewriteTable.load(tempDir.resolve("none.yaml")));
        }

        private CommandRewriteTable load(String yaml) throws ConfigurationException {
            return CommandRewriteTable.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test");
        }
    }
}
