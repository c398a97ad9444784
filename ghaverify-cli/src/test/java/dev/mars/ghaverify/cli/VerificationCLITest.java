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

package dev.mars.ghaverify.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the verification command line.
 */
class VerificationCLITest {

    private static final String PUSH_MAIN = """
            name: CI
            on:
              push:
                branches: [main]
            jobs:
              build:
                runs-on: ubuntu-latest
                steps:
                  - uses: actions/checkout@v4
                  - run: make build
            """;

    private static final String PUSH_MAIN_WITH_PERMISSIONS = """
            name: CI
            on:
              push:
                branches: [main]
            permissions:
              contents: read
            jobs:
              build:
                runs-on: ubuntu-latest
                timeout-minutes: 30
                steps:
                  - uses: actions/checkout@v4
                  - run: make build
            """;

    private static final String PUSH_DEVELOP = """
            name: CI
            on:
              push:
                branches: [develop]
            jobs:
              build:
                runs-on: ubuntu-latest
                steps:
                  - uses: actions/checkout@v4
                  - run: make build
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private VerificationCLI cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new VerificationCLI(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(Path dir, String name, String content) throws IOException {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(name), content);
    }

    @Nested
    @DisplayName("Argument handling")
    class ArgumentHandling {

        @Test
        @DisplayName("Should fail with usage when no arguments are given")
        void testNoArguments() {
            assertEquals(VerificationCLI.EXIT_USAGE, cli.run(new String[0]));
            assertTrue(stderr().contains("No arguments specified"));
            assertTrue(stderr().contains("USAGE"));
        }

        @Test
        @DisplayName("Should print help")
        void testHelp() {
            assertEquals(VerificationCLI.EXIT_SAFE, cli.run(new String[]{"--help"}));
            assertTrue(stdout().contains("EXIT CODES"));
        }

        @Test
        @DisplayName("Should print version")
        void testVersion() {
            assertEquals(VerificationCLI.EXIT_SAFE, cli.run(new String[]{"--version"}));
            assertTrue(stdout().startsWith("GHA Verify CLI v"));
        }

        @Test
        @DisplayName("Should reject unknown options")
        void testUnknownOption() {
            assertEquals(VerificationCLI.EXIT_USAGE, cli.run(new String[]{"verify", "a.yml", "b.yml", "--fast"}));
            assertTrue(stderr().contains("Unknown option --fast"));
        }

        @Test
        @DisplayName("Should reject an option missing its value")
        void testMissingValue() {
            assertEquals(VerificationCLI.EXIT_USAGE, cli.run(new String[]{"verify", "a.yml", "b.yml", "--mode"}));
        }

        @Test
        @DisplayName("Should reject an unknown fix tag")
        void testUnknownFixTag() throws IOException {
            Path original = write(tempDir, "a.yml", PUSH_MAIN);
            Path modified = write(tempDir, "b.yml", PUSH_MAIN);

            int code = cli.run(new String[]{"verify", original.toString(), modified.toString(), "--fixes", "teleport"});

            assertEquals(VerificationCLI.EXIT_USAGE, code);
        }

        @Test
        @DisplayName("Should require two files in single mode")
        void testWrongFileCount() {
            assertEquals(VerificationCLI.EXIT_USAGE, cli.run(new String[]{"verify", "only.yml"}));
        }
    }

    @Nested
    @DisplayName("Single pair")
    class SinglePair {

        @Test
        @DisplayName("Should report identical workflows as safe")
        void testIdenticalIsSafe() throws IOException {
            Path original = write(tempDir, "ci.yml", PUSH_MAIN);
            Path modified = write(tempDir, "ci_repaired.yml", PUSH_MAIN);

            int code = cli.run(new String[]{"verify", original.toString(), modified.toString()});

            assertEquals(VerificationCLI.EXIT_SAFE, code);
            JsonNode json = new ObjectMapper().readTree(stdout());
            assertEquals("SAFE", json.get("status").asText());
            assertTrue(json.get("is_safe").asBoolean());
        }

        @Test
        @DisplayName("Should accept permitted fixes and reject them without the tags")
        void testPermittedFixes() throws IOException {
            Path original = write(tempDir, "ci.yml", PUSH_MAIN);
            Path modified = write(tempDir, "ci_repaired.yml", PUSH_MAIN_WITH_PERMISSIONS);

            assertEquals(VerificationCLI.EXIT_SAFE, cli.run(new String[]{"verify", original.toString(),
                    modified.toString(), "--fixes", "permissions,timeout", "--quiet"}));
            assertEquals("SAFE", stdout().trim());

            out.reset();
            assertEquals(VerificationCLI.EXIT_UNSAFE, cli.run(new String[]{"verify", original.toString(),
                    modified.toString(), "--fixes", "permissions,timeout", "--strict", "--quiet"}));
            assertEquals("UNSAFE", stdout().trim());
        }

        @Test
        @DisplayName("Should report a branch filter change as unsafe")
        void testBranchChangeIsUnsafe() throws IOException {
            Path original = write(tempDir, "ci.yml", PUSH_MAIN);
            Path modified = write(tempDir, "ci_repaired.yml", PUSH_DEVELOP);
            Path report = tempDir.resolve("verdict.json");

            int code = cli.run(new String[]{"verify", original.toString(), modified.toString(),
                    "--mode", "logical", "--output", report.toString()});

            assertEquals(VerificationCLI.EXIT_UNSAFE, code);
            JsonNode json = new ObjectMapper().readTree(Files.readString(report));
            assertEquals("UNSAFE", json.get("status").asText());
            assertTrue(json.get("logical").has("counterexample"));
        }

        @Test
        @DisplayName("Should exit with IO code when a file is missing")
        void testMissingFile() throws IOException {
            Path original = write(tempDir, "ci.yml", PUSH_MAIN);

            int code = cli.run(new String[]{"verify", original.toString(), tempDir.resolve("nope.yml").toString()});

            assertEquals(VerificationCLI.EXIT_IO, code);
            assertTrue(stderr().contains("File does not exist"));
        }

        @Test
        @DisplayName("Should exit with undecided code on malformed YAML")
        void testMalformedYaml() throws IOException {
            Path original = write(tempDir, "ci.yml", PUSH_MAIN);
            Path modified = write(tempDir, "broken.yml", "jobs: [\n");

            int code = cli.run(new String[]{"verify", original.toString(), modified.toString(), "--quiet"});

            assertEquals(VerificationCLI.EXIT_UNDECIDED, code);
            assertEquals("ERROR", stdout().trim());
        }
    }

    @Nested
    @DisplayName("Batch mode")
    class BatchMode {

        @Test
        @DisplayName("Should verify a directory of pairs and write both reports")
        void testBatch() throws IOException {
            Path originals = tempDir.resolve("original");
            Path repaired = tempDir.resolve("repaired");
            write(originals, "a.yml", PUSH_MAIN);
            write(originals, "b.yml", PUSH_MAIN);
            write(repaired, "a.yml_fixed.yml", PUSH_MAIN);
            write(repaired, "b.yml_fixed.yml", PUSH_DEVELOP);
            Path json = tempDir.resolve("report.json");
            Path csv = tempDir.resolve("report.csv");

            int code = cli.run(new String[]{"--batch", "--original-dir", originals.toString(),
                    "--modified-dir", repaired.toString(), "--suffix", "_fixed.yml", "--parallelism", "2",
                    "--output", json.toString(), "--csv", csv.toString()});

            assertEquals(VerificationCLI.EXIT_UNSAFE, code);
            assertTrue(stdout().contains("VERIFICATION SUMMARY"));

            JsonNode report = new ObjectMapper().readTree(Files.readString(json));
            assertEquals(2, report.get("statistics").get("total_files").asInt());
            assertEquals(1, report.get("statistics").get("safe_files").asInt());
            assertEquals(1, report.get("statistics").get("unsafe_files").asInt());
            assertEquals("_fixed.yml", report.get("configuration").get("suffix").asText());

            List<String> lines = Files.readAllLines(csv);
            assertEquals(3, lines.size());
            assertTrue(lines.get(0).startsWith("pair_id"));
        }

        @Test
        @DisplayName("Should require both directories")
        void testMissingDirectoryOption() {
            assertEquals(VerificationCLI.EXIT_USAGE, cli.run(new String[]{"--batch", "--original-dir", "x"}));
        }

        @Test
        @DisplayName("Should exit with IO code when a directory does not exist")
        void testMissingDirectory() {
            int code = cli.run(new String[]{"--batch", "--original-dir", tempDir.resolve("a").toString(),
                    "--modified-dir", tempDir.resolve("b").toString()});

            assertEquals(VerificationCLI.EXIT_IO, code);
        }

        @Test
        @DisplayName("Should exit with IO code when no pairs match")
        void testNoPairs() throws IOException {
            Path originals = tempDir.resolve("original");
            Path repaired = tempDir.resolve("repaired");
            write(originals, "a.yml", PUSH_MAIN);
            Files.createDirectories(repaired);

            int code = cli.run(new String[]{"--batch", "--original-dir", originals.toString(),
                    "--modified-dir", repaired.toString()});

            assertEquals(VerificationCLI.EXIT_IO, code);
        }
    }
}
