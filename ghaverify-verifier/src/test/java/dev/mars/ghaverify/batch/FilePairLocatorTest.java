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

package dev.mars.ghaverify.batch;

import dev.mars.ghaverify.core.exceptions.BatchVerificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilePairLocatorTest {

    @TempDir
    Path tempDir;

    private Path originalDir;
    private Path modifiedDir;
    private FilePairLocator locator;

    @BeforeEach
    void setUp() throws IOException {
        originalDir = Files.createDirectory(tempDir.resolve("original"));
        modifiedDir = Files.createDirectory(tempDir.resolve("modified"));
        locator = new FilePairLocator();
    }

    private static void touch(Path file) throws IOException {
        Files.writeString(file, "name: CI\non: push\njobs: {}\n");
    }

    @Test
    void testMatchesIdenticalNamesInSortedOrder() throws Exception {
        for (String name : List.of("c.yml", "a.yml", "b.yml")) {
            touch(originalDir.resolve(name));
            touch(modifiedDir.resolve(name));
        }

        List<FilePair> pairs = locator.locate(originalDir, modifiedDir, null, 0);

        assertEquals(List.of("a.yml", "b.yml", "c.yml"), pairs.stream().map(FilePair::id).toList());
        assertEquals(modifiedDir.resolve("a.yml"), pairs.get(0).modified());
    }

    @Test
    void testSuffixNaming() throws Exception {
        touch(originalDir.resolve("abc123"));
        touch(modifiedDir.resolve("abc123_gha_repaired.yml"));
        touch(modifiedDir.resolve("abc123"));

        List<FilePair> pairs = locator.locate(originalDir, modifiedDir, "_gha_repaired.yml", 0);

        assertEquals(1, pairs.size());
        assertEquals(modifiedDir.resolve("abc123_gha_repaired.yml"), pairs.get(0).modified());
    }

    @Test
    void testSkipsHiddenAndUnmatchedFiles() throws Exception {
        touch(originalDir.resolve(".DS_Store"));
        touch(modifiedDir.resolve(".DS_Store"));
        touch(originalDir.resolve("lonely.yml"));
        touch(originalDir.resolve("ci.yml"));
        touch(modifiedDir.resolve("ci.yml"));
        Files.createDirectory(originalDir.resolve("nested"));

        List<FilePair> pairs = locator.locate(originalDir, modifiedDir, null, 0);

        assertEquals(List.of("ci.yml"), pairs.stream().map(FilePair::id).toList());
    }

    @Test
    void testMaxFiles() throws Exception {
        for (int i = 0; i < 5; i++) {
            touch(originalDir.resolve("wf" + i + ".yml"));
            touch(modifiedDir.resolve("wf" + i + ".yml"));
        }

        assertEquals(2, locator.locate(originalDir, modifiedDir, null, 2).size());
        assertEquals(5, locator.locate(originalDir, modifiedDir, null, 0).size());
        assertThrows(IllegalArgumentException.class, () -> locator.locate(originalDir, modifiedDir, null, -1));
    }

    @Test
    void testMissingDirectory() {
        Path missing = tempDir.resolve("missing");

        BatchVerificationException e = assertThrows(BatchVerificationException.class,
                () -> locator.locate(originalDir, missing, null, 0));

        assertEquals(missing, e.getLocation());
        assertTrue(e.getMessage().contains("does not exist"));
    }
}
