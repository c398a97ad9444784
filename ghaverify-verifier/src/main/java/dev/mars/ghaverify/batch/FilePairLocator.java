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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Matches original workflow files to their repaired counterparts.
 *
 * <p>Every regular, non-hidden file directly inside the original directory is a candidate. Its
 * counterpart is the file in the modified directory with the same name, or, when a suffix is
 * given, the original name followed by the suffix ({@code abc123} pairs with
 * {@code abc123_gha_repaired.yml}). Originals without a counterpart are skipped and logged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FilePairLocator {

    private final Logger logger;

    public FilePairLocator() {
        this(LoggerFactory.getLogger(FilePairLocator.class));
    }

    public FilePairLocator(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
    }

    /**
     * @param suffix   naming suffix of modified files, or null to match identical names
     * @param maxFiles upper bound on the number of pairs, 0 for no bound
     * @throws BatchVerificationException if either directory is missing or cannot be listed
     */
    public List<FilePair> locate(Path originalDir, Path modifiedDir, String suffix, int maxFiles)
            throws BatchVerificationException {
        requireDirectory(originalDir);
        requireDirectory(modifiedDir);
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles cannot be negative: " + maxFiles);
        }

        List<Path> originals;
        try (Stream<Path> entries = Files.list(originalDir)) {
            originals = entries
                    .filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BatchVerificationException(originalDir, "Cannot list directory", e);
        }

        List<FilePair> pairs = new ArrayList<>();
        int unmatched = 0;
        for (Path original : originals) {
            String name = original.getFileName().toString();
            Path modified = modifiedDir.resolve(suffix == null || suffix.isEmpty() ? name : name + suffix);
            if (!Files.isRegularFile(modified)) {
                unmatched++;
                logger.debug("No modified file for {} (expected {})", name, modified.getFileName());
                continue;
            }
            pairs.add(new FilePair(name, original, modified));
            if (maxFiles > 0 && pairs.size() >= maxFiles) {
                break;
            }
        }

        logger.info("Matched {} file pair(s) between {} and {} ({} original(s) without counterpart)",
                pairs.size(), originalDir, modifiedDir, unmatched);
        return pairs;
    }

    private static void requireDirectory(Path directory) throws BatchVerificationException {
        Objects.requireNonNull(directory, "Directory cannot be null");
        if (!Files.isDirectory(directory)) {
            throw new BatchVerificationException(directory, "Directory does not exist");
        }
        if (!Files.isReadable(directory)) {
            throw new BatchVerificationException(directory, "Directory is not readable");
        }
    }
}
