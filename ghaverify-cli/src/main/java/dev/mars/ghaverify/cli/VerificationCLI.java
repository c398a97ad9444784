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

import dev.mars.ghaverify.batch.BatchReport;
import dev.mars.ghaverify.batch.BatchReportWriter;
import dev.mars.ghaverify.batch.BatchVerifier;
import dev.mars.ghaverify.batch.FilePair;
import dev.mars.ghaverify.batch.FilePairLocator;
import dev.mars.ghaverify.config.VerifierConfiguration;
import dev.mars.ghaverify.core.exceptions.BatchVerificationException;
import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import dev.mars.ghaverify.observability.VerificationMetrics;
import dev.mars.ghaverify.verification.IntegratedVerifier;
import dev.mars.ghaverify.verification.VerificationOptions;
import dev.mars.ghaverify.verification.VerificationStatus;
import dev.mars.ghaverify.verification.VerificationVerdict;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line tool for checking that repaired GitHub Actions workflows keep the behaviour of
 * the originals.
 *
 * Usage:
 *   java VerificationCLI verify <original.yml> <modified.yml> [options]
 *   java VerificationCLI --batch --original-dir DIR --modified-dir DIR [options]
 *   java VerificationCLI --help
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VerificationCLI {

    static final int EXIT_SAFE = 0;
    static final int EXIT_UNSAFE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_UNDECIDED = 4;

    private static final String VERSION = "1.0.0";
    private static final String USAGE = """
            GHA Verify CLI v%s

            USAGE:
              java VerificationCLI verify <original.yml> <modified.yml> [options]
              java VerificationCLI --batch --original-dir DIR --modified-dir DIR [options]
              java VerificationCLI --help
              java VerificationCLI --version

            OPTIONS:
              --mode MODE             structural, logical or hybrid (default hybrid)
              --fixes LIST            Comma-separated fix tags, or 'all'
                                      (permissions, timeout, concurrency, fork-prevention,
                                       path-filter, continue-on-error, package-pinning, smell_N)
              --strict                Allow no changes at all, whatever the fix tags
              --timeout-ms N          Solver timeout per query in milliseconds
              --parallelism N         Worker threads for batch verification
              --max-files N           Verify at most N pairs in batch mode
              --suffix S              Name suffix of repaired files, e.g. _gha_repaired.yml
              --output FILE           Write the JSON report to FILE
              --csv FILE              Write a per-file CSV report to FILE (batch mode)
              --quiet                 Only print the final status
              --verbose               Print failure reasons and stack traces
              --help                  Show this help message
              --version               Show version information

            EXAMPLES:
              # Verify one repaired workflow allowing permission and timeout fixes
              java VerificationCLI verify ci.yml ci_repaired.yml --fixes permissions,timeout

              # Verify a directory of repairs with four workers
              java VerificationCLI --batch --original-dir original/ --modified-dir repaired/ \\
                  --suffix _gha_repaired.yml --parallelism 4 --output report.json --csv report.csv

            EXIT CODES:
              0  Safe
              1  Unsafe repair found
              2  Invalid command line arguments or configuration
              3  File not found, IO error or batch infrastructure failure
              4  Inconclusive or per-file error verdict
            """.formatted(VERSION);

    private static final Set<String> VALUE_OPTIONS = Set.of("--mode", "--fixes", "--timeout-ms", "--parallelism",
            "--max-files", "--suffix", "--output", "--csv", "--original-dir", "--modified-dir");
    private static final Set<String> FLAGS = Set.of("--batch", "--strict", "--quiet", "--verbose",
            "--help", "-h", "--version", "-v");

    private final PrintStream out;
    private final PrintStream err;

    private final Map<String, String> values = new LinkedHashMap<>();
    private final List<String> positional = new ArrayList<>();
    private boolean batch;
    private boolean quiet;
    private boolean verbose;

    public VerificationCLI() {
        this(System.out, System.err);
    }

    public VerificationCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        VerificationCLI cli = new VerificationCLI();
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No arguments specified");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return processArguments(args);
        } catch (ConfigurationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (BatchVerificationException | IOException e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_IO;
        }
    }

    private int processArguments(String[] args) throws ConfigurationException, BatchVerificationException, IOException {
        List<String> argList = List.of(args);

        if (argList.contains("--help") || argList.contains("-h")) {
            out.println(USAGE);
            return EXIT_SAFE;
        }
        if (argList.contains("--version") || argList.contains("-v")) {
            out.println("GHA Verify CLI v" + VERSION);
            return EXIT_SAFE;
        }

        parseOptions(argList);
        VerifierConfiguration configuration = buildConfiguration();
        VerificationOptions options = VerificationOptions.fromConfiguration(configuration);
        IntegratedVerifier verifier = new IntegratedVerifier(configuration).withMetrics(VerificationMetrics.global());

        return batch ? runBatch(verifier, configuration, options) : runSingle(verifier, options);
    }

    private void parseOptions(List<String> args) {
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (VALUE_OPTIONS.contains(arg)) {
                if (i + 1 >= args.size()) {
                    throw new IllegalArgumentException(arg + " requires a value");
                }
                values.put(arg, args.get(++i));
            } else if (FLAGS.contains(arg)) {
                batch |= arg.equals("--batch");
                quiet |= arg.equals("--quiet");
                verbose |= arg.equals("--verbose");
                if (arg.equals("--strict")) {
                    values.put(arg, "true");
                }
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option " + arg);
            } else {
                positional.add(arg);
            }
        }
    }

    private VerifierConfiguration buildConfiguration() {
        VerifierConfiguration configuration = new VerifierConfiguration();
        override(configuration, "--mode", VerifierConfiguration.MODE);
        override(configuration, "--fixes", VerifierConfiguration.PERMITTED_FIXES);
        override(configuration, "--strict", VerifierConfiguration.STRICT);
        override(configuration, "--timeout-ms", VerifierConfiguration.SOLVER_TIMEOUT_MS);
        override(configuration, "--parallelism", VerifierConfiguration.BATCH_PARALLELISM);
        override(configuration, "--max-files", VerifierConfiguration.BATCH_MAX_FILES);
        return configuration;
    }

    private void override(VerifierConfiguration configuration, String option, String key) {
        String value = values.get(option);
        if (value != null) {
            configuration.setProperty(key, value);
        }
    }

    private int runSingle(IntegratedVerifier verifier, VerificationOptions options) throws IOException {
        List<String> files = positional;
        if (!files.isEmpty() && files.get(0).equals("verify")) {
            files = files.subList(1, files.size());
        }
        if (files.size() != 2) {
            err.println("Error: verify needs exactly two files, an original and a modified workflow");
            return EXIT_USAGE;
        }

        Path original = Paths.get(files.get(0));
        Path modified = Paths.get(files.get(1));
        for (Path file : List.of(original, modified)) {
            if (!Files.isRegularFile(file)) {
                err.println("Error: File does not exist: " + file);
                return EXIT_IO;
            }
        }

        VerificationVerdict verdict = verifier.verify(original, modified, options);
        BatchReportWriter writer = new BatchReportWriter();
        String output = values.get("--output");
        if (output != null) {
            Files.writeString(Paths.get(output), writer.toJson(verdict));
        }

        if (quiet) {
            out.println(verdict.getStatus());
        } else {
            out.println(writer.toJson(verdict));
        }
        if (verbose) {
            verdict.getFailureReasons().forEach(reason -> err.println("  - " + reason));
        }
        return exitCode(verdict.getStatus());
    }

    private int runBatch(IntegratedVerifier verifier, VerifierConfiguration configuration,
                         VerificationOptions options) throws BatchVerificationException, IOException {
        String originalDir = values.get("--original-dir");
        String modifiedDir = values.get("--modified-dir");
        if (originalDir == null || modifiedDir == null) {
            err.println("Error: --batch requires --original-dir and --modified-dir");
            return EXIT_USAGE;
        }

        String suffix = values.get("--suffix");
        List<FilePair> pairs = new FilePairLocator().locate(Paths.get(originalDir), Paths.get(modifiedDir),
                suffix, configuration.getBatchMaxFiles());
        if (pairs.isEmpty()) {
            err.println("Error: No matching file pairs found");
            return EXIT_IO;
        }

        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("original_dir", originalDir);
        echo.put("modified_dir", modifiedDir);
        echo.put("suffix", suffix);
        echo.put("mode", options.getMode().name().toLowerCase(Locale.ROOT));
        echo.put("strict_mode", options.isStrictMode());
        echo.put("permitted_fixes", options.getPermittedFixes().stream().map(Object::toString).sorted().toList());
        echo.put("max_files", configuration.getBatchMaxFiles());
        echo.put("parallelism", configuration.getBatchParallelism());
        echo.put("solver_timeout_ms", options.getSolverTimeout().toMillis());

        BatchVerifier batchVerifier = new BatchVerifier(verifier, configuration.getBatchParallelism());
        BatchReport report = batchVerifier.verifyBatch(pairs, options, echo);

        BatchReportWriter writer = new BatchReportWriter();
        if (values.containsKey("--output")) {
            writer.writeJson(report, Paths.get(values.get("--output")));
        }
        if (values.containsKey("--csv")) {
            writer.writeCsv(report, Paths.get(values.get("--csv")));
        }

        printSummary(report);
        return batchExitCode(report.getStatistics());
    }

    private void printSummary(BatchReport report) {
        BatchReport.Statistics stats = report.getStatistics();
        if (quiet) {
            out.println(stats.safeFiles() + "/" + stats.totalFiles() + " safe");
            return;
        }

        out.println();
        out.println("=".repeat(60));
        out.println("VERIFICATION SUMMARY");
        out.println("=".repeat(60));
        out.println("Total pairs:        " + stats.totalFiles());
        out.println("Verified:           " + stats.verifiedFiles());
        out.println("Safe:               " + stats.safeFiles());
        out.println("Unsafe:             " + stats.unsafeFiles());
        out.println("Inconclusive:       " + stats.inconclusiveFiles());
        out.println("Errors:             " + stats.errorFiles());
        out.println("Safety rate:        " + String.format("%.1f%%", stats.safetyRate() * 100));
        out.println("Average confidence: " + String.format("%.2f", stats.averageConfidence()));

        if (verbose) {
            for (VerificationVerdict verdict : report.getFileResults()) {
                if (verdict.getStatus() != VerificationStatus.SAFE) {
                    out.println();
                    out.println(verdict.getPairId() + ": " + verdict.getStatus());
                    verdict.getFailureReasons().forEach(reason -> out.println("  - " + reason));
                    if (verdict.getError() != null) {
                        out.println("  - " + verdict.getError());
                    }
                }
            }
        }
    }

    static int exitCode(VerificationStatus status) {
        switch (status) {
            case SAFE:
                return EXIT_SAFE;
            case UNSAFE:
                return EXIT_UNSAFE;
            default:
                return EXIT_UNDECIDED;
        }
    }

    static int batchExitCode(BatchReport.Statistics stats) {
        if (stats.unsafeFiles() > 0) {
            return EXIT_UNSAFE;
        }
        if (stats.inconclusiveFiles() > 0 || stats.errorFiles() > 0) {
            return EXIT_UNDECIDED;
        }
        return EXIT_SAFE;
    }
}
