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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.ghaverify.logical.DomainResult;
import dev.mars.ghaverify.logical.LogicalResult;
import dev.mars.ghaverify.verification.VerificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists batch reports as JSON and per-file CSV.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BatchReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(BatchReportWriter.class);

    /** One CSV line per verified pair. */
    @JsonPropertyOrder({"pair_id", "status", "is_safe", "confidence", "structural_safe", "critical_issues",
            "logical_status", "trigger", "if", "concurrency", "unsupported_clauses", "error", "elapsed_ms"})
    record CsvRow(
            @JsonProperty("pair_id") String pairId,
            @JsonProperty("status") String status,
            @JsonProperty("is_safe") boolean safe,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("structural_safe") String structuralSafe,
            @JsonProperty("critical_issues") int criticalIssues,
            @JsonProperty("logical_status") String logicalStatus,
            @JsonProperty("trigger") String trigger,
            @JsonProperty("if") String conditions,
            @JsonProperty("concurrency") String concurrency,
            @JsonProperty("unsupported_clauses") int unsupportedClauses,
            @JsonProperty("error") String error,
            @JsonProperty("elapsed_ms") long elapsedMs) {

        static CsvRow of(VerificationVerdict verdict) {
            LogicalResult logical = verdict.getLogical();
            return new CsvRow(
                    verdict.getPairId(),
                    verdict.getStatus().name(),
                    verdict.isSafe(),
                    verdict.getConfidence(),
                    verdict.getStructural() != null ? Boolean.toString(verdict.getStructural().isSafe()) : "",
                    verdict.getStructural() != null ? verdict.getStructural().getCriticalIssues().size() : 0,
                    logical != null ? logical.getStatus().name() : "",
                    outcome(logical, DomainResult.TRIGGER),
                    outcome(logical, DomainResult.IF),
                    outcome(logical, DomainResult.CONCURRENCY),
                    logical != null ? logical.getUnsupportedClauses().size() : 0,
                    verdict.getError() != null ? verdict.getError() : "",
                    verdict.getElapsedMillis());
        }

        private static String outcome(LogicalResult logical, String domain) {
            if (logical == null || logical.getDomain(domain) == null) {
                return "";
            }
            return logical.getDomain(domain).getOutcome().name();
        }
    }

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public BatchReportWriter() {
        this.objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.csvMapper = new CsvMapper();
    }

    public void writeJson(BatchReport report, Path file) throws IOException {
        createParent(file);
        objectMapper.writeValue(file.toFile(), report);
        logger.info("Wrote JSON report to {}", file);
    }

    public void writeCsv(BatchReport report, Path file) throws IOException {
        createParent(file);
        List<CsvRow> rows = new ArrayList<>();
        for (VerificationVerdict verdict : report.getFileResults()) {
            rows.add(CsvRow.of(verdict));
        }
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            csvMapper.writer(schema).writeValue(writer, rows);
        }
        logger.info("Wrote CSV report with {} row(s) to {}", rows.size(), file);
    }

    /**
     * Renders any report object (a batch report or a single verdict) as indented JSON.
     */
    public String toJson(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
