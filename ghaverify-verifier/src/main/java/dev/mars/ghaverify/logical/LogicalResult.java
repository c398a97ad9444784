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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a logical comparison across the trigger, {@code if} and concurrency domains.
 *
 * <p>The result is unsafe when any check is {@link DomainOutcome#NOT_EQUIVALENT}, inconclusive
 * when none is but some check could not be decided, and safe otherwise.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonPropertyOrder({"is_safe", "status", "per_domain", "counterexample", "unsupported_clauses"})
public final class LogicalResult {

    private final Map<String, DomainResult> perDomain;
    private final Counterexample counterexample;
    private final List<String> unsupportedClauses;

    public LogicalResult(List<DomainResult> domains, Counterexample counterexample, List<String> unsupportedClauses) {
        Map<String, DomainResult> ordered = new LinkedHashMap<>();
        for (DomainResult domain : domains) {
            ordered.put(domain.getDomain(), domain);
        }
        this.perDomain = Collections.unmodifiableMap(ordered);
        this.counterexample = counterexample;
        this.unsupportedClauses = List.copyOf(Objects.requireNonNull(unsupportedClauses, "Clauses cannot be null"));
    }

    @JsonProperty("is_safe")
    public boolean isSafe() {
        return getStatus() == LogicalStatus.SAFE;
    }

    @JsonProperty("status")
    public LogicalStatus getStatus() {
        DomainOutcome worst = DomainOutcome.IDENTICAL;
        for (DomainResult domain : perDomain.values()) {
            worst = worst.worst(domain.getOutcome());
        }
        if (worst == DomainOutcome.NOT_EQUIVALENT) {
            return LogicalStatus.UNSAFE;
        }
        return worst == DomainOutcome.INCONCLUSIVE ? LogicalStatus.INCONCLUSIVE : LogicalStatus.SAFE;
    }

    @JsonProperty("per_domain")
    public Map<String, DomainResult> getPerDomain() {
        return perDomain;
    }

    @JsonIgnore
    public DomainResult getDomain(String name) {
        return perDomain.get(name);
    }

    @JsonProperty("counterexample")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Counterexample getCounterexample() {
        return counterexample;
    }

    @JsonProperty("unsupported_clauses")
    public List<String> getUnsupportedClauses() {
        return unsupportedClauses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogicalResult that = (LogicalResult) o;
        return perDomain.equals(that.perDomain)
                && Objects.equals(counterexample, that.counterexample)
                && unsupportedClauses.equals(that.unsupportedClauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(perDomain, counterexample, unsupportedClauses);
    }

    @Override
    public String toString() {
        return "LogicalResult{" +
               "status=" + getStatus() +
               ", perDomain=" + perDomain.values() +
               ", counterexample=" + counterexample +
               '}';
    }
}
