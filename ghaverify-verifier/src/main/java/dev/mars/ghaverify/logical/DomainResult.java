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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * All condition checks of one domain ({@code trigger}, {@code if} or {@code concurrency}).
 * The domain outcome is the worst outcome among its checks, and {@code IDENTICAL} when there
 * was nothing to check.
 */
@JsonPropertyOrder({"outcome", "checks"})
public final class DomainResult {

    public static final String TRIGGER = "trigger";
    public static final String IF = "if";
    public static final String CONCURRENCY = "concurrency";

    private final String domain;
    private final List<ConditionCheck> checks = new ArrayList<>();

    public DomainResult(String domain) {
        this.domain = Objects.requireNonNull(domain, "Domain cannot be null");
    }

    public void add(ConditionCheck check) {
        checks.add(Objects.requireNonNull(check, "Check cannot be null"));
    }

    @JsonIgnore
    public String getDomain() {
        return domain;
    }

    @JsonProperty("outcome")
    public DomainOutcome getOutcome() {
        DomainOutcome outcome = DomainOutcome.IDENTICAL;
        for (ConditionCheck check : checks) {
            outcome = outcome.worst(check.outcome());
        }
        return outcome;
    }

    @JsonProperty("checks")
    public List<ConditionCheck> getChecks() {
        return Collections.unmodifiableList(checks);
    }

    @JsonIgnore
    public boolean isAcceptable() {
        return getOutcome().isAcceptable();
    }

    public long count(DomainOutcome outcome) {
        return checks.stream().filter(check -> check.outcome() == outcome).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainResult that = (DomainResult) o;
        return domain.equals(that.domain) && checks.equals(that.checks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, checks);
    }

    @Override
    public String toString() {
        return domain + "=" + getOutcome() + checks;
    }
}
