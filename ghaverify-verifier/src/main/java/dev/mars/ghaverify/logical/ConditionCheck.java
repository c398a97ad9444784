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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The outcome for one condition location, such as {@code jobs.build.steps[2].if}.
 */
@JsonPropertyOrder({"location", "outcome", "detail"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionCheck(String location, DomainOutcome outcome, String detail) {

    public ConditionCheck {
        Objects.requireNonNull(location, "Location cannot be null");
        Objects.requireNonNull(outcome, "Outcome cannot be null");
    }

    public static ConditionCheck of(String location, DomainOutcome outcome) {
        return new ConditionCheck(location, outcome, null);
    }
}
