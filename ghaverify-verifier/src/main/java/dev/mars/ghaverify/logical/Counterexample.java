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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A concrete context under which the original and modified conditions disagree.
 *
 * @param location  the condition that differs, e.g. {@code jobs.build.if}
 * @param executes  which side holds under the valuation, {@code original} or {@code modified}
 * @param valuation context variable to value
 */
@JsonPropertyOrder({"location", "executes", "valuation"})
public record Counterexample(@JsonProperty("location") String location,
                             @JsonProperty("executes") String executes,
                             @JsonProperty("valuation") Map<String, String> valuation) {

    public static final String ORIGINAL = "original";
    public static final String MODIFIED = "modified";

    public Counterexample {
        Objects.requireNonNull(location, "Location cannot be null");
        Objects.requireNonNull(executes, "Executes cannot be null");
        valuation = Collections.unmodifiableMap(new TreeMap<>(valuation));
    }

    public String describe() {
        return String.format("%s: only the %s version holds when %s", location, executes, valuation);
    }
}
