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

/**
 * Outcome of comparing one gating condition, ordered from best to worst.
 */
public enum DomainOutcome {
    IDENTICAL,
    ALLOWED_CHANGE,
    EQUIVALENT,
    INCONCLUSIVE,
    NOT_EQUIVALENT;

    public boolean isAcceptable() {
        return this == IDENTICAL || this == ALLOWED_CHANGE || this == EQUIVALENT;
    }

    public DomainOutcome worst(DomainOutcome other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
