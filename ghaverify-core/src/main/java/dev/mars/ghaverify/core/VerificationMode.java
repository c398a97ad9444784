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

package dev.mars.ghaverify.core;

import dev.mars.ghaverify.core.exceptions.ConfigurationException;

import java.util.Locale;

/**
 * Which verifiers take part in a verification run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0.0
 */
public enum VerificationMode {

    STRUCTURAL,
    LOGICAL,
    HYBRID;

    public boolean includesStructural() {
        return this != LOGICAL;
    }

    public boolean includesLogical() {
        return this != STRUCTURAL;
    }

    public static VerificationMode parse(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("mode", "Verification mode cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("mode",
                    "Unsupported verification mode '" + value + "', expected structural, logical or hybrid");
        }
    }
}
