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

package dev.mars.ghaverify.core.exceptions;

/**
 * Thrown when verification options are invalid, for example an unknown fix tag,
 * a non-positive solver timeout or confidence weights that cannot be normalised.
 * Fails only the invocation that supplied the options.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ConfigurationException extends VerificationException {

    private final String propertyName;

    public ConfigurationException(String message) {
        super(message);
        this.propertyName = null;
    }

    public ConfigurationException(String propertyName, String message) {
        super(message);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public String getMessage() {
        if (propertyName == null) {
            return super.getMessage();
        }
        return String.format("Invalid configuration '%s': %s", propertyName, super.getMessage());
    }
}
