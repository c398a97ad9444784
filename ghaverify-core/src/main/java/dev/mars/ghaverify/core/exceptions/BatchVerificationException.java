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

import java.nio.file.Path;

/**
 * Batch-level infrastructure failure such as a missing input directory.
 * Unlike per-file failures this aborts the whole run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class BatchVerificationException extends VerificationException {

    private final Path location;

    public BatchVerificationException(Path location, String message) {
        super(message);
        this.location = location;
    }

    public BatchVerificationException(Path location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location == null) {
            return super.getMessage();
        }
        return String.format("%s (%s)", super.getMessage(), location);
    }
}
