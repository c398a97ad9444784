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

package dev.mars.ghaverify.workflow;

import java.nio.file.Path;

/**
 * Turns workflow text into an order-preserving {@link Workflow}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface WorkflowParser {

    Workflow parse(Path yamlFile) throws WorkflowParseException;

    Workflow parseFromString(String yamlContent) throws WorkflowParseException;

    /**
     * Checks a parsed workflow for inconsistencies that do not prevent parsing, such as
     * {@code needs} entries that name unknown jobs or dependency cycles.
     *
     * @param workflow the workflow to check
     * @return validation result
     */
    ValidationResult validate(Workflow workflow);
}
