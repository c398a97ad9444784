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

package dev.mars.ghaverify.structural;

import dev.mars.ghaverify.core.FixTag;

import java.util.Objects;

/**
 * One permitted structural delta. A rule with no enabling tag is universally safe; otherwise
 * it only applies when its tag has been permitted by the caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record AllowedChangeRule(PathPattern pathPattern, ChangeKind changeKind, FixTag enablingTag, String description) {

    public AllowedChangeRule {
        Objects.requireNonNull(pathPattern, "Path pattern cannot be null");
        Objects.requireNonNull(changeKind, "Change kind cannot be null");
        description = description != null ? description : "";
    }

    public static AllowedChangeRule of(String pattern, ChangeKind kind, FixTag tag, String description) {
        return new AllowedChangeRule(PathPattern.compile(pattern), kind, tag, description);
    }

    public boolean isUniversal() {
        return enablingTag == null;
    }

    @Override
    public String toString() {
        return changeKind + " " + pathPattern + (enablingTag != null ? " [" + enablingTag + "]" : " [always]");
    }
}
