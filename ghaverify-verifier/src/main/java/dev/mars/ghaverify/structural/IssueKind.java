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

/**
 * Category of a structural difference.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum IssueKind {
    KEY_REMOVED,
    KEY_ADDED,
    TYPE_CHANGED,
    ORDER_CHANGED,
    LENGTH_CHANGED,
    NEEDS_CHANGED,
    MATRIX_CHANGED,
    STEP_REORDERED,
    STEP_VALUE_CHANGED,
    STEP_TYPE_CHANGED,
    SCALAR_TYPE_CHANGED
}
