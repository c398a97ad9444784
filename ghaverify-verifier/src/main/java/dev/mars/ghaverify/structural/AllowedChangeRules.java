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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static dev.mars.ghaverify.structural.ChangeKind.ADDITION;
import static dev.mars.ghaverify.structural.ChangeKind.REMOVAL;
import static dev.mars.ghaverify.structural.ChangeKind.TYPE_CHANGE;
import static dev.mars.ghaverify.structural.ChangeKind.VALUE_REWRITE;

/**
 * The table of structural deltas that intentional repairs may introduce.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class AllowedChangeRules {

    private static final String JOB = "root.jobs.*";
    private static final String STEP = "root.jobs.*.steps[*]";

    private final List<AllowedChangeRule> rules;

    public AllowedChangeRules(List<AllowedChangeRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
    }

    public static AllowedChangeRules defaults() {
        List<AllowedChangeRule> rules = new ArrayList<>();

        // Token permissions
        rules.add(AllowedChangeRule.of("root.permissions", ADDITION, FixTag.PERMISSIONS, "workflow permissions added"));
        rules.add(AllowedChangeRule.of(JOB + ".permissions", ADDITION, FixTag.PERMISSIONS, "job permissions added"));
        rules.add(AllowedChangeRule.of("root.permissions", TYPE_CHANGE, FixTag.PERMISSIONS, "workflow permissions expanded"));
        rules.add(AllowedChangeRule.of(JOB + ".permissions", TYPE_CHANGE, FixTag.PERMISSIONS, "job permissions expanded"));

        // Timeouts
        rules.add(AllowedChangeRule.of(JOB + ".timeout-minutes", ADDITION, FixTag.TIMEOUT, "job timeout added"));
        rules.add(AllowedChangeRule.of(STEP + ".timeout-minutes", ADDITION, FixTag.TIMEOUT, "step timeout added"));
        rules.add(AllowedChangeRule.of(JOB + ".timeout-minutes", REMOVAL, FixTag.TIMEOUT, "stray job timeout dropped"));
        rules.add(AllowedChangeRule.of(STEP + ".timeout-minutes", REMOVAL, FixTag.TIMEOUT, "stray step timeout dropped"));

        // Concurrency
        rules.add(AllowedChangeRule.of("root.concurrency", ADDITION, FixTag.CONCURRENCY, "workflow concurrency added"));
        rules.add(AllowedChangeRule.of(JOB + ".concurrency", ADDITION, FixTag.CONCURRENCY, "job concurrency added"));
        rules.add(AllowedChangeRule.of("root.concurrency", TYPE_CHANGE, FixTag.CONCURRENCY, "workflow concurrency expanded"));
        rules.add(AllowedChangeRule.of(JOB + ".concurrency", TYPE_CHANGE, FixTag.CONCURRENCY, "job concurrency expanded"));

        // Fork guards
        rules.add(AllowedChangeRule.of(JOB + ".if", ADDITION, FixTag.FORK_PREVENTION, "job condition added"));
        rules.add(AllowedChangeRule.of(STEP + ".if", ADDITION, FixTag.FORK_PREVENTION, "step condition added"));

        // Trigger path filters
        rules.add(AllowedChangeRule.of("root.on.*.paths", ADDITION, FixTag.PATH_FILTER, "trigger paths filter added"));
        rules.add(AllowedChangeRule.of("root.on.*.paths-ignore", ADDITION, FixTag.PATH_FILTER, "trigger paths-ignore filter added"));

        // Failure tolerance
        rules.add(AllowedChangeRule.of(JOB + ".continue-on-error", ADDITION, FixTag.CONTINUE_ON_ERROR, "job continue-on-error added"));
        rules.add(AllowedChangeRule.of(STEP + ".continue-on-error", ADDITION, FixTag.CONTINUE_ON_ERROR, "step continue-on-error added"));

        // Metadata
        rules.add(AllowedChangeRule.of("root.name", ADDITION, null, "workflow name added"));
        rules.add(AllowedChangeRule.of(JOB + ".name", ADDITION, null, "job name added"));
        rules.add(AllowedChangeRule.of(STEP + ".name", ADDITION, null, "step name added"));
        rules.add(AllowedChangeRule.of(STEP + ".name", REMOVAL, null, "step name dropped"));
        rules.add(AllowedChangeRule.of("root.env", ADDITION, null, "workflow env added"));
        rules.add(AllowedChangeRule.of(JOB + ".env", ADDITION, null, "job env added"));
        rules.add(AllowedChangeRule.of(STEP + ".env", ADDITION, null, "step env added"));

        // Run bodies
        rules.add(AllowedChangeRule.of(STEP + ".run", VALUE_REWRITE, FixTag.PACKAGE_PINNING, "package versions pinned"));

        return new AllowedChangeRules(rules);
    }

    public List<AllowedChangeRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
