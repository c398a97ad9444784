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

import java.util.Objects;
/**
 * A single step of a job.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */

public class Step {

    private final int index;
    private final String name;
    private final String id;
    private final String ifCondition;
    private final String uses;
    private final String run;
    private final YamlNode.Mapping with;
    private final YamlNode.Mapping env;
    private final YamlNode continueOnError;
    private final YamlNode timeoutMinutes;
    private final YamlNode.Mapping node;

    public Step(int index, String name, String id, String ifCondition, String uses, String run,
                YamlNode.Mapping with, YamlNode.Mapping env, YamlNode continueOnError,
                YamlNode timeoutMinutes, YamlNode.Mapping node) {
        if (index < 0) {
            throw new IllegalArgumentException("Step index cannot be negative");
        }
        this.index = index;
        this.name = name;
        this.id = id;
        this.ifCondition = ifCondition;
        this.uses = uses;
        this.run = run;
        this.with = with;
        this.env = env;
        this.continueOnError = continueOnError;
        this.timeoutMinutes = timeoutMinutes;
        this.node = Objects.requireNonNull(node, "Step node cannot be null");
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public String getId() {
        return id;
    }

    public String getIfCondition() {
        return ifCondition;
    }

    public String getUses() {
        return uses;
    }

    public String getRun() {
        return run;
    }

    public YamlNode.Mapping getWith() {
        return with;
    }

    public YamlNode.Mapping getEnv() {
        return env;
    }

    public YamlNode getContinueOnError() {
        return continueOnError;
    }

    public YamlNode getTimeoutMinutes() {
        return timeoutMinutes;
    }

    /**
     * The normalized document node this step was built from.
     */
    public YamlNode.Mapping getNode() {
        return node;
    }

    public StepKind getKind() {
        if (uses != null && run == null) {
            return StepKind.USES;
        }
        if (run != null && uses == null) {
            return StepKind.RUN;
        }
        return StepKind.OTHER;
    }

    /**
     * Action reference without its version pin, e.g. {@code actions/checkout} for
     * {@code actions/checkout@v4}. Null for non-{@code uses} steps.
     */
    public String getActionName() {
        if (uses == null) {
            return null;
        }
        int at = uses.indexOf('@');
        return at >= 0 ? uses.substring(0, at) : uses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step step = (Step) o;
        return index == step.index && Objects.equals(node, step.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, node);
    }

    @Override
    public String toString() {
        return "Step{" +
               "index=" + index +
               ", name='" + name + '\'' +
               ", kind=" + getKind() +
               (uses != null ? ", uses='" + uses + '\'' : "") +
               '}';
    }
}
