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

import java.util.List;
import java.util.Objects;
/**
 * A job of a workflow with its dependencies and ordered steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */

public class Job {

    private final String id;
    private final String name;
    private final YamlNode runsOn;
    private final String ifCondition;
    private final List<String> needs;
    private final YamlNode permissions;
    private final YamlNode timeoutMinutes;
    private final YamlNode concurrency;
    private final YamlNode continueOnError;
    private final String uses;
    private final List<Step> steps;
    private final YamlNode.Mapping matrix;
    private final YamlNode.Mapping node;

    public Job(String id, String name, YamlNode runsOn, String ifCondition, List<String> needs,
               YamlNode permissions, YamlNode timeoutMinutes, YamlNode concurrency,
               YamlNode continueOnError, String uses, List<Step> steps, YamlNode.Mapping matrix,
               YamlNode.Mapping node) {
        this.id = Objects.requireNonNull(id, "Job id cannot be null");
        this.name = name;
        this.runsOn = runsOn;
        this.ifCondition = ifCondition;
        this.needs = needs != null ? List.copyOf(needs) : List.of();
        this.permissions = permissions;
        this.timeoutMinutes = timeoutMinutes;
        this.concurrency = concurrency;
        this.continueOnError = continueOnError;
        this.uses = uses;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.matrix = matrix;
        this.node = Objects.requireNonNull(node, "Job node cannot be null");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public YamlNode getRunsOn() {
        return runsOn;
    }

    public String getIfCondition() {
        return ifCondition;
    }

    public List<String> getNeeds() {
        return needs;
    }

    public YamlNode getPermissions() {
        return permissions;
    }

    public YamlNode getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public YamlNode getConcurrency() {
        return concurrency;
    }

    public YamlNode getContinueOnError() {
        return continueOnError;
    }

    /**
     * Reusable workflow reference for {@code jobs.<id>.uses} calls, otherwise null.
     */
    public String getUses() {
        return uses;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public YamlNode.Mapping getMatrix() {
        return matrix;
    }

    public YamlNode.Mapping getNode() {
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return Objects.equals(id, job.id) && Objects.equals(node, job.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, node);
    }

    @Override
    public String toString() {
        return "Job{" +
               "id='" + id + '\'' +
               ", needs=" + needs +
               ", steps=" + steps.size() +
               '}';
    }
}
