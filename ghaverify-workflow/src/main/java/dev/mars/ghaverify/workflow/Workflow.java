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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed GitHub Actions workflow.
 *
 * <p>Besides the typed view, the workflow keeps the normalized document tree
 * ({@link #getRoot()}), which is what structural comparison walks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Workflow {

    private final String name;
    private final Map<String, YamlNode> triggers;
    private final YamlNode permissions;
    private final YamlNode concurrency;
    private final YamlNode.Mapping env;
    private final Map<String, Job> jobs;
    private final YamlNode.Mapping root;

    public Workflow(String name, Map<String, YamlNode> triggers, YamlNode permissions,
                    YamlNode concurrency, YamlNode.Mapping env, Map<String, Job> jobs,
                    YamlNode.Mapping root) {
        this.name = name;
        this.triggers = triggers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(triggers)) : Map.of();
        this.permissions = permissions;
        this.concurrency = concurrency;
        this.env = env;
        this.jobs = jobs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(jobs)) : Map.of();
        this.root = Objects.requireNonNull(root, "Root node cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * Triggering events in document order, each mapped to its filter configuration.
     * Shorthand forms have already been expanded, so every value is a mapping unless the
     * event itself uses a sequence (for example {@code schedule}).
     */
    public Map<String, YamlNode> getTriggers() {
        return triggers;
    }

    /**
     * The normalized {@code on} section, empty when the workflow declares none.
     */
    public YamlNode.Mapping getTriggerNode() {
        YamlNode.Mapping on = root.getMapping("on");
        return on != null ? on : YamlNode.emptyMapping();
    }

    public YamlNode getPermissions() {
        return permissions;
    }

    public YamlNode getConcurrency() {
        return concurrency;
    }

    public YamlNode.Mapping getEnv() {
        return env;
    }

    public Map<String, Job> getJobs() {
        return jobs;
    }

    public Job getJob(String id) {
        return jobs.get(id);
    }

    public YamlNode.Mapping getRoot() {
        return root;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return root.equals(((Workflow) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "name='" + name + '\'' +
               ", triggers=" + triggers.keySet() +
               ", jobs=" + jobs.keySet() +
               '}';
    }
}
