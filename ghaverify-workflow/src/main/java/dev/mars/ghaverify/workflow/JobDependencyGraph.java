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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Dependency graph of the jobs in one workflow, built from their {@code needs} lists.
 * Provides methods for topological sorting and cycle detection.
 */
public class JobDependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, Job> jobs;

    public JobDependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
        this.jobs = new LinkedHashMap<>();
    }

    public static JobDependencyGraph of(Workflow workflow) {
        JobDependencyGraph graph = new JobDependencyGraph();
        workflow.getJobs().values().forEach(graph::addJob);
        return graph;
    }

    /**
     * Adds a job to the dependency graph.
     *
     * @param job the job to add
     */
    public void addJob(Job job) {
        Objects.requireNonNull(job, "Job cannot be null");

        jobs.put(job.getId(), job);
        dependencies.put(job.getId(), new LinkedHashSet<>(job.getNeeds()));
    }

    public Map<String, Job> getJobs() {
        return Map.copyOf(jobs);
    }

    /**
     * Gets the direct dependencies of a job.
     *
     * @param jobId the job id
     * @return set of job ids it needs
     */
    public Set<String> getDependencies(String jobId) {
        return dependencies.getOrDefault(jobId, Set.of());
    }

    /**
     * Orders the job ids so that each job comes after everything it needs. Ties are broken
     * by document order, so the result is deterministic.
     *
     * @return job ids in execution order
     * @throws WorkflowParseException if circular dependencies are detected
     */
    public List<String> topologicalSort() throws WorkflowParseException {
        // Kahn's algorithm for topological sorting
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);

            for (String dependent : findDependents(current)) {
                inDegree.put(dependent, inDegree.get(dependent) - 1);
                if (inDegree.get(dependent) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != jobs.size()) {
            List<String> remaining = new ArrayList<>(jobs.keySet());
            remaining.removeAll(result);
            throw new WorkflowParseException("jobs", "Circular dependency detected among jobs: " + remaining);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (WorkflowParseException e) {
            return true;
        }
    }

    /**
     * Validates the dependency graph for consistency.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String jobId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (dependency.equals(jobId)) {
                    result.addError("jobs." + jobId + ".needs", "Job cannot depend on itself");
                } else if (!jobs.containsKey(dependency)) {
                    result.addError("jobs." + jobId + ".needs",
                            "Dependency '" + dependency + "' not found");
                }
            }
        }

        if (hasCycles()) {
            result.addError("jobs", "Circular dependencies detected between jobs");
        }

        return result;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (String jobId : jobs.keySet()) {
            inDegree.put(jobId, 0);
        }

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String dependent = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (jobs.containsKey(dependency)) {
                    inDegree.put(dependent, inDegree.get(dependent) + 1);
                }
            }
        }

        return inDegree;
    }

    private Set<String> findDependents(String jobId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(jobId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    @Override
    public String toString() {
        return "JobDependencyGraph{" +
               "jobs=" + jobs.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
