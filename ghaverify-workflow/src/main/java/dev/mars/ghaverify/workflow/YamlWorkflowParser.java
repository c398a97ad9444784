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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowParser.
 * Parses GitHub Actions workflows using SnakeYAML.
 *
 * <p>The document is read through SnakeYAML's composer rather than its constructor. The node
 * graph keeps mapping key order and the raw key text, so a plain {@code on:} key stays
 * {@code "on"} instead of being resolved to the YAML 1.1 boolean {@code true}. Duplicate keys,
 * which the composer accepts silently, are rejected here.
 *
 * <p>Shorthand forms are expanded in the tree itself so that every consumer sees one shape:
 * {@code on: push} and {@code on: [push, pull]} become {@code on: {push: {}, ...}}, null event
 * configurations become empty mappings, and {@code needs: build} becomes {@code needs: [build]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowParser implements WorkflowParser {

    private static final int MAX_DEPTH = 200;

    private final Yaml yaml;
    private final Logger logger;

    public YamlWorkflowParser() {
        this(LoggerFactory.getLogger(YamlWorkflowParser.class));
    }

    public YamlWorkflowParser(Logger logger) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.logger = logger;
    }

    @Override
    public Workflow parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        } catch (WorkflowParseException e) {
            throw e.withSource(yamlFile.getFileName().toString());
        }
    }

    @Override
    public Workflow parseFromString(String yamlContent) throws WorkflowParseException {
        if (yamlContent == null || yamlContent.isBlank()) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }

        Node document = composeSingleDocument(yamlContent);
        YamlNode converted = convert(document, "root", 0);
        if (!(converted instanceof YamlNode.Mapping rawRoot)) {
            throw new WorkflowParseException(lineOf(document), "root",
                    "Workflow document must be a mapping, found " + converted.kind());
        }

        YamlNode.Mapping root = normalize(rawRoot);
        Workflow workflow = buildWorkflow(root);
        logger.debug("Parsed workflow '{}' with {} trigger(s) and {} job(s)",
                workflow.getName(), workflow.getTriggers().size(), workflow.getJobs().size());
        return workflow;
    }

    @Override
    public ValidationResult validate(Workflow workflow) {
        ValidationResult result = new ValidationResult();

        if (workflow.getTriggers().isEmpty()) {
            result.addWarning("on", "Workflow declares no triggering events");
        }

        if (workflow.getJobs().isEmpty()) {
            result.addError("jobs", "Workflow must declare at least one job");
        }

        for (Job job : workflow.getJobs().values()) {
            String path = "jobs." + job.getId();
            if (job.getSteps().isEmpty() && job.getUses() == null) {
                result.addWarning(path, "Job has neither steps nor a reusable workflow reference");
            }
            for (Step step : job.getSteps()) {
                if (step.getKind() == StepKind.OTHER) {
                    result.addWarning(path + ".steps[" + step.getIndex() + "]",
                            "Step must declare exactly one of 'uses' or 'run'");
                }
            }
        }

        result.addAll(JobDependencyGraph.of(workflow).validate());
        return result;
    }

    private Node composeSingleDocument(String yamlContent) throws WorkflowParseException {
        List<Node> documents = new ArrayList<>();
        try {
            for (Node node : yaml.composeAll(new StringReader(yamlContent))) {
                documents.add(node);
            }
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            throw new WorkflowParseException(null, mark != null ? mark.getLine() + 1 : -1, null,
                    "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }

        if (documents.isEmpty()) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        if (documents.size() > 1) {
            throw new WorkflowParseException("Expected a single YAML document but found " + documents.size());
        }
        return documents.get(0);
    }

    private YamlNode convert(Node node, String path, int depth) throws WorkflowParseException {
        if (depth > MAX_DEPTH) {
            throw new WorkflowParseException(lineOf(node), path, "Document nesting is too deep");
        }

        if (node instanceof MappingNode mappingNode) {
            LinkedHashMap<String, YamlNode> entries = new LinkedHashMap<>();
            for (NodeTuple tuple : mappingNode.getValue()) {
                Node keyNode = tuple.getKeyNode();
                if (!(keyNode instanceof ScalarNode scalarKey)) {
                    throw new WorkflowParseException(lineOf(keyNode), path, "Mapping keys must be scalars");
                }
                String key = scalarKey.getValue();
                if (entries.containsKey(key)) {
                    throw new WorkflowParseException(lineOf(keyNode), path, "Duplicate key '" + key + "'");
                }
                entries.put(key, convert(tuple.getValueNode(), path + "." + key, depth + 1));
            }
            return new YamlNode.Mapping(entries);
        }

        if (node instanceof SequenceNode sequenceNode) {
            List<YamlNode> items = new ArrayList<>();
            List<Node> values = sequenceNode.getValue();
            for (int i = 0; i < values.size(); i++) {
                items.add(convert(values.get(i), path + "[" + i + "]", depth + 1));
            }
            return new YamlNode.Sequence(items);
        }

        if (node instanceof ScalarNode scalarNode) {
            ScalarType type = scalarType(scalarNode.getTag());
            return type == ScalarType.NULL
                    ? YamlNode.Scalar.nullValue()
                    : new YamlNode.Scalar(scalarNode.getValue(), type);
        }

        throw new WorkflowParseException(lineOf(node), path, "Unsupported YAML node: " + node.getNodeId());
    }

    private static ScalarType scalarType(Tag tag) {
        if (Tag.INT.equals(tag)) {
            return ScalarType.INTEGER;
        }
        if (Tag.FLOAT.equals(tag)) {
            return ScalarType.FLOAT;
        }
        if (Tag.BOOL.equals(tag)) {
            return ScalarType.BOOLEAN;
        }
        if (Tag.NULL.equals(tag)) {
            return ScalarType.NULL;
        }
        return ScalarType.STRING;
    }

    private static int lineOf(Node node) {
        return node.getStartMark() != null ? node.getStartMark().getLine() + 1 : -1;
    }

    // Normalization

    private YamlNode.Mapping normalize(YamlNode.Mapping root) throws WorkflowParseException {
        YamlNode.Mapping result = root;

        if (root.containsKey("on")) {
            result = result.with("on", normalizeTriggers(root.get("on")));
        }

        YamlNode jobsNode = root.get("jobs");
        if (jobsNode != null) {
            if (!(jobsNode instanceof YamlNode.Mapping jobs)) {
                throw new WorkflowParseException("jobs", "Jobs must be a mapping of job id to job");
            }
            LinkedHashMap<String, YamlNode> normalizedJobs = new LinkedHashMap<>();
            for (Map.Entry<String, YamlNode> entry : jobs.entries().entrySet()) {
                normalizedJobs.put(entry.getKey(), normalizeJob(entry.getKey(), entry.getValue()));
            }
            result = result.with("jobs", new YamlNode.Mapping(normalizedJobs));
        }

        return result;
    }

    private YamlNode.Mapping normalizeTriggers(YamlNode on) throws WorkflowParseException {
        LinkedHashMap<String, YamlNode> events = new LinkedHashMap<>();

        if (on instanceof YamlNode.Scalar scalar) {
            if (scalar.isNull()) {
                throw new WorkflowParseException("on", "Trigger section cannot be empty");
            }
            events.put(scalar.value(), YamlNode.emptyMapping());
        } else if (on instanceof YamlNode.Sequence sequence) {
            for (YamlNode item : sequence.items()) {
                if (!(item instanceof YamlNode.Scalar event) || event.isNull()) {
                    throw new WorkflowParseException("on", "Event lists may only contain event names");
                }
                events.put(event.value(), YamlNode.emptyMapping());
            }
        } else if (on instanceof YamlNode.Mapping mapping) {
            for (Map.Entry<String, YamlNode> entry : mapping.entries().entrySet()) {
                YamlNode config = entry.getValue();
                boolean empty = config instanceof YamlNode.Scalar scalar && scalar.isNull();
                events.put(entry.getKey(), empty ? YamlNode.emptyMapping() : config);
            }
        }

        return new YamlNode.Mapping(events);
    }

    private YamlNode normalizeJob(String jobId, YamlNode jobNode) throws WorkflowParseException {
        String path = "jobs." + jobId;
        if (!(jobNode instanceof YamlNode.Mapping job)) {
            throw new WorkflowParseException(path, "Job must be a mapping");
        }

        YamlNode.Mapping result = job;
        YamlNode needs = job.get("needs");
        if (needs instanceof YamlNode.Scalar scalar) {
            result = result.with("needs", scalar.isNull()
                    ? YamlNode.sequenceOf(List.of())
                    : YamlNode.sequenceOf(List.of(scalar)));
        } else if (needs instanceof YamlNode.Mapping) {
            throw new WorkflowParseException(path + ".needs", "Needs must be a job id or a list of job ids");
        }

        YamlNode steps = job.get("steps");
        if (steps != null && !(steps instanceof YamlNode.Sequence)) {
            throw new WorkflowParseException(path + ".steps", "Steps must be a sequence");
        }
        return result;
    }

    // Typed view

    private Workflow buildWorkflow(YamlNode.Mapping root) throws WorkflowParseException {
        Map<String, YamlNode> triggers = new LinkedHashMap<>();
        YamlNode.Mapping on = root.getMapping("on");
        if (on != null) {
            triggers.putAll(on.entries());
        }

        Map<String, Job> jobs = new LinkedHashMap<>();
        YamlNode.Mapping jobsNode = root.getMapping("jobs");
        if (jobsNode != null) {
            for (Map.Entry<String, YamlNode> entry : jobsNode.entries().entrySet()) {
                jobs.put(entry.getKey(), buildJob(entry.getKey(), (YamlNode.Mapping) entry.getValue()));
            }
        }

        return new Workflow(
                root.getString("name"),
                triggers,
                root.get("permissions"),
                root.get("concurrency"),
                root.getMapping("env"),
                jobs,
                root);
    }

    private Job buildJob(String jobId, YamlNode.Mapping node) throws WorkflowParseException {
        String path = "jobs." + jobId;

        List<String> needs = new ArrayList<>();
        YamlNode.Sequence needsNode = node.getSequence("needs");
        if (needsNode != null) {
            for (YamlNode item : needsNode.items()) {
                if (!(item instanceof YamlNode.Scalar scalar) || scalar.isNull()) {
                    throw new WorkflowParseException(path + ".needs", "Needs entries must be job ids");
                }
                needs.add(scalar.value());
            }
        }

        List<Step> steps = new ArrayList<>();
        YamlNode.Sequence stepsNode = node.getSequence("steps");
        if (stepsNode != null) {
            for (int i = 0; i < stepsNode.size(); i++) {
                steps.add(buildStep(path + ".steps[" + i + "]", i, stepsNode.get(i)));
            }
        }

        YamlNode.Mapping matrix = null;
        YamlNode.Mapping strategy = node.getMapping("strategy");
        if (strategy != null) {
            matrix = strategy.getMapping("matrix");
        }

        return new Job(
                jobId,
                node.getString("name"),
                node.get("runs-on"),
                conditionOf(path, node),
                needs,
                node.get("permissions"),
                node.get("timeout-minutes"),
                node.get("concurrency"),
                node.get("continue-on-error"),
                node.getString("uses"),
                steps,
                matrix,
                node);
    }

    private Step buildStep(String path, int index, YamlNode stepNode) throws WorkflowParseException {
        if (!(stepNode instanceof YamlNode.Mapping node)) {
            throw new WorkflowParseException(path, "Step must be a mapping");
        }
        return new Step(
                index,
                node.getString("name"),
                node.getString("id"),
                conditionOf(path, node),
                node.getString("uses"),
                node.getString("run"),
                node.getMapping("with"),
                node.getMapping("env"),
                node.get("continue-on-error"),
                node.get("timeout-minutes"),
                node);
    }

    private String conditionOf(String path, YamlNode.Mapping node) throws WorkflowParseException {
        YamlNode condition = node.get("if");
        if (condition == null) {
            return null;
        }
        if (!(condition instanceof YamlNode.Scalar scalar)) {
            throw new WorkflowParseException(path + ".if", "Condition must be a scalar expression");
        }
        return scalar.isNull() ? null : scalar.value();
    }
}
