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
import dev.mars.ghaverify.workflow.Job;
import dev.mars.ghaverify.workflow.NodeKind;
import dev.mars.ghaverify.workflow.Step;
import dev.mars.ghaverify.workflow.StepKind;
import dev.mars.ghaverify.workflow.Workflow;
import dev.mars.ghaverify.workflow.YamlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the key structure of two workflows.
 *
 * <p>Scalar values are opaque: only keys, node kinds, sequence lengths and scalar types are
 * compared. The exceptions are the values that are themselves structure, namely {@code needs},
 * {@code strategy.matrix} and the identity of each step, which are compared unconditionally.
 * Added, removed and re-typed keys are critical unless an active {@link AllowedChangeRule}
 * covers them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StructuralVerifier {

    private static final String JOBS = KeyStructureExtractor.ROOT + ".jobs";

    private static final List<PathPattern> LENGTH_CRITICAL = List.of(
            PathPattern.compile("root.jobs.*.steps"),
            PathPattern.compile("root.jobs.*.needs"),
            PathPattern.compile("root.jobs.*.strategy.matrix.*"));

    private final Logger logger;
    private final AllowedChangeRules rules;
    private final RunCommandNormalizer normalizer;

    public StructuralVerifier(CommandRewriteTable rewriteTable) {
        this(LoggerFactory.getLogger(StructuralVerifier.class), AllowedChangeRules.defaults(),
                new RunCommandNormalizer(rewriteTable));
    }

    public StructuralVerifier(Logger logger, AllowedChangeRules rules, RunCommandNormalizer normalizer) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        this.rules = Objects.requireNonNull(rules, "Rules cannot be null");
        this.normalizer = Objects.requireNonNull(normalizer, "Normalizer cannot be null");
    }

    public StructuralResult verify(Workflow original, Workflow modified, Set<FixTag> permittedFixes, boolean strictMode) {
        RuleMatcher matcher = new RuleMatcher(rules, permittedFixes, strictMode);
        Comparison comparison = new Comparison(original, modified, matcher);
        StructuralResult result = comparison.run();

        logger.debug("Structural comparison finished: safe={}, {} critical, {} warning(s)",
                result.isSafe(), result.getCriticalIssues().size(), result.getWarnings().size());
        return result;
    }

    /**
     * State of one comparison. Checks run in a fixed order and record subtrees that an earlier
     * check has already accounted for, so each difference is reported once.
     */
    private final class Comparison {

        private final Workflow original;
        private final Workflow modified;
        private final Map<String, KeyStructureNode> before;
        private final Map<String, KeyStructureNode> after;
        private final RuleMatcher matcher;
        private final List<StructuralIssue> issues = new ArrayList<>();
        private final List<String> handled = new ArrayList<>();

        Comparison(Workflow original, Workflow modified, RuleMatcher matcher) {
            this.original = original;
            this.modified = modified;
            this.before = KeyStructureExtractor.extract(original.getRoot());
            this.after = KeyStructureExtractor.extract(modified.getRoot());
            this.matcher = matcher;
        }

        StructuralResult run() {
            checkTypeChanges();
            checkDependencies();
            checkLengths();
            checkSteps();
            checkRemovedPaths();
            checkAddedPaths();
            checkJobOrder();
            checkScalarTypes();
            return new StructuralResult(issues);
        }

        private void checkTypeChanges() {
            for (KeyStructureNode node : before.values()) {
                KeyStructureNode other = after.get(node.path());
                if (other == null || other.kind() == node.kind() || isHandled(node.path())) {
                    continue;
                }
                if (matcher.isTypeChangeAllowed(node.path(), node.kind(), other.kind())) {
                    allowed(ChangeKind.TYPE_CHANGE, node.path());
                } else {
                    critical(IssueKind.TYPE_CHANGED, node.path(),
                            "Node changed from " + node.kind() + " to " + other.kind());
                }
                handled.add(node.path());
            }
        }

        private void checkDependencies() {
            for (Job job : commonJobs()) {
                Job changed = modified.getJob(job.getId());
                String jobPath = JOBS + "." + job.getId();

                if (!job.getNeeds().equals(changed.getNeeds())) {
                    critical(IssueKind.NEEDS_CHANGED, jobPath + ".needs",
                            "Job dependencies changed from " + job.getNeeds() + " to " + changed.getNeeds());
                    handled.add(jobPath + ".needs");
                }

                YamlNode matrix = matrixOf(job);
                YamlNode changedMatrix = matrixOf(changed);
                if (!Objects.equals(matrix, changedMatrix)) {
                    critical(IssueKind.MATRIX_CHANGED, jobPath + ".strategy.matrix",
                            "Build matrix changed from " + render(matrix) + " to " + render(changedMatrix));
                    handled.add(jobPath + ".strategy.matrix");
                }
            }
        }

        private void checkLengths() {
            for (KeyStructureNode node : before.values()) {
                KeyStructureNode other = after.get(node.path());
                if (other == null || node.kind() != NodeKind.SEQUENCE || other.kind() != NodeKind.SEQUENCE
                        || isHandled(node.path()) || !isLengthCritical(node.path())) {
                    continue;
                }
                if (node.length() != other.length()) {
                    critical(IssueKind.LENGTH_CHANGED, node.path(),
                            "Length changed from " + node.length() + " to " + other.length());
                    handled.add(node.path());
                }
            }
        }

        private void checkSteps() {
            for (Job job : commonJobs()) {
                Job changed = modified.getJob(job.getId());
                String stepsPath = JOBS + "." + job.getId() + ".steps";
                List<Step> steps = job.getSteps();
                List<Step> changedSteps = changed.getSteps();
                if (isHandled(stepsPath) || steps.size() != changedSteps.size() || steps.isEmpty()) {
                    continue;
                }

                List<String> fingerprints = StepFingerprint.of(steps, normalizer);
                List<String> changedFingerprints = StepFingerprint.of(changedSteps, normalizer);
                if (fingerprints.equals(changedFingerprints)) {
                    continue;
                }

                if (sorted(fingerprints).equals(sorted(changedFingerprints))) {
                    critical(IssueKind.STEP_REORDERED, stepsPath, "Steps were reordered");
                    handled.add(stepsPath);
                    continue;
                }

                for (int i = 0; i < steps.size(); i++) {
                    if (!fingerprints.get(i).equals(changedFingerprints.get(i))) {
                        compareStep(stepsPath + "[" + i + "]", steps.get(i), changedSteps.get(i));
                    }
                }
            }
        }

        private void compareStep(String stepPath, Step step, Step changed) {
            StepKind kind = step.getKind();
            StepKind changedKind = changed.getKind();

            if (kind == StepKind.RUN && changedKind == StepKind.RUN) {
                String runPath = stepPath + ".run";
                if (matcher.isAllowed(runPath, ChangeKind.VALUE_REWRITE)
                        && normalizer.isPinningRewrite(step.getRun(), changed.getRun())) {
                    allowed(ChangeKind.VALUE_REWRITE, runPath);
                } else {
                    critical(IssueKind.STEP_VALUE_CHANGED, runPath, "Command body changed");
                }
            } else if (kind == StepKind.USES && changedKind == StepKind.USES) {
                critical(IssueKind.STEP_VALUE_CHANGED, stepPath + ".uses",
                        "Action changed from " + step.getActionName() + " to " + changed.getActionName());
            } else if (kind != changedKind) {
                critical(IssueKind.STEP_TYPE_CHANGED, stepPath,
                        "Step changed from " + kind + " to " + changedKind);
                handled.add(stepPath);
            }
        }

        private void checkRemovedPaths() {
            for (String path : before.keySet()) {
                if (after.containsKey(path) || isHandled(path) || !isTopMost(path, after)) {
                    continue;
                }
                if (matcher.isAllowed(path, ChangeKind.REMOVAL)) {
                    allowed(ChangeKind.REMOVAL, path);
                } else {
                    critical(IssueKind.KEY_REMOVED, path, "Key removed");
                }
            }
        }

        private void checkAddedPaths() {
            for (String path : after.keySet()) {
                if (before.containsKey(path) || isHandled(path) || !isTopMost(path, before)) {
                    continue;
                }
                if (matcher.isAllowed(path, ChangeKind.ADDITION)) {
                    allowed(ChangeKind.ADDITION, path);
                } else {
                    critical(IssueKind.KEY_ADDED, path, "Key added");
                }
            }
        }

        private void checkJobOrder() {
            List<String> order = new ArrayList<>(original.getJobs().keySet());
            order.retainAll(modified.getJobs().keySet());
            List<String> changedOrder = new ArrayList<>(modified.getJobs().keySet());
            changedOrder.retainAll(original.getJobs().keySet());

            if (!order.equals(changedOrder)) {
                critical(IssueKind.ORDER_CHANGED, JOBS, "Job order changed from " + order + " to " + changedOrder);
            }
        }

        private void checkScalarTypes() {
            for (KeyStructureNode node : before.values()) {
                KeyStructureNode other = after.get(node.path());
                if (other == null || node.kind() != NodeKind.SCALAR || other.kind() != NodeKind.SCALAR
                        || node.scalarType() == other.scalarType() || isHandled(node.path())) {
                    continue;
                }
                issues.add(StructuralIssue.warning(IssueKind.SCALAR_TYPE_CHANGED, node.path(),
                        "Scalar type changed from " + node.scalarType() + " to " + other.scalarType()));
            }
        }

        private List<Job> commonJobs() {
            List<Job> jobs = new ArrayList<>();
            for (Job job : original.getJobs().values()) {
                if (modified.getJob(job.getId()) != null) {
                    jobs.add(job);
                }
            }
            return jobs;
        }

        /**
         * A path is reported only when its parent exists on the other side; otherwise the
         * parent itself is the reported difference.
         */
        private boolean isTopMost(String path, Map<String, KeyStructureNode> otherSide) {
            String parent = KeyStructureExtractor.parentOf(path);
            return parent == null || otherSide.containsKey(parent);
        }

        private boolean isHandled(String path) {
            for (String subtree : handled) {
                if (path.equals(subtree) || KeyStructureExtractor.isDescendant(path, subtree)) {
                    return true;
                }
            }
            return false;
        }

        private void critical(IssueKind kind, String path, String message) {
            StructuralIssue issue = StructuralIssue.critical(kind, path, message);
            logger.debug("Structural issue: {}", issue);
            issues.add(issue);
        }

        private void allowed(ChangeKind kind, String path) {
            Optional<AllowedChangeRule> rule = matcher.findRule(path, kind);
            logger.debug("Permitted {} at {} by rule {}", kind, path, rule.map(Object::toString).orElse("-"));
        }
    }

    private static YamlNode matrixOf(Job job) {
        YamlNode.Mapping strategy = job.getNode().getMapping("strategy");
        return strategy != null ? strategy.get("matrix") : null;
    }

    private static String render(YamlNode node) {
        return node != null ? node.toCanonicalString() : "none";
    }

    private static boolean isLengthCritical(String path) {
        for (PathPattern pattern : LENGTH_CRITICAL) {
            if (pattern.matchesExactly(path)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(null);
        return copy;
    }
}
