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

import dev.mars.ghaverify.workflow.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Position-independent identity of a step: the action name without its version pin for
 * {@code uses} steps, the normalized body for {@code run} steps and the sorted key set
 * otherwise.
 */
final class StepFingerprint {

    private StepFingerprint() {
    }

    static String of(Step step, RunCommandNormalizer normalizer) {
        switch (step.getKind()) {
            case USES:
                return "uses:" + step.getActionName();
            case RUN:
                return "run:" + normalizer.normalize(step.getRun());
            default:
                List<String> keys = new ArrayList<>(step.getNode().keys());
                keys.sort(null);
                return "other:" + keys;
        }
    }

    static List<String> of(List<Step> steps, RunCommandNormalizer normalizer) {
        List<String> result = new ArrayList<>(steps.size());
        for (Step step : steps) {
            result.add(of(step, normalizer));
        }
        return result;
    }
}
