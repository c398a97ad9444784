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

package dev.mars.ghaverify.observability;

import dev.mars.ghaverify.core.VerificationMode;
import dev.mars.ghaverify.structural.IssueKind;
import dev.mars.ghaverify.structural.StructuralIssue;
import dev.mars.ghaverify.structural.StructuralResult;
import dev.mars.ghaverify.verification.VerificationStatus;
import dev.mars.ghaverify.verification.VerificationVerdict;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private VerificationMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new VerificationMetrics(meterProvider.get(VerificationMetrics.METER_NAME));
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    private MetricData metric(Collection<MetricData> data, String name) {
        return data.stream()
                .filter(metric -> metric.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Metric not exported: " + name));
    }

    @Test
    void testVerdictCounters() {
        StructuralResult unsafe = new StructuralResult(List.of(
                StructuralIssue.critical(IssueKind.NEEDS_CHANGED, "root.jobs.a.needs", "changed")));

        metrics.recordStarted();
        metrics.recordVerdict(VerificationVerdict.builder()
                .pairId("a.yml")
                .status(VerificationStatus.UNSAFE)
                .mode(VerificationMode.STRUCTURAL)
                .confidence(0.0)
                .structural(unsafe)
                .elapsed(Duration.ofMillis(20))
                .build());

        Collection<MetricData> data = reader.collectAllMetrics();

        LongPointData total = metric(data, "ghaverify.verification.total").getLongSumData().getPoints().iterator().next();
        assertThat(total.getValue()).isEqualTo(1);
        assertThat(total.getAttributes().get(AttributeKey.stringKey("verification.status"))).isEqualTo("UNSAFE");

        LongPointData issues = metric(data, "ghaverify.structural.issues").getLongSumData().getPoints().iterator().next();
        assertThat(issues.getAttributes().get(AttributeKey.stringKey("issue.kind"))).isEqualTo("NEEDS_CHANGED");

        assertThat(metric(data, "ghaverify.verification.duration.seconds").getHistogramData().getPoints())
                .hasSize(1);
        assertThat(metrics.getActiveVerifications()).isZero();
    }

    @Test
    void testActiveGauge() {
        metrics.recordStarted();
        metrics.recordStarted();

        MetricData active = metric(reader.collectAllMetrics(), "ghaverify.verification.active");

        assertThat(active.getLongGaugeData().getPoints().iterator().next().getValue()).isEqualTo(2);
    }

    @Test
    void testNoopMetricsAcceptRecords() {
        VerificationMetrics noop = VerificationMetrics.noop();
        noop.recordStarted();

        assertThat(noop.getActiveVerifications()).isEqualTo(1);
    }
}
