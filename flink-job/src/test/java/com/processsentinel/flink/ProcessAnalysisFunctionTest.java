package com.processsentinel.flink;

import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.MetricSnapshot;
import com.processsentinel.core.model.Sample;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.operators.KeyedProcessOperator;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Queue;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Operator-level tests for {@link ProcessAnalysisFunction} using Flink's keyed
 * test harness.
 */
class ProcessAnalysisFunctionTest {

    private static final long IDLE_TIMEOUT_MS = 1_000;

    private ProcessAnalysisFunction function;
    private KeyedOneInputStreamOperatorTestHarness<String, Sample, Alert> harness;

    @BeforeEach
    void setUp() throws Exception {
        MonitorConfig config = MonitorConfig.defaults();
        config.getClassifier().setNumTrees(10);

        function = new ProcessAnalysisFunction(config, IDLE_TIMEOUT_MS);
        harness = new KeyedOneInputStreamOperatorTestHarness<>(
                new KeyedProcessOperator<>(function), Sample::getProcessId, Types.STRING);
        harness.setProcessingTime(0);
        harness.open();
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    @Test
    @DisplayName("Should route system samples to system thresholds without snapshots")
    void shouldCheckSystemSamples() throws Exception {
        harness.processElement(Sample.builder(Sample.SYSTEM_PROCESS_ID).cpu(96).build(), 0);

        List<Alert> alerts = harness.extractOutputValues();
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.CRITICAL);
            assertThat(alert.getMetric()).isEqualTo("cpu");
        });
        assertThat(harness.getSideOutput(ProcessAnalysisFunction.METRIC_SNAPSHOTS)).isNullOrEmpty();
        assertThat(function.getEngine().getHistory().size(Sample.SYSTEM_PROCESS_ID)).isZero();
    }

    @Test
    @DisplayName("Should emit one metric snapshot per process sample")
    void shouldEmitSnapshotPerProcessSample() throws Exception {
        harness.processElement(Sample.builder("p1").processName("nginx").cpu(20).memory(300).build(), 0);
        harness.processElement(Sample.builder("p2").processName("java").cpu(35).memory(900).build(), 0);
        harness.processElement(Sample.builder("p1").processName("nginx").cpu(22).memory(305).build(), 0);

        Queue<StreamRecord<MetricSnapshot>> snapshots =
                harness.getSideOutput(ProcessAnalysisFunction.METRIC_SNAPSHOTS);
        assertThat(snapshots).hasSize(3);
        assertThat(snapshots).extracting(r -> r.getValue().getProcessId())
                .containsExactly("p1", "p2", "p1");
        assertThat(harness.extractOutputValues()).isEmpty();
        assertThat(function.getEngine().getHistory().size("p1")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should emit process alerts on the main output")
    void shouldEmitProcessAlerts() throws Exception {
        harness.processElement(Sample.builder("p7").processName("encoder").cpu(97).build(), 0);

        assertThat(harness.extractOutputValues())
                .extracting(Alert::getProcessId)
                .contains("p7");
    }

    @Test
    @DisplayName("Should forget a process once its idle deadline passes")
    void shouldEvictIdleProcess() throws Exception {
        harness.processElement(Sample.builder("p1").cpu(97).build(), 0);
        assertThat(function.getEngine().getAlertEngine().activeAlerts()).isNotEmpty();

        harness.setProcessingTime(600);
        harness.processElement(Sample.builder("p1").cpu(40).build(), 0);

        harness.setProcessingTime(IDLE_TIMEOUT_MS + 100);
        assertThat(function.getEngine().getHistory().size("p1")).isEqualTo(2);

        harness.setProcessingTime(600 + IDLE_TIMEOUT_MS);
        assertThat(function.getEngine().getHistory().size("p1")).isZero();
        assertThat(function.getEngine().getAlertEngine().activeAlerts()).isEmpty();
        assertThat(function.getEngine().getAlertEngine().getCooldowns().size()).isZero();
    }
}
