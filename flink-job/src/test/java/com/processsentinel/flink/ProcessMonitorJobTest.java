package com.processsentinel.flink;

import com.processsentinel.core.config.MonitorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProcessMonitorJob} configuration helpers and
 * {@link ProcessAnalysisFunction} construction.
 */
class ProcessMonitorJobTest {

    @Test
    @DisplayName("Should load the monitor YAML named by the job config")
    void shouldLoadMonitorConfigFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "cooldownSeconds: 15\nhistoryCapacity: 40\n");
        JobConfig config = new JobConfig.Builder().monitorConfigPath(file.toString()).build();

        MonitorConfig monitorConfig = ProcessMonitorJob.loadMonitorConfig(config);

        assertThat(monitorConfig.getCooldownSeconds()).isEqualTo(15);
        assertThat(monitorConfig.getHistoryCapacity()).isEqualTo(40);
    }

    @Test
    @DisplayName("Analysis function should reject a non-positive idle timeout")
    void shouldRejectIdleTimeout() {
        assertThatThrownBy(() -> new ProcessAnalysisFunction(new MonitorConfig(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("idleTimeoutMs");
        assertThatThrownBy(() -> new ProcessAnalysisFunction(null, 1000))
                .isInstanceOf(NullPointerException.class);
    }
}
