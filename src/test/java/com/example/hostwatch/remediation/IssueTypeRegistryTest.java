package com.example.hostwatch.remediation;

import com.example.hostwatch.config.InvalidConfigurationException;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssueTypeRegistryTest {

    @Test
    @DisplayName("Each metric kind maps to its issue type")
    void mapping() {
        IssueTypeRegistry registry = new IssueTypeRegistry(new MonitorProperties());

        assertThat(registry.issueTypeFor(MetricKind.CPU)).isEqualTo(IssueType.HIGH_CPU);
        assertThat(registry.issueTypeFor(MetricKind.MEMORY)).isEqualTo(IssueType.HIGH_MEMORY);
        assertThat(registry.issueTypeFor(MetricKind.DISK)).isEqualTo(IssueType.HIGH_DISK);
        assertThat(registry.issueTypeFor(MetricKind.SERVICE_HEALTH)).isEqualTo(IssueType.SERVICE_RESTART);
    }

    @Test
    @DisplayName("Only enabled issue types are remediable")
    void enabledSubset() {
        MonitorProperties properties = new MonitorProperties();
        properties.getRemediation().setEnabledIssueTypes(List.of("high_cpu", "HIGH_DISK "));

        IssueTypeRegistry registry = new IssueTypeRegistry(properties);

        assertThat(registry.isRemediable(MetricKind.CPU)).isTrue();
        assertThat(registry.isRemediable(MetricKind.DISK)).isTrue();
        assertThat(registry.isRemediable(MetricKind.MEMORY)).isFalse();
        assertThat(registry.isRemediable(MetricKind.SERVICE_HEALTH)).isFalse();
    }

    @Test
    @DisplayName("Unknown issue types fail at startup")
    void rejectsUnknown() {
        MonitorProperties properties = new MonitorProperties();
        properties.getRemediation().setEnabledIssueTypes(List.of("high_cpu", "reboot_host"));

        assertThatThrownBy(() -> new IssueTypeRegistry(properties))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("reboot_host");
    }

    @Test
    @DisplayName("Reports enabled types the executor does not list")
    void unsupportedBy() {
        IssueTypeRegistry registry = new IssueTypeRegistry(new MonitorProperties());

        assertThat(registry.unsupportedBy(List.of("high_cpu", "high_memory", "high_disk")))
                .containsExactly(IssueType.SERVICE_RESTART);
    }
}
