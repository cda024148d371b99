package com.example.hostwatch.remediation;

import com.example.hostwatch.config.MonitorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RemediationStartupCheckTest {

    private final RemediationExecutor executor = mock(RemediationExecutor.class);
    private final IssueTypeRegistry issueTypes = new IssueTypeRegistry(new MonitorProperties());

    @Test
    @DisplayName("Listing the executor actions at startup does not fail on a partial list")
    void partialSupport() throws Exception {
        when(executor.mode()).thenReturn("live");
        when(executor.availableActions()).thenReturn(List.of("high_cpu"));

        assertThatCode(() -> new RemediationStartupCheck(executor, issueTypes).verifySupportedActions())
                .doesNotThrowAnyException();
        verify(executor).availableActions();
    }

    @Test
    @DisplayName("An unreachable remediation service only produces a warning")
    void unreachableService() throws Exception {
        when(executor.mode()).thenReturn("live");
        when(executor.availableActions()).thenThrow(new IOException("connection refused"));

        assertThatCode(() -> new RemediationStartupCheck(executor, issueTypes).verifySupportedActions())
                .doesNotThrowAnyException();
    }
}
