package com.example.hostwatch.remediation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Compares the enabled issue types with what the remediation executor supports once
 * the application is up. Mismatches are warnings: the service may simply not be up yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemediationStartupCheck {

    private final RemediationExecutor executor;
    private final IssueTypeRegistry issueTypes;

    @EventListener(ApplicationReadyEvent.class)
    public void verifySupportedActions() {
        try {
            List<String> actions = executor.availableActions();
            List<IssueType> unsupported = issueTypes.unsupportedBy(actions);
            if (unsupported.isEmpty()) {
                log.info("Remediation executor ({}) supports all {} enabled issue types",
                        executor.mode(), issueTypes.getEnabled().size());
            } else {
                log.warn("Remediation executor ({}) does not list enabled issue types {}; available: {}",
                        executor.mode(), unsupported.stream().map(IssueType::id).toList(), actions);
            }
        } catch (IOException e) {
            log.warn("Could not list remediation actions from {} executor: {}", executor.mode(), e.getMessage());
        }
    }
}
