package com.example.hostwatch.remediation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.function.Function;

/**
 * In-process remediation that only describes what would be done.
 * Used for dry runs and for hosts without a remediation service.
 */
@Slf4j
public class SimulatedRemediationExecutor implements RemediationExecutor {

    private final Map<IssueType, Function<RemediationRequest, List<String>>> handlers = new EnumMap<>(IssueType.class);

    public SimulatedRemediationExecutor() {
        handlers.put(IssueType.HIGH_CPU, request -> List.of(
                "Identified top CPU consumers on " + hostOf(request) + " (simulated)",
                "Would terminate runaway processes above the CPU threshold (simulated)",
                "Cleared temporary files (simulated)"));
        handlers.put(IssueType.HIGH_MEMORY, request -> List.of(
                "Identified top memory consumers on " + hostOf(request) + " (simulated)",
                "Would drop page caches (simulated)"));
        handlers.put(IssueType.HIGH_DISK, request -> List.of(
                "Would delete temporary files older than 1 day (simulated)",
                "Would remove rotated log files older than 7 days (simulated)"));
        handlers.put(IssueType.SERVICE_RESTART, request -> List.of(
                "Would restart service " + request.context().getOrDefault("serviceName", "unknown-service")
                        + " (simulated)"));
    }

    @Override
    public RemediationOutcome execute(RemediationRequest request) {
        long start = System.nanoTime();
        Optional<IssueType> issueType = IssueType.fromId(request.issueType());
        if (issueType.isEmpty() || !handlers.containsKey(issueType.get())) {
            return RemediationOutcome.failure("Unknown issue type: " + request.issueType(), null);
        }

        List<String> steps = handlers.get(issueType.get()).apply(request);
        steps.forEach(step -> log.info("[SIMULATED] {}: {}", request.issueType(), step));
        return RemediationOutcome.success(
                "Simulated remediation for " + request.issueType() + " completed",
                steps,
                Duration.ofNanos(System.nanoTime() - start));
    }

    @Override
    public List<String> availableActions() {
        return handlers.keySet().stream().map(IssueType::id).toList();
    }

    @Override
    public String mode() {
        return "simulated";
    }

    private static String hostOf(RemediationRequest request) {
        return String.valueOf(request.context().getOrDefault("hostname", "host"));
    }
}
