package com.example.hostwatch.remediation;

import java.io.IOException;
import java.util.List;

/**
 * Capability that carries out a remediation request.
 * The dispatcher's retry and timeout policy is the same whichever implementation runs.
 */
public interface RemediationExecutor {

    /**
     * Execute one attempt.
     *
     * @return the outcome, including application-level failures reported by the executor
     * @throws IOException on transport failure (connection refused, timeout, retryable status)
     */
    RemediationOutcome execute(RemediationRequest request) throws IOException;

    /**
     * Issue type ids this executor can handle.
     */
    List<String> availableActions() throws IOException;

    /**
     * Execution mode name, for logs and status output.
     */
    String mode();
}
