package io.sessionrelay.subscriber.orchestrator;

import io.sessionrelay.core.error.SessionRelayException;

/**
 * The primary session of an invocation failed.
 * <p>
 * Raised only after every additional worker settled; the report describes them.
 * </p>
 */
public class InvocationFailedException extends SessionRelayException {
    private final transient InvocationReport report;

    public InvocationFailedException(InvocationReport report, Throwable primaryCause) {
        super("Invocation " + report.getInvocationId() + " failed: primary session "
            + report.primary().getSessionId() + " " + report.primary().getStatus(), primaryCause);
        this.report = report;
    }

    public InvocationReport getReport() {
        return report;
    }
}
