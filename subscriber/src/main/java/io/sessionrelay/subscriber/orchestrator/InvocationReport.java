package io.sessionrelay.subscriber.orchestrator;

import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcomes of every task of one invocation.
 */
@Value
public class InvocationReport {
    String invocationId;
    InvocationState state;
    List<SessionOutcome> outcomes;
    Duration duration;

    public SessionOutcome primary() {
        return outcomes.stream()
            .filter(o -> o.getRole() == SessionOutcome.Role.PRIMARY)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Report without primary outcome"));
    }

    public List<SessionOutcome> additional() {
        return outcomes.stream()
            .filter(o -> o.getRole() == SessionOutcome.Role.ADDITIONAL)
            .collect(Collectors.toList());
    }

    /**
     * @return ids of the sessions whose messages were forwarded and completed, primary first
     */
    public List<String> processedSessions() {
        return outcomes.stream()
            .filter(o -> o.getStatus() == SessionOutcome.Status.COMPLETED)
            .map(SessionOutcome::getSessionId)
            .collect(Collectors.toList());
    }

    public long count(SessionOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
