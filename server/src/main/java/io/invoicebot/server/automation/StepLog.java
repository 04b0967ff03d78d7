package io.invoicebot.server.automation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Append-only audit trail of one automation session. Step numbers continue after the highest number already
 * persisted for the session and are never reused.
 */
public class StepLog {

    private static final Logger log = LoggerFactory.getLogger(StepLog.class);

    private final String sessionId;
    private final Long jobId;
    private final AutomationStepRepository repository;
    private final Function<String, Optional<String>> evidenceCapture;
    private final Consumer<AutomationStep> listener;
    private final Clock clock;
    private final List<AutomationStep> steps = new ArrayList<>();
    private int nextStepNumber;

    StepLog(
        String sessionId,
        Long jobId,
        int firstStepNumber,
        AutomationStepRepository repository,
        Function<String, Optional<String>> evidenceCapture,
        Consumer<AutomationStep> listener,
        Clock clock
    ) {
        this.sessionId = sessionId;
        this.jobId = jobId;
        this.nextStepNumber = firstStepNumber;
        this.repository = repository;
        this.evidenceCapture = evidenceCapture;
        this.listener = listener;
        this.clock = clock;
    }

    public synchronized AutomationStep record(
        String routeName,
        ActionType actionType,
        String selector,
        ResultStatus status,
        long timingMs,
        boolean retryUsed,
        String description,
        String reasoning
    ) {
        int stepNumber = nextStepNumber++;
        String evidenceRef = captureEvidence(stepNumber, actionType);
        AutomationStep step = new AutomationStep(sessionId, stepNumber, routeName, actionType, selector, description,
            status, timingMs, retryUsed, reasoning, evidenceRef, clock.instant());
        steps.add(step);
        persist(step);
        listener.accept(step);
        return step;
    }

    public synchronized List<AutomationStep> steps() {
        return List.copyOf(steps);
    }

    public String sessionId() {
        return sessionId;
    }

    private String captureEvidence(int stepNumber, ActionType actionType) {
        String name = sessionId + "_step_" + stepNumber + "_" + actionType.name().toLowerCase(Locale.ROOT);
        try {
            return evidenceCapture.apply(name).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Evidence capture failed for step {} of session {}", stepNumber, sessionId, e);
            return null;
        }
    }

    private void persist(AutomationStep step) {
        if (repository == null) {
            return;
        }
        try {
            repository.insert(step, jobId);
        } catch (DataAccessException e) {
            log.warn("Failed to persist step {} of session {}", step.stepNumber(), sessionId, e);
        }
    }
}
