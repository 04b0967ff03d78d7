package io.invoicebot.server.automation;

import io.invoicebot.server.config.InvoiceBotProperties;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class StepLogFactory {

    private final AutomationStepRepository repository;
    private final InvoiceBotProperties properties;
    private final Clock clock;

    public StepLogFactory(AutomationStepRepository repository, InvoiceBotProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public StepLog open(String sessionId, Long jobId, PageDriver driver, Consumer<AutomationStep> listener) {
        Function<String, Optional<String>> evidence = properties.getRouter().isCaptureEvidence()
            ? driver::captureScreenshot
            : name -> Optional.empty();
        return new StepLog(sessionId, jobId, repository.maxStepNumber(sessionId) + 1, repository, evidence, listener,
            clock);
    }

    public static StepLog detached(String sessionId, Clock clock) {
        return new StepLog(sessionId, null, 1, null, name -> Optional.empty(), step -> { }, clock);
    }
}
