package io.invoicebot.server.automation;

import io.invoicebot.server.config.InvoiceBotProperties;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Acts on a single candidate with bounded retries and exponential backoff. Driver failures end up as step log
 * entries and never propagate to the caller.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final InvoiceBotProperties properties;
    private final Sleeper sleeper;

    public StepExecutor(InvoiceBotProperties properties, Sleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public AttemptOutcome attempt(PageDriver driver, StepLog stepLog, Route route, PageElement element) {
        int maxRetries = Math.max(1, properties.getRouter().getMaxRetries());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            boolean retry = attempt > 0;
            if (retry) {
                try {
                    sleeper.sleep(backoffFor(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Backoff on route {} interrupted, cancelling session {}", route.name(), stepLog.sessionId());
                    return AttemptOutcome.CANCELLED;
                }
                if (!isInteractable(driver, element)) {
                    stepLog.record(route.name(), ActionType.VALIDATE_VISIBILITY, element.selector(),
                        ResultStatus.NOT_VISIBLE, 0L, true, "Candidate stopped being interactable before retry", null);
                    return AttemptOutcome.EXHAUSTED;
                }
            }
            ResultStatus status = actOnce(driver, stepLog, route.name(), element, route.action(),
                route.action().actionType(), retry, null);
            if (status == ResultStatus.SUCCESS) {
                return AttemptOutcome.SUCCEEDED;
            }
        }
        return AttemptOutcome.EXHAUSTED;
    }

    public ResultStatus actOnce(
        PageDriver driver,
        StepLog stepLog,
        String routeName,
        PageElement element,
        RouteAction action,
        ActionType recordedAs,
        boolean retryUsed,
        String reasoning
    ) {
        long started = System.nanoTime();
        ResultStatus status;
        String description;
        try {
            String urlBefore = driver.currentUrl();
            ActionResult result = driver.act(element, action);
            String urlAfter = driver.currentUrl();
            status = evaluate(action, result, urlBefore, urlAfter);
            description = status == ResultStatus.SUCCESS
                ? action + " succeeded, now at " + urlAfter
                : action + " not confirmed: " + (result.success() ? "page at " + urlAfter : result.message());
        } catch (RuntimeException e) {
            log.debug("Driver failed acting on {} for route {}", element.selector(), routeName, e);
            status = ResultStatus.ERROR;
            description = "Driver error: " + e.getMessage();
        }
        stepLog.record(routeName, recordedAs, element.selector(), status, elapsedMs(started), retryUsed, description,
            reasoning);
        return status;
    }

    public Duration backoffFor(int failedAttempt) {
        return Duration.ofMillis(properties.getRouter().getBackoffBaseMs() << failedAttempt);
    }

    boolean isInteractable(PageDriver driver, PageElement element) {
        try {
            return driver.isInteractable(element);
        } catch (RuntimeException e) {
            log.debug("Interactability check failed for {}", element.selector(), e);
            return false;
        }
    }

    private ResultStatus evaluate(RouteAction action, ActionResult result, String urlBefore, String urlAfter) {
        if (!result.success()) {
            return ResultStatus.FAILED;
        }
        return switch (action) {
            case CLICK -> ResultStatus.SUCCESS;
            case NAVIGATE -> isDestination(urlAfter) ? ResultStatus.SUCCESS : ResultStatus.PARTIAL;
            case SUBMIT -> Objects.equals(urlBefore, urlAfter) ? ResultStatus.PARTIAL : ResultStatus.SUCCESS;
        };
    }

    private boolean isDestination(String url) {
        List<String> keywords = properties.getRouter().getDestinationKeywords();
        if (keywords == null || keywords.isEmpty()) {
            return true;
        }
        String lower = url == null ? "" : url.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
