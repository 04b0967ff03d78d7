package io.invoicebot.server.automation;

import io.invoicebot.server.config.InvoiceBotProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Walks routes in ascending priority, then asks the decision oracle once, then escalates.
 * The first confirmed success anywhere ends routing.
 */
@Service
public class FallbackRouter {

    private static final Logger log = LoggerFactory.getLogger(FallbackRouter.class);

    static final String ORACLE_ROUTE = "oracle";
    private static final int MAX_SUMMARY_ELEMENTS = 20;

    private final StepExecutor stepExecutor;
    private final DecisionOracle oracle;
    private final Executor oracleExecutor;
    private final InvoiceBotProperties properties;

    public FallbackRouter(
        StepExecutor stepExecutor,
        DecisionOracle oracle,
        @Qualifier("oracleExecutor") Executor oracleExecutor,
        InvoiceBotProperties properties
    ) {
        this.stepExecutor = stepExecutor;
        this.oracle = oracle;
        this.oracleExecutor = oracleExecutor;
        this.properties = properties;
    }

    public RouterOutcome route(RoutingRequest request) {
        StepLog stepLog = request.stepLog();
        List<Route> ordered = request.routes().stream()
            .sorted(Comparator.comparingInt(Route::priority))
            .toList();
        Set<String> exhausted = new LinkedHashSet<>(request.exhaustedRoutes());
        List<String> attempted = new ArrayList<>();
        Map<String, CandidateElement> seen = new LinkedHashMap<>();

        for (Route route : ordered) {
            if (exhausted.contains(route.name())) {
                log.info("Skipping route {} for session {}: exhausted in an earlier attempt",
                    route.name(), stepLog.sessionId());
                continue;
            }
            attempted.add(route.name());
            RouteAttempt result = tryRoute(request.driver(), stepLog, route, seen);
            if (result.outcome() == AttemptOutcome.SUCCEEDED) {
                log.info("Session {} succeeded via route {} ({})",
                    stepLog.sessionId(), route.name(), result.element().selector());
                return new RouterOutcome.Success(route.name(), result.element().selector(), false, stepLog.steps());
            }
            if (result.outcome() == AttemptOutcome.CANCELLED) {
                return new RouterOutcome.Cancelled(stepLog.steps());
            }
            exhausted.add(route.name());
            request.listener().routeExhausted(route, Set.copyOf(exhausted));
        }

        return consultOracle(request.driver(), stepLog, attempted, List.copyOf(seen.values()));
    }

    private RouteAttempt tryRoute(PageDriver driver, StepLog stepLog, Route route, Map<String, CandidateElement> seen) {
        for (String selector : route.candidateSelectors()) {
            long started = System.nanoTime();
            List<PageElement> found;
            try {
                found = driver.findCandidates(selector);
            } catch (RuntimeException e) {
                stepLog.record(route.name(), ActionType.SEARCH_ELEMENTS, selector, ResultStatus.ERROR,
                    elapsedMs(started), false, "Search failed: " + e.getMessage(), null);
                continue;
            }
            if (found.isEmpty()) {
                stepLog.record(route.name(), ActionType.SEARCH_ELEMENTS, selector, ResultStatus.NOT_FOUND,
                    elapsedMs(started), false, "No candidates", null);
                continue;
            }
            stepLog.record(route.name(), ActionType.SEARCH_ELEMENTS, selector, ResultStatus.SUCCESS,
                elapsedMs(started), false, found.size() + " candidates", null);

            for (PageElement element : found) {
                boolean interactable = stepExecutor.isInteractable(driver, element);
                seen.putIfAbsent(element.selector() + "|" + element.text() + "|" + element.href(),
                    CandidateElement.of(element, interactable));
                if (!interactable) {
                    stepLog.record(route.name(), ActionType.VALIDATE_VISIBILITY, element.selector(),
                        ResultStatus.NOT_VISIBLE, 0L, false, "Candidate is not interactable", null);
                    continue;
                }
                AttemptOutcome outcome = stepExecutor.attempt(driver, stepLog, route, element);
                if (outcome != AttemptOutcome.EXHAUSTED) {
                    return new RouteAttempt(outcome, element);
                }
            }
        }
        return new RouteAttempt(AttemptOutcome.EXHAUSTED, null);
    }

    private RouterOutcome consultOracle(
        PageDriver driver,
        StepLog stepLog,
        List<String> attempted,
        List<CandidateElement> candidates
    ) {
        InvoiceBotProperties.Router cfg = properties.getRouter();
        String currentUrl = safeUrl(driver);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("sessionId", stepLog.sessionId());
        context.put("currentUrl", currentUrl);
        context.put("routesAttempted", List.copyOf(attempted));
        OracleRequest request = new OracleRequest(summarize(currentUrl, candidates), context, candidates);

        long started = System.nanoTime();
        CompletableFuture<OracleResponse> future = CompletableFuture.supplyAsync(() -> oracle.suggest(request),
            oracleExecutor);
        OracleResponse response;
        try {
            response = future.get(cfg.getOracleTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Decision oracle timed out after {} ms for session {}", cfg.getOracleTimeoutMs(),
                stepLog.sessionId());
            stepLog.record(ORACLE_ROUTE, ActionType.ORACLE_DECISION, null, ResultStatus.TIMEOUT, elapsedMs(started),
                false, "Oracle did not answer within " + cfg.getOracleTimeoutMs() + " ms", null);
            return escalate(stepLog, attempted, "Decision oracle timed out");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new RouterOutcome.Cancelled(stepLog.steps());
        } catch (ExecutionException e) {
            log.warn("Decision oracle failed for session {}", stepLog.sessionId(), e.getCause());
            stepLog.record(ORACLE_ROUTE, ActionType.ORACLE_DECISION, null, ResultStatus.ERROR, elapsedMs(started),
                false, "Oracle error: " + e.getCause().getMessage(), null);
            return escalate(stepLog, attempted, "Decision oracle failed");
        }

        if (response == null || response.suggestedSelector() == null || response.suggestedSelector().isBlank()
            || response.confidence() < cfg.getOracleConfidenceThreshold()) {
            double confidence = response == null ? 0.0 : response.confidence();
            stepLog.record(ORACLE_ROUTE, ActionType.ORACLE_DECISION, response == null ? null : response.suggestedSelector(),
                ResultStatus.FAILED, elapsedMs(started), false,
                "Suggestion confidence " + confidence + " below threshold " + cfg.getOracleConfidenceThreshold(),
                response == null ? null : response.reasoning());
            return escalate(stepLog, attempted, "No usable oracle suggestion");
        }
        stepLog.record(ORACLE_ROUTE, ActionType.ORACLE_DECISION, response.suggestedSelector(), ResultStatus.SUCCESS,
            elapsedMs(started), false, "Suggestion confidence " + response.confidence(), response.reasoning());

        PageElement target = firstInteractable(driver, response.suggestedSelector());
        if (target == null) {
            stepLog.record(ORACLE_ROUTE, ActionType.ORACLE_ATTEMPT, response.suggestedSelector(),
                ResultStatus.NOT_FOUND, 0L, false, "Suggested element not found or not interactable",
                response.reasoning());
            return escalate(stepLog, attempted, "Oracle suggestion not actionable");
        }
        ResultStatus status = stepExecutor.actOnce(driver, stepLog, ORACLE_ROUTE, target, RouteAction.NAVIGATE,
            ActionType.ORACLE_ATTEMPT, false, response.reasoning());
        if (status == ResultStatus.SUCCESS) {
            log.info("Session {} succeeded via oracle suggestion {}", stepLog.sessionId(), target.selector());
            return new RouterOutcome.Success(ORACLE_ROUTE, target.selector(), true, stepLog.steps());
        }
        return escalate(stepLog, attempted, "Oracle suggestion failed with " + status);
    }

    private PageElement firstInteractable(PageDriver driver, String selector) {
        try {
            for (PageElement element : driver.findCandidates(selector)) {
                if (stepExecutor.isInteractable(driver, element)) {
                    return element;
                }
            }
        } catch (RuntimeException e) {
            log.debug("Search for oracle selector {} failed", selector, e);
        }
        return null;
    }

    private RouterOutcome escalate(StepLog stepLog, List<String> attempted, String reason) {
        log.warn("Session {} requires intervention after routes {}: {}", stepLog.sessionId(), attempted, reason);
        stepLog.record(null, ActionType.ESCALATION, null, ResultStatus.REQUIRES_INTERVENTION, 0L, false,
            "All routes exhausted: " + reason, null);
        return new RouterOutcome.RequiresIntervention(reason, List.copyOf(attempted), stepLog.steps());
    }

    private String summarize(String currentUrl, List<CandidateElement> candidates) {
        String elements = candidates.stream()
            .limit(MAX_SUMMARY_ELEMENTS)
            .map(c -> c.selector() + " '" + c.text() + "' -> " + c.href() + (c.visible() ? "" : " (hidden)"))
            .collect(Collectors.joining("; "));
        return "url=" + currentUrl + "; candidates=[" + elements + "]";
    }

    private String safeUrl(PageDriver driver) {
        try {
            return driver.currentUrl();
        } catch (RuntimeException e) {
            log.debug("Could not read current URL", e);
            return null;
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private record RouteAttempt(AttemptOutcome outcome, PageElement element) {
    }
}
