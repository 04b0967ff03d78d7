package io.invoicebot.server.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.invoicebot.server.automation.FallbackRouter;
import io.invoicebot.server.automation.PageDriver;
import io.invoicebot.server.automation.PageDriverFactory;
import io.invoicebot.server.automation.Route;
import io.invoicebot.server.automation.RouterOutcome;
import io.invoicebot.server.automation.RoutingRequest;
import io.invoicebot.server.automation.StepLog;
import io.invoicebot.server.automation.StepLogFactory;
import io.invoicebot.server.checkpoint.Checkpoint;
import io.invoicebot.server.config.InvoiceBotProperties;
import io.invoicebot.server.persistence.PersistenceCoordinator;
import io.invoicebot.server.persistence.SessionProgress;
import io.invoicebot.server.recovery.RecoveredState;
import io.invoicebot.server.recovery.RecoveryResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Finds and follows the invoicing entry point of a merchant portal. Progress is the number of routes exhausted,
 * so a reclaimed run skips the routes an earlier attempt already ruled out.
 */
@Component
public class InvoicePortalJobProcessor implements JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(InvoicePortalJobProcessor.class);

    public static final String OPERATION_TYPE = "invoice_portal";
    static final String EXHAUSTED_ROUTES = "exhausted_routes";

    private final ObjectProvider<PageDriverFactory> driverFactories;
    private final FallbackRouter router;
    private final StepLogFactory stepLogFactory;
    private final PersistenceCoordinator persistenceCoordinator;
    private final InvoiceBotProperties properties;
    private final ObjectMapper objectMapper;

    public InvoicePortalJobProcessor(
        ObjectProvider<PageDriverFactory> driverFactories,
        FallbackRouter router,
        StepLogFactory stepLogFactory,
        PersistenceCoordinator persistenceCoordinator,
        InvoiceBotProperties properties,
        ObjectMapper objectMapper
    ) {
        this.driverFactories = driverFactories;
        this.router = router;
        this.stepLogFactory = stepLogFactory;
        this.persistenceCoordinator = persistenceCoordinator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String operationType() {
        return OPERATION_TYPE;
    }

    @Override
    public JsonNode process(JobContext context) {
        Object url = context.config().get("url");
        if (!(url instanceof String target) || target.isBlank()) {
            throw new IllegalArgumentException("invoice_portal jobs require a 'url' in their config");
        }
        PageDriverFactory factory = driverFactories.getIfAvailable();
        if (factory == null) {
            throw new IllegalStateException("No PageDriverFactory bean is configured");
        }

        List<Route> routes = PortalRoutes.defaults();
        Set<String> alreadyExhausted = exhaustedRoutes(context.recovery().orElse(null));
        Progress progress = new Progress(context, target, routes.size(), alreadyExhausted);
        if (!progress.exhausted().isEmpty()) {
            log.info("Session {} resumes with routes {} already exhausted", context.sessionId(), progress.exhausted());
        }

        try (PageDriver driver = factory.open(target)) {
            StepLog stepLog = stepLogFactory.open(context.sessionId(), context.jobId(), driver, step -> {
                if (!context.heartbeat()) {
                    log.warn("Heartbeat for job {} rejected; claim may have been taken over", context.jobId());
                }
            });
            persistenceCoordinator.startSessionPersistence(context.sessionId(), OPERATION_TYPE, progress::snapshot,
                Duration.ofSeconds(properties.getCheckpoint().getAutoIntervalSeconds()));
            try {
                RouterOutcome outcome = router.route(new RoutingRequest(driver, stepLog, routes, progress.exhausted(),
                    (route, exhaustedSoFar) -> checkpoint(progress.exhaust(exhaustedSoFar))));
                return toResult(outcome, driver, progress);
            } finally {
                persistenceCoordinator.stopSessionPersistence(context.sessionId());
            }
        }
    }

    private JsonNode toResult(RouterOutcome outcome, PageDriver driver, Progress progress) {
        if (outcome instanceof RouterOutcome.Success success) {
            checkpoint(progress.finish(success.routeName()));
            ObjectNode result = objectMapper.createObjectNode();
            result.put("route", success.routeName());
            result.put("selector", success.selector());
            result.put("via_oracle", success.viaOracle());
            result.put("final_url", driver.currentUrl());
            result.put("steps", success.steps().size());
            return result;
        }
        if (outcome instanceof RouterOutcome.RequiresIntervention intervention) {
            throw new InterventionRequiredException(intervention.reason(), intervention.routesAttempted());
        }
        throw new CancellationException("Routing interrupted for session " + progress.sessionId());
    }

    private void checkpoint(Progress progress) {
        SessionProgress state = progress.snapshot();
        try {
            persistenceCoordinator.createCheckpoint(Checkpoint.draft(progress.sessionId(), OPERATION_TYPE,
                state.currentStep(), state.totalSteps(), state.stateData(), state.executionContext(),
                state.variables(), state.performanceMetrics(), state.errorLog()));
        } catch (RuntimeException e) {
            log.warn("Checkpoint at step {} failed for session {}", state.currentStep(), progress.sessionId(), e);
        }
    }

    static Set<String> exhaustedRoutes(RecoveryResult recovery) {
        if (recovery == null || !recovery.success()) {
            return Set.of();
        }
        RecoveredState state = recovery.recoveredState();
        Object value = state.stateData() == null ? null : state.stateData().get(EXHAUSTED_ROUTES);
        Set<String> names = new LinkedHashSet<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String name) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static final class Progress {

        private final String sessionId;
        private final String targetUrl;
        private final int totalSteps;
        private final Map<String, Object> executionContext;
        private final Set<String> exhausted;
        private final long startedNanos = System.nanoTime();
        private String completedRoute;

        Progress(JobContext context, String targetUrl, int totalSteps, Set<String> alreadyExhausted) {
            this.sessionId = context.sessionId();
            this.targetUrl = targetUrl;
            this.totalSteps = totalSteps;
            this.exhausted = new LinkedHashSet<>(alreadyExhausted);
            Map<String, Object> execution = new LinkedHashMap<>();
            execution.put("job_id", context.jobId());
            execution.put("ticket_id", context.ticketId());
            execution.put("worker_id", context.workerId());
            execution.put("retry_count", context.retryCount());
            this.executionContext = execution;
        }

        String sessionId() {
            return sessionId;
        }

        synchronized Set<String> exhausted() {
            return Set.copyOf(exhausted);
        }

        synchronized Progress exhaust(Set<String> exhaustedSoFar) {
            exhausted.addAll(exhaustedSoFar);
            return this;
        }

        synchronized Progress finish(String routeName) {
            completedRoute = routeName;
            return this;
        }

        synchronized SessionProgress snapshot() {
            int step = completedRoute != null ? totalSteps : Math.min(exhausted.size(), totalSteps);
            Map<String, Object> stateData = new LinkedHashMap<>();
            stateData.put("target_url", targetUrl);
            stateData.put(EXHAUSTED_ROUTES, new ArrayList<>(exhausted));
            if (completedRoute != null) {
                stateData.put("completed_route", completedRoute);
            }
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("elapsed_ms", Duration.ofNanos(System.nanoTime() - startedNanos).toMillis());
            return new SessionProgress(step, totalSteps, stateData, executionContext, Map.of(), metrics, List.of());
        }
    }
}
