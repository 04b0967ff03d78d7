package io.invoicebot.server.automation;

import java.util.List;
import java.util.Set;

public record RoutingRequest(
    PageDriver driver,
    StepLog stepLog,
    List<Route> routes,
    Set<String> exhaustedRoutes,
    RouteListener listener
) {

    public RoutingRequest {
        routes = List.copyOf(routes);
        exhaustedRoutes = exhaustedRoutes == null ? Set.of() : Set.copyOf(exhaustedRoutes);
        listener = listener == null ? (route, exhausted) -> { } : listener;
    }

    @FunctionalInterface
    public interface RouteListener {
        void routeExhausted(Route route, Set<String> exhaustedSoFar);
    }
}
