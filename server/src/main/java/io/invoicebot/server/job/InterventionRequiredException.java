package io.invoicebot.server.job;

import java.util.List;

public class InterventionRequiredException extends RuntimeException {

    private final List<String> routesAttempted;

    public InterventionRequiredException(String message, List<String> routesAttempted) {
        super(message);
        this.routesAttempted = List.copyOf(routesAttempted);
    }

    public List<String> getRoutesAttempted() {
        return routesAttempted;
    }
}
