package io.invoicebot.server.automation;

import java.util.List;

public record Route(String name, int priority, List<String> candidateSelectors, boolean dynamic, RouteAction action) {

    public Route {
        candidateSelectors = List.copyOf(candidateSelectors);
    }
}
