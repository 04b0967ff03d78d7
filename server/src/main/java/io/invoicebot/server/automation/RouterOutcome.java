package io.invoicebot.server.automation;

import java.util.List;

public sealed interface RouterOutcome {

    List<AutomationStep> steps();

    record Success(String routeName, String selector, boolean viaOracle, List<AutomationStep> steps)
        implements RouterOutcome {
    }

    record RequiresIntervention(String reason, List<String> routesAttempted, List<AutomationStep> steps)
        implements RouterOutcome {
    }

    record Cancelled(List<AutomationStep> steps) implements RouterOutcome {
    }
}
