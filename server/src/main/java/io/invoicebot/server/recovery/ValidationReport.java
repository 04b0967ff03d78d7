package io.invoicebot.server.recovery;

import java.util.List;

public record ValidationReport(boolean overallValid, List<RuleResult> ruleResults, List<String> errors, List<String> warnings) {

    public static ValidationReport notRun() {
        return new ValidationReport(false, List.of(), List.of(), List.of());
    }
}
