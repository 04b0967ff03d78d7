package io.invoicebot.server.recovery;

public record RuleResult(String ruleId, boolean passed, String message) {
}
