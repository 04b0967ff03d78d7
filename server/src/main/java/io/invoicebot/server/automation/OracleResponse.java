package io.invoicebot.server.automation;

import java.util.List;

public record OracleResponse(
    String suggestedSelector,
    double confidence,
    String reasoning,
    List<String> alternativeSelectors
) {
}
