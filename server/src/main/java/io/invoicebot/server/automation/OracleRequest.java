package io.invoicebot.server.automation;

import java.util.List;
import java.util.Map;

public record OracleRequest(String domSummary, Map<String, Object> context, List<CandidateElement> candidateElements) {
}
