package io.invoicebot.server.automation;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public class HeuristicDecisionOracle implements DecisionOracle {

    private static final List<String> PRIMARY_KEYWORDS = List.of("factura", "cfdi", "billing", "invoice");
    private static final List<String> SECONDARY_KEYWORDS = List.of("solicitar", "generar", "descargar", "obtener", "emitir");
    private static final int MAX_ALTERNATIVES = 3;

    @Override
    public OracleResponse suggest(OracleRequest request) {
        List<Scored> ranked = request.candidateElements().stream()
            .filter(c -> c.selector() != null)
            .map(c -> new Scored(c, relevance(c.text(), c.href())))
            .filter(s -> s.score() > 0)
            .sorted(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(s -> !s.candidate().visible()))
            .toList();
        if (ranked.isEmpty()) {
            return new OracleResponse(null, 0.2, "No invoicing related element among candidates", List.of());
        }
        Scored best = ranked.get(0);
        List<String> alternatives = ranked.stream()
            .skip(1)
            .map(s -> s.candidate().selector())
            .filter(selector -> !selector.equals(best.candidate().selector()))
            .distinct()
            .limit(MAX_ALTERNATIVES)
            .toList();
        return new OracleResponse(
            best.candidate().selector(),
            best.score(),
            "Best keyword match '" + best.candidate().text() + "' (" + best.candidate().href() + ")",
            alternatives);
    }

    static double relevance(String text, String href) {
        String textLower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        String hrefLower = href == null ? "" : href.toLowerCase(Locale.ROOT);
        double score = 0.0;
        for (String keyword : PRIMARY_KEYWORDS) {
            if (textLower.contains(keyword)) {
                score += 0.4;
            }
            if (hrefLower.contains(keyword)) {
                score += 0.3;
            }
        }
        for (String keyword : SECONDARY_KEYWORDS) {
            if (textLower.contains(keyword)) {
                score += 0.2;
            }
        }
        if (textLower.contains("click") && (textLower.contains("aquí") || textLower.contains("here"))) {
            score += 0.3;
        }
        return Math.min(score, 1.0);
    }

    private record Scored(CandidateElement candidate, double score) {
    }
}
