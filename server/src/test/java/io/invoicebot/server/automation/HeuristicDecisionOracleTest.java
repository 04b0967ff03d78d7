package io.invoicebot.server.automation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HeuristicDecisionOracleTest {

    private final HeuristicDecisionOracle oracle = new HeuristicDecisionOracle();

    @Test
    @DisplayName("keyword weights add up and are capped at one")
    void relevanceShouldFollowKeywordWeights() {
        assertThat(HeuristicDecisionOracle.relevance("Factura", null)).isCloseTo(0.4, within(1e-9));
        assertThat(HeuristicDecisionOracle.relevance("Ver más", "/factura")).isCloseTo(0.3, within(1e-9));
        assertThat(HeuristicDecisionOracle.relevance("Solicitar", "/")).isCloseTo(0.2, within(1e-9));
        assertThat(HeuristicDecisionOracle.relevance("Click here", null)).isCloseTo(0.3, within(1e-9));
        assertThat(HeuristicDecisionOracle.relevance("Generar factura CFDI", "/factura/cfdi")).isEqualTo(1.0);
        assertThat(HeuristicDecisionOracle.relevance("Contacto", "/contacto")).isZero();
    }

    @Test
    @DisplayName("the best scoring candidate is suggested with the others as alternatives")
    void suggestShouldPickBestCandidate() {
        OracleRequest request = new OracleRequest("url=https://portal.example", Map.of(), List.of(
            new CandidateElement("a.promo", "Promociones", "/promo", true),
            new CandidateElement("a.billing", "Solicitar factura", "/factura", true),
            new CandidateElement("a.help", "Ayuda con tu factura", "/help", false)));

        OracleResponse response = oracle.suggest(request);

        assertThat(response.suggestedSelector()).isEqualTo("a.billing");
        assertThat(response.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(response.alternativeSelectors()).containsExactly("a.help");
    }

    @Test
    @DisplayName("no relevant candidate yields a low confidence empty suggestion")
    void suggestShouldReturnLowConfidenceWithoutMatch() {
        OracleResponse response = oracle.suggest(new OracleRequest("", Map.of(),
            List.of(new CandidateElement("a.promo", "Promociones", "/promo", true))));

        assertThat(response.suggestedSelector()).isNull();
        assertThat(response.confidence()).isLessThan(0.6);
    }
}
