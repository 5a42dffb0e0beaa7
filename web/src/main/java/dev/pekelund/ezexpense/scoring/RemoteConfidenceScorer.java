package dev.pekelund.ezexpense.scoring;

import dev.pekelund.ezexpense.reconciliation.ConfidenceScorer;
import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import dev.pekelund.ezexpense.reconciliation.ScoringUnavailableException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Asks the scoring service how well one receipt matches one expense.
 */
public class RemoteConfidenceScorer implements ConfidenceScorer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteConfidenceScorer.class);

    private final RestClient restClient;
    private final ScoringProperties properties;

    public RemoteConfidenceScorer(RestClient restClient, ScoringProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public OptionalDouble score(ExpenseSnapshot expense, ReceiptSnapshot receipt) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getScorePath())
            .build()
            .toUri();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("expense", ScoringPayloads.expense(expense));
        payload.put("receipt", ScoringPayloads.receipt(receipt));

        ScoreResponse response;
        try {
            response = restClient
                .post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(ScoreResponse.class);
        } catch (RestClientException ex) {
            throw new ScoringUnavailableException(
                "Scoring receipt '%s' against expense %d failed".formatted(receipt.name(), expense.id()), ex);
        }

        if (response == null || !Boolean.TRUE.equals(response.ok()) || response.score() == null) {
            LOGGER.debug("Scoring service had no score for receipt '{}' and expense {}", receipt.name(), expense.id());
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(response.score());
    }

    public record ScoreResponse(Boolean ok, Double score) {
    }
}
