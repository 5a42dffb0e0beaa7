package dev.pekelund.ezexpense.scoring;

import dev.pekelund.ezexpense.reconciliation.Confidence;
import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.MatchAssignment;
import dev.pekelund.ezexpense.reconciliation.MatchPlan;
import dev.pekelund.ezexpense.reconciliation.MatchingServiceException;
import dev.pekelund.ezexpense.reconciliation.ReceiptMatcher;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Delegates a bulk matching round to the matching service. Its answer is taken as is: every
 * attachment it reports becomes an assignment, and receipts it does not mention stay where they are.
 */
public class BulkMatchingClient implements ReceiptMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkMatchingClient.class);

    private final RestClient restClient;
    private final ScoringProperties properties;

    public BulkMatchingClient(RestClient restClient, ScoringProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public MatchPlan match(List<ReceiptSnapshot> pool, List<ExpenseSnapshot> expenses) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getBulkMatchPath())
            .build()
            .toUri();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pool", pool.stream().map(ScoringPayloads::receipt).toList());
        payload.put("expenses", expenses.stream().map(ScoringPayloads::expense).toList());

        BulkMatchResponse response;
        try {
            response = restClient
                .post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(BulkMatchResponse.class);
        } catch (RestClientException ex) {
            throw new MatchingServiceException("Bulk matching request failed", ex);
        }
        if (response == null) {
            throw new MatchingServiceException("Bulk matching service returned an empty response");
        }

        Set<String> assigned = new HashSet<>();
        List<MatchAssignment> assignments = new ArrayList<>();
        for (MatchedExpense expense : nullToEmpty(response.matchedExpenses())) {
            if (expense.id() == null) {
                LOGGER.warn("Ignoring matched expense without id");
                continue;
            }
            for (MatchedReceipt receipt : nullToEmpty(expense.attachments())) {
                if (!StringUtils.hasText(receipt.name()) || !assigned.add(receipt.name())) {
                    continue;
                }
                Integer confidence = receipt.confidence() != null ? Confidence.fromScore(receipt.confidence()) : null;
                assignments.add(new MatchAssignment(receipt.name(), expense.id(), confidence));
            }
        }
        List<String> unmatched = nullToEmpty(response.unmatchedReceipts()).stream()
            .map(MatchedReceipt::name)
            .filter(StringUtils::hasText)
            .toList();

        LOGGER.info("Matching service assigned {} receipts, {} unmatched", assignments.size(), unmatched.size());
        return new MatchPlan(assignments, unmatched);
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    public record BulkMatchResponse(List<MatchedExpense> matchedExpenses, List<MatchedReceipt> unmatchedReceipts) {
    }

    public record MatchedExpense(Long id, List<MatchedReceipt> attachments) {
    }

    public record MatchedReceipt(String name, Double confidence) {
    }
}
