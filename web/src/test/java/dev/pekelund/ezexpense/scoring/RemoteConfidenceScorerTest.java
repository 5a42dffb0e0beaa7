package dev.pekelund.ezexpense.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.InvoiceDetails;
import dev.pekelund.ezexpense.reconciliation.ReceiptKind;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import dev.pekelund.ezexpense.reconciliation.ScoringUnavailableException;
import dev.pekelund.ezexpense.storage.StoredReceiptReference;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class RemoteConfidenceScorerTest {

    private MockRestServiceServer server;
    private RemoteConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        ScoringProperties properties = new ScoringProperties();
        properties.setBaseUrl("http://localhost");

        RestClient.Builder restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        scorer = new RemoteConfidenceScorer(restClientBuilder.build(), properties);
    }

    @Test
    void postsExpenseAndReceiptAndReturnsScore() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/api/expenses/match-receipt"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.content().json("{" +
                "\"expense\":{\"id\":3,\"fields\":{\"Merchant\":\"Cafe\"},\"attachments\":[]}," +
                "\"receipt\":{\"name\":\"a.pdf\",\"storageRef\":\"gs://bucket/receipts/a.pdf\",\"kind\":\"document\"," +
                "\"extractedDetails\":{\"amount\":12.5,\"currency\":\"SEK\",\"merchant\":\"Cafe\",\"refund\":false}}}"))
            .andRespond(MockRestResponseCreators.withSuccess("{\"ok\":true,\"score\":0.82}", MediaType.APPLICATION_JSON));

        OptionalDouble score = scorer.score(expense(), receipt());

        server.verify();
        assertThat(score).hasValue(0.82);
    }

    @Test
    void missingScoreIsUnknown() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/expenses/match-receipt"))
            .andRespond(MockRestResponseCreators.withSuccess("{\"ok\":false}", MediaType.APPLICATION_JSON));

        assertThat(scorer.score(expense(), receipt())).isEmpty();
    }

    @Test
    void serverErrorMeansScoringUnavailable() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/expenses/match-receipt"))
            .andRespond(MockRestResponseCreators.withServerError());

        assertThatThrownBy(() -> scorer.score(expense(), receipt()))
            .isInstanceOf(ScoringUnavailableException.class)
            .hasMessageContaining("a.pdf");
    }

    private static ExpenseSnapshot expense() {
        return new ExpenseSnapshot(3, Map.of("Merchant", "Cafe"), List.of());
    }

    private static ReceiptSnapshot receipt() {
        InvoiceDetails details = new InvoiceDetails(new BigDecimal("12.5"), "SEK", null, null, "Cafe", null, false);
        return new ReceiptSnapshot("a.pdf", ReceiptKind.DOCUMENT, "application/pdf", 10,
            new StoredReceiptReference("bucket", "receipts/a.pdf"), details, null);
    }
}
