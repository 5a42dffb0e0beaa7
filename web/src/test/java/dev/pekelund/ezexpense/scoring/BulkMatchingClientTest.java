package dev.pekelund.ezexpense.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.MatchAssignment;
import dev.pekelund.ezexpense.reconciliation.MatchPlan;
import dev.pekelund.ezexpense.reconciliation.MatchingServiceException;
import dev.pekelund.ezexpense.reconciliation.ReceiptKind;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import dev.pekelund.ezexpense.storage.StoredReceiptReference;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class BulkMatchingClientTest {

    private MockRestServiceServer server;
    private BulkMatchingClient client;

    @BeforeEach
    void setUp() {
        ScoringProperties properties = new ScoringProperties();
        properties.setBaseUrl("http://localhost");

        RestClient.Builder restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        client = new BulkMatchingClient(restClientBuilder.build(), properties);
    }

    @Test
    void turnsMatchedExpensesIntoAssignments() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/expenses/match-bulk-receipts"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.jsonPath("$.pool[0].name").value("R1"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.expenses[1].id").value(2))
            .andRespond(MockRestResponseCreators.withSuccess("{" +
                "\"matchedExpenses\":[" +
                "{\"id\":1,\"attachments\":[{\"name\":\"R1\",\"confidence\":91}]}," +
                "{\"id\":2,\"attachments\":[{\"name\":\"R1\",\"confidence\":0.4},{\"name\":\"R2\"}]}]," +
                "\"unmatchedReceipts\":[{\"name\":\"R3\"}]}", MediaType.APPLICATION_JSON));

        MatchPlan plan = client.match(List.of(receipt("R1"), receipt("R2"), receipt("R3")),
            List.of(expense(1), expense(2)));

        server.verify();
        assertThat(plan.assignments()).containsExactly(
            new MatchAssignment("R1", 1, 91),
            new MatchAssignment("R2", 2, null));
        assertThat(plan.unmatched()).containsExactly("R3");
    }

    @Test
    void failedRoundTripAbortsTheMatch() {
        server.expect(MockRestRequestMatchers.requestTo("http://localhost/api/expenses/match-bulk-receipts"))
            .andRespond(MockRestResponseCreators.withServerError());

        assertThatThrownBy(() -> client.match(List.of(receipt("R1")), List.of(expense(1))))
            .isInstanceOf(MatchingServiceException.class);
    }

    private static ReceiptSnapshot receipt(String name) {
        return new ReceiptSnapshot(name, ReceiptKind.IMAGE, "image/png", 10,
            new StoredReceiptReference("local", name), null, null);
    }

    private static ExpenseSnapshot expense(long id) {
        return new ExpenseSnapshot(id, Map.of("Amount", "10"), List.of());
    }
}
