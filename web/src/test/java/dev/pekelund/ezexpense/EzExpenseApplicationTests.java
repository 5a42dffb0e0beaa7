package dev.pekelund.ezexpense;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.ezexpense.reconciliation.ConfidenceScorer;
import dev.pekelund.ezexpense.reconciliation.ReceiptMatcher;
import dev.pekelund.ezexpense.reconciliation.ScoringReceiptMatcher;
import dev.pekelund.ezexpense.scoring.DisabledConfidenceScorer;
import dev.pekelund.ezexpense.storage.LocalReceiptStorageService;
import dev.pekelund.ezexpense.storage.ReceiptStorageService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "gcs.enabled=false",
    "scoring.base-url=",
    "categories.base-url="
})
class EzExpenseApplicationTests {

    @Autowired
    private ReceiptStorageService receiptStorageService;

    @Autowired
    private ConfidenceScorer confidenceScorer;

    @Autowired
    private ReceiptMatcher receiptMatcher;

    @Test
    void contextLoadsWithLocalDefaults() {
        assertThat(receiptStorageService).isInstanceOf(LocalReceiptStorageService.class);
        assertThat(confidenceScorer).isInstanceOf(DisabledConfidenceScorer.class);
        assertThat(receiptMatcher).isInstanceOf(ScoringReceiptMatcher.class);
    }
}
