package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.ReceiptStorageService;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfiguration.class);

    public static final String EXECUTOR_BEAN_NAME = "reconciliationExecutor";

    @Bean(name = EXECUTOR_BEAN_NAME)
    public ThreadPoolTaskExecutor reconciliationExecutor(ReconciliationProperties properties) {
        int poolSize = Math.max(1, properties.getFanOut().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("reconciliation-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Reconciliation executor configured with {} threads", poolSize);
        return executor;
    }

    @Bean
    public ReconciliationAggregate reconciliationAggregate() {
        return new ReconciliationAggregate();
    }

    @Bean
    public ExpenseValidator expenseValidator(CategoryCatalog categoryCatalog) {
        return new ExpenseValidator(categoryCatalog);
    }

    @Bean
    @ConditionalOnProperty(value = "reconciliation.matching.mode", havingValue = "local", matchIfMissing = true)
    public ReceiptMatcher scoringReceiptMatcher(ConfidenceScorer scorer,
        @Qualifier(EXECUTOR_BEAN_NAME) Executor executor, ReconciliationProperties properties) {
        log.info("Bulk matching scores pairs locally with threshold {}", properties.getMatchThreshold());
        return new ScoringReceiptMatcher(scorer, executor, properties.getMatchThreshold());
    }

    @Bean
    public ReconciliationService reconciliationService(ReconciliationAggregate aggregate,
        ReceiptStorageService storageService, ConfidenceScorer scorer, ReceiptMatcher matcher,
        ExpenseValidator validator, @Qualifier(EXECUTOR_BEAN_NAME) Executor executor,
        ReconciliationProperties properties) {
        return new ReconciliationService(aggregate, storageService, scorer, matcher, validator, executor,
            properties);
    }
}
