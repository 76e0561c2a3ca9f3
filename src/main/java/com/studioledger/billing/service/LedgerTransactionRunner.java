package com.studioledger.billing.service;

import com.studioledger.billing.config.LedgerProperties;
import com.studioledger.billing.exception.LedgerContentionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs one ledger write for an invoice as a single transaction and replays it when the database
 * reports a write conflict (stale version, lock timeout, deadlock victim).
 * <p>
 * The unit of work must do its own reads, since each attempt starts from fresh state. When the
 * caller already holds a transaction the work joins it and runs exactly once: a failed attempt
 * leaves the outer transaction rollback-only, so there is nothing to retry into.
 */
@Slf4j
@Component
public class LedgerTransactionRunner {

    private final TransactionTemplate transactionTemplate;
    private final LedgerProperties properties;

    public LedgerTransactionRunner(PlatformTransactionManager transactionManager, LedgerProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    public <T> T run(Long invoiceId, Supplier<T> unitOfWork) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return unitOfWork.get();
        }

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        ConcurrencyFailureException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> unitOfWork.get());
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
                log.debug("Write conflict on invoice {} (attempt {}/{}): {}", invoiceId, attempt, maxAttempts,
                        e.getMessage());
                if (attempt < maxAttempts) {
                    pause(invoiceId, attempt, e);
                }
            }
        }
        log.warn("Giving up on invoice {} after {} attempts", invoiceId, maxAttempts);
        throw new LedgerContentionException(invoiceId, maxAttempts, lastFailure);
    }

    private void pause(Long invoiceId, int attempt, ConcurrencyFailureException cause) {
        long millis = properties.getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerContentionException(invoiceId, attempt, cause);
        }
    }
}
