package com.flagship.bank_ledger.account;

import com.flagship.bank_ledger.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in one database transaction: all of its writes commit
 * together or none of them do.
 *
 * Exceptions thrown by the work roll the transaction back and propagate
 * unchanged. Failures of the store itself (connection loss, lock timeout,
 * deadlock abort, commit failure) become {@link StorageUnavailableException}.
 * Nothing is retried here.
 */
@Component
@Slf4j
public class AtomicScope {

    private final TransactionTemplate transactionTemplate;

    public AtomicScope(PlatformTransactionManager transactionManager,
                       @Value("${ledger.transaction.timeout-seconds:30}") int timeoutSeconds) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    /**
     * @param operation short name used in logs and error messages
     * @param work      the reads and writes to apply atomically
     * @return the value produced by {@code work}
     * @throws StorageUnavailableException if the store could not complete the scope
     */
    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Atomic scope aborted by storage: operation={}, cause={}", operation, e.getMessage());
            throw new StorageUnavailableException(operation + " could not be completed, no changes were applied", e);
        }
    }
}
