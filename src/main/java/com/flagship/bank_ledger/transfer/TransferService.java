package com.flagship.bank_ledger.transfer;

import com.flagship.bank_ledger.account.Account;
import com.flagship.bank_ledger.account.AccountRepository;
import com.flagship.bank_ledger.account.AtomicScope;
import com.flagship.bank_ledger.exception.AccountNotFoundException;
import com.flagship.bank_ledger.exception.InsufficientFundsException;
import com.flagship.bank_ledger.exception.InvalidAmountException;
import com.flagship.bank_ledger.exception.LedgerException;
import com.flagship.bank_ledger.exception.SameAccountException;
import com.flagship.bank_ledger.money.Money;
import com.flagship.bank_ledger.observability.CorrelationContext;
import com.flagship.bank_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Moves money between two accounts.
 *
 * A transfer is one atomic scope:
 * 1. Both accounts are locked in ascending id order
 * 2. The source balance is checked against the amount
 * 3. Both balances are written and one ledger record is appended
 * 4. Everything commits together, or on any failure nothing does
 *
 * Input checks (same account, amount format) happen before any lock is taken.
 * Failures are reported as {@link LedgerException} subtypes and never retried here.
 */
@Service
@Slf4j
public class TransferService {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final AtomicScope atomicScope;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public TransferService(AccountRepository accountRepository,
                           TransactionRepository transactionRepository,
                           AtomicScope atomicScope,
                           LedgerMetrics ledgerMetrics,
                           Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.atomicScope = atomicScope;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
    }

    /**
     * Transfers {@code amountText} from one account to another.
     *
     * @param fromId     account to debit
     * @param toId       account to credit
     * @param amountText positive decimal with at most two fractional digits
     * @return the ledger record of the committed transfer
     * @throws SameAccountException        if both ids are equal
     * @throws InvalidAmountException      if the amount is malformed or not positive
     * @throws AccountNotFoundException    if either account does not exist
     * @throws InsufficientFundsException  if the source balance is below the amount
     * @throws com.flagship.bank_ledger.exception.StorageUnavailableException if the store aborted the scope
     */
    public TransactionRecord transfer(UUID fromId, UUID toId, String amountText) {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        long startTime = System.currentTimeMillis();

        try {
            if (fromId.equals(toId)) {
                throw new SameAccountException(fromId);
            }
            Money amount = Money.parseAmount(amountText);

            TransactionRecord record = atomicScope.execute("transfer", () -> applyTransfer(fromId, toId, amount));

            MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, record.getId().toString());
            ledgerMetrics.recordTransfer("success");
            log.info("Transfer committed: from={}, to={}, amount={}, duration={}ms",
                    fromId, toId, amount, System.currentTimeMillis() - startTime);
            return record;

        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer(e.getErrorCode().name());
            log.info("Transfer failed: from={}, to={}, code={}, reason={}",
                    fromId, toId, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordTransfer("error");
            log.error("Transfer failed unexpectedly: from={}, to={}", fromId, toId, e);
            throw e;
        } finally {
            ledgerMetrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    /**
     * Every ledger record where the account is source or destination, newest first.
     *
     * @return possibly empty list
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> history(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new AccountNotFoundException(accountId);
        }
        return transactionRepository.findByAccount(accountId);
    }

    // Runs inside the atomic scope.
    private TransactionRecord applyTransfer(UUID fromId, UUID toId, Money amount) {
        Map<UUID, Account> locked = accountRepository.lockInOrder(fromId, toId);

        Account from = locked.get(fromId);
        if (from == null) {
            throw new AccountNotFoundException(fromId);
        }
        Account to = locked.get(toId);
        if (to == null) {
            throw new AccountNotFoundException(toId);
        }

        if (from.getBalance().isLessThan(amount)) {
            throw new InsufficientFundsException(fromId, from.getBalance(), amount);
        }

        Money debited = from.getBalance().minus(amount);
        Money credited;
        try {
            credited = to.getBalance().plus(amount);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount would overflow the balance of account " + toId);
        }

        accountRepository.updateBalance(fromId, debited);
        accountRepository.updateBalance(toId, credited);

        TransactionRecord record = new TransactionRecord(
            UUID.randomUUID(),
            fromId,
            toId,
            amount,
            Instant.now(clock).truncatedTo(ChronoUnit.MICROS)
        );
        transactionRepository.insert(record);
        log.debug("Ledger record appended: transactionId={}", record.getId());
        return record;
    }
}
