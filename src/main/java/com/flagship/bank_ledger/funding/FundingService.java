package com.flagship.bank_ledger.funding;

import com.flagship.bank_ledger.account.Account;
import com.flagship.bank_ledger.account.AccountRepository;
import com.flagship.bank_ledger.account.AtomicScope;
import com.flagship.bank_ledger.exception.AccountNotFoundException;
import com.flagship.bank_ledger.exception.InvalidAmountException;
import com.flagship.bank_ledger.exception.LedgerException;
import com.flagship.bank_ledger.money.Money;
import com.flagship.bank_ledger.observability.CorrelationContext;
import com.flagship.bank_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * Credits a single account with no counterparty.
 *
 * Uses the same locking and atomic scope as transfers. No ledger record is
 * written: the transactions table only holds account-to-account transfers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundingService {

    private final AccountRepository accountRepository;
    private final AtomicScope atomicScope;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Adds {@code amountText} to the balance of an account.
     *
     * @return the account with its new balance
     * @throws InvalidAmountException   if the amount is malformed, not positive, or overflows the balance
     * @throws AccountNotFoundException if the account does not exist
     * @throws com.flagship.bank_ledger.exception.StorageUnavailableException if the store aborted the scope
     */
    public Account addFunds(UUID accountId, String amountText) {
        Objects.requireNonNull(accountId, "accountId");
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());

        try {
            Money amount = Money.parseAmount(amountText);

            Account funded = atomicScope.execute("add funds", () -> applyFunding(accountId, amount));

            ledgerMetrics.recordFunding("success");
            log.info("Funds added: amount={}, newBalance={}, duration={}ms",
                    amount, funded.getBalance(), System.currentTimeMillis() - startTime);
            return funded;

        } catch (LedgerException e) {
            ledgerMetrics.recordFunding(e.getErrorCode().name());
            log.info("Funding failed: code={}, reason={}", e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordFunding("error");
            log.error("Funding failed unexpectedly: accountId={}", accountId, e);
            throw e;
        } finally {
            ledgerMetrics.recordLatency("add_funds", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private Account applyFunding(UUID accountId, Money amount) {
        Account account = accountRepository.lockInOrder(accountId).get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }

        Money newBalance;
        try {
            newBalance = account.getBalance().plus(amount);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount would overflow the balance of account " + accountId);
        }

        accountRepository.updateBalance(accountId, newBalance);
        return account.withBalance(newBalance);
    }
}
