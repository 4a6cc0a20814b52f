package com.flagship.bank_ledger.account;

import com.flagship.bank_ledger.exception.AccountNotFoundException;
import com.flagship.bank_ledger.exception.UserNotFoundException;
import com.flagship.bank_ledger.money.Money;
import com.flagship.bank_ledger.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Opens accounts and serves read-only account lookups.
 * Balance changes live in the transfer and funding services.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Opens a new account with a zero balance.
     *
     * @param userId owner of the account
     * @return the stored account
     * @throws UserNotFoundException if the owner does not exist
     */
    @Transactional
    public Account createAccount(UUID userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        Account account = new Account(UUID.randomUUID(), userId, Money.ZERO, now);
        accountRepository.insert(account);
        log.info("Opened account: accountId={}, userId={}", account.getId(), userId);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Lists the accounts of a user, oldest first. Empty when the user has none.
     */
    @Transactional(readOnly = true)
    public List<Account> getAccountsForUser(UUID userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        return accountRepository.findByUserId(userId);
    }
}
