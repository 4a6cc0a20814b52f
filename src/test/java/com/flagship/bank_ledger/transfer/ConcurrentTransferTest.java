package com.flagship.bank_ledger.transfer;

import com.flagship.bank_ledger.account.AccountRepository;
import com.flagship.bank_ledger.account.AccountService;
import com.flagship.bank_ledger.account.AtomicScope;
import com.flagship.bank_ledger.exception.InsufficientFundsException;
import com.flagship.bank_ledger.funding.FundingService;
import com.flagship.bank_ledger.money.Money;
import com.flagship.bank_ledger.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests: try to break the balance invariants with parallel transfers.
 *
 * These tests verify:
 * - Transfers sharing a source account serialize on its row lock
 * - Opposite-direction transfers over the same pair never deadlock
 * - Concurrent debits can never take a balance below zero
 * - Transfers over disjoint account pairs do not wait on each other's locks
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentTransferTest {

    private static final int THREAD_COUNT = 10;

    @Autowired
    private TransferService transferService;

    @Autowired
    private FundingService fundingService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private UserService userService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private AtomicScope atomicScope;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID ownerId;

    @BeforeEach
    void setUp() {
        ownerId = userService.createUser("concurrent-" + UUID.randomUUID()).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private UUID createAccount(String initialBalance) {
        UUID accountId = accountService.createAccount(ownerId).getId();
        if (Money.parse(initialBalance).isPositive()) {
            fundingService.addFunds(accountId, initialBalance);
        }
        return accountId;
    }

    private Money balanceOf(UUID accountId) {
        return accountService.getAccount(accountId).getBalance();
    }

    private int ledgerRecordsFrom(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE from_account = ?", Integer.class, accountId);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("N concurrent transfers from one account to distinct destinations all succeed once")
    void concurrentDebitsFromOneAccount() throws InterruptedException {
        printTestHeader("Concurrent debits from a shared source");

        UUID source = createAccount("1000.00");
        List<UUID> destinations = new ArrayList<>();
        for (int i = 0; i < THREAD_COUNT; i++) {
            destinations.add(createAccount("0"));
        }

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREAD_COUNT);
        AtomicInteger successCount = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);

        for (UUID destination : destinations) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transferService.transfer(source, destination, "25.00");
                    successCount.incrementAndGet();
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Transfers did not finish in time");
        executor.shutdown();

        System.out.println("Successful transfers: " + successCount.get());
        System.out.println("Final source balance: " + balanceOf(source));

        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        assertEquals(THREAD_COUNT, successCount.get());
        assertEquals(Money.parse("750.00"), balanceOf(source));
        for (UUID destination : destinations) {
            assertEquals(Money.parse("25.00"), balanceOf(destination));
        }
        assertEquals(THREAD_COUNT, ledgerRecordsFrom(source));

        printSuccess("balance(X) final == initial - N * a");
    }

    @Test
    @DisplayName("Opposite-direction transfers over the same pair both complete")
    void oppositeDirectionsDoNotDeadlock() throws InterruptedException {
        printTestHeader("X -> Y and Y -> X concurrently");

        UUID x = createAccount("500.00");
        UUID y = createAccount("500.00");
        int rounds = 20;

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2 * rounds);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);

        for (int i = 0; i < rounds; i++) {
            executor.submit(transferTask(x, y, "3.00", startLatch, doneLatch, failures));
            executor.submit(transferTask(y, x, "5.00", startLatch, doneLatch, failures));
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Transfers did not finish: possible deadlock");
        executor.shutdown();

        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        assertEquals(Money.parse("540.00"), balanceOf(x));
        assertEquals(Money.parse("460.00"), balanceOf(y));
        assertEquals(Money.parse("1000.00"), balanceOf(x).plus(balanceOf(y)));

        printSuccess("No deadlock, total preserved");
    }

    @Test
    @DisplayName("Concurrent debits exceeding the balance: only the affordable ones succeed")
    void concurrentOverdraftAttempts() throws InterruptedException {
        printTestHeader("Concurrent overdraft attempts");

        UUID source = createAccount("100.00");
        UUID destination = createAccount("0");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREAD_COUNT);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);

        for (int i = 0; i < THREAD_COUNT; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transferService.transfer(source, destination, "30.00");
                    successCount.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    insufficientCount.incrementAndGet();
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Transfers did not finish in time");
        executor.shutdown();

        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        assertEquals(3, successCount.get());
        assertEquals(THREAD_COUNT - 3, insufficientCount.get());
        assertEquals(Money.parse("10.00"), balanceOf(source));
        assertEquals(Money.parse("90.00"), balanceOf(destination));
        assertEquals(3, ledgerRecordsFrom(source));

        printSuccess("Balance never went below zero");
    }

    @Test
    @DisplayName("A transfer over C and D completes while A and B are held locked")
    void disjointPairsDoNotBlock() throws Exception {
        printTestHeader("Disjoint account pairs");

        UUID a = createAccount("100.00");
        UUID b = createAccount("100.00");
        UUID c = createAccount("100.00");
        UUID d = createAccount("0");

        CountDownLatch locksHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<?> holder = executor.submit(() -> atomicScope.execute("hold", () -> {
                accountRepository.lockInOrder(a, b);
                locksHeld.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertTrue(locksHeld.await(10, TimeUnit.SECONDS), "Lock holder did not start");

            Future<TransactionRecord> disjoint = executor.submit(() -> transferService.transfer(c, d, "40.00"));
            TransactionRecord record = disjoint.get(5, TimeUnit.SECONDS);

            assertEquals(c, record.getFromAccount());
            assertEquals(1, release.getCount(), "A and B must still be locked");

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdown();
        }

        assertEquals(Money.parse("60.00"), balanceOf(c));
        assertEquals(Money.parse("40.00"), balanceOf(d));
        assertEquals(Money.parse("100.00"), balanceOf(a));
        assertEquals(Money.parse("100.00"), balanceOf(b));

        printSuccess("Disjoint transfer finished without waiting for held locks");
    }

    private Runnable transferTask(UUID from, UUID to, String amount,
                                  CountDownLatch startLatch, CountDownLatch doneLatch,
                                  ConcurrentLinkedQueue<Throwable> failures) {
        return () -> {
            try {
                startLatch.await();
                transferService.transfer(from, to, amount);
            } catch (Throwable t) {
                failures.add(t);
            } finally {
                doneLatch.countDown();
            }
        };
    }
}
