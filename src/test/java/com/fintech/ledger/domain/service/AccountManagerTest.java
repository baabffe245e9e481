package com.fintech.ledger.domain.service;

import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.AccountSnapshot;
import com.fintech.ledger.domain.model.ClientTransaction;
import com.fintech.ledger.domain.model.MoneyTransaction;
import com.fintech.ledger.domain.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AccountManagerTest {

    private AccountManager accountManager;

    @BeforeEach
    void setUp() {
        accountManager = new AccountManager();
    }

    @Test
    void process_createsAccountsLazilyPerClient() {
        assertEquals(0, accountManager.totalAccounts());

        accountManager.process(deposit(1, 1, "100.00"));
        accountManager.process(deposit(2, 2, "200.00"));

        assertEquals(2, accountManager.totalAccounts());
        assertEquals(0, accountManager.getAccount(1).orElseThrow().getAvailable().compareTo(new BigDecimal("100.00")));
        assertEquals(0, accountManager.getAccount(2).orElseThrow().getAvailable().compareTo(new BigDecimal("200.00")));
        assertTrue(accountManager.getAccount(3).isEmpty());
    }

    @Test
    void process_disputeDoesNotChangeTheSubmittedDeposit() throws Exception {
        Transaction submitted = deposit(1, 1, "100.00");
        accountManager.process(submitted);
        accountManager.process(Transaction.dispute(ClientTransaction.of(1, 1)));

        assertFalse(submitted.getMoneyTransaction().isDisputed());
        assertFalse(Modifier.isPublic(
                MoneyTransaction.class.getDeclaredMethod("markDisputed").getModifiers()));

        AccountSnapshot account = accountManager.getAccount(1).orElseThrow();
        assertEquals(0, account.getHeld().compareTo(new BigDecimal("100.00")));
        assertEquals(0, account.getAvailable().signum());
    }

    @Test
    void process_sameTxIdForDifferentClients_isNotADuplicate() {
        accountManager.process(deposit(1, 7, "1.00"));
        accountManager.process(deposit(2, 7, "2.00"));

        assertEquals(2, accountManager.totalAccounts());
    }

    @Test
    void process_disputeOfAnotherClientsTransaction_isNotFound() {
        accountManager.process(deposit(1, 1, "10.00"));

        LedgerException e = assertThrows(LedgerException.class,
                () -> accountManager.process(Transaction.dispute(ClientTransaction.of(2, 1))));

        assertEquals(ErrorCode.TRANSACTION_NOT_FOUND, e.getErrorCode());
        // the referencing client still gets an (empty) account
        assertEquals(2, accountManager.totalAccounts());
        assertEquals(0, accountManager.getAccount(1).orElseThrow().getHeld().signum());
    }

    @Test
    void process_rejection_leavesOtherAccountsUntouched() {
        accountManager.process(deposit(1, 1, "10.00"));
        accountManager.process(deposit(2, 2, "5.00"));

        assertThrows(LedgerException.class,
                () -> accountManager.process(Transaction.withdrawal(
                        MoneyTransaction.of(2, 3, new BigDecimal("6.00")))));

        assertEquals(0, accountManager.getAccount(1).orElseThrow().getTotal().compareTo(new BigDecimal("10.00")));
        assertEquals(0, accountManager.getAccount(2).orElseThrow().getTotal().compareTo(new BigDecimal("5.00")));
    }

    @Test
    void snapshot_isOrderedAndDetached() {
        accountManager.process(deposit(3, 1, "3.00"));
        accountManager.process(deposit(1, 1, "1.00"));
        accountManager.process(deposit(2, 1, "2.00"));

        Map<Integer, AccountSnapshot> snapshot = accountManager.snapshot();
        accountManager.process(deposit(1, 2, "100.00"));

        assertEquals(List.of(1, 2, 3), new ArrayList<>(snapshot.keySet()));
        assertEquals(0, snapshot.get(1).getTotal().compareTo(new BigDecimal("1.00")));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(1));
    }

    @Test
    void process_concurrentWriters_neverLoseUpdates() throws Exception {
        int threads = 8;
        int depositsPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int offset = t * depositsPerThread;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < depositsPerThread; i++) {
                    accountManager.process(deposit(1 + (i % 4), offset + i, "1.00"));
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        Map<Integer, AccountSnapshot> snapshot = accountManager.snapshot();
        assertEquals(4, snapshot.size());
        BigDecimal total = snapshot.values().stream()
                .map(AccountSnapshot::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(new BigDecimal(threads * depositsPerThread)));
        for (AccountSnapshot account : snapshot.values()) {
            assertEquals(0, account.getTotal().compareTo(new BigDecimal(threads * depositsPerThread / 4)));
        }
    }

    private static Transaction deposit(int client, long tx, String amount) {
        return Transaction.deposit(MoneyTransaction.of(client, tx, new BigDecimal(amount)));
    }
}
