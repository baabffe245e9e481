package com.fintech.ledger.domain.service;

import com.fintech.ledger.domain.model.Account;
import com.fintech.ledger.domain.model.AccountSnapshot;
import com.fintech.ledger.domain.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Concurrency-safe store of client accounts.
 *
 * Locking:
 * - Every {@link #process} call holds the write lock across lookup-or-create and
 *   the whole {@link Account#process} call, so two transactions of one client never
 *   interleave and a new client's account cannot be created twice
 * - Snapshot reads share the read lock
 *
 * Accounts are created lazily on the first transaction of a client and never removed.
 */
@Slf4j
@Service
public class AccountManager {

    private final Map<Integer, Account> accounts = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Applies a transaction to its owning client's account.
     *
     * @throws com.fintech.ledger.domain.exception.LedgerException if the account rejects it
     */
    public void process(Transaction transaction) {
        int clientId = transaction.getClientId();

        lock.writeLock().lock();
        try {
            Account account = accounts.computeIfAbsent(clientId, id -> {
                log.debug("Opening account for client {}", id);
                return new Account(id);
            });
            account.process(transaction);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies every account's balances, ordered by client id.
     */
    public SortedMap<Integer, AccountSnapshot> snapshot() {
        lock.readLock().lock();
        try {
            SortedMap<Integer, AccountSnapshot> copy = new TreeMap<>();
            accounts.forEach((clientId, account) -> copy.put(clientId, account.snapshot()));
            return Collections.unmodifiableSortedMap(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AccountSnapshot> getAccount(int clientId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(accounts.get(clientId)).map(Account::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int totalAccounts() {
        lock.readLock().lock();
        try {
            return accounts.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
