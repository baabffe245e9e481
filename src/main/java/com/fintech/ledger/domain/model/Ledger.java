package com.fintech.ledger.domain.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-account record of deposits and withdrawals keyed by transaction id.
 *
 * Disputes, resolves and chargebacks never add entries; they change the state of
 * the stored {@link MoneyTransaction}. Uniqueness of ids is checked by the caller.
 */
public class Ledger {

    private final Map<Long, Transaction> transactions = new HashMap<>();

    public void add(long txId, Transaction transaction) {
        transactions.put(txId, transaction);
    }

    public Optional<Transaction> get(long txId) {
        return Optional.ofNullable(transactions.get(txId));
    }

    /**
     * Returns the stored money transaction, the mutable handle for dispute transitions.
     */
    public Optional<MoneyTransaction> getMoneyTransaction(long txId) {
        return get(txId)
                .filter(Transaction::isMoneyTransaction)
                .map(Transaction::getMoneyTransaction);
    }

    public boolean contains(long txId) {
        return transactions.containsKey(txId);
    }

    public boolean isDisputed(long txId) {
        return getMoneyTransaction(txId)
                .map(MoneyTransaction::isDisputed)
                .orElse(false);
    }

    public boolean isChargedback(long txId) {
        return getMoneyTransaction(txId)
                .map(MoneyTransaction::isChargedback)
                .orElse(false);
    }

    public int size() {
        return transactions.size();
    }
}
