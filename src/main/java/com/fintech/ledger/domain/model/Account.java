package com.fintech.ledger.domain.model;

import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Client account with its ledger and balances.
 *
 * Invariant: {@code total == available + held} after every {@link #process} call.
 *
 * Processing Rules:
 * - A locked account rejects everything except chargebacks
 * - Deposits and withdrawals must carry a transaction id unseen by this account
 * - Withdrawals require sufficient available funds
 * - Dispute/resolve/chargeback move the original amount of the referenced transaction
 * - A chargeback locks the account; later chargebacks of other disputed
 *   transactions still apply
 *
 * No internal locking. Callers serialize access (see AccountManager).
 */
@Getter
public class Account {

    private final int client;

    @Getter(AccessLevel.PACKAGE)
    private final Ledger ledger = new Ledger();

    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private BigDecimal total = BigDecimal.ZERO;
    private boolean locked;

    public Account(int client) {
        this.client = client;
    }

    /**
     * Applies one transaction. On failure no balance or ledger state has changed.
     *
     * @throws LedgerException describing why the transaction was rejected
     */
    public void process(Transaction transaction) {
        if (locked && transaction.getType() != Transaction.Type.CHARGEBACK) {
            throw new LedgerException(ErrorCode.ACCOUNT_LOCKED);
        }

        switch (transaction.getType()) {
            case DEPOSIT -> applyDeposit(transaction);
            case WITHDRAWAL -> applyWithdrawal(transaction);
            case DISPUTE -> applyDispute(transaction.getTransactionId());
            case RESOLVE -> applyResolve(transaction.getTransactionId());
            case CHARGEBACK -> applyChargeback(transaction.getTransactionId());
        }
    }

    public AccountSnapshot snapshot() {
        return AccountSnapshot.builder()
                .client(client)
                .available(available)
                .held(held)
                .total(total)
                .locked(locked)
                .build();
    }

    private void applyDeposit(Transaction transaction) {
        requireUnseen(transaction.getTransactionId());

        deposit(transaction.getMoneyTransaction().getAmount());
        ledger.add(transaction.getTransactionId(), transaction.copy());
    }

    private void applyWithdrawal(Transaction transaction) {
        requireUnseen(transaction.getTransactionId());

        withdraw(transaction.getMoneyTransaction().getAmount());
        ledger.add(transaction.getTransactionId(), transaction.copy());
    }

    private void applyDispute(long txId) {
        if (ledger.isDisputed(txId)) {
            throw new LedgerException(ErrorCode.ALREADY_DISPUTED);
        }
        if (ledger.isChargedback(txId)) {
            throw new LedgerException(ErrorCode.ALREADY_CHARGEDBACK);
        }

        MoneyTransaction disputed = findMoneyTransaction(txId);
        disputed.markDisputed();
        hold(disputed.getAmount());
    }

    private void applyResolve(long txId) {
        if (!ledger.isDisputed(txId)) {
            throw new LedgerException(ErrorCode.NOT_DISPUTED);
        }

        MoneyTransaction disputed = findMoneyTransaction(txId);
        disputed.resolveDispute();
        release(disputed.getAmount());
    }

    private void applyChargeback(long txId) {
        if (!ledger.isDisputed(txId)) {
            throw new LedgerException(ErrorCode.NOT_DISPUTED);
        }

        MoneyTransaction disputed = findMoneyTransaction(txId);
        disputed.markChargedback();
        reverse(disputed.getAmount());
    }

    private void requireUnseen(long txId) {
        if (ledger.contains(txId)) {
            throw new LedgerException(ErrorCode.DUPLICATE_TRANSACTION_ID,
                    String.format("Transaction ID %d already exists", txId));
        }
    }

    private MoneyTransaction findMoneyTransaction(long txId) {
        return ledger.getMoneyTransaction(txId)
                .orElseThrow(() -> new LedgerException(ErrorCode.TRANSACTION_NOT_FOUND,
                        String.format("Transaction %d not found for client %d", txId, client)));
    }

    // Balance movements. The locked guards are unreachable through process(),
    // whose pre-check already rejects these kinds on a locked account.

    private void deposit(BigDecimal amount) {
        if (!locked) {
            available = available.add(amount);
            total = total.add(amount);
        }
    }

    private void withdraw(BigDecimal amount) {
        if (locked) {
            throw new LedgerException(ErrorCode.ACCOUNT_LOCKED);
        }
        if (available.compareTo(amount) < 0) {
            throw new LedgerException(ErrorCode.INSUFFICIENT_FUNDS,
                    String.format("Insufficient funds: available=%s, requested=%s", available, amount));
        }
        available = available.subtract(amount);
        total = total.subtract(amount);
    }

    private void hold(BigDecimal amount) {
        if (!locked) {
            available = available.subtract(amount);
            held = held.add(amount);
        }
    }

    private void release(BigDecimal amount) {
        if (!locked) {
            held = held.subtract(amount);
            available = available.add(amount);
        }
    }

    // Applies on a locked account too: each disputed transaction gets its own chargeback.
    private void reverse(BigDecimal amount) {
        held = held.subtract(amount);
        total = total.subtract(amount);
        locked = true;
    }
}
