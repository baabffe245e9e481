package com.fintech.ledger.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One record of the input stream.
 *
 * Deposits and withdrawals carry a {@link MoneyTransaction}; disputes, resolves and
 * chargebacks only reference an existing transaction by its {@link ClientTransaction} id.
 * Callers switch on {@link #getType()} wherever behaviour differs.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Transaction {

    private final Type type;
    private final ClientTransaction id;
    private final MoneyTransaction moneyTransaction;

    public enum Type {
        DEPOSIT,
        WITHDRAWAL,
        DISPUTE,
        RESOLVE,
        CHARGEBACK
    }

    public static Transaction deposit(MoneyTransaction moneyTransaction) {
        return new Transaction(Type.DEPOSIT, moneyTransaction.getId(), moneyTransaction);
    }

    public static Transaction withdrawal(MoneyTransaction moneyTransaction) {
        return new Transaction(Type.WITHDRAWAL, moneyTransaction.getId(), moneyTransaction);
    }

    public static Transaction dispute(ClientTransaction id) {
        return new Transaction(Type.DISPUTE, id, null);
    }

    public static Transaction resolve(ClientTransaction id) {
        return new Transaction(Type.RESOLVE, id, null);
    }

    public static Transaction chargeback(ClientTransaction id) {
        return new Transaction(Type.CHARGEBACK, id, null);
    }

    public int getClientId() {
        return id.getClient();
    }

    public long getTransactionId() {
        return id.getTx();
    }

    /**
     * Copy with its own money transaction, so the submitter's instance and the stored
     * ledger entry never share dispute state.
     */
    Transaction copy() {
        return new Transaction(type, id, moneyTransaction == null ? null : moneyTransaction.copy());
    }

    public boolean isMoneyTransaction() {
        return type == Type.DEPOSIT || type == Type.WITHDRAWAL;
    }
}
