package com.fintech.ledger.domain.model;

import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A deposit or withdrawal together with its dispute state.
 *
 * The amount is validated once at construction. State transitions:
 * <pre>
 * NORMAL -> DISPUTED -> NORMAL | CHARGEDBACK
 * </pre>
 * CHARGEDBACK is terminal. Transitions never touch balances; the owning
 * {@link Account} applies the balance effect with the original amount.
 */
@Getter
@ToString
public class MoneyTransaction {

    private final ClientTransaction id;
    private final BigDecimal amount;
    private final Instant timestamp;
    private TransactionState state;

    private MoneyTransaction(ClientTransaction id, BigDecimal amount, Instant timestamp, TransactionState state) {
        this.id = id;
        this.amount = amount;
        this.timestamp = timestamp;
        this.state = state;
    }

    /**
     * Creates a new money transaction in NORMAL state.
     *
     * @throws LedgerException with {@link ErrorCode#INVALID_AMOUNT} if the amount is missing, zero or negative
     * @throws IllegalArgumentException if the client or transaction id is out of range
     */
    public static MoneyTransaction of(int client, long tx, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT,
                    "Transaction amount must be positive, got: " + amount);
        }
        return new MoneyTransaction(ClientTransaction.of(client, tx), amount, Instant.now(), TransactionState.NORMAL);
    }

    public boolean isDisputed() {
        return state == TransactionState.DISPUTED;
    }

    public boolean isChargedback() {
        return state == TransactionState.CHARGEDBACK;
    }

    MoneyTransaction copy() {
        return new MoneyTransaction(id, amount, timestamp, state);
    }

    // Transitions are only driven by Account, together with the balance movement.

    void markDisputed() {
        if (state == TransactionState.DISPUTED) {
            throw new LedgerException(ErrorCode.ALREADY_DISPUTED);
        }
        if (state == TransactionState.CHARGEDBACK) {
            throw new LedgerException(ErrorCode.ALREADY_CHARGEDBACK);
        }
        state = TransactionState.DISPUTED;
    }

    void resolveDispute() {
        if (state != TransactionState.DISPUTED) {
            throw new LedgerException(ErrorCode.NOT_DISPUTED);
        }
        state = TransactionState.NORMAL;
    }

    void markChargedback() {
        if (state != TransactionState.DISPUTED) {
            throw new LedgerException(ErrorCode.NOT_DISPUTED);
        }
        state = TransactionState.CHARGEDBACK;
    }
}
