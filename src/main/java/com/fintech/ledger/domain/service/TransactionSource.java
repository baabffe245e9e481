package com.fintech.ledger.domain.service;

import com.fintech.ledger.domain.model.Transaction;

import java.util.Optional;

/**
 * Upstream supplier of transactions in arrival order.
 */
public interface TransactionSource extends AutoCloseable {

    /**
     * Reads the next transaction.
     *
     * @return the transaction, or empty when the input is exhausted
     * @throws com.fintech.ledger.domain.exception.LedgerException with DECODE_ERROR for a malformed record
     */
    Optional<Transaction> next();

    /**
     * Describes the input for logging.
     */
    String describe();

    @Override
    void close();
}
