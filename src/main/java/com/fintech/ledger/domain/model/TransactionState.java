package com.fintech.ledger.domain.model;

/**
 * Dispute state of a deposit or withdrawal.
 */
public enum TransactionState {
    /**
     * Initial state. Can be disputed.
     */
    NORMAL,

    /**
     * Funds are held. Can be resolved back to NORMAL or charged back.
     */
    DISPUTED,

    /**
     * Reversed. Terminal state.
     */
    CHARGEDBACK
}
