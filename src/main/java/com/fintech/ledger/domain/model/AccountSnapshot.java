package com.fintech.ledger.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable copy of an account's balances, taken under the store's read lock.
 */
@Value
@Builder
public class AccountSnapshot {
    int client;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
