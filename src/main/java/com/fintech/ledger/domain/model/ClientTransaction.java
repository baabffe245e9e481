package com.fintech.ledger.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity of a transaction: the owning client and its transaction id.
 *
 * Client ids are unsigned 16-bit and transaction ids unsigned 32-bit values,
 * widened to {@code int} and {@code long}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClientTransaction {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    int client;
    long tx;

    public static ClientTransaction of(int client, long tx) {
        if (client < 0 || client > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + client);
        }
        if (tx < 0 || tx > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + tx);
        }
        return new ClientTransaction(client, tx);
    }
}
