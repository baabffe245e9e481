package com.fintech.ledger.infrastructure.csv;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.ClientTransaction;
import com.fintech.ledger.domain.model.MoneyTransaction;
import com.fintech.ledger.domain.model.Transaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw input row: {@code type, client, tx, amount}.
 *
 * Fields are bound as text and converted in {@link #toTransaction()} so every
 * malformed value surfaces as a DECODE_ERROR.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CsvTransactionRecord {

    private String type;
    private String client;
    private String tx;
    private String amount;

    /**
     * A blank input line: no field carries any text.
     */
    @JsonIgnore
    public boolean isBlank() {
        return trimToEmpty(type).isEmpty() && trimToEmpty(client).isEmpty()
                && trimToEmpty(tx).isEmpty() && trimToEmpty(amount).isEmpty();
    }

    public Transaction toTransaction() {
        String label = trimToEmpty(type);
        int clientId = parseClient();
        long txId = parseTx();

        try {
            switch (label) {
                case "deposit":
                    return Transaction.deposit(
                            MoneyTransaction.of(clientId, txId, requireAmount("Deposit requires an amount")));
                case "withdrawal":
                    return Transaction.withdrawal(
                            MoneyTransaction.of(clientId, txId, requireAmount("Withdrawal requires an amount")));
                case "dispute":
                    return Transaction.dispute(ClientTransaction.of(clientId, txId));
                case "resolve":
                    return Transaction.resolve(ClientTransaction.of(clientId, txId));
                case "chargeback":
                    return Transaction.chargeback(ClientTransaction.of(clientId, txId));
                default:
                    throw decodeError("Unknown transaction type: " + label);
            }
        } catch (LedgerException e) {
            if (e.getErrorCode() == ErrorCode.DECODE_ERROR) {
                throw e;
            }
            throw new LedgerException(ErrorCode.DECODE_ERROR, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw decodeError(e.getMessage());
        }
    }

    private int parseClient() {
        String value = trimToEmpty(client);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0 || parsed > ClientTransaction.MAX_CLIENT_ID) {
                throw decodeError("Client id out of range: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw decodeError("Invalid client id: '" + value + "'");
        }
    }

    private long parseTx() {
        String value = trimToEmpty(tx);
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0 || parsed > ClientTransaction.MAX_TX_ID) {
                throw decodeError("Transaction id out of range: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw decodeError("Invalid transaction id: '" + value + "'");
        }
    }

    private BigDecimal requireAmount(String missingMessage) {
        String value = trimToEmpty(amount);
        if (value.isEmpty()) {
            throw decodeError(missingMessage);
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw decodeError("Invalid amount: '" + value + "'");
        }
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static LedgerException decodeError(String message) {
        return new LedgerException(ErrorCode.DECODE_ERROR, message);
    }
}
